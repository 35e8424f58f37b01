package com.umitunal.corequeue.model;

import com.umitunal.corequeue.core.Job;
import com.umitunal.corequeue.core.JobQueue;
import com.umitunal.corequeue.core.Lane;
import com.umitunal.corequeue.storage.StoreException;

/**
 * Job bound to the queue that issued it.
 *
 * The queue reference is a back-pointer only: the handle does not own the queue
 * and holds no storage state besides the cached result.
 *
 * @param <T> the type of the job payload
 */
public class JobHandle<T> implements Job<T> {
    private final String id;
    private final T payload;
    private final Lane lane;
    private final JobQueue<T> queue;

    private byte[] result;

    public JobHandle(String id, T payload, Lane lane, JobQueue<T> queue) {
        this.id = id;
        this.payload = payload;
        this.lane = lane;
        this.queue = queue;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public T getPayload() {
        return payload;
    }

    @Override
    public Lane getLane() {
        return lane;
    }

    @Override
    public int getAttempts() throws StoreException {
        return queue.getAttempts(id);
    }

    @Override
    public void complete() throws StoreException {
        queue.complete(id);
    }

    @Override
    public void error() throws StoreException {
        queue.error(id);
    }

    @Override
    public void defer() throws StoreException {
        queue.defer(id);
    }

    @Override
    public byte[] getResult() throws StoreException {
        if (result == null) {
            result = queue.getResult(id);
        }
        return result != null ? result.clone() : null;
    }

    @Override
    public void setResult(byte[] result) throws StoreException {
        queue.putResult(id, result);
        this.result = result != null ? result.clone() : null;
    }

    @Override
    public String toString() {
        return String.format("JobHandle{id='%s', lane=%s}", id, lane);
    }
}
