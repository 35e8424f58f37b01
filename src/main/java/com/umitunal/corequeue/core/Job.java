package com.umitunal.corequeue.core;

import com.umitunal.corequeue.serialization.PayloadCodec;
import com.umitunal.corequeue.storage.StoreException;

/**
 * A job handed out by the queue. Terminal calls are forwarded to the queue that
 * issued the job; the handle itself never touches storage.
 *
 * @param <T> the type of the job payload
 */
public interface Job<T> {

    /**
     * Gets the queue-scoped identifier, prefixed with the lane key it was enqueued on.
     */
    String getId();

    /**
     * Gets the job payload data.
     */
    T getPayload();

    /**
     * Gets the lane the job was enqueued on.
     */
    Lane getLane();

    /**
     * Gets the current attempt count, read from the queue on every call.
     */
    int getAttempts() throws StoreException;

    /**
     * Mark the job as successfully completed.
     */
    void complete() throws StoreException;

    /**
     * Mark a processing failure. The job is retried while attempts remain,
     * otherwise it is removed and, if enabled, dead-lettered.
     */
    void error() throws StoreException;

    /**
     * Put the job back on its lane without charging an attempt.
     */
    void defer() throws StoreException;

    /**
     * Gets the stored result, fetched on first read and cached afterwards.
     *
     * @return the result bytes, or null if none was stored
     */
    byte[] getResult() throws StoreException;

    /**
     * Store the result. Results are write-once.
     */
    void setResult(byte[] result) throws StoreException;

    /**
     * Gets the stored result decoded with the given codec.
     *
     * @return the decoded result, or null if none was stored
     */
    default <R> R getResult(PayloadCodec<R> codec) throws StoreException {
        byte[] raw = getResult();
        return raw != null ? codec.decode(raw) : null;
    }

    /**
     * Store a result encoded with the given codec.
     */
    default <R> void setResult(R result, PayloadCodec<R> codec) throws StoreException {
        setResult(result != null ? codec.encode(result) : null);
    }
}
