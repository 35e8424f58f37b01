package com.umitunal.corequeue.worker;

import com.umitunal.corequeue.core.DuplicateResultException;
import com.umitunal.corequeue.core.Job;
import com.umitunal.corequeue.core.JobQueue;
import com.umitunal.corequeue.core.LockConflictException;
import com.umitunal.corequeue.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A worker that continuously polls the queue and processes jobs.
 *
 * @param <T> the type of job payload
 */
public class QueueWorker<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private final String workerId;
    private final JobQueue<T> queue;
    private final JobProcessor<T> processor;
    private final long pollInterval;
    private final boolean ignorePriority;
    private final boolean storeResults;
    private final AtomicBoolean running;
    private final AtomicLong processedCount;
    private final AtomicLong failedCount;
    private final AtomicLong deferredCount;

    private Thread workerThread;

    private QueueWorker(Builder<T> builder) {
        this.workerId = builder.workerId;
        this.queue = builder.queue;
        this.processor = builder.processor;
        this.pollInterval = builder.pollInterval;
        this.ignorePriority = builder.ignorePriority;
        this.storeResults = builder.storeResults;
        this.running = new AtomicBoolean(false);
        this.processedCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
        this.deferredCount = new AtomicLong(0);
    }

    /**
     * Start the worker in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread = new Thread(this::run, "QueueWorker-" + workerId);
            workerThread.setDaemon(false);
            workerThread.start();
            log.info("Worker {} started", workerId);
        }
    }

    /**
     * Stop the worker gracefully.
     */
    public void stop() {
        running.set(false);
        if (workerThread != null) {
            try {
                workerThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("Worker {} stopped (processed={}, failed={}, deferred={})",
                    workerId, processedCount.get(), failedCount.get(), deferredCount.get());
        }
    }

    /**
     * Process a single job synchronously.
     *
     * @return true if a job was leased, whatever its outcome
     */
    public boolean processOne() throws Exception {
        Job<T> job = queue.dequeue(ignorePriority);

        if (job == null) {
            return false;
        }

        JobProcessor.ProcessingResult result;
        try {
            result = processor.process(job);
        } catch (Exception e) {
            job.error();
            failedCount.incrementAndGet();
            throw e;
        }

        switch (result.getOutcome()) {
            case SUCCESS -> {
                storeResult(job, result.getResult());
                job.complete();
                processedCount.incrementAndGet();
            }
            case FAILURE -> {
                log.debug("Job {} failed: {}", job.getId(), result.getMessage());
                job.error();
                failedCount.incrementAndGet();
            }
            case DEFERRED -> {
                job.defer();
                deferredCount.incrementAndGet();
            }
        }
        return true;
    }

    private void storeResult(Job<T> job, byte[] value) throws StoreException {
        if (value == null) {
            return;
        }
        if (!storeResults) {
            log.warn("Worker {} dropped the result of job {}: queue does not store results", workerId, job.getId());
            return;
        }
        try {
            job.setResult(value);
        } catch (DuplicateResultException e) {
            // An earlier delivery stored its result before losing the lease
            log.info("Job {} already has a result, keeping the first one", job.getId());
        }
    }

    private void run() {
        while (running.get()) {
            try {
                boolean processed = processOne();

                if (!processed) {
                    // No jobs available, wait before polling again
                    Thread.sleep(pollInterval);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (LockConflictException e) {
                log.warn("Worker {} hit a lease conflict on job {}", workerId, e.getJobId());
            } catch (Exception e) {
                log.warn("Worker {} error: {}", workerId, e.getMessage(), e);
            }
        }
    }

    public String getWorkerId() { return workerId; }
    public long getProcessedCount() { return processedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public long getDeferredCount() { return deferredCount.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }

    public static <T> Builder<T> builder(String workerId, JobQueue<T> queue, JobProcessor<T> processor) {
        return new Builder<>(workerId, queue, processor);
    }

    public static class Builder<T> {
        private final String workerId;
        private final JobQueue<T> queue;
        private final JobProcessor<T> processor;
        private long pollInterval = 1000;   // 1 second
        private boolean ignorePriority = false;
        private boolean storeResults;

        private Builder(String workerId, JobQueue<T> queue, JobProcessor<T> processor) {
            this.workerId = workerId;
            this.queue = queue;
            this.processor = processor;
        }

        public Builder<T> withPollInterval(long millis) {
            this.pollInterval = millis;
            return this;
        }

        /**
         * Pick between lanes at random instead of draining high priority first.
         */
        public Builder<T> withIgnorePriority(boolean ignore) {
            this.ignorePriority = ignore;
            return this;
        }

        public QueueWorker<T> build() {
            this.storeResults = queue.isResultsEnabled();
            return new QueueWorker<>(this);
        }
    }
}
