package com.umitunal.corequeue.core;

import com.umitunal.corequeue.storage.StoreException;

import java.time.Instant;
import java.util.Map;

/**
 * Lease-based job queue with retries, dead letters, optional results,
 * acknowledgements and priority lanes.
 *
 * Delivery is at-least-once: a job is handed to exactly one consumer at a time,
 * and handed out again if that consumer's lease runs out.
 *
 * @param <T> the type of job payload
 */
public interface JobQueue<T> {

    /**
     * Enqueue a job on the normal lane.
     *
     * @param payload the job data
     * @return the enqueued job, not leased
     */
    Job<T> enqueue(T payload) throws StoreException;

    /**
     * Enqueue a job.
     *
     * @param payload the job data
     * @param highPriority whether to use the high-priority lane
     * @return the enqueued job, not leased
     * @throws QueueConfigurationException if high priority is requested on a queue without priority
     */
    Job<T> enqueue(T payload, boolean highPriority) throws StoreException;

    /**
     * Lease the next job, preferring the high-priority lane when there is one.
     *
     * @return the leased job, or null if the queue is drained
     */
    Job<T> dequeue() throws StoreException;

    /**
     * Lease the next job.
     *
     * @param ignorePriority pick between non-empty lanes at random instead of preferring high priority
     * @return the leased job, or null if the queue is drained
     * @throws LockConflictException if the popped id already had a lease; it is back on its lane
     */
    Job<T> dequeue(boolean ignorePriority) throws StoreException;

    /**
     * Mark a job as completed, removing all of its live state.
     */
    void complete(String jobId) throws StoreException;

    /**
     * Mark a processing failure: retry while attempts remain, otherwise remove
     * and dead-letter if enabled.
     *
     * @throws IllegalStateException if the job does not exist
     */
    void error(String jobId) throws StoreException;

    /**
     * Release the lease and requeue without charging an attempt.
     *
     * @throws IllegalStateException if the job does not exist
     */
    void defer(String jobId) throws StoreException;

    /**
     * Remove a job's live state as a terminal transition.
     *
     * @param failed record the job in the dead-letter store if enabled
     * @param completed record an acknowledgement if enabled
     * @throws CapabilityConflictException if both flags are set
     */
    void remove(String jobId, boolean failed, boolean completed) throws StoreException;

    /**
     * Requeue jobs whose lease has run out.
     *
     * @return number of jobs reclaimed
     */
    long reclaim() throws StoreException;

    /**
     * Requeue jobs that are tracked but sit in no lane, lease or dead-letter entry.
     *
     * @return number of jobs requeued
     */
    long repairOrphans() throws StoreException;

    /**
     * Number of pending jobs across lanes, after reclaiming expired leases.
     */
    long size() throws StoreException;

    /**
     * Drop all pending and leased jobs with their counters.
     */
    void reset() throws StoreException;

    /**
     * Reset the queue, purge its dead letters and remove it from the registry.
     */
    void delete() throws StoreException;

    /**
     * @return true if this queue stores job results
     */
    boolean isResultsEnabled();

    /**
     * @throws QueueConfigurationException if results are disabled
     * @throws EmptyResultException if the result is null or empty
     * @throws DuplicateResultException if a result was stored already
     */
    void putResult(String jobId, byte[] result) throws StoreException;

    /**
     * @return the stored result, or null if none
     * @throws QueueConfigurationException if results are disabled
     */
    byte[] getResult(String jobId) throws StoreException;

    /**
     * @return the attempt count, 0 if the job was never leased or does not exist
     */
    int getAttempts(String jobId) throws StoreException;

    /**
     * @return when the job was completed, or null if no acknowledgement is retained
     * @throws QueueConfigurationException if acknowledgements are disabled
     */
    Instant getAcknowledgement(String jobId) throws StoreException;

    /**
     * @return dead-lettered job ids with the time they were dead-lettered
     * @throws QueueConfigurationException if dead-lettering is disabled
     */
    Map<String, Instant> deadLetters() throws StoreException;

    /**
     * Put a dead-lettered job back on its lane with a fresh attempt count.
     *
     * @throws QueueConfigurationException if dead payloads are not retained
     * @throws IllegalStateException if the job is not dead-lettered
     */
    void replayDeadLetter(String jobId) throws StoreException;

    /**
     * Remove all dead letters and their retained payloads.
     *
     * @return number of dead letters removed
     */
    long purgeDeadLetters() throws StoreException;

    /**
     * Get statistics about the queue.
     */
    QueueMetrics getMetrics() throws StoreException;
}
