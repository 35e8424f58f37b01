package com.umitunal.corequeue.core;

/**
 * A popped job id already had a lease. The id has been pushed back onto its
 * lane before this is thrown, so the job is not lost.
 */
public class LockConflictException extends QueueException {
    private final String jobId;
    private final Lane lane;

    public LockConflictException(String jobId, Lane lane) {
        super("Job " + jobId + " is already leased (lane " + lane + ")");
        this.jobId = jobId;
        this.lane = lane;
    }

    public String getJobId() { return jobId; }
    public Lane getLane() { return lane; }
}
