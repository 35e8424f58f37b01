package com.umitunal.corequeue.core;

/**
 * Metrics and statistics for queue monitoring.
 */
public class QueueMetrics {
    private final long pendingJobs;
    private final long pendingHighPriorityJobs;
    private final long leasedJobs;
    private final long deadJobs;
    private final long trackedJobs;

    public QueueMetrics(long pendingJobs, long pendingHighPriorityJobs, long leasedJobs,
                        long deadJobs, long trackedJobs) {
        this.pendingJobs = pendingJobs;
        this.pendingHighPriorityJobs = pendingHighPriorityJobs;
        this.leasedJobs = leasedJobs;
        this.deadJobs = deadJobs;
        this.trackedJobs = trackedJobs;
    }

    /** Jobs waiting on the normal lane. */
    public long getPendingJobs() { return pendingJobs; }
    /** Jobs waiting on the high-priority lane. */
    public long getPendingHighPriorityJobs() { return pendingHighPriorityJobs; }
    public long getLeasedJobs() { return leasedJobs; }
    public long getDeadJobs() { return deadJobs; }
    /** Live jobs known to the job index, whatever lane or lease they are in. */
    public long getTrackedJobs() { return trackedJobs; }

    @Override
    public String toString() {
        return String.format(
            "QueueMetrics{pending=%d, pendingHigh=%d, leased=%d, dead=%d, tracked=%d}",
            pendingJobs, pendingHighPriorityJobs, leasedJobs, deadJobs, trackedJobs
        );
    }
}
