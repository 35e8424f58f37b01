package com.umitunal.corequeue.core;

/**
 * A result already exists for the job. Results are write-once.
 */
public class DuplicateResultException extends QueueException {

    public DuplicateResultException(String jobId) {
        super("Result for job " + jobId + " exists already and cannot be overwritten");
    }
}
