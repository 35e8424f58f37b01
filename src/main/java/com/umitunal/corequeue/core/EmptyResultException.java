package com.umitunal.corequeue.core;

public class EmptyResultException extends QueueException {

    public EmptyResultException(String jobId) {
        super("Cannot store an empty result for job " + jobId);
    }
}
