package com.umitunal.corequeue.core;

/**
 * A single call asked for mutually exclusive outcomes, such as marking a job
 * both failed and completed.
 */
public class CapabilityConflictException extends QueueException {

    public CapabilityConflictException(String message) {
        super(message);
    }
}
