package com.umitunal.corequeue.core;

/**
 * A stored value (timestamp, counter, job id) does not have the expected format.
 */
public class MalformedRecordException extends QueueException {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
