package com.umitunal.corequeue.core;

/**
 * Base class for protocol errors raised by the queue. These signal caller
 * mistakes or inconsistent stored state and are never retried by the queue.
 */
public class QueueException extends RuntimeException {

    public QueueException(String message) {
        super(message);
    }

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
