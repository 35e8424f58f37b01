package com.umitunal.corequeue.core;

/**
 * Invalid queue configuration, or an operation that needs a feature the queue
 * was built without (results, acknowledgements, priority, dead letters).
 */
public class QueueConfigurationException extends QueueException {

    public QueueConfigurationException(String message) {
        super(message);
    }
}
