package com.umitunal.corequeue.storage;

/**
 * Raised by a {@link KeyValueStore} when the backend cannot serve a request.
 * The queue never retries these; retry and backoff belong to the caller.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
