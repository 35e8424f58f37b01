package com.umitunal.corequeue.storage;

/**
 * Commands queued for submission in one go. They run in the order they were
 * added when {@link #execute()} is called. A failure part way through leaves the
 * earlier commands applied.
 */
public interface StoreBatch {

    StoreBatch set(String key, byte[] value);

    StoreBatch delete(String key);

    StoreBatch hset(String key, String field, String value);

    StoreBatch hdel(String key, String field);

    StoreBatch hincrBy(String key, String field, long delta);

    StoreBatch lpush(String key, String value);

    /**
     * Run all queued commands.
     */
    void execute() throws StoreException;
}
