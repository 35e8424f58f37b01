package com.umitunal.corequeue.storage;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Primitive operations the queue needs from its backing store.
 *
 * Every single method is atomic with respect to the key it touches. Nothing is
 * atomic across keys, batches included. Keys hold exactly one kind of value: a
 * byte value, a hash of string fields, or a list of strings. Hashes and lists
 * that become empty cease to exist.
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * Read a value key.
     *
     * @return the value, or null if absent or expired
     */
    byte[] get(String key) throws StoreException;

    /**
     * Write a value key, clearing any time-to-live it had.
     */
    void set(String key, byte[] value) throws StoreException;

    /**
     * Create a value key only if it does not exist yet.
     *
     * @return true if this call created the key
     */
    boolean setIfAbsent(String key, byte[] value) throws StoreException;

    /**
     * Create a value key with a time-to-live only if it does not exist yet.
     * Creation and expiry are applied together.
     *
     * @return true if this call created the key
     */
    boolean setIfAbsent(String key, byte[] value, Duration ttl) throws StoreException;

    /**
     * Remove keys of any kind.
     *
     * @return number of keys that existed
     */
    long delete(Collection<String> keys) throws StoreException;

    boolean exists(String key) throws StoreException;

    /**
     * Set a time-to-live on an existing value key.
     *
     * @return false if the key does not exist
     */
    boolean expire(String key, Duration ttl) throws StoreException;

    String hget(String key, String field) throws StoreException;

    void hset(String key, String field, String value) throws StoreException;

    /**
     * Set a hash field only if it does not exist yet.
     *
     * @return true if this call created the field
     */
    boolean hsetIfAbsent(String key, String field, String value) throws StoreException;

    /**
     * @return number of fields removed (0 or 1)
     */
    long hdel(String key, String field) throws StoreException;

    /**
     * Remove a hash field only while it still holds the expected value.
     *
     * @return true if this call removed the field
     */
    boolean hdelIfEquals(String key, String field, String expected) throws StoreException;

    boolean hexists(String key, String field) throws StoreException;

    Map<String, String> hgetAll(String key) throws StoreException;

    long hlen(String key) throws StoreException;

    /**
     * Add to a numeric hash field, creating it at zero first if missing.
     *
     * @return the value after the increment
     */
    long hincrBy(String key, String field, long delta) throws StoreException;

    /**
     * Push onto the head (left end) of a list.
     *
     * @return list length after the push
     */
    long lpush(String key, String value) throws StoreException;

    /**
     * Push onto the tail (right end) of a list.
     *
     * @return list length after the push
     */
    long rpush(String key, String value) throws StoreException;

    /**
     * Pop from the tail (right end) of a list.
     *
     * @return the element, or null if the list is empty
     */
    String rpop(String key) throws StoreException;

    long llen(String key) throws StoreException;

    /**
     * All elements of a list, head to tail.
     */
    List<String> lrange(String key) throws StoreException;

    /**
     * Start a batch of commands submitted together. A batch saves round trips;
     * it is not a transaction.
     */
    StoreBatch batch();

    @Override
    void close() throws StoreException;
}
