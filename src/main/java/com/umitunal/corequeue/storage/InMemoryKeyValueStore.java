package com.umitunal.corequeue.storage;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of {@link KeyValueStore}.
 *
 * Every primitive holds the store monitor for its whole duration, which makes it
 * atomic against all other primitives. Expiry is checked lazily on access.
 * Data is lost when the process exits.
 */
public class InMemoryKeyValueStore implements KeyValueStore {
    private final Clock clock;
    private final Map<String, byte[]> values = new HashMap<>();
    private final Map<String, Long> expiries = new HashMap<>();
    private final Map<String, Map<String, String>> hashes = new HashMap<>();
    private final Map<String, Deque<String>> lists = new HashMap<>();

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized byte[] get(String key) {
        evictIfExpired(key);
        byte[] value = values.get(key);
        return value != null ? value.clone() : null;
    }

    @Override
    public synchronized void set(String key, byte[] value) {
        requireUnusedBy(key, hashes, lists);
        values.put(key, value.clone());
        expiries.remove(key);
    }

    @Override
    public synchronized boolean setIfAbsent(String key, byte[] value) {
        evictIfExpired(key);
        if (values.containsKey(key)) {
            return false;
        }
        set(key, value);
        return true;
    }

    @Override
    public synchronized boolean setIfAbsent(String key, byte[] value, Duration ttl) {
        if (!setIfAbsent(key, value)) {
            return false;
        }
        expiries.put(key, clock.millis() + ttl.toMillis());
        return true;
    }

    @Override
    public synchronized long delete(Collection<String> keys) {
        long removed = 0;
        for (String key : keys) {
            evictIfExpired(key);
            expiries.remove(key);
            if (values.remove(key) != null | hashes.remove(key) != null | lists.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized boolean exists(String key) {
        evictIfExpired(key);
        return values.containsKey(key) || hashes.containsKey(key) || lists.containsKey(key);
    }

    @Override
    public synchronized boolean expire(String key, Duration ttl) {
        evictIfExpired(key);
        if (!values.containsKey(key)) {
            return false;
        }
        expiries.put(key, clock.millis() + ttl.toMillis());
        return true;
    }

    @Override
    public synchronized String hget(String key, String field) {
        Map<String, String> hash = hashes.get(key);
        return hash != null ? hash.get(field) : null;
    }

    @Override
    public synchronized void hset(String key, String field, String value) {
        hashFor(key).put(field, value);
    }

    @Override
    public synchronized boolean hsetIfAbsent(String key, String field, String value) {
        return hashFor(key).putIfAbsent(field, value) == null;
    }

    @Override
    public synchronized long hdel(String key, String field) {
        Map<String, String> hash = hashes.get(key);
        if (hash == null || hash.remove(field) == null) {
            return 0;
        }
        if (hash.isEmpty()) {
            hashes.remove(key);
        }
        return 1;
    }

    @Override
    public synchronized boolean hdelIfEquals(String key, String field, String expected) {
        Map<String, String> hash = hashes.get(key);
        if (hash == null || !hash.remove(field, expected)) {
            return false;
        }
        if (hash.isEmpty()) {
            hashes.remove(key);
        }
        return true;
    }

    @Override
    public synchronized boolean hexists(String key, String field) {
        Map<String, String> hash = hashes.get(key);
        return hash != null && hash.containsKey(field);
    }

    @Override
    public synchronized Map<String, String> hgetAll(String key) {
        Map<String, String> hash = hashes.get(key);
        return hash != null ? new LinkedHashMap<>(hash) : new LinkedHashMap<>();
    }

    @Override
    public synchronized long hlen(String key) {
        Map<String, String> hash = hashes.get(key);
        return hash != null ? hash.size() : 0;
    }

    @Override
    public synchronized long hincrBy(String key, String field, long delta) {
        Map<String, String> hash = hashFor(key);
        String current = hash.get(field);
        long next;
        try {
            next = (current != null ? Long.parseLong(current) : 0L) + delta;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Hash field " + key + "/" + field + " is not an integer: " + current, e);
        }
        hash.put(field, Long.toString(next));
        return next;
    }

    @Override
    public synchronized long lpush(String key, String value) {
        Deque<String> list = listFor(key);
        list.addFirst(value);
        return list.size();
    }

    @Override
    public synchronized long rpush(String key, String value) {
        Deque<String> list = listFor(key);
        list.addLast(value);
        return list.size();
    }

    @Override
    public synchronized String rpop(String key) {
        Deque<String> list = lists.get(key);
        if (list == null) {
            return null;
        }
        String value = list.pollLast();
        if (list.isEmpty()) {
            lists.remove(key);
        }
        return value;
    }

    @Override
    public synchronized long llen(String key) {
        Deque<String> list = lists.get(key);
        return list != null ? list.size() : 0;
    }

    @Override
    public synchronized List<String> lrange(String key) {
        Deque<String> list = lists.get(key);
        return list != null ? new ArrayList<>(list) : new ArrayList<>();
    }

    @Override
    public StoreBatch batch() {
        return new SequentialStoreBatch(this);
    }

    @Override
    public synchronized void close() {
        values.clear();
        expiries.clear();
        hashes.clear();
        lists.clear();
    }

    private Map<String, String> hashFor(String key) {
        requireUnusedBy(key, values, lists);
        return hashes.computeIfAbsent(key, k -> new LinkedHashMap<>());
    }

    private Deque<String> listFor(String key) {
        requireUnusedBy(key, values, hashes);
        return lists.computeIfAbsent(key, k -> new ArrayDeque<>());
    }

    private void evictIfExpired(String key) {
        Long expiry = expiries.get(key);
        if (expiry != null && expiry <= clock.millis()) {
            expiries.remove(key);
            values.remove(key);
        }
    }

    private static void requireUnusedBy(String key, Map<String, ?> first, Map<String, ?> second) {
        if (first.containsKey(key) || second.containsKey(key)) {
            throw new IllegalStateException("Key " + key + " holds a value of another kind");
        }
    }
}
