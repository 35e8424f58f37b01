package com.umitunal.corequeue.queue;

import com.umitunal.corequeue.storage.KeyValueStore;
import com.umitunal.corequeue.storage.StoreException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry of queue names kept in the store, so every process sharing the
 * store sees the same set of queues.
 */
public class QueueRegistry {
    private final KeyValueStore store;
    private final Clock clock;

    public QueueRegistry(KeyValueStore store) {
        this(store, Clock.systemUTC());
    }

    public QueueRegistry(KeyValueStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Record a queue name with its creation time. Registering again keeps the
     * original time.
     *
     * @return true if the name was not registered before
     */
    public boolean register(String name) throws StoreException {
        return store.hsetIfAbsent(QueueKeys.REGISTRY, name, Long.toString(clock.millis()));
    }

    public boolean unregister(String name) throws StoreException {
        return store.hdel(QueueKeys.REGISTRY, name) > 0;
    }

    public boolean isRegistered(String name) throws StoreException {
        return store.hexists(QueueKeys.REGISTRY, name);
    }

    /**
     * @return queue names with their creation time
     */
    public Map<String, Instant> list() throws StoreException {
        Map<String, Instant> queues = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : store.hgetAll(QueueKeys.REGISTRY).entrySet()) {
            queues.put(entry.getKey(), Instant.ofEpochMilli(
                    StoredValues.parseLong(QueueKeys.REGISTRY, entry.getKey(), entry.getValue())));
        }
        return queues;
    }
}
