package com.umitunal.corequeue.storage;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch that replays its commands one by one against a {@link KeyValueStore}.
 */
public final class SequentialStoreBatch implements StoreBatch {
    private final KeyValueStore store;
    private final List<Command> commands = new ArrayList<>();

    public SequentialStoreBatch(KeyValueStore store) {
        this.store = store;
    }

    @Override
    public StoreBatch set(String key, byte[] value) {
        commands.add(s -> s.set(key, value));
        return this;
    }

    @Override
    public StoreBatch delete(String key) {
        commands.add(s -> s.delete(List.of(key)));
        return this;
    }

    @Override
    public StoreBatch hset(String key, String field, String value) {
        commands.add(s -> s.hset(key, field, value));
        return this;
    }

    @Override
    public StoreBatch hdel(String key, String field) {
        commands.add(s -> s.hdel(key, field));
        return this;
    }

    @Override
    public StoreBatch hincrBy(String key, String field, long delta) {
        commands.add(s -> s.hincrBy(key, field, delta));
        return this;
    }

    @Override
    public StoreBatch lpush(String key, String value) {
        commands.add(s -> s.lpush(key, value));
        return this;
    }

    @Override
    public void execute() throws StoreException {
        List<Command> pending = new ArrayList<>(commands);
        commands.clear();
        for (Command command : pending) {
            command.apply(store);
        }
    }

    @FunctionalInterface
    private interface Command {
        void apply(KeyValueStore store) throws StoreException;
    }
}
