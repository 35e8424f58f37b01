package com.umitunal.corequeue.storage;

import com.umitunal.corequeue.config.StorageConfig;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed implementation of {@link KeyValueStore}.
 *
 * Storage layout, one RocksDB key per entry:
 * - value:      'v' + key
 * - expiry:     't' + key                         -> expiry millis (8 bytes)
 * - hash field: 'h' + key + 0x00 + field          -> UTF-8 value
 * - list meta:  'm' + key                         -> head (8 bytes) + tail (8 bytes)
 * - list item:  'l' + key + 0x00 + index(8 bytes) -> UTF-8 element
 *
 * List indexes are stored sign-flipped big-endian so a prefix scan walks a list
 * from head to tail. Read-modify-write primitives run in optimistic transactions
 * and are retried when a concurrent writer wins the commit.
 */
public class RocksKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(RocksKeyValueStore.class);

    private static final byte VALUE = 'v';
    private static final byte EXPIRY = 't';
    private static final byte HASH = 'h';
    private static final byte LIST_META = 'm';
    private static final byte LIST_ITEM = 'l';
    private static final byte SEPARATOR = 0;

    private final OptimisticTransactionDB transactionDB;
    private final ColumnFamilyHandle cf;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions readOpts;
    private final ReadOptions scanReadOpts;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final Clock clock;
    private final boolean durableWrites;
    private final int maxTransactionRetries;
    private final Duration retryBackoff;
    private final AtomicLong txnRetryCount = new AtomicLong(0);

    public RocksKeyValueStore(StorageConfig config) throws StoreException {
        this(config, Clock.systemUTC());
    }

    public RocksKeyValueStore(StorageConfig config, Clock clock) throws StoreException {
        this.clock = clock;
        this.durableWrites = config.isDurableWrites();
        this.maxTransactionRetries = config.getMaxTransactionRetries();
        this.retryBackoff = config.getTransactionRetryBackoff();

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(64 * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.cfOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setTableFormatConfig(tableConfig);
        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setIncreaseParallelism(Runtime.getRuntime().availableProcessors());

        // The default column family handle is only populated when opened with descriptors
        List<ColumnFamilyDescriptor> descriptors = List.of(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions));
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        try {
            this.transactionDB = OptimisticTransactionDB.open(
                    dbOptions, config.getDataDirectory(), descriptors, handles);
            this.cf = handles.get(0);
        } catch (RocksDBException e) {
            dbOptions.close();
            cfOptions.close();
            blockCache.close();
            bloomFilter.close();
            throw new StoreException("Failed to open RocksDB at " + config.getDataDirectory(), e);
        }

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());
        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);
        this.readOpts = new ReadOptions();
        // Scans should not pollute the block cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        log.info("Opened RocksDB store at {} (durableWrites={})",
                config.getDataDirectory(), config.isDurableWrites());
    }

    @Override
    public byte[] get(String key) throws StoreException {
        byte[] valueKey = storageKey(VALUE, key);
        byte[] expiryKey = storageKey(EXPIRY, key);
        return atomically(txn -> {
            byte[] value = txn.get(cf, readOpts, valueKey);
            if (value != null && isExpired(txn.getForUpdate(readOpts, cf, expiryKey, true))) {
                txn.delete(cf, valueKey);
                txn.delete(cf, expiryKey);
                return null;
            }
            return value;
        });
    }

    @Override
    public void set(String key, byte[] value) throws StoreException {
        byte[] valueKey = storageKey(VALUE, key);
        byte[] expiryKey = storageKey(EXPIRY, key);
        atomically(txn -> {
            txn.put(cf, valueKey, value);
            txn.delete(cf, expiryKey);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, byte[] value) throws StoreException {
        return createValue(key, value, null);
    }

    @Override
    public boolean setIfAbsent(String key, byte[] value, Duration ttl) throws StoreException {
        return createValue(key, value, ttl);
    }

    @Override
    public long delete(Collection<String> keys) throws StoreException {
        long removed = 0;
        for (String key : keys) {
            if (deleteOne(key)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public boolean exists(String key) throws StoreException {
        try {
            byte[] value = transactionDB.get(cf, readOpts, storageKey(VALUE, key));
            if (value != null) {
                return !isExpired(transactionDB.get(cf, readOpts, storageKey(EXPIRY, key)));
            }
            return transactionDB.get(cf, readOpts, storageKey(LIST_META, key)) != null
                    || hasEntryWithPrefix(prefix(HASH, key));
        } catch (RocksDBException e) {
            throw new StoreException("Failed to check key " + key, e);
        }
    }

    @Override
    public boolean expire(String key, Duration ttl) throws StoreException {
        byte[] valueKey = storageKey(VALUE, key);
        byte[] expiryKey = storageKey(EXPIRY, key);
        return atomically(txn -> {
            byte[] value = txn.getForUpdate(readOpts, cf, valueKey, true);
            if (value == null || isExpired(txn.getForUpdate(readOpts, cf, expiryKey, true))) {
                return false;
            }
            txn.put(cf, expiryKey, encodeLong(clock.millis() + ttl.toMillis()));
            return true;
        });
    }

    @Override
    public String hget(String key, String field) throws StoreException {
        try {
            byte[] value = transactionDB.get(cf, readOpts, hashField(key, field));
            return value != null ? new String(value, UTF_8) : null;
        } catch (RocksDBException e) {
            throw new StoreException("Failed to read hash field " + key + "/" + field, e);
        }
    }

    @Override
    public void hset(String key, String field, String value) throws StoreException {
        try {
            transactionDB.put(cf, writeOpts, hashField(key, field), value.getBytes(UTF_8));
        } catch (RocksDBException e) {
            throw new StoreException("Failed to write hash field " + key + "/" + field, e);
        }
    }

    @Override
    public boolean hsetIfAbsent(String key, String field, String value) throws StoreException {
        byte[] fieldKey = hashField(key, field);
        return atomically(txn -> {
            if (txn.getForUpdate(readOpts, cf, fieldKey, true) != null) {
                return false;
            }
            txn.put(cf, fieldKey, value.getBytes(UTF_8));
            return true;
        });
    }

    @Override
    public long hdel(String key, String field) throws StoreException {
        byte[] fieldKey = hashField(key, field);
        return atomically(txn -> {
            if (txn.getForUpdate(readOpts, cf, fieldKey, true) == null) {
                return 0L;
            }
            txn.delete(cf, fieldKey);
            return 1L;
        });
    }

    @Override
    public boolean hdelIfEquals(String key, String field, String expected) throws StoreException {
        byte[] fieldKey = hashField(key, field);
        byte[] expectedBytes = expected.getBytes(UTF_8);
        return atomically(txn -> {
            byte[] current = txn.getForUpdate(readOpts, cf, fieldKey, true);
            if (current == null || !Arrays.equals(current, expectedBytes)) {
                return false;
            }
            txn.delete(cf, fieldKey);
            return true;
        });
    }

    @Override
    public boolean hexists(String key, String field) throws StoreException {
        return hget(key, field) != null;
    }

    @Override
    public Map<String, String> hgetAll(String key) throws StoreException {
        byte[] prefix = prefix(HASH, key);
        Map<String, String> entries = new LinkedHashMap<>();
        try (RocksIterator iter = transactionDB.newIterator(cf, scanReadOpts)) {
            for (iter.seek(prefix); iter.isValid() && startsWith(iter.key(), prefix); iter.next()) {
                byte[] fullKey = iter.key();
                String field = new String(fullKey, prefix.length, fullKey.length - prefix.length, UTF_8);
                entries.put(field, new String(iter.value(), UTF_8));
            }
        }
        return entries;
    }

    @Override
    public long hlen(String key) throws StoreException {
        byte[] prefix = prefix(HASH, key);
        long count = 0;
        try (RocksIterator iter = transactionDB.newIterator(cf, scanReadOpts)) {
            for (iter.seek(prefix); iter.isValid() && startsWith(iter.key(), prefix); iter.next()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public long hincrBy(String key, String field, long delta) throws StoreException {
        byte[] fieldKey = hashField(key, field);
        return atomically(txn -> {
            byte[] current = txn.getForUpdate(readOpts, cf, fieldKey, true);
            long next = (current != null ? parseCounter(key, field, current) : 0L) + delta;
            txn.put(cf, fieldKey, Long.toString(next).getBytes(UTF_8));
            return next;
        });
    }

    @Override
    public long lpush(String key, String value) throws StoreException {
        byte[] metaKey = storageKey(LIST_META, key);
        return atomically(txn -> {
            long[] bounds = readBounds(txn.getForUpdate(readOpts, cf, metaKey, true));
            bounds[0]--;
            txn.put(cf, listItem(key, bounds[0]), value.getBytes(UTF_8));
            txn.put(cf, metaKey, encodeBounds(bounds));
            return bounds[1] - bounds[0];
        });
    }

    @Override
    public long rpush(String key, String value) throws StoreException {
        byte[] metaKey = storageKey(LIST_META, key);
        return atomically(txn -> {
            long[] bounds = readBounds(txn.getForUpdate(readOpts, cf, metaKey, true));
            txn.put(cf, listItem(key, bounds[1]), value.getBytes(UTF_8));
            bounds[1]++;
            txn.put(cf, metaKey, encodeBounds(bounds));
            return bounds[1] - bounds[0];
        });
    }

    @Override
    public String rpop(String key) throws StoreException {
        byte[] metaKey = storageKey(LIST_META, key);
        return atomically(txn -> {
            byte[] meta = txn.getForUpdate(readOpts, cf, metaKey, true);
            if (meta == null) {
                return null;
            }
            long[] bounds = readBounds(meta);
            bounds[1]--;
            byte[] itemKey = listItem(key, bounds[1]);
            byte[] value = txn.get(cf, readOpts, itemKey);
            txn.delete(cf, itemKey);
            if (bounds[0] == bounds[1]) {
                txn.delete(cf, metaKey);
            } else {
                txn.put(cf, metaKey, encodeBounds(bounds));
            }
            return value != null ? new String(value, UTF_8) : null;
        });
    }

    @Override
    public long llen(String key) throws StoreException {
        try {
            long[] bounds = readBounds(transactionDB.get(cf, readOpts, storageKey(LIST_META, key)));
            return bounds[1] - bounds[0];
        } catch (RocksDBException e) {
            throw new StoreException("Failed to read list length of " + key, e);
        }
    }

    @Override
    public List<String> lrange(String key) throws StoreException {
        byte[] prefix = prefix(LIST_ITEM, key);
        List<String> elements = new ArrayList<>();
        try (RocksIterator iter = transactionDB.newIterator(cf, scanReadOpts)) {
            for (iter.seek(prefix); iter.isValid() && startsWith(iter.key(), prefix); iter.next()) {
                elements.add(new String(iter.value(), UTF_8));
            }
        }
        return elements;
    }

    @Override
    public StoreBatch batch() {
        return new SequentialStoreBatch(this);
    }

    /**
     * Get the number of transaction retries that occurred.
     * Useful for monitoring contention.
     */
    public long getTransactionRetryCount() {
        return txnRetryCount.get();
    }

    @Override
    public void close() throws StoreException {
        // Writes bypass the WAL unless durable, so persist the memtables first
        try (FlushOptions flushOptions = new FlushOptions().setWaitForFlush(true)) {
            if (!durableWrites) {
                transactionDB.flush(flushOptions, cf);
            }
        } catch (RocksDBException e) {
            throw new StoreException("Failed to flush RocksDB before closing", e);
        } finally {
            release();
        }
    }

    private void release() {
        scanReadOpts.close();
        readOpts.close();
        txnOpts.close();
        writeOpts.close();
        cf.close();
        transactionDB.close();
        dbOptions.close();
        cfOptions.close();
        blockCache.close();
        bloomFilter.close();
    }

    private boolean createValue(String key, byte[] value, Duration ttl) throws StoreException {
        byte[] valueKey = storageKey(VALUE, key);
        byte[] expiryKey = storageKey(EXPIRY, key);
        return atomically(txn -> {
            byte[] current = txn.getForUpdate(readOpts, cf, valueKey, true);
            byte[] expiry = txn.getForUpdate(readOpts, cf, expiryKey, true);
            if (current != null && !isExpired(expiry)) {
                return false;
            }
            txn.put(cf, valueKey, value);
            if (ttl != null) {
                txn.put(cf, expiryKey, encodeLong(clock.millis() + ttl.toMillis()));
            } else if (expiry != null) {
                txn.delete(cf, expiryKey);
            }
            return true;
        });
    }

    private boolean deleteOne(String key) throws StoreException {
        byte[] valueKey = storageKey(VALUE, key);
        byte[] expiryKey = storageKey(EXPIRY, key);
        byte[] metaKey = storageKey(LIST_META, key);
        byte[] hashPrefix = prefix(HASH, key);
        byte[] listPrefix = prefix(LIST_ITEM, key);
        return atomically(txn -> {
            boolean existed = false;
            byte[] value = txn.getForUpdate(readOpts, cf, valueKey, true);
            if (value != null) {
                existed = !isExpired(txn.get(cf, readOpts, expiryKey));
                txn.delete(cf, valueKey);
                txn.delete(cf, expiryKey);
            }
            if (txn.getForUpdate(readOpts, cf, metaKey, true) != null) {
                existed = true;
                txn.delete(cf, metaKey);
            }
            existed |= deleteRange(txn, hashPrefix);
            deleteRange(txn, listPrefix);
            return existed;
        });
    }

    private boolean deleteRange(Transaction txn, byte[] prefix) throws RocksDBException {
        List<byte[]> doomed = new ArrayList<>();
        try (RocksIterator iter = txn.getIterator(readOpts, cf)) {
            for (iter.seek(prefix); iter.isValid() && startsWith(iter.key(), prefix); iter.next()) {
                doomed.add(iter.key());
            }
        }
        for (byte[] entry : doomed) {
            txn.getForUpdate(readOpts, cf, entry, true);
            txn.delete(cf, entry);
        }
        return !doomed.isEmpty();
    }

    private boolean hasEntryWithPrefix(byte[] prefix) {
        try (RocksIterator iter = transactionDB.newIterator(cf, scanReadOpts)) {
            iter.seek(prefix);
            return iter.isValid() && startsWith(iter.key(), prefix);
        }
    }

    /**
     * Run an action in an optimistic transaction, retrying when the commit
     * detects a conflicting write.
     */
    private <R> R atomically(TxnAction<R> action) throws StoreException {
        for (int attempt = 1; ; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
                R result = action.apply(txn);
                txn.commit();
                return result;
            } catch (RocksDBException e) {
                if (!isConflict(e)) {
                    throw new StoreException("RocksDB transaction failed", e);
                }
                txnRetryCount.incrementAndGet();
                if (attempt >= maxTransactionRetries) {
                    throw new StoreException("Transaction still conflicting after " + attempt + " attempts", e);
                }
                log.debug("Transaction conflict, retry {} of {}", attempt, maxTransactionRetries);
                pause();
            }
        }
    }

    private void pause() throws StoreException {
        try {
            Thread.sleep(retryBackoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while retrying a transaction", e);
        }
    }

    private boolean isExpired(byte[] expiry) {
        return expiry != null && ByteBuffer.wrap(expiry).getLong() <= clock.millis();
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }

    private static long parseCounter(String key, String field, byte[] raw) {
        String text = new String(raw, UTF_8);
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Hash field " + key + "/" + field + " is not an integer: " + text, e);
        }
    }

    private static long[] readBounds(byte[] meta) {
        if (meta == null) {
            return new long[] {0L, 0L};
        }
        ByteBuffer buffer = ByteBuffer.wrap(meta);
        return new long[] {buffer.getLong(), buffer.getLong()};
    }

    private static byte[] encodeBounds(long[] bounds) {
        return ByteBuffer.allocate(16).putLong(bounds[0]).putLong(bounds[1]).array();
    }

    private static byte[] encodeLong(long value) {
        return ByteBuffer.allocate(8).putLong(value).array();
    }

    private static byte[] storageKey(byte type, String key) {
        byte[] keyBytes = checkedKey(key);
        ByteBuffer buffer = ByteBuffer.allocate(1 + keyBytes.length);
        buffer.put(type);
        buffer.put(keyBytes);
        return buffer.array();
    }

    private static byte[] prefix(byte type, String key) {
        byte[] keyBytes = checkedKey(key);
        ByteBuffer buffer = ByteBuffer.allocate(2 + keyBytes.length);
        buffer.put(type);
        buffer.put(keyBytes);
        buffer.put(SEPARATOR);
        return buffer.array();
    }

    private static byte[] hashField(String key, String field) {
        byte[] prefix = prefix(HASH, key);
        byte[] fieldBytes = field.getBytes(UTF_8);
        byte[] full = Arrays.copyOf(prefix, prefix.length + fieldBytes.length);
        System.arraycopy(fieldBytes, 0, full, prefix.length, fieldBytes.length);
        return full;
    }

    private static byte[] listItem(String key, long index) {
        byte[] prefix = prefix(LIST_ITEM, key);
        return ByteBuffer.allocate(prefix.length + 8)
                .put(prefix)
                .putLong(index ^ Long.MIN_VALUE)
                .array();
    }

    private static byte[] checkedKey(String key) {
        if (key.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Keys must not contain NUL: " + key);
        }
        return key.getBytes(UTF_8);
    }

    private static boolean startsWith(byte[] candidate, byte[] prefix) {
        if (candidate.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (candidate[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    @FunctionalInterface
    private interface TxnAction<R> {
        R apply(Transaction txn) throws RocksDBException;
    }
}
