package com.umitunal.corequeue.config;

import java.time.Duration;

/**
 * Configuration for the RocksDB store adapter.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final int maxTransactionRetries;
    private final Duration transactionRetryBackoff;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.maxTransactionRetries = builder.maxTransactionRetries;
        this.transactionRetryBackoff = builder.transactionRetryBackoff;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public int getMaxTransactionRetries() { return maxTransactionRetries; }
    public Duration getTransactionRetryBackoff() { return transactionRetryBackoff; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = false;
        private int memoryBufferSizeMB = 64;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 4;
        private int maxTransactionRetries = 32;
        private Duration transactionRetryBackoff = Duration.ofMillis(1);

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Enable durable writes (fsync on every write).
         * Slower but guarantees durability.
         * Default: false
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memory buffer size in MB.
         * Default: 64 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Set maximum number of memory buffers.
         * Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Set number of background compaction threads.
         * Default: 4
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * How many times a conflicting transaction is retried before giving up.
         * Default: 32
         */
        public Builder withMaxTransactionRetries(int retries) {
            this.maxTransactionRetries = retries;
            return this;
        }

        /**
         * Pause between transaction retries.
         * Default: 1 ms
         */
        public Builder withTransactionRetryBackoff(Duration backoff) {
            this.transactionRetryBackoff = backoff;
            return this;
        }

        public StorageConfig build() {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("Data directory is required");
            }
            if (maxTransactionRetries < 1) {
                throw new IllegalArgumentException("maxTransactionRetries must be at least 1");
            }
            return new StorageConfig(this);
        }
    }
}
