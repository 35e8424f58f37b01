package com.umitunal.corequeue.config;

import com.umitunal.corequeue.core.QueueConfigurationException;

import java.time.Duration;

/**
 * Immutable configuration of one named queue.
 */
public class QueueConfig {
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_LEASE_TIMEOUT = Duration.ofSeconds(3600);
    public static final Duration DEFAULT_ACK_RETENTION = Duration.ofHours(1);
    public static final Duration DEFAULT_RESULT_RETENTION = Duration.ofHours(24);

    private final String name;
    private final int maxAttempts;
    private final Duration leaseTimeout;
    private final boolean resultsEnabled;
    private final boolean ackEnabled;
    private final boolean deadLetterEnabled;
    private final boolean priorityEnabled;
    private final boolean retainDeadPayload;
    private final Duration ackRetention;
    private final Duration resultRetention;
    private final Duration repairInterval;

    private QueueConfig(Builder builder) {
        this.name = builder.name;
        this.maxAttempts = builder.maxAttempts;
        this.leaseTimeout = builder.leaseTimeout;
        this.resultsEnabled = builder.resultsEnabled;
        this.ackEnabled = builder.ackEnabled;
        this.deadLetterEnabled = builder.deadLetterEnabled;
        this.priorityEnabled = builder.priorityEnabled;
        this.retainDeadPayload = builder.retainDeadPayload;
        this.ackRetention = builder.ackRetention;
        this.resultRetention = builder.resultRetention;
        this.repairInterval = builder.repairInterval != null ? builder.repairInterval : builder.leaseTimeout;
    }

    public String getName() { return name; }
    public int getMaxAttempts() { return maxAttempts; }
    public Duration getLeaseTimeout() { return leaseTimeout; }
    public boolean isResultsEnabled() { return resultsEnabled; }
    public boolean isAckEnabled() { return ackEnabled; }
    public boolean isDeadLetterEnabled() { return deadLetterEnabled; }
    public boolean isPriorityEnabled() { return priorityEnabled; }
    public boolean isRetainDeadPayload() { return retainDeadPayload; }
    public Duration getAckRetention() { return ackRetention; }
    public Duration getResultRetention() { return resultRetention; }
    public Duration getRepairInterval() { return repairInterval; }

    public static Builder newBuilder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return String.format(
            "QueueConfig{name='%s', maxAttempts=%d, leaseTimeout=%s, results=%b, ack=%b, deadLetter=%b, priority=%b}",
            name, maxAttempts, leaseTimeout, resultsEnabled, ackEnabled, deadLetterEnabled, priorityEnabled
        );
    }

    public static class Builder {
        private final String name;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration leaseTimeout = DEFAULT_LEASE_TIMEOUT;
        private boolean resultsEnabled = false;
        private boolean ackEnabled = false;
        private boolean deadLetterEnabled = false;
        private boolean priorityEnabled = false;
        private boolean retainDeadPayload = false;
        private Duration ackRetention = DEFAULT_ACK_RETENTION;
        private Duration resultRetention = DEFAULT_RESULT_RETENTION;
        private Duration repairInterval;

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Maximum number of charged attempts before a failing job is dead.
         * Default: 5
         */
        public Builder withMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * How long a lease may stay unresolved before it is reclaimed.
         * Default: 3600 seconds
         */
        public Builder withLeaseTimeout(Duration leaseTimeout) {
            this.leaseTimeout = leaseTimeout;
            return this;
        }

        public Builder withResults(boolean enable) {
            this.resultsEnabled = enable;
            return this;
        }

        public Builder withAck(boolean enable) {
            this.ackEnabled = enable;
            return this;
        }

        public Builder withDeadLetter(boolean enable) {
            this.deadLetterEnabled = enable;
            return this;
        }

        public Builder withPriority(boolean enable) {
            this.priorityEnabled = enable;
            return this;
        }

        /**
         * Keep the payload of dead-lettered jobs so they can be replayed.
         * Requires dead-lettering.
         * Default: false
         */
        public Builder withRetainDeadPayload(boolean enable) {
            this.retainDeadPayload = enable;
            return this;
        }

        /**
         * Default: 1 hour
         */
        public Builder withAckRetention(Duration retention) {
            this.ackRetention = retention;
            return this;
        }

        /**
         * Default: 24 hours
         */
        public Builder withResultRetention(Duration retention) {
            this.resultRetention = retention;
            return this;
        }

        /**
         * Minimum time between two orphan sweeps, shared by every process using the queue.
         * Default: the lease timeout
         */
        public Builder withRepairInterval(Duration interval) {
            this.repairInterval = interval;
            return this;
        }

        public QueueConfig build() {
            if (name == null || name.isBlank()) {
                throw new QueueConfigurationException("You need to supply a valid string as a name for the queue");
            }
            if (name.indexOf('\0') >= 0) {
                throw new QueueConfigurationException("Queue name must not contain NUL");
            }
            if (maxAttempts < 1) {
                throw new QueueConfigurationException("maxAttempts must be at least 1, got " + maxAttempts);
            }
            requirePositive("leaseTimeout", leaseTimeout);
            requirePositive("ackRetention", ackRetention);
            requirePositive("resultRetention", resultRetention);
            if (repairInterval != null) {
                requirePositive("repairInterval", repairInterval);
            }
            if (retainDeadPayload && !deadLetterEnabled) {
                throw new QueueConfigurationException("Retaining dead payloads requires dead-lettering");
            }
            return new QueueConfig(this);
        }

        private static void requirePositive(String property, Duration value) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new QueueConfigurationException(property + " must be positive, got " + value);
            }
        }
    }
}
