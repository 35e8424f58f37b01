package com.umitunal.corequeue.queue;

import com.umitunal.corequeue.config.QueueConfig;
import com.umitunal.corequeue.core.CapabilityConflictException;
import com.umitunal.corequeue.core.DuplicateResultException;
import com.umitunal.corequeue.core.EmptyResultException;
import com.umitunal.corequeue.core.Job;
import com.umitunal.corequeue.core.JobQueue;
import com.umitunal.corequeue.core.Lane;
import com.umitunal.corequeue.core.LockConflictException;
import com.umitunal.corequeue.core.QueueConfigurationException;
import com.umitunal.corequeue.core.QueueMetrics;
import com.umitunal.corequeue.model.JobHandle;
import com.umitunal.corequeue.serialization.PayloadCodec;
import com.umitunal.corequeue.storage.KeyValueStore;
import com.umitunal.corequeue.storage.StoreBatch;
import com.umitunal.corequeue.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * {@link JobQueue} implemented on the primitives of a {@link KeyValueStore}.
 *
 * <p>A live job is in exactly one place: a lane list, the lease table, or the
 * dead-letter store. Exclusivity of delivery rests on a single conditional
 * create of the job's lease entry. Transitions that touch two keys always clear
 * the lease before pushing the id back, so an interrupted transition leaves a
 * tracked job that is in no lane and holds no lease. {@link #repairOrphans()}
 * finds those and requeues them.
 *
 * <p>Attempt counting: the first lease grant creates the counter at 1, each
 * retry through {@link #error(String)} adds one. Deferral, reclaim and later
 * lease grants leave it unchanged.
 *
 * @param <T> the type of job payload
 */
public class CoreQueue<T> implements JobQueue<T> {
    private static final Logger log = LoggerFactory.getLogger(CoreQueue.class);

    private final KeyValueStore store;
    private final QueueConfig config;
    private final QueueKeys keys;
    private final PayloadCodec<T> codec;
    private final QueueRegistry registry;
    private final Clock clock;

    public CoreQueue(KeyValueStore store, QueueConfig config, PayloadCodec<T> codec) throws StoreException {
        this(store, config, codec, Clock.systemUTC());
    }

    public CoreQueue(KeyValueStore store, QueueConfig config, PayloadCodec<T> codec, Clock clock)
            throws StoreException {
        this.store = store;
        this.config = config;
        this.keys = new QueueKeys(config.getName());
        this.codec = codec;
        this.clock = clock;
        this.registry = new QueueRegistry(store, clock);

        if (registry.register(config.getName())) {
            log.info("Registered queue {}", config);
        }
    }

    @Override
    public Job<T> enqueue(T payload) throws StoreException {
        return enqueue(payload, false);
    }

    @Override
    public Job<T> enqueue(T payload, boolean highPriority) throws StoreException {
        Objects.requireNonNull(payload, "payload");
        if (highPriority) {
            requireFeature(config.isPriorityEnabled(), "priority");
        }
        Lane lane = highPriority ? Lane.HIGH : Lane.NORMAL;
        String jobId = keys.newJobId(lane);

        store.batch()
                .set(jobId, codec.encode(payload))
                .hset(keys.jobs(), jobId, now())
                .lpush(keys.lane(lane), jobId)
                .execute();

        log.debug("Enqueued job {} on lane {}", jobId, lane);
        return new JobHandle<>(jobId, payload, lane, this);
    }

    @Override
    public Job<T> dequeue() throws StoreException {
        return dequeue(false);
    }

    @Override
    public Job<T> dequeue(boolean ignorePriority) throws StoreException {
        reclaim();

        while (true) {
            String jobId = null;
            Lane lane = null;
            for (Lane candidate : laneOrder(ignorePriority)) {
                jobId = store.rpop(keys.lane(candidate));
                if (jobId != null) {
                    lane = candidate;
                    break;
                }
            }
            if (jobId == null) {
                return null;
            }

            if (!store.hsetIfAbsent(keys.locked(), jobId, now())) {
                store.rpush(keys.lane(lane), jobId);
                log.warn("Popped job {} already holds a lease, pushed it back onto lane {}", jobId, lane);
                throw new LockConflictException(jobId, lane);
            }

            byte[] data = store.get(jobId);
            if (data == null) {
                // A leftover copy of an id whose job has already been removed
                store.hdel(keys.locked(), jobId);
                log.debug("Discarded stale job id {}", jobId);
                continue;
            }

            store.hsetIfAbsent(keys.attempts(), jobId, "1");
            log.debug("Leased job {} from lane {}", jobId, lane);
            return new JobHandle<>(jobId, codec.decode(data), lane, this);
        }
    }

    @Override
    public void complete(String jobId) throws StoreException {
        remove(jobId, false, true);
    }

    @Override
    public void error(String jobId) throws StoreException {
        Lane lane = originLane(jobId);
        int attempts = getAttempts(jobId);
        releaseLease(jobId);

        if (attempts < config.getMaxAttempts()) {
            store.batch()
                    .hincrBy(keys.attempts(), jobId, 1)
                    .lpush(keys.lane(lane), jobId)
                    .execute();
            log.debug("Job {} failed attempt {} of {}, requeued", jobId, attempts, config.getMaxAttempts());
        } else {
            remove(jobId, true, false);
            if (config.isDeadLetterEnabled()) {
                log.info("Job {} exhausted {} attempts, moved to dead letters", jobId, attempts);
            } else {
                log.info("Job {} exhausted {} attempts, dropped", jobId, attempts);
            }
        }
    }

    @Override
    public void defer(String jobId) throws StoreException {
        Lane lane = originLane(jobId);
        releaseLease(jobId);
        store.lpush(keys.lane(lane), jobId);
        log.debug("Deferred job {}", jobId);
    }

    @Override
    public void remove(String jobId, boolean failed, boolean completed) throws StoreException {
        if (failed && completed) {
            throw new CapabilityConflictException("Cannot mark job " + jobId + " with both error and complete");
        }
        boolean deadLetter = failed && config.isDeadLetterEnabled();
        String now = now();

        StoreBatch batch = store.batch();
        if (deadLetter) {
            batch.hset(keys.dead(), jobId, now);
        }
        if (!(deadLetter && config.isRetainDeadPayload())) {
            batch.delete(jobId);
        }
        batch.hdel(keys.attempts(), jobId)
                .hdel(keys.jobs(), jobId)
                .hdel(keys.orphans(), jobId)
                .hdel(keys.locked(), jobId)
                .execute();

        if (completed && config.isAckEnabled()) {
            store.setIfAbsent(keys.ack(jobId), now.getBytes(UTF_8), config.getAckRetention());
        }
    }

    @Override
    public long reclaim() throws StoreException {
        long now = clock.millis();
        long timeout = config.getLeaseTimeout().toMillis();
        long reclaimed = 0;

        for (Map.Entry<String, String> lease : store.hgetAll(keys.locked()).entrySet()) {
            String jobId = lease.getKey();
            long leasedAt = StoredValues.parseLong(keys.locked(), jobId, lease.getValue());
            if (leasedAt + timeout >= now) {
                continue;
            }
            // The lease may have been released and granted anew since it was read
            if (!store.hdelIfEquals(keys.locked(), jobId, lease.getValue())) {
                continue;
            }
            if (store.exists(jobId)) {
                store.lpush(keys.lane(originLane(jobId)), jobId);
                reclaimed++;
            }
        }

        if (reclaimed > 0) {
            log.info("Reclaimed {} expired leases on queue {}", reclaimed, keys.name());
        }

        if (store.setIfAbsent(keys.repairGate(), Long.toString(now).getBytes(UTF_8), config.getRepairInterval())) {
            reclaimed += repairOrphans();
        }
        return reclaimed;
    }

    /**
     * {@inheritDoc}
     *
     * <p>A job is requeued only when the previous sweep already saw it orphaned,
     * which keeps jobs that are between two steps of a transition from being
     * pushed twice. {@link #reclaim()} runs a sweep at most once per repair
     * interval across all processes; manual calls should keep the same pace.
     */
    @Override
    public long repairOrphans() throws StoreException {
        Set<String> accounted = new HashSet<>();
        accounted.addAll(store.lrange(keys.lane(Lane.NORMAL)));
        accounted.addAll(store.lrange(keys.lane(Lane.HIGH)));
        accounted.addAll(store.hgetAll(keys.locked()).keySet());
        accounted.addAll(store.hgetAll(keys.dead()).keySet());
        Map<String, String> suspects = store.hgetAll(keys.orphans());
        Set<String> tracked = store.hgetAll(keys.jobs()).keySet();
        String now = now();
        long requeued = 0;

        for (String jobId : tracked) {
            if (accounted.contains(jobId)) {
                continue;
            }
            if (!store.exists(jobId)) {
                // Removal stopped after the payload was deleted
                store.batch()
                        .hdel(keys.attempts(), jobId)
                        .hdel(keys.jobs(), jobId)
                        .hdel(keys.orphans(), jobId)
                        .execute();
                continue;
            }
            if (suspects.containsKey(jobId)) {
                store.hdel(keys.orphans(), jobId);
                store.lpush(keys.lane(originLane(jobId)), jobId);
                requeued++;
                log.warn("Requeued orphaned job {}", jobId);
            } else {
                store.hset(keys.orphans(), jobId, now);
            }
        }

        for (String suspect : suspects.keySet()) {
            if (accounted.contains(suspect) || !tracked.contains(suspect)) {
                store.hdel(keys.orphans(), suspect);
            }
        }
        return requeued;
    }

    @Override
    public long size() throws StoreException {
        reclaim();
        long size = store.llen(keys.lane(Lane.NORMAL));
        if (config.isPriorityEnabled()) {
            size += store.llen(keys.lane(Lane.HIGH));
        }
        return size;
    }

    @Override
    public void reset() throws StoreException {
        Set<String> jobIds = new LinkedHashSet<>();
        jobIds.addAll(store.lrange(keys.lane(Lane.NORMAL)));
        jobIds.addAll(store.lrange(keys.lane(Lane.HIGH)));
        jobIds.addAll(store.hgetAll(keys.locked()).keySet());
        jobIds.addAll(store.hgetAll(keys.jobs()).keySet());

        List<String> doomed = new ArrayList<>(List.of(
                keys.attempts(), keys.locked(), keys.lane(Lane.NORMAL), keys.lane(Lane.HIGH),
                keys.jobs(), keys.orphans(), keys.repairGate()));
        doomed.addAll(jobIds);
        store.delete(doomed);
        log.info("Reset queue {}, dropped {} jobs", keys.name(), jobIds.size());
    }

    @Override
    public void delete() throws StoreException {
        reset();
        purgeDeadLetters();
        registry.unregister(keys.name());
        log.info("Deleted queue {}", keys.name());
    }

    @Override
    public boolean isResultsEnabled() {
        return config.isResultsEnabled();
    }

    @Override
    public void putResult(String jobId, byte[] result) throws StoreException {
        requireFeature(config.isResultsEnabled(), "results");
        if (result == null || result.length == 0) {
            throw new EmptyResultException(jobId);
        }
        if (!store.setIfAbsent(keys.result(jobId), result, config.getResultRetention())) {
            throw new DuplicateResultException(jobId);
        }
    }

    @Override
    public byte[] getResult(String jobId) throws StoreException {
        requireFeature(config.isResultsEnabled(), "results");
        return store.get(keys.result(jobId));
    }

    @Override
    public int getAttempts(String jobId) throws StoreException {
        String raw = store.hget(keys.attempts(), jobId);
        return raw != null ? StoredValues.parseCount(keys.attempts(), jobId, raw) : 0;
    }

    @Override
    public Instant getAcknowledgement(String jobId) throws StoreException {
        requireFeature(config.isAckEnabled(), "acknowledgements");
        String ackKey = keys.ack(jobId);
        byte[] raw = store.get(ackKey);
        if (raw == null) {
            return null;
        }
        return Instant.ofEpochMilli(StoredValues.parseLong(ackKey, "value", new String(raw, UTF_8)));
    }

    @Override
    public Map<String, Instant> deadLetters() throws StoreException {
        requireFeature(config.isDeadLetterEnabled(), "dead-lettering");
        Map<String, Instant> deadLetters = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : store.hgetAll(keys.dead()).entrySet()) {
            deadLetters.put(entry.getKey(),
                    Instant.ofEpochMilli(StoredValues.parseLong(keys.dead(), entry.getKey(), entry.getValue())));
        }
        return deadLetters;
    }

    @Override
    public void replayDeadLetter(String jobId) throws StoreException {
        requireFeature(config.isRetainDeadPayload(), "dead payload retention");
        Lane lane = originLane(jobId);
        if (!store.hexists(keys.dead(), jobId)) {
            throw new IllegalStateException("Job not dead-lettered: " + jobId);
        }
        if (!store.exists(jobId)) {
            store.hdel(keys.dead(), jobId);
            throw new IllegalStateException("Payload of dead-lettered job " + jobId + " is gone");
        }

        store.hset(keys.jobs(), jobId, now());
        if (store.hdel(keys.dead(), jobId) == 0) {
            return; // replayed concurrently
        }
        store.hdel(keys.attempts(), jobId);
        store.lpush(keys.lane(lane), jobId);
        log.info("Replayed dead-lettered job {}", jobId);
    }

    @Override
    public long purgeDeadLetters() throws StoreException {
        Set<String> jobIds = store.hgetAll(keys.dead()).keySet();
        List<String> doomed = new ArrayList<>(jobIds);
        doomed.add(keys.dead());
        store.delete(doomed);
        return jobIds.size();
    }

    @Override
    public QueueMetrics getMetrics() throws StoreException {
        return new QueueMetrics(
                store.llen(keys.lane(Lane.NORMAL)),
                store.llen(keys.lane(Lane.HIGH)),
                store.hlen(keys.locked()),
                store.hlen(keys.dead()),
                store.hlen(keys.jobs())
        );
    }

    public String getName() {
        return keys.name();
    }

    private List<Lane> laneOrder(boolean ignorePriority) {
        if (!config.isPriorityEnabled()) {
            return List.of(Lane.NORMAL);
        }
        if (!ignorePriority || ThreadLocalRandom.current().nextBoolean()) {
            return List.of(Lane.HIGH, Lane.NORMAL);
        }
        return List.of(Lane.NORMAL, Lane.HIGH);
    }

    /**
     * Lane to requeue a job on. High-priority ids fall back to the normal lane
     * when the queue is running without priority.
     */
    private Lane originLane(String jobId) {
        Lane lane = keys.laneOf(jobId);
        return lane == Lane.HIGH && !config.isPriorityEnabled() ? Lane.NORMAL : lane;
    }

    private void releaseLease(String jobId) throws StoreException {
        if (store.hdel(keys.locked(), jobId) == 0) {
            throw new IllegalStateException("Job not found or not leased: " + jobId);
        }
    }

    private void requireFeature(boolean enabled, String feature) {
        if (!enabled) {
            throw new QueueConfigurationException("Queue " + keys.name() + " was built without " + feature);
        }
    }

    private String now() {
        return Long.toString(clock.millis());
    }
}
