package com.umitunal.corequeue.queue;

import com.umitunal.corequeue.core.Lane;
import com.umitunal.corequeue.core.MalformedRecordException;

import java.util.UUID;

/**
 * Store key names derived from a queue name.
 *
 * Job ids are the lane key followed by a random UUID, so a job's payload lives
 * under its own id and the lane it was enqueued on can be read back from it.
 */
public final class QueueKeys {
    public static final String REGISTRY = "QUEUEREGISTER";

    private final String name;
    private final String high;
    private final String locked;
    private final String attempts;
    private final String dead;
    private final String jobs;
    private final String orphans;
    private final String repairGate;

    public QueueKeys(String name) {
        this.name = name;
        this.high = name + ":HIGH";
        this.locked = name + ":LOCKED";
        this.attempts = name + ":ATTEMPTS";
        this.dead = name + ":DEAD";
        this.jobs = name + ":JOBS";
        this.orphans = name + ":ORPHANS";
        this.repairGate = name + ":REPAIR";
    }

    public String name() { return name; }
    /** Lease table: job id -> lease timestamp (epoch millis). */
    public String locked() { return locked; }
    /** Attempt counters: job id -> count. */
    public String attempts() { return attempts; }
    /** Dead-letter store: job id -> dead-lettered timestamp (epoch millis). */
    public String dead() { return dead; }
    /** Job index: job id -> enqueue timestamp (epoch millis). */
    public String jobs() { return jobs; }
    /** Orphan suspects seen by the previous sweep: job id -> sweep timestamp. */
    public String orphans() { return orphans; }
    public String repairGate() { return repairGate; }

    public String lane(Lane lane) {
        return lane == Lane.HIGH ? high : name;
    }

    public String ack(String jobId) {
        return jobId + ":ACK";
    }

    public String result(String jobId) {
        return jobId + ":RESULT";
    }

    public String newJobId(Lane lane) {
        return lane(lane) + ":" + UUID.randomUUID();
    }

    /**
     * Read the lane a job was enqueued on from its id.
     *
     * @throws MalformedRecordException if the id was not issued by this queue
     */
    public Lane laneOf(String jobId) {
        if (isIdOn(jobId, high)) {
            return Lane.HIGH;
        }
        if (isIdOn(jobId, name)) {
            return Lane.NORMAL;
        }
        throw new MalformedRecordException("Job id " + jobId + " does not belong to queue " + name);
    }

    private static boolean isIdOn(String jobId, String laneKey) {
        if (!jobId.startsWith(laneKey + ":")) {
            return false;
        }
        String token = jobId.substring(laneKey.length() + 1);
        try {
            UUID.fromString(token);
            return token.length() == 36;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
