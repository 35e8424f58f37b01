package com.umitunal.corequeue.queue;

import com.umitunal.corequeue.core.MalformedRecordException;

/**
 * Strict parsing of numbers kept in store hashes.
 */
final class StoredValues {

    private StoredValues() {
    }

    static long parseLong(String key, String field, String raw) {
        if (raw == null) {
            throw new MalformedRecordException("Missing value at " + key + "/" + field);
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("Malformed number at " + key + "/" + field + ": '" + raw + "'", e);
        }
    }

    static int parseCount(String key, String field, String raw) {
        long value = parseLong(key, field, raw);
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new MalformedRecordException("Counter out of range at " + key + "/" + field + ": " + value);
        }
        return (int) value;
    }
}
