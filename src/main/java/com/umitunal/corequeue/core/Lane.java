package com.umitunal.corequeue.core;

/**
 * Pending list a job is queued on.
 */
public enum Lane {
    NORMAL,
    HIGH
}
