package com.clustermgmt.querytelemetry.exception;

/**
 * Failure kinds reported by the telemetry engine.
 */
public enum ErrorKind {

    /** Telemetry source call failed or timed out; the cycle is skipped, the loop continues. */
    SOURCE_UNAVAILABLE,

    /** More than one canonical row exists for the same query shape of a target. */
    CONFLICTING_CANONICAL,

    /** Classification references a missing canonical query or group. */
    INVALID_CLASSIFICATION,

    /** A single row could not be persisted; it is retried on the next cycle. */
    STORE_WRITE_FAILURE,

    /** Start on a target already monitored, or stop on a target never monitored. */
    SESSION_STATE_CONFLICT
}
