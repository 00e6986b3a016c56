package org.tomasim.runtime.rob;

/**
 * Life cycle of a reorder buffer entry.
 */
public enum RobState {
    /** Allocated, waiting for operands or for a free execution cycle. */
    ISSUED,
    /** Counting down its latency in a reservation station. */
    EXECUTING,
    /** Result broadcast, waiting to reach the head of the buffer. */
    WRITTEN,
    /** Retired in program order. */
    COMMITTED,
    /** Discarded because an older control transfer was mispredicted. */
    SQUASHED
}
