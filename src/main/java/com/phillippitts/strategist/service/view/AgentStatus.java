package com.phillippitts.strategist.service.view;

/**
 * Display status of one agent slot.
 */
public enum AgentStatus {
    /** Nothing started yet, or the last result was discarded. */
    EMPTY,
    /** A tracked call is still running. */
    PENDING,
    READY,
    /** The last call timed out or failed. */
    UNAVAILABLE
}
