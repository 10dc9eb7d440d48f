package com.phillippitts.strategist.service.orchestration;

/**
 * Lifecycle of a tracked agent call. {@link #PENDING} is the only non-terminal state.
 */
public enum AgentTaskState {
    PENDING,
    READY,
    TIMED_OUT,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
