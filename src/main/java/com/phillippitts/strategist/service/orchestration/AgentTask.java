package com.phillippitts.strategist.service.orchestration;

import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.AgentResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Future;

/**
 * Handle of one in-flight background agent call.
 *
 * <p>There is no cancellation: once a task stops being tracked (timeout or supersession) the
 * underlying call keeps running until it finishes on its own. The {@code observed} flag records
 * that the outcome has been consumed, which guarantees each task is committed exactly once no
 * matter how often it is reconciled.
 */
public final class AgentTask {

    private final AgentKind kind;
    private final String sessionId;
    private final Future<? extends AgentResult> handle;
    private final Instant startedAt;
    private final Duration timeout;

    private AgentTaskState state = AgentTaskState.PENDING;
    private boolean observed;

    public AgentTask(AgentKind kind, String sessionId, Future<? extends AgentResult> handle,
                     Instant startedAt, Duration timeout) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.handle = Objects.requireNonNull(handle, "handle");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public AgentKind kind() {
        return kind;
    }

    public String sessionId() {
        return sessionId;
    }

    public Future<? extends AgentResult> handle() {
        return handle;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Duration timeout() {
        return timeout;
    }

    public synchronized AgentTaskState state() {
        return state;
    }

    public synchronized boolean isObserved() {
        return observed;
    }

    /**
     * @return true once {@code now} is strictly past {@code startedAt + timeout + grace}
     */
    public boolean isExpired(Instant now, Duration grace) {
        return Duration.between(startedAt, now).compareTo(timeout.plus(grace)) > 0;
    }

    public Duration elapsed(Instant now) {
        return Duration.between(startedAt, now);
    }

    /**
     * Moves the task to a terminal state.
     *
     * @return false if the task was already observed; the state is left unchanged
     * @throws IllegalArgumentException if {@code target} is {@link AgentTaskState#PENDING}
     */
    synchronized boolean complete(AgentTaskState target) {
        if (!target.isTerminal()) {
            throw new IllegalArgumentException("Target state must be terminal: " + target);
        }
        if (observed) {
            return false;
        }
        observed = true;
        state = target;
        return true;
    }

    @Override
    public String toString() {
        return "AgentTask{" + kind.metricName() + ", session=" + sessionId + ", state=" + state() + "}";
    }
}
