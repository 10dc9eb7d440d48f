package com.phillippitts.strategist.service.session;

import com.phillippitts.strategist.domain.AgentResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable content of one per-session result cell: empty, a terminal result, or the
 * unavailable sentinel.
 */
public final class ResultSlot {

    public enum Status { EMPTY, READY, UNAVAILABLE }

    private static final ResultSlot EMPTY = new ResultSlot(Status.EMPTY, null, null);

    private final Status status;
    private final AgentResult result;
    private final UnavailableReason reason;

    private ResultSlot(Status status, AgentResult result, UnavailableReason reason) {
        this.status = status;
        this.result = result;
        this.reason = reason;
    }

    public static ResultSlot empty() {
        return EMPTY;
    }

    public static ResultSlot ready(AgentResult result) {
        return new ResultSlot(Status.READY, Objects.requireNonNull(result, "result"), null);
    }

    public static ResultSlot unavailable(UnavailableReason reason) {
        return new ResultSlot(Status.UNAVAILABLE, null, Objects.requireNonNull(reason, "reason"));
    }

    public Status status() {
        return status;
    }

    public boolean isReady() {
        return status == Status.READY;
    }

    public boolean isUnavailable() {
        return status == Status.UNAVAILABLE;
    }

    public Optional<AgentResult> result() {
        return Optional.ofNullable(result);
    }

    /**
     * Typed view of the result; empty when the slot is not ready or holds another type.
     */
    public <T extends AgentResult> Optional<T> result(Class<T> type) {
        return type.isInstance(result) ? Optional.of(type.cast(result)) : Optional.empty();
    }

    public Optional<UnavailableReason> reason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return status == Status.UNAVAILABLE ? "UNAVAILABLE(" + reason + ")" : status.name();
    }
}
