package com.phillippitts.strategist.service.session;

import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.AgentResult;
import com.phillippitts.strategist.domain.StrategyReport;
import com.phillippitts.strategist.service.orchestration.AgentTask;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * All in-memory state of one user session.
 *
 * <p>Owned by {@link SessionRegistry} and passed explicitly to the orchestrator, the
 * reconciliation loop and the result store. Not thread-safe on its own: callers serialize every
 * access to one session by synchronizing on the instance, which gives the slots a single writer.
 */
public final class SessionState {

    private final String sessionId;
    private final Instant createdAt;
    private final Map<AgentKind, String> correlationIds = new EnumMap<>(AgentKind.class);
    private final Map<AgentKind, ResultSlot> slots = new EnumMap<>(AgentKind.class);
    private final Map<AgentKind, AgentTask> trackedTasks = new EnumMap<>(AgentKind.class);
    private final Map<Integer, Boolean> swotVisibility = new HashMap<>();

    private ThreadPoolTaskExecutor agentPool;
    private StrategyReport strategyReport = StrategyReport.empty();
    private String finalStrategyError;

    public SessionState(String sessionId, Instant createdAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        correlationIds.put(AgentKind.WEBSEARCH, UUID.randomUUID().toString());
        correlationIds.put(AgentKind.FORECAST, UUID.randomUUID().toString());
        correlationIds.put(AgentKind.FINAL_STRATEGY, UUID.randomUUID().toString());
        for (AgentKind kind : AgentKind.values()) {
            slots.put(kind, ResultSlot.empty());
        }
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Correlation id sent to the given agent; stable for the whole session.
     *
     * @throws IllegalArgumentException for {@link AgentKind#RETRIEVAL}, which is not session-correlated
     */
    public String correlationId(AgentKind kind) {
        String id = correlationIds.get(kind);
        if (id == null) {
            throw new IllegalArgumentException("No correlation id for agent " + kind);
        }
        return id;
    }

    public Map<AgentKind, String> correlationIds() {
        return Collections.unmodifiableMap(correlationIds);
    }

    // ---- slots ----

    public ResultSlot slot(AgentKind kind) {
        return slots.get(kind);
    }

    public void commit(AgentResult result) {
        slots.put(result.kind(), ResultSlot.ready(result));
    }

    public void markUnavailable(AgentKind kind, UnavailableReason reason) {
        slots.put(kind, ResultSlot.unavailable(reason));
    }

    /**
     * Resets an unavailable slot to empty; a ready slot keeps its result.
     */
    public void clearUnavailable(AgentKind kind) {
        if (slots.get(kind).isUnavailable()) {
            slots.put(kind, ResultSlot.empty());
        }
    }

    // ---- tracked tasks ----

    /**
     * Starts tracking a task.
     *
     * @return the task previously tracked for the same agent, now abandoned, or null
     */
    public AgentTask track(AgentTask task) {
        return trackedTasks.put(task.kind(), task);
    }

    /**
     * Stops tracking {@code task} if it is still the tracked one for its agent.
     */
    public void untrack(AgentTask task) {
        trackedTasks.remove(task.kind(), task);
    }

    public AgentTask trackedTask(AgentKind kind) {
        return trackedTasks.get(kind);
    }

    public List<AgentTask> trackedTasks() {
        return new ArrayList<>(trackedTasks.values());
    }

    public boolean hasTrackedTasks() {
        return !trackedTasks.isEmpty();
    }

    // ---- worker pool ----

    public ThreadPoolTaskExecutor agentPool() {
        return agentPool;
    }

    /**
     * Installs the pool of the latest analysis.
     *
     * @return the previous pool, which the caller must shut down, or null
     */
    public ThreadPoolTaskExecutor replaceAgentPool(ThreadPoolTaskExecutor pool) {
        ThreadPoolTaskExecutor previous = this.agentPool;
        this.agentPool = pool;
        return previous;
    }

    // ---- final strategy ----

    public StrategyReport strategyReport() {
        return strategyReport;
    }

    public void setStrategyReport(StrategyReport strategyReport) {
        this.strategyReport = strategyReport == null ? StrategyReport.empty() : strategyReport;
    }

    public String finalStrategyError() {
        return finalStrategyError;
    }

    public void setFinalStrategyError(String finalStrategyError) {
        this.finalStrategyError = finalStrategyError;
    }

    // ---- SWOT visibility ----

    public boolean isSwotVisible(int emissionIndex) {
        return swotVisibility.getOrDefault(emissionIndex, Boolean.FALSE);
    }

    /**
     * Flips SWOT visibility for one strategy.
     *
     * @return the new visibility
     */
    public boolean toggleSwot(int emissionIndex) {
        boolean visible = !isSwotVisible(emissionIndex);
        swotVisibility.put(emissionIndex, visible);
        return visible;
    }

    public void resetSwotVisibility() {
        swotVisibility.clear();
    }
}
