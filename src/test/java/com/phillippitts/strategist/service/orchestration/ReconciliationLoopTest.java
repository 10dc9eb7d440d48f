package com.phillippitts.strategist.service.orchestration;

import com.phillippitts.strategist.config.properties.AgentProperties;
import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.AgentResult;
import com.phillippitts.strategist.domain.ForecastResult;
import com.phillippitts.strategist.domain.WebsearchResult;
import com.phillippitts.strategist.exception.GatewayException;
import com.phillippitts.strategist.service.metrics.AgentMetrics;
import com.phillippitts.strategist.service.session.ResultSlot;
import com.phillippitts.strategist.service.session.SessionState;
import com.phillippitts.strategist.service.session.UnavailableReason;
import com.phillippitts.strategist.testutil.MutableClock;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ReconciliationLoopTest {

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private ReconciliationLoop loop;
    private SessionState session;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        registry = new SimpleMeterRegistry();
        loop = new ReconciliationLoop(new AgentProperties(), new AgentMetrics(registry), clock);
        session = new SessionState("s-1", clock.instant());
    }

    private AgentTask track(AgentKind kind, CompletableFuture<AgentResult> handle, Duration timeout) {
        AgentTask task = new AgentTask(kind, session.sessionId(), handle, clock.instant(), timeout);
        session.track(task);
        return task;
    }

    private double failures(AgentKind kind, String reason) {
        Counter counter = registry.find("strategist.agent.failure")
                .tag("agent", kind.metricName()).tag("reason", reason).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    void unresolvedWebsearchPastTimeoutPlusGraceIsUnavailableExactlyOnce() {
        AgentTask task = track(AgentKind.WEBSEARCH, new CompletableFuture<>(), Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(66));
        ReconcileOutcome outcome = loop.reconcile(session);
        loop.reconcile(session);

        assertThat(task.state()).isEqualTo(AgentTaskState.TIMED_OUT);
        assertThat(session.slot(AgentKind.WEBSEARCH).reason()).contains(UnavailableReason.TIMED_OUT);
        assertThat(session.hasTrackedTasks()).isFalse();
        assertThat(outcome.hasPending()).isFalse();
        assertThat(failures(AgentKind.WEBSEARCH, "timeout")).isEqualTo(1.0);
    }

    @Test
    void exactlyAtTimeoutPlusGraceStillPending() {
        track(AgentKind.WEBSEARCH, new CompletableFuture<>(), Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(65));
        ReconcileOutcome outcome = loop.reconcile(session);

        assertThat(outcome.pendingCount()).isEqualTo(1);
        assertThat(outcome.pollAfter()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void websearchResolvedAt64SecondsIsReadyNeverTimedOut() {
        CompletableFuture<AgentResult> handle = new CompletableFuture<>();
        AgentTask task = track(AgentKind.WEBSEARCH, handle, Duration.ofSeconds(60));
        WebsearchResult result = new WebsearchResult("{\"summary\":\"ok\"}", List.of());

        clock.advance(Duration.ofSeconds(64));
        handle.complete(result);
        loop.reconcile(session);
        clock.advance(Duration.ofSeconds(10));
        loop.reconcile(session);

        assertThat(task.state()).isEqualTo(AgentTaskState.READY);
        assertThat(session.slot(AgentKind.WEBSEARCH).result()).contains(result);
        assertThat(failures(AgentKind.WEBSEARCH, "timeout")).isZero();
    }

    @Test
    void pendingHandleAsksCallerToPollAgain() {
        track(AgentKind.FORECAST, new CompletableFuture<>(), Duration.ofSeconds(90));
        track(AgentKind.WEBSEARCH, new CompletableFuture<>(), Duration.ofSeconds(60));

        ReconcileOutcome outcome = loop.reconcile(session);

        assertThat(outcome.pendingCount()).isEqualTo(2);
        assertThat(session.slot(AgentKind.FORECAST).status()).isEqualTo(ResultSlot.Status.EMPTY);
    }

    @Test
    void failedHandleMarksSlotUnavailable() {
        CompletableFuture<AgentResult> handle = new CompletableFuture<>();
        AgentTask task = track(AgentKind.FORECAST, handle, Duration.ofSeconds(90));
        handle.completeExceptionally(new GatewayException(AgentKind.FORECAST, "HTTP 500"));

        loop.reconcile(session);

        assertThat(task.state()).isEqualTo(AgentTaskState.FAILED);
        assertThat(session.slot(AgentKind.FORECAST).reason()).contains(UnavailableReason.FAILED);
        assertThat(failures(AgentKind.FORECAST, "error")).isEqualTo(1.0);
    }

    @Test
    void readyResultClearsEarlierUnavailableFlag() {
        session.markUnavailable(AgentKind.FORECAST, UnavailableReason.TIMED_OUT);
        track(AgentKind.FORECAST, CompletableFuture.completedFuture(new ForecastResult("trends")), Duration.ofSeconds(90));

        loop.reconcile(session);

        assertThat(session.slot(AgentKind.FORECAST).isReady()).isTrue();
    }

    @Test
    void reconcilingTerminalTaskAgainChangesNothing() {
        CompletableFuture<AgentResult> handle = CompletableFuture.completedFuture(new ForecastResult("first"));
        AgentTask task = track(AgentKind.FORECAST, handle, Duration.ofSeconds(90));
        loop.reconcile(session);

        // re-tracking the same settled task simulates a stale reference
        session.track(task);
        loop.reconcile(session);

        assertThat(task.state()).isEqualTo(AgentTaskState.READY);
        assertThat(session.slot(AgentKind.FORECAST).result(ForecastResult.class))
                .hasValueSatisfying(r -> assertThat(r.answerText()).isEqualTo("first"));
        assertThat(session.hasTrackedTasks()).isFalse();
    }

    @Test
    void nothingTrackedReleasesSessionPool() {
        ThreadPoolTaskExecutor pool = mock(ThreadPoolTaskExecutor.class);
        session.replaceAgentPool(pool);

        ReconcileOutcome outcome = loop.reconcile(session);

        assertThat(outcome).isEqualTo(ReconcileOutcome.settled());
        assertThat(session.agentPool()).isNull();
        verify(pool).shutdown();
    }

    @Test
    void poolKeptWhileTasksPending() {
        ThreadPoolTaskExecutor pool = mock(ThreadPoolTaskExecutor.class);
        session.replaceAgentPool(pool);
        track(AgentKind.WEBSEARCH, new CompletableFuture<>(), Duration.ofSeconds(60));

        loop.reconcile(session);

        assertThat(session.agentPool()).isSameAs(pool);
    }
}
