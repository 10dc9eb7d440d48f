package com.phillippitts.strategist.service.orchestration;

import com.phillippitts.strategist.config.properties.AgentProperties;
import com.phillippitts.strategist.domain.AgentResult;
import com.phillippitts.strategist.service.metrics.AgentMetrics;
import com.phillippitts.strategist.service.session.SessionState;
import com.phillippitts.strategist.service.session.UnavailableReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Settles the background tasks of a session without ever blocking.
 *
 * <p>Per tracked task, in order:
 * <ol>
 *   <li>past {@code timeout + grace}: TIMED_OUT, slot becomes unavailable</li>
 *   <li>done with a value: READY, slot committed, unavailable flag cleared</li>
 *   <li>done with an error: FAILED, slot becomes unavailable</li>
 *   <li>otherwise still pending; the caller should poll again</li>
 * </ol>
 * Settled tasks stop being tracked. A pass that leaves nothing tracked releases the session pool.
 *
 * <p><b>Thread Safety:</b> callers must hold the session monitor.
 */
@Component
public class ReconciliationLoop {

    private static final Logger LOG = LogManager.getLogger(ReconciliationLoop.class);

    private final AgentProperties props;
    private final AgentMetrics metrics;
    private final Clock clock;

    public ReconciliationLoop(AgentProperties props, AgentMetrics metrics, Clock clock) {
        this.props = Objects.requireNonNull(props);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    public ReconcileOutcome reconcile(SessionState session) {
        Objects.requireNonNull(session, "session");
        int pending = 0;
        for (AgentTask task : session.trackedTasks()) {
            if (!settle(session, task)) {
                pending++;
            }
        }
        if (pending > 0) {
            return new ReconcileOutcome(pending, props.getPollInterval());
        }
        ThreadPoolTaskExecutor pool = session.replaceAgentPool(null);
        if (pool != null) {
            pool.shutdown();
            LOG.debug("No pending agents; session pool released");
        }
        return ReconcileOutcome.settled();
    }

    public Duration pollInterval() {
        return props.getPollInterval();
    }

    /**
     * @return true if the task is no longer pending
     */
    private boolean settle(SessionState session, AgentTask task) {
        if (task.state() != AgentTaskState.PENDING) {
            session.untrack(task);
            return true;
        }
        Instant now = clock.instant();
        if (task.isExpired(now, props.getGrace())) {
            if (task.complete(AgentTaskState.TIMED_OUT)) {
                session.markUnavailable(task.kind(), UnavailableReason.TIMED_OUT);
                metrics.incrementFailure(task.kind(), "timeout");
                LOG.warn("{} timed out after {} s", task.kind().metricName(), task.elapsed(now).toSeconds());
            }
            session.untrack(task);
            return true;
        }

        Future<? extends AgentResult> handle = task.handle();
        if (!handle.isDone()) {
            return false;
        }
        try {
            AgentResult result = handle.get();
            if (result == null) {
                fail(session, task, "gateway returned no result");
            } else if (task.complete(AgentTaskState.READY)) {
                session.commit(result);
                session.clearUnavailable(task.kind());
                metrics.incrementSuccess(task.kind());
                metrics.recordLatency(task.kind(), task.elapsed(now));
                LOG.info("{} ready after {} ms", task.kind().metricName(), task.elapsed(now).toMillis());
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            fail(session, task, cause.getMessage());
        } catch (CancellationException e) {
            fail(session, task, "cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        session.untrack(task);
        return true;
    }

    private void fail(SessionState session, AgentTask task, String message) {
        if (task.complete(AgentTaskState.FAILED)) {
            session.markUnavailable(task.kind(), UnavailableReason.FAILED);
            metrics.incrementFailure(task.kind(), "error");
            LOG.warn("{} failed: {}", task.kind().metricName(), message);
        }
    }
}
