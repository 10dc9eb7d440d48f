package com.phillippitts.strategist.service.orchestration;

import com.phillippitts.strategist.config.properties.AgentProperties;
import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.AgentResult;
import com.phillippitts.strategist.domain.Document;
import com.phillippitts.strategist.domain.RetrievalResult;
import com.phillippitts.strategist.exception.AnalysisFailedException;
import com.phillippitts.strategist.gateway.ForecastGateway;
import com.phillippitts.strategist.gateway.RetrievalGateway;
import com.phillippitts.strategist.gateway.WebsearchGateway;
import com.phillippitts.strategist.service.metrics.AgentMetrics;
import com.phillippitts.strategist.service.session.SessionState;
import com.phillippitts.strategist.util.LogSanitizer;
import com.phillippitts.strategist.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Default implementation of {@link TaskOrchestrator}.
 *
 * <p>Key features:
 * <ul>
 *   <li><b>Parallel start:</b> all three calls are submitted before the primary is awaited</li>
 *   <li><b>Bounded wait:</b> only the primary call is awaited, up to
 *       {@code strategist.agents.primary-timeout}</li>
 *   <li><b>No cancellation:</b> superseded and orphaned calls run to completion; only tracking
 *       stops</li>
 * </ul>
 *
 * <p><b>Thread Model:</b> every analysis gets its own pool from {@link AgentExecutorFactory}.
 * On success the pool becomes the session pool and the previous one is shut down without
 * interrupting its workers. On failure the pool is shut down the same way right away.
 */
@Service
public class DefaultTaskOrchestrator implements TaskOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultTaskOrchestrator.class);

    private final RetrievalGateway retrieval;
    private final WebsearchGateway websearch;
    private final ForecastGateway forecast;
    private final AgentExecutorFactory executorFactory;
    private final AgentProperties props;
    private final AgentMetrics metrics;
    private final Clock clock;

    public DefaultTaskOrchestrator(RetrievalGateway retrieval,
                                   WebsearchGateway websearch,
                                   ForecastGateway forecast,
                                   AgentExecutorFactory executorFactory,
                                   AgentProperties props,
                                   AgentMetrics metrics,
                                   Clock clock) {
        this.retrieval = Objects.requireNonNull(retrieval);
        this.websearch = Objects.requireNonNull(websearch);
        this.forecast = Objects.requireNonNull(forecast);
        this.executorFactory = Objects.requireNonNull(executorFactory);
        this.props = Objects.requireNonNull(props);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public AnalysisStart startAnalysis(SessionState session, AnalysisRequest request) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(request, "request");
        LOG.info("Starting analysis: query='{}'", LogSanitizer.preview(request.query()));

        ThreadPoolTaskExecutor pool = executorFactory.create();
        Instant submittedAt = clock.instant();
        String websearchCid = session.correlationId(AgentKind.WEBSEARCH);
        String forecastCid = session.correlationId(AgentKind.FORECAST);

        CompletableFuture<RetrievalResult> primary =
                submit(pool, AgentKind.RETRIEVAL, () -> runRetrieval(request));
        CompletableFuture<AgentResult> websearchHandle =
                submit(pool, AgentKind.WEBSEARCH, () -> websearch.call(websearchCid, request.enrichedQuery()));
        CompletableFuture<AgentResult> forecastHandle =
                submit(pool, AgentKind.FORECAST, () -> forecast.call(forecastCid, request.enrichedQuery()));

        RetrievalResult result = awaitPrimary(session, pool, primary);
        // background deadlines run from the end of the primary wait
        Instant trackedFrom = clock.instant();

        AnalysisStart start;
        if (result.documents().isEmpty() || result.answerText().isBlank()) {
            LOG.info("Primary call produced no answer ({} documents)", result.documents().size());
            start = new AnalysisStart(AnalysisStart.PrimaryOutcome.NOTHING_FOUND, result);
        } else {
            session.commit(result);
            start = new AnalysisStart(AnalysisStart.PrimaryOutcome.COMMITTED, result);
        }
        metrics.incrementSuccess(AgentKind.RETRIEVAL);
        metrics.recordLatency(AgentKind.RETRIEVAL, Duration.between(submittedAt, trackedFrom));

        session.clearUnavailable(AgentKind.WEBSEARCH);
        session.clearUnavailable(AgentKind.FORECAST);
        track(session, new AgentTask(AgentKind.WEBSEARCH, session.sessionId(), websearchHandle,
                trackedFrom, props.getWebsearchTimeout()));
        track(session, new AgentTask(AgentKind.FORECAST, session.sessionId(), forecastHandle,
                trackedFrom, props.getForecastTimeout()));

        ThreadPoolTaskExecutor previous = session.replaceAgentPool(pool);
        if (previous != null && previous != pool) {
            previous.shutdown();
            LOG.debug("Previous agent pool released");
        }
        return start;
    }

    private RetrievalResult awaitPrimary(SessionState session, ThreadPoolTaskExecutor pool,
                                         CompletableFuture<RetrievalResult> primary) {
        long timeoutMs = props.getPrimaryTimeout().toMillis();
        try {
            RetrievalResult result = primary.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new IllegalStateException("Retrieval gateway returned no result");
            }
            return result;
        } catch (TimeoutException te) {
            LOG.warn("Primary call overran its {} ms deadline", timeoutMs);
            metrics.incrementFailure(AgentKind.RETRIEVAL, "deadline");
            throw orphan(session, pool, te);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause() != null ? ee.getCause() : ee;
            LOG.warn("Primary call failed: {}", cause.getMessage(), cause);
            metrics.incrementFailure(AgentKind.RETRIEVAL, "error");
            throw orphan(session, pool, cause);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            metrics.incrementFailure(AgentKind.RETRIEVAL, "interrupted");
            throw orphan(session, pool, ie);
        } catch (RuntimeException re) {
            LOG.warn("Primary call failed: {}", re.getMessage(), re);
            metrics.incrementFailure(AgentKind.RETRIEVAL, "error");
            throw orphan(session, pool, re);
        }
    }

    /**
     * The background calls of a failed analysis keep running but are never tracked.
     */
    private AnalysisFailedException orphan(SessionState session, ThreadPoolTaskExecutor pool, Throwable cause) {
        metrics.incrementAbandoned(AgentKind.WEBSEARCH, "orphaned");
        metrics.incrementAbandoned(AgentKind.FORECAST, "orphaned");
        pool.shutdown();
        return new AnalysisFailedException(session.sessionId(), cause);
    }

    private void track(SessionState session, AgentTask task) {
        AgentTask superseded = session.track(task);
        if (superseded != null && superseded.state() == AgentTaskState.PENDING) {
            LOG.info("{} handle superseded by a new analysis; earlier call left running",
                    task.kind().metricName());
            metrics.incrementAbandoned(task.kind(), "superseded");
        }
    }

    private RetrievalResult runRetrieval(AnalysisRequest request) {
        List<Document> documents = retrieval.search(request.searchQuery(), request.query());
        if (documents == null || documents.isEmpty()) {
            return new RetrievalResult("", List.of(), List.of());
        }
        String answer = retrieval.generate(request.query(), documents);
        return new RetrievalResult(answer == null ? "" : answer, documents,
                retrieval.topSources(documents));
    }

    private static <T> CompletableFuture<T> submit(ThreadPoolTaskExecutor pool, AgentKind kind, Supplier<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            long t0 = System.nanoTime();
            try {
                return call.get();
            } finally {
                LOG.debug("{} call returned after {} ms", kind.metricName(), TimeUtils.elapsedMillis(t0));
            }
        }, pool);
    }
}
