package com.phillippitts.strategist.service.session;

import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.FinalStrategyResult;
import com.phillippitts.strategist.domain.ForecastResult;
import com.phillippitts.strategist.domain.RetrievalResult;
import com.phillippitts.strategist.domain.WebsearchDigest;
import com.phillippitts.strategist.domain.WebsearchResult;
import com.phillippitts.strategist.exception.GatewayException;
import com.phillippitts.strategist.gateway.FinalStrategyGateway;
import com.phillippitts.strategist.service.metrics.AgentMetrics;
import com.phillippitts.strategist.service.parser.PayloadUnwrapper;
import com.phillippitts.strategist.service.parser.StrategyResponseParser;
import com.phillippitts.strategist.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-side access to the result slots, including the dependent final strategy call.
 *
 * <p>The final strategy is triggered at read time: the first inspection that finds Retrieval,
 * Websearch and Forecast all READY, with a non-blank retrieval answer, makes one synchronous
 * gateway call and commits the result.
 * A populated slot is never triggered again. A failed call leaves the slot empty and is retried
 * by the next inspection.
 *
 * <p><b>Thread Safety:</b> callers must hold the session monitor.
 */
@Component
public class ResultStore {

    private static final Logger LOG = LogManager.getLogger(ResultStore.class);

    private final FinalStrategyGateway finalStrategy;
    private final PayloadUnwrapper unwrapper;
    private final StrategyResponseParser parser;
    private final AgentMetrics metrics;

    public ResultStore(FinalStrategyGateway finalStrategy, PayloadUnwrapper unwrapper,
                       StrategyResponseParser parser, AgentMetrics metrics) {
        this.finalStrategy = Objects.requireNonNull(finalStrategy);
        this.unwrapper = Objects.requireNonNull(unwrapper);
        this.parser = Objects.requireNonNull(parser);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Triggers the final strategy call when its inputs are complete.
     *
     * @return true if this call committed a new final strategy result
     */
    public boolean inspectFinalStrategy(SessionState session) {
        if (session.slot(AgentKind.FINAL_STRATEGY).isReady()) {
            return false;
        }
        Optional<RetrievalResult> retrieval = session.slot(AgentKind.RETRIEVAL).result(RetrievalResult.class);
        Optional<WebsearchResult> web = session.slot(AgentKind.WEBSEARCH).result(WebsearchResult.class);
        Optional<ForecastResult> forecast = session.slot(AgentKind.FORECAST).result(ForecastResult.class);
        if (retrieval.isEmpty() || web.isEmpty() || forecast.isEmpty()) {
            return false;
        }
        if (retrieval.get().answerText().isBlank()) {
            return false;
        }

        WebsearchDigest digest = websearchDigest(web.get());
        long t0 = System.nanoTime();
        FinalStrategyResult result;
        try {
            result = finalStrategy.call(retrieval.get().answerText(), digest.summary(), digest.bullets(),
                    forecast.get().answerText());
        } catch (GatewayException e) {
            LOG.warn("Final strategy call failed: {}", e.getMessage());
            metrics.incrementFailure(AgentKind.FINAL_STRATEGY, "error");
            session.setFinalStrategyError(e.getMessage());
            return false;
        }
        if (result == null) {
            session.setFinalStrategyError("Final strategy agent returned no result");
            metrics.incrementFailure(AgentKind.FINAL_STRATEGY, "error");
            return false;
        }
        long ms = TimeUtils.elapsedMillis(t0);
        metrics.recordLatency(AgentKind.FINAL_STRATEGY, Duration.ofMillis(ms));
        metrics.incrementSuccess(AgentKind.FINAL_STRATEGY);
        LOG.info("Final strategy built in {} ms", ms);

        session.commit(result);
        session.setFinalStrategyError(null);
        session.setStrategyReport(parser.parse(result));
        session.resetSwotVisibility();
        return true;
    }

    /**
     * Decoded websearch payload; the raw payload doubles as display text when it holds no JSON.
     */
    public WebsearchDigest websearchDigest(WebsearchResult result) {
        return unwrapper.unwrap(result.rawPayload());
    }
}
