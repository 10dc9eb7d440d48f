package com.phillippitts.strategist.service.metrics;

import com.phillippitts.strategist.domain.AgentKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for agent calls.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Call latency per agent, measured from submission to observed completion</li>
 *   <li>Success/failure counts per agent</li>
 *   <li>Timeouts and abandoned handles (superseded or orphaned calls still running)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class AgentMetrics {

    private static final String METRIC_PREFIX = "strategist.agent";

    private final MeterRegistry registry;

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(AgentKind agent, Duration duration) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time from agent call submission to observed completion")
                .tag("agent", agent.metricName())
                .register(registry)
                .record(duration);
    }

    public void incrementSuccess(AgentKind agent) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful agent calls")
                .tag("agent", agent.metricName())
                .register(registry)
                .increment();
    }

    /**
     * @param reason short failure reason (error, timeout, deadline)
     */
    public void incrementFailure(AgentKind agent, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed agent calls")
                .tag("agent", agent.metricName())
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts handles whose outcome will never be observed.
     *
     * @param cause superseded (new analysis) or orphaned (primary call failed)
     */
    public void incrementAbandoned(AgentKind agent, String cause) {
        Counter.builder(METRIC_PREFIX + ".abandoned")
                .description("Number of agent calls left running without a tracked handle")
                .tag("agent", agent.metricName())
                .tag("cause", cause)
                .register(registry)
                .increment();
    }
}
