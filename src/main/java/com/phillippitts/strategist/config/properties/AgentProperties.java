package com.phillippitts.strategist.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Timeouts owned by the analysis core.
 *
 * <p>Bound from {@code strategist.agents.*}. Every value falls back to its default when absent
 * and must be positive (grace may be zero).
 */
@Validated
@ConfigurationProperties(prefix = "strategist.agents")
public class AgentProperties {

    public static final Duration DEFAULT_PRIMARY_TIMEOUT = Duration.ofSeconds(120);
    public static final Duration DEFAULT_WEBSEARCH_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_FORECAST_TIMEOUT = Duration.ofSeconds(90);
    public static final Duration DEFAULT_GRACE = Duration.ofSeconds(5);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);

    /** Deadline of the one blocking wait on the retrieval call. */
    @NotNull
    private final Duration primaryTimeout;

    @NotNull
    private final Duration websearchTimeout;

    @NotNull
    private final Duration forecastTimeout;

    /** Extra time granted on top of a background timeout before a handle is abandoned. */
    @NotNull
    private final Duration grace;

    /** How long callers should wait before the next reconciliation pass. */
    @NotNull
    private final Duration pollInterval;

    @ConstructorBinding
    public AgentProperties(Duration primaryTimeout,
                           Duration websearchTimeout,
                           Duration forecastTimeout,
                           Duration grace,
                           Duration pollInterval) {
        this.primaryTimeout = positiveOrDefault(primaryTimeout, DEFAULT_PRIMARY_TIMEOUT, "primary-timeout");
        this.websearchTimeout = positiveOrDefault(websearchTimeout, DEFAULT_WEBSEARCH_TIMEOUT, "websearch-timeout");
        this.forecastTimeout = positiveOrDefault(forecastTimeout, DEFAULT_FORECAST_TIMEOUT, "forecast-timeout");
        if (grace != null && grace.isNegative()) {
            throw new IllegalArgumentException("strategist.agents.grace must not be negative");
        }
        this.grace = grace == null ? DEFAULT_GRACE : grace;
        this.pollInterval = positiveOrDefault(pollInterval, DEFAULT_POLL_INTERVAL, "poll-interval");
    }

    /**
     * Defaults for tests and manual instantiation.
     */
    public AgentProperties() {
        this(null, null, null, null, null);
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException("strategist.agents." + name + " must be positive");
        }
        return value;
    }

    public Duration getPrimaryTimeout() {
        return primaryTimeout;
    }

    public Duration getWebsearchTimeout() {
        return websearchTimeout;
    }

    public Duration getForecastTimeout() {
        return forecastTimeout;
    }

    public Duration getGrace() {
        return grace;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }
}
