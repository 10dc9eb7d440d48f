package com.phillippitts.strategist.domain;

/**
 * The four external text-generation agents a session talks to.
 *
 * <p>{@link #RETRIEVAL} is the primary (blocking) call of an analysis, {@link #WEBSEARCH} and
 * {@link #FORECAST} run in the background, and {@link #FINAL_STRATEGY} depends on all three.
 */
public enum AgentKind {
    RETRIEVAL("retrieval"),
    WEBSEARCH("websearch"),
    FORECAST("forecast"),
    FINAL_STRATEGY("final-strategy");

    private final String metricName;

    AgentKind(String metricName) {
        this.metricName = metricName;
    }

    /**
     * Lower-case name used for metric tags and log lines.
     */
    public String metricName() {
        return metricName;
    }

    /**
     * Returns true for the agents that are tracked by the reconciliation loop.
     */
    public boolean isBackground() {
        return this == WEBSEARCH || this == FORECAST;
    }
}
