package com.phillippitts.strategist.domain;

/**
 * Terminal output of one agent call.
 *
 * <p>Implementations are immutable records, one per {@link AgentKind}. Consumers switch on
 * {@link #kind()} or use {@code instanceof} pattern matching to reach the typed payload.
 */
public interface AgentResult {

    /**
     * @return the agent that produced this result
     */
    AgentKind kind();
}
