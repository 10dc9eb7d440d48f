package com.phillippitts.strategist.exception;

import com.phillippitts.strategist.domain.AgentKind;

/**
 * Thrown when an agent call fails at the provider, network or protocol level.
 */
public class GatewayException extends StrategistException {

    private final AgentKind agentKind;

    public GatewayException(AgentKind agentKind, String message) {
        super(message + " (agent: " + agentKind.metricName() + ")");
        this.agentKind = agentKind;
    }

    public GatewayException(AgentKind agentKind, String message, Throwable cause) {
        super(message + " (agent: " + agentKind.metricName() + ")", cause);
        this.agentKind = agentKind;
    }

    public AgentKind getAgentKind() {
        return agentKind;
    }
}
