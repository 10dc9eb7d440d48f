package com.phillippitts.strategist.service.view;

import com.phillippitts.strategist.service.session.UnavailableReason;

/**
 * Status line shown for one agent.
 *
 * @param status current status
 * @param reason why the agent is unavailable; null otherwise
 * @param notice user-facing hint, empty when the result itself is shown
 */
public record AgentView(AgentStatus status, UnavailableReason reason, String notice) {

    public AgentView {
        notice = notice == null ? "" : notice;
    }
}
