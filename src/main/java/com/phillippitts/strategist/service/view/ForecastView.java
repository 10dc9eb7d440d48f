package com.phillippitts.strategist.service.view;

public record ForecastView(AgentView agent, String text) {
}
