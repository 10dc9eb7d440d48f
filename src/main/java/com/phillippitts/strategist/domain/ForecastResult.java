package com.phillippitts.strategist.domain;

/**
 * Output of the forecast agent: free text with 1-3 year development options.
 */
public record ForecastResult(String answerText) implements AgentResult {

    public ForecastResult {
        answerText = answerText == null ? "" : answerText;
    }

    @Override
    public AgentKind kind() {
        return AgentKind.FORECAST;
    }
}
