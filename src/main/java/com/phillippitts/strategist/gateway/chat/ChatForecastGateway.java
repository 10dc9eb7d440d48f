package com.phillippitts.strategist.gateway.chat;

import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.ForecastResult;
import com.phillippitts.strategist.gateway.ForecastGateway;

import java.util.Objects;

/**
 * Forecast agent: proposes development options for the next one to three years.
 */
public class ChatForecastGateway implements ForecastGateway {

    static final String SYSTEM_PROMPT = """
            You are a foresight analyst. For the user's request, propose 3-5 concrete development \
            options for the next 1-3 years. For each option give a short title, the trend it builds \
            on, the expected effect and the main risk. Answer in Markdown.""";

    private final ChatCompletionClient client;

    public ChatForecastGateway(ChatCompletionClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public ForecastResult call(String correlationId, String query) {
        return new ForecastResult(client.complete(AgentKind.FORECAST, SYSTEM_PROMPT, query, correlationId));
    }
}
