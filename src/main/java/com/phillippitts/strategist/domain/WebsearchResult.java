package com.phillippitts.strategist.domain;

import java.util.List;

/**
 * Output of the websearch agent.
 *
 * <p>{@code rawPayload} is deliberately untyped: providers return a JSON object, a JSON string,
 * a fenced code block or a double-encoded value. Use
 * {@link com.phillippitts.strategist.service.parser.PayloadUnwrapper} to read it.
 *
 * @param rawPayload provider payload as returned (JSONObject, Map or String), never null
 * @param sources    cited web sources
 */
public record WebsearchResult(Object rawPayload, List<SourceRef> sources) implements AgentResult {

    public WebsearchResult {
        rawPayload = rawPayload == null ? "" : rawPayload;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    @Override
    public AgentKind kind() {
        return AgentKind.WEBSEARCH;
    }
}
