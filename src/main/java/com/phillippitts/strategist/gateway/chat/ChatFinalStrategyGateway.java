package com.phillippitts.strategist.gateway.chat;

import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.FinalStrategyResult;
import com.phillippitts.strategist.gateway.FinalStrategyGateway;
import com.phillippitts.strategist.service.parser.StrategyMarkers;
import com.phillippitts.strategist.service.parser.StrategyResponseParser;

import java.util.List;
import java.util.Objects;

/**
 * Final strategist: merges internal findings, external cases and forecasts into three scored
 * strategies plus a SWOT block hidden behind sentinel markers.
 */
public class ChatFinalStrategyGateway implements FinalStrategyGateway {

    static final String SYSTEM_PROMPT = """
            You are the organization's strategy agent. From three sources (internal data, external \
            cases of other universities, forecast ideas) build 3 final strategies and, separately, a \
            SWOT analysis for each.

            Rules:
            1) Use only the data provided, invent nothing.
            2) Strategies must build on what the organization already has (internal data).
            3) Take external cases and forecast ideas into account.
            4) Score every strategy on 5 criteria from 0 to 10:
               - Cost (10 = very expensive)
               - Risk (10 = very risky)
               - Time (10 = takes long to implement)
               - Effect (10 = maximum effect)
               - Optimality (overall score)
            5) Rank the strategies by optimality (1 = most preferable).
            6) Do NOT put SWOT in the main block. Put SWOT in a separate block between the markers.

            Answer in clean Markdown with exactly this structure:

            ## Final strategies

            ### Strategy 1: <title>
            Short description (3-6 sentences).
            Scores (0-10): Cost=X; Risk=Y; Time=Z; Effect=W; Optimality=O

            ### Strategy 2: ...

            ### Strategy 3: ...

            %s
            ## SWOT
            ### Strategy 1: <title>
            S:
            - 2-3 points, each on its own line starting with "- "
            W:
            - ...
            O:
            - ...
            T:
            - ...

            ### Strategy 2: ...

            ### Strategy 3: ...
            %s

            Do not output JSON. Do not mention missing sources.""".formatted(
            StrategyMarkers.SWOT_START, StrategyMarkers.SWOT_END);

    private final ChatCompletionClient client;

    public ChatFinalStrategyGateway(ChatCompletionClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public FinalStrategyResult call(String retrievalSummary, String webSummary, List<String> webBullets,
                                    String forecastText) {
        String content = client.complete(AgentKind.FINAL_STRATEGY, SYSTEM_PROMPT,
                userPrompt(retrievalSummary, webSummary, webBullets, forecastText), null);
        StrategyResponseParser.Blocks blocks = StrategyResponseParser.split(content);
        return new FinalStrategyResult(blocks.main(), blocks.swot(), content);
    }

    static String userPrompt(String retrievalSummary, String webSummary, List<String> webBullets,
                             String forecastText) {
        String facts = webBullets == null || webBullets.isEmpty() ? "—" : String.join("; ", webBullets);
        return """
                Data for the analysis:

                1) Internal data (retrieval):
                %s

                Put the most weight on the internal data. Strategies must build on what the \
                organization already has.

                2) External cases of other universities (websearch):
                Overview:
                %s
                Key facts:
                %s

                3) Forecast ideas (forecast agent):
                %s
                """.formatted(nullToEmpty(retrievalSummary), nullToEmpty(webSummary), facts,
                nullToEmpty(forecastText));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
