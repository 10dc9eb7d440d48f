package com.phillippitts.strategist.domain;

import java.util.List;
import java.util.Map;

/**
 * Structured form of one final strategy answer.
 *
 * <p>Always structurally valid. {@link #isEmpty()} is the explicit "nothing extractable"
 * condition callers render a fallback notice for.
 *
 * @param preamble     text before the first strategy header, ranking summary removed
 * @param strategies   strategies in emission order
 * @param swotByIndex  SWOT entries keyed by emission index
 */
public record StrategyReport(String preamble, List<Strategy> strategies, Map<Integer, SwotEntry> swotByIndex) {

    public StrategyReport {
        preamble = preamble == null ? "" : preamble;
        strategies = strategies == null ? List.of() : List.copyOf(strategies);
        swotByIndex = swotByIndex == null ? Map.of() : Map.copyOf(swotByIndex);
    }

    public static StrategyReport empty() {
        return new StrategyReport("", List.of(), Map.of());
    }

    public boolean isEmpty() {
        return strategies.isEmpty();
    }

    /**
     * SWOT for the given emission index, or an empty entry when the model omitted it.
     */
    public SwotEntry swotFor(int emissionIndex) {
        SwotEntry entry = swotByIndex.get(emissionIndex);
        return entry != null ? entry : SwotEntry.empty(emissionIndex);
    }
}
