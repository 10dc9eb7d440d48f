package com.phillippitts.strategist.service.view;

import java.util.List;

/**
 * @param strategies         strategies in display (rank) order
 * @param nothingExtractable true when a result exists but no strategy could be parsed from it
 * @param error              message of the last failed call, or null
 */
public record FinalStrategyView(AgentView agent, String preamble, List<StrategyView> strategies,
                                boolean nothingExtractable, String error) {
}
