package com.phillippitts.strategist.service.view;

import com.phillippitts.strategist.domain.Tier;

import java.util.Map;

/**
 * One ranked strategy as displayed.
 *
 * @param index       emission index; the key for SWOT toggling
 * @param scores      criterion label to score, only criteria that were present
 * @param swot        SWOT of this strategy; null unless {@code swotVisible}
 */
public record StrategyView(int index, int rank, Tier tier, String medal, String title, String description,
                           Map<String, Integer> scores, boolean swotVisible, SwotView swot) {
}
