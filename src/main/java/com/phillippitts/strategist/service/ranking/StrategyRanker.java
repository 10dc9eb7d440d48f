package com.phillippitts.strategist.service.ranking;

import com.phillippitts.strategist.domain.RankedStrategy;
import com.phillippitts.strategist.domain.Strategy;
import com.phillippitts.strategist.domain.Tier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders strategies for display.
 *
 * <p>Sort key: optimality descending (a missing optimality counts as 0), ties broken by
 * ascending emission index. Ranks are assigned 1..N and the first three get a medal tier.
 * The emission index travels with every record, so SWOT lookups stay correct after reordering.
 */
@Component
public class StrategyRanker {

    static final Comparator<Strategy> DISPLAY_ORDER = Comparator
            .comparingInt(Strategy::optimalityOrZero).reversed()
            .thenComparingInt(Strategy::emissionIndex);

    public List<RankedStrategy> rank(List<Strategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            return List.of();
        }
        List<Strategy> sorted = new ArrayList<>(strategies);
        sorted.sort(DISPLAY_ORDER);

        List<RankedStrategy> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            int rank = i + 1;
            ranked.add(new RankedStrategy(sorted.get(i), rank, Tier.forRank(rank)));
        }
        return List.copyOf(ranked);
    }
}
