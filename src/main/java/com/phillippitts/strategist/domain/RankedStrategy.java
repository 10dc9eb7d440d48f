package com.phillippitts.strategist.domain;

import java.util.Objects;

/**
 * A strategy in display order.
 *
 * @param strategy the parsed strategy (carries its emission index)
 * @param rank     1-based display rank
 * @param tier     medal for ranks 1-3, {@link Tier#NONE} otherwise
 */
public record RankedStrategy(Strategy strategy, int rank, Tier tier) {

    public RankedStrategy {
        Objects.requireNonNull(strategy, "strategy");
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1, got: " + rank);
        }
        tier = tier == null ? Tier.NONE : tier;
    }

    public int emissionIndex() {
        return strategy.emissionIndex();
    }
}
