package com.phillippitts.strategist.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One strategy recovered from the final strategy text.
 *
 * <p>The emission index is the number the model gave the strategy and stays attached to it
 * after ranking, so SWOT lookups never depend on display order.
 *
 * @param emissionIndex 1-based index as emitted
 * @param title         header text after {@code Strategy N:}
 * @param description   body text without the scores line and rule lines
 * @param scores        criteria found on the scores line, each within [0, 10]
 */
public record Strategy(int emissionIndex, String title, String description, Map<Criterion, Integer> scores) {

    public Strategy {
        if (emissionIndex < 1) {
            throw new IllegalArgumentException("emissionIndex must be >= 1, got: " + emissionIndex);
        }
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        EnumMap<Criterion, Integer> copy = new EnumMap<>(Criterion.class);
        if (scores != null) {
            scores.forEach((k, v) -> copy.put(Objects.requireNonNull(k), Criterion.clamp(v)));
        }
        scores = Collections.unmodifiableMap(copy);
    }

    /**
     * Optimality used for ranking; a missing value counts as 0.
     */
    public int optimalityOrZero() {
        return scores.getOrDefault(Criterion.OPTIMALITY, 0);
    }
}
