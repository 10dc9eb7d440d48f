package com.phillippitts.strategist.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Score criteria emitted on each strategy's scores line, in emission order.
 */
public enum Criterion {
    COST("Cost"),
    RISK("Risk"),
    TIME("Time"),
    EFFECT("Effect"),
    OPTIMALITY("Optimality");

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 10;

    private final String label;

    Criterion(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Case-insensitive lookup by label.
     */
    public static Optional<Criterion> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Criterion c : values()) {
            if (c.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public static int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
