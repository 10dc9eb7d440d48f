package com.phillippitts.strategist.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * SWOT bullets for one strategy, keyed by the strategy's emission index (never its rank).
 */
public record SwotEntry(int strategyIndex, Map<SwotCategory, List<String>> bullets) {

    public static final int MAX_BULLETS = 5;

    public SwotEntry {
        EnumMap<SwotCategory, List<String>> copy = new EnumMap<>(SwotCategory.class);
        for (SwotCategory c : SwotCategory.values()) {
            List<String> items = bullets == null ? null : bullets.get(c);
            if (items == null) {
                copy.put(c, List.of());
            } else {
                copy.put(c, List.copyOf(items.size() > MAX_BULLETS ? items.subList(0, MAX_BULLETS) : items));
            }
        }
        bullets = Collections.unmodifiableMap(copy);
    }

    public static SwotEntry empty(int strategyIndex) {
        return new SwotEntry(strategyIndex, Map.of());
    }

    public List<String> get(SwotCategory category) {
        return bullets.get(category);
    }

    public boolean isEmpty() {
        return bullets.values().stream().allMatch(List::isEmpty);
    }
}
