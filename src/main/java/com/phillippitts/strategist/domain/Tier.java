package com.phillippitts.strategist.domain;

/**
 * Marker given to the three best-ranked strategies.
 */
public enum Tier {
    GOLD("🥇"),
    SILVER("🥈"),
    BRONZE("🥉"),
    NONE("");

    private final String medal;

    Tier(String medal) {
        this.medal = medal;
    }

    public String medal() {
        return medal;
    }

    public static Tier forRank(int rank) {
        return switch (rank) {
            case 1 -> GOLD;
            case 2 -> SILVER;
            case 3 -> BRONZE;
            default -> NONE;
        };
    }
}
