package com.phillippitts.strategist.service.parser;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Literal markers and line classifiers shared by the final strategy prompt and its parser.
 */
public final class StrategyMarkers {

    public static final String SWOT_START = "<!--SWOT_START-->";
    public static final String SWOT_END = "<!--SWOT_END-->";

    /** {@code ### Strategy 2: Title}; any heading level, tolerant of spacing and bold markers. */
    private static final Pattern STRATEGY_HEADER = Pattern.compile(
            "^\\s*#{1,6}\\s*\\**\\s*Strategy\\s*(\\d{1,3})\\s*[:.]\\s*(.*?)\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern RULE_LINE = Pattern.compile("^\\s*[-*_]{2,}\\s*$");

    private static final String[] RANKING_MARKERS = {
        "1\uFE0F\u20E3", "2\uFE0F\u20E3", "3\uFE0F\u20E3",
        "\uD83E\uDD47", "\uD83E\uDD48", "\uD83E\uDD49"
    };

    private StrategyMarkers() {
    }

    /**
     * Parsed strategy header line.
     *
     * @param index number written after {@code Strategy}
     * @param title remaining header text, bold markers removed
     */
    public record Header(int index, String title) {
    }

    /**
     * @return the header, or null if the line is not a strategy header
     */
    public static Header parseHeader(String line) {
        if (line == null) {
            return null;
        }
        Matcher m = STRATEGY_HEADER.matcher(line);
        if (!m.matches()) {
            return null;
        }
        int index;
        try {
            index = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        String title = m.group(2).replaceAll("^\\*+|\\*+$", "").trim();
        return new Header(index, title);
    }

    public static boolean isRuleLine(String line) {
        return line != null && RULE_LINE.matcher(line).matches();
    }

    /**
     * A ranking summary starts with a "Ranking" heading or an enumerated keycap/medal marker.
     * Everything from such a line on is dropped from the preamble and descriptions.
     */
    public static boolean isRankingSummaryLine(String line) {
        if (line == null) {
            return false;
        }
        String s = line.strip().replaceFirst("^[#*\\s]+", "");
        if (s.toLowerCase(Locale.ROOT).startsWith("ranking")) {
            return true;
        }
        for (String marker : RANKING_MARKERS) {
            if (s.startsWith(marker)) {
                return true;
            }
        }
        return false;
    }
}
