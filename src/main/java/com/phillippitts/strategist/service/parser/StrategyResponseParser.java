package com.phillippitts.strategist.service.parser;

import com.phillippitts.strategist.domain.Criterion;
import com.phillippitts.strategist.domain.FinalStrategyResult;
import com.phillippitts.strategist.domain.Strategy;
import com.phillippitts.strategist.domain.StrategyReport;
import com.phillippitts.strategist.domain.SwotCategory;
import com.phillippitts.strategist.domain.SwotEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the free-form final strategy answer into {@link Strategy} and {@link SwotEntry} records.
 *
 * <p>The parser is a line-oriented state machine: it detects the SWOT sentinel markers, then
 * accumulates lines into sections at each strategy header, and inside SWOT sections accumulates
 * lines per category label. It never throws. Any irregularity (missing markers, missing scores
 * line, unknown labels, stray whitespace) degrades to partial or empty structures, and a report
 * without strategies is the explicit "nothing extractable" signal.
 *
 * <p>Thread-safe and stateless.
 */
@Component
public class StrategyResponseParser {

    private static final Logger LOG = LogManager.getLogger(StrategyResponseParser.class);

    private static final Pattern SCORE_PAIR = Pattern.compile(
            "\\b(Cost|Risk|Time|Effect|Optimality)\\s*[=:]\\s*(\\d{1,3})\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SWOT_LABEL = Pattern.compile(
            "^\\s*\\**\\s*([A-Z])\\s*\\**\\s*:\\s*\\**\\s*(.*)$");

    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-•]\\s*|\\*\\s+)(.*)$");

    /**
     * Main and SWOT blocks of one answer.
     *
     * @param main visible part, or the whole text when a marker is missing
     * @param swot part between the markers, empty when a marker is missing
     */
    public record Blocks(String main, String swot) {
    }

    /**
     * Splits text on the SWOT sentinel markers. Both markers must be present, in order.
     */
    public static Blocks split(String text) {
        String s = text == null ? "" : text;
        int start = s.indexOf(StrategyMarkers.SWOT_START);
        int end = start < 0 ? -1 : s.indexOf(StrategyMarkers.SWOT_END, start + StrategyMarkers.SWOT_START.length());
        if (start < 0 || end < 0) {
            return new Blocks(s.strip(), "");
        }
        String main = s.substring(0, start).strip();
        String swot = s.substring(start + StrategyMarkers.SWOT_START.length(), end).strip();
        return new Blocks(main, swot);
    }

    /**
     * Parses a gateway result, preferring the raw text so marker handling stays in one place.
     */
    public StrategyReport parse(FinalStrategyResult result) {
        if (result == null) {
            return StrategyReport.empty();
        }
        if (!result.rawText().isBlank()) {
            return parse(result.rawText());
        }
        return parse(result.mainText(), result.swotText());
    }

    public StrategyReport parse(String text) {
        Blocks blocks = split(text);
        return parse(blocks.main(), blocks.swot());
    }

    /**
     * Parses already separated blocks.
     *
     * @return a structurally valid report; empty when nothing could be extracted
     */
    public StrategyReport parse(String mainBlock, String swotBlock) {
        try {
            SectionedText main = sectionize(mainBlock);
            String preamble = joinTrimmed(untilRankingSummary(main.preamble()));

            List<Strategy> strategies = new ArrayList<>();
            List<Section> mainSections = main.sections();
            List<Integer> mainIndices = emissionIndices(mainSections);
            for (int i = 0; i < mainSections.size(); i++) {
                strategies.add(toStrategy(mainIndices.get(i), mainSections.get(i)));
            }

            Map<Integer, SwotEntry> swot = new LinkedHashMap<>();
            List<Section> swotSections = sectionize(swotBlock).sections();
            List<Integer> swotIndices = emissionIndices(swotSections);
            for (int i = 0; i < swotSections.size(); i++) {
                swot.put(swotIndices.get(i), toSwot(swotIndices.get(i), swotSections.get(i)));
            }

            StrategyReport report = new StrategyReport(preamble, strategies, swot);
            if (report.isEmpty()) {
                LOG.warn("Final strategy text contained no strategy sections ({} chars)",
                        mainBlock == null ? 0 : mainBlock.length());
            }
            return report;
        } catch (RuntimeException e) {
            LOG.warn("Final strategy text could not be parsed, returning empty report", e);
            return StrategyReport.empty();
        }
    }

    /**
     * Extracts criterion scores from one line. Accepts {@code Name=N} and {@code Name: N},
     * case-insensitive; the first occurrence of a criterion wins and values are clamped to [0, 10].
     */
    public static Map<Criterion, Integer> extractScores(String line) {
        Map<Criterion, Integer> scores = new EnumMap<>(Criterion.class);
        if (line == null) {
            return scores;
        }
        Matcher m = SCORE_PAIR.matcher(line);
        while (m.find()) {
            Criterion criterion = Criterion.fromLabel(m.group(1)).orElse(null);
            if (criterion == null || scores.containsKey(criterion)) {
                continue;
            }
            try {
                scores.put(criterion, Criterion.clamp(Integer.parseInt(m.group(2))));
            } catch (NumberFormatException ignored) {
                // omitted, like a missing criterion
            }
        }
        return scores;
    }

    // ---- strategies ----

    private Strategy toStrategy(int index, Section section) {
        List<String> body = untilRankingSummary(section.lines());

        int scoresLine = findScoresLine(body);
        Map<Criterion, Integer> scores;
        if (scoresLine >= 0) {
            scores = extractScores(body.get(scoresLine));
        } else {
            scores = new EnumMap<>(Criterion.class);
            for (String line : body) {
                extractScores(line).forEach(scores::putIfAbsent);
            }
        }

        List<String> description = new ArrayList<>();
        for (int i = 0; i < body.size(); i++) {
            String line = body.get(i);
            if (i == scoresLine || isScoresLabelLine(line) || StrategyMarkers.isRuleLine(line)) {
                continue;
            }
            description.add(line);
        }
        return new Strategy(index, section.title(), joinTrimmed(description), scores);
    }

    private static int findScoresLine(List<String> lines) {
        int fallback = -1;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (isScoresLabelLine(line) && !extractScores(line).isEmpty()) {
                return i;
            }
            if (fallback < 0 && extractScores(line).size() >= 2) {
                fallback = i;
            }
        }
        return fallback;
    }

    private static boolean isScoresLabelLine(String line) {
        String s = line.strip().replaceFirst("^[#*\\-\\s]+", "").toLowerCase(Locale.ROOT);
        return s.startsWith("scores");
    }

    // ---- SWOT ----

    private SwotEntry toSwot(int index, Section section) {
        Map<SwotCategory, List<String>> bullets = new EnumMap<>(SwotCategory.class);
        Set<SwotCategory> seen = EnumSet.noneOf(SwotCategory.class);
        SwotCategory current = null;

        for (String line : section.lines()) {
            Matcher label = SWOT_LABEL.matcher(line);
            String content = line;
            if (label.matches()) {
                SwotCategory category = SwotCategory.fromLetter(label.group(1).charAt(0));
                // an unknown label or a repeated category closes the current run
                current = category != null && seen.add(category) ? category : null;
                if (current != null) {
                    bullets.put(current, new ArrayList<>());
                }
                content = label.group(2);
            }
            if (current == null) {
                continue;
            }
            String bullet = bulletText(content);
            List<String> items = bullets.get(current);
            if (bullet != null && items.size() < SwotEntry.MAX_BULLETS) {
                items.add(bullet);
            }
        }
        return new SwotEntry(index, bullets);
    }

    private static String bulletText(String line) {
        Matcher m = BULLET.matcher(line);
        if (!m.matches()) {
            return null;
        }
        String text = m.group(1).strip();
        return text.isEmpty() ? null : text;
    }

    // ---- sectioning ----

    private record Section(int index, String title, List<String> lines) {
    }

    private record SectionedText(List<String> preamble, List<Section> sections) {
    }

    private static SectionedText sectionize(String block) {
        List<String> preamble = new ArrayList<>();
        List<Section> sections = new ArrayList<>();
        if (block == null || block.isBlank()) {
            return new SectionedText(preamble, sections);
        }
        List<String> current = preamble;
        for (String line : block.split("\\R", -1)) {
            StrategyMarkers.Header header = StrategyMarkers.parseHeader(line);
            if (header != null) {
                current = new ArrayList<>();
                sections.add(new Section(header.index(), header.title(), current));
            } else {
                current.add(line);
            }
        }
        return new SectionedText(preamble, sections);
    }

    /**
     * Header numbers as emitted; a missing, invalid or repeated number becomes one past the
     * highest index so far. Applied to both blocks so SWOT keys line up with the strategies.
     */
    private static List<Integer> emissionIndices(List<Section> sections) {
        List<Integer> indices = new ArrayList<>(sections.size());
        Set<Integer> used = new HashSet<>();
        int maxIndex = 0;
        for (Section section : sections) {
            int index = section.index();
            if (index < 1 || used.contains(index)) {
                index = maxIndex + 1;
            }
            used.add(index);
            maxIndex = Math.max(maxIndex, index);
            indices.add(index);
        }
        return indices;
    }

    private static List<String> untilRankingSummary(List<String> lines) {
        List<String> kept = new ArrayList<>();
        for (String line : lines) {
            if (StrategyMarkers.isRankingSummaryLine(line)) {
                break;
            }
            kept.add(line);
        }
        return kept;
    }

    private static String joinTrimmed(List<String> lines) {
        return String.join("\n", lines).strip();
    }
}
