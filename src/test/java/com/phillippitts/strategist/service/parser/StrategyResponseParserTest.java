package com.phillippitts.strategist.service.parser;

import com.phillippitts.strategist.domain.Criterion;
import com.phillippitts.strategist.domain.FinalStrategyResult;
import com.phillippitts.strategist.domain.Strategy;
import com.phillippitts.strategist.domain.StrategyReport;
import com.phillippitts.strategist.domain.SwotCategory;
import com.phillippitts.strategist.domain.SwotEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class StrategyResponseParserTest {

    private static final String FULL_ANSWER = """
            ## Final strategies

            ### Strategy 1: Expand online programs
            Build on the existing LMS and recorded lectures.
            Scores (0-10): Cost=4; Risk=3; Time=5; Effect=8; Optimality=7
            ---

            ### Strategy 2: **Industry partnerships**
            Co-funded labs with regional employers.
            Scores (0-10): Cost: 6, Risk: 4, Time: 6, Effect: 9, Optimality: 9

            ### Strategy 3: Dormitory renovation
            Renovate two dormitories.
            Scores: Cost=9; Risk=5; Time=8; Effect=6; Optimality=9

            Ranking summary:
            1️⃣ Strategy 2
            <!--SWOT_START-->
            ## SWOT
            ### Strategy 1: Expand online programs
            S:
            - existing LMS
            - trained staff
            W:
            - weak marketing
            O:
            - remote learners
            T:
            - competitors

            ### Strategy 2: Industry partnerships
            S: - strong regional ties
            W:
            - slow contracts
            O:
            - joint grants
            T:
            - employer churn
            <!--SWOT_END-->
            """;

    private final StrategyResponseParser parser = new StrategyResponseParser();

    @Test
    void parsesStrategiesWithTitlesScoresAndDescriptions() {
        StrategyReport report = parser.parse(FULL_ANSWER);

        assertThat(report.preamble()).isEqualTo("## Final strategies");
        assertThat(report.strategies()).extracting(Strategy::emissionIndex).containsExactly(1, 2, 3);
        assertThat(report.strategies()).extracting(Strategy::title)
                .containsExactly("Expand online programs", "Industry partnerships", "Dormitory renovation");

        Strategy first = report.strategies().get(0);
        assertThat(first.description()).isEqualTo("Build on the existing LMS and recorded lectures.");
        assertThat(first.scores()).containsEntry(Criterion.COST, 4)
                .containsEntry(Criterion.OPTIMALITY, 7)
                .hasSize(5);
    }

    @Test
    void descriptionStopsAtRankingSummary() {
        Strategy third = parser.parse(FULL_ANSWER).strategies().get(2);

        assertThat(third.description()).isEqualTo("Renovate two dormitories.");
    }

    @Test
    void equalsAndColonDelimitersYieldIdenticalScores() {
        Map<Criterion, Integer> equals = StrategyResponseParser.extractScores("Cost=3; Risk=2");
        Map<Criterion, Integer> colon = StrategyResponseParser.extractScores("cost: 3, RISK: 2");

        assertThat(equals).isEqualTo(colon).containsEntry(Criterion.COST, 3);
    }

    @Test
    void scoresAreClampedAndMissingCriteriaOmitted() {
        Map<Criterion, Integer> scores = StrategyResponseParser.extractScores("Cost=15; Effect=7");

        assertThat(scores).containsEntry(Criterion.COST, 10)
                .containsEntry(Criterion.EFFECT, 7)
                .doesNotContainKey(Criterion.OPTIMALITY);
    }

    @Test
    void firstOccurrenceOfCriterionWins() {
        assertThat(StrategyResponseParser.extractScores("Risk=2; Risk=8")).containsEntry(Criterion.RISK, 2);
    }

    @Test
    void swotIsKeyedByEmissionIndexAndOnlyBulletsAreKept() {
        StrategyReport report = parser.parse(FULL_ANSWER);

        SwotEntry first = report.swotFor(1);
        assertThat(first.get(SwotCategory.STRENGTHS)).containsExactly("existing LMS", "trained staff");
        assertThat(first.get(SwotCategory.THREATS)).containsExactly("competitors");

        SwotEntry second = report.swotFor(2);
        assertThat(second.get(SwotCategory.STRENGTHS)).containsExactly("strong regional ties");
        assertThat(second.get(SwotCategory.OPPORTUNITIES)).containsExactly("joint grants");
    }

    @Test
    void missingSwotSectionYieldsEmptyEntry() {
        assertThat(parser.parse(FULL_ANSWER).swotFor(3).isEmpty()).isTrue();
    }

    @Test
    void swotBulletsAreCappedAtFive() {
        String text = """
                ### Strategy 1: A
                Scores: Cost=1; Optimality=2
                <!--SWOT_START-->
                ### Strategy 1: A
                S:
                - one
                * two
                • three
                - four
                - five
                - six
                W: plain text without a bullet
                <!--SWOT_END-->
                """;

        SwotEntry entry = parser.parse(text).swotFor(1);

        assertThat(entry.get(SwotCategory.STRENGTHS)).containsExactly("one", "two", "three", "four", "five");
        assertThat(entry.get(SwotCategory.WEAKNESSES)).isEmpty();
    }

    @Test
    void missingEndMarkerTreatsWholeTextAsMainBlock() {
        String text = """
                ### Strategy 1: Only one
                Scores: Optimality=5; Cost=2
                <!--SWOT_START-->
                ### Strategy 2: Looks like a strategy
                S:
                - hidden
                """;

        StrategyReport report = parser.parse(text);

        assertThat(report.strategies()).hasSize(2);
        assertThat(report.swotByIndex()).isEmpty();
    }

    @Test
    void duplicateHeaderNumbersGetFreshIndices() {
        String text = """
                ### Strategy 1: First
                Scores: Optimality=5; Cost=2
                ### Strategy 1: Second
                Scores: Optimality=6; Cost=2
                """;

        assertThat(parser.parse(text).strategies()).extracting(Strategy::emissionIndex).containsExactly(1, 2);
    }

    @Test
    void renumberedStrategyKeepsItsOwnSwot() {
        String text = """
                ### Strategy 1: First
                Scores: Optimality=5; Cost=2
                ### Strategy 1: Second
                Scores: Optimality=6; Cost=2
                <!--SWOT_START-->
                ### Strategy 1: First
                S:
                - cheap
                ### Strategy 1: Second
                S:
                - fast
                <!--SWOT_END-->
                """;

        StrategyReport report = parser.parse(text);

        assertThat(report.swotFor(1).get(SwotCategory.STRENGTHS)).containsExactly("cheap");
        assertThat(report.swotFor(2).get(SwotCategory.STRENGTHS)).containsExactly("fast");
        assertThat(report.swotFor(2).strategyIndex()).isEqualTo(2);
    }

    @Test
    void scoresFoundOnUnlabelledLineWithSeveralPairs() {
        String text = """
                ### Strategy 1: Plain
                Some description.
                Cost=2 Risk=3 Optimality=8
                """;

        Strategy strategy = parser.parse(text).strategies().get(0);

        assertThat(strategy.optimalityOrZero()).isEqualTo(8);
        assertThat(strategy.description()).isEqualTo("Some description.");
    }

    @Test
    void resultPrefersRawText() {
        FinalStrategyResult result = new FinalStrategyResult("ignored", "", "### Strategy 1: Raw\nScores: Optimality=3; Cost=1");

        assertThat(parser.parse(result).strategies()).extracting(Strategy::title).containsExactly("Raw");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "no headers at all", "### Strategy : missing number", "<!--SWOT_END--><!--SWOT_START-->"})
    void malformedInputNeverThrowsAndYieldsEmptyReport(String text) {
        assertThatCode(() -> parser.parse(text)).doesNotThrowAnyException();
        assertThat(parser.parse(text).isEmpty()).isTrue();
    }

    @Test
    void splitRequiresBothMarkersInOrder() {
        StrategyResponseParser.Blocks blocks = StrategyResponseParser.split("main <!--SWOT_START-->swot<!--SWOT_END--> tail");

        assertThat(blocks.main()).isEqualTo("main");
        assertThat(blocks.swot()).isEqualTo("swot");
        assertThat(StrategyResponseParser.split("a <!--SWOT_END--> b <!--SWOT_START-->").swot()).isEmpty();
    }
}
