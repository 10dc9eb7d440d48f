package com.phillippitts.strategist.service.ranking;

import com.phillippitts.strategist.domain.Criterion;
import com.phillippitts.strategist.domain.RankedStrategy;
import com.phillippitts.strategist.domain.Strategy;
import com.phillippitts.strategist.domain.StrategyReport;
import com.phillippitts.strategist.domain.SwotCategory;
import com.phillippitts.strategist.domain.SwotEntry;
import com.phillippitts.strategist.domain.Tier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyRankerTest {

    private final StrategyRanker ranker = new StrategyRanker();

    private static Strategy strategy(int index, Integer optimality) {
        Map<Criterion, Integer> scores = optimality == null ? Map.of(Criterion.COST, 5)
                : Map.of(Criterion.OPTIMALITY, optimality);
        return new Strategy(index, "S" + index, "", scores);
    }

    @Test
    void ordersByOptimalityThenEmissionIndex() {
        List<RankedStrategy> ranked = ranker.rank(List.of(strategy(1, 7), strategy(2, 9), strategy(3, 9)));

        assertThat(ranked).extracting(RankedStrategy::emissionIndex).containsExactly(2, 3, 1);
        assertThat(ranked).extracting(RankedStrategy::rank).containsExactly(1, 2, 3);
        assertThat(ranked).extracting(RankedStrategy::tier).containsExactly(Tier.GOLD, Tier.SILVER, Tier.BRONZE);
    }

    @Test
    void missingOptimalityRanksAsZero() {
        List<RankedStrategy> ranked = ranker.rank(List.of(strategy(1, null), strategy(2, 0), strategy(3, 1)));

        assertThat(ranked).extracting(RankedStrategy::emissionIndex).containsExactly(3, 1, 2);
    }

    @Test
    void ranksBeyondThreeGetNoTier() {
        List<RankedStrategy> ranked = ranker.rank(List.of(strategy(1, 4), strategy(2, 3), strategy(3, 2), strategy(4, 1)));

        assertThat(ranked.get(3).tier()).isEqualTo(Tier.NONE);
        assertThat(ranked.get(3).tier().medal()).isEmpty();
    }

    @Test
    void swotLookupByEmissionIndexUnchangedByRanking() {
        SwotEntry second = new SwotEntry(2, Map.of(SwotCategory.STRENGTHS, List.of("partners")));
        StrategyReport report = new StrategyReport("", List.of(strategy(1, 7), strategy(2, 9), strategy(3, 9)),
                Map.of(2, second));
        SwotEntry before = report.swotFor(2);

        RankedStrategy top = ranker.rank(report.strategies()).get(0);

        assertThat(report.swotFor(top.emissionIndex())).isEqualTo(before);
        assertThat(report.swotFor(top.emissionIndex()).get(SwotCategory.STRENGTHS)).containsExactly("partners");
    }

    @Test
    void emptyInputYieldsEmptyRanking() {
        assertThat(ranker.rank(List.of())).isEmpty();
        assertThat(ranker.rank(null)).isEmpty();
    }
}
