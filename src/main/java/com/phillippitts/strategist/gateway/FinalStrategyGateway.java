package com.phillippitts.strategist.gateway;

import com.phillippitts.strategist.domain.FinalStrategyResult;

import java.util.List;

/**
 * Aggregates the three upstream answers into three scored strategies with SWOT.
 *
 * <p>The returned text follows the format parsed by
 * {@link com.phillippitts.strategist.service.parser.StrategyResponseParser}.
 */
public interface FinalStrategyGateway {

    FinalStrategyResult call(String retrievalSummary, String webSummary, List<String> webBullets,
                             String forecastText);
}
