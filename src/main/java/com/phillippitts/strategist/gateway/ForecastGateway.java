package com.phillippitts.strategist.gateway;

import com.phillippitts.strategist.domain.ForecastResult;

/**
 * Forward-looking proposals for the next one to three years.
 */
public interface ForecastGateway {

    ForecastResult call(String correlationId, String query);
}
