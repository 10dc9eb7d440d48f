package com.phillippitts.strategist.gateway;

import com.phillippitts.strategist.domain.WebsearchResult;

/**
 * External case research: how comparable organizations handled similar situations.
 */
public interface WebsearchGateway {

    /**
     * @param correlationId session-stable id for provider-side conversation tracking
     * @param query         enriched user query
     */
    WebsearchResult call(String correlationId, String query);
}
