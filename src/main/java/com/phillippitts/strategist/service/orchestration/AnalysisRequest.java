package com.phillippitts.strategist.service.orchestration;

/**
 * Query variants of one analysis.
 *
 * @param query         the user's original wording; drives the primary answer
 * @param searchQuery   query for the internal document search
 * @param enrichedQuery query handed to the websearch and forecast agents
 */
public record AnalysisRequest(String query, String searchQuery, String enrichedQuery) {

    /**
     * @throws IllegalArgumentException if {@code query} is null or blank
     */
    public AnalysisRequest {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        query = query.strip();
        searchQuery = searchQuery == null || searchQuery.isBlank() ? query : searchQuery.strip();
        enrichedQuery = enrichedQuery == null || enrichedQuery.isBlank() ? query : enrichedQuery.strip();
    }

    public static AnalysisRequest of(String primaryQuery, String secondaryQuery) {
        return new AnalysisRequest(primaryQuery, primaryQuery, secondaryQuery);
    }
}
