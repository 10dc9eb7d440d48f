package com.phillippitts.strategist.service.view;

/**
 * Everything one poll returns for a session.
 *
 * @param pendingCount background calls still running
 * @param pollAfterMs  suggested delay before the next poll; null when nothing is pending
 */
public record AnalysisView(String sessionId,
                           RetrievalView retrieval,
                           WebsearchView websearch,
                           ForecastView forecast,
                           FinalStrategyView finalStrategy,
                           int pendingCount,
                           Long pollAfterMs) {
}
