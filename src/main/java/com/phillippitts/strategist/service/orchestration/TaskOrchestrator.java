package com.phillippitts.strategist.service.orchestration;

import com.phillippitts.strategist.service.session.SessionState;

/**
 * Launches the three agent calls of one analysis.
 *
 * <p>The primary (retrieval) call is awaited with a bounded wait; websearch and forecast run in
 * the background and are handed to the session as tracked {@link AgentTask}s, to be settled by
 * {@link ReconciliationLoop}.
 *
 * <p><b>Thread Safety:</b> callers must hold the session monitor for the whole call.
 *
 * @see ReconciliationLoop
 */
public interface TaskOrchestrator {

    /**
     * Starts an analysis.
     *
     * <p>On return the session tracks one pending task per background agent. Tasks of an earlier
     * analysis that were still pending are superseded: their calls keep running, but their
     * results are never committed.
     *
     * @param session session to update
     * @param request query variants
     * @return whether the primary call produced an answer
     * @throws com.phillippitts.strategist.exception.AnalysisFailedException if the primary call
     *         fails or overruns its deadline; background calls are then orphaned
     */
    AnalysisStart startAnalysis(SessionState session, AnalysisRequest request);

    /**
     * Convenience form: the primary query drives both the search and the answer.
     *
     * @throws IllegalArgumentException if {@code primaryQuery} is blank
     */
    default AnalysisStart startAnalysis(SessionState session, String primaryQuery, String secondaryQuery) {
        return startAnalysis(session, AnalysisRequest.of(primaryQuery, secondaryQuery));
    }
}
