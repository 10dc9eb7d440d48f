package com.phillippitts.strategist.service.orchestration;

import com.phillippitts.strategist.domain.RetrievalResult;

/**
 * Result of a successful {@link TaskOrchestrator#startAnalysis} call.
 *
 * @param outcome   whether the primary call produced an answer
 * @param retrieval the primary result; has no documents when {@code outcome} is NOTHING_FOUND
 */
public record AnalysisStart(PrimaryOutcome outcome, RetrievalResult retrieval) {

    public enum PrimaryOutcome {
        /** Answer committed to the retrieval slot. */
        COMMITTED,
        /** No internal documents matched; earlier slot contents were left untouched. */
        NOTHING_FOUND
    }

    public boolean isCommitted() {
        return outcome == PrimaryOutcome.COMMITTED;
    }
}
