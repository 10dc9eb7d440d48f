package com.phillippitts.strategist.service.orchestration;

import java.time.Duration;

/**
 * Result of one reconciliation pass.
 *
 * @param pendingCount tasks still pending after the pass
 * @param pollAfter    delay before the caller should reconcile again; zero when nothing is pending
 */
public record ReconcileOutcome(int pendingCount, Duration pollAfter) {

    public static ReconcileOutcome settled() {
        return new ReconcileOutcome(0, Duration.ZERO);
    }

    public boolean hasPending() {
        return pendingCount > 0;
    }
}
