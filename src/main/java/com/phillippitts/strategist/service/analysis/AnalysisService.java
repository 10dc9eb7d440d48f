package com.phillippitts.strategist.service.analysis;

import com.phillippitts.strategist.service.orchestration.AnalysisRequest;
import com.phillippitts.strategist.service.orchestration.AnalysisStart;
import com.phillippitts.strategist.service.orchestration.ReconcileOutcome;
import com.phillippitts.strategist.service.orchestration.ReconciliationLoop;
import com.phillippitts.strategist.service.orchestration.TaskOrchestrator;
import com.phillippitts.strategist.service.session.ResultStore;
import com.phillippitts.strategist.service.session.SessionRegistry;
import com.phillippitts.strategist.service.session.SessionState;
import com.phillippitts.strategist.service.view.AnalysisView;
import com.phillippitts.strategist.service.view.AnalysisViewAssembler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Entry point of the HTTP layer: one method per user interaction.
 *
 * <p>Every method holds the session monitor for its whole duration, so the orchestrator, the
 * reconciliation loop and the result store see one writer per session even though requests
 * arrive on different servlet threads. Different sessions never block each other.
 */
@Service
public class AnalysisService {

    private static final Logger LOG = LogManager.getLogger(AnalysisService.class);

    private final SessionRegistry sessions;
    private final TaskOrchestrator orchestrator;
    private final ReconciliationLoop reconciliation;
    private final ResultStore results;
    private final AnalysisViewAssembler views;

    public AnalysisService(SessionRegistry sessions,
                           TaskOrchestrator orchestrator,
                           ReconciliationLoop reconciliation,
                           ResultStore results,
                           AnalysisViewAssembler views) {
        this.sessions = Objects.requireNonNull(sessions);
        this.orchestrator = Objects.requireNonNull(orchestrator);
        this.reconciliation = Objects.requireNonNull(reconciliation);
        this.results = Objects.requireNonNull(results);
        this.views = Objects.requireNonNull(views);
    }

    public SessionState createSession() {
        return sessions.create();
    }

    /**
     * @throws com.phillippitts.strategist.exception.SessionNotFoundException for unknown ids
     * @throws com.phillippitts.strategist.exception.AnalysisFailedException if the primary call fails
     */
    public AnalysisStart start(String sessionId, AnalysisRequest request) {
        SessionState session = sessions.get(sessionId);
        synchronized (session) {
            return orchestrator.startAnalysis(session, request);
        }
    }

    /**
     * One host cycle: settle background calls, trigger the final strategy if possible, render.
     */
    public AnalysisView poll(String sessionId) {
        SessionState session = sessions.get(sessionId);
        synchronized (session) {
            ReconcileOutcome outcome = reconciliation.reconcile(session);
            if (results.inspectFinalStrategy(session)) {
                LOG.debug("Final strategy committed during poll");
            }
            return views.assemble(session, outcome);
        }
    }

    /**
     * Flips SWOT visibility of one strategy and returns the refreshed view. Does not reconcile.
     */
    public AnalysisView toggleSwot(String sessionId, int emissionIndex) {
        SessionState session = sessions.get(sessionId);
        synchronized (session) {
            if (emissionIndex < 1) {
                throw new IllegalArgumentException("Strategy index must be >= 1: " + emissionIndex);
            }
            session.toggleSwot(emissionIndex);
            int pending = session.trackedTasks().size();
            ReconcileOutcome outcome = pending == 0 ? ReconcileOutcome.settled()
                    : new ReconcileOutcome(pending, reconciliation.pollInterval());
            return views.assemble(session, outcome);
        }
    }
}
