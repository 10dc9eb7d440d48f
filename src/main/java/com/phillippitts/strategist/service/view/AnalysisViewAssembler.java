package com.phillippitts.strategist.service.view;

import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.Criterion;
import com.phillippitts.strategist.domain.FinalStrategyResult;
import com.phillippitts.strategist.domain.ForecastResult;
import com.phillippitts.strategist.domain.RankedStrategy;
import com.phillippitts.strategist.domain.RetrievalResult;
import com.phillippitts.strategist.domain.StrategyReport;
import com.phillippitts.strategist.domain.SwotCategory;
import com.phillippitts.strategist.domain.SwotEntry;
import com.phillippitts.strategist.domain.WebsearchDigest;
import com.phillippitts.strategist.domain.WebsearchResult;
import com.phillippitts.strategist.service.orchestration.ReconcileOutcome;
import com.phillippitts.strategist.service.parser.PayloadUnwrapper;
import com.phillippitts.strategist.service.ranking.StrategyRanker;
import com.phillippitts.strategist.service.session.ResultSlot;
import com.phillippitts.strategist.service.session.SessionState;
import com.phillippitts.strategist.service.session.UnavailableReason;
import com.phillippitts.strategist.util.DisplayText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the read model of a session. Pure: never triggers agent calls.
 */
@Component
public class AnalysisViewAssembler {

    static final String NOTICE_NOT_STARTED = "Start an analysis first; results appear here automatically.";
    static final String NOTICE_RUNNING = "The agent is running. The result appears automatically when ready.";
    static final String NOTICE_TIMED_OUT = "The agent is unavailable for now: it did not answer in time. "
            + "Start the analysis again to retry.";
    static final String NOTICE_FAILED = "The agent is unavailable for now: the call failed. "
            + "Start the analysis again to retry.";
    static final String NOTICE_NO_TEXT = "No text answer could be extracted. Try the analysis again.";
    static final String NOTICE_WAITING_UPSTREAM = "Final strategies appear automatically once the "
            + "retrieval, websearch and forecast agents have finished.";
    static final String NOTICE_NOTHING_EXTRACTABLE = "No strategies could be extracted from the answer.";

    private final PayloadUnwrapper unwrapper;
    private final StrategyRanker ranker;

    public AnalysisViewAssembler(PayloadUnwrapper unwrapper, StrategyRanker ranker) {
        this.unwrapper = unwrapper;
        this.ranker = ranker;
    }

    public AnalysisView assemble(SessionState session, ReconcileOutcome outcome) {
        return new AnalysisView(session.sessionId(),
                retrieval(session),
                websearch(session),
                forecast(session),
                finalStrategy(session),
                outcome.pendingCount(),
                outcome.hasPending() ? outcome.pollAfter().toMillis() : null);
    }

    private RetrievalView retrieval(SessionState session) {
        Optional<RetrievalResult> result = session.slot(AgentKind.RETRIEVAL).result(RetrievalResult.class);
        if (result.isEmpty()) {
            return new RetrievalView(agentView(session, AgentKind.RETRIEVAL), "", List.of());
        }
        return new RetrievalView(new AgentView(AgentStatus.READY, null, ""),
                result.get().answerText(), result.get().topSources());
    }

    private WebsearchView websearch(SessionState session) {
        Optional<WebsearchResult> result = session.slot(AgentKind.WEBSEARCH).result(WebsearchResult.class);
        if (result.isEmpty()) {
            return new WebsearchView(agentView(session, AgentKind.WEBSEARCH), "", List.of(), "", List.of());
        }
        WebsearchDigest digest = unwrapper.unwrap(result.get().rawPayload());
        String display = DisplayText.clean(digest.displayText());
        String notice = digest.isEmpty() && display.isBlank() ? NOTICE_NO_TEXT : "";
        List<String> bullets = digest.bullets().stream().map(DisplayText::clean).toList();
        return new WebsearchView(new AgentView(AgentStatus.READY, null, notice),
                DisplayText.clean(digest.summary()), bullets, display, result.get().sources());
    }

    private ForecastView forecast(SessionState session) {
        Optional<ForecastResult> result = session.slot(AgentKind.FORECAST).result(ForecastResult.class);
        if (result.isEmpty()) {
            return new ForecastView(agentView(session, AgentKind.FORECAST), "");
        }
        String text = DisplayText.clean(result.get().answerText());
        String notice = text.isBlank() ? NOTICE_NO_TEXT : "";
        return new ForecastView(new AgentView(AgentStatus.READY, null, notice), text);
    }

    private FinalStrategyView finalStrategy(SessionState session) {
        ResultSlot slot = session.slot(AgentKind.FINAL_STRATEGY);
        if (slot.result(FinalStrategyResult.class).isEmpty()) {
            AgentView agent = new AgentView(AgentStatus.EMPTY, null, NOTICE_WAITING_UPSTREAM);
            return new FinalStrategyView(agent, "", List.of(), false, session.finalStrategyError());
        }
        StrategyReport report = session.strategyReport();
        if (report.isEmpty()) {
            AgentView agent = new AgentView(AgentStatus.READY, null, NOTICE_NOTHING_EXTRACTABLE);
            return new FinalStrategyView(agent, DisplayText.clean(report.preamble()), List.of(), true, null);
        }
        List<StrategyView> strategies = new ArrayList<>();
        for (RankedStrategy ranked : ranker.rank(report.strategies())) {
            int index = ranked.emissionIndex();
            boolean visible = session.isSwotVisible(index);
            strategies.add(new StrategyView(index, ranked.rank(), ranked.tier(), ranked.tier().medal(),
                    DisplayText.clean(ranked.strategy().title()),
                    DisplayText.clean(ranked.strategy().description()),
                    scores(ranked.strategy().scores()),
                    visible,
                    visible ? swot(report.swotFor(index)) : null));
        }
        return new FinalStrategyView(new AgentView(AgentStatus.READY, null, ""),
                DisplayText.clean(report.preamble()), strategies, false, null);
    }

    private static AgentView agentView(SessionState session, AgentKind kind) {
        ResultSlot slot = session.slot(kind);
        if (slot.isUnavailable()) {
            UnavailableReason reason = slot.reason().orElse(UnavailableReason.FAILED);
            return new AgentView(AgentStatus.UNAVAILABLE, reason,
                    reason == UnavailableReason.TIMED_OUT ? NOTICE_TIMED_OUT : NOTICE_FAILED);
        }
        if (kind.isBackground() && session.trackedTask(kind) != null) {
            return new AgentView(AgentStatus.PENDING, null, NOTICE_RUNNING);
        }
        return new AgentView(AgentStatus.EMPTY, null, NOTICE_NOT_STARTED);
    }

    private static Map<String, Integer> scores(Map<Criterion, Integer> scores) {
        Map<String, Integer> out = new LinkedHashMap<>();
        scores.forEach((criterion, value) -> out.put(criterion.label(), value));
        return out;
    }

    private static SwotView swot(SwotEntry entry) {
        return new SwotView(cleaned(entry.get(SwotCategory.STRENGTHS)),
                cleaned(entry.get(SwotCategory.WEAKNESSES)),
                cleaned(entry.get(SwotCategory.OPPORTUNITIES)),
                cleaned(entry.get(SwotCategory.THREATS)));
    }

    private static List<String> cleaned(List<String> items) {
        return items.stream().map(DisplayText::clean).toList();
    }
}
