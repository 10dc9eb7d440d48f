package com.phillippitts.strategist.presentation.controller;

import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.SourceRef;
import com.phillippitts.strategist.service.analysis.AnalysisService;
import com.phillippitts.strategist.service.orchestration.AnalysisRequest;
import com.phillippitts.strategist.service.orchestration.AnalysisStart;
import com.phillippitts.strategist.service.session.SessionState;
import com.phillippitts.strategist.service.view.AnalysisView;
import com.phillippitts.strategist.util.DisplayText;
import com.phillippitts.strategist.util.TimeUtils;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Polling API over one analysis session.
 *
 * <p>Typical flow: {@code POST /api/sessions}, then {@code POST .../analysis}, then
 * {@code GET .../analysis} every {@code pollAfterMs} until it is absent.
 */
@RestController
@RequestMapping("/api/sessions")
class AnalysisController {

    private final AnalysisService analysis;

    AnalysisController(AnalysisService analysis) {
        this.analysis = analysis;
    }

    @PostMapping
    ResponseEntity<SessionCreated> createSession() {
        SessionState session = analysis.createSession();
        return ResponseEntity.status(HttpStatus.CREATED).body(new SessionCreated(session.sessionId(), Map.of(
                AgentKind.WEBSEARCH.metricName(), session.correlationId(AgentKind.WEBSEARCH),
                AgentKind.FORECAST.metricName(), session.correlationId(AgentKind.FORECAST),
                AgentKind.FINAL_STRATEGY.metricName(), session.correlationId(AgentKind.FINAL_STRATEGY))));
    }

    @PostMapping("/{sessionId}/analysis")
    ResponseEntity<AnalysisStarted> start(@PathVariable String sessionId, @Valid @RequestBody StartRequest body) {
        AnalysisStart start = analysis.start(sessionId,
                new AnalysisRequest(body.query(), body.searchQuery(), body.enrichedQuery()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new AnalysisStarted(start.outcome(),
                DisplayText.clean(start.retrieval().answerText()), start.retrieval().topSources()));
    }

    @GetMapping("/{sessionId}/analysis")
    ResponseEntity<AnalysisView> poll(@PathVariable String sessionId) {
        return withRetryAfter(analysis.poll(sessionId));
    }

    @PostMapping("/{sessionId}/strategies/{index}/swot")
    ResponseEntity<AnalysisView> toggleSwot(@PathVariable String sessionId, @PathVariable int index) {
        return withRetryAfter(analysis.toggleSwot(sessionId, index));
    }

    private static ResponseEntity<AnalysisView> withRetryAfter(AnalysisView view) {
        ResponseEntity.BodyBuilder ok = ResponseEntity.ok();
        if (view.pollAfterMs() != null) {
            ok.header(HttpHeaders.RETRY_AFTER, Long.toString(TimeUtils.retryAfterSeconds(view.pollAfterMs())));
        }
        return ok.body(view);
    }

    record SessionCreated(String sessionId, Map<String, String> correlationIds) {
    }

    record StartRequest(@NotBlank String query, String searchQuery, String enrichedQuery) {
    }

    record AnalysisStarted(AnalysisStart.PrimaryOutcome outcome, String answer, List<SourceRef> sources) {
    }
}
