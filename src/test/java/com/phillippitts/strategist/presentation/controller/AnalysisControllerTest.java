package com.phillippitts.strategist.presentation.controller;

import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.domain.RetrievalResult;
import com.phillippitts.strategist.domain.SourceRef;
import com.phillippitts.strategist.exception.AnalysisFailedException;
import com.phillippitts.strategist.exception.SessionNotFoundException;
import com.phillippitts.strategist.service.analysis.AnalysisService;
import com.phillippitts.strategist.service.orchestration.AnalysisRequest;
import com.phillippitts.strategist.service.orchestration.AnalysisStart;
import com.phillippitts.strategist.service.session.SessionState;
import com.phillippitts.strategist.service.view.AnalysisView;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnalysisService analysisService;

    @Test
    void createSessionReturns201WithCorrelationIds() throws Exception {
        SessionState session = new SessionState("s-1", Instant.parse("2024-01-01T00:00:00Z"));
        when(analysisService.createSession()).thenReturn(session);

        mockMvc.perform(post("/api/sessions"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.correlationIds.websearch")
                        .value(session.correlationId(AgentKind.WEBSEARCH)))
                .andExpect(jsonPath("$.correlationIds.forecast").exists());
    }

    @Test
    void startReturns202WithCleanedAnswer() throws Exception {
        RetrievalResult retrieval = new RetrievalResult("Grow<br>north", List.of(),
                List.of(SourceRef.internal("plan.md", "2024-01-01")));
        when(analysisService.start(eq("s-1"), any(AnalysisRequest.class)))
                .thenReturn(new AnalysisStart(AnalysisStart.PrimaryOutcome.COMMITTED, retrieval));

        mockMvc.perform(post("/api/sessions/s-1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"How do we grow?\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.outcome").value("COMMITTED"))
                .andExpect(jsonPath("$.answer").value("Grow north"))
                .andExpect(jsonPath("$.sources[0].title").value("plan.md"));

        verify(analysisService).start("s-1", new AnalysisRequest("How do we grow?", null, null));
    }

    @Test
    void startRejectsBlankQuery() throws Exception {
        mockMvc.perform(post("/api/sessions/s-1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MethodArgumentNotValidException"));

        verifyNoInteractions(analysisService);
    }

    @Test
    void startReturns502WhenPrimaryFails() throws Exception {
        when(analysisService.start(eq("s-1"), any(AnalysisRequest.class)))
                .thenThrow(new AnalysisFailedException("s-1", new TimeoutException()));

        mockMvc.perform(post("/api/sessions/s-1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"q\"}"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void pollSetsRetryAfterWhilePending() throws Exception {
        when(analysisService.poll("s-1")).thenReturn(view(2, 1500L));

        mockMvc.perform(get("/api/sessions/s-1/analysis"))
                .andExpect(status().isOk())
                .andExpect(header().string("Retry-After", "2"))
                .andExpect(jsonPath("$.pendingCount").value(2))
                .andExpect(jsonPath("$.pollAfterMs").value(1500));
    }

    @Test
    void pollOmitsRetryAfterWhenSettled() throws Exception {
        when(analysisService.poll("s-1")).thenReturn(view(0, null));

        mockMvc.perform(get("/api/sessions/s-1/analysis"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("Retry-After"));
    }

    @Test
    void pollUnknownSessionReturns404() throws Exception {
        when(analysisService.poll("nope")).thenThrow(new SessionNotFoundException("nope"));

        mockMvc.perform(get("/api/sessions/nope/analysis"))
                .andExpect(status().isNotFound());
    }

    @Test
    void toggleSwotPassesIndex() throws Exception {
        when(analysisService.toggleSwot("s-1", 2)).thenReturn(view(0, null));

        mockMvc.perform(post("/api/sessions/s-1/strategies/2/swot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s-1"));

        verify(analysisService).toggleSwot("s-1", 2);
    }

    @Test
    void toggleSwotRejectsNonNumericIndex() throws Exception {
        mockMvc.perform(post("/api/sessions/s-1/strategies/first/swot"))
                .andExpect(status().isBadRequest());
    }

    private static AnalysisView view(int pending, Long pollAfterMs) {
        return new AnalysisView("s-1", null, null, null, null, pending, pollAfterMs);
    }
}
