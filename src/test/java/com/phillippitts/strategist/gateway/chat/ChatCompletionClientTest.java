package com.phillippitts.strategist.gateway.chat;

import com.phillippitts.strategist.config.properties.LlmProperties;
import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.exception.GatewayConfigurationException;
import com.phillippitts.strategist.exception.GatewayException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ChatCompletionClientTest {

    private static final String BASE_URL = "http://llm.test/v1";

    private MockRestServiceServer server;
    private ChatCompletionClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new ChatCompletionClient(builder.build(), new LlmProperties(BASE_URL, "secret", "test-model"));
    }

    @Test
    void postsChatRequestAndReturnsAssistantContent() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret"))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content").value("question"))
                .andExpect(jsonPath("$.user").value("cid-1"))
                .andRespond(withSuccess("""
                        {"id":"x","choices":[{"index":0,"message":{"role":"assistant","content":"  answer  "}}]}
                        """, MediaType.APPLICATION_JSON));

        String content = client.complete(AgentKind.FORECAST, "system prompt", "question", "cid-1");

        assertThat(content).isEqualTo("answer");
        server.verify();
    }

    @Test
    void omitsUserFieldWithoutCorrelationId() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andExpect(jsonPath("$.user").doesNotExist())
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.complete(AgentKind.RETRIEVAL, "s", "u", null)).isEqualTo("ok");
    }

    @Test
    void httpErrorBecomesGatewayExceptionTaggedWithAgent() {
        server.expect(requestTo(BASE_URL + "/chat/completions")).andRespond(withServerError());

        assertThatThrownBy(() -> client.complete(AgentKind.WEBSEARCH, "s", "u", "cid"))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("HTTP 500")
                .hasMessageContaining("websearch")
                .satisfies(e -> assertThat(((GatewayException) e).getAgentKind()).isEqualTo(AgentKind.WEBSEARCH));
    }

    @Test
    void providerErrorBodyBecomesGatewayException() {
        assertThatThrownBy(() -> ChatCompletionClient.extractContent(AgentKind.FORECAST,
                "{\"error\":{\"message\":\"quota exceeded\"}}"))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("quota exceeded");
    }

    @Test
    void invalidJsonOrMissingChoicesBecomesGatewayException() {
        assertThatThrownBy(() -> ChatCompletionClient.extractContent(AgentKind.FORECAST, "<html>"))
                .isInstanceOf(GatewayException.class);
        assertThatThrownBy(() -> ChatCompletionClient.extractContent(AgentKind.FORECAST, "{\"choices\":[]}"))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("no choices");
    }

    @Test
    void missingApiKeyFailsAtConstruction() {
        RestClient restClient = RestClient.builder().baseUrl(BASE_URL).build();

        assertThatThrownBy(() -> new ChatCompletionClient(restClient, new LlmProperties(BASE_URL, "  ", "m")))
                .isInstanceOf(GatewayConfigurationException.class)
                .hasMessageContaining("strategist.llm.api-key");
    }
}
