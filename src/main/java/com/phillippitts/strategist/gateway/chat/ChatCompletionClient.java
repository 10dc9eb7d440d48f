package com.phillippitts.strategist.gateway.chat;

import com.phillippitts.strategist.config.properties.LlmProperties;
import com.phillippitts.strategist.domain.AgentKind;
import com.phillippitts.strategist.exception.GatewayConfigurationException;
import com.phillippitts.strategist.exception.GatewayException;
import com.phillippitts.strategist.util.LogSanitizer;
import com.phillippitts.strategist.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * Minimal client for an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>One request per call, no retries and no streaming: agents are slow and retries are the
 * caller's decision (a new analysis). Request and response bodies are built and read with
 * org.json so that unexpected provider fields never break deserialization.
 *
 * <p><b>Fail-fast:</b> construction fails with {@link GatewayConfigurationException} when no API
 * key is configured, so a misconfigured deployment never starts.
 */
public class ChatCompletionClient {

    private static final Logger LOG = LogManager.getLogger(ChatCompletionClient.class);

    static final String API_KEY_PROPERTY = "strategist.llm.api-key";
    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final RestClient restClient;
    private final LlmProperties props;

    /**
     * @param restClient client with base URL and timeouts applied
     * @param props      model, temperature and API key
     * @throws GatewayConfigurationException if the API key is blank
     */
    public ChatCompletionClient(RestClient restClient, LlmProperties props) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.props = Objects.requireNonNull(props, "props");
        if (props.getApiKey().isBlank()) {
            throw new GatewayConfigurationException(API_KEY_PROPERTY);
        }
    }

    /**
     * Sends one system + user exchange and returns the assistant message content.
     *
     * @param agent         agent on whose behalf the call is made (error tagging, logs)
     * @param systemPrompt  system message
     * @param userPrompt    user message
     * @param correlationId sent as the provider {@code user} field; may be null
     * @return trimmed content, possibly empty
     * @throws GatewayException on HTTP, I/O or protocol errors
     */
    public String complete(AgentKind agent, String systemPrompt, String userPrompt, String correlationId) {
        JSONObject request = new JSONObject()
                .put("model", props.getModel())
                .put("temperature", props.getTemperature())
                .put("messages", new JSONArray()
                        .put(new JSONObject().put("role", "system").put("content", systemPrompt))
                        .put(new JSONObject().put("role", "user").put("content", userPrompt)));
        if (correlationId != null && !correlationId.isBlank()) {
            request.put("user", correlationId);
        }

        long t0 = System.nanoTime();
        String body;
        try {
            body = restClient.post()
                    .uri(COMPLETIONS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(request.toString())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw new GatewayException(agent, "Provider returned HTTP " + e.getStatusCode().value()
                    + ": " + LogSanitizer.truncate(e.getResponseBodyAsString(), 200), e);
        } catch (ResourceAccessException e) {
            throw new GatewayException(agent, "Provider unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new GatewayException(agent, "Provider call failed: " + e.getMessage(), e);
        }

        String content = extractContent(agent, body);
        LOG.debug("{} completion in {} ms: '{}'", agent.metricName(), TimeUtils.elapsedMillis(t0),
                LogSanitizer.preview(content));
        return content;
    }

    static String extractContent(AgentKind agent, String body) {
        if (body == null || body.isBlank()) {
            throw new GatewayException(agent, "Provider returned an empty body");
        }
        try {
            JSONObject json = new JSONObject(body);
            JSONObject error = json.optJSONObject("error");
            if (error != null) {
                throw new GatewayException(agent, "Provider error: " + error.optString("message", "unknown"));
            }
            JSONArray choices = json.optJSONArray("choices");
            if (choices == null || choices.isEmpty()) {
                throw new GatewayException(agent, "Provider response has no choices");
            }
            JSONObject message = choices.getJSONObject(0).optJSONObject("message");
            if (message == null) {
                return "";
            }
            return message.optString("content", "").strip();
        } catch (JSONException e) {
            throw new GatewayException(agent, "Provider response is not valid JSON", e);
        }
    }
}
