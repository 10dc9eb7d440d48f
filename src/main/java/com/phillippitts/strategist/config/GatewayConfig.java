package com.phillippitts.strategist.config;

import com.phillippitts.strategist.config.properties.LlmProperties;
import com.phillippitts.strategist.config.properties.RetrievalProperties;
import com.phillippitts.strategist.gateway.FinalStrategyGateway;
import com.phillippitts.strategist.gateway.ForecastGateway;
import com.phillippitts.strategist.gateway.RetrievalGateway;
import com.phillippitts.strategist.gateway.WebsearchGateway;
import com.phillippitts.strategist.gateway.chat.ChatCompletionClient;
import com.phillippitts.strategist.gateway.chat.ChatFinalStrategyGateway;
import com.phillippitts.strategist.gateway.chat.ChatForecastGateway;
import com.phillippitts.strategist.gateway.chat.ChatWebsearchGateway;
import com.phillippitts.strategist.gateway.retrieval.DocumentIndex;
import com.phillippitts.strategist.gateway.retrieval.DocumentRetrievalGateway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Wires the agent gateways explicitly.
 *
 * <p>All chat agents share one {@link ChatCompletionClient}. Its construction fails fast when no
 * API key is configured, which aborts startup before any session can be created.
 */
@Configuration
public class GatewayConfig {

    private final LlmProperties llmProperties;
    private final RetrievalProperties retrievalProperties;

    public GatewayConfig(LlmProperties llmProperties, RetrievalProperties retrievalProperties) {
        this.llmProperties = llmProperties;
        this.retrievalProperties = retrievalProperties;
    }

    /**
     * Wall clock for timeout decisions. Tests replace it with a controllable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * HTTP client for the provider, with base URL and socket timeouts applied.
     */
    @Bean
    public RestClient llmRestClient(RestClient.Builder builder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(llmProperties.getConnectTimeout());
        requestFactory.setReadTimeout(llmProperties.getReadTimeout());
        return builder
                .baseUrl(llmProperties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public ChatCompletionClient chatCompletionClient(RestClient llmRestClient) {
        return new ChatCompletionClient(llmRestClient, llmProperties);
    }

    @Bean
    public DocumentIndex documentIndex() {
        return DocumentIndex.load(retrievalProperties);
    }

    @Bean
    public RetrievalGateway retrievalGateway(DocumentIndex documentIndex, ChatCompletionClient client) {
        return new DocumentRetrievalGateway(documentIndex, client, retrievalProperties.getTopK());
    }

    @Bean
    public WebsearchGateway websearchGateway(ChatCompletionClient client) {
        return new ChatWebsearchGateway(client);
    }

    @Bean
    public ForecastGateway forecastGateway(ChatCompletionClient client) {
        return new ChatForecastGateway(client);
    }

    @Bean
    public FinalStrategyGateway finalStrategyGateway(ChatCompletionClient client) {
        return new ChatFinalStrategyGateway(client);
    }
}
