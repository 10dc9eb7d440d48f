package com.phillippitts.strategist.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the OpenAI-compatible chat completions provider shared by all agents.
 *
 * <p>The API key is intentionally not validated here: a missing key is reported by the gateway
 * at construction time so the failure names the gateway that needed it.
 */
@Validated
@ConfigurationProperties(prefix = "strategist.llm")
public class LlmProperties {

    @NotBlank
    private final String baseUrl;

    private final String apiKey;

    @NotBlank
    private final String model;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double temperature;

    private final Duration connectTimeout;

    /** Socket read timeout; the only bound on the final strategy call. */
    private final Duration readTimeout;

    @ConstructorBinding
    public LlmProperties(String baseUrl, String apiKey, String model, Double temperature,
                         Duration connectTimeout, Duration readTimeout) {
        this.baseUrl = baseUrl == null ? "https://api.openai.com/v1" : baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model == null ? "gpt-4o-mini" : model;
        this.temperature = temperature == null ? 0.4 : temperature;
        this.connectTimeout = connectTimeout == null ? Duration.ofSeconds(20) : connectTimeout;
        this.readTimeout = readTimeout == null ? Duration.ofSeconds(180) : readTimeout;
    }

    public LlmProperties(String baseUrl, String apiKey, String model) {
        this(baseUrl, apiKey, model, null, null, null);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getModel() {
        return model;
    }

    public double getTemperature() {
        return temperature;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }
}
