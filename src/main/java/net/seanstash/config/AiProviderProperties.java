package net.seanstash.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the hosted model used by command analysis.
 */
@Component
@ConfigurationProperties(prefix = "app.ai")
public class AiProviderProperties {

    /**
     * Model identifier sent with every request.
     */
    private String model = "claude-3-5-sonnet-20241022";

    /**
     * Base URL of the OpenAI-compatible chat completions endpoint.
     */
    private String baseUrl = "https://api.anthropic.com/v1";

    /**
     * Fallback API key used when the settings table holds none.
     */
    private String apiKey = "";

    /**
     * Settings table key consulted before {@link #apiKey}.
     */
    private String apiKeySetting = "claude_api_key";

    private long maxTokens = 4000L;

    private double temperature = 0.1;

    /**
     * SDK-level retries per call. Passes already retry provider failures.
     */
    private int maxRetries = 0;

    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * USD per million input tokens.
     */
    private double inputCostPerMillion = 3.00;

    /**
     * USD per million output tokens.
     */
    private double outputCostPerMillion = 15.00;

    @PostConstruct
    void validate() {
        Assert.hasText(model, "app.ai.model must not be blank");
        Assert.hasText(baseUrl, "app.ai.base-url must not be blank");
        Assert.isTrue(maxTokens > 0, "app.ai.max-tokens must be positive");
        Assert.isTrue(temperature >= 0.0 && temperature <= 2.0, "app.ai.temperature must be between 0 and 2");
        Assert.isTrue(maxRetries >= 0, "app.ai.max-retries must be non-negative");
        Assert.isTrue(requestTimeout != null && !requestTimeout.isNegative() && !requestTimeout.isZero(),
            "app.ai.request-timeout must be positive");
        Assert.isTrue(inputCostPerMillion >= 0 && outputCostPerMillion >= 0, "app.ai token rates must be non-negative");
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiKeySetting() {
        return apiKeySetting;
    }

    public void setApiKeySetting(String apiKeySetting) {
        this.apiKeySetting = apiKeySetting;
    }

    public long getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(long maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public double getInputCostPerMillion() {
        return inputCostPerMillion;
    }

    public void setInputCostPerMillion(double inputCostPerMillion) {
        this.inputCostPerMillion = inputCostPerMillion;
    }

    public double getOutputCostPerMillion() {
        return outputCostPerMillion;
    }

    public void setOutputCostPerMillion(double outputCostPerMillion) {
        this.outputCostPerMillion = outputCostPerMillion;
    }
}
