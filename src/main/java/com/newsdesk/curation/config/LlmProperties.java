package com.newsdesk.curation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Language-model provider settings and the throughput budget shared by every call to it.
 */
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {
    private String apiKey;
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o-mini";
    private String embeddingModel = "text-embedding-3-small";

    // Rate limiter
    private long tokensPerMinute = 200_000L;
    /**
     * Token bucket capacity. Zero or negative means a quarter of {@link #tokensPerMinute}.
     */
    private long burstTokens;
    /** Length of the rolling window the tokens-per-minute budget applies to. */
    private long windowMs = 60_000L;
    private int maxConcurrent = 5;

    // Prompt sizing
    private int maxInputTokens = 4000;
    private int maxInterestTokens = 300;
    private int responseBufferTokens = 400;

    // Batching
    private int batchLimit = 50;
    private int lookbackHours = 24;

    // Failure policy
    private int maxRetries = 3;
    private int maxRateLimitRetries = 8;
    private long retryBackoffMs = 1000L;
    private int requestTimeoutSec = 60;

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    public long effectiveBurstTokens() {
        return burstTokens > 0 ? burstTokens : Math.max(1L, tokensPerMinute / 4);
    }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public String getEmbeddingModel() { return embeddingModel; }
    public void setEmbeddingModel(String embeddingModel) { this.embeddingModel = embeddingModel; }
    public long getTokensPerMinute() { return tokensPerMinute; }
    public void setTokensPerMinute(long tokensPerMinute) { this.tokensPerMinute = tokensPerMinute; }
    public long getBurstTokens() { return burstTokens; }
    public void setBurstTokens(long burstTokens) { this.burstTokens = burstTokens; }
    public long getWindowMs() { return windowMs; }
    public void setWindowMs(long windowMs) { this.windowMs = windowMs; }
    public int getMaxConcurrent() { return maxConcurrent; }
    public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
    public int getMaxInputTokens() { return maxInputTokens; }
    public void setMaxInputTokens(int maxInputTokens) { this.maxInputTokens = maxInputTokens; }
    public int getMaxInterestTokens() { return maxInterestTokens; }
    public void setMaxInterestTokens(int maxInterestTokens) { this.maxInterestTokens = maxInterestTokens; }
    public int getResponseBufferTokens() { return responseBufferTokens; }
    public void setResponseBufferTokens(int responseBufferTokens) { this.responseBufferTokens = responseBufferTokens; }
    public int getBatchLimit() { return batchLimit; }
    public void setBatchLimit(int batchLimit) { this.batchLimit = batchLimit; }
    public int getLookbackHours() { return lookbackHours; }
    public void setLookbackHours(int lookbackHours) { this.lookbackHours = lookbackHours; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public int getMaxRateLimitRetries() { return maxRateLimitRetries; }
    public void setMaxRateLimitRetries(int maxRateLimitRetries) { this.maxRateLimitRetries = maxRateLimitRetries; }
    public long getRetryBackoffMs() { return retryBackoffMs; }
    public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }
    public int getRequestTimeoutSec() { return requestTimeoutSec; }
    public void setRequestTimeoutSec(int requestTimeoutSec) { this.requestTimeoutSec = requestTimeoutSec; }
}
