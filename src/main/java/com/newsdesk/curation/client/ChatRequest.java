package com.newsdesk.curation.client;

/**
 * @param jsonResponse ask the provider for a JSON object answer
 * @param maxTokens    completion cap; also the response share of the rate-limit estimate
 */
public record ChatRequest(String model, String systemPrompt, String userPrompt,
                          boolean jsonResponse, int maxTokens, double temperature) {
}
