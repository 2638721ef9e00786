package com.newsdesk.curation.client;

public record LlmCompletion(String model, String content, long promptTokens, long completionTokens, long totalTokens) {
}
