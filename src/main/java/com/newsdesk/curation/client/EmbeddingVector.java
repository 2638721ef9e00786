package com.newsdesk.curation.client;

public record EmbeddingVector(String model, float[] vector, long promptTokens) {
}
