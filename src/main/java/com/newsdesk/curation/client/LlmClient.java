package com.newsdesk.curation.client;

import reactor.core.publisher.Mono;

/**
 * Boundary to the language-model provider. Implementations signal failures with the
 * {@code com.newsdesk.curation.exception} kinds so callers can apply one failure policy
 * regardless of provider.
 */
public interface LlmClient {

    Mono<LlmCompletion> complete(ChatRequest request);

    Mono<EmbeddingVector> embed(String model, String text);
}
