package com.newsdesk.curation.client;

import com.newsdesk.curation.config.LlmProperties;
import com.newsdesk.curation.exception.BatchAbortedException;
import com.newsdesk.curation.exception.EmbeddingUnavailableException;
import com.newsdesk.curation.exception.FatalProviderException;
import com.newsdesk.curation.support.Fixtures;
import com.newsdesk.curation.support.ScriptedLlmClient;
import com.newsdesk.curation.util.TokenBucketRateLimiter;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class GatedLlmClientTest {
    private final ScriptedLlmClient provider = new ScriptedLlmClient();
    private final LlmProperties props = Fixtures.llmProps(2);
    private final TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(props);
    private final GatedLlmClient client = new GatedLlmClient(provider, limiter, props);

    private static ChatRequest request(String title) {
        return new ChatRequest("gpt-4o-mini", "system", "Title: " + title + "\n", true, 100, 0.2);
    }

    @Test
    void trippedBatchSendsNothing() {
        BatchAbort abort = new BatchAbort();
        abort.trip("401 invalid api key");

        StepVerifier.create(client.complete(request("Any"), null, abort))
                .expectError(BatchAbortedException.class)
                .verify();
        StepVerifier.create(client.embed("Any", null, abort))
                .expectError(BatchAbortedException.class)
                .verify();

        assertTrue(provider.completedTitles.isEmpty());
        assertTrue(provider.embeddedTexts.isEmpty());
        assertEquals(0, limiter.snapshot().inFlight());
    }

    @Test
    void fatalErrorTripsTheSharedAbort() {
        provider.onTitle("Refused", () -> Mono.error(new FatalProviderException("quota exhausted")));
        BatchAbort abort = new BatchAbort();

        StepVerifier.create(client.complete(request("Refused"), null, abort))
                .expectError(FatalProviderException.class)
                .verify();

        assertTrue(abort.isTripped());
        assertEquals("quota exhausted", abort.reason());
        assertFalse(abort.trip("second"));
    }

    @Test
    void embeddingFailureAfterRetriesIsReportedAsUnavailable() {
        provider.failEmbedding("Quiet story");

        StepVerifier.create(client.embed("Quiet story", null))
                .expectError(EmbeddingUnavailableException.class)
                .verify();

        // first attempt plus the configured retry
        assertEquals(2, provider.embeddedTexts.size());
    }

    @Test
    void requestEstimateCoversPromptsOverheadAndResponse() {
        ChatRequest r = new ChatRequest("m", "abcd".repeat(10), "abcd".repeat(20), true, 100, 0.2);
        assertEquals(10 + 20 + GatedLlmClient.REQUEST_OVERHEAD_TOKENS + 100, client.estimateRequestTokens(r));
    }
}
