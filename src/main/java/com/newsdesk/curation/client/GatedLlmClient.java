package com.newsdesk.curation.client;

import com.newsdesk.curation.config.LlmProperties;
import com.newsdesk.curation.exception.BatchAbortedException;
import com.newsdesk.curation.exception.EmbeddingUnavailableException;
import com.newsdesk.curation.exception.FatalProviderException;
import com.newsdesk.curation.exception.RateLimitedException;
import com.newsdesk.curation.exception.TransientProviderException;
import com.newsdesk.curation.util.RatePermit;
import com.newsdesk.curation.util.TokenAccounting;
import com.newsdesk.curation.util.TokenBucketRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Function;

/**
 * Every provider call goes through here: estimate, acquire a permit, call, reconcile with reported usage,
 * release. Each retry attempt acquires a fresh permit.
 *
 * <p>Rate-limit answers pause the shared limiter and are retried up to {@code maxRateLimitRetries};
 * past that they count as transient. Transient failures are retried {@code maxRetries} times with
 * exponential backoff and jitter. Anything else propagates unchanged.
 *
 * <p>Calls made for a batch share a {@link BatchAbort}. A fatal error trips it before the permit is released;
 * it is checked once a permit is held, right before the request is sent, and before every retry. A tripped
 * batch fails its remaining calls with {@link BatchAbortedException} and sends nothing more.
 */
@Component
public class GatedLlmClient {
    private static final Logger log = LoggerFactory.getLogger(GatedLlmClient.class);
    /** Per-message framing the provider adds on top of the visible text. */
    static final int REQUEST_OVERHEAD_TOKENS = 8;

    private final LlmClient client;
    private final TokenBucketRateLimiter limiter;
    private final LlmProperties props;

    public GatedLlmClient(LlmClient client, TokenBucketRateLimiter limiter, LlmProperties props) {
        this.client = client;
        this.limiter = limiter;
        this.props = props;
    }

    public Mono<LlmCompletion> complete(ChatRequest request, TokenAccounting accounting) {
        return complete(request, accounting, new BatchAbort());
    }

    public Mono<LlmCompletion> complete(ChatRequest request, TokenAccounting accounting, BatchAbort abort) {
        long estimate = estimateRequestTokens(request);
        return gated(estimate, abort, permit -> client.complete(request)
                        .doOnNext(c -> permit.reconcile(c.totalTokens())))
                .doOnNext(c -> {
                    if (accounting != null) {
                        accounting.recordChatCompletionUsage(c.model(), c.promptTokens(), c.completionTokens(), c.totalTokens());
                    }
                });
    }

    public Mono<EmbeddingVector> embed(String text, TokenAccounting accounting) {
        return embed(text, accounting, new BatchAbort());
    }

    /**
     * Fatal and abort errors propagate as they are; any other failure left after retries becomes
     * {@link EmbeddingUnavailableException}.
     */
    public Mono<EmbeddingVector> embed(String text, TokenAccounting accounting, BatchAbort abort) {
        String model = props.getEmbeddingModel();
        long estimate = TokenBucketRateLimiter.estimateTokens(text) + REQUEST_OVERHEAD_TOKENS;
        return gated(estimate, abort, permit -> client.embed(model, text)
                        .doOnNext(e -> permit.reconcile(e.promptTokens())))
                .onErrorMap(e -> !(e instanceof FatalProviderException || e instanceof BatchAbortedException
                                || e instanceof EmbeddingUnavailableException),
                        e -> new EmbeddingUnavailableException("Embedding unavailable: " + e.getMessage(), e))
                .doOnNext(e -> {
                    if (accounting != null) accounting.recordEmbeddingUsage(e.model(), e.promptTokens());
                });
    }

    public long estimateRequestTokens(ChatRequest request) {
        long response = request.maxTokens() > 0 ? request.maxTokens() : props.getResponseBufferTokens();
        return TokenBucketRateLimiter.estimateTokens(request.systemPrompt())
                + TokenBucketRateLimiter.estimateTokens(request.userPrompt())
                + REQUEST_OVERHEAD_TOKENS
                + response;
    }

    private <T> Mono<T> gated(long estimate, BatchAbort abort, Function<RatePermit, Mono<T>> call) {
        Duration backoff = Duration.ofMillis(Math.max(1L, props.getRetryBackoffMs()));
        return Mono.using(() -> limiter.acquire(estimate),
                        permit -> abort.isTripped()
                                ? Mono.<T>error(new BatchAbortedException("Batch aborted: " + abort.reason()))
                                : call.apply(permit)
                                        .doOnError(FatalProviderException.class, e -> abort.trip(e.getMessage())),
                        RatePermit::close)
                .subscribeOn(Schedulers.boundedElastic())
                .doOnError(RateLimitedException.class, e -> limiter.onRateLimited(e.getRetryAfter()))
                .retryWhen(Retry.max(props.getMaxRateLimitRetries())
                        .filter(e -> e instanceof RateLimitedException && !abort.isTripped())
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorMap(RateLimitedException.class,
                        e -> new TransientProviderException("Still rate limited after retries", e))
                .retryWhen(Retry.backoff(props.getMaxRetries(), backoff)
                        .jitter(0.5)
                        .filter(e -> e instanceof TransientProviderException && !abort.isTripped())
                        .doBeforeRetry(s -> log.info("Retrying LLM call after transient failure (attempt {}): {}",
                                s.totalRetries() + 1, s.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }
}
