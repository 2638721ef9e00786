package com.newsdesk.curation.service.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdesk.curation.client.GatedLlmClient;
import com.newsdesk.curation.client.LlmCompletion;
import com.newsdesk.curation.config.LlmProperties;
import com.newsdesk.curation.dto.ActionDtos;
import com.newsdesk.curation.exception.ArticleNotFoundException;
import com.newsdesk.curation.exception.FatalProviderException;
import com.newsdesk.curation.exception.RateLimitedException;
import com.newsdesk.curation.exception.TransientProviderException;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.model.ProcessingStatus;
import com.newsdesk.curation.support.Fixtures;
import com.newsdesk.curation.support.InMemoryArticleRepository;
import com.newsdesk.curation.support.InMemorySettingsRepository;
import com.newsdesk.curation.support.ScriptedLlmClient;
import com.newsdesk.curation.util.TokenAccounting;
import com.newsdesk.curation.util.TokenBucketRateLimiter;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class LlmProcessorTest {
    private final InMemoryArticleRepository repo = new InMemoryArticleRepository();
    private final InMemorySettingsRepository settings = new InMemorySettingsRepository();
    private final ScriptedLlmClient llm = new ScriptedLlmClient();

    private LlmProcessor processor(int maxConcurrent) {
        LlmProperties props = Fixtures.llmProps(maxConcurrent);
        return processor(props, new TokenBucketRateLimiter(props));
    }

    private LlmProcessor processor(LlmProperties props, TokenBucketRateLimiter limiter) {
        GatedLlmClient gated = new GatedLlmClient(llm, limiter, props);
        ContentSanitizer sanitizer = new ContentSanitizer();
        return new LlmProcessor(repo, settings, gated, new PromptBuilder(props, sanitizer),
                new EnrichmentParser(new ObjectMapper()), props, Fixtures.CLOCK);
    }

    private void pending(long id, String title) {
        repo.save(Fixtures.pending(id, title, Fixtures.NOW.minus(Duration.ofMinutes(60 - id))));
    }

    @Test
    void fatalErrorAbortsTheRestOfTheBatch() {
        // Given: five pending articles, the third hits an invalid API key
        for (long i = 1; i <= 5; i++) pending(i, "Story " + i);
        llm.onTitle("Story 3", () -> Mono.error(new FatalProviderException("401 invalid api key")));

        ActionDtos.ProcessingReport report = processor(1).processPending(1L, new TokenAccounting()).block();

        assertNotNull(report);
        assertEquals(5, report.getRequested());
        assertEquals(2, report.getProcessed());
        assertEquals(3, report.getFailed());
        assertEquals(List.of(3L, 4L, 5L), report.getFailed_ids());
        assertTrue(report.isAborted());
        assertTrue(report.getFatal_error().contains("invalid api key"));
        assertEquals(ProcessingStatus.ENRICHED, repo.get(1).getProcessing_status());
        assertEquals(ProcessingStatus.ENRICHED, repo.get(2).getProcessing_status());
        for (long i = 3; i <= 5; i++) {
            assertEquals(ProcessingStatus.PENDING, repo.get(i).getProcessing_status(), "article " + i);
        }
        assertFalse(llm.completedTitles.contains("Story 4"));
        assertFalse(llm.completedTitles.contains("Story 5"));
    }

    @Test
    void fatalErrorStopsArticlesQueuedForThePermit() {
        // Three workers share one provider slot; whichever article reaches the provider first is refused
        for (long i = 1; i <= 3; i++) pending(i, "Story " + i);
        AtomicBoolean first = new AtomicBoolean(true);
        Supplier<Mono<LlmCompletion>> firstCallRefused = () -> first.getAndSet(false)
                ? Mono.delay(Duration.ofMillis(200)).then(Mono.<LlmCompletion>error(new FatalProviderException("quota exhausted")))
                : Mono.just(ScriptedLlmClient.completion(ScriptedLlmClient.enrichment("Late", 0.9)));
        for (long i = 1; i <= 3; i++) llm.onTitle("Story " + i, firstCallRefused);
        TokenBucketRateLimiter oneSlot = new TokenBucketRateLimiter(1_000_000, 0, 60_000, 1);

        ActionDtos.ProcessingReport report = processor(Fixtures.llmProps(3), oneSlot)
                .processPending(1L, new TokenAccounting()).block(Duration.ofSeconds(10));

        assertNotNull(report);
        assertTrue(report.isAborted());
        assertEquals(1, llm.completedTitles.size(), "calls sent: " + llm.completedTitles);
        assertEquals(0, report.getProcessed());
        assertEquals(List.of(1L, 2L, 3L), report.getFailed_ids());
        for (long i = 1; i <= 3; i++) {
            assertEquals(ProcessingStatus.PENDING, repo.get(i).getProcessing_status(), "article " + i);
        }
        assertEquals(0, oneSlot.snapshot().inFlight());
    }

    @Test
    void fatalErrorCancelsPendingTransientRetries() {
        pending(1, "Refused");
        pending(2, "Flaky");
        llm.onTitle("Refused", () -> Mono.delay(Duration.ofMillis(50))
                .then(Mono.<LlmCompletion>error(new FatalProviderException("401 invalid api key"))));
        llm.onTitle("Flaky", () -> Mono.error(new TransientProviderException("503")));
        LlmProperties props = Fixtures.llmProps(2);
        props.setMaxRetries(3);
        props.setRetryBackoffMs(500);

        ActionDtos.ProcessingReport report = processor(props, new TokenBucketRateLimiter(props))
                .processPending(1L, new TokenAccounting()).block(Duration.ofSeconds(10));

        assertTrue(report.isAborted());
        assertEquals(List.of(1L, 2L), report.getFailed_ids());
        assertTrue(llm.completedTitles.stream().filter("Flaky"::equals).count() <= 1,
                "retried after abort: " + llm.completedTitles);
        assertEquals(ProcessingStatus.PENDING, repo.get(2).getProcessing_status());
    }

    @Test
    void malformedAnswerKeepsRawFieldsAndScoresZero() {
        pending(1, "Odd one");
        llm.answer("Odd one", "I cannot help with that.");

        ActionDtos.ProcessingReport report = processor(2).processPending(1L, new TokenAccounting()).block();

        assertEquals(1, report.getMalformed());
        Article a = repo.get(1);
        assertEquals(ProcessingStatus.MALFORMED, a.getProcessing_status());
        assertEquals(0.0, a.getRelevance_score());
        assertNull(a.getLlm_title());
        assertEquals("Odd one", a.getTitle());
        assertNotNull(a.getProcessed_at());
    }

    @Test
    void enrichmentIsCommittedWithCategoryAndEmbedding() {
        settings.category(3, "World", "world", 0);
        pending(1, "Raw headline");
        llm.answer("Raw headline", "{\"title\":\"Better headline\",\"summary\":\"S\",\"category\":\"world\",\"relevance_score\":0.9}");
        llm.vector("Better headline", Fixtures.axis(2));

        TokenAccounting acct = new TokenAccounting();
        ActionDtos.ProcessingReport report = processor(2).processPending(1L, acct).block();

        assertEquals(1, report.getProcessed());
        assertEquals(0, report.getEmbeddings_missing());
        Article a = repo.get(1);
        assertEquals("Better headline", a.getLlm_title());
        assertEquals(3L, a.getCategory_id());
        assertEquals(0.9, a.getRelevance_score());
        assertArrayEquals(Fixtures.axis(2), a.getTitle_embedding());
        assertTrue(report.getAi_usage_per_model().containsKey("gpt-4o-mini"));
        assertTrue(acct.totalTokens() > 0);
    }

    @Test
    void missingEmbeddingStillCommitsAndIsBackfilledLater() {
        pending(1, "Quiet story");
        llm.failEmbedding("Quiet story");
        LlmProcessor processor = processor(2);

        ActionDtos.ProcessingReport report = processor.processPending(1L, new TokenAccounting()).block();

        assertEquals(1, report.getProcessed());
        assertEquals(1, report.getEmbeddings_missing());
        assertEquals(ProcessingStatus.ENRICHED, repo.get(1).getProcessing_status());
        assertNull(repo.get(1).getTitle_embedding());

        llm.clearEmbeddingFailures();
        assertEquals(1, processor.backfillEmbeddings(1L, new TokenAccounting()).block());
        assertNotNull(repo.get(1).getTitle_embedding());
    }

    @Test
    void transientFailureLeavesArticlePendingAfterRetries() {
        pending(1, "Flaky");
        pending(2, "Fine");
        llm.onTitle("Flaky", () -> Mono.error(new TransientProviderException("503")));

        ActionDtos.ProcessingReport report = processor(2).processPending(1L, new TokenAccounting()).block();

        assertEquals(1, report.getProcessed());
        assertEquals(1, report.getFailed());
        assertFalse(report.isAborted());
        assertEquals(ProcessingStatus.PENDING, repo.get(1).getProcessing_status());
        // one call plus one retry
        assertEquals(2, llm.completedTitles.stream().filter("Flaky"::equals).count());
    }

    @Test
    void rateLimitIsRetriedWithoutSurfacing() {
        pending(1, "Busy");
        AtomicInteger calls = new AtomicInteger();
        llm.onTitle("Busy", () -> calls.incrementAndGet() == 1
                ? Mono.error(new RateLimitedException("429", Duration.ofMillis(20)))
                : Mono.just(ScriptedLlmClient.completion(ScriptedLlmClient.enrichment("Busy", 0.7))));

        ActionDtos.ProcessingReport report = processor(1).processPending(1L, new TokenAccounting()).block();

        assertEquals(1, report.getProcessed());
        assertEquals(0, report.getFailed());
        assertEquals(2, calls.get());
    }

    @Test
    void explicitIdsSkipArticlesThatAreNotPending() {
        pending(1, "New");
        Article done = Fixtures.enriched(2, "Old", 0.5, Fixtures.axis(1), Fixtures.NOW);
        repo.save(done);

        ActionDtos.ProcessingReport report = processor(2)
                .processArticles(1L, List.of(1L, 2L), new TokenAccounting()).block();

        assertEquals(2, report.getRequested());
        assertEquals(1, report.getProcessed());
        assertEquals(1, report.getSkipped());
        assertFalse(llm.completedTitles.contains("Old"));
    }

    @Test
    void pendingOutsideLookbackIsLeftAlone() {
        repo.save(Fixtures.pending(1, "Stale", Fixtures.NOW.minus(Duration.ofHours(30))));

        ActionDtos.ProcessingReport report = processor(2).processPending(1L, new TokenAccounting()).block();

        assertEquals(0, report.getRequested());
        assertTrue(llm.completedTitles.isEmpty());
    }

    @Test
    void reprocessRefusesClusteredArticles() {
        Instant t = Fixtures.NOW;
        repo.save(Fixtures.enriched(1, "Canonical", 0.8, Fixtures.axis(0), t));
        Article dup = Fixtures.enriched(2, "Copy", 0.8, Fixtures.axis(0), t);
        dup.setIs_duplicate(true);
        dup.setDuplicate_of_id(1L);
        repo.save(dup);
        repo.save(Fixtures.enriched(3, "Loner", 0.2, Fixtures.axis(5), t));
        LlmProcessor processor = processor(1);

        assertThrows(IllegalStateException.class, () -> processor.reprocess(1, new TokenAccounting()).block());
        assertThrows(ArticleNotFoundException.class, () -> processor.reprocess(99, new TokenAccounting()).block());

        ActionDtos.ProcessingReport report = processor.reprocess(3, new TokenAccounting()).block();
        assertEquals(1, report.getProcessed());
        assertEquals(0.5, repo.get(3).getRelevance_score());
    }
}
