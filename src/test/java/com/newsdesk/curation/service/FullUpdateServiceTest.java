package com.newsdesk.curation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdesk.curation.admin.RunLogService;
import com.newsdesk.curation.admin.RunRegistry;
import com.newsdesk.curation.client.GatedLlmClient;
import com.newsdesk.curation.config.AppProperties;
import com.newsdesk.curation.config.CurationProperties;
import com.newsdesk.curation.config.LlmProperties;
import com.newsdesk.curation.dto.ActionDtos;
import com.newsdesk.curation.exception.FatalProviderException;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.model.RawArticle;
import com.newsdesk.curation.service.enrichment.ContentSanitizer;
import com.newsdesk.curation.service.enrichment.EnrichmentParser;
import com.newsdesk.curation.service.enrichment.LlmProcessor;
import com.newsdesk.curation.service.enrichment.PromptBuilder;
import com.newsdesk.curation.service.feedback.FeedbackService;
import com.newsdesk.curation.service.feedback.ScoreAdjustmentEngine;
import com.newsdesk.curation.support.Fixtures;
import com.newsdesk.curation.support.InMemoryArticleRepository;
import com.newsdesk.curation.support.InMemoryNewspaperRepository;
import com.newsdesk.curation.support.InMemorySettingsRepository;
import com.newsdesk.curation.support.ScriptedLlmClient;
import com.newsdesk.curation.util.TokenBucketRateLimiter;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FullUpdateServiceTest {
    private final InMemoryArticleRepository repo = new InMemoryArticleRepository();
    private final InMemoryNewspaperRepository newspapers = new InMemoryNewspaperRepository();
    private final InMemorySettingsRepository settings = new InMemorySettingsRepository().category(10, "Markets", "markets", 0);
    private final ScriptedLlmClient llm = new ScriptedLlmClient();
    private final RunRegistry registry = new RunRegistry();
    private final AppProperties app = new AppProperties();
    private final List<RawArticle> feed = new ArrayList<>();

    private FullUpdateService service(FeedFetcher fetcher) {
        LlmProperties llmProps = Fixtures.llmProps(2);
        CurationProperties props = Fixtures.curationProps();
        GatedLlmClient gated = new GatedLlmClient(llm, new TokenBucketRateLimiter(llmProps), llmProps);
        LlmProcessor processor = new LlmProcessor(repo, settings, gated, new PromptBuilder(llmProps, new ContentSanitizer()),
                new EnrichmentParser(new ObjectMapper()), llmProps, Fixtures.CLOCK);
        FeedbackService feedback = new FeedbackService(repo, new ScoreAdjustmentEngine(props), gated, props, llmProps, Fixtures.CLOCK);
        NewspaperGenerator generator = new NewspaperGenerator(repo, newspapers, settings, feedback, props, Fixtures.CLOCK);
        return new FullUpdateService(
                new ArticleIngestService(fetcher, repo, Fixtures.CLOCK),
                new ArticleCleanupService(repo, app, Fixtures.CLOCK),
                processor,
                new DuplicateDetector(repo, props, Fixtures.CLOCK),
                generator, registry, new RunLogService(), app, new ObjectMapper(), Fixtures.CLOCK);
    }

    private void item(long feedId, String title, long hoursAgo) {
        RawArticle r = new RawArticle();
        r.setFeed_id(feedId);
        r.setTitle(title);
        r.setLink("https://feed" + feedId + ".example/" + title.hashCode());
        r.setContent("<p>" + title + "</p>");
        r.setPublished_date(Fixtures.NOW.minus(Duration.ofHours(hoursAgo)));
        feed.add(r);
    }

    @Test
    void runsEveryStageAndReportsCounts() {
        item(1, "Stocks surge on rate cut hopes", 3);
        item(2, "Stocks surge as rate cut hopes grow", 2);
        item(3, "New phone released", 1);
        item(3, "", 1);
        llm.answer("Stocks surge on rate cut hopes", "{\"title\":\"Stocks surge\",\"category\":\"markets\",\"relevance_score\":0.9}");
        llm.answer("Stocks surge as rate cut hopes grow", "{\"title\":\"Stocks surge again\",\"category\":\"markets\",\"relevance_score\":0.85}");
        llm.answer("New phone released", "{\"title\":\"Phone launch\",\"relevance_score\":0.7}");
        llm.vector("Stocks surge", Fixtures.axis(0));
        llm.vector("Stocks surge again", Fixtures.near(0, 1, 0.93));
        llm.vector("Phone launch", Fixtures.axis(4));

        FullUpdateService service = service(userId -> Flux.fromIterable(feed));
        FullUpdateService.RunHandle handle = service.start(1L);
        ActionDtos.FullUpdateReport report = handle.result().block(Duration.ofSeconds(30));

        assertNotNull(report);
        assertEquals("completed", report.getStatus(), String.valueOf(report.getErrors()));
        assertEquals(3, report.getNew_articles());
        assertEquals(3, report.getProcessed_articles());
        assertEquals(1, report.getDuplicates_marked());
        assertEquals(2, report.getToday_count());
        assertEquals(0, report.getCategory_count());
        assertTrue(report.getAi_usage_per_model().containsKey("gpt-4o-mini"));

        RunRegistry.RunInfo info = registry.get(handle.runId());
        assertEquals("completed", info.status);
        assertEquals(3, info.processed);
        assertSame(report, info.result);
        assertFalse(service.isRunning(1L));

        // the same feed items again are not stored twice
        ActionDtos.FullUpdateReport second = service.start(1L).result().block(Duration.ofSeconds(30));
        assertEquals(0, second.getNew_articles());
        assertEquals(3, repo.all().size());
    }

    @Test
    void concurrentTriggerJoinsTheRunningUpdate() {
        Sinks.One<Boolean> release = Sinks.one();
        FullUpdateService service = service(userId -> release.asMono().thenMany(Flux.empty()));

        FullUpdateService.RunHandle first = service.start(1L);
        FullUpdateService.RunHandle second = service.start(1L);

        assertEquals(first.runId(), second.runId());
        assertFalse(first.joined());
        assertTrue(second.joined());
        assertTrue(service.isRunning(1L));

        release.tryEmitValue(true);
        ActionDtos.FullUpdateReport a = first.result().block(Duration.ofSeconds(10));
        ActionDtos.FullUpdateReport b = second.result().block(Duration.ofSeconds(10));
        assertSame(a, b);
        assertFalse(service.isRunning(1L));

        FullUpdateService.RunHandle third = service.start(1L);
        assertNotEquals(first.runId(), third.runId());
    }

    @Test
    void fatalProviderErrorFailsTheRunButLaterStagesStillRun() {
        item(1, "Anything", 1);
        llm.onTitle("Anything", () -> Mono.error(new FatalProviderException("quota exhausted")));
        Article old = Fixtures.enriched(50, "Yesterday's pick", 0.9, Fixtures.axis(7), Fixtures.NOW.minus(Duration.ofHours(20)));
        repo.save(old);

        ActionDtos.FullUpdateReport report = service(userId -> Flux.fromIterable(feed)).start(1L).result()
                .block(Duration.ofSeconds(30));

        assertEquals("failed", report.getStatus());
        assertEquals(1, report.getFailed_articles());
        assertTrue(report.getErrors().stream().anyMatch(e -> e.startsWith("process")));
        assertEquals(1, report.getToday_count());
        assertEquals("failed", registry.latestOfType(FullUpdateService.RUN_TYPE).status);
    }

    @Test
    void failingFetchIsRecordedAndTheRestContinues() {
        repo.save(Fixtures.enriched(1, "Already here", 0.8, Fixtures.axis(0), Fixtures.NOW.minus(Duration.ofHours(2))));

        ActionDtos.FullUpdateReport report = service(userId -> Flux.error(new IllegalStateException("feed host unreachable")))
                .start(1L).result().block(Duration.ofSeconds(30));

        assertEquals("completed_with_errors", report.getStatus());
        assertEquals(List.of("fetch: feed host unreachable"), report.getErrors());
        assertEquals(1, report.getToday_count());
    }

    @Test
    void timeoutFailsTheRun() {
        app.setFullUpdateTimeout(Duration.ofMillis(200));

        ActionDtos.FullUpdateReport report = service(userId -> Flux.never()).start(1L).result()
                .block(Duration.ofSeconds(10));

        assertEquals("failed", report.getStatus());
        assertTrue(report.getErrors().get(0).startsWith("timeout"));
    }

    @Test
    void cleanupArchivesAndDeletesButKeepsDownvotes() {
        repo.save(Fixtures.enriched(1, "Week old", 0.8, Fixtures.axis(0), Fixtures.NOW.minus(Duration.ofDays(7).plusHours(1))));
        repo.save(Fixtures.enriched(2, "Ancient", 0.8, Fixtures.axis(1), Fixtures.NOW.minus(Duration.ofDays(9))));
        Article disliked = Fixtures.enriched(3, "Ancient but disliked", 0.8, Fixtures.axis(2), Fixtures.NOW.minus(Duration.ofDays(9)));
        disliked.setUser_vote(-1);
        repo.save(disliked);

        ActionDtos.FullUpdateReport report = service(userId -> Flux.empty()).start(1L).result().block(Duration.ofSeconds(10));

        assertEquals(3, report.getArchived_articles());
        assertEquals(1, report.getDeleted_articles());
        assertTrue(repo.get(1).getIs_archived());
        assertNull(repo.get(2));
        assertNotNull(repo.get(3));
    }
}
