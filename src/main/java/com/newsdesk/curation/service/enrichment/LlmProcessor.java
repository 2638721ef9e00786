package com.newsdesk.curation.service.enrichment;

import com.newsdesk.curation.client.BatchAbort;
import com.newsdesk.curation.client.ChatRequest;
import com.newsdesk.curation.client.GatedLlmClient;
import com.newsdesk.curation.config.LlmProperties;
import com.newsdesk.curation.dto.ActionDtos;
import com.newsdesk.curation.exception.ArticleNotFoundException;
import com.newsdesk.curation.exception.BatchAbortedException;
import com.newsdesk.curation.exception.EmbeddingUnavailableException;
import com.newsdesk.curation.exception.FatalProviderException;
import com.newsdesk.curation.exception.MalformedResponseException;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.model.Category;
import com.newsdesk.curation.model.EnrichmentResult;
import com.newsdesk.curation.model.ProcessingStatus;
import com.newsdesk.curation.repository.ArticleRepository;
import com.newsdesk.curation.repository.CurationSettingsRepository;
import com.newsdesk.curation.util.TokenAccounting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Enriches PENDING articles with the language model: improved title, subtitle, summary, category and
 * relevance score, plus a title embedding from a separate call.
 *
 * <p>Articles are handled independently, up to {@code llm.max-concurrent} at a time, each committed
 * on its own. Failure policy per article:
 * <ul>
 *   <li>transient errors are retried (inside {@link GatedLlmClient}); when retries run out the article
 *       stays PENDING for the next run</li>
 *   <li>an unusable answer marks the article MALFORMED with relevance 0 and raw fields intact</li>
 *   <li>a fatal provider error fails that article and aborts the rest of the batch: articles still waiting
 *       for a permit or a retry send nothing more and are reported as aborted. A completion already
 *       answered is still committed, without its embedding</li>
 *   <li>a failed embedding call still commits the enrichment; {@link #backfillEmbeddings} fills it in later</li>
 * </ul>
 */
@Service
public class LlmProcessor {
    private static final Logger log = LoggerFactory.getLogger(LlmProcessor.class);

    private final ArticleRepository articles;
    private final CurationSettingsRepository settings;
    private final GatedLlmClient llm;
    private final PromptBuilder prompts;
    private final EnrichmentParser parser;
    private final LlmProperties props;
    private final Clock clock;

    public LlmProcessor(ArticleRepository articles, CurationSettingsRepository settings, GatedLlmClient llm,
                        PromptBuilder prompts, EnrichmentParser parser, LlmProperties props, Clock clock) {
        this.articles = articles;
        this.settings = settings;
        this.llm = llm;
        this.prompts = prompts;
        this.parser = parser;
        this.props = props;
        this.clock = clock;
    }

    /** Next batch of PENDING articles created within the lookback window. */
    public Mono<ActionDtos.ProcessingReport> processPending(long userId, TokenAccounting accounting) {
        Instant since = clock.instant().minus(Duration.ofHours(props.getLookbackHours()));
        return articles.findPending(userId, since, props.getBatchLimit())
                .collectList()
                .flatMap(batch -> processBatch(userId, batch, accounting));
    }

    /** Explicit ids, regardless of age. Ids that are not PENDING are counted as skipped. */
    public Mono<ActionDtos.ProcessingReport> processArticles(long userId, List<Long> ids, TokenAccounting accounting) {
        return articles.findByIds(userId, ids)
                .filter(a -> a.getProcessing_status() == ProcessingStatus.PENDING)
                .collectList()
                .flatMap(batch -> processBatch(userId, batch, accounting)
                        .map(report -> {
                            int notPending = ids.size() - batch.size();
                            report.setRequested(ids.size());
                            report.setSkipped(report.getSkipped() + notPending);
                            return report;
                        }));
    }

    /**
     * Clears one article's enrichment and runs it again. Refused for articles in a duplicate cluster,
     * since their links depend on the current embedding.
     */
    public Mono<ActionDtos.ProcessingReport> reprocess(long articleId, TokenAccounting accounting) {
        return articles.findById(articleId)
                .switchIfEmpty(Mono.error(new ArticleNotFoundException(articleId)))
                .flatMap(article -> articles.resetEnrichment(articleId)
                        .flatMap(reset -> {
                            if (!reset) {
                                return Mono.error(new IllegalStateException(
                                        "Article " + articleId + " belongs to a duplicate cluster and cannot be reprocessed"));
                            }
                            return articles.findById(articleId)
                                    .flatMap(fresh -> processBatch(article.getUser_id(), List.of(fresh), accounting));
                        }));
    }

    /**
     * Embeds ENRICHED articles whose embedding call failed earlier. Stops at the first fatal error.
     *
     * @return number of embeddings stored
     */
    public Mono<Integer> backfillEmbeddings(long userId, TokenAccounting accounting) {
        BatchAbort stop = new BatchAbort();
        return articles.findEnrichedWithoutEmbedding(userId, props.getBatchLimit())
                .flatMap(a -> Mono.defer(() -> {
                    if (stop.isTripped()) return Mono.just(false);
                    return llm.embed(a.displayTitle(), accounting, stop)
                            .flatMap(e -> articles.saveEmbedding(a.getId(), e.vector()))
                            .onErrorResume(e -> {
                                log.warn("Embedding backfill failed for article {}: {}", a.getId(), e.getMessage());
                                return Mono.just(false);
                            });
                }), Math.max(1, props.getMaxConcurrent()))
                .filter(Boolean::booleanValue)
                .count()
                .map(Long::intValue)
                .doOnNext(n -> { if (n > 0) log.info("Backfilled {} title embeddings for user {}", n, userId); });
    }

    Mono<ActionDtos.ProcessingReport> processBatch(long userId, List<Article> batch, TokenAccounting accounting) {
        if (batch.isEmpty()) {
            return Mono.just(report(0, List.of(), null, accounting));
        }
        log.info("LLM processing batch of {} articles for user {}", batch.size(), userId);
        BatchAbort fatal = new BatchAbort();
        AtomicInteger done = new AtomicInteger();
        return loadContext(userId)
                .flatMap(ctx -> Flux.fromIterable(batch)
                        .flatMap(a -> processOne(a, ctx, accounting, fatal)
                                        .doOnNext(o -> log.info("LLM progress: {}/{} article={} outcome={}",
                                                done.incrementAndGet(), batch.size(), o.articleId(), o.kind())),
                                Math.max(1, props.getMaxConcurrent()))
                        .collectList())
                .map(outcomes -> report(batch.size(), outcomes, fatal.reason(), accounting));
    }

    private Mono<ArticleOutcome> processOne(Article a, Context ctx, TokenAccounting accounting,
                                            BatchAbort fatal) {
        long id = a.getId();
        return Mono.defer(() -> {
                    if (fatal.isTripped()) {
                        return Mono.just(ArticleOutcome.of(id, ArticleOutcome.Kind.ABORTED, "batch aborted: " + fatal.reason()));
                    }
                    ChatRequest request = prompts.build(a, ctx.categories(), ctx.interestPrompt());
                    return llm.complete(request, accounting, fatal)
                            .map(completion -> parser.parse(completion.content()))
                            .flatMap(result -> embedTitle(a, result, accounting, fatal)
                                    .flatMap(vec -> commit(a, result, vec.orElse(null), ctx)));
                })
                .onErrorResume(BatchAbortedException.class, e -> Mono.just(
                        ArticleOutcome.of(id, ArticleOutcome.Kind.ABORTED, "batch aborted: " + fatal.reason())))
                .onErrorResume(FatalProviderException.class, e -> {
                    fatal.trip(e.getMessage());
                    log.error("Fatal provider error on article {}; aborting remaining batch: {}", id, e.getMessage());
                    return Mono.just(ArticleOutcome.of(id, ArticleOutcome.Kind.FAILED, e.getMessage()));
                })
                .onErrorResume(MalformedResponseException.class, e -> {
                    log.warn("Malformed enrichment for article {}: {}", id, e.getMessage());
                    return articles.markMalformed(id, clock.instant())
                            .map(ok -> ArticleOutcome.of(id, ok ? ArticleOutcome.Kind.MALFORMED : ArticleOutcome.Kind.SKIPPED,
                                    e.getMessage()));
                })
                .onErrorResume(e -> {
                    log.warn("Enrichment failed for article {}; left pending: {}", id, e.toString());
                    return Mono.just(ArticleOutcome.of(id, ArticleOutcome.Kind.FAILED, e.toString()));
                });
    }

    private Mono<Optional<float[]>> embedTitle(Article a, EnrichmentResult result, TokenAccounting accounting,
                                               BatchAbort fatal) {
        String text = result.title() != null ? result.title() : a.getTitle();
        return llm.embed(text, accounting, fatal)
                .map(e -> Optional.of(e.vector()))
                .onErrorResume(FatalProviderException.class, e -> {
                    fatal.trip(e.getMessage());
                    log.error("Fatal provider error while embedding article {}; aborting remaining batch: {}",
                            a.getId(), e.getMessage());
                    return Mono.just(Optional.empty());
                })
                .onErrorResume(BatchAbortedException.class, e -> Mono.just(Optional.empty()))
                .onErrorResume(EmbeddingUnavailableException.class, e -> {
                    log.warn("Embedding unavailable for article {}: {}", a.getId(), e.getMessage());
                    return Mono.just(Optional.empty());
                });
    }

    private Mono<ArticleOutcome> commit(Article a, EnrichmentResult result, float[] embedding, Context ctx) {
        Long categoryId = parser.resolveCategory(result.categorySuggestion(), ctx.categories());
        return articles.saveEnrichment(a.getId(), result, categoryId, embedding, clock.instant())
                .map(saved -> saved
                        ? ArticleOutcome.enriched(a.getId(), embedding != null)
                        : ArticleOutcome.of(a.getId(), ArticleOutcome.Kind.SKIPPED, "already processed"));
    }

    private Mono<Context> loadContext(long userId) {
        return Mono.zip(
                        settings.findActiveCategories(userId).collectList(),
                        settings.findInterestPrompt(userId).defaultIfEmpty(PromptBuilder.DEFAULT_INTEREST_PROMPT))
                .map(t -> new Context(t.getT1(), t.getT2()));
    }

    private ActionDtos.ProcessingReport report(int requested, List<ArticleOutcome> outcomes, String fatal,
                                               TokenAccounting accounting) {
        ActionDtos.ProcessingReport r = new ActionDtos.ProcessingReport();
        r.setRequested(requested);
        for (ArticleOutcome o : outcomes) {
            switch (o.kind()) {
                case ENRICHED -> {
                    r.setProcessed(r.getProcessed() + 1);
                    if (!o.embedded()) r.setEmbeddings_missing(r.getEmbeddings_missing() + 1);
                }
                case MALFORMED -> r.setMalformed(r.getMalformed() + 1);
                case SKIPPED -> r.setSkipped(r.getSkipped() + 1);
                case FAILED, ABORTED -> {
                    r.setFailed(r.getFailed() + 1);
                    r.getFailed_ids().add(o.articleId());
                }
            }
        }
        r.getFailed_ids().sort(Long::compare);
        r.setAborted(fatal != null);
        r.setFatal_error(fatal);
        if (accounting != null) {
            var snapshot = accounting.snapshotWithCosts();
            r.setAi_usage_per_model(accounting.toReport());
            r.setAi_cost_total_usd(TokenAccounting.totalCostUsd(snapshot));
        }
        if (requested > 0) {
            log.info("LLM batch done: processed={} malformed={} failed={} skipped={} aborted={}",
                    r.getProcessed(), r.getMalformed(), r.getFailed(), r.getSkipped(), r.isAborted());
        }
        return r;
    }

    private record Context(List<Category> categories, String interestPrompt) {}
}
