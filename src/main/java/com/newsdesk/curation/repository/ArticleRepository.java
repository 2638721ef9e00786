package com.newsdesk.curation.repository;

import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.model.EnrichmentResult;
import com.newsdesk.curation.model.RawArticle;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;

/**
 * Article persistence. Writes that protect pipeline invariants are conditional: they report
 * {@code false} instead of overwriting when the row is no longer in the expected state.
 */
public interface ArticleRepository {

    /** Stores a fetched record. Empty when the feed already has an article with this link. */
    Mono<Long> insertIfAbsent(long userId, RawArticle raw, Instant createdAt);

    Mono<Article> findById(long id);

    Flux<Article> findByIds(long userId, Collection<Long> ids);

    /** PENDING, non-archived articles created at or after {@code since}, oldest first. */
    Flux<Article> findPending(long userId, Instant since, int limit);

    /** Write-once: applies only while the article is still PENDING. */
    Mono<Boolean> saveEnrichment(long id, EnrichmentResult result, Long categoryId, float[] embedding, Instant processedAt);

    /** PENDING to MALFORMED with relevance 0; raw fields untouched. */
    Mono<Boolean> markMalformed(long id, Instant processedAt);

    /** Puts a canonical article without duplicates back to PENDING with all derived fields cleared. */
    Mono<Boolean> resetEnrichment(long id);

    Flux<Article> findEnrichedWithoutEmbedding(long userId, int limit);

    /** Applies only while the article has no embedding. */
    Mono<Boolean> saveEmbedding(long id, float[] embedding);

    /** Embedded, not yet deduplicated, oldest reference date first. */
    Flux<Article> findDedupPending(long userId);

    /** Embedded articles whose reference date lies in [from, to]. */
    Flux<Article> findEmbeddedBetween(long userId, Instant from, Instant to);

    /**
     * Links {@code duplicateId} to {@code canonicalId}. Refused when the duplicate is already linked or has
     * duplicates of its own, or when the canonical is itself a duplicate. This keeps every cluster flat.
     */
    Mono<Boolean> markDuplicate(long duplicateId, long canonicalId);

    Mono<Boolean> markDedupChecked(long id, Instant checkedAt);

    Mono<Long> countDuplicatesOf(long canonicalId);

    Mono<Boolean> updateVote(long id, int vote, Instant at);

    /** Embedded articles with a downvote cast at or after {@code since}. */
    Flux<Article> findDownvotedSince(long userId, Instant since);

    /** ENRICHED, canonical, non-archived articles with reference date in {@code [since, until)}. */
    Flux<Article> findNewspaperPool(long userId, Instant since, Instant until);

    Mono<Long> archiveOlderThan(long userId, Instant cutoff);

    /**
     * Deletes articles older than {@code cutoff}, except downvoted ones, which feed score suppression.
     * Duplicates of deleted canonicals are detached first and become canonical themselves.
     */
    Mono<Long> deleteOlderThan(long userId, Instant cutoff);
}
