package com.newsdesk.curation.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.model.EnrichmentResult;
import com.newsdesk.curation.model.ProcessingStatus;
import com.newsdesk.curation.model.RawArticle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static com.newsdesk.curation.repository.R2dbcRows.*;

@Repository
public class R2dbcArticleRepository implements ArticleRepository {
    private static final Logger log = LoggerFactory.getLogger(R2dbcArticleRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String COLUMNS = "id, user_id, feed_id, category_id, title, link, description, content, author, " +
            "published_date, image_urls, llm_title, llm_subtitle, llm_summary, llm_category_suggestion, relevance_score, " +
            "title_embedding, is_duplicate, duplicate_of_id, user_vote, vote_updated_at, is_read, is_archived, " +
            "processing_status, processed_at, dedup_checked_at, created_at";
    private static final String REF_DATE = "COALESCE(published_date, created_at)";

    private final DatabaseClient db;
    private final ObjectMapper mapper;

    public R2dbcArticleRepository(DatabaseClient db, ObjectMapper mapper) {
        this.db = db;
        this.mapper = mapper;
        ensureSchema().subscribe(
                v -> {},
                e -> log.error("articles schema init failed: {}", e.toString()));
    }

    private Mono<Void> ensureSchema() {
        String ddl = "CREATE TABLE IF NOT EXISTS articles (" +
                "id BIGSERIAL PRIMARY KEY, " +
                "user_id BIGINT NOT NULL, " +
                "feed_id BIGINT NOT NULL DEFAULT 0, " +
                "category_id BIGINT, " +
                "title TEXT NOT NULL, " +
                "link TEXT NOT NULL, " +
                "description TEXT, " +
                "content TEXT, " +
                "author TEXT, " +
                "published_date TIMESTAMPTZ, " +
                "image_urls TEXT, " +
                "llm_title TEXT, " +
                "llm_subtitle TEXT, " +
                "llm_summary TEXT, " +
                "llm_category_suggestion TEXT, " +
                "relevance_score DOUBLE PRECISION, " +
                "title_embedding TEXT, " +
                "is_duplicate BOOLEAN NOT NULL DEFAULT FALSE, " +
                "duplicate_of_id BIGINT, " +
                "user_vote INTEGER NOT NULL DEFAULT 0, " +
                "vote_updated_at TIMESTAMPTZ, " +
                "is_read BOOLEAN NOT NULL DEFAULT FALSE, " +
                "is_archived BOOLEAN NOT NULL DEFAULT FALSE, " +
                "processing_status TEXT NOT NULL DEFAULT 'PENDING', " +
                "processed_at TIMESTAMPTZ, " +
                "dedup_checked_at TIMESTAMPTZ, " +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(), " +
                "UNIQUE (user_id, feed_id, link)" +
                ")";
        List<String> indexes = List.of(
                "CREATE INDEX IF NOT EXISTS idx_articles_status ON articles (user_id, processing_status, created_at)",
                "CREATE INDEX IF NOT EXISTS idx_articles_duplicate_of ON articles (duplicate_of_id)",
                "CREATE INDEX IF NOT EXISTS idx_articles_vote ON articles (user_id, user_vote, vote_updated_at)");
        return db.sql(ddl).fetch().rowsUpdated()
                .thenMany(Flux.fromIterable(indexes).concatMap(sql -> db.sql(sql).fetch().rowsUpdated()))
                .then();
    }

    @Override
    public Mono<Long> insertIfAbsent(long userId, RawArticle raw, Instant createdAt) {
        DatabaseClient.GenericExecuteSpec spec = db.sql("INSERT INTO articles (user_id, feed_id, category_id, title, link, " +
                        "description, content, author, published_date, image_urls, created_at) " +
                        "VALUES (:uid, :feed, :category, :title, :link, :description, :content, :author, :published, :images, :created) " +
                        "ON CONFLICT (user_id, feed_id, link) DO NOTHING RETURNING id")
                .bind("uid", userId)
                .bind("feed", raw.getFeed_id() != null ? raw.getFeed_id() : 0L)
                .bind("title", raw.getTitle())
                .bind("link", raw.getLink())
                .bind("created", createdAt);
        spec = bindNullable(spec, "category", raw.getCategory_id(), Long.class);
        spec = bindNullable(spec, "description", raw.getDescription(), String.class);
        spec = bindNullable(spec, "content", raw.getContent(), String.class);
        spec = bindNullable(spec, "author", raw.getAuthor(), String.class);
        spec = bindNullable(spec, "published", raw.getPublished_date(), Instant.class);
        spec = bindNullable(spec, "images", writeJson(raw.getImage_urls()), String.class);
        return spec.fetch().first().map(m -> toLong(m.get("id")));
    }

    @Override
    public Mono<Article> findById(long id) {
        return db.sql("SELECT " + COLUMNS + " FROM articles WHERE id = :id")
                .bind("id", id)
                .fetch().first()
                .map(this::toArticle);
    }

    @Override
    public Flux<Article> findByIds(long userId, Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) return Flux.empty();
        return db.sql("SELECT " + COLUMNS + " FROM articles WHERE user_id = :uid AND id IN (:ids) ORDER BY id")
                .bind("uid", userId)
                .bind("ids", new ArrayList<>(ids))
                .fetch().all()
                .map(this::toArticle);
    }

    @Override
    public Flux<Article> findPending(long userId, Instant since, int limit) {
        return db.sql("SELECT " + COLUMNS + " FROM articles WHERE user_id = :uid AND processing_status = 'PENDING' " +
                        "AND is_archived = FALSE AND created_at >= :since ORDER BY created_at, id LIMIT :limit")
                .bind("uid", userId)
                .bind("since", since)
                .bind("limit", limit)
                .fetch().all()
                .map(this::toArticle);
    }

    @Override
    public Mono<Boolean> saveEnrichment(long id, EnrichmentResult result, Long categoryId, float[] embedding, Instant processedAt) {
        DatabaseClient.GenericExecuteSpec spec = db.sql("UPDATE articles SET llm_title = :title, llm_subtitle = :subtitle, " +
                        "llm_summary = :summary, llm_category_suggestion = :suggestion, relevance_score = :score, " +
                        "category_id = COALESCE(:category, category_id), title_embedding = :embedding, " +
                        "processing_status = 'ENRICHED', processed_at = :at " +
                        "WHERE id = :id AND processing_status = 'PENDING'")
                .bind("id", id)
                .bind("title", result.title())
                .bind("score", result.relevanceScore())
                .bind("at", processedAt);
        spec = bindNullable(spec, "subtitle", result.subtitle(), String.class);
        spec = bindNullable(spec, "summary", result.summary(), String.class);
        spec = bindNullable(spec, "suggestion", result.categorySuggestion(), String.class);
        spec = bindNullable(spec, "category", categoryId, Long.class);
        spec = bindNullable(spec, "embedding", writeJson(embedding), String.class);
        return spec.fetch().rowsUpdated().map(n -> n > 0);
    }

    @Override
    public Mono<Boolean> markMalformed(long id, Instant processedAt) {
        return db.sql("UPDATE articles SET processing_status = 'MALFORMED', relevance_score = 0, processed_at = :at " +
                        "WHERE id = :id AND processing_status = 'PENDING'")
                .bind("id", id)
                .bind("at", processedAt)
                .fetch().rowsUpdated().map(n -> n > 0);
    }

    @Override
    public Mono<Boolean> resetEnrichment(long id) {
        return db.sql("UPDATE articles SET llm_title = NULL, llm_subtitle = NULL, llm_summary = NULL, " +
                        "llm_category_suggestion = NULL, relevance_score = NULL, title_embedding = NULL, " +
                        "processing_status = 'PENDING', processed_at = NULL, dedup_checked_at = NULL " +
                        "WHERE id = :id AND is_duplicate = FALSE AND duplicate_of_id IS NULL " +
                        "AND NOT EXISTS (SELECT 1 FROM articles d WHERE d.duplicate_of_id = :id)")
                .bind("id", id)
                .fetch().rowsUpdated().map(n -> n > 0);
    }

    @Override
    public Flux<Article> findEnrichedWithoutEmbedding(long userId, int limit) {
        return db.sql("SELECT " + COLUMNS + " FROM articles WHERE user_id = :uid AND processing_status = 'ENRICHED' " +
                        "AND title_embedding IS NULL AND is_archived = FALSE ORDER BY created_at, id LIMIT :limit")
                .bind("uid", userId)
                .bind("limit", limit)
                .fetch().all()
                .map(this::toArticle);
    }

    @Override
    public Mono<Boolean> saveEmbedding(long id, float[] embedding) {
        return db.sql("UPDATE articles SET title_embedding = :embedding WHERE id = :id AND title_embedding IS NULL")
                .bind("id", id)
                .bind("embedding", writeJson(embedding))
                .fetch().rowsUpdated().map(n -> n > 0);
    }

    @Override
    public Flux<Article> findDedupPending(long userId) {
        return db.sql("SELECT " + COLUMNS + " FROM articles WHERE user_id = :uid AND title_embedding IS NOT NULL " +
                        "AND dedup_checked_at IS NULL ORDER BY " + REF_DATE + ", id")
                .bind("uid", userId)
                .fetch().all()
                .map(this::toArticle);
    }

    @Override
    public Flux<Article> findEmbeddedBetween(long userId, Instant from, Instant to) {
        return db.sql("SELECT " + COLUMNS + " FROM articles WHERE user_id = :uid AND title_embedding IS NOT NULL " +
                        "AND " + REF_DATE + " BETWEEN :from AND :to ORDER BY " + REF_DATE + ", id")
                .bind("uid", userId)
                .bind("from", from)
                .bind("to", to)
                .fetch().all()
                .map(this::toArticle);
    }

    @Override
    public Mono<Boolean> markDuplicate(long duplicateId, long canonicalId) {
        if (duplicateId == canonicalId) return Mono.just(false);
        return db.sql("UPDATE articles SET is_duplicate = TRUE, duplicate_of_id = :canonical " +
                        "WHERE id = :id AND is_duplicate = FALSE AND duplicate_of_id IS NULL " +
                        "AND NOT EXISTS (SELECT 1 FROM articles d WHERE d.duplicate_of_id = :id) " +
                        "AND EXISTS (SELECT 1 FROM articles c WHERE c.id = :canonical " +
                        "AND c.is_duplicate = FALSE AND c.duplicate_of_id IS NULL)")
                .bind("id", duplicateId)
                .bind("canonical", canonicalId)
                .fetch().rowsUpdated().map(n -> n > 0);
    }

    @Override
    public Mono<Boolean> markDedupChecked(long id, Instant checkedAt) {
        return db.sql("UPDATE articles SET dedup_checked_at = :at WHERE id = :id")
                .bind("id", id)
                .bind("at", checkedAt)
                .fetch().rowsUpdated().map(n -> n > 0);
    }

    @Override
    public Mono<Long> countDuplicatesOf(long canonicalId) {
        return db.sql("SELECT COUNT(*) AS n FROM articles WHERE duplicate_of_id = :id")
                .bind("id", canonicalId)
                .fetch().first()
                .map(m -> toLong(m.get("n")))
                .defaultIfEmpty(0L);
    }

    @Override
    public Mono<Boolean> updateVote(long id, int vote, Instant at) {
        return db.sql("UPDATE articles SET user_vote = :vote, vote_updated_at = :at WHERE id = :id")
                .bind("id", id)
                .bind("vote", vote)
                .bind("at", at)
                .fetch().rowsUpdated().map(n -> n > 0);
    }

    @Override
    public Flux<Article> findDownvotedSince(long userId, Instant since) {
        return db.sql("SELECT " + COLUMNS + " FROM articles WHERE user_id = :uid AND user_vote = -1 " +
                        "AND title_embedding IS NOT NULL AND vote_updated_at >= :since ORDER BY id")
                .bind("uid", userId)
                .bind("since", since)
                .fetch().all()
                .map(this::toArticle);
    }

    @Override
    public Flux<Article> findNewspaperPool(long userId, Instant since, Instant until) {
        return db.sql("SELECT " + COLUMNS + " FROM articles WHERE user_id = :uid AND processing_status = 'ENRICHED' " +
                        "AND is_archived = FALSE AND is_duplicate = FALSE AND duplicate_of_id IS NULL " +
                        "AND " + REF_DATE + " >= :since AND " + REF_DATE + " < :until ORDER BY id")
                .bind("uid", userId)
                .bind("since", since)
                .bind("until", until)
                .fetch().all()
                .map(this::toArticle);
    }

    @Override
    public Mono<Long> archiveOlderThan(long userId, Instant cutoff) {
        return db.sql("UPDATE articles SET is_archived = TRUE WHERE user_id = :uid AND is_archived = FALSE " +
                        "AND " + REF_DATE + " < :cutoff")
                .bind("uid", userId)
                .bind("cutoff", cutoff)
                .fetch().rowsUpdated();
    }

    @Override
    public Mono<Long> deleteOlderThan(long userId, Instant cutoff) {
        String doomed = "SELECT id FROM articles WHERE user_id = :uid AND user_vote = 0 AND " + REF_DATE + " < :cutoff";
        Mono<Long> detach = db.sql("UPDATE articles SET is_duplicate = FALSE, duplicate_of_id = NULL " +
                        "WHERE user_id = :uid AND duplicate_of_id IN (" + doomed + ")")
                .bind("uid", userId)
                .bind("cutoff", cutoff)
                .fetch().rowsUpdated();
        Mono<Long> delete = db.sql("DELETE FROM articles WHERE user_id = :uid AND user_vote = 0 AND " + REF_DATE + " < :cutoff")
                .bind("uid", userId)
                .bind("cutoff", cutoff)
                .fetch().rowsUpdated();
        return detach
                .doOnNext(n -> { if (n > 0) log.info("Detached {} duplicates from expiring canonicals", n); })
                .then(delete);
    }

    private Article toArticle(Map<String, Object> m) {
        Article a = new Article();
        a.setId(toLong(m.get("id")));
        a.setUser_id(toLong(m.get("user_id")));
        a.setFeed_id(toLong(m.get("feed_id")));
        a.setCategory_id(toLong(m.get("category_id")));
        a.setTitle(toStr(m.get("title")));
        a.setLink(toStr(m.get("link")));
        a.setDescription(toStr(m.get("description")));
        a.setContent(toStr(m.get("content")));
        a.setAuthor(toStr(m.get("author")));
        a.setPublished_date(toInstant(m.get("published_date")));
        a.setImage_urls(readJson(toStr(m.get("image_urls")), STRING_LIST));
        a.setLlm_title(toStr(m.get("llm_title")));
        a.setLlm_subtitle(toStr(m.get("llm_subtitle")));
        a.setLlm_summary(toStr(m.get("llm_summary")));
        a.setLlm_category_suggestion(toStr(m.get("llm_category_suggestion")));
        a.setRelevance_score(toDouble(m.get("relevance_score")));
        a.setTitle_embedding(readEmbedding(toStr(m.get("title_embedding"))));
        a.setIs_duplicate(toBool(m.get("is_duplicate")));
        a.setDuplicate_of_id(toLong(m.get("duplicate_of_id")));
        a.setUser_vote(toInt(m.get("user_vote")));
        a.setVote_updated_at(toInstant(m.get("vote_updated_at")));
        a.setIs_read(toBool(m.get("is_read")));
        a.setIs_archived(toBool(m.get("is_archived")));
        String status = toStr(m.get("processing_status"));
        a.setProcessing_status(status != null ? ProcessingStatus.valueOf(status) : ProcessingStatus.PENDING);
        a.setProcessed_at(toInstant(m.get("processed_at")));
        a.setDedup_checked_at(toInstant(m.get("dedup_checked_at")));
        a.setCreated_at(toInstant(m.get("created_at")));
        return a;
    }

    private String writeJson(Object value) {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize column value: " + e.getMessage(), e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) return null;
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable JSON column: {}", e.getOriginalMessage());
            return null;
        }
    }

    private float[] readEmbedding(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return mapper.readValue(json, float[].class);
        } catch (JsonProcessingException e) {
            // Treated as missing; the backfill pass can't repair it because the column is non-null.
            log.warn("Unreadable embedding column: {}", e.getOriginalMessage());
            return null;
        }
    }
}
