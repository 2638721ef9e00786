package com.newsdesk.curation.support;

import com.newsdesk.curation.config.CurationProperties;
import com.newsdesk.curation.config.LlmProperties;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.model.ProcessingStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

public final class Fixtures {
    public static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    public static final int DIM = 16;

    private Fixtures() {}

    /** Fast-failing settings: no waiting on retries, generous budget. */
    public static LlmProperties llmProps(int maxConcurrent) {
        LlmProperties p = new LlmProperties();
        p.setApiKey("test-key");
        p.setTokensPerMinute(1_000_000);
        p.setMaxConcurrent(maxConcurrent);
        p.setMaxRetries(1);
        p.setRetryBackoffMs(1);
        p.setMaxRateLimitRetries(1);
        return p;
    }

    public static CurationProperties curationProps() {
        return new CurationProperties();
    }

    /** Unit vector along {@code axis}. */
    public static float[] axis(int axis) {
        float[] v = new float[DIM];
        v[axis] = 1f;
        return v;
    }

    /** Unit vector whose cosine with {@code axis(axis)} is exactly-ish {@code similarity}. */
    public static float[] near(int axis, int spill, double similarity) {
        float[] v = new float[DIM];
        v[axis] = (float) similarity;
        v[spill] = (float) Math.sqrt(1 - similarity * similarity);
        return v;
    }

    public static Article enriched(long id, String title, double score, float[] embedding, Instant published) {
        Article a = new Article();
        a.setId(id);
        a.setUser_id(1L);
        a.setFeed_id(1L);
        a.setTitle(title);
        a.setLink("https://news.example/" + id);
        a.setLlm_title(title);
        a.setRelevance_score(score);
        a.setTitle_embedding(embedding);
        a.setPublished_date(published);
        a.setCreated_at(published);
        a.setProcessing_status(ProcessingStatus.ENRICHED);
        return a;
    }

    public static Article pending(long id, String title, Instant created) {
        Article a = new Article();
        a.setId(id);
        a.setUser_id(1L);
        a.setFeed_id(1L);
        a.setTitle(title);
        a.setLink("https://news.example/" + id);
        a.setContent("<p>Body of " + title + "</p>");
        a.setCreated_at(created);
        a.setPublished_date(created);
        return a;
    }
}
