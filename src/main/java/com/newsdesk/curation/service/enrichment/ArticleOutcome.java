package com.newsdesk.curation.service.enrichment;

/**
 * What happened to one article in a processing batch.
 */
record ArticleOutcome(long articleId, Kind kind, boolean embedded, String error) {

    enum Kind {
        ENRICHED,
        MALFORMED,
        /** Left PENDING after a transient or fatal failure; the next run retries it. */
        FAILED,
        /** Not attempted because an earlier fatal error aborted the batch. */
        ABORTED,
        /** Someone else finished it first; nothing written. */
        SKIPPED
    }

    static ArticleOutcome enriched(long id, boolean embedded) {
        return new ArticleOutcome(id, Kind.ENRICHED, embedded, null);
    }

    static ArticleOutcome of(long id, Kind kind, String error) {
        return new ArticleOutcome(id, kind, false, error);
    }
}
