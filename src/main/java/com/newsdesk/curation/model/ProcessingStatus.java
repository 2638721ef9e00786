package com.newsdesk.curation.model;

public enum ProcessingStatus {
    /** Fetched, not yet enriched (or enrichment failed transiently and will be retried). */
    PENDING,
    ENRICHED,
    /** The model's answer was unusable; raw fields kept, relevance 0. */
    MALFORMED
}
