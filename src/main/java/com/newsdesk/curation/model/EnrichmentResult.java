package com.newsdesk.curation.model;

/**
 * Typed answer of one enrichment call. Produced only by the parser, so every instance is valid:
 * title is non-blank and relevance is within [0, 1].
 *
 * @param subtitle           optional
 * @param summary            optional
 * @param categorySuggestion raw category text as the model returned it, optional
 */
public record EnrichmentResult(String title, String subtitle, String summary,
                               String categorySuggestion, double relevanceScore) {
}
