package com.newsdesk.curation.service.feedback;

/**
 * Result of applying downvote feedback to one article.
 *
 * @param adjustedScore equals {@code originalScore} exactly when no suppression applies
 * @param similarity    highest similarity to a downvoted article, or null when none was comparable
 * @param reason        short text for list display; null when not adjusted
 */
public record ScoreAdjustment(Double originalScore, Double adjustedScore, boolean adjusted,
                              Double similarity, Long triggerArticleId, String triggerTitle, String reason) {

    static ScoreAdjustment unchanged(Double original, Double similarity, Long triggerId, String triggerTitle) {
        return new ScoreAdjustment(original, original, false, similarity, triggerId, triggerTitle, null);
    }
}
