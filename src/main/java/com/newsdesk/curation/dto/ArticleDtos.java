package com.newsdesk.curation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

public class ArticleDtos {
    public static class VoteResponse {
        private long article_id;
        private int user_vote;
        private Instant vote_updated_at;
        private String message;

        public VoteResponse() {}

        public VoteResponse(long article_id, int user_vote, Instant vote_updated_at, String message) {
            this.article_id = article_id;
            this.user_vote = user_vote;
            this.vote_updated_at = vote_updated_at;
            this.message = message;
        }

        public long getArticle_id() { return article_id; }
        public void setArticle_id(long article_id) { this.article_id = article_id; }
        public int getUser_vote() { return user_vote; }
        public void setUser_vote(int user_vote) { this.user_vote = user_vote; }
        public Instant getVote_updated_at() { return vote_updated_at; }
        public void setVote_updated_at(Instant vote_updated_at) { this.vote_updated_at = vote_updated_at; }
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
    }

    /** Full, on-demand account of why an article's score was lowered. Never stored. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AdjustmentExplanation {
        private long article_id;
        private boolean adjusted;
        private Double original_score;
        private Double adjusted_score;
        private Double similarity;
        private Long downvoted_article_id;
        private String downvoted_article_title;
        private List<String> shared_themes;
        private String reason;
        private String explanation;

        public long getArticle_id() { return article_id; }
        public void setArticle_id(long article_id) { this.article_id = article_id; }
        public boolean isAdjusted() { return adjusted; }
        public void setAdjusted(boolean adjusted) { this.adjusted = adjusted; }
        public Double getOriginal_score() { return original_score; }
        public void setOriginal_score(Double original_score) { this.original_score = original_score; }
        public Double getAdjusted_score() { return adjusted_score; }
        public void setAdjusted_score(Double adjusted_score) { this.adjusted_score = adjusted_score; }
        public Double getSimilarity() { return similarity; }
        public void setSimilarity(Double similarity) { this.similarity = similarity; }
        public Long getDownvoted_article_id() { return downvoted_article_id; }
        public void setDownvoted_article_id(Long downvoted_article_id) { this.downvoted_article_id = downvoted_article_id; }
        public String getDownvoted_article_title() { return downvoted_article_title; }
        public void setDownvoted_article_title(String downvoted_article_title) { this.downvoted_article_title = downvoted_article_title; }
        public List<String> getShared_themes() { return shared_themes; }
        public void setShared_themes(List<String> shared_themes) { this.shared_themes = shared_themes; }
        public String getReason() { return reason; }
        public void setReason(String reason) { this.reason = reason; }
        public String getExplanation() { return explanation; }
        public void setExplanation(String explanation) { this.explanation = explanation; }
    }
}
