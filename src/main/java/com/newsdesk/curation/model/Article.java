package com.newsdesk.curation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One fetched item, mutated in place as it moves through enrichment, deduplication and feedback.
 * Field names follow the column and JSON names.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Article {
    private Long id;
    private Long user_id;
    private Long feed_id;
    private Long category_id; // null until classified
    private String title; // raw, immutable once fetched
    private String link;
    private String description;
    private String content;
    private String author;
    private Instant published_date;
    private List<String> image_urls;
    private String llm_title; // enriched, written once
    private String llm_subtitle;
    private String llm_summary;
    private String llm_category_suggestion;
    private Double relevance_score; // model judgment, never changed by feedback
    @JsonIgnore
    private float[] title_embedding;
    private boolean is_duplicate;
    private Long duplicate_of_id; // always points at a canonical article
    private int user_vote; // -1 or 0
    private Instant vote_updated_at;
    private Double adjusted_relevance_score; // derived on read
    private String score_adjustment_reason;
    private boolean is_read;
    private boolean is_archived;
    private ProcessingStatus processing_status = ProcessingStatus.PENDING;
    private Instant processed_at;
    private Instant dedup_checked_at;
    private Instant created_at;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getUser_id() { return user_id; }
    public void setUser_id(Long user_id) { this.user_id = user_id; }
    public Long getFeed_id() { return feed_id; }
    public void setFeed_id(Long feed_id) { this.feed_id = feed_id; }
    public Long getCategory_id() { return category_id; }
    public void setCategory_id(Long category_id) { this.category_id = category_id; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getLink() { return link; }
    public void setLink(String link) { this.link = link; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
    public String getAuthor() { return author; }
    public void setAuthor(String author) { this.author = author; }
    public Instant getPublished_date() { return published_date; }
    public void setPublished_date(Instant published_date) { this.published_date = published_date; }
    public List<String> getImage_urls() { return image_urls; }
    public void setImage_urls(List<String> image_urls) { this.image_urls = image_urls; }
    public String getLlm_title() { return llm_title; }
    public void setLlm_title(String llm_title) { this.llm_title = llm_title; }
    public String getLlm_subtitle() { return llm_subtitle; }
    public void setLlm_subtitle(String llm_subtitle) { this.llm_subtitle = llm_subtitle; }
    public String getLlm_summary() { return llm_summary; }
    public void setLlm_summary(String llm_summary) { this.llm_summary = llm_summary; }
    public String getLlm_category_suggestion() { return llm_category_suggestion; }
    public void setLlm_category_suggestion(String llm_category_suggestion) { this.llm_category_suggestion = llm_category_suggestion; }
    public Double getRelevance_score() { return relevance_score; }
    public void setRelevance_score(Double relevance_score) { this.relevance_score = relevance_score; }
    @JsonIgnore
    public float[] getTitle_embedding() { return title_embedding; }
    public void setTitle_embedding(float[] title_embedding) { this.title_embedding = title_embedding; }
    public boolean getIs_duplicate() { return is_duplicate; }
    public void setIs_duplicate(boolean is_duplicate) { this.is_duplicate = is_duplicate; }
    public Long getDuplicate_of_id() { return duplicate_of_id; }
    public void setDuplicate_of_id(Long duplicate_of_id) { this.duplicate_of_id = duplicate_of_id; }
    public int getUser_vote() { return user_vote; }
    public void setUser_vote(int user_vote) { this.user_vote = user_vote; }
    public Instant getVote_updated_at() { return vote_updated_at; }
    public void setVote_updated_at(Instant vote_updated_at) { this.vote_updated_at = vote_updated_at; }
    public Double getAdjusted_relevance_score() { return adjusted_relevance_score; }
    public void setAdjusted_relevance_score(Double adjusted_relevance_score) { this.adjusted_relevance_score = adjusted_relevance_score; }
    public String getScore_adjustment_reason() { return score_adjustment_reason; }
    public void setScore_adjustment_reason(String score_adjustment_reason) { this.score_adjustment_reason = score_adjustment_reason; }
    public boolean getIs_read() { return is_read; }
    public void setIs_read(boolean is_read) { this.is_read = is_read; }
    public boolean getIs_archived() { return is_archived; }
    public void setIs_archived(boolean is_archived) { this.is_archived = is_archived; }
    public ProcessingStatus getProcessing_status() { return processing_status; }
    public void setProcessing_status(ProcessingStatus processing_status) { this.processing_status = processing_status; }
    public Instant getProcessed_at() { return processed_at; }
    public void setProcessed_at(Instant processed_at) { this.processed_at = processed_at; }
    public Instant getDedup_checked_at() { return dedup_checked_at; }
    public void setDedup_checked_at(Instant dedup_checked_at) { this.dedup_checked_at = dedup_checked_at; }
    public Instant getCreated_at() { return created_at; }
    public void setCreated_at(Instant created_at) { this.created_at = created_at; }

    /** Published date, falling back to the fetch time for feeds that omit it. */
    @JsonIgnore
    public Instant referenceDate() {
        return published_date != null ? published_date : created_at;
    }

    @JsonIgnore
    public boolean isCanonical() {
        return !is_duplicate && duplicate_of_id == null;
    }

    @JsonIgnore
    public boolean hasEmbedding() {
        return title_embedding != null && title_embedding.length > 0;
    }

    /** Title shown to readers: the improved one when enrichment produced it. */
    @JsonIgnore
    public String displayTitle() {
        return llm_title != null && !llm_title.isBlank() ? llm_title : title;
    }

    public Article copy() {
        Article a = new Article();
        a.id = id;
        a.user_id = user_id;
        a.feed_id = feed_id;
        a.category_id = category_id;
        a.title = title;
        a.link = link;
        a.description = description;
        a.content = content;
        a.author = author;
        a.published_date = published_date;
        a.image_urls = image_urls != null ? new ArrayList<>(image_urls) : null;
        a.llm_title = llm_title;
        a.llm_subtitle = llm_subtitle;
        a.llm_summary = llm_summary;
        a.llm_category_suggestion = llm_category_suggestion;
        a.relevance_score = relevance_score;
        a.title_embedding = title_embedding != null ? title_embedding.clone() : null;
        a.is_duplicate = is_duplicate;
        a.duplicate_of_id = duplicate_of_id;
        a.user_vote = user_vote;
        a.vote_updated_at = vote_updated_at;
        a.adjusted_relevance_score = adjusted_relevance_score;
        a.score_adjustment_reason = score_adjustment_reason;
        a.is_read = is_read;
        a.is_archived = is_archived;
        a.processing_status = processing_status;
        a.processed_at = processed_at;
        a.dedup_checked_at = dedup_checked_at;
        a.created_at = created_at;
        return a;
    }
}
