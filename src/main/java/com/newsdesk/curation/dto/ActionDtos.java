package com.newsdesk.curation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ActionDtos {
    public static class ProcessArticlesRequest {
        @NotNull
        @NotEmpty
        private List<Long> article_ids;

        public List<Long> getArticle_ids() { return article_ids; }
        public void setArticle_ids(List<Long> article_ids) { this.article_ids = article_ids; }
    }

    public static class RegenerateRequest {
        private LocalDate date; // defaults to today

        public LocalDate getDate() { return date; }
        public void setDate(LocalDate date) { this.date = date; }
    }

    /** Outcome of one enrichment batch. Every input article is counted exactly once. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ProcessingReport {
        private int requested;
        private int processed; // enriched and committed
        private int malformed;
        private int failed; // left PENDING: transient exhaustion, fatal, or skipped after abort
        private int skipped; // already processed by someone else
        private int embeddings_missing;
        private List<Long> failed_ids = new ArrayList<>();
        private boolean aborted;
        private String fatal_error;
        private Map<String, Map<String, Object>> ai_usage_per_model;
        private double ai_cost_total_usd;

        public int getRequested() { return requested; }
        public void setRequested(int requested) { this.requested = requested; }
        public int getProcessed() { return processed; }
        public void setProcessed(int processed) { this.processed = processed; }
        public int getMalformed() { return malformed; }
        public void setMalformed(int malformed) { this.malformed = malformed; }
        public int getFailed() { return failed; }
        public void setFailed(int failed) { this.failed = failed; }
        public int getSkipped() { return skipped; }
        public void setSkipped(int skipped) { this.skipped = skipped; }
        public int getEmbeddings_missing() { return embeddings_missing; }
        public void setEmbeddings_missing(int embeddings_missing) { this.embeddings_missing = embeddings_missing; }
        public List<Long> getFailed_ids() { return failed_ids; }
        public void setFailed_ids(List<Long> failed_ids) { this.failed_ids = failed_ids; }
        public boolean isAborted() { return aborted; }
        public void setAborted(boolean aborted) { this.aborted = aborted; }
        public String getFatal_error() { return fatal_error; }
        public void setFatal_error(String fatal_error) { this.fatal_error = fatal_error; }
        public Map<String, Map<String, Object>> getAi_usage_per_model() { return ai_usage_per_model; }
        public void setAi_usage_per_model(Map<String, Map<String, Object>> ai_usage_per_model) { this.ai_usage_per_model = ai_usage_per_model; }
        public double getAi_cost_total_usd() { return ai_cost_total_usd; }
        public void setAi_cost_total_usd(double ai_cost_total_usd) { this.ai_cost_total_usd = ai_cost_total_usd; }
    }

    public static class DedupReport {
        private int checked;
        private int duplicates_marked;
        private List<Long> duplicate_ids = new ArrayList<>();

        public int getChecked() { return checked; }
        public void setChecked(int checked) { this.checked = checked; }
        public int getDuplicates_marked() { return duplicates_marked; }
        public void setDuplicates_marked(int duplicates_marked) { this.duplicates_marked = duplicates_marked; }
        public List<Long> getDuplicate_ids() { return duplicate_ids; }
        public void setDuplicate_ids(List<Long> duplicate_ids) { this.duplicate_ids = duplicate_ids; }
    }

    public static class RegenerateResponse {
        private String message;
        private LocalDate date;
        private int today_count;
        private int category_count;

        public RegenerateResponse() {}

        public RegenerateResponse(String message, LocalDate date, int today_count, int category_count) {
            this.message = message;
            this.date = date;
            this.today_count = today_count;
            this.category_count = category_count;
        }

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
        public LocalDate getDate() { return date; }
        public void setDate(LocalDate date) { this.date = date; }
        public int getToday_count() { return today_count; }
        public void setToday_count(int today_count) { this.today_count = today_count; }
        public int getCategory_count() { return category_count; }
        public void setCategory_count(int category_count) { this.category_count = category_count; }
    }

    /**
     * Aggregate counts of one full update. Per-article problems show up here as counts,
     * never as errors to the caller.
     */
    public static class FullUpdateReport {
        private String run_id;
        private long user_id;
        private String status; // completed | completed_with_errors | failed
        private int new_articles;
        private int processed_articles;
        private int archived_articles;
        private int deleted_articles;
        private int malformed_articles;
        private int failed_articles;
        private int embeddings_backfilled;
        private int duplicates_marked;
        private int today_count;
        private int category_count;
        private List<String> errors = new ArrayList<>();
        private String started_at;
        private String ended_at;

        /**
         * Per-model AI token usage and approximate cost.
         * Structure: model -> { calls, prompt_tokens, completion_tokens, total_tokens, cost_usd }
         */
        private Map<String, Map<String, Object>> ai_usage_per_model;
        private double ai_cost_total_usd;

        public String getRun_id() { return run_id; }
        public void setRun_id(String run_id) { this.run_id = run_id; }
        public long getUser_id() { return user_id; }
        public void setUser_id(long user_id) { this.user_id = user_id; }
        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public int getNew_articles() { return new_articles; }
        public void setNew_articles(int new_articles) { this.new_articles = new_articles; }
        public int getProcessed_articles() { return processed_articles; }
        public void setProcessed_articles(int processed_articles) { this.processed_articles = processed_articles; }
        public int getArchived_articles() { return archived_articles; }
        public void setArchived_articles(int archived_articles) { this.archived_articles = archived_articles; }
        public int getDeleted_articles() { return deleted_articles; }
        public void setDeleted_articles(int deleted_articles) { this.deleted_articles = deleted_articles; }
        public int getMalformed_articles() { return malformed_articles; }
        public void setMalformed_articles(int malformed_articles) { this.malformed_articles = malformed_articles; }
        public int getFailed_articles() { return failed_articles; }
        public void setFailed_articles(int failed_articles) { this.failed_articles = failed_articles; }
        public int getEmbeddings_backfilled() { return embeddings_backfilled; }
        public void setEmbeddings_backfilled(int embeddings_backfilled) { this.embeddings_backfilled = embeddings_backfilled; }
        public int getDuplicates_marked() { return duplicates_marked; }
        public void setDuplicates_marked(int duplicates_marked) { this.duplicates_marked = duplicates_marked; }
        public int getToday_count() { return today_count; }
        public void setToday_count(int today_count) { this.today_count = today_count; }
        public int getCategory_count() { return category_count; }
        public void setCategory_count(int category_count) { this.category_count = category_count; }
        public List<String> getErrors() { return errors; }
        public void setErrors(List<String> errors) { this.errors = errors; }
        public String getStarted_at() { return started_at; }
        public void setStarted_at(String started_at) { this.started_at = started_at; }
        public String getEnded_at() { return ended_at; }
        public void setEnded_at(String ended_at) { this.ended_at = ended_at; }
        public Map<String, Map<String, Object>> getAi_usage_per_model() { return ai_usage_per_model; }
        public void setAi_usage_per_model(Map<String, Map<String, Object>> ai_usage_per_model) { this.ai_usage_per_model = ai_usage_per_model; }
        public double getAi_cost_total_usd() { return ai_cost_total_usd; }
        public void setAi_cost_total_usd(double ai_cost_total_usd) { this.ai_cost_total_usd = ai_cost_total_usd; }
    }
}
