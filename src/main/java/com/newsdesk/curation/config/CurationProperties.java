package com.newsdesk.curation.config;

import com.newsdesk.curation.service.feedback.DecayCurve;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Thresholds and sizes for deduplication, feedback suppression and newspaper composition.
 *
 * <p>The duplicate threshold and the feedback threshold are independent: a pair above 0.80 but below
 * 0.85 is suppressed without being linked as a duplicate.
 */
@ConfigurationProperties(prefix = "curation")
public class CurationProperties {
    private final Duplicate duplicate = new Duplicate();
    private final Feedback feedback = new Feedback();
    private final Newspaper newspaper = new Newspaper();

    public Duplicate getDuplicate() { return duplicate; }
    public Feedback getFeedback() { return feedback; }
    public Newspaper getNewspaper() { return newspaper; }

    public static class Duplicate {
        /** Cosine similarity at or above which two articles are the same story. */
        private double threshold = 0.85;
        /** Candidates are limited to articles dated within this many days of the subject. */
        private int windowDays = 2;

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
        public int getWindowDays() { return windowDays; }
        public void setWindowDays(int windowDays) { this.windowDays = windowDays; }
    }

    public static class Feedback {
        /** Similarity strictly above which a downvote suppresses another article. */
        private double threshold = 0.80;
        /** Only downvotes cast within this many days are considered. */
        private int windowDays = 30;
        private DecayCurve decayCurve = DecayCurve.COMPLEMENT;
        /** Used by {@link DecayCurve#RAMP} only: suppression reached at similarity 1.0. */
        private double decayStrength = 1.0;
        /** When true, on-demand explanations ask the model for a narrative. */
        private boolean llmExplanations;

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
        public int getWindowDays() { return windowDays; }
        public void setWindowDays(int windowDays) { this.windowDays = windowDays; }
        public DecayCurve getDecayCurve() { return decayCurve; }
        public void setDecayCurve(DecayCurve decayCurve) { this.decayCurve = decayCurve; }
        public double getDecayStrength() { return decayStrength; }
        public void setDecayStrength(double decayStrength) { this.decayStrength = decayStrength; }
        public boolean isLlmExplanations() { return llmExplanations; }
        public void setLlmExplanations(boolean llmExplanations) { this.llmExplanations = llmExplanations; }
    }

    public static class Newspaper {
        private int windowDays = 3;
        private double selectionThreshold = 0.6;
        private int todaySize = 20;
        private int maxPerFeed = 3;
        private int categorySize = 10;
        private boolean excludeTodayFromCategories = true;

        public int getWindowDays() { return windowDays; }
        public void setWindowDays(int windowDays) { this.windowDays = windowDays; }
        public double getSelectionThreshold() { return selectionThreshold; }
        public void setSelectionThreshold(double selectionThreshold) { this.selectionThreshold = selectionThreshold; }
        public int getTodaySize() { return todaySize; }
        public void setTodaySize(int todaySize) { this.todaySize = todaySize; }
        public int getMaxPerFeed() { return maxPerFeed; }
        public void setMaxPerFeed(int maxPerFeed) { this.maxPerFeed = maxPerFeed; }
        public int getCategorySize() { return categorySize; }
        public void setCategorySize(int categorySize) { this.categorySize = categorySize; }
        public boolean isExcludeTodayFromCategories() { return excludeTodayFromCategories; }
        public void setExcludeTodayFromCategories(boolean excludeTodayFromCategories) { this.excludeTodayFromCategories = excludeTodayFromCategories; }
    }
}
