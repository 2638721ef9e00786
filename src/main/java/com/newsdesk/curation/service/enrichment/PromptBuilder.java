package com.newsdesk.curation.service.enrichment;

import com.newsdesk.curation.client.ChatRequest;
import com.newsdesk.curation.config.LlmProperties;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.model.Category;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the enrichment request for one article. The user's interest prompt is capped so that a long
 * stored prompt cannot crowd out the article itself.
 */
@Component
public class PromptBuilder {
    public static final String DEFAULT_INTEREST_PROMPT = "Select all articles that are informative and well-written.";
    /** Budget reserved for the system prompt, headers and category list. */
    static final int SCAFFOLDING_TOKENS = 1000;
    static final int MAX_COMPLETION_TOKENS = 400;

    private static final String SYSTEM_PROMPT = """
            You curate news for one reader. For the article you are given, return a JSON object with:
              "title": a clear newspaper-style headline, at most 80 characters
              "subtitle": a one-line tagline, at most 100 characters, or null
              "summary": two or three sentences
              "category": the id of the best matching category from the list, or null when none fits
              "relevance_score": a number from 0.0 to 1.0 measuring ONLY how well the article matches the reader's interests
            Write in the article's own language; never translate.
            Score guide: 0.9-1.0 core interest, 0.7-0.9 strongly related, 0.6-0.7 clearly related,
            0.4-0.6 tangential, below 0.4 unrelated.""";

    private final LlmProperties props;
    private final ContentSanitizer sanitizer;

    public PromptBuilder(LlmProperties props, ContentSanitizer sanitizer) {
        this.props = props;
        this.sanitizer = sanitizer;
    }

    public ChatRequest build(Article article, List<Category> categories, String interestPrompt) {
        int contentBudget = Math.max(100, props.getMaxInputTokens() - SCAFFOLDING_TOKENS);
        String content = sanitizer.prepare(article.getContent(), article.getDescription(), contentBudget);
        String interests = interestPrompt != null && !interestPrompt.isBlank() ? interestPrompt.trim() : DEFAULT_INTEREST_PROMPT;
        interests = sanitizer.truncateToTokens(interests, props.getMaxInterestTokens());

        StringBuilder user = new StringBuilder();
        user.append("Title: ").append(nullToEmpty(article.getTitle())).append('\n');
        user.append("Author: ").append(article.getAuthor() != null ? article.getAuthor() : "Unknown").append('\n');
        user.append("Content:\n").append(content).append("\n\n");
        user.append(categoryBlock(categories)).append('\n');
        user.append("Reader's interests:\n").append(interests);

        return new ChatRequest(props.getModel(), SYSTEM_PROMPT, user.toString(), true, MAX_COMPLETION_TOKENS, 0.2);
    }

    private static String categoryBlock(List<Category> categories) {
        if (categories == null || categories.isEmpty()) {
            return "Categories: none defined, return null for category.";
        }
        StringBuilder sb = new StringBuilder("Categories:\n");
        for (Category c : categories) {
            sb.append("  - id ").append(c.getId()).append(": ").append(c.getName());
            if (c.getDescription() != null && !c.getDescription().isBlank()) {
                sb.append(" (").append(c.getDescription().trim()).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
