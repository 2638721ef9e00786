package com.newsdesk.curation.service.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdesk.curation.exception.MalformedResponseException;
import com.newsdesk.curation.model.Category;
import com.newsdesk.curation.model.EnrichmentResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * The one place model output becomes typed data. Anything unusable is a {@link MalformedResponseException}.
 */
@Component
public class EnrichmentParser {
    static final int MAX_TITLE_CHARS = 200;
    static final int MAX_SUBTITLE_CHARS = 250;

    private final ObjectMapper mapper;

    public EnrichmentParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public EnrichmentResult parse(String content) {
        if (content == null || content.isBlank()) {
            throw new MalformedResponseException("Empty model response");
        }
        JsonNode root;
        try {
            root = mapper.readTree(stripCodeFence(content));
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Model response is not JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedResponseException("Model response is not a JSON object");
        }

        String title = text(root, "title");
        if (title == null) {
            throw new MalformedResponseException("Model response has no title");
        }
        double score = score(root.get("relevance_score"));

        String category = firstText(root, "category", "category_id", "category_slug");
        return new EnrichmentResult(
                clip(title, MAX_TITLE_CHARS),
                clip(text(root, "subtitle"), MAX_SUBTITLE_CHARS),
                text(root, "summary"),
                category,
                score);
    }

    /**
     * Maps a suggestion to one of the active categories by id, slug or name (case-insensitive).
     * Null when nothing matches.
     */
    public Long resolveCategory(String suggestion, List<Category> categories) {
        if (suggestion == null || categories == null || categories.isEmpty()) return null;
        String s = suggestion.trim();
        for (Category c : categories) {
            if (c.getId() != null && s.equals(String.valueOf(c.getId()))) return c.getId();
        }
        String lower = s.toLowerCase(Locale.ROOT);
        for (Category c : categories) {
            if (c.getSlug() != null && c.getSlug().toLowerCase(Locale.ROOT).equals(lower)) return c.getId();
            if (c.getName() != null && c.getName().toLowerCase(Locale.ROOT).equals(lower)) return c.getId();
        }
        return null;
    }

    private static double score(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new MalformedResponseException("Model response has no relevance_score");
        }
        double v;
        if (node.isNumber()) {
            v = node.asDouble();
        } else if (node.isTextual()) {
            try {
                v = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedResponseException("relevance_score is not a number: " + node.asText());
            }
        } else {
            throw new MalformedResponseException("relevance_score is not a number");
        }
        if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
            throw new MalformedResponseException("relevance_score out of range: " + v);
        }
        return v;
    }

    private static String firstText(JsonNode root, String... fields) {
        for (String f : fields) {
            String v = text(root, f);
            if (v != null) return v;
        }
        return null;
    }

    private static String text(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull() || n.isContainerNode()) return null;
        String s = n.asText().trim();
        return s.isEmpty() || s.equalsIgnoreCase("null") ? null : s;
    }

    private static String clip(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max).trim();
    }

    private static String stripCodeFence(String content) {
        String s = content.trim();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            int lastFence = s.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                s = s.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return s;
    }
}
