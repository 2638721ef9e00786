package com.newsdesk.curation.service.enrichment;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Reduces article HTML to plain text the model can read cheaply: images and their wrappers removed,
 * bare image links dropped, whitespace collapsed, then cut to a token budget.
 */
@Component
public class ContentSanitizer {
    private static final Pattern IMAGE_URL = Pattern.compile(
            "https?://\\S+?\\.(?:jpe?g|png|gif|webp|svg|bmp|avif)(?:\\?\\S*)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPACES = Pattern.compile("\\s+");
    static final String ELLIPSIS = "...";

    public String stripImages(String html) {
        if (html == null || html.isBlank()) return "";
        Document doc = Jsoup.parseBodyFragment(html);
        doc.select("img, picture, figure, svg, source, video, iframe, script, style").remove();
        String text = doc.body().text();
        text = IMAGE_URL.matcher(text).replaceAll(" ");
        return SPACES.matcher(text).replaceAll(" ").trim();
    }

    /** Keeps roughly {@code maxTokens} tokens (~4 chars each), marking the cut with "...". */
    public String truncateToTokens(String text, int maxTokens) {
        if (text == null) return "";
        int maxChars = Math.max(0, maxTokens) * 4;
        if (text.length() <= maxChars) return text;
        int cut = maxChars;
        // don't split a surrogate pair
        if (cut > 0 && Character.isHighSurrogate(text.charAt(cut - 1))) cut--;
        return text.substring(0, cut) + ELLIPSIS;
    }

    /** Content for the model: body, else description, stripped and truncated. */
    public String prepare(String content, String description, int maxTokens) {
        String source = content != null && !content.isBlank() ? content : description;
        String text = stripImages(source);
        if (text.isEmpty()) return "No content available";
        return truncateToTokens(text, maxTokens);
    }
}
