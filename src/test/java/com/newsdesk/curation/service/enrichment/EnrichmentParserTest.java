package com.newsdesk.curation.service.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdesk.curation.exception.MalformedResponseException;
import com.newsdesk.curation.model.Category;
import com.newsdesk.curation.model.EnrichmentResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnrichmentParserTest {
    private final EnrichmentParser parser = new EnrichmentParser(new ObjectMapper());

    @Test
    void parsesWellFormedAnswer() {
        EnrichmentResult r = parser.parse("""
                {"title":"ECB holds rates","subtitle":"Inflation cools","summary":"The bank paused.",
                 "category":"3","relevance_score":0.82}""");
        assertEquals("ECB holds rates", r.title());
        assertEquals("Inflation cools", r.subtitle());
        assertEquals("3", r.categorySuggestion());
        assertEquals(0.82, r.relevanceScore(), 1e-9);
    }

    @Test
    void acceptsCodeFencesAndNumericStrings() {
        EnrichmentResult r = parser.parse("```json\n{\"title\":\"T\",\"relevance_score\":\"0.4\",\"category\":null}\n```");
        assertEquals("T", r.title());
        assertNull(r.categorySuggestion());
        assertEquals(0.4, r.relevanceScore(), 1e-9);
    }

    @Test
    void rejectsUnusableAnswers() {
        assertThrows(MalformedResponseException.class, () -> parser.parse("Sure! Here is your JSON"));
        assertThrows(MalformedResponseException.class, () -> parser.parse("[1,2]"));
        assertThrows(MalformedResponseException.class, () -> parser.parse("{\"relevance_score\":0.5}"));
        assertThrows(MalformedResponseException.class, () -> parser.parse("{\"title\":\"T\"}"));
        assertThrows(MalformedResponseException.class, () -> parser.parse("{\"title\":\"T\",\"relevance_score\":1.3}"));
        assertThrows(MalformedResponseException.class, () -> parser.parse("{\"title\":\"T\",\"relevance_score\":\"high\"}"));
        assertThrows(MalformedResponseException.class, () -> parser.parse(""));
    }

    @Test
    void resolvesCategoryByIdSlugOrName() {
        List<Category> cats = List.of(new Category(3L, 1L, "World News", "world", 0),
                new Category(7L, 1L, "Technology", "tech", 1));
        assertEquals(3L, parser.resolveCategory("3", cats));
        assertEquals(7L, parser.resolveCategory("TECH", cats));
        assertEquals(3L, parser.resolveCategory("world news", cats));
        assertNull(parser.resolveCategory("sports", cats));
        assertNull(parser.resolveCategory(null, cats));
    }
}
