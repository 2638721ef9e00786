package com.newsdesk.curation.service.feedback;

import com.newsdesk.curation.client.GatedLlmClient;
import com.newsdesk.curation.config.CurationProperties;
import com.newsdesk.curation.config.LlmProperties;
import com.newsdesk.curation.dto.ArticleDtos;
import com.newsdesk.curation.exception.ArticleNotFoundException;
import com.newsdesk.curation.exception.TransientProviderException;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.support.Fixtures;
import com.newsdesk.curation.support.InMemoryArticleRepository;
import com.newsdesk.curation.support.ScriptedLlmClient;
import com.newsdesk.curation.util.TokenBucketRateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackServiceTest {
    private final InMemoryArticleRepository repo = new InMemoryArticleRepository();
    private final ScriptedLlmClient llm = new ScriptedLlmClient();
    private final CurationProperties props = Fixtures.curationProps();
    private FeedbackService service;

    @BeforeEach
    void setUp() {
        LlmProperties llmProps = Fixtures.llmProps(2);
        GatedLlmClient gated = new GatedLlmClient(llm, new TokenBucketRateLimiter(llmProps), llmProps);
        service = new FeedbackService(repo, new ScoreAdjustmentEngine(props), gated, props, llmProps, Fixtures.CLOCK);

        Article target = Fixtures.enriched(1, "Central bank raises interest rates again", 0.75, Fixtures.near(0, 1, 0.9), Fixtures.NOW);
        target.setLlm_summary("Interest rates climb as inflation persists.");
        repo.save(target);
        Article other = Fixtures.enriched(2, "Central bank raises interest rates", 0.6, Fixtures.axis(0), Fixtures.NOW);
        other.setLlm_summary("Another hike in interest rates.");
        repo.save(other);
        repo.save(Fixtures.enriched(3, "Local team wins the cup", 0.8, Fixtures.axis(5), Fixtures.NOW));
    }

    @Test
    void downvoteSuppressesAndUndoRestoresExactly() {
        double before = service.getArticle(1).block().getAdjusted_relevance_score();
        assertEquals(0.75, before);

        ArticleDtos.VoteResponse down = service.toggleDownvote(2).block();
        assertEquals(-1, down.getUser_vote());
        Article suppressed = service.getArticle(1).block();
        assertEquals(0.075, suppressed.getAdjusted_relevance_score(), 1e-6);
        assertTrue(suppressed.getScore_adjustment_reason().startsWith("Similar to downvoted: 'Central bank raises interest rates'"));
        assertEquals(0.75, suppressed.getRelevance_score(), "stored relevance is never rewritten");
        assertEquals(0.8, service.getArticle(3).block().getAdjusted_relevance_score());

        ArticleDtos.VoteResponse up = service.toggleDownvote(2).block();
        assertEquals(0, up.getUser_vote());
        Article restored = service.getArticle(1).block();
        assertEquals(before, restored.getAdjusted_relevance_score());
        assertNull(restored.getScore_adjustment_reason());
    }

    @Test
    void explanationNamesTriggerAndSharedThemes() {
        service.setVote(2, -1).block();

        ArticleDtos.AdjustmentExplanation ex = service.explain(1).block();

        assertTrue(ex.isAdjusted());
        assertEquals(2L, ex.getDownvoted_article_id());
        assertEquals(0.9, ex.getSimilarity(), 1e-6);
        assertTrue(ex.getShared_themes().contains("interest"));
        assertTrue(ex.getShared_themes().contains("rates"));
        assertTrue(ex.getExplanation().contains("0.75"));
        assertTrue(ex.getExplanation().contains("90%"));
    }

    @Test
    void modelNarrativeFallsBackOnError() {
        props.getFeedback().setLlmExplanations(true);
        llm.onTitle("", () -> Mono.error(new TransientProviderException("down")));
        service.setVote(2, -1).block();

        ArticleDtos.AdjustmentExplanation ex = service.explain(1).block();

        assertTrue(ex.getExplanation().startsWith("The score was lowered from 0.75 to "));
        assertFalse(llm.completedTitles.isEmpty());
    }

    @Test
    void unadjustedArticleSaysSo() {
        ArticleDtos.AdjustmentExplanation ex = service.explain(3).block();
        assertFalse(ex.isAdjusted());
        assertEquals(0.8, ex.getAdjusted_score());
        assertNull(ex.getDownvoted_article_id());
    }

    @Test
    void invalidVoteAndMissingArticleAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.setVote(1, 1).block());
        assertThrows(ArticleNotFoundException.class, () -> service.toggleDownvote(42).block());
    }

    @Test
    void decorateUsesOneDownvoteReadForTheWholeList() {
        service.setVote(2, -1).block();
        List<Article> list = List.of(repo.get(1), repo.get(3));

        service.decorate(1L, list).block();

        assertEquals(0.075, list.get(0).getAdjusted_relevance_score(), 1e-6);
        assertEquals(0.8, list.get(1).getAdjusted_relevance_score());
    }
}
