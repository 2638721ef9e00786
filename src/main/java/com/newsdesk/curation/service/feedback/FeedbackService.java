package com.newsdesk.curation.service.feedback;

import com.newsdesk.curation.client.ChatRequest;
import com.newsdesk.curation.client.GatedLlmClient;
import com.newsdesk.curation.config.CurationProperties;
import com.newsdesk.curation.config.LlmProperties;
import com.newsdesk.curation.dto.ArticleDtos;
import com.newsdesk.curation.exception.ArticleNotFoundException;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.repository.ArticleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Downvotes and their read-time effect. Votes are the only thing stored; adjusted scores, reasons and
 * explanations are derived from the current votes every time they are read.
 */
@Service
public class FeedbackService {
    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);
    static final int MAX_THEMES = 5;
    private static final Set<String> STOPWORDS = Set.of(
            "about", "after", "against", "also", "among", "amid", "been", "before", "being", "between", "could",
            "does", "from", "have", "into", "more", "most", "news", "over", "says", "said", "than", "that", "their",
            "them", "then", "there", "these", "they", "this", "those", "through", "under", "what", "when", "where",
            "which", "while", "will", "with", "would", "your", "year", "years");

    private final ArticleRepository articles;
    private final ScoreAdjustmentEngine engine;
    private final GatedLlmClient llm;
    private final CurationProperties props;
    private final LlmProperties llmProps;
    private final Clock clock;

    public FeedbackService(ArticleRepository articles, ScoreAdjustmentEngine engine, GatedLlmClient llm,
                           CurationProperties props, LlmProperties llmProps, Clock clock) {
        this.articles = articles;
        this.engine = engine;
        this.llm = llm;
        this.props = props;
        this.llmProps = llmProps;
        this.clock = clock;
    }

    /** Flips the vote between -1 and 0. */
    public Mono<ArticleDtos.VoteResponse> toggleDownvote(long articleId) {
        return find(articleId).flatMap(a -> setVote(articleId, a.getUser_vote() == -1 ? 0 : -1));
    }

    public Mono<ArticleDtos.VoteResponse> setVote(long articleId, int vote) {
        if (vote != 0 && vote != -1) {
            return Mono.error(new IllegalArgumentException("vote must be -1 or 0"));
        }
        Instant now = clock.instant();
        return find(articleId)
                .flatMap(a -> articles.updateVote(articleId, vote, now))
                .map(updated -> {
                    log.info("Article {} vote set to {}", articleId, vote);
                    String message = vote == -1
                            ? "Article downvoted. Similar articles will be ranked lower."
                            : "Downvote removed.";
                    return new ArticleDtos.VoteResponse(articleId, vote, now, message);
                });
    }

    /** The article with adjusted score and reason filled in. */
    public Mono<Article> getArticle(long articleId) {
        return find(articleId).flatMap(a -> decorate(a.getUser_id(), List.of(a)).map(list -> list.get(0)));
    }

    /**
     * Sets {@code adjusted_relevance_score} and {@code score_adjustment_reason} on each article in place,
     * using one read of the user's recent downvotes.
     */
    public Mono<List<Article>> decorate(long userId, List<Article> list) {
        if (list.isEmpty()) return Mono.just(list);
        return recentDownvotes(userId).map(downvoted -> {
            for (Article a : list) {
                ScoreAdjustment adj = engine.adjust(a, downvoted);
                a.setAdjusted_relevance_score(adj.adjustedScore());
                a.setScore_adjustment_reason(adj.reason());
            }
            return list;
        });
    }

    public Mono<ArticleDtos.AdjustmentExplanation> explain(long articleId) {
        return find(articleId).flatMap(target -> recentDownvotes(target.getUser_id()).flatMap(downvoted -> {
            ScoreAdjustment adj = engine.adjust(target, downvoted);
            ArticleDtos.AdjustmentExplanation out = new ArticleDtos.AdjustmentExplanation();
            out.setArticle_id(articleId);
            out.setAdjusted(adj.adjusted());
            out.setOriginal_score(adj.originalScore());
            out.setAdjusted_score(adj.adjustedScore());
            out.setSimilarity(adj.similarity());
            if (!adj.adjusted()) {
                out.setExplanation("This article's score has not been adjusted.");
                return Mono.just(out);
            }
            Article trigger = downvoted.stream()
                    .filter(d -> d.getId().equals(adj.triggerArticleId()))
                    .findFirst().orElse(null);
            out.setDownvoted_article_id(adj.triggerArticleId());
            out.setDownvoted_article_title(adj.triggerTitle());
            out.setReason(adj.reason());
            out.setShared_themes(trigger != null ? sharedThemes(target, trigger) : List.of());
            return narrative(target, adj, out.getShared_themes()).map(text -> {
                out.setExplanation(text);
                return out;
            });
        }));
    }

    static List<String> sharedThemes(Article a, Article b) {
        Set<String> other = terms(b);
        List<String> shared = new ArrayList<>();
        for (String t : terms(a)) {
            if (other.contains(t)) shared.add(t);
            if (shared.size() == MAX_THEMES) break;
        }
        return shared;
    }

    private static Set<String> terms(Article a) {
        String text = (a.displayTitle() != null ? a.displayTitle() : "") + " " + (a.getLlm_summary() != null ? a.getLlm_summary() : "");
        Set<String> out = new LinkedHashSet<>();
        for (String w : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (w.length() >= 4 && !STOPWORDS.contains(w)) out.add(w);
        }
        return out;
    }

    private Mono<String> narrative(Article target, ScoreAdjustment adj, List<String> themes) {
        String fallback = fallbackNarrative(adj, themes);
        if (!props.getFeedback().isLlmExplanations()) return Mono.just(fallback);

        String system = "In two sentences, explain to a reader why an article was ranked lower because it resembles "
                + "one they downvoted. Be concrete about the shared topic. Plain text, no lists.";
        String user = "Article: " + target.displayTitle() + "\n"
                + "Downvoted article: " + adj.triggerTitle() + "\n"
                + "Similarity: " + Math.round(adj.similarity() * 100) + "%\n"
                + "Shared terms: " + String.join(", ", themes);
        ChatRequest request = new ChatRequest(llmProps.getModel(), system, user, false, 150, 0.3);
        return llm.complete(request, null)
                .map(c -> c.content() != null && !c.content().isBlank() ? c.content().trim() : fallback)
                .onErrorResume(e -> {
                    log.warn("Explanation generation failed for article {}: {}", target.getId(), e.getMessage());
                    return Mono.just(fallback);
                });
    }

    static String fallbackNarrative(ScoreAdjustment adj, List<String> themes) {
        String base = String.format(Locale.ROOT,
                "The score was lowered from %.2f to %.2f because this article is %d%% similar to one you downvoted: '%s'.",
                adj.originalScore(), adj.adjustedScore(), Math.round(adj.similarity() * 100), adj.triggerTitle());
        if (themes == null || themes.isEmpty()) return base;
        return base + " Shared themes: " + String.join(", ", themes) + ".";
    }

    private Mono<List<Article>> recentDownvotes(long userId) {
        Instant since = clock.instant().minus(Duration.ofDays(props.getFeedback().getWindowDays()));
        return articles.findDownvotedSince(userId, since).collectList();
    }

    private Mono<Article> find(long articleId) {
        return articles.findById(articleId).switchIfEmpty(Mono.error(new ArticleNotFoundException(articleId)));
    }
}
