package com.newsdesk.curation.controller;

import com.newsdesk.curation.dto.ArticleDtos;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.service.feedback.FeedbackService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/articles")
public class ArticleController {
    private final FeedbackService feedback;

    public ArticleController(FeedbackService feedback) {
        this.feedback = feedback;
    }

    /** The article with its feedback-adjusted score filled in. */
    @GetMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Article> get(@PathVariable long id) {
        return feedback.getArticle(id);
    }

    /** Toggles the downvote: -1 becomes 0 and anything else becomes -1. */
    @PostMapping(path = "/{id}/downvote", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ArticleDtos.VoteResponse> downvote(@PathVariable long id) {
        return feedback.toggleDownvote(id);
    }

    @GetMapping(path = "/{id}/explain-adjustment", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ArticleDtos.AdjustmentExplanation> explain(@PathVariable long id) {
        return feedback.explain(id);
    }
}
