package com.newsdesk.curation.service;

import com.newsdesk.curation.model.RawArticle;
import com.newsdesk.curation.repository.ArticleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Stores what the {@link FeedFetcher} hands over as PENDING articles. A link already stored for the same
 * feed is skipped.
 */
@Service
public class ArticleIngestService {
    private static final Logger log = LoggerFactory.getLogger(ArticleIngestService.class);

    private final FeedFetcher fetcher;
    private final ArticleRepository articles;
    private final Clock clock;

    public ArticleIngestService(FeedFetcher fetcher, ArticleRepository articles, Clock clock) {
        this.fetcher = fetcher;
        this.articles = articles;
        this.clock = clock;
    }

    /** @return number of newly stored articles */
    public Mono<Integer> ingestNew(long userId) {
        return fetcher.fetchNew(userId)
                .filter(this::isUsable)
                .concatMap(raw -> articles.insertIfAbsent(userId, raw, clock.instant()))
                .count()
                .map(Long::intValue)
                .doOnNext(n -> log.info("Fetch stage for user {}: {} new articles", userId, n));
    }

    private boolean isUsable(RawArticle raw) {
        boolean ok = raw != null && raw.getLink() != null && !raw.getLink().isBlank()
                && raw.getTitle() != null && !raw.getTitle().isBlank();
        if (!ok) log.debug("Skipping fetched item without title or link");
        return ok;
    }
}
