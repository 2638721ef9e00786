package com.newsdesk.curation.service;

import com.newsdesk.curation.config.AppProperties;
import com.newsdesk.curation.repository.ArticleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Ages articles out: archived after {@code app.archive-after-days}, deleted after {@code app.retention-days}.
 * Downvoted articles are never deleted here because score suppression still reads them.
 */
@Service
public class ArticleCleanupService {
    private static final Logger log = LoggerFactory.getLogger(ArticleCleanupService.class);

    private final ArticleRepository articles;
    private final AppProperties props;
    private final Clock clock;

    public ArticleCleanupService(ArticleRepository articles, AppProperties props, Clock clock) {
        this.articles = articles;
        this.props = props;
        this.clock = clock;
    }

    public record CleanupResult(long archived, long deleted) {}

    public Mono<CleanupResult> archiveAndCleanup(long userId) {
        Instant now = clock.instant();
        Instant archiveCutoff = now.minus(Duration.ofDays(props.getArchiveAfterDays()));
        Instant deleteCutoff = now.minus(Duration.ofDays(props.getRetentionDays()));
        return articles.archiveOlderThan(userId, archiveCutoff)
                .flatMap(archived -> articles.deleteOlderThan(userId, deleteCutoff)
                        .map(deleted -> new CleanupResult(archived, deleted)))
                .doOnNext(r -> {
                    if (r.archived() > 0 || r.deleted() > 0) {
                        log.info("Cleanup for user {}: archived={} deleted={}", userId, r.archived(), r.deleted());
                    }
                });
    }
}
