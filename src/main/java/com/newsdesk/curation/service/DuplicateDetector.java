package com.newsdesk.curation.service;

import com.newsdesk.curation.config.CurationProperties;
import com.newsdesk.curation.dto.ActionDtos;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.repository.ArticleRepository;
import com.newsdesk.curation.util.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Clusters near-identical articles by title-embedding cosine similarity.
 *
 * <p>Each newly embedded article (the subject) is compared with embedded articles dated within
 * {@code curation.duplicate.window-days} of it. A candidate at or above the threshold is resolved to
 * its canonical root first, so links always point at a canonical article and never chain. Between
 * the subject and the best-matching root:
 * <ul>
 *   <li>a root that already has duplicates keeps the cluster and the subject joins it;</li>
 *   <li>a subject that already has duplicates absorbs a root that has none;</li>
 *   <li>two unlinked articles: the earlier one stays canonical;</li>
 *   <li>two clusters never merge, since existing links are never rewritten.</li>
 * </ul>
 * Subjects are handled oldest-first, one at a time, and marked checked afterwards, so a re-run does not
 * change anything that was already resolved.
 */
@Service
public class DuplicateDetector {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    /** Earlier reference date first, then lower id. */
    static final Comparator<Article> OLDEST_FIRST = Comparator
            .comparing(Article::referenceDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Article::getId);

    private final ArticleRepository articles;
    private final CurationProperties props;
    private final Clock clock;

    public DuplicateDetector(ArticleRepository articles, CurationProperties props, Clock clock) {
        this.articles = articles;
        this.props = props;
        this.clock = clock;
    }

    public Mono<ActionDtos.DedupReport> detect(long userId) {
        ActionDtos.DedupReport report = new ActionDtos.DedupReport();
        return articles.findDedupPending(userId)
                .collectSortedList(OLDEST_FIRST)
                .flatMapMany(Flux::fromIterable)
                .concatMap(subject -> resolve(userId, subject)
                        .doOnNext(duplicateId -> {
                            report.setDuplicates_marked(report.getDuplicates_marked() + 1);
                            report.getDuplicate_ids().add(duplicateId);
                        })
                        .then(articles.markDedupChecked(subject.getId(), clock.instant()))
                        .doOnNext(x -> report.setChecked(report.getChecked() + 1)))
                .then(Mono.fromSupplier(() -> {
                    if (report.getChecked() > 0) {
                        log.info("Duplicate detection for user {}: checked={} marked={}",
                                userId, report.getChecked(), report.getDuplicates_marked());
                    }
                    return report;
                }));
    }

    /** Emits the id of the article newly marked duplicate, if any. */
    private Mono<Long> resolve(long userId, Article stale) {
        return articles.findById(stale.getId())
                .filter(s -> s.isCanonical() && s.hasEmbedding())
                .flatMap(subject -> {
                    Instant ref = subject.referenceDate() != null ? subject.referenceDate() : clock.instant();
                    Duration window = Duration.ofDays(props.getDuplicate().getWindowDays());
                    return articles.findEmbeddedBetween(userId, ref.minus(window), ref.plus(window))
                            .collectList()
                            .flatMap(candidates -> bestRoot(subject, candidates))
                            .flatMap(match -> link(subject, match));
                });
    }

    private Mono<Match> bestRoot(Article subject, List<Article> candidates) {
        double threshold = props.getDuplicate().getThreshold();
        Map<Long, Double> bestByRoot = new HashMap<>();
        Map<Long, Article> byId = new HashMap<>();
        for (Article c : candidates) byId.put(c.getId(), c);

        for (Article c : candidates) {
            if (c.getId().equals(subject.getId())) continue;
            long root = c.getDuplicate_of_id() != null ? c.getDuplicate_of_id() : c.getId();
            if (root == subject.getId()) continue; // already in the subject's own cluster
            double sim = VectorMath.cosine(subject.getTitle_embedding(), c.getTitle_embedding());
            if (sim >= threshold) {
                bestByRoot.merge(root, sim, Math::max);
            }
        }
        if (bestByRoot.isEmpty()) return Mono.empty();

        return Flux.fromIterable(bestByRoot.entrySet())
                .concatMap(e -> {
                    Article known = byId.get(e.getKey());
                    Mono<Article> root = known != null && known.isCanonical() ? Mono.just(known) : articles.findById(e.getKey());
                    return root.filter(Article::isCanonical).map(r -> new Match(r, e.getValue()));
                })
                .collectList()
                .flatMap(matches -> Mono.justOrEmpty(matches.stream()
                        .max(Comparator.comparingDouble(Match::similarity)
                                .thenComparing(Match::root, OLDEST_FIRST.reversed()))));
    }

    private Mono<Long> link(Article subject, Match match) {
        Article root = match.root();
        return Mono.zip(articles.countDuplicatesOf(root.getId()), articles.countDuplicatesOf(subject.getId()))
                .flatMap(counts -> {
                    boolean rootHasCluster = counts.getT1() > 0;
                    boolean subjectHasCluster = counts.getT2() > 0;
                    Article duplicate;
                    Article canonical;
                    if (rootHasCluster && subjectHasCluster) {
                        log.info("Articles {} and {} head separate clusters (similarity {}); leaving both",
                                subject.getId(), root.getId(), fmt(match.similarity()));
                        return Mono.empty();
                    } else if (rootHasCluster) {
                        duplicate = subject;
                        canonical = root;
                    } else if (subjectHasCluster) {
                        duplicate = root;
                        canonical = subject;
                    } else if (OLDEST_FIRST.compare(root, subject) <= 0) {
                        duplicate = subject;
                        canonical = root;
                    } else {
                        duplicate = root;
                        canonical = subject;
                    }
                    return articles.markDuplicate(duplicate.getId(), canonical.getId())
                            .flatMap(marked -> {
                                if (!marked) {
                                    log.debug("Duplicate link {} -> {} refused; state changed concurrently",
                                            duplicate.getId(), canonical.getId());
                                    return Mono.empty();
                                }
                                log.info("Marked article {} as duplicate of {} (similarity {})",
                                        duplicate.getId(), canonical.getId(), fmt(match.similarity()));
                                return Mono.just(duplicate.getId());
                            });
                });
    }

    private static String fmt(double d) {
        return String.format("%.3f", d);
    }

    private record Match(Article root, double similarity) {}
}
