package com.newsdesk.curation.service;

import com.newsdesk.curation.config.CurationProperties;
import com.newsdesk.curation.dto.ActionDtos;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.model.Category;
import com.newsdesk.curation.model.Newspaper;
import com.newsdesk.curation.model.NewspaperStructure;
import com.newsdesk.curation.model.ProcessingStatus;
import com.newsdesk.curation.repository.ArticleRepository;
import com.newsdesk.curation.repository.CurationSettingsRepository;
import com.newsdesk.curation.repository.NewspaperRepository;
import com.newsdesk.curation.service.feedback.FeedbackService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Composes the daily edition from the current article pool.
 *
 * <p>{@link #compose} is a pure function of its inputs with a total ordering (adjusted score desc,
 * reference date desc, id asc), so the same pool always yields the same structure. {@link #regenerate}
 * writes it with one upsert; if anything fails before that, the stored edition is left as it was.
 */
@Service
public class NewspaperGenerator {
    private static final Logger log = LoggerFactory.getLogger(NewspaperGenerator.class);

    static final Comparator<Article> EDITION_ORDER = Comparator
            .comparing(Article::getAdjusted_relevance_score, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Article::referenceDate, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Article::getId);

    private final ArticleRepository articles;
    private final NewspaperRepository newspapers;
    private final CurationSettingsRepository settings;
    private final FeedbackService feedback;
    private final CurationProperties props;
    private final Clock clock;

    public NewspaperGenerator(ArticleRepository articles, NewspaperRepository newspapers,
                              CurationSettingsRepository settings, FeedbackService feedback,
                              CurationProperties props, Clock clock) {
        this.articles = articles;
        this.newspapers = newspapers;
        this.settings = settings;
        this.feedback = feedback;
        this.props = props;
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Rebuilds the edition for {@code date} from articles whose reference date falls in the
     * {@code window-days} calendar days ending with {@code date}, so a past date only sees its own articles.
     */
    public Mono<ActionDtos.RegenerateResponse> regenerate(long userId, LocalDate date) {
        CurationProperties.Newspaper cfg = props.getNewspaper();
        Instant until = date.plusDays(1).atStartOfDay(clock.getZone()).toInstant();
        Instant since = until.minus(Duration.ofDays(cfg.getWindowDays()));
        Mono<List<Article>> pool = articles.findNewspaperPool(userId, since, until)
                .collectList()
                .flatMap(list -> feedback.decorate(userId, list));
        Mono<List<Category>> categories = settings.findActiveCategories(userId).collectList();

        return Mono.zip(pool, categories)
                .map(t -> compose(t.getT1(), t.getT2(), cfg))
                .flatMap(structure -> newspapers.upsert(userId, date, structure, clock.instant()))
                .map(saved -> {
                    NewspaperStructure s = saved.getStructure();
                    log.info("Newspaper regenerated for user {} date {}: today={} categories={}",
                            userId, date, s.todayCount(), s.categoryCount());
                    return new ActionDtos.RegenerateResponse("Newspaper regenerated", date, s.todayCount(), s.categoryCount());
                });
    }

    public Mono<Newspaper> find(long userId, LocalDate date) {
        return newspapers.find(userId, date);
    }

    /**
     * Pure composition. {@code pool} must already carry adjusted scores.
     */
    public static NewspaperStructure compose(List<Article> pool, List<Category> categories, CurationProperties.Newspaper cfg) {
        List<Article> eligible = new ArrayList<>();
        for (Article a : pool) {
            if (a.getProcessing_status() != ProcessingStatus.ENRICHED) continue;
            if (a.getIs_archived() || !a.isCanonical()) continue;
            Double score = a.getAdjusted_relevance_score();
            if (score == null || score < cfg.getSelectionThreshold()) continue;
            eligible.add(a);
        }
        eligible.sort(EDITION_ORDER);

        List<Long> today = new ArrayList<>();
        Map<Long, Integer> perFeed = new HashMap<>();
        for (Article a : eligible) {
            if (today.size() >= cfg.getTodaySize()) break;
            int used = perFeed.getOrDefault(a.getFeed_id(), 0);
            if (used >= cfg.getMaxPerFeed()) continue;
            perFeed.put(a.getFeed_id(), used + 1);
            today.add(a.getId());
        }

        Set<Long> onFrontPage = new HashSet<>(today);
        LinkedHashMap<String, List<Long>> sections = new LinkedHashMap<>();
        List<Category> ordered = new ArrayList<>(categories);
        ordered.sort(Comparator.comparingInt(Category::getDisplay_order).thenComparing(Category::getId));
        for (Category c : ordered) {
            if (c.getIs_deleted() || c.getSlug() == null) continue;
            List<Long> ids = new ArrayList<>();
            for (Article a : eligible) {
                if (ids.size() >= cfg.getCategorySize()) break;
                if (!Objects.equals(a.getCategory_id(), c.getId())) continue;
                if (cfg.isExcludeTodayFromCategories() && onFrontPage.contains(a.getId())) continue;
                ids.add(a.getId());
            }
            sections.put(c.getSlug(), ids);
        }
        return new NewspaperStructure(today, sections);
    }
}
