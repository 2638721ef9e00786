package com.newsdesk.curation.repository;

import com.newsdesk.curation.model.Category;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read side of the user's curation settings. Categories and the interest prompt are edited by the
 * outer web layer.
 */
public interface CurationSettingsRepository {

    /** Non-deleted categories in display order. */
    Flux<Category> findActiveCategories(long userId);

    /** The stored interest prompt; empty when the user never set one. */
    Mono<String> findInterestPrompt(long userId);
}
