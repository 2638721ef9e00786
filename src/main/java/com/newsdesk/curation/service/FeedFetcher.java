package com.newsdesk.curation.service;

import com.newsdesk.curation.model.RawArticle;
import reactor.core.publisher.Flux;

/**
 * Source of newly fetched feed items for a user (RSS polling, image download and the like live behind it).
 * Items whose link is already stored for the feed are dropped on insert, so implementations may re-emit.
 */
public interface FeedFetcher {
    Flux<RawArticle> fetchNew(long userId);
}
