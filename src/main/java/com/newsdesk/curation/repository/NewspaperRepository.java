package com.newsdesk.curation.repository;

import com.newsdesk.curation.model.Newspaper;
import com.newsdesk.curation.model.NewspaperStructure;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;

public interface NewspaperRepository {

    /** Replaces the structure for (user, date) in one statement; never merges. */
    Mono<Newspaper> upsert(long userId, LocalDate date, NewspaperStructure structure, Instant at);

    Mono<Newspaper> find(long userId, LocalDate date);
}
