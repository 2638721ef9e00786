package com.newsdesk.curation.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdesk.curation.model.Newspaper;
import com.newsdesk.curation.model.NewspaperStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static com.newsdesk.curation.repository.R2dbcRows.*;

@Repository
public class R2dbcNewspaperRepository implements NewspaperRepository {
    private static final Logger log = LoggerFactory.getLogger(R2dbcNewspaperRepository.class);
    private final DatabaseClient db;
    private final ObjectMapper mapper;

    public R2dbcNewspaperRepository(DatabaseClient db, ObjectMapper mapper) {
        this.db = db;
        this.mapper = mapper;
        ensureSchema().subscribe(
                v -> {},
                e -> log.error("newspapers schema init failed: {}", e.toString()));
    }

    private Mono<Void> ensureSchema() {
        String ddl = "CREATE TABLE IF NOT EXISTS newspapers (" +
                "id BIGSERIAL PRIMARY KEY, " +
                "user_id BIGINT NOT NULL, " +
                "date DATE NOT NULL, " +
                "structure TEXT NOT NULL, " +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(), " +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW(), " +
                "UNIQUE (user_id, date)" +
                ")";
        return db.sql(ddl).fetch().rowsUpdated().then();
    }

    @Override
    public Mono<Newspaper> upsert(long userId, LocalDate date, NewspaperStructure structure, Instant at) {
        String json;
        try {
            json = mapper.writeValueAsString(structure);
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalArgumentException("Cannot serialize newspaper structure", e));
        }
        return db.sql("INSERT INTO newspapers (user_id, date, structure, created_at, updated_at) " +
                        "VALUES (:uid, :date, :structure, :at, :at) " +
                        "ON CONFLICT (user_id, date) DO UPDATE SET structure = EXCLUDED.structure, updated_at = EXCLUDED.updated_at " +
                        "RETURNING id, user_id, date, structure, created_at, updated_at")
                .bind("uid", userId)
                .bind("date", date)
                .bind("structure", json)
                .bind("at", at)
                .fetch().first()
                .map(this::toNewspaper);
    }

    @Override
    public Mono<Newspaper> find(long userId, LocalDate date) {
        return db.sql("SELECT id, user_id, date, structure, created_at, updated_at FROM newspapers " +
                        "WHERE user_id = :uid AND date = :date")
                .bind("uid", userId)
                .bind("date", date)
                .fetch().first()
                .map(this::toNewspaper);
    }

    private Newspaper toNewspaper(Map<String, Object> m) {
        Newspaper n = new Newspaper();
        n.setId(toLong(m.get("id")));
        n.setUser_id(toLong(m.get("user_id")));
        n.setDate(toLocalDate(m.get("date")));
        n.setCreated_at(toInstant(m.get("created_at")));
        n.setUpdated_at(toInstant(m.get("updated_at")));
        String json = toStr(m.get("structure"));
        try {
            n.setStructure(json != null ? mapper.readValue(json, NewspaperStructure.class) : new NewspaperStructure());
        } catch (JsonProcessingException e) {
            log.warn("Unreadable newspaper structure id={}: {}", n.getId(), e.getOriginalMessage());
            n.setStructure(new NewspaperStructure());
        }
        return n;
    }
}
