package com.newsdesk.curation.repository;

import com.newsdesk.curation.model.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.newsdesk.curation.repository.R2dbcRows.*;

@Repository
public class R2dbcCurationSettingsRepository implements CurationSettingsRepository {
    private static final Logger log = LoggerFactory.getLogger(R2dbcCurationSettingsRepository.class);
    static final String INTEREST_PROMPT_KEY = "llm_selection_prompt";

    private final DatabaseClient db;

    public R2dbcCurationSettingsRepository(DatabaseClient db) {
        this.db = db;
        ensureSchema().subscribe(
                v -> {},
                e -> log.error("settings schema init failed: {}", e.toString()));
    }

    private Mono<Void> ensureSchema() {
        List<String> ddl = List.of(
                "CREATE TABLE IF NOT EXISTS categories (" +
                        "id BIGSERIAL PRIMARY KEY, " +
                        "user_id BIGINT NOT NULL, " +
                        "name TEXT NOT NULL, " +
                        "slug TEXT NOT NULL, " +
                        "description TEXT, " +
                        "display_order INTEGER NOT NULL DEFAULT 0, " +
                        "is_deleted BOOLEAN NOT NULL DEFAULT FALSE, " +
                        "UNIQUE (user_id, slug)" +
                        ")",
                "CREATE TABLE IF NOT EXISTS user_settings (" +
                        "user_id BIGINT NOT NULL, " +
                        "key TEXT NOT NULL, " +
                        "value TEXT, " +
                        "updated_at TIMESTAMPTZ DEFAULT NOW(), " +
                        "PRIMARY KEY (user_id, key)" +
                        ")");
        return Flux.fromIterable(ddl).concatMap(sql -> db.sql(sql).fetch().rowsUpdated()).then();
    }

    @Override
    public Flux<Category> findActiveCategories(long userId) {
        return db.sql("SELECT id, user_id, name, slug, description, display_order, is_deleted FROM categories " +
                        "WHERE user_id = :uid AND is_deleted = FALSE ORDER BY display_order, id")
                .bind("uid", userId)
                .fetch().all()
                .map(m -> {
                    Category c = new Category();
                    c.setId(toLong(m.get("id")));
                    c.setUser_id(toLong(m.get("user_id")));
                    c.setName(toStr(m.get("name")));
                    c.setSlug(toStr(m.get("slug")));
                    c.setDescription(toStr(m.get("description")));
                    c.setDisplay_order(toInt(m.get("display_order")));
                    c.setIs_deleted(toBool(m.get("is_deleted")));
                    return c;
                });
    }

    @Override
    public Mono<String> findInterestPrompt(long userId) {
        return db.sql("SELECT value FROM user_settings WHERE user_id = :uid AND key = :key")
                .bind("uid", userId)
                .bind("key", INTEREST_PROMPT_KEY)
                .fetch().first()
                .mapNotNull(m -> toStr(m.get("value")))
                .filter(v -> !v.isBlank());
    }
}
