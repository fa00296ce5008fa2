package com.bloomcart.scoring.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * PostgreSQL-backed store keeping each record as a JSON text column next to its key.
 * Errors, including timeouts, are propagated so {@link DegradingStore} can fall back.
 */
public class R2dbcJsonStore<T> implements KeyValueStore<T> {
    private static final Logger log = LoggerFactory.getLogger(R2dbcJsonStore.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

    private final DatabaseClient db;
    private final ObjectMapper objectMapper;
    private final String table;
    private final Class<T> type;
    private final Duration timeout;

    public R2dbcJsonStore(DatabaseClient db, ObjectMapper objectMapper, String table, Class<T> type, Duration timeout) {
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        this.db = db;
        this.objectMapper = objectMapper;
        this.table = table;
        this.type = type;
        this.timeout = timeout;
    }

    public Mono<Void> ensureSchema() {
        String ddl = "CREATE TABLE IF NOT EXISTS " + table + " (" +
                "key TEXT PRIMARY KEY, " +
                "payload TEXT NOT NULL, " +
                "updated_at TIMESTAMPTZ DEFAULT NOW()" +
                ")";
        return db.sql(ddl).fetch().rowsUpdated()
                .timeout(timeout)
                .then()
                .onErrorResume(e -> {
                    log.warn("Could not ensure table {}: {}", table, e.toString());
                    return Mono.empty();
                });
    }

    @Override
    public Mono<T> find(String key) {
        return db.sql("SELECT payload FROM " + table + " WHERE key = :key")
                .bind("key", key)
                .fetch().first()
                .timeout(timeout)
                .flatMap(row -> {
                    Object payload = row.get("payload");
                    if (payload == null) return Mono.empty();
                    try {
                        return Mono.just(objectMapper.readValue(String.valueOf(payload), type));
                    } catch (JsonProcessingException e) {
                        log.warn("Discarding unreadable {} record key={}: {}", table, key, e.getOriginalMessage());
                        return Mono.empty();
                    }
                });
    }

    @Override
    public Mono<Void> upsert(String key, T value) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(value))
                .flatMap(json -> db.sql("INSERT INTO " + table + "(key, payload, updated_at) VALUES(:key, :payload, NOW()) " +
                                "ON CONFLICT (key) DO UPDATE SET payload = EXCLUDED.payload, updated_at = NOW()")
                        .bind("key", key)
                        .bind("payload", json)
                        .fetch().rowsUpdated())
                .timeout(timeout)
                .then();
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return db.sql("DELETE FROM " + table + " WHERE key = :key")
                .bind("key", key)
                .fetch().rowsUpdated()
                .timeout(timeout)
                .map(n -> n > 0);
    }
}
