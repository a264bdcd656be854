/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.cqrs.eventsourcing.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.cqrs.exception.CqrsException;
import io.r2dbc.spi.Readable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

/**
 * {@link SnapshotStorage} backed by the {@code snapshots} table.
 * <p>
 * Saving replaces the row at the same {@code (stream_id, snapshot_version)};
 * the delete and the insert run in one transaction.
 */
@Slf4j
public class R2dbcSnapshotStorage implements SnapshotStorage {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final DatabaseClient databaseClient;
    private final TransactionalOperator transactionalOperator;
    private final ObjectMapper objectMapper;

    public R2dbcSnapshotStorage(DatabaseClient databaseClient,
                                TransactionalOperator transactionalOperator,
                                ObjectMapper objectMapper) {
        this.databaseClient = databaseClient;
        this.transactionalOperator = transactionalOperator;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> save(Snapshot snapshot) {
        Mono<Void> upsert = Mono.defer(() -> {
            String state = write(snapshot.state(), snapshot);
            String metadata = write(snapshot.metadata(), snapshot);
            return databaseClient.sql("""
                        DELETE FROM snapshots
                        WHERE stream_id = :streamId AND snapshot_version = :version
                        """)
                    .bind("streamId", snapshot.streamId())
                    .bind("version", snapshot.version())
                    .fetch()
                    .rowsUpdated()
                    .then(databaseClient.sql("""
                                INSERT INTO snapshots (stream_id, snapshot_version, snapshot_data,
                                                       snapshot_metadata, created_at)
                                VALUES (:streamId, :version, :state, :metadata, :createdAt)
                                """)
                            .bind("streamId", snapshot.streamId())
                            .bind("version", snapshot.version())
                            .bind("state", state)
                            .bind("metadata", metadata)
                            .bind("createdAt", snapshot.createdAt().atOffset(ZoneOffset.UTC))
                            .fetch()
                            .rowsUpdated())
                    .then();
        });
        return upsert.as(transactionalOperator::transactional)
                .onErrorMap(e -> !(e instanceof CqrsException),
                        e -> CqrsException.database("Failed to save snapshot for stream "
                                + snapshot.streamId(), e));
    }

    @Override
    public Mono<Snapshot> loadLatest(UUID streamId) {
        return databaseClient.sql("""
                    SELECT stream_id, snapshot_version, snapshot_data, snapshot_metadata, created_at
                    FROM snapshots
                    WHERE stream_id = :streamId
                    ORDER BY snapshot_version DESC
                    LIMIT 1
                    """)
                .bind("streamId", streamId)
                .map(this::toSnapshot)
                .first();
    }

    @Override
    public Mono<Snapshot> loadAtVersion(UUID streamId, long version) {
        return databaseClient.sql("""
                    SELECT stream_id, snapshot_version, snapshot_data, snapshot_metadata, created_at
                    FROM snapshots
                    WHERE stream_id = :streamId AND snapshot_version <= :version
                    ORDER BY snapshot_version DESC
                    LIMIT 1
                    """)
                .bind("streamId", streamId)
                .bind("version", version)
                .map(this::toSnapshot)
                .first();
    }

    @Override
    public Mono<Long> deleteBeforeVersion(UUID streamId, long version) {
        return databaseClient.sql("""
                    DELETE FROM snapshots
                    WHERE stream_id = :streamId AND snapshot_version < :version
                    """)
                .bind("streamId", streamId)
                .bind("version", version)
                .fetch()
                .rowsUpdated()
                .defaultIfEmpty(0L);
    }

    @Override
    public Flux<Long> listVersions(UUID streamId) {
        return databaseClient.sql("""
                    SELECT snapshot_version FROM snapshots
                    WHERE stream_id = :streamId
                    ORDER BY snapshot_version DESC
                    """)
                .bind("streamId", streamId)
                .map(row -> row.get("snapshot_version", Long.class))
                .all();
    }

    @Override
    public Flux<UUID> getSnapshotStreamIds() {
        return databaseClient.sql("""
                    SELECT DISTINCT stream_id FROM snapshots ORDER BY stream_id
                    """)
                .map(row -> row.get("stream_id", UUID.class))
                .all();
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return databaseClient.sql("SELECT 1")
                .map(row -> Boolean.TRUE)
                .first()
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Snapshot storage health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    private Snapshot toSnapshot(Readable row) {
        UUID streamId = row.get("stream_id", UUID.class);
        Long version = row.get("snapshot_version", Long.class);
        OffsetDateTime createdAt = row.get("created_at", OffsetDateTime.class);
        try {
            JsonNode state = objectMapper.readTree(row.get("snapshot_data", String.class));
            Map<String, Object> metadata = objectMapper.readValue(
                    row.get("snapshot_metadata", String.class), METADATA_TYPE);
            return new Snapshot(streamId, version != null ? version : 0L, state, metadata,
                    createdAt != null ? createdAt.toInstant() : null);
        } catch (JsonProcessingException e) {
            throw CqrsException.serialization("Corrupt snapshot for stream " + streamId, e);
        }
    }

    private String write(Object value, Snapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw CqrsException.serialization("Cannot serialize snapshot for stream "
                    + snapshot.streamId(), e);
        }
    }
}
