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


package org.fireflyframework.cqrs.replay;

import org.fireflyframework.cqrs.exception.CqrsException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * {@link ReplayCheckpointStore} backed by the {@code projection_checkpoints} table.
 */
public class R2dbcReplayCheckpointStore implements ReplayCheckpointStore {

    private final DatabaseClient databaseClient;
    private final TransactionalOperator transactionalOperator;

    public R2dbcReplayCheckpointStore(DatabaseClient databaseClient, TransactionalOperator transactionalOperator) {
        this.databaseClient = databaseClient;
        this.transactionalOperator = transactionalOperator;
    }

    @Override
    public Mono<Void> save(String name, UUID streamId, long lastSequence) {
        return databaseClient.sql("""
                    DELETE FROM projection_checkpoints
                    WHERE checkpoint_name = :name AND stream_id = :streamId
                    """)
                .bind("name", name)
                .bind("streamId", streamId)
                .fetch()
                .rowsUpdated()
                .then(databaseClient.sql("""
                            INSERT INTO projection_checkpoints (checkpoint_name, stream_id, last_sequence, updated_at)
                            VALUES (:name, :streamId, :lastSequence, :updatedAt)
                            """)
                        .bind("name", name)
                        .bind("streamId", streamId)
                        .bind("lastSequence", lastSequence)
                        .bind("updatedAt", Instant.now().atOffset(ZoneOffset.UTC))
                        .fetch()
                        .rowsUpdated())
                .then()
                .as(transactionalOperator::transactional)
                .onErrorMap(e -> !(e instanceof CqrsException),
                        e -> CqrsException.database("Failed to save checkpoint " + name + " for stream " + streamId, e));
    }

    @Override
    public Mono<Long> load(String name, UUID streamId) {
        return databaseClient.sql("""
                    SELECT last_sequence FROM projection_checkpoints
                    WHERE checkpoint_name = :name AND stream_id = :streamId
                    """)
                .bind("name", name)
                .bind("streamId", streamId)
                .map(row -> row.get("last_sequence", Long.class))
                .first();
    }

    @Override
    public Mono<Map<UUID, Long>> loadAll(String name) {
        return databaseClient.sql("""
                    SELECT stream_id, last_sequence FROM projection_checkpoints
                    WHERE checkpoint_name = :name
                    """)
                .bind("name", name)
                .map(row -> Map.entry(row.get("stream_id", UUID.class), row.get("last_sequence", Long.class)))
                .all()
                .collectMap(Map.Entry::getKey, Map.Entry::getValue, HashMap::new)
                .map(Map::copyOf);
    }

    @Override
    public Mono<Void> clear(String name) {
        return databaseClient.sql("DELETE FROM projection_checkpoints WHERE checkpoint_name = :name")
                .bind("name", name)
                .fetch()
                .rowsUpdated()
                .then();
    }
}
