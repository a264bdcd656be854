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


package org.fireflyframework.cqrs.eventsourcing.store;

import org.fireflyframework.cqrs.eventsourcing.event.AbstractDomainEvent;
import org.fireflyframework.cqrs.eventsourcing.event.EventMetadata;
import org.fireflyframework.cqrs.exception.ConcurrencyConflictException;
import org.fireflyframework.cqrs.exception.CqrsException;
import io.r2dbc.spi.Readable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.lang.Nullable;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link EventStore} persisting events to the {@code events} table through R2DBC.
 * <p>
 * The head check and the inserts of one append run in a single transaction.
 * The unique {@code (stream_id, sequence_number)} constraint is the final
 * arbiter between two writers that passed the head check concurrently; the
 * loser's constraint violation is reported as a {@link ConcurrencyConflictException}.
 */
@Slf4j
public class R2dbcEventStore implements EventStore {

    private final DatabaseClient databaseClient;
    private final TransactionalOperator transactionalOperator;
    private final EventSerializer serializer;
    private final EventBus eventBus;
    private final int maxEventsPerRead;

    public R2dbcEventStore(DatabaseClient databaseClient,
                           TransactionalOperator transactionalOperator,
                           EventSerializer serializer,
                           @Nullable EventBus eventBus,
                           int maxEventsPerRead) {
        this.databaseClient = databaseClient;
        this.transactionalOperator = transactionalOperator;
        this.serializer = serializer;
        this.eventBus = eventBus;
        this.maxEventsPerRead = maxEventsPerRead;
    }

    @Override
    public Mono<Long> appendEvents(UUID streamId, List<? extends AbstractDomainEvent> events,
                                   @Nullable Long expectedVersion) {
        if (events.isEmpty()) {
            return getStreamVersion(streamId);
        }

        AtomicLong observedHead = new AtomicLong();
        Mono<List<StoredEvent>> append = getStreamVersion(streamId)
                .flatMap(head -> {
                    observedHead.set(head);
                    if (expectedVersion != null && expectedVersion != head.longValue()) {
                        return Mono.error(new ConcurrencyConflictException(streamId, expectedVersion, head));
                    }
                    List<StoredEvent> stored = new ArrayList<>(events.size());
                    for (int i = 0; i < events.size(); i++) {
                        AbstractDomainEvent event = events.get(i);
                        stored.add(new StoredEvent(EventMetadata.forEvent(streamId, event, head + i + 1), event));
                    }
                    return Flux.fromIterable(stored)
                            .concatMap(this::insert)
                            .then(Mono.just(stored));
                })
                .as(transactionalOperator::transactional);

        return append
                .onErrorResume(DataIntegrityViolationException.class, e -> getStreamVersion(streamId)
                        .flatMap(actual -> Mono.error(new ConcurrencyConflictException(streamId,
                                expectedVersion != null ? expectedVersion : observedHead.get(), actual))))
                .onErrorMap(e -> !(e instanceof CqrsException),
                        e -> CqrsException.database("Failed to append events to stream " + streamId, e))
                .flatMap(stored -> {
                    long head = stored.get(stored.size() - 1).sequenceNumber();
                    log.debug("Appended {} events to stream {} (head={})", stored.size(), streamId, head);
                    Mono<Void> publish = eventBus != null ? eventBus.publish(stored) : Mono.empty();
                    return publish.thenReturn(head);
                });
    }

    @Override
    public Flux<StoredEvent> readEvents(UUID streamId, @Nullable Long fromVersion, @Nullable Integer limit) {
        return databaseClient.sql("""
                    SELECT event_id, stream_id, event_type, event_version, sequence_number,
                           event_data, occurred_at, correlation_id, causation_id
                    FROM events
                    WHERE stream_id = :streamId AND sequence_number > :fromVersion
                    ORDER BY sequence_number ASC
                    LIMIT :limit
                    """)
                .bind("streamId", streamId)
                .bind("fromVersion", fromVersion != null ? fromVersion : 0L)
                .bind("limit", limit != null ? limit : maxEventsPerRead)
                .map(this::toStoredEvent)
                .all()
                .onErrorMap(e -> !(e instanceof CqrsException),
                        e -> CqrsException.database("Failed to read stream " + streamId, e));
    }

    @Override
    public Mono<Long> getStreamVersion(UUID streamId) {
        return databaseClient.sql("""
                    SELECT COALESCE(MAX(sequence_number), 0) AS version
                    FROM events
                    WHERE stream_id = :streamId
                    """)
                .bind("streamId", streamId)
                .map(row -> row.get("version", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    @Override
    public Flux<UUID> getAllStreamIds() {
        return databaseClient.sql("""
                    SELECT DISTINCT stream_id FROM events ORDER BY stream_id
                    """)
                .map(row -> row.get("stream_id", UUID.class))
                .all();
    }

    @Override
    public Flux<UUID> getStreamIds(@Nullable Instant from, @Nullable Instant to) {
        StringBuilder sql = new StringBuilder("SELECT DISTINCT stream_id FROM events WHERE 1 = 1");
        if (from != null) {
            sql.append(" AND occurred_at >= :from");
        }
        if (to != null) {
            sql.append(" AND occurred_at <= :to");
        }
        sql.append(" ORDER BY stream_id");

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql.toString());
        if (from != null) {
            spec = spec.bind("from", toOffset(from));
        }
        if (to != null) {
            spec = spec.bind("to", toOffset(to));
        }
        return spec.map(row -> row.get("stream_id", UUID.class)).all();
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return databaseClient.sql("SELECT 1")
                .map(row -> Boolean.TRUE)
                .first()
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Event store health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    @Override
    public int getMaxEventsPerRead() {
        return maxEventsPerRead;
    }

    private Mono<Long> insert(StoredEvent stored) {
        EventMetadata metadata = stored.metadata();
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("""
                    INSERT INTO events (event_id, stream_id, event_type, event_version, sequence_number,
                                        event_data, occurred_at, correlation_id, causation_id)
                    VALUES (:eventId, :streamId, :eventType, :eventVersion, :sequenceNumber,
                            :eventData, :occurredAt, :correlationId, :causationId)
                    """)
                .bind("eventId", metadata.eventId())
                .bind("streamId", metadata.streamId())
                .bind("eventType", metadata.eventType())
                .bind("eventVersion", metadata.eventVersion())
                .bind("sequenceNumber", metadata.sequenceNumber())
                .bind("eventData", serializer.serialize(stored.event()))
                .bind("occurredAt", toOffset(metadata.timestamp()));
        spec = bindNullable(spec, "correlationId", metadata.correlationId());
        spec = bindNullable(spec, "causationId", metadata.causationId());
        return spec.fetch().rowsUpdated();
    }

    private StoredEvent toStoredEvent(Readable row) {
        String eventType = row.get("event_type", String.class);
        AbstractDomainEvent event = serializer.deserialize(eventType, row.get("event_data", String.class));
        OffsetDateTime occurredAt = row.get("occurred_at", OffsetDateTime.class);
        Integer eventVersion = row.get("event_version", Integer.class);
        Long sequenceNumber = row.get("sequence_number", Long.class);
        EventMetadata metadata = new EventMetadata(
                row.get("event_id", UUID.class),
                row.get("stream_id", UUID.class),
                eventType,
                eventVersion != null ? eventVersion : 1,
                sequenceNumber != null ? sequenceNumber : 0L,
                occurredAt != null ? occurredAt.toInstant() : null,
                row.get("correlation_id", UUID.class),
                row.get("causation_id", UUID.class));
        return new StoredEvent(metadata, event);
    }

    private static DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec,
                                                                  String name, @Nullable UUID value) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, UUID.class);
    }

    static OffsetDateTime toOffset(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}
