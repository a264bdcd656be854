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

import org.fireflyframework.cqrs.H2TestDatabase;
import org.fireflyframework.cqrs.eventsourcing.event.EventTypeRegistry;
import org.fireflyframework.cqrs.eventsourcing.event.TaskCreatedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.WorkflowCreatedEvent;
import org.fireflyframework.cqrs.exception.ConcurrencyConflictException;
import org.fireflyframework.cqrs.model.ResearchMethodology;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.cqrs.TestFixtures.METHODOLOGY;
import static org.fireflyframework.cqrs.TestFixtures.created;
import static org.fireflyframework.cqrs.TestFixtures.renamed;
import static org.fireflyframework.cqrs.TestFixtures.started;
import static org.fireflyframework.cqrs.TestFixtures.taskCreated;

/**
 * Integration tests for {@link R2dbcEventStore} against an in-memory H2 database.
 */
class R2dbcEventStoreTest {

    private R2dbcEventStore store;
    private EventBus eventBus;
    private UUID streamId;

    @BeforeEach
    void setUp() {
        H2TestDatabase database = H2TestDatabase.create();
        EventSerializer serializer =
                new EventSerializer(H2TestDatabase.objectMapper(), EventTypeRegistry.withResearchEvents());
        eventBus = new EventBus();
        store = new R2dbcEventStore(database.databaseClient(), database.transactionalOperator(),
                serializer, eventBus, 2);
        streamId = UUID.randomUUID();
    }

    @Test
    @DisplayName("appendEvents should persist events and round-trip their payloads")
    void appendShouldPersistAndRoundTrip() {
        UUID taskId = UUID.randomUUID();
        UUID correlationId = UUID.randomUUID();
        WorkflowCreatedEvent createdEvent = WorkflowCreatedEvent.builder()
                .aggregateId(streamId)
                .correlationId(correlationId)
                .name("Persisted")
                .query("q")
                .methodology(METHODOLOGY)
                .build();

        StepVerifier.create(store.appendEvents(streamId,
                        List.of(createdEvent, started(streamId), taskCreated(streamId, taskId)), 0L))
                .expectNext(3L)
                .verifyComplete();

        StepVerifier.create(store.readStream(streamId, 0).collectList())
                .assertNext(events -> {
                    assertThat(events).extracting(StoredEvent::sequenceNumber).containsExactly(1L, 2L, 3L);
                    WorkflowCreatedEvent first = (WorkflowCreatedEvent) events.get(0).event();
                    assertThat(first.getName()).isEqualTo("Persisted");
                    assertThat(first.getMethodology()).isEqualTo(METHODOLOGY);
                    assertThat(first.getCorrelationId()).isEqualTo(correlationId);
                    assertThat(events.get(0).metadata().correlationId()).isEqualTo(correlationId);
                    assertThat(((TaskCreatedEvent) events.get(2).event()).getTaskId()).isEqualTo(taskId);
                })
                .verifyComplete();
        StepVerifier.create(store.getStreamVersion(streamId)).expectNext(3L).verifyComplete();
    }

    @Test
    @DisplayName("appendEvents should reject a stale expected version without writing")
    void appendShouldRejectStaleExpectedVersion() {
        store.appendEvents(streamId, List.of(created(streamId)), 0L).block();

        StepVerifier.create(store.appendEvents(streamId, List.of(created(streamId)), 0L))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ConcurrencyConflictException.class);
                    assertThat(((ConcurrencyConflictException) error).getActualVersion()).isEqualTo(1);
                })
                .verify();
        StepVerifier.create(store.getStreamVersion(streamId)).expectNext(1L).verifyComplete();
    }

    @Test
    @DisplayName("readEvents should respect fromVersion and limit")
    void readEventsShouldRespectBounds() {
        store.appendEvents(streamId, List.of(created(streamId), started(streamId),
                renamed(streamId, "a"), renamed(streamId, "b")), 0L).block();

        StepVerifier.create(store.readEvents(streamId, 1L, 2).map(StoredEvent::sequenceNumber))
                .expectNext(2L, 3L)
                .verifyComplete();
        StepVerifier.create(store.readStream(streamId, 2).map(StoredEvent::sequenceNumber))
                .expectNext(3L, 4L)
                .verifyComplete();
    }

    @Test
    @DisplayName("appendEvents should publish committed events to the bus")
    void appendShouldPublishCommittedEvents() {
        List<StoredEvent> received = new ArrayList<>();
        eventBus.subscribe(events -> Mono.fromRunnable(() -> received.addAll(events)));

        store.appendEvents(streamId, List.of(created(streamId)), 0L).block();

        assertThat(received).singleElement().extracting(StoredEvent::sequenceNumber).isEqualTo(1L);
    }

    @Test
    @DisplayName("stream id queries should list streams and filter by time window")
    void streamIdQueriesShouldWork() {
        UUID other = UUID.randomUUID();
        store.appendEvents(streamId, List.of(created(streamId)), 0L).block();
        store.appendEvents(other, List.of(created(other)), 0L).block();

        StepVerifier.create(store.getAllStreamIds().collectList())
                .assertNext(ids -> assertThat(ids).containsExactlyInAnyOrder(streamId, other))
                .verifyComplete();
        StepVerifier.create(store.getStreamIds(Instant.now().plusSeconds(3600), null)).verifyComplete();
        StepVerifier.create(store.getStreamIds(Instant.now().minusSeconds(3600), Instant.now().plusSeconds(3600))
                        .collectList())
                .assertNext(ids -> assertThat(ids).hasSize(2))
                .verifyComplete();
    }

    @Test
    @DisplayName("isHealthy should report true for a reachable database")
    void isHealthyShouldReportTrue() {
        StepVerifier.create(store.isHealthy()).expectNext(true).verifyComplete();
        StepVerifier.create(store.streamExists(UUID.randomUUID())).expectNext(false).verifyComplete();
    }

    @Test
    @DisplayName("methodology payloads should survive storage unchanged")
    void methodologyShouldSurviveStorage() {
        ResearchMethodology methodology = new ResearchMethodology("meta", List.of(), List.of("a", "b"), 5);
        store.appendEvents(streamId, List.of(WorkflowCreatedEvent.builder()
                .aggregateId(streamId).name("n").query("q").methodology(methodology).build()), 0L).block();

        StoredEvent stored = store.readEvents(streamId, null, null).blockFirst();

        assertThat(((WorkflowCreatedEvent) stored.event()).getMethodology()).isEqualTo(methodology);
    }
}
