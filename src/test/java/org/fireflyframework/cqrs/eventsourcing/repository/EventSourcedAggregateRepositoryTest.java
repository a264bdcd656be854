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


package org.fireflyframework.cqrs.eventsourcing.repository;

import org.fireflyframework.cqrs.H2TestDatabase;
import org.fireflyframework.cqrs.eventsourcing.aggregate.ResearchWorkflowAggregate;
import org.fireflyframework.cqrs.eventsourcing.aggregate.ResearchWorkflowState;
import org.fireflyframework.cqrs.eventsourcing.snapshot.InMemorySnapshotStorage;
import org.fireflyframework.cqrs.eventsourcing.snapshot.Snapshot;
import org.fireflyframework.cqrs.eventsourcing.snapshot.SnapshotStorage;
import org.fireflyframework.cqrs.eventsourcing.snapshot.SnapshotStore;
import org.fireflyframework.cqrs.eventsourcing.store.InMemoryEventStore;
import org.fireflyframework.cqrs.exception.ConcurrencyConflictException;
import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.exception.ErrorType;
import org.fireflyframework.cqrs.model.WorkflowStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.cqrs.TestFixtures.METHODOLOGY;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link EventSourcedAggregateRepository}.
 */
class EventSourcedAggregateRepositoryTest {

    private InMemoryEventStore eventStore;
    private SnapshotStore snapshotStore;
    private EventSourcedAggregateRepository<ResearchWorkflowAggregate, ResearchWorkflowState> repository;
    private UUID workflowId;

    @BeforeEach
    void setUp() {
        eventStore = spy(new InMemoryEventStore());
        snapshotStore = new SnapshotStore(new InMemorySnapshotStorage(), H2TestDatabase.objectMapper(),
                100, Duration.ofMinutes(5), 3);
        repository = new EventSourcedAggregateRepository<>(eventStore, snapshotStore,
                ResearchWorkflowAggregate::new, ResearchWorkflowState.class, 5);
        workflowId = UUID.randomUUID();
    }

    private ResearchWorkflowAggregate createAndSave() {
        ResearchWorkflowAggregate aggregate = ResearchWorkflowAggregate.create(workflowId, "n", "q", METHODOLOGY);
        repository.save(aggregate).block();
        return aggregate;
    }

    // ========================================================================
    // Load and Save Tests
    // ========================================================================

    @Nested
    @DisplayName("Load and save")
    class LoadAndSaveTests {

        @Test
        @DisplayName("save should append uncommitted events and clear them")
        void saveShouldAppendAndClear() {
            ResearchWorkflowAggregate aggregate = ResearchWorkflowAggregate.create(workflowId, "n", "q", METHODOLOGY);
            aggregate.startExecution();

            StepVerifier.create(repository.save(aggregate)).expectNext(2L).verifyComplete();

            assertThat(aggregate.hasUncommittedEvents()).isFalse();
            StepVerifier.create(repository.getVersion(workflowId)).expectNext(2L).verifyComplete();
            StepVerifier.create(repository.exists(workflowId)).expectNext(true).verifyComplete();
        }

        @Test
        @DisplayName("save without pending events should return the current version")
        void saveWithoutPendingEventsShouldBeNoOp() {
            ResearchWorkflowAggregate aggregate = createAndSave();

            StepVerifier.create(repository.save(aggregate)).expectNext(1L).verifyComplete();
        }

        @Test
        @DisplayName("load should rebuild the aggregate from its events")
        void loadShouldRebuildFromEvents() {
            ResearchWorkflowAggregate saved = createAndSave();

            StepVerifier.create(repository.load(workflowId))
                    .assertNext(loaded -> {
                        assertThat(loaded.getVersion()).isEqualTo(1);
                        assertThat(loaded.getState()).isEqualTo(saved.getState());
                        assertThat(loaded.hasUncommittedEvents()).isFalse();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("load should report an unknown aggregate as not found")
        void loadShouldReportUnknownAggregate() {
            StepVerifier.create(repository.load(UUID.randomUUID()))
                    .expectErrorSatisfies(error -> assertThat(((CqrsException) error).getErrorType())
                            .isEqualTo(ErrorType.NOT_FOUND))
                    .verify();
        }

        @Test
        @DisplayName("saving two copies loaded at the same version should conflict")
        void staleCopyShouldConflict() {
            createAndSave();
            ResearchWorkflowAggregate first = repository.load(workflowId).block();
            ResearchWorkflowAggregate second = repository.load(workflowId).block();
            first.startExecution();
            second.updateWorkflow(Map.of("name", "other"));

            repository.save(first).block();

            StepVerifier.create(repository.save(second))
                    .expectError(ConcurrencyConflictException.class)
                    .verify();
            StepVerifier.create(repository.getVersion(workflowId)).expectNext(2L).verifyComplete();
        }
    }

    // ========================================================================
    // Snapshot Tests
    // ========================================================================

    @Nested
    @DisplayName("Snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("crossesSnapshotBoundary should detect crossing a multiple of the frequency")
        void crossesSnapshotBoundaryShouldDetectMultiples() {
            assertThat(EventSourcedAggregateRepository.crossesSnapshotBoundary(4, 5, 5)).isTrue();
            assertThat(EventSourcedAggregateRepository.crossesSnapshotBoundary(3, 7, 5)).isTrue();
            assertThat(EventSourcedAggregateRepository.crossesSnapshotBoundary(5, 9, 5)).isFalse();
            assertThat(EventSourcedAggregateRepository.crossesSnapshotBoundary(0, 100, 0)).isFalse();
        }

        @Test
        @DisplayName("load should restore the snapshot at 5 and replay only events 6 to 9")
        void loadShouldRestoreSnapshotAndReplayTail() {
            ResearchWorkflowAggregate aggregate = ResearchWorkflowAggregate.create(workflowId, "n", "q", METHODOLOGY);
            aggregate.startExecution();
            aggregate.updateWorkflow(Map.of("name", "v3"));
            aggregate.updateWorkflow(Map.of("name", "v4"));
            aggregate.updateWorkflow(Map.of("name", "v5"));
            repository.save(aggregate).block();
            for (int version = 6; version <= 9; version++) {
                aggregate.updateWorkflow(Map.of("name", "v" + version));
            }
            repository.save(aggregate).block();

            StepVerifier.create(snapshotStore.loadLatest(workflowId).map(Snapshot::version))
                    .expectNext(5L)
                    .verifyComplete();

            ResearchWorkflowAggregate loaded = repository.load(workflowId).block();

            assertThat(loaded.getVersion()).isEqualTo(9);
            assertThat(loaded.getName()).isEqualTo("v9");
            assertThat(loaded.getStatus()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(loaded.getState()).isEqualTo(aggregate.getState());
            verify(eventStore).readStream(workflowId, 5L);
        }

        @Test
        @DisplayName("a failing snapshot read should fall back to full replay")
        void failingSnapshotReadShouldFallBack() {
            SnapshotStorage storage = mock(SnapshotStorage.class);
            when(storage.loadLatest(any())).thenReturn(Mono.error(new IllegalStateException("storage down")));
            when(storage.save(any())).thenReturn(Mono.error(new IllegalStateException("storage down")));
            SnapshotStore failing = new SnapshotStore(storage, H2TestDatabase.objectMapper(), 0,
                    Duration.ofMinutes(5), 3);
            EventSourcedAggregateRepository<ResearchWorkflowAggregate, ResearchWorkflowState> fallback =
                    new EventSourcedAggregateRepository<>(eventStore, failing, ResearchWorkflowAggregate::new,
                            ResearchWorkflowState.class, 1);
            ResearchWorkflowAggregate aggregate = ResearchWorkflowAggregate.create(workflowId, "n", "q", METHODOLOGY);

            StepVerifier.create(fallback.save(aggregate)).expectNext(1L).verifyComplete();
            StepVerifier.create(fallback.load(workflowId).map(ResearchWorkflowAggregate::getVersion))
                    .expectNext(1L)
                    .verifyComplete();
            verify(eventStore).readStream(eq(workflowId), eq(0L));
        }

        @Test
        @DisplayName("a repository without a snapshot store should never snapshot")
        void repositoryWithoutSnapshotStoreShouldReplay() {
            EventSourcedAggregateRepository<ResearchWorkflowAggregate, ResearchWorkflowState> plain =
                    new EventSourcedAggregateRepository<>(eventStore, null, ResearchWorkflowAggregate::new,
                            ResearchWorkflowState.class, 1);
            plain.save(ResearchWorkflowAggregate.create(workflowId, "n", "q", METHODOLOGY)).block();

            StepVerifier.create(plain.load(workflowId).map(ResearchWorkflowAggregate::getName))
                    .expectNext("n")
                    .verifyComplete();
            verify(eventStore).readStream(workflowId, 0L);
        }
    }
}
