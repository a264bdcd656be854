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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.cqrs.H2TestDatabase;
import org.fireflyframework.cqrs.MutableClock;
import org.fireflyframework.cqrs.eventsourcing.aggregate.ResearchWorkflowAggregate;
import org.fireflyframework.cqrs.eventsourcing.aggregate.ResearchWorkflowState;
import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.exception.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.fireflyframework.cqrs.TestFixtures.METHODOLOGY;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link SnapshotStore}, its storages and {@link SnapshotCleanupService}.
 */
class SnapshotStoreTest {

    private final ObjectMapper objectMapper = H2TestDatabase.objectMapper();
    private MutableClock clock;
    private UUID streamId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        streamId = UUID.randomUUID();
    }

    private SnapshotStore store(SnapshotStorage storage, int cacheSize, int maxPerStream) {
        return new SnapshotStore(storage, objectMapper, cacheSize, Duration.ofMinutes(5), maxPerStream, clock);
    }

    private ResearchWorkflowState runningState() {
        ResearchWorkflowAggregate aggregate = ResearchWorkflowAggregate.create(streamId, "n", "q", METHODOLOGY);
        aggregate.startExecution();
        return aggregate.getState();
    }

    // ========================================================================
    // Store Tests
    // ========================================================================

    @Nested
    @DisplayName("Snapshot store")
    class StoreTests {

        @Test
        @DisplayName("takeSnapshot should round-trip aggregate state")
        void takeSnapshotShouldRoundTripState() {
            SnapshotStore store = store(new InMemorySnapshotStorage(), 10, 3);
            ResearchWorkflowState state = runningState();

            store.takeSnapshot(streamId, 2, state, Map.of("aggregateType", "research-workflow")).block();

            Snapshot latest = store.loadLatest(streamId).block();
            assertThat(latest.version()).isEqualTo(2);
            assertThat(latest.metadata()).containsEntry("aggregateType", "research-workflow");
            assertThat(store.toState(latest, ResearchWorkflowState.class)).isEqualTo(state);
        }

        @Test
        @DisplayName("loadLatest should return the highest version")
        void loadLatestShouldReturnHighestVersion() {
            SnapshotStore store = store(new InMemorySnapshotStorage(), 0, 10);
            store.takeSnapshot(streamId, 5, runningState(), Map.of()).block();
            store.takeSnapshot(streamId, 10, runningState(), Map.of()).block();
            store.takeSnapshot(streamId, 3, runningState(), Map.of()).block();

            StepVerifier.create(store.loadLatest(streamId).map(Snapshot::version))
                    .expectNext(10L)
                    .verifyComplete();
            StepVerifier.create(store.loadAtVersion(streamId, 5).map(Snapshot::version))
                    .expectNext(5L)
                    .verifyComplete();
            StepVerifier.create(store.loadLatest(UUID.randomUUID())).verifyComplete();
        }

        @Test
        @DisplayName("loadLatest should be served from the cache until the TTL expires")
        void loadLatestShouldUseCacheUntilExpiry() {
            SnapshotStorage storage = mock(SnapshotStorage.class);
            Snapshot snapshot = new Snapshot(streamId, 4, objectMapper.valueToTree(runningState()), Map.of(),
                    clock.instant());
            when(storage.loadLatest(streamId)).thenReturn(Mono.just(snapshot));
            SnapshotStore store = store(storage, 10, 3);

            store.loadLatest(streamId).block();
            store.loadLatest(streamId).block();
            verify(storage, times(1)).loadLatest(streamId);

            clock.advance(Duration.ofMinutes(6));
            store.loadLatest(streamId).block();
            verify(storage, times(2)).loadLatest(streamId);
        }

        @Test
        @DisplayName("the cache should evict its oldest entry when full")
        void cacheShouldEvictOldestEntry() {
            SnapshotStore store = store(new InMemorySnapshotStorage(), 2, 3);
            for (int i = 0; i < 3; i++) {
                store.takeSnapshot(UUID.randomUUID(), 1, runningState(), Map.of()).block();
            }

            assertThat(store.getCacheSize()).isEqualTo(2);
            store.clearCache();
            assertThat(store.getCacheSize()).isZero();
        }

        @Test
        @DisplayName("cleanupOldSnapshots should keep only the newest snapshots")
        void cleanupShouldKeepNewest() {
            SnapshotStore store = store(new InMemorySnapshotStorage(), 10, 2);
            for (long version : new long[] {5, 10, 15, 20}) {
                store.takeSnapshot(streamId, version, runningState(), Map.of()).block();
            }

            StepVerifier.create(store.cleanupOldSnapshots(streamId)).expectNext(2L).verifyComplete();

            StepVerifier.create(store.getStats(streamId))
                    .assertNext(stats -> {
                        assertThat(stats.totalSnapshots()).isEqualTo(2);
                        assertThat(stats.latestVersion()).isEqualTo(20);
                        assertThat(stats.oldestVersion()).isEqualTo(15);
                        assertThat(stats.approximateSizeBytes()).isPositive();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("getStats should report an empty stream")
        void getStatsShouldReportEmptyStream() {
            SnapshotStore store = store(new InMemorySnapshotStorage(), 10, 2);

            StepVerifier.create(store.getStats(streamId))
                    .expectNext(SnapshotStats.empty(streamId))
                    .verifyComplete();
        }

        @Test
        @DisplayName("toState should report unreadable state as a snapshot error")
        void toStateShouldReportUnreadableState() {
            SnapshotStore store = store(new InMemorySnapshotStorage(), 10, 2);
            Snapshot broken = new Snapshot(streamId, 1, objectMapper.valueToTree(Map.of("tasks", "nope")),
                    Map.of(), clock.instant());

            assertThatThrownBy(() -> store.toState(broken, ResearchWorkflowState.class))
                    .isInstanceOf(CqrsException.class)
                    .extracting(e -> ((CqrsException) e).getErrorType())
                    .isEqualTo(ErrorType.SNAPSHOT);
        }

        @Test
        @DisplayName("snapshots should reject versions below 1")
        void snapshotShouldRejectVersionZero() {
            assertThatThrownBy(() -> new Snapshot(streamId, 0, null, Map.of(), clock.instant()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ========================================================================
    // R2DBC Storage Tests
    // ========================================================================

    @Nested
    @DisplayName("R2DBC storage")
    class R2dbcStorageTests {

        private SnapshotStore store;

        @BeforeEach
        void setUp() {
            H2TestDatabase database = H2TestDatabase.create();
            store = store(new R2dbcSnapshotStorage(database.databaseClient(), database.transactionalOperator(),
                    objectMapper), 0, 2);
        }

        @Test
        @DisplayName("save should upsert a snapshot at the same version")
        void saveShouldUpsert() {
            store.takeSnapshot(streamId, 5, runningState(), Map.of("n", 1)).block();
            store.takeSnapshot(streamId, 5, runningState(), Map.of("n", 2)).block();

            StepVerifier.create(store.loadLatest(streamId))
                    .assertNext(snapshot -> {
                        assertThat(snapshot.version()).isEqualTo(5);
                        assertThat(snapshot.metadata()).containsEntry("n", 2);
                        assertThat(store.toState(snapshot, ResearchWorkflowState.class).getName())
                                .isEqualTo("n");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("cleanup should delete older snapshots from the database")
        void cleanupShouldDeleteFromDatabase() {
            for (long version : new long[] {5, 10, 15}) {
                store.takeSnapshot(streamId, version, runningState(), Map.of()).block();
            }

            StepVerifier.create(store.cleanupOldSnapshots(streamId)).expectNext(1L).verifyComplete();
            StepVerifier.create(store.loadAtVersion(streamId, 5)).verifyComplete();
            StepVerifier.create(store.getSnapshotStreamIds()).expectNext(streamId).verifyComplete();
            StepVerifier.create(store.isHealthy()).expectNext(true).verifyComplete();
        }
    }

    // ========================================================================
    // Cleanup Service Tests
    // ========================================================================

    @Nested
    @DisplayName("Cleanup service")
    class CleanupServiceTests {

        @Test
        @DisplayName("cleanupAll should apply retention to every stream")
        void cleanupAllShouldApplyRetentionEverywhere() {
            SnapshotStore store = store(new InMemorySnapshotStorage(), 10, 1);
            UUID other = UUID.randomUUID();
            store.takeSnapshot(streamId, 1, runningState(), Map.of()).block();
            store.takeSnapshot(streamId, 2, runningState(), Map.of()).block();
            store.takeSnapshot(other, 1, runningState(), Map.of()).block();
            store.takeSnapshot(other, 2, runningState(), Map.of()).block();
            SnapshotCleanupService service = new SnapshotCleanupService(store, Duration.ofHours(1));

            StepVerifier.create(service.cleanupAll()).expectNext(2L).verifyComplete();
        }

        @Test
        @DisplayName("a failing stream should not stop cleanup of the others")
        void failingStreamShouldNotStopCleanup() {
            SnapshotStore store = mock(SnapshotStore.class);
            UUID other = UUID.randomUUID();
            when(store.getSnapshotStreamIds()).thenReturn(Flux.just(streamId, other));
            when(store.cleanupOldSnapshots(streamId)).thenReturn(Mono.error(new IllegalStateException("boom")));
            when(store.cleanupOldSnapshots(other)).thenReturn(Mono.just(3L));
            SnapshotCleanupService service = new SnapshotCleanupService(store, Duration.ofHours(1));

            StepVerifier.create(service.cleanupAll()).expectNext(3L).verifyComplete();
        }

        @Test
        @DisplayName("start and stop should toggle the running state")
        void startAndStopShouldToggleRunning() {
            SnapshotStore store = mock(SnapshotStore.class);
            when(store.getSnapshotStreamIds()).thenReturn(Flux.empty());
            SnapshotCleanupService service = new SnapshotCleanupService(store, Duration.ofHours(1));

            service.start();
            assertThat(service.isRunning()).isTrue();
            service.destroy();
            assertThat(service.isRunning()).isFalse();
            verify(store, times(0)).cleanupOldSnapshots(any());
        }
    }
}
