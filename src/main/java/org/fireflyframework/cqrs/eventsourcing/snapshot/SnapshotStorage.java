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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Persistence backend for snapshots. Caching is layered on top by {@link SnapshotStore}.
 */
public interface SnapshotStorage {

    /**
     * Stores a snapshot, replacing any snapshot of the same stream at the same version.
     */
    Mono<Void> save(Snapshot snapshot);

    /**
     * Loads the snapshot with the highest version, empty if the stream has none.
     */
    Mono<Snapshot> loadLatest(UUID streamId);

    /**
     * Loads the snapshot with the greatest version not above {@code version}.
     */
    Mono<Snapshot> loadAtVersion(UUID streamId, long version);

    /**
     * Deletes snapshots with a version strictly below {@code version}.
     *
     * @return the number of snapshots deleted
     */
    Mono<Long> deleteBeforeVersion(UUID streamId, long version);

    /**
     * Lists the stored snapshot versions, newest first.
     */
    Flux<Long> listVersions(UUID streamId);

    /**
     * Enumerates the streams that have at least one snapshot.
     */
    Flux<UUID> getSnapshotStreamIds();

    Mono<Boolean> isHealthy();
}
