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

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * {@link SnapshotStorage} keeping snapshots in sorted per-stream maps.
 */
public class InMemorySnapshotStorage implements SnapshotStorage {

    private final Map<UUID, ConcurrentSkipListMap<Long, Snapshot>> snapshots = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> save(Snapshot snapshot) {
        return Mono.fromRunnable(() -> snapshots
                .computeIfAbsent(snapshot.streamId(), id -> new ConcurrentSkipListMap<>())
                .put(snapshot.version(), snapshot));
    }

    @Override
    public Mono<Snapshot> loadLatest(UUID streamId) {
        return Mono.fromCallable(() -> {
            NavigableMap<Long, Snapshot> stream = snapshots.get(streamId);
            if (stream == null) {
                return null;
            }
            Map.Entry<Long, Snapshot> last = stream.lastEntry();
            return last != null ? last.getValue() : null;
        });
    }

    @Override
    public Mono<Snapshot> loadAtVersion(UUID streamId, long version) {
        return Mono.fromCallable(() -> {
            NavigableMap<Long, Snapshot> stream = snapshots.get(streamId);
            if (stream == null) {
                return null;
            }
            Map.Entry<Long, Snapshot> floor = stream.floorEntry(version);
            return floor != null ? floor.getValue() : null;
        });
    }

    @Override
    public Mono<Long> deleteBeforeVersion(UUID streamId, long version) {
        return Mono.fromCallable(() -> {
            ConcurrentSkipListMap<Long, Snapshot> stream = snapshots.get(streamId);
            if (stream == null) {
                return 0L;
            }
            NavigableMap<Long, Snapshot> older = stream.headMap(version, false);
            long count = older.size();
            older.clear();
            return count;
        });
    }

    @Override
    public Flux<Long> listVersions(UUID streamId) {
        return Flux.defer(() -> {
            ConcurrentSkipListMap<Long, Snapshot> stream = snapshots.get(streamId);
            return stream == null
                    ? Flux.empty()
                    : Flux.fromIterable(List.copyOf(stream.descendingKeySet()));
        });
    }

    @Override
    public Flux<UUID> getSnapshotStreamIds() {
        return Flux.defer(() -> Flux.fromIterable(snapshots.entrySet().stream()
                .filter(entry -> !entry.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .toList()));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }
}
