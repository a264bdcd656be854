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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.cqrs.exception.CqrsException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Snapshot store with a read-through cache of the latest snapshot per stream.
 * <p>
 * Only {@link #loadLatest(UUID)} is served from the cache; {@link #loadAtVersion(UUID, long)}
 * always reads the storage. The cache is bounded: when full, the oldest cached entry is
 * evicted. Entries older than the TTL are treated as absent.
 */
@Slf4j
public class SnapshotStore {

    private final SnapshotStorage storage;
    private final ObjectMapper objectMapper;
    private final int cacheSize;
    private final Duration cacheTtl;
    private final int maxSnapshotsPerStream;
    private final Clock clock;

    private final Map<UUID, CachedSnapshot> cache = new LinkedHashMap<>();
    private final ReentrantLock cacheLock = new ReentrantLock();

    public SnapshotStore(SnapshotStorage storage, ObjectMapper objectMapper, int cacheSize,
                         Duration cacheTtl, int maxSnapshotsPerStream) {
        this(storage, objectMapper, cacheSize, cacheTtl, maxSnapshotsPerStream, Clock.systemUTC());
    }

    public SnapshotStore(SnapshotStorage storage, ObjectMapper objectMapper, int cacheSize,
                         Duration cacheTtl, int maxSnapshotsPerStream, Clock clock) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.cacheSize = cacheSize;
        this.cacheTtl = cacheTtl;
        this.maxSnapshotsPerStream = maxSnapshotsPerStream;
        this.clock = clock;
    }

    // ==================== Snapshot operations ====================

    /**
     * Stores a snapshot, replacing any snapshot at the same version, and refreshes
     * the cached latest snapshot when this one is at least as new.
     */
    public Mono<Void> save(Snapshot snapshot) {
        return storage.save(snapshot)
                .doOnSuccess(ignored -> {
                    cacheIfNewer(snapshot);
                    log.debug("Saved snapshot for stream {} at version {}", snapshot.streamId(), snapshot.version());
                });
    }

    /**
     * Captures aggregate state as a snapshot and saves it.
     */
    public Mono<Snapshot> takeSnapshot(UUID streamId, long version, Object state, Map<String, Object> metadata) {
        return Mono.fromCallable(() -> new Snapshot(streamId, version, toTree(state, streamId), metadata,
                        clock.instant()))
                .flatMap(snapshot -> save(snapshot).thenReturn(snapshot));
    }

    public Mono<Snapshot> loadLatest(UUID streamId) {
        Snapshot cached = getCached(streamId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return storage.loadLatest(streamId)
                .doOnNext(this::cacheIfNewer);
    }

    public Mono<Snapshot> loadAtVersion(UUID streamId, long version) {
        return storage.loadAtVersion(streamId, version);
    }

    /**
     * Deletes snapshots of a stream with a version strictly below {@code version}.
     */
    public Mono<Long> deleteBefore(UUID streamId, long version) {
        return storage.deleteBeforeVersion(streamId, version)
                .doOnNext(deleted -> {
                    withCacheLock(() -> {
                        CachedSnapshot cached = cache.get(streamId);
                        if (cached != null && cached.snapshot().version() < version) {
                            cache.remove(streamId);
                        }
                        return null;
                    });
                    if (deleted > 0) {
                        log.debug("Deleted {} snapshots of stream {} before version {}", deleted, streamId, version);
                    }
                });
    }

    /**
     * Keeps only the {@code maxSnapshotsPerStream} most recent snapshots of a stream.
     *
     * @return the number of snapshots deleted
     */
    public Mono<Long> cleanupOldSnapshots(UUID streamId) {
        return storage.listVersions(streamId)
                .collectList()
                .flatMap(versions -> {
                    if (versions.size() <= maxSnapshotsPerStream) {
                        return Mono.just(0L);
                    }
                    long oldestKept = versions.get(maxSnapshotsPerStream - 1);
                    return deleteBefore(streamId, oldestKept);
                });
    }

    public Mono<SnapshotStats> getStats(UUID streamId) {
        return storage.listVersions(streamId)
                .collectList()
                .flatMap(versions -> {
                    if (versions.isEmpty()) {
                        return Mono.just(SnapshotStats.empty(streamId));
                    }
                    return loadLatest(streamId)
                            .map(latest -> toStats(streamId, versions, latest))
                            .defaultIfEmpty(SnapshotStats.empty(streamId));
                });
    }

    public Flux<UUID> getSnapshotStreamIds() {
        return storage.getSnapshotStreamIds();
    }

    public Mono<Boolean> isHealthy() {
        return storage.isHealthy();
    }

    /**
     * Converts a snapshot's state tree back into its typed form.
     */
    public <S> S toState(Snapshot snapshot, Class<S> stateType) {
        try {
            return objectMapper.treeToValue(snapshot.state(), stateType);
        } catch (JsonProcessingException e) {
            throw CqrsException.snapshot("Cannot restore snapshot of stream " + snapshot.streamId()
                    + " at version " + snapshot.version(), e);
        }
    }

    // ==================== Cache ====================

    public void evict(UUID streamId) {
        withCacheLock(() -> cache.remove(streamId));
    }

    public void clearCache() {
        withCacheLock(() -> {
            cache.clear();
            return null;
        });
    }

    public int getCacheSize() {
        return withCacheLock(cache::size);
    }

    private Snapshot getCached(UUID streamId) {
        return withCacheLock(() -> {
            CachedSnapshot cached = cache.get(streamId);
            if (cached == null) {
                return null;
            }
            if (cached.isExpired(clock.instant(), cacheTtl)) {
                cache.remove(streamId);
                return null;
            }
            return cached.snapshot();
        });
    }

    private void cacheIfNewer(Snapshot snapshot) {
        if (cacheSize <= 0) {
            return;
        }
        withCacheLock(() -> {
            CachedSnapshot existing = cache.get(snapshot.streamId());
            if (existing != null && existing.snapshot().version() > snapshot.version()) {
                return null;
            }
            cache.remove(snapshot.streamId());
            while (cache.size() >= cacheSize) {
                UUID eldest = cache.keySet().iterator().next();
                cache.remove(eldest);
            }
            cache.put(snapshot.streamId(), new CachedSnapshot(snapshot, clock.instant()));
            return null;
        });
    }

    private <T> T withCacheLock(Supplier<T> action) {
        cacheLock.lock();
        try {
            return action.get();
        } finally {
            cacheLock.unlock();
        }
    }

    private JsonNode toTree(Object state, UUID streamId) {
        try {
            return objectMapper.valueToTree(state);
        } catch (IllegalArgumentException e) {
            throw CqrsException.snapshot("Cannot serialize state of stream " + streamId, e);
        }
    }

    private static SnapshotStats toStats(UUID streamId, List<Long> versions, Snapshot latest) {
        return new SnapshotStats(streamId, versions.size(), versions.get(0),
                versions.get(versions.size() - 1), latest.approximateSize(), latest.createdAt());
    }

    private record CachedSnapshot(Snapshot snapshot, Instant cachedAt) {

        boolean isExpired(Instant now, Duration ttl) {
            return cachedAt.plus(ttl).isBefore(now);
        }
    }
}
