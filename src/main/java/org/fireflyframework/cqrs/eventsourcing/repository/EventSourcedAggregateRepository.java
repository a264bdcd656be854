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

import org.fireflyframework.cqrs.eventsourcing.aggregate.AggregateRoot;
import org.fireflyframework.cqrs.eventsourcing.event.AbstractDomainEvent;
import org.fireflyframework.cqrs.eventsourcing.snapshot.Snapshot;
import org.fireflyframework.cqrs.eventsourcing.snapshot.SnapshotStore;
import org.fireflyframework.cqrs.eventsourcing.store.EventStore;
import org.fireflyframework.cqrs.eventsourcing.store.StoredEvent;
import org.fireflyframework.cqrs.exception.CqrsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * {@link AggregateRepository} on top of an {@link EventStore} and an optional {@link SnapshotStore}.
 * <p>
 * A snapshot is taken after a save whose new version crosses a multiple of the
 * snapshot frequency. Snapshot reads and writes are an optimization only: a
 * failing snapshot falls back to full replay on load and is logged on save.
 *
 * @param <A> the aggregate type
 * @param <S> the aggregate's state type
 */
@Slf4j
public class EventSourcedAggregateRepository<A extends AggregateRoot<S>, S> implements AggregateRepository<A> {

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final Function<UUID, A> aggregateFactory;
    private final Class<S> stateType;
    private final int snapshotFrequency;

    public EventSourcedAggregateRepository(EventStore eventStore,
                                           @Nullable SnapshotStore snapshotStore,
                                           Function<UUID, A> aggregateFactory,
                                           Class<S> stateType,
                                           int snapshotFrequency) {
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.aggregateFactory = aggregateFactory;
        this.stateType = stateType;
        this.snapshotFrequency = snapshotFrequency;
    }

    @Override
    public Mono<A> load(UUID id) {
        return loadSnapshot(id)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(snapshot -> {
                    A aggregate = aggregateFactory.apply(id);
                    long fromVersion = 0L;
                    if (snapshot.isPresent()) {
                        aggregate.restoreFromSnapshot(snapshotStore.toState(snapshot.get(), stateType),
                                snapshot.get().version());
                        fromVersion = snapshot.get().version();
                    }
                    long snapshotVersion = fromVersion;
                    return eventStore.readStream(id, fromVersion)
                            .map(StoredEvent::event)
                            .collectList()
                            .flatMap(events -> rebuild(aggregate, snapshotVersion, events));
                });
    }

    @Override
    public Mono<Long> save(A aggregate) {
        if (!aggregate.hasUncommittedEvents()) {
            return Mono.just(aggregate.getVersion());
        }
        List<AbstractDomainEvent> events = aggregate.getUncommittedEvents();
        long expectedVersion = aggregate.getVersion() - events.size();

        return eventStore.appendEvents(aggregate.getId(), events, expectedVersion)
                .flatMap(newVersion -> {
                    aggregate.markEventsAsCommitted();
                    log.debug("Saved {} {} events for aggregate {} (version {} -> {})", events.size(),
                            aggregate.getAggregateType(), aggregate.getId(), expectedVersion, newVersion);
                    return maybeSnapshot(aggregate, expectedVersion, newVersion).thenReturn(newVersion);
                });
    }

    @Override
    public Mono<Boolean> exists(UUID id) {
        return eventStore.streamExists(id);
    }

    @Override
    public Mono<Long> getVersion(UUID id) {
        return eventStore.getStreamVersion(id);
    }

    /**
     * Returns {@code true} if moving from {@code previousVersion} to {@code newVersion}
     * crosses a multiple of {@code frequency}.
     */
    static boolean crossesSnapshotBoundary(long previousVersion, long newVersion, int frequency) {
        return frequency > 0 && previousVersion / frequency < newVersion / frequency;
    }

    private Mono<A> rebuild(A aggregate, long snapshotVersion, List<AbstractDomainEvent> events) {
        if (snapshotVersion == 0 && events.isEmpty()) {
            return Mono.error(CqrsException.notFound(aggregate.getAggregateType() + " " + aggregate.getId()));
        }
        aggregate.loadFromHistory(events);
        aggregate.validate();
        log.debug("Loaded aggregate {} at version {} (snapshot={}, replayed={})",
                aggregate.getId(), aggregate.getVersion(), snapshotVersion, events.size());
        return Mono.just(aggregate);
    }

    private Mono<Snapshot> loadSnapshot(UUID id) {
        if (snapshotStore == null) {
            return Mono.empty();
        }
        return snapshotStore.loadLatest(id)
                .onErrorResume(error -> {
                    log.warn("Failed to load snapshot for aggregate {}, replaying full stream: {}",
                            id, error.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Void> maybeSnapshot(A aggregate, long previousVersion, long newVersion) {
        if (snapshotStore == null || !crossesSnapshotBoundary(previousVersion, newVersion, snapshotFrequency)) {
            return Mono.empty();
        }
        return snapshotStore.takeSnapshot(aggregate.getId(), newVersion, aggregate.getState(),
                        Map.of("aggregateType", aggregate.getAggregateType()))
                .doOnNext(snapshot -> log.debug("Snapshot taken for aggregate {} at version {}",
                        aggregate.getId(), newVersion))
                .onErrorResume(error -> {
                    log.warn("Failed to snapshot aggregate {} at version {}: {}",
                            aggregate.getId(), newVersion, error.getMessage());
                    return Mono.empty();
                })
                .then();
    }
}
