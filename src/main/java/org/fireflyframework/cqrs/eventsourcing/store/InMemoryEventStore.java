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
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link EventStore} backed by a {@link ConcurrentHashMap} of immutable stream lists.
 * <p>
 * The version check and the append for a stream happen inside a single
 * {@link ConcurrentHashMap#compute} call, so two appends with the same expected
 * version can never both succeed. Readers always see a complete, immutable list.
 */
@Slf4j
public class InMemoryEventStore implements EventStore {

    private final ConcurrentHashMap<UUID, List<StoredEvent>> streams = new ConcurrentHashMap<>();
    private final EventBus eventBus;
    private final int maxEventsPerRead;

    public InMemoryEventStore() {
        this(null, 1000);
    }

    public InMemoryEventStore(@Nullable EventBus eventBus, int maxEventsPerRead) {
        this.eventBus = eventBus;
        this.maxEventsPerRead = maxEventsPerRead;
    }

    @Override
    public Mono<Long> appendEvents(UUID streamId, List<? extends AbstractDomainEvent> events,
                                   @Nullable Long expectedVersion) {
        if (events.isEmpty()) {
            return getStreamVersion(streamId);
        }

        return Mono.fromCallable(() -> {
                    List<StoredEvent> appended = new ArrayList<>(events.size());
                    streams.compute(streamId, (id, existing) -> {
                        List<StoredEvent> current = existing != null ? existing : List.of();
                        long head = current.size();
                        if (expectedVersion != null && expectedVersion != head) {
                            throw new ConcurrencyConflictException(streamId, expectedVersion, head);
                        }
                        List<StoredEvent> updated = new ArrayList<>(current);
                        for (int i = 0; i < events.size(); i++) {
                            AbstractDomainEvent event = events.get(i);
                            StoredEvent stored = new StoredEvent(
                                    EventMetadata.forEvent(streamId, event, head + i + 1), event);
                            updated.add(stored);
                            appended.add(stored);
                        }
                        return List.copyOf(updated);
                    });
                    return appended;
                })
                .doOnNext(appended -> log.debug("Appended {} events to stream {} (head={})",
                        appended.size(), streamId, lastSequence(appended)))
                .flatMap(appended -> publish(appended).thenReturn(lastSequence(appended)));
    }

    @Override
    public Flux<StoredEvent> readEvents(UUID streamId, @Nullable Long fromVersion, @Nullable Integer limit) {
        long from = fromVersion != null ? fromVersion : 0L;
        int max = limit != null ? limit : maxEventsPerRead;
        return Flux.defer(() -> Flux.fromIterable(streams.getOrDefault(streamId, List.of())))
                .filter(stored -> stored.sequenceNumber() > from)
                .take(max);
    }

    @Override
    public Mono<Long> getStreamVersion(UUID streamId) {
        return Mono.fromCallable(() -> (long) streams.getOrDefault(streamId, List.of()).size());
    }

    @Override
    public Flux<UUID> getAllStreamIds() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(streams.keySet())));
    }

    @Override
    public Flux<UUID> getStreamIds(@Nullable Instant from, @Nullable Instant to) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(streams.entrySet())))
                .filter(entry -> entry.getValue().stream()
                        .anyMatch(stored -> isWithin(stored.timestamp(), from, to)))
                .map(Map.Entry::getKey);
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    @Override
    public int getMaxEventsPerRead() {
        return maxEventsPerRead;
    }

    public int getStreamCount() {
        return streams.size();
    }

    public void clear() {
        streams.clear();
    }

    private Mono<Void> publish(List<StoredEvent> appended) {
        return eventBus != null ? eventBus.publish(appended) : Mono.empty();
    }

    private static long lastSequence(List<StoredEvent> appended) {
        return appended.get(appended.size() - 1).sequenceNumber();
    }

    static boolean isWithin(Instant timestamp, @Nullable Instant from, @Nullable Instant to) {
        return (from == null || !timestamp.isBefore(from)) && (to == null || !timestamp.isAfter(to));
    }
}
