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

import org.fireflyframework.cqrs.eventsourcing.aggregate.AggregateRoot;
import org.fireflyframework.cqrs.eventsourcing.store.StoredEvent;
import org.fireflyframework.cqrs.exception.CqrsException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Rebuilds aggregates in memory from replayed events.
 * <p>
 * Events at or below an aggregate's version are skipped, so replaying a stream
 * twice is harmless. An event that leaves a gap in the sequence fails the stream.
 *
 * @param <A> the aggregate type
 */
@Slf4j
public class AggregateReplayHandler<A extends AggregateRoot<?>> implements ReplayHandler {

    private final String name;
    private final Set<String> eventTypes;
    private final Function<UUID, A> factory;
    private final Map<UUID, A> aggregates = new ConcurrentHashMap<>();

    public AggregateReplayHandler(String name, Set<String> eventTypes, Function<UUID, A> factory) {
        this.name = name;
        this.eventTypes = Set.copyOf(eventTypes);
        this.factory = factory;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean handles(String eventType) {
        return eventTypes.contains(eventType);
    }

    @Override
    public Mono<Void> handleEvent(StoredEvent event) {
        return Mono.fromRunnable(() -> {
            A aggregate = aggregates.computeIfAbsent(event.streamId(), factory);
            long expected = aggregate.getVersion() + 1;
            if (event.sequenceNumber() < expected) {
                log.debug("Aggregate {} already at version {}, skipping #{}", event.streamId(),
                        aggregate.getVersion(), event.sequenceNumber());
                return;
            }
            if (event.sequenceNumber() > expected) {
                throw CqrsException.eventStore("Gap in stream " + event.streamId() + ": expected #"
                        + expected + " but got #" + event.sequenceNumber());
            }
            aggregate.apply(event.event());
        });
    }

    public Optional<A> getAggregate(UUID aggregateId) {
        return Optional.ofNullable(aggregates.get(aggregateId));
    }

    public Map<UUID, A> getAggregates() {
        return Map.copyOf(aggregates);
    }

    public void clear() {
        aggregates.clear();
    }
}
