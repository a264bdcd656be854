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
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only store of event streams with optimistic concurrency.
 * <p>
 * Each stream is identified by its aggregate id. Events in a stream carry
 * contiguous sequence numbers starting at 1; the highest sequence number is the
 * stream's head version (0 for a stream without events).
 */
public interface EventStore {

    /**
     * Appends events to a stream.
     * <p>
     * When {@code expectedVersion} is non-null it must equal the stream head at
     * commit time, otherwise the append fails with
     * {@link org.fireflyframework.cqrs.exception.ConcurrencyConflictException}
     * and nothing is written. Events receive sequence numbers
     * {@code head+1 .. head+events.size()}.
     *
     * @param streamId        the stream (aggregate) id
     * @param events          the events to append, in order
     * @param expectedVersion the expected head version, or null to append at the current head
     * @return the new head version
     */
    Mono<Long> appendEvents(UUID streamId, List<? extends AbstractDomainEvent> events,
                            @Nullable Long expectedVersion);

    /**
     * Reads events with a sequence number greater than {@code fromVersion}, in ascending order.
     *
     * @param streamId    the stream id
     * @param fromVersion exclusive lower bound, null for the start of the stream
     * @param limit       maximum number of events, null for {@link #getMaxEventsPerRead()}
     */
    Flux<StoredEvent> readEvents(UUID streamId, @Nullable Long fromVersion, @Nullable Integer limit);

    /**
     * Returns the head version of a stream, 0 if the stream does not exist.
     */
    Mono<Long> getStreamVersion(UUID streamId);

    /**
     * Enumerates the ids of all streams.
     */
    Flux<UUID> getAllStreamIds();

    /**
     * Enumerates the ids of streams with at least one event appended inside the window.
     *
     * @param from inclusive lower bound, null for unbounded
     * @param to   inclusive upper bound, null for unbounded
     */
    Flux<UUID> getStreamIds(@Nullable Instant from, @Nullable Instant to);

    /**
     * Checks that the backing storage is reachable.
     */
    Mono<Boolean> isHealthy();

    /**
     * Default page size for reads without an explicit limit.
     */
    int getMaxEventsPerRead();

    /**
     * Reads every event after {@code fromVersion}, fetching pages of
     * {@link #getMaxEventsPerRead()} events.
     */
    default Flux<StoredEvent> readStream(UUID streamId, long fromVersion) {
        int pageSize = getMaxEventsPerRead();
        return readEvents(streamId, fromVersion, pageSize)
                .collectList()
                .expand(page -> page.size() < pageSize
                        ? Mono.empty()
                        : readEvents(streamId, page.get(page.size() - 1).sequenceNumber(), pageSize)
                                .collectList()
                                .filter(next -> !next.isEmpty()))
                .flatMapIterable(page -> page);
    }

    /**
     * Returns {@code true} if the stream has at least one event.
     */
    default Mono<Boolean> streamExists(UUID streamId) {
        return getStreamVersion(streamId).map(version -> version > 0);
    }
}
