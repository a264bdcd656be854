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
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Loads and persists event-sourced aggregates.
 *
 * @param <A> the aggregate type
 */
public interface AggregateRepository<A extends AggregateRoot<?>> {

    /**
     * Rebuilds an aggregate from its latest snapshot and the events after it.
     * Fails with NOT_FOUND if the stream has no events.
     */
    Mono<A> load(UUID id);

    /**
     * Appends the aggregate's uncommitted events, expecting the stream head to be
     * the version the aggregate had before those events were applied.
     *
     * @return the new stream version
     */
    Mono<Long> save(A aggregate);

    Mono<Boolean> exists(UUID id);

    Mono<Long> getVersion(UUID id);
}
