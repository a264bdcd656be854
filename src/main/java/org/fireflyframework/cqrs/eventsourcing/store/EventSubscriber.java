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

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Receives events published by the {@link EventBus} after a successful append.
 */
@FunctionalInterface
public interface EventSubscriber {

    /**
     * Handles a batch of events from a single append, in sequence order.
     */
    Mono<Void> onEvents(List<StoredEvent> events);
}
