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


package org.fireflyframework.cqrs.projection;

import org.fireflyframework.cqrs.eventsourcing.store.StoredEvent;
import reactor.core.publisher.Mono;

/**
 * Folds stored events into read models.
 * <p>
 * {@link #apply(StoredEvent)} must be idempotent: applying an event that was
 * already applied leaves the read model unchanged.
 */
public interface Projection {

    String getName();

    boolean handles(String eventType);

    Mono<Void> apply(StoredEvent event);

    /**
     * Drops everything this projection has built, ahead of a rebuild.
     */
    Mono<Void> reset();
}
