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

import org.fireflyframework.cqrs.eventsourcing.store.StoredEvent;
import reactor.core.publisher.Mono;

/**
 * Receives historical events during a replay. Events of one stream arrive in
 * sequence order; different streams may be replayed concurrently.
 */
public interface ReplayHandler {

    String getName();

    boolean handles(String eventType);

    Mono<Void> handleEvent(StoredEvent event);
}
