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

import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Durable per-stream replay positions, grouped under a checkpoint name.
 */
public interface ReplayCheckpointStore {

    Mono<Void> save(String name, UUID streamId, long lastSequence);

    /**
     * Returns the last processed sequence of a stream, or empty if none was recorded.
     */
    Mono<Long> load(String name, UUID streamId);

    Mono<Map<UUID, Long>> loadAll(String name);

    Mono<Void> clear(String name);
}
