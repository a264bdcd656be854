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
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryReplayCheckpointStore implements ReplayCheckpointStore {

    private final Map<String, Map<UUID, Long>> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> save(String name, UUID streamId, long lastSequence) {
        return Mono.fromRunnable(() ->
                checkpoints.computeIfAbsent(name, key -> new ConcurrentHashMap<>()).put(streamId, lastSequence));
    }

    @Override
    public Mono<Long> load(String name, UUID streamId) {
        return Mono.justOrEmpty(checkpoints.getOrDefault(name, Map.of()).get(streamId));
    }

    @Override
    public Mono<Map<UUID, Long>> loadAll(String name) {
        return Mono.fromCallable(() -> Map.copyOf(checkpoints.getOrDefault(name, Map.of())));
    }

    @Override
    public Mono<Void> clear(String name) {
        return Mono.fromRunnable(() -> checkpoints.remove(name));
    }
}
