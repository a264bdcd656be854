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


package org.fireflyframework.cqrs.eventsourcing.snapshot;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Serialized aggregate state captured at a stream version.
 *
 * @param streamId  the aggregate (stream) id
 * @param version   the stream version the state reflects, never above the stream head
 * @param state     the aggregate state as a JSON tree
 * @param metadata  free-form metadata (aggregate type, reason)
 * @param createdAt when the snapshot was taken
 */
public record Snapshot(UUID streamId, long version, JsonNode state, Map<String, Object> metadata,
                       Instant createdAt) {

    public Snapshot {
        if (version < 1) {
            throw new IllegalArgumentException("Snapshot version must be >= 1, was " + version);
        }
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Approximate size of the serialized state in characters.
     */
    public int approximateSize() {
        return state != null ? state.toString().length() : 0;
    }
}
