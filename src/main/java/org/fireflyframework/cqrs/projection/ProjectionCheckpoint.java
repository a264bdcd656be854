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

import java.time.Instant;
import java.util.UUID;

/**
 * Progress of one projection.
 *
 * @param projectionName   the projection
 * @param lastStreamId     stream of the last event applied
 * @param lastSequence     sequence number of the last event applied within {@code lastStreamId}
 * @param eventsProcessed  events applied since the last reset
 * @param status           current status
 * @param errorCount       failed applications since the last reset
 * @param lastError        message of the most recent failure, if any
 * @param updatedAt        when the checkpoint last changed
 */
public record ProjectionCheckpoint(
        String projectionName,
        UUID lastStreamId,
        long lastSequence,
        long eventsProcessed,
        ProjectionStatus status,
        long errorCount,
        String lastError,
        Instant updatedAt
) {

    public static ProjectionCheckpoint initial(String projectionName) {
        return new ProjectionCheckpoint(projectionName, null, 0, 0, ProjectionStatus.STOPPED, 0, null, Instant.now());
    }

    public ProjectionCheckpoint applied(UUID streamId, long sequence) {
        return new ProjectionCheckpoint(projectionName, streamId, sequence, eventsProcessed + 1, status,
                errorCount, lastError, Instant.now());
    }

    public ProjectionCheckpoint failed(String error) {
        return new ProjectionCheckpoint(projectionName, lastStreamId, lastSequence, eventsProcessed, status,
                errorCount + 1, error, Instant.now());
    }

    public ProjectionCheckpoint withStatus(ProjectionStatus newStatus) {
        return new ProjectionCheckpoint(projectionName, lastStreamId, lastSequence, eventsProcessed, newStatus,
                errorCount, lastError, Instant.now());
    }

    public ProjectionCheckpoint reset() {
        return new ProjectionCheckpoint(projectionName, null, 0, 0, status, 0, null, Instant.now());
    }
}
