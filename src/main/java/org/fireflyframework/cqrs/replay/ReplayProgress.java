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

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Point-in-time view of a replay run.
 *
 * @param replayId         id of the run
 * @param status           current status
 * @param totalStreams     streams selected for the run
 * @param processedStreams streams finished successfully
 * @param failedStreams    streams that failed
 * @param eventsProcessed  events dispatched to handlers
 * @param checkpoints      last processed sequence number per stream
 * @param startedAt        when the run started
 * @param completedAt      when the run ended, null while active
 * @param lastError        most recent stream failure, if any
 */
public record ReplayProgress(
        UUID replayId,
        ReplayStatus status,
        int totalStreams,
        int processedStreams,
        int failedStreams,
        long eventsProcessed,
        Map<UUID, Long> checkpoints,
        Instant startedAt,
        Instant completedAt,
        String lastError
) {

    public ReplayProgress {
        checkpoints = checkpoints != null ? Map.copyOf(checkpoints) : Map.of();
    }

    public static ReplayProgress notStarted() {
        return new ReplayProgress(null, ReplayStatus.NOT_STARTED, 0, 0, 0, 0, Map.of(), null, null, null);
    }

    public double progressPercentage() {
        return totalStreams > 0 ? (processedStreams + failedStreams) * 100.0 / totalStreams : 0.0;
    }
}
