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

import java.time.Instant;
import java.util.UUID;

/**
 * Per-stream snapshot statistics.
 *
 * @param streamId             the stream id
 * @param totalSnapshots       number of stored snapshots
 * @param latestVersion        highest snapshot version, 0 if none
 * @param oldestVersion        lowest snapshot version, 0 if none
 * @param approximateSizeBytes size of the latest snapshot's state
 * @param lastSnapshotAt       creation time of the latest snapshot, null if none
 */
public record SnapshotStats(UUID streamId, long totalSnapshots, long latestVersion, long oldestVersion,
                            long approximateSizeBytes, Instant lastSnapshotAt) {

    public static SnapshotStats empty(UUID streamId) {
        return new SnapshotStats(streamId, 0, 0, 0, 0, null);
    }
}
