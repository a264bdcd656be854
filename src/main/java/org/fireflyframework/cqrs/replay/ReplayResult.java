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

import java.time.Duration;
import java.util.UUID;

/**
 * Summary of a finished replay run. {@code success} means no stream failed and
 * the run was not cancelled.
 */
public record ReplayResult(
        UUID replayId,
        ReplayStatus status,
        boolean success,
        int totalStreams,
        int processedStreams,
        int failedStreams,
        long eventsProcessed,
        Duration duration
) {
}
