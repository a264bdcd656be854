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


package org.fireflyframework.cqrs.readmodel;

import org.fireflyframework.cqrs.model.TaskStatus;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Denormalized view of one workflow task.
 */
@Builder(toBuilder = true)
public record TaskReadModel(
        UUID id,
        UUID workflowId,
        String taskType,
        String agentType,
        TaskStatus status,
        Instant createdAt,
        Instant completedAt,
        Map<String, Object> results,
        Long durationSeconds
) {

    public TaskReadModel complete(Map<String, Object> taskResults, Instant at) {
        return toBuilder()
                .status(TaskStatus.COMPLETED)
                .completedAt(at)
                .results(taskResults)
                .durationSeconds(createdAt != null ? Duration.between(createdAt, at).toSeconds() : null)
                .build();
    }
}
