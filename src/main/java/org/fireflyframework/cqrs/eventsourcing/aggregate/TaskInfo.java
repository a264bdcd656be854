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


package org.fireflyframework.cqrs.eventsourcing.aggregate;

import org.fireflyframework.cqrs.model.TaskStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A task tracked by a research workflow.
 */
public record TaskInfo(
        UUID taskId,
        String taskType,
        String agentType,
        TaskStatus status,
        Instant createdAt,
        Instant completedAt,
        Map<String, Object> results) {

    public static TaskInfo created(UUID taskId, String taskType, String agentType, Instant createdAt) {
        return new TaskInfo(taskId, taskType, agentType, TaskStatus.CREATED, createdAt, null, null);
    }

    /**
     * Returns a copy of this task marked COMPLETED with the given results.
     */
    public TaskInfo complete(Map<String, Object> results, Instant completedAt) {
        return new TaskInfo(taskId, taskType, agentType, TaskStatus.COMPLETED, createdAt, completedAt, results);
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }
}
