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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Task progress of a workflow.
 *
 * @param totalTasks            number of tasks created
 * @param completedTasks        number of completed tasks
 * @param failedTasks           number of failed tasks
 * @param progressPercentage    completed tasks as a percentage of all tasks, 0 without tasks
 * @param actualDurationMinutes minutes from start to completion, null while not finished
 */
public record WorkflowProgress(
        int totalTasks,
        int completedTasks,
        int failedTasks,
        double progressPercentage,
        Long actualDurationMinutes
) {

    public static final WorkflowProgress EMPTY = new WorkflowProgress(0, 0, 0, 0.0, null);

    public static WorkflowProgress of(List<TaskReadModel> tasks, Instant startedAt, Instant completedAt) {
        int total = tasks.size();
        int completed = (int) tasks.stream().filter(task -> task.status() == TaskStatus.COMPLETED).count();
        int failed = (int) tasks.stream().filter(task -> task.status() == TaskStatus.FAILED).count();
        double percentage = total > 0 ? completed * 100.0 / total : 0.0;
        Long duration = startedAt != null && completedAt != null
                ? Duration.between(startedAt, completedAt).toMinutes()
                : null;
        return new WorkflowProgress(total, completed, failed, percentage, duration);
    }
}
