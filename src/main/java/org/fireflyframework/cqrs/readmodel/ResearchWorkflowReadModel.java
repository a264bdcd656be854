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

import org.fireflyframework.cqrs.model.ResearchMethodology;
import org.fireflyframework.cqrs.model.ResearchResults;
import org.fireflyframework.cqrs.model.WorkflowStatus;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Denormalized detail view of a research workflow.
 * <p>
 * {@code lastAppliedSequence} is the sequence number of the last event folded
 * into this view; the projection skips events at or below it.
 */
@Builder(toBuilder = true)
public record ResearchWorkflowReadModel(
        UUID id,
        String name,
        String query,
        ResearchMethodology methodology,
        WorkflowStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant updatedAt,
        ResearchResults results,
        String errorMessage,
        List<TaskReadModel> tasks,
        WorkflowProgress progress,
        long lastAppliedSequence
) {

    public ResearchWorkflowReadModel {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        progress = progress != null ? progress : WorkflowProgress.EMPTY;
    }

    public ResearchWorkflowReadModel withoutTasks() {
        return toBuilder().tasks(List.of()).build();
    }

    public WorkflowSummary toSummary() {
        return new WorkflowSummary(id, name, query, status, createdAt, completedAt,
                progress.progressPercentage(), progress.totalTasks(), progress.completedTasks());
    }
}
