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

import org.fireflyframework.cqrs.model.ResearchMethodology;
import org.fireflyframework.cqrs.model.ResearchResults;
import org.fireflyframework.cqrs.model.WorkflowStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot-able state of a {@link ResearchWorkflowAggregate}.
 * <p>
 * Two states are equal when every field is equal, which is what replay
 * determinism is checked against.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResearchWorkflowState {

    private UUID id;
    private String name;
    private String query;
    private ResearchMethodology methodology;

    @Builder.Default
    private WorkflowStatus status = WorkflowStatus.CREATED;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant updatedAt;
    private ResearchResults results;
    private String errorMessage;

    @Builder.Default
    private List<TaskInfo> tasks = new ArrayList<>();

    /**
     * Returns a deep enough copy that mutating the copy never affects this state.
     */
    public ResearchWorkflowState copy() {
        return toBuilder().tasks(new ArrayList<>(tasks)).build();
    }
}
