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


package org.fireflyframework.cqrs.eventsourcing.event;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.UUID;

/**
 * Domain Event: A task has been added to a running workflow.
 */
@JsonTypeName("research.task.created")
@SuperBuilder
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TaskCreatedEvent extends AbstractDomainEvent {

    /**
     * Unique identifier of the task within the workflow.
     */
    private UUID taskId;

    /**
     * Kind of work the task performs (e.g. "web-search").
     */
    private String taskType;

    /**
     * Agent type assigned to the task, may be null.
     */
    private String agentType;

    @Override
    public void validate() {
        requireText(taskType, "Task type");
    }
}
