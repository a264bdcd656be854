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
import org.fireflyframework.cqrs.model.ResearchMethodology;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Domain Event: A research workflow has been created.
 * <p>
 * Always the first event of a workflow stream (sequence number 1).
 */
@JsonTypeName("research.workflow.created")
@SuperBuilder
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowCreatedEvent extends AbstractDomainEvent {

    /**
     * Human-readable workflow name.
     */
    private String name;

    /**
     * The research question being investigated.
     */
    private String query;

    /**
     * The methodology the workflow follows.
     */
    private ResearchMethodology methodology;

    @Override
    public void validate() {
        requireText(name, "Workflow name");
        requireText(query, "Research query");
    }
}
