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


package org.fireflyframework.cqrs;

import org.fireflyframework.cqrs.eventsourcing.event.ExecutionStartedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.TaskCompletedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.TaskCreatedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.WorkflowCreatedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.WorkflowUpdatedEvent;
import org.fireflyframework.cqrs.model.ResearchMethodology;
import org.fireflyframework.cqrs.model.ResearchResults;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Shared domain objects for tests.
 */
public final class TestFixtures {

    public static final ResearchMethodology METHODOLOGY =
            new ResearchMethodology("systematic", List.of("collect", "analyze"), List.of("search-agent"), 30);

    public static final ResearchResults RESULTS =
            new ResearchResults("summary", List.of(), List.of(), 0.9, 12);

    private TestFixtures() {
    }

    public static WorkflowCreatedEvent created(UUID workflowId) {
        return created(workflowId, "Workflow " + workflowId.toString().substring(0, 8));
    }

    public static WorkflowCreatedEvent created(UUID workflowId, String name) {
        return WorkflowCreatedEvent.builder()
                .aggregateId(workflowId)
                .name(name)
                .query("query for " + name)
                .methodology(METHODOLOGY)
                .build();
    }

    public static ExecutionStartedEvent started(UUID workflowId) {
        return ExecutionStartedEvent.builder().aggregateId(workflowId).build();
    }

    public static TaskCreatedEvent taskCreated(UUID workflowId, UUID taskId) {
        return TaskCreatedEvent.builder()
                .aggregateId(workflowId)
                .taskId(taskId)
                .taskType("search")
                .agentType("search-agent")
                .build();
    }

    public static TaskCompletedEvent taskCompleted(UUID workflowId, UUID taskId) {
        return TaskCompletedEvent.builder()
                .aggregateId(workflowId)
                .taskId(taskId)
                .results(Map.of("hits", 3))
                .build();
    }

    public static WorkflowUpdatedEvent renamed(UUID workflowId, String name) {
        return WorkflowUpdatedEvent.builder()
                .aggregateId(workflowId)
                .updates(Map.of("name", name))
                .build();
    }
}
