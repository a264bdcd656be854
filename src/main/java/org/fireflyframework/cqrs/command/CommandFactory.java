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


package org.fireflyframework.cqrs.command;

import org.fireflyframework.cqrs.model.ResearchMethodology;
import org.fireflyframework.cqrs.model.ResearchResults;

import java.util.Map;
import java.util.UUID;

/**
 * Builds commands with fresh command ids and a shared correlation id.
 */
public class CommandFactory {

    private final UUID correlationId;

    public CommandFactory() {
        this(UUID.randomUUID());
    }

    public CommandFactory(UUID correlationId) {
        this.correlationId = correlationId;
    }

    public static CommandFactory withCorrelationId(UUID correlationId) {
        return new CommandFactory(correlationId);
    }

    public UUID getCorrelationId() {
        return correlationId;
    }

    public CreateResearchWorkflowCommand createResearchWorkflow(String name, String query,
                                                                ResearchMethodology methodology) {
        return createResearchWorkflow(UUID.randomUUID(), name, query, methodology);
    }

    public CreateResearchWorkflowCommand createResearchWorkflow(UUID workflowId, String name, String query,
                                                                ResearchMethodology methodology) {
        return new CreateResearchWorkflowCommand(UUID.randomUUID(), workflowId, name, query, methodology,
                correlationId);
    }

    public StartWorkflowExecutionCommand startWorkflowExecution(UUID workflowId) {
        return new StartWorkflowExecutionCommand(UUID.randomUUID(), workflowId, correlationId);
    }

    public CreateTaskCommand createTask(UUID workflowId, String taskType, String agentType) {
        return createTask(workflowId, UUID.randomUUID(), taskType, agentType);
    }

    public CreateTaskCommand createTask(UUID workflowId, UUID taskId, String taskType, String agentType) {
        return new CreateTaskCommand(UUID.randomUUID(), workflowId, taskId, taskType, agentType, correlationId);
    }

    public CompleteTaskCommand completeTask(UUID workflowId, UUID taskId, Map<String, Object> results) {
        return new CompleteTaskCommand(UUID.randomUUID(), workflowId, taskId, results, correlationId);
    }

    public CompleteWorkflowCommand completeWorkflow(UUID workflowId, ResearchResults results) {
        return new CompleteWorkflowCommand(UUID.randomUUID(), workflowId, results, correlationId);
    }

    public FailWorkflowCommand failWorkflow(UUID workflowId, String error) {
        return new FailWorkflowCommand(UUID.randomUUID(), workflowId, error, correlationId);
    }

    public UpdateWorkflowCommand updateWorkflow(UUID workflowId, Map<String, Object> updates) {
        return new UpdateWorkflowCommand(UUID.randomUUID(), workflowId, updates, correlationId);
    }
}
