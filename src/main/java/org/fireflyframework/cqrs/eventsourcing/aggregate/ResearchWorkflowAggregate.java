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

import org.fireflyframework.cqrs.eventsourcing.event.ExecutionCompletedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.ExecutionFailedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.ExecutionStartedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.TaskCompletedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.TaskCreatedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.WorkflowCreatedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.WorkflowUpdatedEvent;
import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.model.ResearchMethodology;
import org.fireflyframework.cqrs.model.ResearchResults;
import org.fireflyframework.cqrs.model.TaskStatus;
import org.fireflyframework.cqrs.model.WorkflowStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Event-sourced aggregate representing a research workflow.
 * <p>
 * <b>Lifecycle:</b> CREATED -> RUNNING -> COMPLETED/FAILED
 * <p>
 * Every command method checks its precondition against the current state and
 * emits exactly one event. Event handlers only copy data from the event; they
 * read timestamps from the event, never from the clock, so replaying the same
 * events always yields an equal {@link ResearchWorkflowState}.
 *
 * @see AggregateRoot
 * @see WorkflowStatus
 */
@Slf4j
public class ResearchWorkflowAggregate extends AggregateRoot<ResearchWorkflowState> {

    public static final String AGGREGATE_TYPE = "research-workflow";

    private ResearchWorkflowState state;

    /**
     * Constructs an empty aggregate, ready to be created or loaded from history.
     *
     * @param id the workflow id, which is also the stream id
     */
    public ResearchWorkflowAggregate(UUID id) {
        super(id, AGGREGATE_TYPE);
        this.state = ResearchWorkflowState.builder().id(id).build();
    }

    // ========================================================================
    // Command Methods (validate state + applyChange)
    // ========================================================================

    /**
     * Creates a new workflow.
     *
     * @throws CqrsException of type VALIDATION if name or query is blank
     */
    public static ResearchWorkflowAggregate create(UUID id, String name, String query,
                                                   ResearchMethodology methodology) {
        return create(id, name, query, methodology, null);
    }

    /**
     * Creates a new workflow whose creation event carries the given correlation id.
     */
    public static ResearchWorkflowAggregate create(UUID id, String name, String query,
                                                   ResearchMethodology methodology, UUID correlationId) {
        requireText(name, "Workflow name");
        requireText(query, "Research query");

        ResearchWorkflowAggregate aggregate = new ResearchWorkflowAggregate(id);
        aggregate.applyChange(WorkflowCreatedEvent.builder()
                .aggregateId(id)
                .correlationId(correlationId)
                .name(name)
                .query(query)
                .methodology(methodology)
                .build());
        return aggregate;
    }

    /**
     * Starts execution. Only valid in CREATED status.
     */
    public void startExecution() {
        if (state.getStatus() != WorkflowStatus.CREATED) {
            throw CqrsException.conflict("Cannot start workflow " + getId() + ": current status is "
                    + state.getStatus() + ", expected CREATED");
        }

        applyChange(ExecutionStartedEvent.builder()
                .aggregateId(getId())
                .build());
    }

    /**
     * Creates a task. Only valid while RUNNING.
     */
    public void createTask(UUID taskId, String taskType, String agentType) {
        requireText(taskType, "Task type");
        if (taskId == null) {
            throw CqrsException.validation("Task id cannot be null");
        }
        if (state.getStatus() != WorkflowStatus.RUNNING) {
            throw CqrsException.conflict("Cannot create task on workflow " + getId()
                    + ": current status is " + state.getStatus() + ", expected RUNNING");
        }
        if (getTask(taskId).isPresent()) {
            throw CqrsException.conflict("Task " + taskId + " already exists on workflow " + getId());
        }

        applyChange(TaskCreatedEvent.builder()
                .aggregateId(getId())
                .taskId(taskId)
                .taskType(taskType)
                .agentType(agentType)
                .build());
    }

    /**
     * Completes a task that exists and is not yet completed.
     */
    public void completeTask(UUID taskId, Map<String, Object> results) {
        TaskInfo task = getTask(taskId)
                .orElseThrow(() -> CqrsException.notFound("Task " + taskId + " on workflow " + getId()));
        if (task.isCompleted()) {
            throw CqrsException.conflict("Task " + taskId + " is already completed");
        }

        applyChange(TaskCompletedEvent.builder()
                .aggregateId(getId())
                .taskId(taskId)
                .results(results != null ? new HashMap<>(results) : new HashMap<>())
                .build());
    }

    /**
     * Completes the workflow with its results. Only valid while RUNNING.
     */
    public void completeExecution(ResearchResults results) {
        if (results == null) {
            throw CqrsException.validation("Research results cannot be null");
        }
        if (state.getStatus() != WorkflowStatus.RUNNING) {
            throw CqrsException.conflict("Cannot complete workflow " + getId() + ": current status is "
                    + state.getStatus() + ", expected RUNNING");
        }

        applyChange(ExecutionCompletedEvent.builder()
                .aggregateId(getId())
                .results(results)
                .build());
    }

    /**
     * Marks the workflow as failed. Rejected once the workflow is terminal.
     */
    public void failExecution(String error) {
        requireText(error, "Error message");
        if (state.getStatus().isTerminal()) {
            throw CqrsException.conflict("Cannot fail workflow " + getId() + ": current status is "
                    + state.getStatus() + " (terminal)");
        }

        applyChange(ExecutionFailedEvent.builder()
                .aggregateId(getId())
                .error(error)
                .build());
    }

    /**
     * Updates workflow metadata. The {@code name} key renames the workflow.
     */
    public void updateWorkflow(Map<String, Object> updates) {
        if (updates == null || updates.isEmpty()) {
            throw CqrsException.validation("Updates cannot be empty");
        }
        if (state.getStatus().isTerminal()) {
            throw CqrsException.conflict("Cannot update workflow " + getId() + ": current status is "
                    + state.getStatus() + " (terminal)");
        }
        if (updates.containsKey("name") && !(updates.get("name") instanceof String name && !name.isBlank())) {
            throw CqrsException.validation("Workflow name cannot be empty");
        }

        applyChange(WorkflowUpdatedEvent.builder()
                .aggregateId(getId())
                .updates(new HashMap<>(updates))
                .build());
    }

    // ========================================================================
    // Event Handlers (private on() methods, pure state mutations)
    // ========================================================================

    @SuppressWarnings("unused")
    private void on(WorkflowCreatedEvent event) {
        state.setId(getId());
        state.setName(event.getName());
        state.setQuery(event.getQuery());
        state.setMethodology(event.getMethodology());
        state.setStatus(WorkflowStatus.CREATED);
        state.setCreatedAt(event.getEventTimestamp());
        state.setUpdatedAt(event.getEventTimestamp());
    }

    @SuppressWarnings("unused")
    private void on(ExecutionStartedEvent event) {
        state.setStatus(WorkflowStatus.RUNNING);
        state.setStartedAt(event.getEventTimestamp());
        state.setUpdatedAt(event.getEventTimestamp());
    }

    @SuppressWarnings("unused")
    private void on(TaskCreatedEvent event) {
        state.getTasks().add(TaskInfo.created(event.getTaskId(), event.getTaskType(), event.getAgentType(),
                event.getEventTimestamp()));
        state.setUpdatedAt(event.getEventTimestamp());
    }

    @SuppressWarnings("unused")
    private void on(TaskCompletedEvent event) {
        List<TaskInfo> tasks = state.getTasks();
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).taskId().equals(event.getTaskId())) {
                tasks.set(i, tasks.get(i).complete(event.getResults(), event.getEventTimestamp()));
            }
        }
        state.setUpdatedAt(event.getEventTimestamp());
    }

    @SuppressWarnings("unused")
    private void on(ExecutionCompletedEvent event) {
        state.setStatus(WorkflowStatus.COMPLETED);
        state.setResults(event.getResults());
        state.setCompletedAt(event.getEventTimestamp());
        state.setUpdatedAt(event.getEventTimestamp());
    }

    @SuppressWarnings("unused")
    private void on(ExecutionFailedEvent event) {
        state.setStatus(WorkflowStatus.FAILED);
        state.setErrorMessage(event.getError());
        state.setCompletedAt(event.getEventTimestamp());
        state.setUpdatedAt(event.getEventTimestamp());
    }

    @SuppressWarnings("unused")
    private void on(WorkflowUpdatedEvent event) {
        Map<String, Object> updates = event.getUpdates();
        if (updates != null && updates.get("name") instanceof String name) {
            state.setName(name);
        }
        state.setUpdatedAt(event.getEventTimestamp());
    }

    // ========================================================================
    // State access and validation
    // ========================================================================

    @Override
    public ResearchWorkflowState getState() {
        return state.copy();
    }

    @Override
    protected void restoreState(ResearchWorkflowState restored) {
        ResearchWorkflowState copy = restored.copy();
        copy.setId(getId());
        this.state = copy;
    }

    @Override
    public void validate() {
        if (isBlank(state.getName())) {
            throw CqrsException.validation("Workflow name cannot be empty");
        }
        if (isBlank(state.getQuery())) {
            throw CqrsException.validation("Research query cannot be empty");
        }
        switch (state.getStatus()) {
            case RUNNING -> {
                if (state.getStartedAt() == null) {
                    throw CqrsException.validation("Running workflow must have startedAt");
                }
            }
            case COMPLETED -> {
                if (state.getCompletedAt() == null) {
                    throw CqrsException.validation("Completed workflow must have completedAt");
                }
                if (state.getResults() == null) {
                    throw CqrsException.validation("Completed workflow must have results");
                }
            }
            case FAILED -> {
                if (state.getErrorMessage() == null) {
                    throw CqrsException.validation("Failed workflow must have an error message");
                }
            }
            default -> {
                // no extra invariants
            }
        }
    }

    public WorkflowStatus getStatus() {
        return state.getStatus();
    }

    public String getName() {
        return state.getName();
    }

    public boolean areAllTasksCompleted() {
        return !state.getTasks().isEmpty() && state.getTasks().stream().allMatch(TaskInfo::isCompleted);
    }

    public Optional<TaskInfo> getTask(UUID taskId) {
        return state.getTasks().stream()
                .filter(task -> task.taskId().equals(taskId))
                .findFirst();
    }

    public List<TaskInfo> getTasksByStatus(TaskStatus status) {
        return state.getTasks().stream()
                .filter(task -> task.status() == status)
                .toList();
    }

    public List<TaskInfo> getTasks() {
        return List.copyOf(state.getTasks());
    }

    private static void requireText(String value, String field) {
        if (isBlank(value)) {
            throw CqrsException.validation(field + " cannot be empty");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
