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

import org.fireflyframework.cqrs.eventsourcing.event.AbstractDomainEvent;
import org.fireflyframework.cqrs.eventsourcing.event.ExecutionStartedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.TaskCompletedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.TaskCreatedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.WorkflowCreatedEvent;
import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.exception.ErrorType;
import org.fireflyframework.cqrs.model.ResearchMethodology;
import org.fireflyframework.cqrs.model.ResearchResults;
import org.fireflyframework.cqrs.model.TaskStatus;
import org.fireflyframework.cqrs.model.WorkflowStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ResearchWorkflowAggregate} command methods and event folding.
 */
class ResearchWorkflowAggregateTest {

    private static final ResearchMethodology METHODOLOGY =
            new ResearchMethodology("systematic", List.of("collect", "analyze"), List.of("search-agent"), 30);
    private static final ResearchResults RESULTS =
            new ResearchResults("summary", List.of(), List.of(), 0.9, 12);

    private UUID workflowId;
    private ResearchWorkflowAggregate aggregate;

    @BeforeEach
    void setUp() {
        workflowId = UUID.randomUUID();
        aggregate = ResearchWorkflowAggregate.create(workflowId, "AI safety", "What is alignment?", METHODOLOGY);
    }

    private static void assertErrorType(Runnable action, ErrorType expected) {
        assertThatThrownBy(action::run)
                .isInstanceOf(CqrsException.class)
                .satisfies(e -> assertThat(((CqrsException) e).getErrorType()).isEqualTo(expected));
    }

    // ========================================================================
    // Creation Tests
    // ========================================================================

    @Nested
    @DisplayName("Creation")
    class CreationTests {

        @Test
        @DisplayName("create should record one created event at version 1")
        void createShouldRecordOneCreatedEvent() {
            assertThat(aggregate.getVersion()).isEqualTo(1);
            assertThat(aggregate.getStatus()).isEqualTo(WorkflowStatus.CREATED);
            assertThat(aggregate.getUncommittedEvents()).hasSize(1);
            assertThat(aggregate.getUncommittedEvents().get(0)).isInstanceOf(WorkflowCreatedEvent.class);
            assertThat(aggregate.getUncommittedEvents().get(0).getEventType())
                    .isEqualTo("research.workflow.created");
        }

        @Test
        @DisplayName("create should populate state from the event")
        void createShouldPopulateState() {
            ResearchWorkflowState state = aggregate.getState();

            assertThat(state.getId()).isEqualTo(workflowId);
            assertThat(state.getName()).isEqualTo("AI safety");
            assertThat(state.getQuery()).isEqualTo("What is alignment?");
            assertThat(state.getMethodology()).isEqualTo(METHODOLOGY);
            assertThat(state.getCreatedAt()).isNotNull();
            assertThat(state.getTasks()).isEmpty();
        }

        @Test
        @DisplayName("create should reject a blank name")
        void createShouldRejectBlankName() {
            assertErrorType(() -> ResearchWorkflowAggregate.create(UUID.randomUUID(), " ", "q", METHODOLOGY),
                    ErrorType.VALIDATION);
        }

        @Test
        @DisplayName("create should reject a blank query")
        void createShouldRejectBlankQuery() {
            assertErrorType(() -> ResearchWorkflowAggregate.create(UUID.randomUUID(), "n", "", METHODOLOGY),
                    ErrorType.VALIDATION);
        }

        @Test
        @DisplayName("create should carry the correlation id on the event")
        void createShouldCarryCorrelationId() {
            UUID correlationId = UUID.randomUUID();
            ResearchWorkflowAggregate correlated =
                    ResearchWorkflowAggregate.create(UUID.randomUUID(), "n", "q", METHODOLOGY, correlationId);

            assertThat(correlated.getUncommittedEvents().get(0).getCorrelationId()).isEqualTo(correlationId);
        }
    }

    // ========================================================================
    // Lifecycle Tests
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("startExecution should move to RUNNING at version 2")
        void startExecutionShouldMoveToRunning() {
            aggregate.markEventsAsCommitted();

            aggregate.startExecution();

            assertThat(aggregate.getVersion()).isEqualTo(2);
            assertThat(aggregate.getStatus()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(aggregate.getState().getStartedAt()).isNotNull();
            assertThat(aggregate.getUncommittedEvents()).singleElement().isInstanceOf(ExecutionStartedEvent.class);
        }

        @Test
        @DisplayName("startExecution should be rejected when already running")
        void startExecutionShouldBeRejectedWhenRunning() {
            aggregate.startExecution();

            assertErrorType(aggregate::startExecution, ErrorType.CONFLICT);
            assertThat(aggregate.getVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("createTask and completeTask should track the task through its lifecycle")
        void taskLifecycleShouldBeTracked() {
            UUID taskId = UUID.randomUUID();
            aggregate.startExecution();

            aggregate.createTask(taskId, "search", "search-agent");
            assertThat(aggregate.getTask(taskId)).get()
                    .extracting(TaskInfo::status).isEqualTo(TaskStatus.CREATED);

            aggregate.completeTask(taskId, Map.of("hits", 3));

            assertThat(aggregate.getVersion()).isEqualTo(4);
            TaskInfo task = aggregate.getTask(taskId).orElseThrow();
            assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(task.results()).containsEntry("hits", 3);
            assertThat(task.completedAt()).isNotNull();
            assertThat(aggregate.areAllTasksCompleted()).isTrue();
            assertThat(aggregate.getUncommittedEvents())
                    .extracting(AbstractDomainEvent::getClass)
                    .containsExactly(WorkflowCreatedEvent.class, ExecutionStartedEvent.class,
                            TaskCreatedEvent.class, TaskCompletedEvent.class);
        }

        @Test
        @DisplayName("createTask should be rejected before execution starts")
        void createTaskShouldBeRejectedBeforeStart() {
            assertErrorType(() -> aggregate.createTask(UUID.randomUUID(), "search", "agent"), ErrorType.CONFLICT);
            assertThat(aggregate.getVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("createTask should reject duplicate task ids")
        void createTaskShouldRejectDuplicates() {
            UUID taskId = UUID.randomUUID();
            aggregate.startExecution();
            aggregate.createTask(taskId, "search", "agent");

            assertErrorType(() -> aggregate.createTask(taskId, "search", "agent"), ErrorType.CONFLICT);
        }

        @Test
        @DisplayName("completeTask should report an unknown task as not found")
        void completeTaskShouldReportUnknownTask() {
            aggregate.startExecution();

            assertErrorType(() -> aggregate.completeTask(UUID.randomUUID(), Map.of()), ErrorType.NOT_FOUND);
        }

        @Test
        @DisplayName("completeTask should reject a task completed twice")
        void completeTaskShouldRejectSecondCompletion() {
            UUID taskId = UUID.randomUUID();
            aggregate.startExecution();
            aggregate.createTask(taskId, "search", "agent");
            aggregate.completeTask(taskId, Map.of());

            assertErrorType(() -> aggregate.completeTask(taskId, Map.of()), ErrorType.CONFLICT);
        }

        @Test
        @DisplayName("completeExecution should store results and completion time")
        void completeExecutionShouldStoreResults() {
            aggregate.startExecution();

            aggregate.completeExecution(RESULTS);

            assertThat(aggregate.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(aggregate.getState().getResults()).isEqualTo(RESULTS);
            assertThat(aggregate.getState().getCompletedAt()).isNotNull();
            aggregate.validate();
        }

        @Test
        @DisplayName("completeExecution should require RUNNING status")
        void completeExecutionShouldRequireRunning() {
            assertErrorType(() -> aggregate.completeExecution(RESULTS), ErrorType.CONFLICT);
        }

        @Test
        @DisplayName("completeExecution should reject null results")
        void completeExecutionShouldRejectNullResults() {
            aggregate.startExecution();

            assertErrorType(() -> aggregate.completeExecution(null), ErrorType.VALIDATION);
        }

        @Test
        @DisplayName("failExecution should be allowed from CREATED and rejected once terminal")
        void failExecutionShouldRespectTerminalStates() {
            aggregate.failExecution("agent crashed");

            assertThat(aggregate.getStatus()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(aggregate.getState().getErrorMessage()).isEqualTo("agent crashed");
            assertErrorType(() -> aggregate.failExecution("again"), ErrorType.CONFLICT);
        }

        @Test
        @DisplayName("updateWorkflow should rename the workflow")
        void updateWorkflowShouldRename() {
            aggregate.updateWorkflow(Map.of("name", "Renamed"));

            assertThat(aggregate.getName()).isEqualTo("Renamed");
            assertThat(aggregate.getVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("updateWorkflow should reject empty updates and blank names")
        void updateWorkflowShouldRejectInvalidUpdates() {
            assertErrorType(() -> aggregate.updateWorkflow(Map.of()), ErrorType.VALIDATION);
            assertErrorType(() -> aggregate.updateWorkflow(Map.of("name", "")), ErrorType.VALIDATION);
        }
    }

    // ========================================================================
    // Replay Tests
    // ========================================================================

    @Nested
    @DisplayName("Replay")
    class ReplayTests {

        @Test
        @DisplayName("loadFromHistory should rebuild identical state")
        void loadFromHistoryShouldRebuildIdenticalState() {
            UUID taskId = UUID.randomUUID();
            aggregate.startExecution();
            aggregate.createTask(taskId, "search", "agent");
            aggregate.completeTask(taskId, Map.of("k", "v"));
            aggregate.completeExecution(RESULTS);

            ResearchWorkflowAggregate replayed = new ResearchWorkflowAggregate(workflowId);
            replayed.loadFromHistory(aggregate.getUncommittedEvents());

            assertThat(replayed.getVersion()).isEqualTo(aggregate.getVersion());
            assertThat(replayed.getState()).isEqualTo(aggregate.getState());
            assertThat(replayed.hasUncommittedEvents()).isFalse();
        }

        @Test
        @DisplayName("restoreFromSnapshot should seed state and version without pending events")
        void restoreFromSnapshotShouldSeedState() {
            aggregate.startExecution();
            ResearchWorkflowState snapshot = aggregate.getState();

            ResearchWorkflowAggregate restored = new ResearchWorkflowAggregate(workflowId);
            restored.restoreFromSnapshot(snapshot, 2);

            assertThat(restored.getVersion()).isEqualTo(2);
            assertThat(restored.getStatus()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(restored.getUncommittedEventCount()).isZero();
        }

        @Test
        @DisplayName("getState should return a defensive copy")
        void getStateShouldReturnCopy() {
            aggregate.getState().setName("mutated");

            assertThat(aggregate.getName()).isEqualTo("AI safety");
        }
    }
}
