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


package org.fireflyframework.cqrs.projection;

import org.fireflyframework.cqrs.eventsourcing.event.AbstractDomainEvent;
import org.fireflyframework.cqrs.eventsourcing.event.ExecutionCompletedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.ExecutionFailedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.ExecutionStartedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.TaskCompletedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.TaskCreatedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.WorkflowCreatedEvent;
import org.fireflyframework.cqrs.eventsourcing.event.WorkflowUpdatedEvent;
import org.fireflyframework.cqrs.eventsourcing.store.StoredEvent;
import org.fireflyframework.cqrs.model.TaskStatus;
import org.fireflyframework.cqrs.model.WorkflowStatus;
import org.fireflyframework.cqrs.readmodel.ReadModelStore;
import org.fireflyframework.cqrs.readmodel.ResearchWorkflowReadModel;
import org.fireflyframework.cqrs.readmodel.TaskReadModel;
import org.fireflyframework.cqrs.readmodel.WorkflowProgress;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maintains {@link ResearchWorkflowReadModel}s from research workflow events.
 * <p>
 * Each view records the sequence number of the last event folded into it, so
 * redelivered or replayed events at or below that number are skipped.
 */
@Slf4j
public class ResearchWorkflowProjection implements Projection {

    public static final String NAME = "research-workflow";

    private static final Set<String> EVENT_TYPES = Set.of(
            AbstractDomainEvent.eventTypeOf(WorkflowCreatedEvent.class),
            AbstractDomainEvent.eventTypeOf(ExecutionStartedEvent.class),
            AbstractDomainEvent.eventTypeOf(TaskCreatedEvent.class),
            AbstractDomainEvent.eventTypeOf(TaskCompletedEvent.class),
            AbstractDomainEvent.eventTypeOf(ExecutionCompletedEvent.class),
            AbstractDomainEvent.eventTypeOf(ExecutionFailedEvent.class),
            AbstractDomainEvent.eventTypeOf(WorkflowUpdatedEvent.class));

    private final ReadModelStore readModelStore;

    public ResearchWorkflowProjection(ReadModelStore readModelStore) {
        this.readModelStore = readModelStore;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean handles(String eventType) {
        return EVENT_TYPES.contains(eventType);
    }

    @Override
    public Mono<Void> apply(StoredEvent stored) {
        return readModelStore.updateWorkflow(stored.streamId(), current -> fold(current, stored)).then();
    }

    @Override
    public Mono<Void> reset() {
        return readModelStore.clear();
    }

    /**
     * Returns the next view, or null to keep the current one.
     */
    ResearchWorkflowReadModel fold(ResearchWorkflowReadModel current, StoredEvent stored) {
        long sequence = stored.sequenceNumber();
        AbstractDomainEvent event = stored.event();

        if (current != null && sequence <= current.lastAppliedSequence()) {
            log.debug("Skipping already applied event {} #{} for workflow {}",
                    stored.eventType(), sequence, stored.streamId());
            return null;
        }
        if (event instanceof WorkflowCreatedEvent created) {
            return created(stored, created);
        }
        if (current == null) {
            log.debug("No view for workflow {}, skipping {} #{}", stored.streamId(), stored.eventType(), sequence);
            return null;
        }

        Instant at = event.getEventTimestamp();
        ResearchWorkflowReadModel.ResearchWorkflowReadModelBuilder next = current.toBuilder()
                .updatedAt(at)
                .lastAppliedSequence(sequence);

        if (event instanceof ExecutionStartedEvent) {
            next.status(WorkflowStatus.RUNNING).startedAt(at);
        } else if (event instanceof TaskCreatedEvent taskCreated) {
            next.tasks(withTask(current, taskCreated, at));
        } else if (event instanceof TaskCompletedEvent taskCompleted) {
            next.tasks(withCompletedTask(current, taskCompleted, at));
        } else if (event instanceof ExecutionCompletedEvent completed) {
            next.status(WorkflowStatus.COMPLETED).completedAt(at).results(completed.getResults());
        } else if (event instanceof ExecutionFailedEvent failed) {
            next.status(WorkflowStatus.FAILED).completedAt(at).errorMessage(failed.getError());
        } else if (event instanceof WorkflowUpdatedEvent updated && updated.getUpdates() != null
                && updated.getUpdates().get("name") instanceof String name) {
            next.name(name);
        }

        ResearchWorkflowReadModel view = next.build();
        return view.toBuilder()
                .progress(WorkflowProgress.of(view.tasks(), view.startedAt(), view.completedAt()))
                .build();
    }

    private static ResearchWorkflowReadModel created(StoredEvent stored, WorkflowCreatedEvent event) {
        Instant at = event.getEventTimestamp();
        return ResearchWorkflowReadModel.builder()
                .id(stored.streamId())
                .name(event.getName())
                .query(event.getQuery())
                .methodology(event.getMethodology())
                .status(WorkflowStatus.CREATED)
                .createdAt(at)
                .updatedAt(at)
                .tasks(List.of())
                .progress(WorkflowProgress.EMPTY)
                .lastAppliedSequence(stored.sequenceNumber())
                .build();
    }

    private static List<TaskReadModel> withTask(ResearchWorkflowReadModel current, TaskCreatedEvent event,
                                                 Instant at) {
        if (current.tasks().stream().anyMatch(task -> task.id().equals(event.getTaskId()))) {
            return current.tasks();
        }
        List<TaskReadModel> tasks = new ArrayList<>(current.tasks());
        tasks.add(TaskReadModel.builder()
                .id(event.getTaskId())
                .workflowId(current.id())
                .taskType(event.getTaskType())
                .agentType(event.getAgentType())
                .status(TaskStatus.CREATED)
                .createdAt(at)
                .build());
        return tasks;
    }

    private static List<TaskReadModel> withCompletedTask(ResearchWorkflowReadModel current,
                                                         TaskCompletedEvent event, Instant at) {
        return current.tasks().stream()
                .map(task -> task.id().equals(event.getTaskId()) ? task.complete(event.getResults(), at) : task)
                .toList();
    }
}
