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
import org.fireflyframework.cqrs.model.WorkflowStatus;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Storage for the denormalized research workflow views.
 * <p>
 * Only projections write to the store; query handlers read from it.
 */
public interface ReadModelStore {

    /**
     * Returns the workflow view, or empty when no such workflow was projected.
     */
    Mono<ResearchWorkflowReadModel> getWorkflow(UUID workflowId);

    /**
     * Returns one page of workflow summaries.
     *
     * @param page      1-based page number
     * @param pageSize  entries per page
     * @param status    only workflows in this status, or all when null
     * @param search    case-insensitive substring of name or query, or no filter when null
     * @param sortBy    {@code created_at}, {@code updated_at}, {@code name} or {@code status}
     * @param sortOrder {@code asc} or {@code desc}
     */
    Mono<WorkflowListReadModel> listWorkflows(int page, int pageSize, @Nullable WorkflowStatus status,
                                              @Nullable String search, String sortBy, String sortOrder);

    /**
     * Aggregates statistics over the workflows created within {@code [from, to]}.
     * Null bounds are open. {@code groupBy} is {@code day}, {@code week} or {@code month}.
     */
    Mono<WorkflowStatsReadModel> getWorkflowStats(@Nullable Instant from, @Nullable Instant to, String groupBy);

    /**
     * Returns the tasks of a workflow in creation order, or an empty list for an unknown workflow.
     */
    Mono<List<TaskReadModel>> getTasksByWorkflow(UUID workflowId, @Nullable TaskStatus status);

    /**
     * Full-text search over name and query, with optional exact-match filters
     * on {@code status} and {@code methodology}.
     */
    Mono<WorkflowListReadModel> searchWorkflows(String term, int page, int pageSize, Map<String, String> filters);

    Mono<Void> saveWorkflow(ResearchWorkflowReadModel workflow);

    /**
     * Atomically replaces the view of one workflow. The function receives null when
     * no view exists and may return null to leave the store untouched.
     *
     * @return the stored view after the update, or empty when nothing is stored
     */
    Mono<ResearchWorkflowReadModel> updateWorkflow(UUID workflowId,
                                                   UnaryOperator<ResearchWorkflowReadModel> update);

    Mono<Boolean> deleteWorkflow(UUID workflowId);

    /**
     * Removes every view. Used before a full projection rebuild.
     */
    Mono<Void> clear();

    Mono<ReadModelStats> getStats();

    Mono<Boolean> isHealthy();
}
