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


package org.fireflyframework.cqrs.query;

import org.fireflyframework.cqrs.model.TaskStatus;
import org.fireflyframework.cqrs.model.WorkflowStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Builds queries with fresh query ids and a shared correlation id.
 */
public class QueryFactory {

    private final UUID correlationId;

    public QueryFactory() {
        this(UUID.randomUUID());
    }

    public QueryFactory(UUID correlationId) {
        this.correlationId = correlationId;
    }

    public static QueryFactory withCorrelationId(UUID correlationId) {
        return new QueryFactory(correlationId);
    }

    public UUID getCorrelationId() {
        return correlationId;
    }

    public GetResearchWorkflowQuery getResearchWorkflow(UUID workflowId) {
        return getResearchWorkflow(workflowId, true);
    }

    public GetResearchWorkflowQuery getResearchWorkflow(UUID workflowId, boolean includeTasks) {
        return new GetResearchWorkflowQuery(UUID.randomUUID(), workflowId, includeTasks, correlationId);
    }

    public GetWorkflowListQuery getWorkflowList(int page, int pageSize) {
        return getWorkflowList(page, pageSize, null, null, null, null);
    }

    public GetWorkflowListQuery getWorkflowList(int page, int pageSize, WorkflowStatus status, String search,
                                                String sortBy, String sortOrder) {
        return new GetWorkflowListQuery(UUID.randomUUID(), page, pageSize, status, search, sortBy, sortOrder,
                correlationId);
    }

    public GetWorkflowStatsQuery getWorkflowStats(Instant startDate, Instant endDate, String groupBy) {
        return new GetWorkflowStatsQuery(UUID.randomUUID(), startDate, endDate, groupBy, correlationId);
    }

    public GetTasksByWorkflowQuery getTasksByWorkflow(UUID workflowId, TaskStatus statusFilter) {
        return new GetTasksByWorkflowQuery(UUID.randomUUID(), workflowId, statusFilter, correlationId);
    }

    public SearchWorkflowsQuery searchWorkflows(String searchTerm, int page, int pageSize,
                                                Map<String, String> filters) {
        return new SearchWorkflowsQuery(UUID.randomUUID(), searchTerm, page, pageSize, filters, correlationId);
    }
}
