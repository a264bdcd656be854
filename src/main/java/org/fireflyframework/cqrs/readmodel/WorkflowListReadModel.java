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

import java.util.List;

/**
 * A page of workflow summaries. Pages are numbered from 1.
 */
public record WorkflowListReadModel(
        List<WorkflowSummary> workflows,
        long totalCount,
        int page,
        int pageSize,
        int totalPages,
        boolean hasNextPage,
        boolean hasPreviousPage
) {

    public WorkflowListReadModel {
        workflows = workflows != null ? List.copyOf(workflows) : List.of();
    }

    /**
     * Cuts one page out of an already filtered and sorted list.
     */
    public static WorkflowListReadModel page(List<WorkflowSummary> all, int page, int pageSize) {
        int totalPages = (int) Math.ceil(all.size() / (double) pageSize);
        int from = Math.min((page - 1) * pageSize, all.size());
        int to = Math.min(from + pageSize, all.size());
        return new WorkflowListReadModel(all.subList(from, to), all.size(), page, pageSize, totalPages,
                page < totalPages, page > 1);
    }
}
