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

import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.model.WorkflowStatus;
import org.fireflyframework.cqrs.readmodel.WorkflowListReadModel;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * One page of workflow summaries, optionally filtered by status and a search term.
 * A null {@code sortBy} means {@code created_at}; a null {@code sortOrder} means {@code desc}.
 */
public record GetWorkflowListQuery(
        UUID queryId,
        int page,
        int pageSize,
        WorkflowStatus status,
        String search,
        String sortBy,
        String sortOrder,
        UUID correlationId
) implements Query<WorkflowListReadModel> {

    public static final int MAX_PAGE_SIZE = 1000;
    static final Set<String> SORT_FIELDS = Set.of("created_at", "updated_at", "name", "status");

    public GetWorkflowListQuery {
        sortBy = sortBy != null ? sortBy.toLowerCase(Locale.ROOT) : "created_at";
        sortOrder = sortOrder != null ? sortOrder.toLowerCase(Locale.ROOT) : "desc";
    }

    @Override
    public void validate() {
        requirePaging(page, pageSize);
        if (!SORT_FIELDS.contains(sortBy)) {
            throw CqrsException.queryValidation("Unsupported sort field: " + sortBy);
        }
        if (!sortOrder.equals("asc") && !sortOrder.equals("desc")) {
            throw CqrsException.queryValidation("Sort order must be asc or desc: " + sortOrder);
        }
    }

    @Override
    public String cacheKey() {
        return "workflow_list:" + page + ":" + pageSize
                + ":" + (status != null ? status.name().toLowerCase(Locale.ROOT) : "all")
                + ":" + (search != null ? search : "")
                + ":" + sortBy + ":" + sortOrder;
    }

    @Override
    public Duration cacheTtl() {
        return Duration.ofSeconds(60);
    }

    static void requirePaging(int page, int pageSize) {
        if (page < 1) {
            throw CqrsException.queryValidation("Page must be >= 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw CqrsException.queryValidation("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
    }
}
