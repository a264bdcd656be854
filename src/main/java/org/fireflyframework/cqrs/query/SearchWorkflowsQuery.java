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
import org.fireflyframework.cqrs.readmodel.WorkflowListReadModel;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Full-text search over workflow names and queries.
 * Supported filters are {@code status} and {@code methodology}.
 */
public record SearchWorkflowsQuery(
        UUID queryId,
        String searchTerm,
        int page,
        int pageSize,
        Map<String, String> filters,
        UUID correlationId
) implements Query<WorkflowListReadModel> {

    public SearchWorkflowsQuery {
        filters = filters != null ? Map.copyOf(filters) : Map.of();
    }

    @Override
    public void validate() {
        if (searchTerm == null || searchTerm.isBlank()) {
            throw CqrsException.queryValidation("Search term cannot be empty");
        }
        GetWorkflowListQuery.requirePaging(page, pageSize);
    }

    @Override
    public String cacheKey() {
        String filterKey = new TreeMap<>(filters).entrySet().stream()
                .map(entry -> entry.getKey() + ":" + entry.getValue())
                .collect(Collectors.joining(","));
        return "search:" + searchTerm + ":" + page + ":" + pageSize + ":" + filterKey;
    }

    @Override
    public Duration cacheTtl() {
        return Duration.ofMinutes(2);
    }
}
