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
import org.fireflyframework.cqrs.readmodel.WorkflowStatsReadModel;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Statistics over the workflows created between {@code startDate} and {@code endDate}.
 * Null bounds are open; a null {@code groupBy} means {@code day}.
 */
public record GetWorkflowStatsQuery(
        UUID queryId,
        Instant startDate,
        Instant endDate,
        String groupBy,
        UUID correlationId
) implements Query<WorkflowStatsReadModel> {

    static final Set<String> GROUPINGS = Set.of("day", "week", "month");

    public GetWorkflowStatsQuery {
        groupBy = groupBy != null ? groupBy.toLowerCase(Locale.ROOT) : "day";
    }

    @Override
    public void validate() {
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw CqrsException.queryValidation("Start date must not be after end date");
        }
        if (!GROUPINGS.contains(groupBy)) {
            throw CqrsException.queryValidation("Unsupported grouping: " + groupBy);
        }
    }

    @Override
    public String cacheKey() {
        return "workflow_stats:" + (startDate != null ? startDate.getEpochSecond() : 0)
                + ":" + (endDate != null ? endDate.getEpochSecond() : 0)
                + ":" + groupBy;
    }

    @Override
    public Duration cacheTtl() {
        return Duration.ofMinutes(10);
    }
}
