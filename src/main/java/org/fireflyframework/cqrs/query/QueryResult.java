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

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a query execution.
 *
 * @param fromCache {@code true} when the result was served from the query cache
 */
public record QueryResult<R>(
        UUID queryId,
        R result,
        Instant executedAt,
        long executionTimeMs,
        boolean fromCache
) {

    public static <R> QueryResult<R> fresh(UUID queryId, R result, long executionTimeMs) {
        return new QueryResult<>(queryId, result, Instant.now(), executionTimeMs, false);
    }

    public static <R> QueryResult<R> cached(UUID queryId, R result, long executionTimeMs) {
        return new QueryResult<>(queryId, result, Instant.now(), executionTimeMs, true);
    }
}
