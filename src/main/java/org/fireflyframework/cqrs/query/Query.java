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

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.UUID;

/**
 * A read-only request answered from the read models.
 *
 * @param <R> the result type
 */
public interface Query<R> {

    Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    UUID queryId();

    @Nullable
    UUID correlationId();

    /**
     * Checks the query's parameters before dispatch.
     *
     * @throws org.fireflyframework.cqrs.exception.CqrsException of type QUERY_VALIDATION
     */
    default void validate() {
        // no rules by default
    }

    default String queryName() {
        String name = getClass().getSimpleName();
        return name.endsWith("Query") ? name.substring(0, name.length() - "Query".length()) : name;
    }

    default boolean isCacheable() {
        return true;
    }

    /**
     * A key derived only from the query's parameters. Two queries with equal
     * parameters must produce equal keys.
     */
    String cacheKey();

    default Duration cacheTtl() {
        return DEFAULT_CACHE_TTL;
    }
}
