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
import org.fireflyframework.cqrs.exception.ErrorContext;
import org.fireflyframework.cqrs.metrics.CqrsMetrics;
import org.fireflyframework.cqrs.resilience.CqrsResilience;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes each query to the single handler registered for its class, serving
 * cacheable queries from the {@link QueryCache} when a live entry exists.
 * <p>
 * Failures reach the caller as {@link CqrsException}s with an {@link ErrorContext}.
 * Failed results are never cached.
 */
@Slf4j
public class QueryBus {

    static final String COMPONENT = "query-bus";

    private final Map<Class<?>, QueryHandler<?, ?>> handlers = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final QueryCache cache;
    private final CqrsMetrics metrics;
    private final CqrsResilience resilience;

    public QueryBus(ObjectMapper objectMapper, Duration timeout, @Nullable QueryCache cache) {
        this(objectMapper, timeout, cache, null, null);
    }

    public QueryBus(ObjectMapper objectMapper, Duration timeout, @Nullable QueryCache cache,
                    @Nullable CqrsMetrics metrics, @Nullable CqrsResilience resilience) {
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.cache = cache;
        this.metrics = metrics;
        this.resilience = resilience;
    }

    // ==================== Registration ====================

    public <Q extends Query<R>, R> void register(QueryHandler<Q, R> handler) {
        Class<Q> queryType = handler.getQueryType();
        QueryHandler<?, ?> existing = handlers.putIfAbsent(queryType, handler);
        if (existing != null && existing != handler) {
            throw CqrsException.configuration("A handler is already registered for "
                    + queryType.getSimpleName() + ": " + existing.getClass().getSimpleName());
        }
        log.info("Registered query handler {} for {}", handler.getClass().getSimpleName(),
                queryType.getSimpleName());
    }

    public void registerAll(Collection<? extends QueryHandler<?, ?>> queryHandlers) {
        queryHandlers.forEach(this::registerUnchecked);
    }

    public boolean hasHandler(Class<?> queryType) {
        return handlers.containsKey(queryType);
    }

    public Set<Class<?>> getRegisteredQueryTypes() {
        return Set.copyOf(handlers.keySet());
    }

    public int getHandlerCount() {
        return handlers.size();
    }

    // ==================== Execution ====================

    /**
     * Validates a query and answers it from the cache or its handler.
     */
    public <R> Mono<QueryResult<R>> execute(Query<R> query) {
        String name = query.queryName();
        return Mono.defer(() -> {
            long start = System.nanoTime();
            query.validate();
            QueryHandler<Query<R>, R> handler = resolve(query);
            boolean useCache = cache != null && query.isCacheable();

            if (useCache) {
                JavaType resultType = objectMapper.getTypeFactory().constructType(handler.getResultType());
                Optional<R> cached = cache.get(query.cacheKey(), resultType);
                if (cached.isPresent()) {
                    log.debug("Query {} [{}] served from cache: {}", name, query.queryId(), query.cacheKey());
                    if (metrics != null) {
                        metrics.recordCacheHit(name);
                        metrics.recordQueryExecuted(name, elapsed(start), true);
                    }
                    return Mono.just(QueryResult.cached(query.queryId(), cached.get(), elapsed(start).toMillis()));
                }
                if (metrics != null) {
                    metrics.recordCacheMiss(name);
                }
            }

            Mono<R> dispatch = Mono.defer(() -> handler.handle(query));
            if (resilience != null) {
                dispatch = resilience.decorateQuery(name, dispatch);
            }
            return dispatch
                    .timeout(timeout, Mono.error(() -> CqrsException.queryTimeout(name + " exceeded " + timeout)))
                    .switchIfEmpty(Mono.error(() -> CqrsException.internal(name + " handler returned no result", null)))
                    .doOnNext(result -> {
                        if (useCache) {
                            store(query, result);
                        }
                    })
                    .map(result -> QueryResult.fresh(query.queryId(), result, elapsed(start).toMillis()))
                    .doOnNext(result -> {
                        log.debug("Query {} [{}] executed in {}ms", name, query.queryId(), result.executionTimeMs());
                        if (metrics != null) {
                            metrics.recordQueryExecuted(name, elapsed(start), false);
                        }
                    });
        })
                .onErrorMap(error -> withContext(error, query))
                .doOnError(CqrsException.class, error -> {
                    if (metrics != null) {
                        metrics.recordQueryFailed(name, error.getErrorType());
                    }
                });
    }

    /**
     * Executes a query and unwraps its result.
     */
    public <R> Mono<R> executeForResult(Query<R> query) {
        return execute(query).map(QueryResult::result);
    }

    // ==================== Cache ====================

    public void invalidate(Query<?> query) {
        if (cache != null) {
            cache.invalidate(query.cacheKey());
        }
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
            log.info("Query cache cleared");
        }
    }

    @Nullable
    public QueryCache getCache() {
        return cache;
    }

    // ==================== Helpers ====================

    @SuppressWarnings("unchecked")
    private <R> QueryHandler<Query<R>, R> resolve(Query<R> query) {
        QueryHandler<?, ?> handler = handlers.get(query.getClass());
        if (handler == null) {
            throw CqrsException.queryHandlerNotFound(query.queryName());
        }
        if (!handler.getQueryType().isInstance(query)) {
            throw CqrsException.handlerCast(handler.getClass().getSimpleName()
                    + " cannot handle " + query.getClass().getSimpleName());
        }
        return (QueryHandler<Query<R>, R>) handler;
    }

    private <R> void store(Query<R> query, R result) {
        Duration ttl = query.cacheTtl() != null ? query.cacheTtl() : Query.DEFAULT_CACHE_TTL;
        try {
            cache.put(query.cacheKey(), result, ttl);
        } catch (CqrsException e) {
            log.warn("Query {} [{}] result not cached: {}", query.queryName(), query.queryId(), e.getMessage());
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private void registerUnchecked(QueryHandler<?, ?> handler) {
        register((QueryHandler) handler);
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private CqrsException withContext(Throwable error, Query<?> query) {
        ErrorContext context = ErrorContext.of(query.queryName(), COMPONENT, query.correlationId());
        if (error instanceof CqrsException cqrs) {
            log.warn("Query {} [{}] failed: {}", query.queryName(), query.queryId(), cqrs.getMessage());
            return cqrs.withContext(context);
        }
        log.error("Unexpected error executing query {} [{}] ({})", query.queryName(), query.queryId(),
                context, error);
        return CqrsException.internal("Unexpected error executing " + query.queryName(), error)
                .withContext(context);
    }
}
