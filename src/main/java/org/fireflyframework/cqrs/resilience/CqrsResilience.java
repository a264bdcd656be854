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


package org.fireflyframework.cqrs.resilience;

import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.properties.CqrsProperties;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provides Resilience4j decorators for command and query dispatch.
 * <p>
 * Each command or query name gets its own circuit breaker, rate limiter and
 * bulkhead. Only retryable CQRS failures and unexpected errors count against a
 * circuit breaker; validation and business failures never open it.
 */
@Slf4j
public class CqrsResilience {

    private static final String COMMAND_PREFIX = "command:";
    private static final String QUERY_PREFIX = "query:";

    private final CqrsProperties.ResilienceConfig config;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final BulkheadRegistry bulkheadRegistry;

    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final Map<String, RateLimiter> rateLimiters = new ConcurrentHashMap<>();
    private final Map<String, Bulkhead> bulkheads = new ConcurrentHashMap<>();

    public CqrsResilience(CqrsProperties properties) {
        this.config = properties.getResilience();

        this.circuitBreakerRegistry = createCircuitBreakerRegistry();
        this.rateLimiterRegistry = createRateLimiterRegistry();
        this.bulkheadRegistry = createBulkheadRegistry();

        log.info("RESILIENCE_INIT: circuitBreaker={}, rateLimiter={}, bulkhead={}",
                isCircuitBreakerEnabled(), isRateLimiterEnabled(), isBulkheadEnabled());
    }

    public <T> Mono<T> decorateCommand(String commandName, Mono<T> mono) {
        return decorate(COMMAND_PREFIX + commandName, mono);
    }

    public <T> Mono<T> decorateQuery(String queryName, Mono<T> mono) {
        return decorate(QUERY_PREFIX + queryName, mono);
    }

    /**
     * Decorates a Mono with all enabled resilience patterns. Rejections are
     * translated into RATE_LIMIT_EXCEEDED or SERVICE_UNAVAILABLE failures.
     */
    public <T> Mono<T> decorate(String name, Mono<T> mono) {
        if (!config.isEnabled()) {
            return mono;
        }

        Mono<T> decorated = mono;

        // Apply bulkhead (innermost)
        if (isBulkheadEnabled()) {
            decorated = decorated.transformDeferred(BulkheadOperator.of(getOrCreateBulkhead(name)));
        }

        // Apply rate limiter
        if (isRateLimiterEnabled()) {
            decorated = decorated.transformDeferred(RateLimiterOperator.of(getOrCreateRateLimiter(name)));
        }

        // Apply circuit breaker (outermost)
        if (isCircuitBreakerEnabled()) {
            decorated = decorated.transformDeferred(CircuitBreakerOperator.of(getOrCreateCircuitBreaker(name)));
        }

        return decorated.onErrorMap(CqrsResilience::isRejection, error -> translate(name, error));
    }

    /**
     * Gets or creates a circuit breaker for the given name.
     */
    public CircuitBreaker getOrCreateCircuitBreaker(String name) {
        return circuitBreakers.computeIfAbsent(name, n -> {
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(n);
            cb.getEventPublisher()
                    .onStateTransition(event ->
                            log.info("CIRCUIT_BREAKER_STATE: name={}, from={}, to={}",
                                    event.getCircuitBreakerName(),
                                    event.getStateTransition().getFromState(),
                                    event.getStateTransition().getToState()))
                    .onError(event ->
                            log.warn("CIRCUIT_BREAKER_ERROR: name={}, error={}",
                                    event.getCircuitBreakerName(),
                                    event.getThrowable().getMessage()));
            return cb;
        });
    }

    /**
     * Gets or creates a rate limiter for the given name.
     */
    public RateLimiter getOrCreateRateLimiter(String name) {
        return rateLimiters.computeIfAbsent(name, n -> {
            RateLimiter rl = rateLimiterRegistry.rateLimiter(n);
            rl.getEventPublisher()
                    .onFailure(event ->
                            log.warn("RATE_LIMITER_REJECTED: name={}", event.getRateLimiterName()));
            return rl;
        });
    }

    /**
     * Gets or creates a bulkhead for the given name.
     */
    public Bulkhead getOrCreateBulkhead(String name) {
        return bulkheads.computeIfAbsent(name, n -> {
            Bulkhead bh = bulkheadRegistry.bulkhead(n);
            bh.getEventPublisher()
                    .onCallRejected(event ->
                            log.warn("BULKHEAD_REJECTED: name={}", event.getBulkheadName()));
            return bh;
        });
    }

    /**
     * Gets the circuit breaker state for a command, or null if it never ran.
     */
    public CircuitBreaker.State getCommandCircuitBreakerState(String commandName) {
        CircuitBreaker cb = circuitBreakers.get(COMMAND_PREFIX + commandName);
        return cb != null ? cb.getState() : null;
    }

    /**
     * Resets the circuit breaker with the given name.
     */
    public void resetCircuitBreaker(String name) {
        CircuitBreaker cb = circuitBreakers.get(name);
        if (cb != null) {
            cb.reset();
            log.info("CIRCUIT_BREAKER_RESET: name={}", name);
        }
    }

    /**
     * Gets circuit breaker metrics, or null if no breaker exists for the name.
     */
    public CircuitBreakerMetrics getCircuitBreakerMetrics(String name) {
        CircuitBreaker cb = circuitBreakers.get(name);
        if (cb == null) {
            return null;
        }
        CircuitBreaker.Metrics metrics = cb.getMetrics();
        return new CircuitBreakerMetrics(
                cb.getState(),
                metrics.getFailureRate(),
                metrics.getNumberOfSuccessfulCalls(),
                metrics.getNumberOfFailedCalls(),
                metrics.getNumberOfNotPermittedCalls()
        );
    }

    /**
     * Gets all circuit breaker states.
     */
    public Map<String, CircuitBreaker.State> getAllCircuitBreakerStates() {
        Map<String, CircuitBreaker.State> states = new ConcurrentHashMap<>();
        circuitBreakers.forEach((name, cb) -> states.put(name, cb.getState()));
        return states;
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    public CircuitBreakerRegistry getCircuitBreakerRegistry() {
        return circuitBreakerRegistry;
    }

    public RateLimiterRegistry getRateLimiterRegistry() {
        return rateLimiterRegistry;
    }

    public BulkheadRegistry getBulkheadRegistry() {
        return bulkheadRegistry;
    }

    public boolean isCircuitBreakerEnabled() {
        return config.isEnabled() && config.getCircuitBreaker().isEnabled();
    }

    public boolean isRateLimiterEnabled() {
        return config.isEnabled() && config.getRateLimiter().isEnabled();
    }

    public boolean isBulkheadEnabled() {
        return config.isEnabled() && config.getBulkhead().isEnabled();
    }

    /**
     * Returns {@code true} for failures that should count against a circuit breaker.
     */
    static boolean isRecordedFailure(Throwable error) {
        if (error instanceof CqrsException cqrs) {
            return cqrs.isRetryable();
        }
        return true;
    }

    private static boolean isRejection(Throwable error) {
        return error instanceof CallNotPermittedException
                || error instanceof RequestNotPermitted
                || error instanceof BulkheadFullException;
    }

    private static CqrsException translate(String name, Throwable error) {
        if (error instanceof RequestNotPermitted) {
            return CqrsException.rateLimitExceeded(name, error);
        }
        return CqrsException.serviceUnavailable(name + ": " + error.getMessage(), error);
    }

    // ==================== Registry Creation ====================

    private CircuitBreakerRegistry createCircuitBreakerRegistry() {
        var cbConfig = config.getCircuitBreaker();

        CircuitBreakerConfig defaultConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(cbConfig.getFailureRateThreshold())
                .permittedNumberOfCallsInHalfOpenState(cbConfig.getPermittedNumberOfCallsInHalfOpenState())
                .minimumNumberOfCalls(cbConfig.getMinimumNumberOfCalls())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(cbConfig.getSlidingWindowSize())
                .waitDurationInOpenState(cbConfig.getWaitDurationInOpenState())
                .recordException(CqrsResilience::isRecordedFailure)
                .build();

        return CircuitBreakerRegistry.of(defaultConfig);
    }

    private RateLimiterRegistry createRateLimiterRegistry() {
        var rlConfig = config.getRateLimiter();

        RateLimiterConfig defaultConfig = RateLimiterConfig.custom()
                .limitForPeriod(rlConfig.getLimitForPeriod())
                .limitRefreshPeriod(rlConfig.getLimitRefreshPeriod())
                .timeoutDuration(rlConfig.getTimeoutDuration())
                .build();

        return RateLimiterRegistry.of(defaultConfig);
    }

    private BulkheadRegistry createBulkheadRegistry() {
        var bhConfig = config.getBulkhead();

        BulkheadConfig defaultConfig = BulkheadConfig.custom()
                .maxConcurrentCalls(bhConfig.getMaxConcurrentCalls())
                .maxWaitDuration(bhConfig.getMaxWaitDuration())
                .build();

        return BulkheadRegistry.of(defaultConfig);
    }

    // ==================== Metrics Record ====================

    /**
     * Circuit breaker metrics snapshot.
     */
    public record CircuitBreakerMetrics(
            CircuitBreaker.State state,
            float failureRate,
            int successfulCalls,
            int failedCalls,
            long notPermittedCalls
    ) {}
}
