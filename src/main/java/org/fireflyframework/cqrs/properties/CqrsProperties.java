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


package org.fireflyframework.cqrs.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the CQRS core.
 */
@ConfigurationProperties(prefix = "firefly.cqrs")
@Validated
@Data
public class CqrsProperties {

    /**
     * Whether the CQRS core is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to enable health checks.
     */
    private boolean healthEnabled = true;

    /**
     * Command bus configuration.
     */
    @Valid
    @NotNull
    private CommandConfig command = new CommandConfig();

    /**
     * Query bus configuration.
     */
    @Valid
    @NotNull
    private QueryConfig query = new QueryConfig();

    /**
     * Event store configuration.
     */
    @Valid
    @NotNull
    private EventStoreConfig eventStore = new EventStoreConfig();

    /**
     * Snapshot configuration.
     */
    @Valid
    @NotNull
    private SnapshotConfig snapshot = new SnapshotConfig();

    /**
     * Projection configuration.
     */
    @Valid
    @NotNull
    private ProjectionConfig projection = new ProjectionConfig();

    /**
     * Replay configuration.
     */
    @Valid
    @NotNull
    private ReplayConfig replay = new ReplayConfig();

    /**
     * Command retry configuration.
     */
    @Valid
    @NotNull
    private RetryConfig retry = new RetryConfig();

    /**
     * Resilience configuration for command and query dispatch.
     */
    @Valid
    @NotNull
    private ResilienceConfig resilience = new ResilienceConfig();

    /**
     * Command bus configuration.
     */
    @Data
    public static class CommandConfig {

        /**
         * Maximum time a command may take before it fails with COMMAND_TIMEOUT.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Whether commands are validated before dispatch.
         */
        private boolean validationEnabled = true;
    }

    /**
     * Query bus configuration.
     */
    @Data
    public static class QueryConfig {

        /**
         * Maximum time a query may take before it fails with QUERY_TIMEOUT.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * Whether cacheable query results are cached.
         */
        private boolean cachingEnabled = true;

        /**
         * Maximum number of cached query results.
         */
        @Min(1)
        private int cacheSize = 10000;

        /**
         * TTL for queries that do not declare their own.
         */
        @NotNull
        private Duration defaultCacheTtl = Duration.ofMinutes(5);
    }

    /**
     * Event store configuration.
     */
    @Data
    public static class EventStoreConfig {

        /**
         * Event store backend.
         */
        @NotNull
        private StoreType type = StoreType.IN_MEMORY;

        /**
         * Page size for reads without an explicit limit.
         */
        @Min(1)
        private int maxEventsPerRead = 1000;

        /**
         * Whether appended events are published to live subscribers.
         */
        private boolean publishEvents = true;
    }

    /**
     * Supported storage backends.
     */
    public enum StoreType {
        IN_MEMORY,
        R2DBC
    }

    /**
     * Snapshot configuration.
     */
    @Data
    public static class SnapshotConfig {

        /**
         * Whether snapshots are taken and used on load.
         */
        private boolean enabled = true;

        /**
         * Take a snapshot every this many events.
         */
        @Min(1)
        private int frequency = 100;

        /**
         * Maximum number of streams whose latest snapshot is cached.
         */
        @Min(0)
        private int cacheSize = 1000;

        /**
         * How long a cached snapshot stays valid.
         */
        @NotNull
        private Duration cacheTtl = Duration.ofHours(1);

        /**
         * Number of most recent snapshots kept per stream by cleanup.
         */
        @Min(1)
        private int maxSnapshotsPerStream = 10;

        /**
         * Whether periodic snapshot cleanup runs.
         */
        private boolean cleanupEnabled = true;

        /**
         * Interval between cleanup runs.
         */
        @NotNull
        private Duration cleanupInterval = Duration.ofHours(24);
    }

    /**
     * Projection configuration.
     */
    @Data
    public static class ProjectionConfig {

        /**
         * Whether read-model projections are maintained.
         */
        private boolean enabled = true;

        /**
         * Whether projections subscribe to live events on startup.
         */
        private boolean autoStart = true;
    }

    /**
     * Replay configuration.
     */
    @Data
    public static class ReplayConfig {

        /**
         * Number of events read per page.
         */
        @Min(1)
        private int batchSize = 100;

        /**
         * Number of streams replayed concurrently.
         */
        @Min(1)
        private int maxConcurrentStreams = 10;

        /**
         * Record a checkpoint every this many events of a stream.
         */
        @Min(1)
        private int checkpointFrequency = 1000;

        /**
         * Maximum time to read and dispatch one page of a stream. Time spent paused is not counted.
         */
        @NotNull
        private Duration timeout = Duration.ofMinutes(5);

        /**
         * Whether each replayed event is validated before it is handled.
         */
        private boolean validateEvents = true;

        /**
         * How often a paused replay checks whether it was resumed.
         */
        @NotNull
        private Duration pausePollInterval = Duration.ofMillis(100);
    }

    /**
     * Command retry configuration.
     */
    @Data
    public static class RetryConfig {

        /**
         * Maximum number of attempts, including the first.
         */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * Delay before the first retry.
         */
        @NotNull
        private Duration initialDelay = Duration.ofMillis(100);

        /**
         * Upper bound for the retry delay.
         */
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(5);

        /**
         * Backoff multiplier applied per attempt.
         */
        @DecimalMin("1.0")
        private double multiplier = 2.0;

        /**
         * Random jitter as a fraction of the delay.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.1;
    }

    /**
     * Resilience configuration for Circuit Breaker, Rate Limiter and Bulkhead.
     */
    @Data
    public static class ResilienceConfig {

        /**
         * Whether resilience features are enabled.
         */
        private boolean enabled = true;

        /**
         * Circuit breaker configuration.
         */
        @Valid
        @NotNull
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

        /**
         * Rate limiter configuration.
         */
        @Valid
        @NotNull
        private RateLimiterConfig rateLimiter = new RateLimiterConfig();

        /**
         * Bulkhead configuration.
         */
        @Valid
        @NotNull
        private BulkheadConfig bulkhead = new BulkheadConfig();
    }

    /**
     * Circuit breaker configuration.
     */
    @Data
    public static class CircuitBreakerConfig {

        /**
         * Whether circuit breaker is enabled.
         */
        private boolean enabled = true;

        /**
         * Failure rate threshold percentage (0-100) to open the circuit.
         */
        @Min(1)
        private int failureRateThreshold = 50;

        /**
         * Number of permitted calls in half-open state.
         */
        @Min(1)
        private int permittedNumberOfCallsInHalfOpenState = 10;

        /**
         * Minimum number of calls before calculating failure rate.
         */
        @Min(1)
        private int minimumNumberOfCalls = 10;

        /**
         * Sliding window size in calls.
         */
        @Min(1)
        private int slidingWindowSize = 100;

        /**
         * Wait duration in open state before transitioning to half-open.
         */
        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(60);
    }

    /**
     * Rate limiter configuration.
     */
    @Data
    public static class RateLimiterConfig {

        /**
         * Whether rate limiter is enabled.
         */
        private boolean enabled = false;

        /**
         * Number of permissions available during one limit refresh period.
         */
        @Min(1)
        private int limitForPeriod = 100;

        /**
         * Period of a limit refresh.
         */
        @NotNull
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);

        /**
         * Maximum time a call waits for permission.
         */
        @NotNull
        private Duration timeoutDuration = Duration.ofSeconds(1);
    }

    /**
     * Bulkhead configuration for limiting concurrent executions.
     */
    @Data
    public static class BulkheadConfig {

        /**
         * Whether bulkhead is enabled.
         */
        private boolean enabled = false;

        /**
         * Maximum number of concurrent calls.
         */
        @Min(1)
        private int maxConcurrentCalls = 50;

        /**
         * Maximum wait duration for a permit.
         */
        @NotNull
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }
}
