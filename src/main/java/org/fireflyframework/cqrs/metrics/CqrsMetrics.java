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


package org.fireflyframework.cqrs.metrics;

import org.fireflyframework.cqrs.exception.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records CQRS metrics in Micrometer. All metrics are prefixed with {@code firefly.cqrs.*}.
 * <p>
 * Totals and accumulated durations are also kept locally so that
 * {@link #getSnapshot()} works with any registry.
 */
@Slf4j
public class CqrsMetrics {

    private static final String PREFIX = "firefly.cqrs.";

    private final MeterRegistry meterRegistry;

    private final AtomicLong commandsExecuted = new AtomicLong();
    private final AtomicLong commandsFailed = new AtomicLong();
    private final AtomicLong commandNanos = new AtomicLong();
    private final AtomicLong queriesExecuted = new AtomicLong();
    private final AtomicLong queriesFailed = new AtomicLong();
    private final AtomicLong queryNanos = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong eventsProjected = new AtomicLong();
    private final AtomicLong projectionFailures = new AtomicLong();
    private final AtomicLong eventsReplayed = new AtomicLong();
    private final AtomicLong streamsReplayed = new AtomicLong();
    private final AtomicLong streamsFailed = new AtomicLong();

    public CqrsMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("CqrsMetrics initialized");
    }

    // ==================== Command Metrics ====================

    public void recordCommandExecuted(String commandName, Duration duration) {
        counter("command.executed", "command", commandName).increment();
        timer("command.duration", "command", commandName, "outcome", "success").record(duration);
        commandsExecuted.incrementAndGet();
        commandNanos.addAndGet(duration.toNanos());
        log.debug("METRIC: command.executed command={}, durationMs={}", commandName, duration.toMillis());
    }

    public void recordCommandFailed(String commandName, ErrorType errorType, Duration duration) {
        counter("command.failed", "command", commandName, "error.type", errorType.name()).increment();
        timer("command.duration", "command", commandName, "outcome", "failure").record(duration);
        commandsFailed.incrementAndGet();
        log.debug("METRIC: command.failed command={}, errorType={}", commandName, errorType);
    }

    // ==================== Query Metrics ====================

    public void recordQueryExecuted(String queryName, Duration duration, boolean fromCache) {
        counter("query.executed", "query", queryName, "cached", String.valueOf(fromCache)).increment();
        timer("query.duration", "query", queryName).record(duration);
        queriesExecuted.incrementAndGet();
        queryNanos.addAndGet(duration.toNanos());
        log.debug("METRIC: query.executed query={}, durationMs={}, fromCache={}",
                queryName, duration.toMillis(), fromCache);
    }

    public void recordQueryFailed(String queryName, ErrorType errorType) {
        counter("query.failed", "query", queryName, "error.type", errorType.name()).increment();
        queriesFailed.incrementAndGet();
        log.debug("METRIC: query.failed query={}, errorType={}", queryName, errorType);
    }

    public void recordCacheHit(String queryName) {
        counter("query.cache.hit", "query", queryName).increment();
        cacheHits.incrementAndGet();
    }

    public void recordCacheMiss(String queryName) {
        counter("query.cache.miss", "query", queryName).increment();
        cacheMisses.incrementAndGet();
    }

    // ==================== Projection Metrics ====================

    public void recordEventProjected(String projection, String eventType) {
        counter("projection.events", "projection", projection, "event.type", eventType).increment();
        eventsProjected.incrementAndGet();
    }

    public void recordProjectionFailed(String projection, String eventType) {
        counter("projection.failed", "projection", projection, "event.type", eventType).increment();
        projectionFailures.incrementAndGet();
        log.debug("METRIC: projection.failed projection={}, eventType={}", projection, eventType);
    }

    // ==================== Replay Metrics ====================

    public void recordEventsReplayed(long count) {
        counter("replay.events").increment(count);
        eventsReplayed.addAndGet(count);
    }

    public void recordStreamReplayed(boolean success) {
        counter("replay.streams", "outcome", success ? "success" : "failure").increment();
        if (success) {
            streamsReplayed.incrementAndGet();
        } else {
            streamsFailed.incrementAndGet();
        }
    }

    // ==================== Snapshot ====================

    public MetricsSnapshot getSnapshot() {
        long commands = commandsExecuted.get();
        long queries = queriesExecuted.get();
        long hits = cacheHits.get();
        long lookups = hits + cacheMisses.get();
        return new MetricsSnapshot(
                commands,
                commandsFailed.get(),
                commands > 0 ? commandNanos.get() / 1_000_000.0 / commands : 0.0,
                queries,
                queriesFailed.get(),
                queries > 0 ? queryNanos.get() / 1_000_000.0 / queries : 0.0,
                hits,
                cacheMisses.get(),
                lookups > 0 ? (double) hits / lookups : 0.0,
                eventsProjected.get(),
                projectionFailures.get(),
                eventsReplayed.get(),
                streamsReplayed.get(),
                streamsFailed.get());
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    // ==================== Helper Methods ====================

    private Counter counter(String name, String... tags) {
        return Counter.builder(PREFIX + name)
                .tags(tags)
                .register(meterRegistry);
    }

    private Timer timer(String name, String... tags) {
        return Timer.builder(PREFIX + name)
                .tags(tags)
                .register(meterRegistry);
    }

    /**
     * Point-in-time totals.
     */
    public record MetricsSnapshot(
            long commandsExecuted,
            long commandsFailed,
            double averageCommandTimeMs,
            long queriesExecuted,
            long queriesFailed,
            double averageQueryTimeMs,
            long cacheHits,
            long cacheMisses,
            double cacheHitRate,
            long eventsProjected,
            long projectionFailures,
            long eventsReplayed,
            long streamsReplayed,
            long streamsFailed
    ) {}
}
