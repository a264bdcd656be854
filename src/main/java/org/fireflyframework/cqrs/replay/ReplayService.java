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


package org.fireflyframework.cqrs.replay;

import org.fireflyframework.cqrs.eventsourcing.store.EventStore;
import org.fireflyframework.cqrs.eventsourcing.store.StoredEvent;
import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.metrics.CqrsMetrics;
import org.fireflyframework.cqrs.properties.CqrsProperties.ReplayConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Re-applies stored events to the registered {@link ReplayHandler}s.
 * <p>
 * Streams are replayed in batches of {@code max-concurrent-streams}, concurrently
 * within a batch and sequentially within a stream, reading pages of
 * {@code batch-size} events. Pause and cancel are honoured between pages.
 * A failing stream is counted and logged; its siblings carry on.
 * <p>
 * Checkpoints are written every {@code checkpoint-frequency} events and at the
 * end of each stream, so {@link #resumeInterruptedReplay()} can pick up a failed
 * or cancelled run where each stream stopped. Only one run is active at a time.
 */
@Slf4j
public class ReplayService {

    public static final String CHECKPOINT_NAME = "replay";

    private final EventStore eventStore;
    private final ReplayCheckpointStore checkpointStore;
    private final ReplayConfig config;
    private final CqrsMetrics metrics;
    private final List<ReplayHandler> handlers = new CopyOnWriteArrayList<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private UUID replayId;
    private ReplayStatus status = ReplayStatus.NOT_STARTED;
    private int totalStreams;
    private int processedStreams;
    private int failedStreams;
    private long eventsProcessed;
    private final Map<UUID, Long> checkpoints = new HashMap<>();
    private Instant startedAt;
    private Instant completedAt;
    private String lastError;
    private Instant windowFrom;
    private Instant windowTo;

    public ReplayService(EventStore eventStore, ReplayCheckpointStore checkpointStore, ReplayConfig config,
                         @Nullable CqrsMetrics metrics) {
        this.eventStore = eventStore;
        this.checkpointStore = checkpointStore;
        this.config = config;
        this.metrics = metrics;
    }

    // ==================== Handlers ====================

    public void registerHandler(ReplayHandler handler) {
        handlers.add(handler);
        log.info("Registered replay handler {}", handler.getName());
    }

    public List<ReplayHandler> getHandlers() {
        return List.copyOf(handlers);
    }

    // ==================== Runs ====================

    /**
     * Replays every stream from its first event.
     */
    public Mono<ReplayResult> replayAll() {
        return run(null, null, false);
    }

    /**
     * Replays the streams that have events inside {@code [from, to]}.
     * <p>
     * Each selected stream is replayed from its first event up to the last event at
     * or before {@code to}, so handlers always see a gapless prefix of the stream.
     */
    public Mono<ReplayResult> replayFromTimestamp(Instant from, @Nullable Instant to) {
        if (from == null || (to != null && from.isAfter(to))) {
            return Mono.error(CqrsException.validation("Replay window must have a start not after its end"));
        }
        return run(from, to, false);
    }

    /**
     * Continues the last failed or cancelled run from its stored checkpoints,
     * using the same time window.
     *
     * @throws CqrsException of type CONFLICT if the last run is not resumable
     */
    public Mono<ReplayResult> resumeInterruptedReplay() {
        return Mono.defer(() -> {
            ReplayStatus current = read(() -> status);
            if (!current.isResumable()) {
                return Mono.error(CqrsException.conflict("No interrupted replay to resume, status is " + current));
            }
            return run(read(() -> windowFrom), read(() -> windowTo), true);
        });
    }

    private Mono<ReplayResult> run(@Nullable Instant from, @Nullable Instant to, boolean resume) {
        return Mono.defer(() -> {
            begin(from, to, resume);
            return execute(from, to, resume).doOnError(this::abort);
        });
    }

    private Mono<ReplayResult> execute(@Nullable Instant from, @Nullable Instant to, boolean resume) {
        return Mono.defer(() -> {
            Mono<Map<UUID, Long>> startPositions = resume
                    ? checkpointStore.loadAll(CHECKPOINT_NAME)
                    : checkpointStore.clear(CHECKPOINT_NAME).then(Mono.just(Map.<UUID, Long>of()));
            Flux<UUID> streams = from == null && to == null
                    ? eventStore.getAllStreamIds()
                    : eventStore.getStreamIds(from, to);

            return startPositions.flatMap(positions -> streams.collectList().flatMap(streamIds -> {
                write(() -> totalStreams = streamIds.size());
                log.info("Replay {} started: {} streams, resume={}, window=[{}, {}]",
                        read(() -> replayId), streamIds.size(), resume, from, to);
                int concurrency = Math.max(1, config.getMaxConcurrentStreams());
                return Flux.fromIterable(streamIds)
                        .buffer(concurrency)
                        .concatMap(batch -> Flux.defer(() -> isCancelled()
                                ? Flux.<Void>empty()
                                : Flux.fromIterable(batch)
                                        .flatMap(streamId -> replayStream(streamId,
                                                positions.getOrDefault(streamId, 0L), to), batch.size())))
                        .then(Mono.fromCallable(this::finish));
            }));
        });
    }

    private Mono<Void> replayStream(UUID streamId, long startAfter, @Nullable Instant to) {
        AtomicLong sinceCheckpoint = new AtomicLong();
        return replayPages(streamId, startAfter, to, sinceCheckpoint)
                .flatMap(last -> last > startAfter ? saveCheckpoint(streamId, last) : Mono.<Void>empty())
                .then(Mono.fromRunnable(() -> {
                    if (!isCancelled()) {
                        write(() -> processedStreams++);
                        if (metrics != null) {
                            metrics.recordStreamReplayed(true);
                        }
                        log.debug("Replayed stream {}", streamId);
                    }
                }))
                .onErrorResume(error -> {
                    log.warn("Replay of stream {} failed: {}", streamId, error.getMessage());
                    write(() -> {
                        failedStreams++;
                        lastError = streamId + ": " + error.getMessage();
                    });
                    if (metrics != null) {
                        metrics.recordStreamReplayed(false);
                    }
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Processes pages after {@code after} until the stream or the window is exhausted,
     * or the run is cancelled. Time spent paused is not part of any page.
     *
     * @return the last dispatched sequence number
     */
    private Mono<Long> replayPages(UUID streamId, long after, @Nullable Instant to, AtomicLong sinceCheckpoint) {
        return awaitRunnable().flatMap(proceed -> {
            if (!proceed) {
                return Mono.just(after);
            }
            return replayPage(streamId, after, to, sinceCheckpoint)
                    .flatMap(page -> page.exhausted()
                            ? Mono.just(page.lastSequence())
                            : replayPages(streamId, page.lastSequence(), to, sinceCheckpoint));
        });
    }

    /**
     * Reads one page and dispatches its events up to the window end. Bounded by
     * {@code replay.timeout}.
     */
    private Mono<PageOutcome> replayPage(UUID streamId, long after, @Nullable Instant to,
                                         AtomicLong sinceCheckpoint) {
        int pageSize = Math.max(1, config.getBatchSize());
        return eventStore.readEvents(streamId, after, pageSize).collectList()
                .flatMap(page -> {
                    List<StoredEvent> inWindow = to == null
                            ? page
                            : page.stream().takeWhile(event -> !event.timestamp().isAfter(to)).toList();
                    boolean exhausted = page.size() < pageSize || inWindow.size() < page.size();
                    long last = inWindow.isEmpty() ? after : inWindow.get(inWindow.size() - 1).sequenceNumber();
                    return Flux.fromIterable(inWindow)
                            .concatMap(event -> dispatch(event)
                                    .then(Mono.defer(() -> afterEvent(event, sinceCheckpoint))))
                            .then(Mono.fromCallable(() -> new PageOutcome(last, exhausted)));
                })
                .timeout(config.getTimeout(), Mono.error(() -> CqrsException.eventStore("Replay of stream "
                        + streamId + " after #" + after + " exceeded " + config.getTimeout())));
    }

    private record PageOutcome(long lastSequence, boolean exhausted) {
    }

    private Mono<Void> dispatch(StoredEvent event) {
        return Mono.fromRunnable(() -> {
                    if (config.isValidateEvents()) {
                        event.event().validate();
                    }
                })
                .onErrorMap(IllegalArgumentException.class, e -> CqrsException.validation("Invalid event "
                        + event.eventType() + " #" + event.sequenceNumber() + ": " + e.getMessage()))
                .thenMany(Flux.fromIterable(handlers)
                        .filter(handler -> handler.handles(event.eventType()))
                        .concatMap(handler -> handler.handleEvent(event)))
                .then();
    }

    private Mono<Void> afterEvent(StoredEvent event, AtomicLong sinceCheckpoint) {
        write(() -> eventsProcessed++);
        if (sinceCheckpoint.incrementAndGet() % Math.max(1, config.getCheckpointFrequency()) == 0) {
            return saveCheckpoint(event.streamId(), event.sequenceNumber());
        }
        return Mono.empty();
    }

    private Mono<Void> saveCheckpoint(UUID streamId, long sequence) {
        write(() -> checkpoints.put(streamId, sequence));
        return checkpointStore.save(CHECKPOINT_NAME, streamId, sequence);
    }

    private Mono<Boolean> awaitRunnable() {
        return Mono.defer(() -> {
            ReplayStatus current = read(() -> status);
            if (current == ReplayStatus.PAUSED) {
                return Mono.delay(config.getPausePollInterval()).then(Mono.defer(this::awaitRunnable));
            }
            return Mono.just(current == ReplayStatus.RUNNING);
        });
    }

    // ==================== Control ====================

    /**
     * Pauses a running replay at the next page boundary.
     *
     * @return {@code true} if the replay was running
     */
    public boolean pause() {
        return transition(ReplayStatus.RUNNING, ReplayStatus.PAUSED);
    }

    public boolean resume() {
        return transition(ReplayStatus.PAUSED, ReplayStatus.RUNNING);
    }

    /**
     * Cancels an active replay. Streams stop at the next page boundary and keep
     * their checkpoints.
     */
    public boolean cancel() {
        lock.writeLock().lock();
        try {
            if (!status.isActive()) {
                return false;
            }
            status = ReplayStatus.CANCELLED;
            log.info("Replay {} cancelled", replayId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ReplayStatus getStatus() {
        return read(() -> status);
    }

    public ReplayProgress getProgress() {
        return read(() -> new ReplayProgress(replayId, status, totalStreams, processedStreams, failedStreams,
                eventsProcessed, checkpoints, startedAt, completedAt, lastError));
    }

    // ==================== State ====================

    private void begin(@Nullable Instant from, @Nullable Instant to, boolean resume) {
        lock.writeLock().lock();
        try {
            if (status.isActive()) {
                throw CqrsException.conflict("Replay " + replayId + " is already " + status);
            }
            replayId = UUID.randomUUID();
            status = ReplayStatus.RUNNING;
            totalStreams = 0;
            processedStreams = 0;
            failedStreams = 0;
            eventsProcessed = 0;
            if (!resume) {
                checkpoints.clear();
            }
            startedAt = Instant.now();
            completedAt = null;
            lastError = null;
            windowFrom = from;
            windowTo = to;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private ReplayResult finish() {
        ReplayResult result;
        lock.writeLock().lock();
        try {
            if (status != ReplayStatus.CANCELLED) {
                status = failedStreams > 0 ? ReplayStatus.FAILED : ReplayStatus.COMPLETED;
            }
            completedAt = Instant.now();
            result = new ReplayResult(replayId, status, status == ReplayStatus.COMPLETED,
                    totalStreams, processedStreams, failedStreams, eventsProcessed,
                    Duration.between(startedAt, completedAt));
        } finally {
            lock.writeLock().unlock();
        }
        if (metrics != null) {
            metrics.recordEventsReplayed(result.eventsProcessed());
        }
        log.info("Replay {} {}: streams={}/{}, failed={}, events={}, took {}ms", result.replayId(),
                result.status(), result.processedStreams(), result.totalStreams(), result.failedStreams(),
                result.eventsProcessed(), result.duration().toMillis());
        return result;
    }

    private void abort(Throwable error) {
        lock.writeLock().lock();
        try {
            if (status.isActive()) {
                status = ReplayStatus.FAILED;
                completedAt = Instant.now();
                lastError = error.getMessage();
                log.warn("Replay {} aborted: {}", replayId, error.getMessage());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean transition(ReplayStatus from, ReplayStatus to) {
        lock.writeLock().lock();
        try {
            if (status != from) {
                return false;
            }
            status = to;
            log.info("Replay {} {} -> {}", replayId, from, to);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean isCancelled() {
        return read(() -> status) == ReplayStatus.CANCELLED;
    }

    private <T> T read(Supplier<T> supplier) {
        lock.readLock().lock();
        try {
            return supplier.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void write(Runnable action) {
        lock.writeLock().lock();
        try {
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
