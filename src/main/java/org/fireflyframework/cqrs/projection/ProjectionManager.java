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


package org.fireflyframework.cqrs.projection;

import org.fireflyframework.cqrs.eventsourcing.store.EventBus;
import org.fireflyframework.cqrs.eventsourcing.store.EventSubscriber;
import org.fireflyframework.cqrs.eventsourcing.store.StoredEvent;
import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.metrics.CqrsMetrics;
import org.fireflyframework.cqrs.replay.ReplayResult;
import org.fireflyframework.cqrs.replay.ReplayService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the registered projections, feeds them live events from the {@link EventBus}
 * and tracks a {@link ProjectionCheckpoint} per projection.
 * <p>
 * A failing projection is recorded on its checkpoint and does not stop the
 * other projections from receiving the event.
 */
@Slf4j
public class ProjectionManager implements EventSubscriber, DisposableBean {

    private final EventBus eventBus;
    private final CqrsMetrics metrics;
    private final List<Projection> projections = new CopyOnWriteArrayList<>();
    private final Map<String, ProjectionCheckpoint> checkpoints = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ProjectionManager(EventBus eventBus, @Nullable CqrsMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    // ==================== Registration ====================

    public void register(Projection projection) {
        if (checkpoints.putIfAbsent(projection.getName(), ProjectionCheckpoint.initial(projection.getName())) != null) {
            throw CqrsException.configuration("Projection already registered: " + projection.getName());
        }
        projections.add(projection);
        if (running.get()) {
            updateStatus(projection.getName(), ProjectionStatus.RUNNING);
        }
        log.info("Registered projection {}", projection.getName());
    }

    public List<Projection> getProjections() {
        return List.copyOf(projections);
    }

    // ==================== Lifecycle ====================

    public void start() {
        if (running.compareAndSet(false, true)) {
            eventBus.subscribe(this);
            projections.forEach(projection -> updateStatus(projection.getName(), ProjectionStatus.RUNNING));
            log.info("Projection manager started with {} projections", projections.size());
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            eventBus.unsubscribe(this);
            projections.forEach(projection -> updateStatus(projection.getName(), ProjectionStatus.STOPPED));
            log.info("Projection manager stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void destroy() {
        stop();
    }

    // ==================== Event handling ====================

    @Override
    public Mono<Void> onEvents(List<StoredEvent> events) {
        return Flux.fromIterable(events)
                .concatMap(event -> project(event, false))
                .then();
    }

    /**
     * Applies one event to every projection that handles its type.
     *
     * @param failOnError when true the returned Mono fails with a PROJECTION error
     *                    after all projections ran if any of them failed
     */
    public Mono<Void> project(StoredEvent event, boolean failOnError) {
        return Flux.fromIterable(projections)
                .filter(projection -> projection.handles(event.eventType()))
                .concatMap(projection -> applyTo(projection, event))
                .all(Boolean::booleanValue)
                .flatMap(allApplied -> allApplied || !failOnError
                        ? Mono.<Void>empty()
                        : Mono.error(CqrsException.projection("Projection failed for event "
                                + event.eventType() + " #" + event.sequenceNumber()
                                + " of stream " + event.streamId(), null)));
    }

    private Mono<Boolean> applyTo(Projection projection, StoredEvent event) {
        return Mono.defer(() -> projection.apply(event))
                .then(Mono.fromCallable(() -> {
                    checkpoints.computeIfPresent(projection.getName(),
                            (name, checkpoint) -> checkpoint.applied(event.streamId(), event.sequenceNumber()));
                    if (metrics != null) {
                        metrics.recordEventProjected(projection.getName(), event.eventType());
                    }
                    return true;
                }))
                .onErrorResume(error -> {
                    log.warn("Projection {} failed on {} #{} of stream {}: {}", projection.getName(),
                            event.eventType(), event.sequenceNumber(), event.streamId(), error.getMessage());
                    checkpoints.computeIfPresent(projection.getName(),
                            (name, checkpoint) -> checkpoint.failed(error.getMessage()));
                    if (metrics != null) {
                        metrics.recordProjectionFailed(projection.getName(), event.eventType());
                    }
                    return Mono.just(false);
                });
    }

    // ==================== Rebuild ====================

    /**
     * Resets every projection and replays the full event history into them.
     * Live events keep flowing during the rebuild; projections skip duplicates.
     */
    public Mono<ReplayResult> rebuild(ReplayService replayService) {
        return Flux.fromIterable(projections)
                .concatMap(projection -> {
                    updateStatus(projection.getName(), ProjectionStatus.REBUILDING);
                    checkpoints.computeIfPresent(projection.getName(), (name, checkpoint) -> checkpoint.reset());
                    return projection.reset();
                })
                .then(Mono.defer(replayService::replayAll))
                .doOnNext(result -> {
                    ProjectionStatus status = !result.success() ? ProjectionStatus.FAILED
                            : running.get() ? ProjectionStatus.RUNNING : ProjectionStatus.STOPPED;
                    projections.forEach(projection -> updateStatus(projection.getName(), status));
                    log.info("Projection rebuild finished: success={}, events={}, failedStreams={}",
                            result.success(), result.eventsProcessed(), result.failedStreams());
                })
                .doOnError(error -> {
                    log.warn("Projection rebuild failed: {}", error.getMessage());
                    projections.forEach(projection -> updateStatus(projection.getName(), ProjectionStatus.FAILED));
                });
    }

    // ==================== Checkpoints ====================

    public Optional<ProjectionCheckpoint> getCheckpoint(String projectionName) {
        return Optional.ofNullable(checkpoints.get(projectionName));
    }

    public Map<String, ProjectionCheckpoint> getCheckpoints() {
        return Map.copyOf(checkpoints);
    }

    private void updateStatus(String projectionName, ProjectionStatus status) {
        checkpoints.computeIfPresent(projectionName, (name, checkpoint) -> checkpoint.withStatus(status));
    }
}
