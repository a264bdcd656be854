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


package org.fireflyframework.cqrs.service;

import org.fireflyframework.cqrs.command.Command;
import org.fireflyframework.cqrs.command.CommandBus;
import org.fireflyframework.cqrs.command.CommandResult;
import org.fireflyframework.cqrs.eventsourcing.store.EventStore;
import org.fireflyframework.cqrs.metrics.CqrsMetrics;
import org.fireflyframework.cqrs.projection.ProjectionManager;
import org.fireflyframework.cqrs.query.Query;
import org.fireflyframework.cqrs.query.QueryBus;
import org.fireflyframework.cqrs.query.QueryResult;
import org.fireflyframework.cqrs.readmodel.ReadModelStore;
import org.fireflyframework.cqrs.replay.ReplayResult;
import org.fireflyframework.cqrs.replay.ReplayService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Entry point for applications using the CQRS core: command and query
 * execution, projection lifecycle, metrics and a health summary.
 */
@Slf4j
public class CqrsService {

    private final CommandBus commandBus;
    private final QueryBus queryBus;
    private final EventStore eventStore;
    private final ReadModelStore readModelStore;
    private final ProjectionManager projectionManager;
    private final ReplayService replayService;
    private final CqrsMetrics metrics;

    public CqrsService(CommandBus commandBus, QueryBus queryBus, EventStore eventStore,
                       ReadModelStore readModelStore, ProjectionManager projectionManager,
                       ReplayService replayService, @Nullable CqrsMetrics metrics) {
        this.commandBus = commandBus;
        this.queryBus = queryBus;
        this.eventStore = eventStore;
        this.readModelStore = readModelStore;
        this.projectionManager = projectionManager;
        this.replayService = replayService;
        this.metrics = metrics;
    }

    // ==================== Commands & Queries ====================

    public Mono<CommandResult> executeCommand(Command command) {
        return commandBus.execute(command);
    }

    public <R> Mono<QueryResult<R>> executeQuery(Query<R> query) {
        return queryBus.execute(query);
    }

    // ==================== Projections ====================

    public void startProjections() {
        projectionManager.start();
    }

    public void stopProjections() {
        projectionManager.stop();
    }

    /**
     * Rebuilds all read models from the event history and drops cached query results.
     */
    public Mono<ReplayResult> rebuildProjections() {
        log.info("Rebuilding projections from event history");
        return projectionManager.rebuild(replayService)
                .doOnNext(result -> queryBus.clearCache());
    }

    // ==================== Observability ====================

    public Optional<CqrsMetrics.MetricsSnapshot> getMetrics() {
        return Optional.ofNullable(metrics).map(CqrsMetrics::getSnapshot);
    }

    /**
     * Returns {@code true} when both the event store and the read-model store respond.
     */
    public Mono<Boolean> healthCheck() {
        return Mono.zip(eventStore.isHealthy(), readModelStore.isHealthy())
                .map(health -> health.getT1() && health.getT2())
                .onErrorResume(e -> {
                    log.warn("CQRS health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    public CommandBus getCommandBus() {
        return commandBus;
    }

    public QueryBus getQueryBus() {
        return queryBus;
    }

    public ReplayService getReplayService() {
        return replayService;
    }
}
