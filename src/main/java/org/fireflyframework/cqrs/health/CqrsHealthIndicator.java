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


package org.fireflyframework.cqrs.health;

import org.fireflyframework.cqrs.command.CommandBus;
import org.fireflyframework.cqrs.eventsourcing.store.EventStore;
import org.fireflyframework.cqrs.projection.ProjectionManager;
import org.fireflyframework.cqrs.query.QueryBus;
import org.fireflyframework.cqrs.replay.ReplayService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Health indicator for the CQRS core.
 * <p>
 * Reports the health status based on:
 * <ul>
 *   <li>Event store connectivity</li>
 *   <li>Number of registered command and query handlers</li>
 *   <li>Projection state</li>
 *   <li>Replay status</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class CqrsHealthIndicator implements ReactiveHealthIndicator {

    private final EventStore eventStore;
    private final CommandBus commandBus;
    private final QueryBus queryBus;
    @Nullable
    private final ProjectionManager projectionManager;
    @Nullable
    private final ReplayService replayService;

    @Override
    public Mono<Health> health() {
        return checkEventStore()
                .map(storeHealthy -> {
                    Health.Builder builder = storeHealthy ? Health.up() : Health.down();
                    builder.withDetail("eventStore", storeHealthy ? "connected" : "disconnected")
                            .withDetail("commandHandlers", commandBus.getHandlerCount())
                            .withDetail("queryHandlers", queryBus.getHandlerCount());
                    if (projectionManager != null) {
                        builder.withDetail("projectionsRunning", projectionManager.isRunning())
                                .withDetail("projections", projectionStatuses());
                    }
                    if (replayService != null) {
                        builder.withDetail("replayStatus", replayService.getStatus().name());
                    }
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.warn("CQRS health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Mono<Boolean> checkEventStore() {
        return eventStore.isHealthy()
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false);
    }

    private Map<String, String> projectionStatuses() {
        return projectionManager.getCheckpoints().values().stream()
                .collect(Collectors.toMap(checkpoint -> checkpoint.projectionName(),
                        checkpoint -> checkpoint.status().name()));
    }
}
