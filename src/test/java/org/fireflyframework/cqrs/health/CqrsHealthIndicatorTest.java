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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.cqrs.command.CommandBus;
import org.fireflyframework.cqrs.eventsourcing.store.EventBus;
import org.fireflyframework.cqrs.eventsourcing.store.EventStore;
import org.fireflyframework.cqrs.eventsourcing.store.InMemoryEventStore;
import org.fireflyframework.cqrs.projection.ProjectionManager;
import org.fireflyframework.cqrs.projection.ResearchWorkflowProjection;
import org.fireflyframework.cqrs.query.QueryBus;
import org.fireflyframework.cqrs.readmodel.InMemoryReadModelStore;
import org.fireflyframework.cqrs.replay.InMemoryReplayCheckpointStore;
import org.fireflyframework.cqrs.replay.ReplayService;
import org.fireflyframework.cqrs.properties.CqrsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CqrsHealthIndicator}.
 */
class CqrsHealthIndicatorTest {

    private CommandBus commandBus;
    private QueryBus queryBus;
    private ProjectionManager projectionManager;

    @BeforeEach
    void setUp() {
        commandBus = new CommandBus(Duration.ofSeconds(1));
        queryBus = new QueryBus(new ObjectMapper(), Duration.ofSeconds(1), null);
        projectionManager = new ProjectionManager(new EventBus(), null);
        projectionManager.register(new ResearchWorkflowProjection(new InMemoryReadModelStore()));
    }

    @Test
    @DisplayName("should report UP with component details when the event store is healthy")
    void shouldReportUp() {
        EventStore eventStore = new InMemoryEventStore();
        ReplayService replayService = new ReplayService(eventStore, new InMemoryReplayCheckpointStore(),
                new CqrsProperties.ReplayConfig(), null);
        projectionManager.start();
        CqrsHealthIndicator indicator = new CqrsHealthIndicator(eventStore, commandBus, queryBus,
                projectionManager, replayService);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("eventStore", "connected")
                            .containsEntry("commandHandlers", 0)
                            .containsEntry("projectionsRunning", true)
                            .containsEntry("projections", Map.of(ResearchWorkflowProjection.NAME, "RUNNING"))
                            .containsEntry("replayStatus", "NOT_STARTED");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report DOWN when the event store is unhealthy or fails")
    void shouldReportDown() {
        EventStore unhealthy = mock(EventStore.class);
        when(unhealthy.isHealthy()).thenReturn(Mono.just(false));
        EventStore failing = mock(EventStore.class);
        when(failing.isHealthy()).thenReturn(Mono.error(new IllegalStateException("connection refused")));

        StepVerifier.create(new CqrsHealthIndicator(unhealthy, commandBus, queryBus, null, null).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("eventStore", "disconnected")
                            .doesNotContainKey("replayStatus");
                })
                .verifyComplete();
        StepVerifier.create(new CqrsHealthIndicator(failing, commandBus, queryBus, projectionManager, null).health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }
}
