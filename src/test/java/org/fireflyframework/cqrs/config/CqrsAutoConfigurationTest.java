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


package org.fireflyframework.cqrs.config;

import org.fireflyframework.cqrs.H2TestDatabase;
import org.fireflyframework.cqrs.command.CommandBus;
import org.fireflyframework.cqrs.eventsourcing.snapshot.SnapshotCleanupService;
import org.fireflyframework.cqrs.eventsourcing.snapshot.SnapshotStore;
import org.fireflyframework.cqrs.eventsourcing.store.EventStore;
import org.fireflyframework.cqrs.eventsourcing.store.InMemoryEventStore;
import org.fireflyframework.cqrs.eventsourcing.store.R2dbcEventStore;
import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.health.CqrsHealthIndicator;
import org.fireflyframework.cqrs.metrics.CqrsMetrics;
import org.fireflyframework.cqrs.projection.ProjectionManager;
import org.fireflyframework.cqrs.query.QueryBus;
import org.fireflyframework.cqrs.query.QueryCache;
import org.fireflyframework.cqrs.replay.ReplayService;
import org.fireflyframework.cqrs.resilience.CqrsResilience;
import org.fireflyframework.cqrs.service.CqrsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.r2dbc.core.DatabaseClient;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the CQRS auto-configurations.
 */
class CqrsAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    CqrsMetricsAutoConfiguration.class,
                    CqrsResilienceAutoConfiguration.class,
                    CqrsAutoConfiguration.class))
            .withPropertyValues("firefly.cqrs.snapshot.cleanup-enabled=false");

    @Test
    @DisplayName("defaults should wire an in-memory core with every component")
    void defaultsShouldWireInMemoryCore() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(EventStore.class)).isInstanceOf(InMemoryEventStore.class);
            assertThat(context).hasSingleBean(SnapshotStore.class);
            assertThat(context).hasSingleBean(QueryCache.class);
            assertThat(context).hasSingleBean(CqrsMetrics.class);
            assertThat(context).hasSingleBean(CqrsResilience.class);
            assertThat(context).hasSingleBean(ReplayService.class);
            assertThat(context).hasSingleBean(CqrsService.class);
            assertThat(context).hasSingleBean(CqrsHealthIndicator.class);
            assertThat(context).doesNotHaveBean(SnapshotCleanupService.class);
            assertThat(context.getBean(CommandBus.class).getHandlerCount()).isEqualTo(7);
            assertThat(context.getBean(QueryBus.class).getHandlerCount()).isEqualTo(5);
            assertThat(context.getBean(ProjectionManager.class).isRunning()).isTrue();
            assertThat(context.getBean(ReplayService.class).getHandlers()).hasSize(1);
        });
    }

    @Test
    @DisplayName("disabling the core should create no CQRS beans")
    void disabledShouldCreateNothing() {
        contextRunner.withPropertyValues("firefly.cqrs.enabled=false").run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).doesNotHaveBean(CommandBus.class);
            assertThat(context).doesNotHaveBean(CqrsMetrics.class);
            assertThat(context).doesNotHaveBean(CqrsResilience.class);
        });
    }

    @Test
    @DisplayName("optional features should be switchable by property")
    void optionalFeaturesShouldBeSwitchable() {
        contextRunner.withPropertyValues(
                "firefly.cqrs.snapshot.enabled=false",
                "firefly.cqrs.query.caching-enabled=false",
                "firefly.cqrs.projection.auto-start=false",
                "firefly.cqrs.resilience.enabled=false",
                "firefly.cqrs.health-enabled=false"
        ).run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).doesNotHaveBean(SnapshotStore.class);
            assertThat(context).doesNotHaveBean(QueryCache.class);
            assertThat(context).doesNotHaveBean(CqrsResilience.class);
            assertThat(context).doesNotHaveBean(CqrsHealthIndicator.class);
            assertThat(context.getBean(ProjectionManager.class).isRunning()).isFalse();
            assertThat(context.getBean(QueryBus.class).getCache()).isNull();
        });
    }

    @Test
    @DisplayName("the R2DBC store without a DatabaseClient should fail with a configuration error")
    void r2dbcWithoutDatabaseClientShouldFail() {
        contextRunner.withPropertyValues("firefly.cqrs.event-store.type=R2DBC").run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(CqrsException.class)
                    .rootCause().hasMessageContaining("DatabaseClient");
        });
    }

    @Test
    @DisplayName("R2DBC store type should select the R2DBC event store when a DatabaseClient exists")
    void r2dbcShouldBeSelected() {
        contextRunner.withPropertyValues("firefly.cqrs.event-store.type=R2DBC")
                .withBean(DatabaseClient.class, () -> H2TestDatabase.create().databaseClient())
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(EventStore.class)).isInstanceOf(R2dbcEventStore.class);
                });
    }
}
