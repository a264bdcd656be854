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

import org.fireflyframework.cqrs.command.CommandBus;
import org.fireflyframework.cqrs.command.CommandHandler;
import org.fireflyframework.cqrs.command.handler.CompleteTaskHandler;
import org.fireflyframework.cqrs.command.handler.CompleteWorkflowHandler;
import org.fireflyframework.cqrs.command.handler.CreateResearchWorkflowHandler;
import org.fireflyframework.cqrs.command.handler.CreateTaskHandler;
import org.fireflyframework.cqrs.command.handler.FailWorkflowHandler;
import org.fireflyframework.cqrs.command.handler.StartWorkflowExecutionHandler;
import org.fireflyframework.cqrs.command.handler.UpdateWorkflowHandler;
import org.fireflyframework.cqrs.eventsourcing.aggregate.ResearchWorkflowAggregate;
import org.fireflyframework.cqrs.eventsourcing.aggregate.ResearchWorkflowState;
import org.fireflyframework.cqrs.eventsourcing.event.EventTypeRegistry;
import org.fireflyframework.cqrs.eventsourcing.repository.AggregateRepository;
import org.fireflyframework.cqrs.eventsourcing.repository.EventSourcedAggregateRepository;
import org.fireflyframework.cqrs.eventsourcing.snapshot.InMemorySnapshotStorage;
import org.fireflyframework.cqrs.eventsourcing.snapshot.R2dbcSnapshotStorage;
import org.fireflyframework.cqrs.eventsourcing.snapshot.SnapshotCleanupService;
import org.fireflyframework.cqrs.eventsourcing.snapshot.SnapshotStorage;
import org.fireflyframework.cqrs.eventsourcing.snapshot.SnapshotStore;
import org.fireflyframework.cqrs.eventsourcing.store.EventBus;
import org.fireflyframework.cqrs.eventsourcing.store.EventSerializer;
import org.fireflyframework.cqrs.eventsourcing.store.EventStore;
import org.fireflyframework.cqrs.eventsourcing.store.InMemoryEventStore;
import org.fireflyframework.cqrs.eventsourcing.store.R2dbcEventStore;
import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.health.CqrsHealthIndicator;
import org.fireflyframework.cqrs.metrics.CqrsMetrics;
import org.fireflyframework.cqrs.projection.Projection;
import org.fireflyframework.cqrs.projection.ProjectionManager;
import org.fireflyframework.cqrs.projection.ResearchWorkflowProjection;
import org.fireflyframework.cqrs.properties.CqrsProperties;
import org.fireflyframework.cqrs.properties.CqrsProperties.StoreType;
import org.fireflyframework.cqrs.query.QueryBus;
import org.fireflyframework.cqrs.query.QueryCache;
import org.fireflyframework.cqrs.query.QueryHandler;
import org.fireflyframework.cqrs.query.handler.GetResearchWorkflowHandler;
import org.fireflyframework.cqrs.query.handler.GetTasksByWorkflowHandler;
import org.fireflyframework.cqrs.query.handler.GetWorkflowListHandler;
import org.fireflyframework.cqrs.query.handler.GetWorkflowStatsHandler;
import org.fireflyframework.cqrs.query.handler.SearchWorkflowsHandler;
import org.fireflyframework.cqrs.readmodel.InMemoryReadModelStore;
import org.fireflyframework.cqrs.readmodel.ReadModelStore;
import org.fireflyframework.cqrs.replay.InMemoryReplayCheckpointStore;
import org.fireflyframework.cqrs.replay.ProjectionReplayHandler;
import org.fireflyframework.cqrs.replay.R2dbcReplayCheckpointStore;
import org.fireflyframework.cqrs.replay.ReplayCheckpointStore;
import org.fireflyframework.cqrs.replay.ReplayHandler;
import org.fireflyframework.cqrs.replay.ReplayService;
import org.fireflyframework.cqrs.resilience.CqrsResilience;
import org.fireflyframework.cqrs.service.CqrsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

/**
 * Auto-configuration for the Firefly CQRS core.
 * <p>
 * This configuration provides:
 * <ul>
 *   <li>EventStore - in-memory or R2DBC, selected by {@code firefly.cqrs.event-store.type}</li>
 *   <li>SnapshotStore - snapshot persistence with a read-through cache and periodic cleanup</li>
 *   <li>CommandBus - with the research workflow command handlers registered</li>
 *   <li>QueryBus - with the query cache and the research workflow query handlers</li>
 *   <li>ProjectionManager - keeps the read models current from live events</li>
 *   <li>ReplayService - rebuilds projections and aggregates from history</li>
 *   <li>CqrsService - application facade</li>
 *   <li>CqrsHealthIndicator - health monitoring</li>
 * </ul>
 * <p>
 * The R2DBC stores require a {@link DatabaseClient} bean and the tables in {@code db/cqrs-schema.sql}.
 */
@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration")
@EnableConfigurationProperties(CqrsProperties.class)
@ConditionalOnProperty(prefix = "firefly.cqrs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CqrsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper cqrsObjectMapper() {
        log.info("Creating ObjectMapper for CQRS serialization");
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return objectMapper;
    }

    // ==================== Event Store ====================

    @Bean
    @ConditionalOnMissingBean
    public EventTypeRegistry eventTypeRegistry() {
        return EventTypeRegistry.withResearchEvents();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSerializer eventSerializer(ObjectMapper objectMapper, EventTypeRegistry eventTypeRegistry) {
        return new EventSerializer(objectMapper, eventTypeRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventStore eventStore(CqrsProperties properties,
                                 EventSerializer eventSerializer,
                                 EventBus eventBus,
                                 ObjectProvider<DatabaseClient> databaseClient,
                                 ObjectProvider<ReactiveTransactionManager> transactionManager) {
        CqrsProperties.EventStoreConfig config = properties.getEventStore();
        EventBus publisher = config.isPublishEvents() ? eventBus : null;
        if (config.getType() == StoreType.R2DBC) {
            DatabaseClient client = requireDatabaseClient(databaseClient, "event store");
            log.info("Creating R2dbcEventStore with maxEventsPerRead: {}, publishEvents: {}",
                    config.getMaxEventsPerRead(), config.isPublishEvents());
            return new R2dbcEventStore(client, transactionalOperator(client, transactionManager),
                    eventSerializer, publisher, config.getMaxEventsPerRead());
        }
        log.info("Creating InMemoryEventStore with maxEventsPerRead: {}, publishEvents: {}",
                config.getMaxEventsPerRead(), config.isPublishEvents());
        return new InMemoryEventStore(publisher, config.getMaxEventsPerRead());
    }

    // ==================== Snapshots ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.cqrs.snapshot", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SnapshotStorage snapshotStorage(CqrsProperties properties,
                                           ObjectMapper objectMapper,
                                           ObjectProvider<DatabaseClient> databaseClient,
                                           ObjectProvider<ReactiveTransactionManager> transactionManager) {
        if (properties.getEventStore().getType() == StoreType.R2DBC) {
            DatabaseClient client = requireDatabaseClient(databaseClient, "snapshot storage");
            log.info("Creating R2dbcSnapshotStorage");
            return new R2dbcSnapshotStorage(client, transactionalOperator(client, transactionManager), objectMapper);
        }
        log.info("Creating InMemorySnapshotStorage");
        return new InMemorySnapshotStorage();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.cqrs.snapshot", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SnapshotStore snapshotStore(SnapshotStorage snapshotStorage, ObjectMapper objectMapper,
                                       CqrsProperties properties) {
        CqrsProperties.SnapshotConfig config = properties.getSnapshot();
        log.info("Creating SnapshotStore with frequency: {}, cacheSize: {}, cacheTtl: {}, maxPerStream: {}",
                config.getFrequency(), config.getCacheSize(), config.getCacheTtl(),
                config.getMaxSnapshotsPerStream());
        return new SnapshotStore(snapshotStorage, objectMapper, config.getCacheSize(), config.getCacheTtl(),
                config.getMaxSnapshotsPerStream());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.cqrs.snapshot", name = {"enabled", "cleanup-enabled"},
            havingValue = "true", matchIfMissing = true)
    public SnapshotCleanupService snapshotCleanupService(SnapshotStore snapshotStore, CqrsProperties properties) {
        log.info("Creating SnapshotCleanupService with interval: {}", properties.getSnapshot().getCleanupInterval());
        SnapshotCleanupService service = new SnapshotCleanupService(snapshotStore,
                properties.getSnapshot().getCleanupInterval());
        service.start();
        return service;
    }

    // ==================== Command side ====================

    @Bean
    @ConditionalOnMissingBean
    public AggregateRepository<ResearchWorkflowAggregate> researchWorkflowRepository(
            EventStore eventStore,
            @Nullable SnapshotStore snapshotStore,
            CqrsProperties properties) {
        log.info("Creating research workflow repository with snapshots: {}", snapshotStore != null);
        return new EventSourcedAggregateRepository<>(eventStore, snapshotStore, ResearchWorkflowAggregate::new,
                ResearchWorkflowState.class, properties.getSnapshot().getFrequency());
    }

    @Bean
    public CreateResearchWorkflowHandler createResearchWorkflowHandler(
            AggregateRepository<ResearchWorkflowAggregate> repository) {
        return new CreateResearchWorkflowHandler(repository);
    }

    @Bean
    public StartWorkflowExecutionHandler startWorkflowExecutionHandler(
            AggregateRepository<ResearchWorkflowAggregate> repository) {
        return new StartWorkflowExecutionHandler(repository);
    }

    @Bean
    public CreateTaskHandler createTaskHandler(AggregateRepository<ResearchWorkflowAggregate> repository) {
        return new CreateTaskHandler(repository);
    }

    @Bean
    public CompleteTaskHandler completeTaskHandler(AggregateRepository<ResearchWorkflowAggregate> repository) {
        return new CompleteTaskHandler(repository);
    }

    @Bean
    public CompleteWorkflowHandler completeWorkflowHandler(AggregateRepository<ResearchWorkflowAggregate> repository) {
        return new CompleteWorkflowHandler(repository);
    }

    @Bean
    public FailWorkflowHandler failWorkflowHandler(AggregateRepository<ResearchWorkflowAggregate> repository) {
        return new FailWorkflowHandler(repository);
    }

    @Bean
    public UpdateWorkflowHandler updateWorkflowHandler(AggregateRepository<ResearchWorkflowAggregate> repository) {
        return new UpdateWorkflowHandler(repository);
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandBus commandBus(CqrsProperties properties,
                                 ObjectProvider<CommandHandler<?>> handlers,
                                 @Nullable CqrsMetrics metrics,
                                 @Nullable CqrsResilience resilience) {
        CqrsProperties.CommandConfig config = properties.getCommand();
        CommandBus commandBus = new CommandBus(config.getTimeout(), config.isValidationEnabled(), metrics, resilience);
        commandBus.registerAll(handlers.orderedStream().toList());
        log.info("Creating CommandBus with timeout: {}, handlers: {}, metrics: {}, resilience: {}",
                config.getTimeout(), commandBus.getHandlerCount(), metrics != null, resilience != null);
        return commandBus;
    }

    // ==================== Query side ====================

    @Bean
    @ConditionalOnMissingBean
    public ReadModelStore readModelStore() {
        log.info("Creating InMemoryReadModelStore");
        return new InMemoryReadModelStore();
    }

    @Bean
    public GetResearchWorkflowHandler getResearchWorkflowHandler(ReadModelStore readModelStore) {
        return new GetResearchWorkflowHandler(readModelStore);
    }

    @Bean
    public GetWorkflowListHandler getWorkflowListHandler(ReadModelStore readModelStore) {
        return new GetWorkflowListHandler(readModelStore);
    }

    @Bean
    public GetWorkflowStatsHandler getWorkflowStatsHandler(ReadModelStore readModelStore) {
        return new GetWorkflowStatsHandler(readModelStore);
    }

    @Bean
    public GetTasksByWorkflowHandler getTasksByWorkflowHandler(ReadModelStore readModelStore) {
        return new GetTasksByWorkflowHandler(readModelStore);
    }

    @Bean
    public SearchWorkflowsHandler searchWorkflowsHandler(ReadModelStore readModelStore) {
        return new SearchWorkflowsHandler(readModelStore);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.cqrs.query", name = "caching-enabled", havingValue = "true", matchIfMissing = true)
    public QueryCache queryCache(ObjectMapper objectMapper, CqrsProperties properties) {
        log.info("Creating QueryCache with size: {}", properties.getQuery().getCacheSize());
        return new QueryCache(objectMapper, properties.getQuery().getCacheSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryBus queryBus(CqrsProperties properties,
                             ObjectMapper objectMapper,
                             ObjectProvider<QueryHandler<?, ?>> handlers,
                             @Nullable QueryCache queryCache,
                             @Nullable CqrsMetrics metrics,
                             @Nullable CqrsResilience resilience) {
        QueryBus queryBus = new QueryBus(objectMapper, properties.getQuery().getTimeout(), queryCache,
                metrics, resilience);
        queryBus.registerAll(handlers.orderedStream().toList());
        log.info("Creating QueryBus with timeout: {}, handlers: {}, caching: {}",
                properties.getQuery().getTimeout(), queryBus.getHandlerCount(), queryCache != null);
        return queryBus;
    }

    // ==================== Projections & Replay ====================

    @Bean
    @ConditionalOnProperty(prefix = "firefly.cqrs.projection", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ResearchWorkflowProjection researchWorkflowProjection(ReadModelStore readModelStore) {
        return new ResearchWorkflowProjection(readModelStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectionManager projectionManager(EventBus eventBus,
                                               ObjectProvider<Projection> projections,
                                               @Nullable CqrsMetrics metrics,
                                               CqrsProperties properties) {
        ProjectionManager manager = new ProjectionManager(eventBus, metrics);
        projections.orderedStream().forEach(manager::register);
        CqrsProperties.ProjectionConfig config = properties.getProjection();
        if (config.isEnabled() && config.isAutoStart()) {
            manager.start();
        }
        log.info("Creating ProjectionManager with projections: {}, running: {}",
                manager.getProjections().size(), manager.isRunning());
        return manager;
    }

    @Bean
    @ConditionalOnMissingBean
    public ReplayCheckpointStore replayCheckpointStore(CqrsProperties properties,
                                                       ObjectProvider<DatabaseClient> databaseClient,
                                                       ObjectProvider<ReactiveTransactionManager> transactionManager) {
        if (properties.getEventStore().getType() == StoreType.R2DBC) {
            DatabaseClient client = requireDatabaseClient(databaseClient, "replay checkpoints");
            return new R2dbcReplayCheckpointStore(client, transactionalOperator(client, transactionManager));
        }
        return new InMemoryReplayCheckpointStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReplayService replayService(EventStore eventStore,
                                       ReplayCheckpointStore checkpointStore,
                                       ProjectionManager projectionManager,
                                       ObjectProvider<ReplayHandler> replayHandlers,
                                       @Nullable CqrsMetrics metrics,
                                       CqrsProperties properties) {
        CqrsProperties.ReplayConfig config = properties.getReplay();
        log.info("Creating ReplayService with batchSize: {}, maxConcurrentStreams: {}, checkpointFrequency: {}",
                config.getBatchSize(), config.getMaxConcurrentStreams(), config.getCheckpointFrequency());
        ReplayService replayService = new ReplayService(eventStore, checkpointStore, config, metrics);
        replayService.registerHandler(new ProjectionReplayHandler(projectionManager));
        replayHandlers.orderedStream().forEach(replayService::registerHandler);
        return replayService;
    }

    /**
     * Service layer for CQRS operations.
     */
    @Bean
    @ConditionalOnMissingBean
    public CqrsService cqrsService(CommandBus commandBus, QueryBus queryBus, EventStore eventStore,
                                   ReadModelStore readModelStore, ProjectionManager projectionManager,
                                   ReplayService replayService, @Nullable CqrsMetrics metrics) {
        log.info("Creating CqrsService");
        return new CqrsService(commandBus, queryBus, eventStore, readModelStore, projectionManager,
                replayService, metrics);
    }

    // ==================== Health ====================

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(ReactiveHealthIndicator.class)
    @ConditionalOnProperty(prefix = "firefly.cqrs", name = "health-enabled", havingValue = "true", matchIfMissing = true)
    static class CqrsHealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public CqrsHealthIndicator cqrsHealthIndicator(EventStore eventStore, CommandBus commandBus,
                                                       QueryBus queryBus, ProjectionManager projectionManager,
                                                       ReplayService replayService) {
            log.info("Creating CqrsHealthIndicator");
            return new CqrsHealthIndicator(eventStore, commandBus, queryBus, projectionManager, replayService);
        }
    }

    // ==================== Helpers ====================

    private static DatabaseClient requireDatabaseClient(ObjectProvider<DatabaseClient> databaseClient, String component) {
        DatabaseClient client = databaseClient.getIfAvailable();
        if (client == null) {
            throw CqrsException.configuration("R2DBC " + component + " requires a DatabaseClient bean");
        }
        return client;
    }

    private static TransactionalOperator transactionalOperator(DatabaseClient client,
                                                               ObjectProvider<ReactiveTransactionManager> transactionManager) {
        ReactiveTransactionManager manager = transactionManager.getIfAvailable(
                () -> new R2dbcTransactionManager(client.getConnectionFactory()));
        return TransactionalOperator.create(manager);
    }
}
