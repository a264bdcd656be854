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


package org.fireflyframework.cqrs.query;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.cqrs.H2TestDatabase;
import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.exception.ErrorType;
import org.fireflyframework.cqrs.metrics.CqrsMetrics;
import org.fireflyframework.cqrs.model.TaskStatus;
import org.fireflyframework.cqrs.model.WorkflowStatus;
import org.fireflyframework.cqrs.query.handler.GetResearchWorkflowHandler;
import org.fireflyframework.cqrs.query.handler.GetTasksByWorkflowHandler;
import org.fireflyframework.cqrs.query.handler.GetWorkflowListHandler;
import org.fireflyframework.cqrs.query.handler.GetWorkflowStatsHandler;
import org.fireflyframework.cqrs.query.handler.SearchWorkflowsHandler;
import org.fireflyframework.cqrs.readmodel.InMemoryReadModelStore;
import org.fireflyframework.cqrs.readmodel.ReadModelStore;
import org.fireflyframework.cqrs.readmodel.ResearchWorkflowReadModel;
import org.fireflyframework.cqrs.readmodel.TaskReadModel;
import org.fireflyframework.cqrs.readmodel.WorkflowProgress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.cqrs.TestFixtures.METHODOLOGY;
import static org.fireflyframework.cqrs.TestFixtures.RESULTS;

/**
 * Unit tests for {@link QueryBus} dispatch, caching and the read-side query handlers.
 */
class QueryBusTest {

    private final ObjectMapper objectMapper = H2TestDatabase.objectMapper();
    private ReadModelStore readModelStore;
    private CqrsMetrics metrics;
    private QueryBus queryBus;
    private QueryFactory queries;
    private ResearchWorkflowReadModel workflow;

    @BeforeEach
    void setUp() {
        readModelStore = new InMemoryReadModelStore();
        metrics = new CqrsMetrics(new SimpleMeterRegistry());
        queryBus = new QueryBus(objectMapper, Duration.ofSeconds(5), new QueryCache(objectMapper, 100),
                metrics, null);
        queryBus.registerAll(List.of(
                new GetResearchWorkflowHandler(readModelStore),
                new GetWorkflowListHandler(readModelStore),
                new GetWorkflowStatsHandler(readModelStore),
                new GetTasksByWorkflowHandler(readModelStore),
                new SearchWorkflowsHandler(readModelStore)));
        queries = new QueryFactory();

        UUID workflowId = UUID.randomUUID();
        Instant created = Instant.parse("2026-02-01T09:00:00Z");
        TaskReadModel task = TaskReadModel.builder()
                .id(UUID.randomUUID())
                .workflowId(workflowId)
                .taskType("search")
                .agentType("search-agent")
                .status(TaskStatus.COMPLETED)
                .createdAt(created)
                .completedAt(created.plusSeconds(90))
                .results(Map.of("hits", 3, "nested", Map.of("ok", true)))
                .durationSeconds(90L)
                .build();
        workflow = ResearchWorkflowReadModel.builder()
                .id(workflowId)
                .name("Quantum survey")
                .query("State of quantum error correction")
                .methodology(METHODOLOGY)
                .status(WorkflowStatus.COMPLETED)
                .createdAt(created)
                .startedAt(created.plusSeconds(5))
                .completedAt(created.plusSeconds(600))
                .updatedAt(created.plusSeconds(600))
                .results(RESULTS)
                .tasks(List.of(task))
                .progress(WorkflowProgress.of(List.of(task), created.plusSeconds(5), created.plusSeconds(600)))
                .lastAppliedSequence(5)
                .build();
        readModelStore.saveWorkflow(workflow).block();
    }

    // ========================================================================
    // Dispatch Tests
    // ========================================================================

    @Nested
    @DisplayName("Dispatch")
    class DispatchTests {

        @Test
        @DisplayName("execute should answer from the handler and then from the cache")
        void executeShouldCacheResults() {
            QueryResult<ResearchWorkflowReadModel> first =
                    queryBus.execute(queries.getResearchWorkflow(workflow.id())).block();
            QueryResult<ResearchWorkflowReadModel> second =
                    queryBus.execute(queries.getResearchWorkflow(workflow.id())).block();

            assertThat(first.fromCache()).isFalse();
            assertThat(first.result()).isEqualTo(workflow);
            assertThat(second.fromCache()).isTrue();
            assertThat(second.result()).isEqualTo(first.result());
            assertThat(metrics.getSnapshot().cacheHits()).isEqualTo(1);
            assertThat(metrics.getSnapshot().cacheMisses()).isEqualTo(1);
        }

        @Test
        @DisplayName("cached results should serialize to the same JSON as fresh ones")
        void cachedResultsShouldSerializeIdentically() throws Exception {
            ResearchWorkflowReadModel fresh = queryBus.executeForResult(queries.getResearchWorkflow(workflow.id()))
                    .block();
            ResearchWorkflowReadModel cached = queryBus.executeForResult(queries.getResearchWorkflow(workflow.id()))
                    .block();

            assertThat(objectMapper.writeValueAsString(cached)).isEqualTo(objectMapper.writeValueAsString(fresh));
        }

        @Test
        @DisplayName("changes to the read model should stay invisible until the cache entry is invalidated")
        void cacheShouldServeUntilInvalidated() {
            GetResearchWorkflowQuery query = queries.getResearchWorkflow(workflow.id());
            queryBus.execute(query).block();
            readModelStore.updateWorkflow(workflow.id(), current -> current.toBuilder().name("Renamed").build())
                    .block();

            StepVerifier.create(queryBus.executeForResult(queries.getResearchWorkflow(workflow.id()))
                            .map(ResearchWorkflowReadModel::name))
                    .expectNext("Quantum survey")
                    .verifyComplete();

            queryBus.invalidate(query);

            StepVerifier.create(queryBus.executeForResult(query).map(ResearchWorkflowReadModel::name))
                    .expectNext("Renamed")
                    .verifyComplete();
        }

        @Test
        @DisplayName("a missing workflow should fail with not found and not be cached")
        void missingWorkflowShouldNotBeCached() {
            UUID missing = UUID.randomUUID();

            StepVerifier.create(queryBus.execute(queries.getResearchWorkflow(missing)))
                    .expectErrorSatisfies(error -> {
                        CqrsException cqrs = (CqrsException) error;
                        assertThat(cqrs.getErrorType()).isEqualTo(ErrorType.NOT_FOUND);
                        assertThat(cqrs.getContext().component()).isEqualTo("query-bus");
                    })
                    .verify();
            assertThat(queryBus.getCache().size()).isZero();
            assertThat(metrics.getSnapshot().queriesFailed()).isEqualTo(1);
        }

        @Test
        @DisplayName("invalid queries should fail validation before dispatch")
        void invalidQueriesShouldFailValidation() {
            StepVerifier.create(queryBus.execute(queries.getWorkflowList(0, 10)))
                    .expectErrorSatisfies(error -> assertThat(((CqrsException) error).getErrorType())
                            .isEqualTo(ErrorType.QUERY_VALIDATION))
                    .verify();
            StepVerifier.create(queryBus.execute(queries.getWorkflowList(1, 10, null, null, "priority", "asc")))
                    .expectError(CqrsException.class)
                    .verify();
            StepVerifier.create(queryBus.execute(queries.searchWorkflows(" ", 1, 10, Map.of())))
                    .expectError(CqrsException.class)
                    .verify();
        }

        @Test
        @DisplayName("an unregistered query type should fail with query handler not found")
        void unregisteredQueryShouldFail() {
            QueryBus empty = new QueryBus(objectMapper, Duration.ofSeconds(1), null);

            StepVerifier.create(empty.execute(queries.getResearchWorkflow(workflow.id())))
                    .expectErrorSatisfies(error -> assertThat(((CqrsException) error).getErrorType())
                            .isEqualTo(ErrorType.QUERY_HANDLER_NOT_FOUND))
                    .verify();
        }

        @Test
        @DisplayName("slow handlers should time out")
        void slowHandlersShouldTimeOut() {
            QueryBus slow = new QueryBus(objectMapper, Duration.ofMillis(100), null);
            slow.register(new QueryHandler<GetResearchWorkflowQuery, ResearchWorkflowReadModel>() {
                @Override
                public Mono<ResearchWorkflowReadModel> handle(GetResearchWorkflowQuery query) {
                    return Mono.never();
                }

                @Override
                public Class<GetResearchWorkflowQuery> getQueryType() {
                    return GetResearchWorkflowQuery.class;
                }

                @Override
                public TypeReference<ResearchWorkflowReadModel> getResultType() {
                    return new TypeReference<>() {
                    };
                }
            });

            StepVerifier.create(slow.execute(queries.getResearchWorkflow(workflow.id())))
                    .expectErrorSatisfies(error -> assertThat(((CqrsException) error).getErrorType())
                            .isEqualTo(ErrorType.QUERY_TIMEOUT))
                    .verify();
        }
    }

    // ========================================================================
    // Handler Tests
    // ========================================================================

    @Nested
    @DisplayName("Handlers")
    class HandlerTests {

        @Test
        @DisplayName("getResearchWorkflow without tasks should strip the task list")
        void getWithoutTasksShouldStripTasks() {
            StepVerifier.create(queryBus.executeForResult(queries.getResearchWorkflow(workflow.id(), false)))
                    .assertNext(result -> {
                        assertThat(result.tasks()).isEmpty();
                        assertThat(result.progress().totalTasks()).isEqualTo(1);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("list, search, tasks and stats queries should reach the read model")
        void readQueriesShouldReachReadModel() {
            StepVerifier.create(queryBus.executeForResult(queries.getWorkflowList(1, 10)))
                    .assertNext(page -> assertThat(page.totalCount()).isEqualTo(1))
                    .verifyComplete();
            StepVerifier.create(queryBus.executeForResult(queries.searchWorkflows("quantum", 1, 10,
                            Map.of("status", "completed"))))
                    .assertNext(page -> assertThat(page.workflows()).hasSize(1))
                    .verifyComplete();
            StepVerifier.create(queryBus.executeForResult(queries.getTasksByWorkflow(workflow.id(),
                            TaskStatus.COMPLETED)))
                    .assertNext(tasks -> assertThat(tasks).singleElement()
                            .extracting(TaskReadModel::durationSeconds).isEqualTo(90L))
                    .verifyComplete();
            StepVerifier.create(queryBus.executeForResult(queries.getWorkflowStats(null, null, "month")))
                    .assertNext(stats -> {
                        assertThat(stats.totalWorkflows()).isEqualTo(1);
                        assertThat(stats.successRatePercentage()).isEqualTo(100.0);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("cache keys should distinguish query parameters")
        void cacheKeysShouldDistinguishParameters() {
            assertThat(queries.getResearchWorkflow(workflow.id(), true).cacheKey())
                    .isNotEqualTo(queries.getResearchWorkflow(workflow.id(), false).cacheKey());
            assertThat(queries.getWorkflowList(1, 10, WorkflowStatus.RUNNING, null, "NAME", "ASC").cacheKey())
                    .isEqualTo("workflow_list:1:10:running::name:asc");
            assertThat(queries.searchWorkflows("x", 1, 10, Map.of("b", "2", "a", "1")).cacheKey())
                    .isEqualTo(queries.searchWorkflows("x", 1, 10, Map.of("a", "1", "b", "2")).cacheKey());
        }
    }
}
