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


package org.fireflyframework.cqrs.query.handler;

import org.fireflyframework.cqrs.query.QueryHandler;
import org.fireflyframework.cqrs.query.SearchWorkflowsQuery;
import org.fireflyframework.cqrs.readmodel.ReadModelStore;
import org.fireflyframework.cqrs.readmodel.WorkflowListReadModel;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

@RequiredArgsConstructor
public class SearchWorkflowsHandler implements QueryHandler<SearchWorkflowsQuery, WorkflowListReadModel> {

    private final ReadModelStore readModelStore;

    @Override
    public Mono<WorkflowListReadModel> handle(SearchWorkflowsQuery query) {
        return readModelStore.searchWorkflows(query.searchTerm(), query.page(), query.pageSize(), query.filters());
    }

    @Override
    public Class<SearchWorkflowsQuery> getQueryType() {
        return SearchWorkflowsQuery.class;
    }

    @Override
    public TypeReference<WorkflowListReadModel> getResultType() {
        return new TypeReference<WorkflowListReadModel>() {
        };
    }
}
