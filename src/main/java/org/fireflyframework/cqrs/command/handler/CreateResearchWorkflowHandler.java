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


package org.fireflyframework.cqrs.command.handler;

import org.fireflyframework.cqrs.command.CommandHandler;
import org.fireflyframework.cqrs.command.CommandResult;
import org.fireflyframework.cqrs.command.CreateResearchWorkflowCommand;
import org.fireflyframework.cqrs.eventsourcing.aggregate.ResearchWorkflowAggregate;
import org.fireflyframework.cqrs.eventsourcing.repository.AggregateRepository;
import org.fireflyframework.cqrs.exception.CqrsException;
import reactor.core.publisher.Mono;

/**
 * Creates a new workflow on an empty stream.
 * <p>
 * The append expects version 0, so a concurrent creation of the same workflow
 * loses with a concurrency conflict.
 */
public class CreateResearchWorkflowHandler implements CommandHandler<CreateResearchWorkflowCommand> {

    private final AggregateRepository<ResearchWorkflowAggregate> repository;

    public CreateResearchWorkflowHandler(AggregateRepository<ResearchWorkflowAggregate> repository) {
        this.repository = repository;
    }

    @Override
    public Mono<CommandResult> handle(CreateResearchWorkflowCommand command) {
        return repository.exists(command.workflowId())
                .flatMap(exists -> exists
                        ? Mono.error(CqrsException.conflict("Workflow " + command.workflowId() + " already exists"))
                        : Mono.fromCallable(() -> ResearchWorkflowAggregate.create(command.workflowId(),
                                command.name(), command.query(), command.methodology(), command.correlationId())))
                .flatMap(aggregate -> repository.save(aggregate)
                        .map(version -> CommandResult.success(command.commandId(), aggregate.getId(), version)));
    }

    @Override
    public Class<CreateResearchWorkflowCommand> getCommandType() {
        return CreateResearchWorkflowCommand.class;
    }
}
