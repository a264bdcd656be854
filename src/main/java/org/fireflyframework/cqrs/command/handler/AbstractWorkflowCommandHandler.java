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
import org.fireflyframework.cqrs.command.WorkflowCommand;
import org.fireflyframework.cqrs.eventsourcing.aggregate.ResearchWorkflowAggregate;
import org.fireflyframework.cqrs.eventsourcing.repository.AggregateRepository;
import reactor.core.publisher.Mono;

/**
 * Load, mutate, append for commands on an existing research workflow.
 * <p>
 * The aggregate is loaded at the stream head, the mutation runs against it, and
 * the new events are appended expecting that head. If the mutation throws,
 * nothing is appended.
 *
 * @param <C> the command type
 */
public abstract class AbstractWorkflowCommandHandler<C extends WorkflowCommand> implements CommandHandler<C> {

    protected final AggregateRepository<ResearchWorkflowAggregate> repository;

    protected AbstractWorkflowCommandHandler(AggregateRepository<ResearchWorkflowAggregate> repository) {
        this.repository = repository;
    }

    @Override
    public Mono<CommandResult> handle(C command) {
        return repository.load(command.workflowId())
                .flatMap(aggregate -> Mono.fromCallable(() -> {
                    apply(aggregate, command);
                    return aggregate;
                }))
                .flatMap(aggregate -> repository.save(aggregate)
                        .map(version -> CommandResult.success(command.commandId(), aggregate.getId(), version)));
    }

    /**
     * Invokes the intention method for the command.
     */
    protected abstract void apply(ResearchWorkflowAggregate aggregate, C command);
}
