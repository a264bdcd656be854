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

import org.fireflyframework.cqrs.command.CompleteTaskCommand;
import org.fireflyframework.cqrs.eventsourcing.aggregate.ResearchWorkflowAggregate;
import org.fireflyframework.cqrs.eventsourcing.repository.AggregateRepository;

/**
 * Completes a task. Fails with NOT_FOUND for an unknown task and CONFLICT if it is already completed.
 */
public class CompleteTaskHandler extends AbstractWorkflowCommandHandler<CompleteTaskCommand> {

    public CompleteTaskHandler(AggregateRepository<ResearchWorkflowAggregate> repository) {
        super(repository);
    }

    @Override
    protected void apply(ResearchWorkflowAggregate aggregate, CompleteTaskCommand command) {
        aggregate.completeTask(command.taskId(), command.results());
    }

    @Override
    public Class<CompleteTaskCommand> getCommandType() {
        return CompleteTaskCommand.class;
    }
}
