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


package org.fireflyframework.cqrs.command;

import org.fireflyframework.cqrs.exception.CqrsException;

import java.util.UUID;

/**
 * A command addressed to a research workflow.
 */
public interface WorkflowCommand extends Command {

    UUID workflowId();

    @Override
    default UUID aggregateId() {
        return workflowId();
    }

    @Override
    default void validate() {
        if (commandId() == null) {
            throw CqrsException.validation("Command id cannot be null");
        }
        if (workflowId() == null) {
            throw CqrsException.validation("Workflow id cannot be null");
        }
    }

    static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw CqrsException.validation(field + " cannot be empty");
        }
    }
}
