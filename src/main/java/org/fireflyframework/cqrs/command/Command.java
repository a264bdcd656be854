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

import org.springframework.lang.Nullable;

import java.util.UUID;

/**
 * An immutable intent to change one aggregate.
 */
public interface Command {

    UUID commandId();

    /**
     * The aggregate this command targets.
     */
    UUID aggregateId();

    @Nullable
    UUID correlationId();

    /**
     * Checks the command's shape before dispatch.
     *
     * @throws org.fireflyframework.cqrs.exception.CqrsException of type VALIDATION
     */
    default void validate() {
        // no rules by default
    }

    default String commandName() {
        String name = getClass().getSimpleName();
        return name.endsWith("Command") ? name.substring(0, name.length() - "Command".length()) : name;
    }
}
