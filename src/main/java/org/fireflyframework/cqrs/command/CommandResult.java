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
import org.fireflyframework.cqrs.exception.ErrorCategory;
import org.fireflyframework.cqrs.exception.ErrorType;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a command.
 *
 * @param commandId       the command that was executed
 * @param aggregateId     the affected aggregate, null on failure
 * @param version         the aggregate's new version, null on failure
 * @param success         whether the command succeeded
 * @param message         failure description, null on success
 * @param errorType       failure type, null on success
 * @param executedAt      when the result was produced
 * @param executionTimeMs total execution time as measured by the bus
 */
public record CommandResult(
        UUID commandId,
        UUID aggregateId,
        Long version,
        boolean success,
        String message,
        ErrorType errorType,
        Instant executedAt,
        long executionTimeMs
) {

    public static CommandResult success(UUID commandId, UUID aggregateId, long version) {
        return new CommandResult(commandId, aggregateId, version, true, null, null, Instant.now(), 0);
    }

    public static CommandResult failure(UUID commandId, String message) {
        return new CommandResult(commandId, null, null, false, message, ErrorType.INTERNAL, Instant.now(), 0);
    }

    public static CommandResult failure(UUID commandId, CqrsException error) {
        return new CommandResult(commandId, null, null, false, error.getMessage(), error.getErrorType(),
                Instant.now(), 0);
    }

    public CommandResult withExecutionTime(long executionTimeMs) {
        return new CommandResult(commandId, aggregateId, version, success, message, errorType, executedAt,
                executionTimeMs);
    }

    public ErrorCategory errorCategory() {
        return errorType != null ? errorType.getCategory() : null;
    }

    public boolean retryable() {
        return errorType != null && errorType.isRetryable();
    }
}
