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

package org.fireflyframework.cqrs.exception;

/**
 * Base exception for every failure surfaced by the CQRS core.
 * <p>
 * The {@link ErrorType} determines category, HTTP-equivalent status, severity
 * and retryability. The command and query buses attach an {@link ErrorContext}
 * before propagating the error; they never swallow it.
 */
public class CqrsException extends RuntimeException {

    private final ErrorType errorType;
    private volatile ErrorContext context;

    public CqrsException(ErrorType errorType, String message) {
        super(errorType.getTitle() + ": " + message);
        this.errorType = errorType;
    }

    public CqrsException(ErrorType errorType, String message, Throwable cause) {
        super(errorType.getTitle() + ": " + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public ErrorCategory getCategory() {
        return errorType.getCategory();
    }

    public int getHttpStatus() {
        return errorType.getHttpStatus();
    }

    public ErrorSeverity getSeverity() {
        return errorType.getSeverity();
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }

    public ErrorContext getContext() {
        return context;
    }

    /**
     * Attaches observability context. The first context wins so that the
     * innermost component reporting the failure is preserved.
     */
    public CqrsException withContext(ErrorContext context) {
        if (this.context == null) {
            this.context = context;
        }
        return this;
    }

    /**
     * Returns {@code true} if the given throwable is a retryable CQRS failure.
     */
    public static boolean isRetryable(Throwable error) {
        return error instanceof CqrsException cqrs && cqrs.isRetryable();
    }

    // ==================== Factories ====================

    public static CqrsException validation(String message) {
        return new CqrsException(ErrorType.VALIDATION, message);
    }

    public static CqrsException queryValidation(String message) {
        return new CqrsException(ErrorType.QUERY_VALIDATION, message);
    }

    public static CqrsException handlerNotFound(String commandName) {
        return new CqrsException(ErrorType.HANDLER_NOT_FOUND, commandName);
    }

    public static CqrsException queryHandlerNotFound(String queryName) {
        return new CqrsException(ErrorType.QUERY_HANDLER_NOT_FOUND, queryName);
    }

    public static CqrsException handlerCast(String name) {
        return new CqrsException(ErrorType.HANDLER_CAST, name);
    }

    public static CqrsException commandTimeout(String commandName) {
        return new CqrsException(ErrorType.COMMAND_TIMEOUT, commandName);
    }

    public static CqrsException queryTimeout(String queryName) {
        return new CqrsException(ErrorType.QUERY_TIMEOUT, queryName);
    }

    public static CqrsException database(String message, Throwable cause) {
        return new CqrsException(ErrorType.DATABASE, message, cause);
    }

    public static CqrsException eventStore(String message) {
        return new CqrsException(ErrorType.EVENT_STORE, message);
    }

    public static CqrsException serialization(String message, Throwable cause) {
        return new CqrsException(ErrorType.SERIALIZATION, message, cause);
    }

    public static CqrsException projection(String message, Throwable cause) {
        return new CqrsException(ErrorType.PROJECTION, message, cause);
    }

    public static CqrsException readModel(String message) {
        return new CqrsException(ErrorType.READ_MODEL, message);
    }

    public static CqrsException snapshot(String message, Throwable cause) {
        return new CqrsException(ErrorType.SNAPSHOT, message, cause);
    }

    public static CqrsException cache(String message, Throwable cause) {
        return new CqrsException(ErrorType.CACHE, message, cause);
    }

    public static CqrsException configuration(String message) {
        return new CqrsException(ErrorType.CONFIGURATION, message);
    }

    public static CqrsException notFound(String resource) {
        return new CqrsException(ErrorType.NOT_FOUND, resource);
    }

    public static CqrsException conflict(String message) {
        return new CqrsException(ErrorType.CONFLICT, message);
    }

    public static CqrsException rateLimitExceeded(String message, Throwable cause) {
        return new CqrsException(ErrorType.RATE_LIMIT_EXCEEDED, message, cause);
    }

    public static CqrsException serviceUnavailable(String message, Throwable cause) {
        return new CqrsException(ErrorType.SERVICE_UNAVAILABLE, message, cause);
    }

    public static CqrsException internal(String message, Throwable cause) {
        return new CqrsException(ErrorType.INTERNAL, message, cause);
    }
}
