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
 * The closed set of failures the CQRS core can report.
 * <p>
 * Each type fixes its {@link ErrorCategory}, an HTTP-equivalent status code,
 * a {@link ErrorSeverity} and whether a caller may retry the operation.
 */
public enum ErrorType {

    VALIDATION("Command validation failed", ErrorCategory.VALIDATION, 400, ErrorSeverity.LOW, false),
    QUERY_VALIDATION("Query validation failed", ErrorCategory.VALIDATION, 400, ErrorSeverity.LOW, false),
    HANDLER_NOT_FOUND("Command handler not found", ErrorCategory.CONFIGURATION, 501, ErrorSeverity.HIGH, false),
    QUERY_HANDLER_NOT_FOUND("Query handler not found", ErrorCategory.CONFIGURATION, 501, ErrorSeverity.HIGH, false),
    HANDLER_CAST("Handler type mismatch", ErrorCategory.INTERNAL, 500, ErrorSeverity.CRITICAL, false),
    COMMAND_TIMEOUT("Command execution timeout", ErrorCategory.PERFORMANCE, 408, ErrorSeverity.MEDIUM, true),
    QUERY_TIMEOUT("Query execution timeout", ErrorCategory.PERFORMANCE, 408, ErrorSeverity.MEDIUM, true),
    DATABASE("Database error", ErrorCategory.INFRASTRUCTURE, 500, ErrorSeverity.HIGH, true),
    EVENT_STORE("Event store error", ErrorCategory.INFRASTRUCTURE, 500, ErrorSeverity.HIGH, true),
    SERIALIZATION("Serialization error", ErrorCategory.DATA, 500, ErrorSeverity.MEDIUM, false),
    PROJECTION("Projection error", ErrorCategory.PROCESSING, 500, ErrorSeverity.MEDIUM, false),
    READ_MODEL("Read model error", ErrorCategory.DATA, 500, ErrorSeverity.MEDIUM, false),
    SNAPSHOT("Snapshot error", ErrorCategory.INFRASTRUCTURE, 500, ErrorSeverity.MEDIUM, false),
    CACHE("Cache error", ErrorCategory.INFRASTRUCTURE, 500, ErrorSeverity.LOW, false),
    CONFIGURATION("Configuration error", ErrorCategory.CONFIGURATION, 500, ErrorSeverity.HIGH, false),
    CONCURRENCY_CONFLICT("Concurrency conflict", ErrorCategory.CONCURRENCY, 409, ErrorSeverity.MEDIUM, true),
    AUTHORIZATION("Authorization error", ErrorCategory.SECURITY, 403, ErrorSeverity.MEDIUM, false),
    NOT_FOUND("Resource not found", ErrorCategory.NOT_FOUND, 404, ErrorSeverity.LOW, false),
    CONFLICT("Resource conflict", ErrorCategory.BUSINESS, 409, ErrorSeverity.MEDIUM, false),
    RATE_LIMIT_EXCEEDED("Rate limit exceeded", ErrorCategory.RATE_LIMIT, 429, ErrorSeverity.LOW, true),
    SERVICE_UNAVAILABLE("Service unavailable", ErrorCategory.INFRASTRUCTURE, 503, ErrorSeverity.HIGH, true),
    INTERNAL("Internal error", ErrorCategory.INTERNAL, 500, ErrorSeverity.CRITICAL, false);

    private final String title;
    private final ErrorCategory category;
    private final int httpStatus;
    private final ErrorSeverity severity;
    private final boolean retryable;

    ErrorType(String title, ErrorCategory category, int httpStatus, ErrorSeverity severity, boolean retryable) {
        this.title = title;
        this.category = category;
        this.httpStatus = httpStatus;
        this.severity = severity;
        this.retryable = retryable;
    }

    public String getTitle() {
        return title;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public ErrorSeverity getSeverity() {
        return severity;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
