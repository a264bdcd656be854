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

import java.time.Instant;
import java.util.UUID;

/**
 * Observability context attached to a {@link CqrsException} by the bus layer.
 *
 * @param operation     the command or query name being executed
 * @param component     the component that observed the failure (e.g. "command-bus")
 * @param correlationId the correlation id of the request, may be null
 * @param timestamp     when the failure was observed
 */
public record ErrorContext(String operation, String component, UUID correlationId, Instant timestamp) {

    public static ErrorContext of(String operation, String component, UUID correlationId) {
        return new ErrorContext(operation, component, correlationId, Instant.now());
    }

    @Override
    public String toString() {
        return "operation=" + operation + ", component=" + component
                + ", correlationId=" + correlationId + ", timestamp=" + timestamp;
    }
}
