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

import java.util.UUID;

/**
 * Thrown when an append's expected version does not match the stream head.
 * <p>
 * Retryable: the caller reloads the aggregate at the new head and re-runs the command.
 */
public class ConcurrencyConflictException extends CqrsException {

    private final UUID streamId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(UUID streamId, long expectedVersion, long actualVersion) {
        super(ErrorType.CONCURRENCY_CONFLICT,
                "stream " + streamId + " expected version " + expectedVersion
                        + ", actual version " + actualVersion);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public UUID getStreamId() {
        return streamId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
