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


package org.fireflyframework.cqrs.eventsourcing.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only envelope stored with every event.
 * <p>
 * Sequence numbers are contiguous per stream, starting at 1.
 *
 * @param eventId        globally unique event id
 * @param streamId       the aggregate (stream) id
 * @param eventType      the event type tag
 * @param eventVersion   payload schema version
 * @param sequenceNumber position of the event in its stream
 * @param timestamp      when the event was appended
 * @param correlationId  correlation id, may be null
 * @param causationId    causation id, may be null
 */
public record EventMetadata(
        UUID eventId,
        UUID streamId,
        String eventType,
        int eventVersion,
        long sequenceNumber,
        Instant timestamp,
        UUID correlationId,
        UUID causationId) {

    /**
     * Builds the metadata for an event about to be stored at the given sequence number.
     */
    public static EventMetadata forEvent(UUID streamId, AbstractDomainEvent event, long sequenceNumber) {
        return new EventMetadata(
                UUID.randomUUID(),
                streamId,
                event.getEventType(),
                event.getEventVersion(),
                sequenceNumber,
                Instant.now(),
                event.getCorrelationId(),
                event.getCausationId());
    }
}
