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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.UUID;

/**
 * Base class for all domain events.
 * <p>
 * An event is an immutable fact about one aggregate. The event type tag is
 * taken from the subclass's {@link JsonTypeName} annotation, which is also the
 * name under which the class is registered in the {@link EventTypeRegistry}.
 * Sequence numbers are not part of the event: they are assigned by the event
 * store at append time and travel on the stored envelope.
 */
@SuperBuilder
@Getter
@NoArgsConstructor
@AllArgsConstructor
public abstract class AbstractDomainEvent {

    /**
     * The identifier of the aggregate (stream) this event belongs to.
     */
    private UUID aggregateId;

    /**
     * When the event occurred. Event handlers must use this instead of the clock.
     */
    @Builder.Default
    private Instant eventTimestamp = Instant.now();

    /**
     * Correlation id for tracing a request across commands and events.
     */
    private UUID correlationId;

    /**
     * Id of the command or event that caused this event.
     */
    private UUID causationId;

    /**
     * Schema version of the payload.
     */
    @Builder.Default
    private int eventVersion = 1;

    /**
     * Returns the event type tag declared by {@link JsonTypeName}.
     */
    @JsonIgnore
    public String getEventType() {
        return eventTypeOf(getClass());
    }

    /**
     * Checks the payload's structural rules. The default accepts every event.
     *
     * @throws IllegalArgumentException if the payload is malformed
     */
    public void validate() {
        // no structural rules by default
    }

    /**
     * Resolves the type tag of an event class.
     */
    public static String eventTypeOf(Class<?> eventClass) {
        JsonTypeName typeName = eventClass.getAnnotation(JsonTypeName.class);
        return typeName != null ? typeName.value() : eventClass.getSimpleName();
    }

    protected static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be empty");
        }
    }
}
