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


package org.fireflyframework.cqrs.eventsourcing.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.cqrs.eventsourcing.event.AbstractDomainEvent;
import org.fireflyframework.cqrs.eventsourcing.event.EventTypeRegistry;
import org.fireflyframework.cqrs.exception.CqrsException;
import lombok.RequiredArgsConstructor;

/**
 * Jackson-based (de)serialization of event payloads.
 * <p>
 * Payloads are written as plain JSON of the concrete event class; the type tag
 * is stored separately and resolved through the {@link EventTypeRegistry}.
 */
@RequiredArgsConstructor
public class EventSerializer {

    private final ObjectMapper objectMapper;
    private final EventTypeRegistry typeRegistry;

    public String serialize(AbstractDomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw CqrsException.serialization("Cannot serialize event " + event.getEventType(), e);
        }
    }

    public AbstractDomainEvent deserialize(String eventType, String payload) {
        Class<? extends AbstractDomainEvent> eventClass = typeRegistry.resolve(eventType)
                .orElseThrow(() -> CqrsException.serialization("Unknown event type: " + eventType, null));
        try {
            return objectMapper.readValue(payload, eventClass);
        } catch (JsonProcessingException e) {
            throw CqrsException.serialization("Corrupt payload for event type " + eventType, e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
