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

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps event type tags to event classes so stored payloads can be deserialized.
 */
@Slf4j
public class EventTypeRegistry {

    private final Map<String, Class<? extends AbstractDomainEvent>> types = new ConcurrentHashMap<>();

    /**
     * Creates a registry pre-populated with the research workflow events.
     */
    public static EventTypeRegistry withResearchEvents() {
        EventTypeRegistry registry = new EventTypeRegistry();
        registry.registerAll(List.of(
                WorkflowCreatedEvent.class,
                ExecutionStartedEvent.class,
                TaskCreatedEvent.class,
                TaskCompletedEvent.class,
                ExecutionCompletedEvent.class,
                ExecutionFailedEvent.class,
                WorkflowUpdatedEvent.class));
        return registry;
    }

    public void register(Class<? extends AbstractDomainEvent> eventClass) {
        String eventType = AbstractDomainEvent.eventTypeOf(eventClass);
        Class<? extends AbstractDomainEvent> previous = types.putIfAbsent(eventType, eventClass);
        if (previous != null && previous != eventClass) {
            throw new IllegalStateException("Event type '" + eventType + "' is already registered to "
                    + previous.getName());
        }
        log.debug("Registered event type {} -> {}", eventType, eventClass.getSimpleName());
    }

    public void registerAll(Collection<Class<? extends AbstractDomainEvent>> eventClasses) {
        eventClasses.forEach(this::register);
    }

    public Optional<Class<? extends AbstractDomainEvent>> resolve(String eventType) {
        return Optional.ofNullable(types.get(eventType));
    }

    public Set<String> getEventTypes() {
        return Set.copyOf(types.keySet());
    }
}
