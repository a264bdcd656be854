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


package org.fireflyframework.cqrs.eventsourcing.aggregate;

import org.fireflyframework.cqrs.eventsourcing.event.AbstractDomainEvent;
import org.fireflyframework.cqrs.exception.CqrsException;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Base class for event-sourced aggregates.
 * <p>
 * State is derived only by applying events. Subclasses declare one
 * {@code private void on(XEvent event)} method per event type they react to;
 * events without a matching handler are ignored but still advance the version.
 * Command methods validate the current state and then call
 * {@link #applyChange(AbstractDomainEvent)}, which applies the event immediately
 * and queues it as uncommitted.
 *
 * @param <S> the serializable state type captured by snapshots
 */
@Slf4j
public abstract class AggregateRoot<S> {

    private static final Map<Class<?>, Map<Class<?>, Method>> HANDLERS = new ConcurrentHashMap<>();

    private final UUID id;
    private final String aggregateType;
    private long version;
    private final List<AbstractDomainEvent> uncommittedEvents = new ArrayList<>();

    protected AggregateRoot(UUID id, String aggregateType) {
        if (id == null) {
            throw CqrsException.validation("Aggregate id cannot be null");
        }
        this.id = id;
        this.aggregateType = aggregateType;
    }

    public UUID getId() {
        return id;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    /**
     * The sequence number of the last applied event, 0 for a fresh aggregate.
     */
    public long getVersion() {
        return version;
    }

    // ========================================================================
    // Event application
    // ========================================================================

    /**
     * Validates a new event's payload, applies it and queues it for persistence.
     *
     * @throws CqrsException of type VALIDATION if the payload is malformed
     */
    protected void applyChange(AbstractDomainEvent event) {
        try {
            event.validate();
        } catch (IllegalArgumentException e) {
            throw CqrsException.validation(e.getMessage());
        }
        apply(event);
        uncommittedEvents.add(event);
    }

    /**
     * Folds one event into the state and advances the version. Never rejects an event.
     */
    public void apply(AbstractDomainEvent event) {
        Method handler = handlersOf(getClass()).get(event.getClass());
        if (handler != null) {
            invoke(handler, event);
        } else {
            log.debug("No handler for event {} on {}, ignoring", event.getEventType(), aggregateType);
        }
        version++;
    }

    /**
     * Rebuilds state from previously stored events.
     */
    public void loadFromHistory(Iterable<? extends AbstractDomainEvent> history) {
        for (AbstractDomainEvent event : history) {
            apply(event);
        }
    }

    /**
     * Seeds the aggregate with snapshot state at the given version.
     */
    public void restoreFromSnapshot(S state, long snapshotVersion) {
        restoreState(state);
        this.version = snapshotVersion;
        this.uncommittedEvents.clear();
    }

    /**
     * Returns the current state in its snapshot form.
     */
    public abstract S getState();

    protected abstract void restoreState(S state);

    /**
     * Checks structural invariants of the current state. The default accepts every state.
     *
     * @throws CqrsException if the state is inconsistent
     */
    public void validate() {
        // no structural invariants by default
    }

    // ========================================================================
    // Uncommitted events
    // ========================================================================

    public List<AbstractDomainEvent> getUncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    public int getUncommittedEventCount() {
        return uncommittedEvents.size();
    }

    /**
     * Clears the uncommitted events. Only called once the append has succeeded.
     */
    public void markEventsAsCommitted() {
        uncommittedEvents.clear();
    }

    // ========================================================================
    // Handler discovery
    // ========================================================================

    private void invoke(Method handler, AbstractDomainEvent event) {
        try {
            handler.invoke(this, event);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw CqrsException.internal("Event handler failed for " + event.getEventType(), cause);
        } catch (IllegalAccessException e) {
            throw CqrsException.internal("Event handler not accessible for " + event.getEventType(), e);
        }
    }

    private static Map<Class<?>, Method> handlersOf(Class<?> aggregateClass) {
        return HANDLERS.computeIfAbsent(aggregateClass, AggregateRoot::discoverHandlers);
    }

    private static Map<Class<?>, Method> discoverHandlers(Class<?> aggregateClass) {
        Map<Class<?>, Method> handlers = new HashMap<>();
        for (Class<?> type = aggregateClass; type != null && type != AggregateRoot.class; type = type.getSuperclass()) {
            for (Method method : type.getDeclaredMethods()) {
                if (isEventHandler(method)) {
                    method.setAccessible(true);
                    handlers.putIfAbsent(method.getParameterTypes()[0], method);
                }
            }
        }
        return Map.copyOf(handlers);
    }

    private static boolean isEventHandler(Method method) {
        return method.getName().equals("on")
                && method.getParameterCount() == 1
                && AbstractDomainEvent.class.isAssignableFrom(method.getParameterTypes()[0])
                && !Modifier.isStatic(method.getModifiers());
    }
}
