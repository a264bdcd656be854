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

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process publication of appended events to live subscribers.
 * <p>
 * Subscribers run one after another. A failing subscriber is logged and the
 * remaining subscribers still receive the events; publication never fails the
 * append that triggered it.
 */
@Slf4j
public class EventBus {

    private final List<EventSubscriber> subscribers = new CopyOnWriteArrayList<>();

    public void subscribe(EventSubscriber subscriber) {
        subscribers.add(subscriber);
        log.debug("EventBus subscriber added, total={}", subscribers.size());
    }

    public void unsubscribe(EventSubscriber subscriber) {
        subscribers.remove(subscriber);
        log.debug("EventBus subscriber removed, total={}", subscribers.size());
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    public Mono<Void> publish(List<StoredEvent> events) {
        if (events.isEmpty() || subscribers.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(List.copyOf(subscribers))
                .concatMap(subscriber -> Mono.defer(() -> subscriber.onEvents(events))
                        .onErrorResume(error -> {
                            log.warn("Event subscriber {} failed for stream {}: {}",
                                    subscriber.getClass().getSimpleName(),
                                    events.get(0).streamId(), error.getMessage());
                            return Mono.empty();
                        }))
                .then();
    }
}
