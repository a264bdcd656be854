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


package org.fireflyframework.cqrs.replay;

import org.fireflyframework.cqrs.eventsourcing.store.StoredEvent;
import org.fireflyframework.cqrs.projection.ProjectionManager;
import reactor.core.publisher.Mono;

/**
 * Feeds replayed events to the registered projections. A projection failure
 * fails the stream being replayed.
 */
public class ProjectionReplayHandler implements ReplayHandler {

    private final ProjectionManager projectionManager;

    public ProjectionReplayHandler(ProjectionManager projectionManager) {
        this.projectionManager = projectionManager;
    }

    @Override
    public String getName() {
        return "projections";
    }

    @Override
    public boolean handles(String eventType) {
        return projectionManager.getProjections().stream()
                .anyMatch(projection -> projection.handles(eventType));
    }

    @Override
    public Mono<Void> handleEvent(StoredEvent event) {
        return projectionManager.project(event, true);
    }
}
