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


package org.fireflyframework.cqrs.eventsourcing.snapshot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Periodically applies snapshot retention to every stream that has snapshots.
 */
@Slf4j
public class SnapshotCleanupService implements DisposableBean {

    private final SnapshotStore snapshotStore;
    private final Duration cleanupInterval;
    private volatile Disposable subscription;

    public SnapshotCleanupService(SnapshotStore snapshotStore, Duration cleanupInterval) {
        this.snapshotStore = snapshotStore;
        this.cleanupInterval = cleanupInterval;
    }

    /**
     * Starts the cleanup loop. Subsequent calls while running are no-ops.
     */
    public void start() {
        if (isRunning()) {
            log.debug("SnapshotCleanupService already running");
            return;
        }

        log.info("Starting SnapshotCleanupService with cleanupInterval={}", cleanupInterval);

        subscription = Flux.interval(cleanupInterval)
                .flatMap(tick -> cleanupAll(), 1)
                .onErrorResume(error -> {
                    log.error("Error in snapshot cleanup loop: {}", error.getMessage());
                    return Mono.empty();
                })
                .subscribe();
    }

    public void stop() {
        if (isRunning()) {
            log.info("Stopping SnapshotCleanupService");
            subscription.dispose();
        }
    }

    public boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }

    @Override
    public void destroy() {
        stop();
    }

    /**
     * Runs retention over all streams once.
     *
     * @return the total number of snapshots deleted
     */
    public Mono<Long> cleanupAll() {
        return snapshotStore.getSnapshotStreamIds()
                .concatMap(streamId -> snapshotStore.cleanupOldSnapshots(streamId)
                        .onErrorResume(error -> {
                            log.warn("Snapshot cleanup failed for stream {}: {}", streamId, error.getMessage());
                            return Mono.just(0L);
                        }))
                .reduce(0L, Long::sum)
                .doOnNext(deleted -> {
                    if (deleted > 0) {
                        log.info("Snapshot cleanup removed {} snapshots", deleted);
                    }
                });
    }
}
