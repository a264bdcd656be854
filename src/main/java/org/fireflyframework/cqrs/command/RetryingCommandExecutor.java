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


package org.fireflyframework.cqrs.command;

import org.fireflyframework.cqrs.resilience.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Re-runs a command through the {@link CommandBus} on retryable failures.
 * <p>
 * Each attempt is a full load, mutate and append cycle, so a retry after a
 * concurrency conflict works against the new stream head.
 */
@Slf4j
public class RetryingCommandExecutor {

    private final CommandBus commandBus;
    private final RetryPolicy retryPolicy;

    public RetryingCommandExecutor(CommandBus commandBus, RetryPolicy retryPolicy) {
        this.commandBus = commandBus;
        this.retryPolicy = retryPolicy;
    }

    public Mono<CommandResult> execute(Command command) {
        return attempt(command, 1);
    }

    private Mono<CommandResult> attempt(Command command, int attempt) {
        return commandBus.execute(command)
                .onErrorResume(error -> {
                    if (!retryPolicy.shouldRetry(attempt, error)) {
                        return Mono.error(error);
                    }
                    var delay = retryPolicy.calculateDelay(attempt - 1);
                    log.info("Retrying command {} [{}] after {} (attempt {}/{}): {}", command.commandName(),
                            command.commandId(), delay, attempt + 1, retryPolicy.maxAttempts(), error.getMessage());
                    return Mono.delay(delay).then(attempt(command, attempt + 1));
                });
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
}
