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

import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.exception.ErrorContext;
import org.fireflyframework.cqrs.metrics.CqrsMetrics;
import org.fireflyframework.cqrs.resilience.CqrsResilience;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes each command to the single handler registered for its class.
 * <p>
 * Every failure reaches the caller as a {@link CqrsException} carrying an
 * {@link ErrorContext}; unexpected throwables become INTERNAL errors.
 * {@link #executeSafely(Command)} turns failures into failed {@link CommandResult}s instead.
 */
@Slf4j
public class CommandBus {

    static final String COMPONENT = "command-bus";

    private final Map<Class<?>, CommandHandler<?>> handlers = new ConcurrentHashMap<>();
    private final Duration timeout;
    private final boolean validationEnabled;
    private final CqrsMetrics metrics;
    private final CqrsResilience resilience;

    public CommandBus(Duration timeout) {
        this(timeout, true, null, null);
    }

    public CommandBus(Duration timeout, boolean validationEnabled,
                      @Nullable CqrsMetrics metrics, @Nullable CqrsResilience resilience) {
        this.timeout = timeout;
        this.validationEnabled = validationEnabled;
        this.metrics = metrics;
        this.resilience = resilience;
    }

    // ==================== Registration ====================

    public <C extends Command> void register(CommandHandler<C> handler) {
        register(handler.getCommandType(), handler);
    }

    /**
     * Registers a handler under an explicit command class.
     *
     * @throws CqrsException of type CONFIGURATION if another handler is registered for the class
     */
    public void register(Class<? extends Command> commandType, CommandHandler<?> handler) {
        CommandHandler<?> existing = handlers.putIfAbsent(commandType, handler);
        if (existing != null && existing != handler) {
            throw CqrsException.configuration("A handler is already registered for "
                    + commandType.getSimpleName() + ": " + existing.getClass().getSimpleName());
        }
        log.info("Registered command handler {} for {}", handler.getClass().getSimpleName(),
                commandType.getSimpleName());
    }

    public void registerAll(Collection<? extends CommandHandler<?>> commandHandlers) {
        commandHandlers.forEach(handler -> register(handler.getCommandType(), handler));
    }

    public boolean hasHandler(Class<? extends Command> commandType) {
        return handlers.containsKey(commandType);
    }

    public Set<Class<?>> getRegisteredCommandTypes() {
        return Set.copyOf(handlers.keySet());
    }

    public int getHandlerCount() {
        return handlers.size();
    }

    // ==================== Execution ====================

    /**
     * Validates and dispatches a command.
     *
     * @return the handler's result, with the measured execution time
     */
    public Mono<CommandResult> execute(Command command) {
        String name = command.commandName();
        return Mono.defer(() -> {
            long start = System.nanoTime();
            Mono<CommandResult> dispatch = Mono.defer(() -> {
                if (validationEnabled) {
                    command.validate();
                }
                return resolve(command).flatMap(handler -> invoke(handler, command));
            });
            if (resilience != null) {
                dispatch = resilience.decorateCommand(name, dispatch);
            }
            return dispatch
                    .timeout(timeout, Mono.error(() -> CqrsException.commandTimeout(name + " exceeded " + timeout)))
                    .switchIfEmpty(Mono.error(() -> CqrsException.internal(name + " handler returned no result", null)))
                    .map(result -> result.withExecutionTime(elapsed(start).toMillis()))
                    .doOnNext(result -> {
                        log.debug("Command {} [{}] executed: aggregate={}, version={}",
                                name, command.commandId(), result.aggregateId(), result.version());
                        if (metrics != null) {
                            metrics.recordCommandExecuted(name, elapsed(start));
                        }
                    })
                    .onErrorMap(error -> withContext(error, command))
                    .doOnError(CqrsException.class, error -> {
                        if (metrics != null) {
                            metrics.recordCommandFailed(name, error.getErrorType(), elapsed(start));
                        }
                    });
        });
    }

    /**
     * Executes a command and reports failures as a failed {@link CommandResult}.
     */
    public Mono<CommandResult> executeSafely(Command command) {
        return execute(command)
                .onErrorResume(CqrsException.class, error ->
                        Mono.just(CommandResult.failure(command.commandId(), error)));
    }

    private Mono<CommandHandler<?>> resolve(Command command) {
        CommandHandler<?> handler = handlers.get(command.getClass());
        if (handler == null) {
            return Mono.error(CqrsException.handlerNotFound(command.commandName()));
        }
        if (!handler.getCommandType().isInstance(command)) {
            return Mono.error(CqrsException.handlerCast(handler.getClass().getSimpleName()
                    + " cannot handle " + command.getClass().getSimpleName()));
        }
        return Mono.just(handler);
    }

    @SuppressWarnings("unchecked")
    private static <C extends Command> Mono<CommandResult> invoke(CommandHandler<C> handler, Command command) {
        return handler.handle((C) command);
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private CqrsException withContext(Throwable error, Command command) {
        ErrorContext context = ErrorContext.of(command.commandName(), COMPONENT, command.correlationId());
        if (error instanceof CqrsException cqrs) {
            log.warn("Command {} [{}] failed: {}", command.commandName(), command.commandId(), cqrs.getMessage());
            return cqrs.withContext(context);
        }
        log.error("Unexpected error executing command {} [{}] ({})", command.commandName(),
                command.commandId(), context, error);
        return CqrsException.internal("Unexpected error executing " + command.commandName(), error)
                .withContext(context);
    }
}
