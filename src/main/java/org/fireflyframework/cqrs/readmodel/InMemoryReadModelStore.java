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


package org.fireflyframework.cqrs.readmodel;

import org.fireflyframework.cqrs.model.TaskStatus;
import org.fireflyframework.cqrs.model.WorkflowStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * {@link ReadModelStore} held in memory.
 * <p>
 * Writers take the write lock so list and statistics reads see a consistent set of views.
 */
@Slf4j
public class InMemoryReadModelStore implements ReadModelStore {

    private final ConcurrentHashMap<UUID, ResearchWorkflowReadModel> workflows = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile Instant lastUpdated;

    // ==================== Reads ====================

    @Override
    public Mono<ResearchWorkflowReadModel> getWorkflow(UUID workflowId) {
        return Mono.justOrEmpty(workflows.get(workflowId));
    }

    @Override
    public Mono<WorkflowListReadModel> listWorkflows(int page, int pageSize, @Nullable WorkflowStatus status,
                                                     @Nullable String search, String sortBy, String sortOrder) {
        return Mono.fromCallable(() -> {
            Predicate<ResearchWorkflowReadModel> filter = workflow -> status == null || workflow.status() == status;
            if (search != null && !search.isBlank()) {
                filter = filter.and(matchesTerm(search));
            }
            List<WorkflowSummary> matches = select(filter, comparator(sortBy, sortOrder));
            return WorkflowListReadModel.page(matches, page, pageSize);
        });
    }

    @Override
    public Mono<WorkflowListReadModel> searchWorkflows(String term, int page, int pageSize,
                                                       Map<String, String> filters) {
        return Mono.fromCallable(() -> {
            Predicate<ResearchWorkflowReadModel> filter = matchesTerm(term);
            String status = filters.get("status");
            if (status != null) {
                filter = filter.and(workflow -> workflow.status().name().equalsIgnoreCase(status));
            }
            String methodology = filters.get("methodology");
            if (methodology != null) {
                filter = filter.and(workflow -> workflow.methodology() != null
                        && methodology.equalsIgnoreCase(workflow.methodology().name()));
            }
            List<WorkflowSummary> matches = select(filter, comparator("created_at", "desc"));
            return WorkflowListReadModel.page(matches, page, pageSize);
        });
    }

    @Override
    public Mono<List<TaskReadModel>> getTasksByWorkflow(UUID workflowId, @Nullable TaskStatus status) {
        return Mono.fromCallable(() -> {
            ResearchWorkflowReadModel workflow = workflows.get(workflowId);
            if (workflow == null) {
                return List.<TaskReadModel>of();
            }
            return workflow.tasks().stream()
                    .filter(task -> status == null || task.status() == status)
                    .toList();
        });
    }

    @Override
    public Mono<WorkflowStatsReadModel> getWorkflowStats(@Nullable Instant from, @Nullable Instant to,
                                                         String groupBy) {
        return Mono.fromCallable(() -> {
            List<ResearchWorkflowReadModel> inRange = snapshot().stream()
                    .filter(workflow -> from == null || !workflow.createdAt().isBefore(from))
                    .filter(workflow -> to == null || !workflow.createdAt().isAfter(to))
                    .toList();
            return computeStats(inRange, groupBy);
        });
    }

    @Override
    public Mono<ReadModelStats> getStats() {
        return Mono.fromCallable(() -> {
            List<ResearchWorkflowReadModel> all = snapshot();
            long tasks = all.stream().mapToLong(workflow -> workflow.tasks().size()).sum();
            return new ReadModelStats(all.size(), tasks, lastUpdated);
        });
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    // ==================== Writes ====================

    @Override
    public Mono<Void> saveWorkflow(ResearchWorkflowReadModel workflow) {
        return Mono.fromRunnable(() -> write(() -> {
            workflows.put(workflow.id(), workflow);
            touch();
        }));
    }

    @Override
    public Mono<ResearchWorkflowReadModel> updateWorkflow(UUID workflowId,
                                                          UnaryOperator<ResearchWorkflowReadModel> update) {
        return Mono.fromCallable(() -> {
            lock.writeLock().lock();
            try {
                ResearchWorkflowReadModel updated = workflows.compute(workflowId, (id, current) -> {
                    ResearchWorkflowReadModel next = update.apply(current);
                    return next != null ? next : current;
                });
                touch();
                return updated;
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    @Override
    public Mono<Boolean> deleteWorkflow(UUID workflowId) {
        return Mono.fromCallable(() -> {
            lock.writeLock().lock();
            try {
                boolean removed = workflows.remove(workflowId) != null;
                if (removed) {
                    touch();
                }
                return removed;
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    @Override
    public Mono<Void> clear() {
        return Mono.fromRunnable(() -> write(() -> {
            int size = workflows.size();
            workflows.clear();
            touch();
            log.info("Cleared {} workflow read models", size);
        }));
    }

    // ==================== Helpers ====================

    private void write(Runnable action) {
        lock.writeLock().lock();
        try {
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void touch() {
        lastUpdated = Instant.now();
    }

    private List<ResearchWorkflowReadModel> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(workflows.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<WorkflowSummary> select(Predicate<ResearchWorkflowReadModel> filter,
                                         Comparator<ResearchWorkflowReadModel> order) {
        return snapshot().stream()
                .filter(filter)
                .sorted(order)
                .map(ResearchWorkflowReadModel::toSummary)
                .toList();
    }

    private static Predicate<ResearchWorkflowReadModel> matchesTerm(String term) {
        String needle = term.toLowerCase(Locale.ROOT);
        return workflow -> contains(workflow.name(), needle) || contains(workflow.query(), needle);
    }

    private static boolean contains(@Nullable String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    static Comparator<ResearchWorkflowReadModel> comparator(String sortBy, String sortOrder) {
        Comparator<ResearchWorkflowReadModel> order = switch (sortBy == null ? "created_at" : sortBy) {
            case "name" -> Comparator.comparing(
                    (ResearchWorkflowReadModel w) -> w.name() == null ? "" : w.name(), String.CASE_INSENSITIVE_ORDER);
            case "updated_at" -> Comparator.comparing(ResearchWorkflowReadModel::updatedAt,
                    Comparator.nullsFirst(Comparator.naturalOrder()));
            case "status" -> Comparator.comparing(ResearchWorkflowReadModel::status);
            default -> Comparator.comparing(ResearchWorkflowReadModel::createdAt,
                    Comparator.nullsFirst(Comparator.naturalOrder()));
        };
        if ("desc".equalsIgnoreCase(sortOrder)) {
            order = order.reversed();
        }
        // stable pages for equal keys
        return order.thenComparing(ResearchWorkflowReadModel::id);
    }

    // ==================== Statistics ====================

    static WorkflowStatsReadModel computeStats(List<ResearchWorkflowReadModel> workflows, String groupBy) {
        Map<String, Long> byStatus = workflows.stream()
                .collect(Collectors.groupingBy(w -> w.status().name(), TreeMap::new, Collectors.counting()));

        Map<Instant, Long> byDate = workflows.stream()
                .collect(Collectors.groupingBy(w -> truncate(w.createdAt(), groupBy), TreeMap::new,
                        Collectors.counting()));
        List<WorkflowStatsReadModel.DateCount> dateCounts = byDate.entrySet().stream()
                .map(entry -> new WorkflowStatsReadModel.DateCount(entry.getKey(), entry.getValue()))
                .toList();

        double averageCompletion = workflows.stream()
                .filter(w -> w.status() == WorkflowStatus.COMPLETED && w.startedAt() != null && w.completedAt() != null)
                .mapToDouble(w -> Duration.between(w.startedAt(), w.completedAt()).toSeconds() / 60.0)
                .average()
                .orElse(0.0);

        return new WorkflowStatsReadModel(
                workflows.size(),
                byStatus,
                dateCounts,
                averageCompletion,
                successRate(workflows),
                methodologyCounts(workflows),
                taskStatistics(workflows));
    }

    private static double successRate(List<ResearchWorkflowReadModel> workflows) {
        long completed = workflows.stream().filter(w -> w.status() == WorkflowStatus.COMPLETED).count();
        long failed = workflows.stream().filter(w -> w.status() == WorkflowStatus.FAILED).count();
        return completed + failed > 0 ? completed * 100.0 / (completed + failed) : 0.0;
    }

    private static List<WorkflowStatsReadModel.MethodologyCount> methodologyCounts(
            List<ResearchWorkflowReadModel> workflows) {
        Map<String, List<ResearchWorkflowReadModel>> byMethodology = workflows.stream()
                .filter(w -> w.methodology() != null)
                .collect(Collectors.groupingBy(w -> w.methodology().name(), TreeMap::new, Collectors.toList()));
        return byMethodology.entrySet().stream()
                .map(entry -> new WorkflowStatsReadModel.MethodologyCount(
                        entry.getKey(), entry.getValue().size(), successRate(entry.getValue())))
                .sorted(Comparator.comparingLong(WorkflowStatsReadModel.MethodologyCount::count).reversed()
                        .thenComparing(WorkflowStatsReadModel.MethodologyCount::methodology))
                .toList();
    }

    private static TaskStatistics taskStatistics(List<ResearchWorkflowReadModel> workflows) {
        List<TaskReadModel> tasks = workflows.stream()
                .flatMap(w -> w.tasks().stream())
                .toList();
        Map<String, Long> byType = countBy(tasks, TaskReadModel::taskType);
        Map<String, Long> byAgent = countBy(tasks, TaskReadModel::agentType);
        double averageDuration = tasks.stream()
                .map(TaskReadModel::durationSeconds)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average()
                .orElse(0.0);
        long completed = tasks.stream().filter(task -> task.status() == TaskStatus.COMPLETED).count();
        double taskSuccessRate = tasks.isEmpty() ? 0.0 : completed * 100.0 / tasks.size();
        return new TaskStatistics(tasks.size(), byType, byAgent, averageDuration, taskSuccessRate);
    }

    private static Map<String, Long> countBy(List<TaskReadModel> tasks, Function<TaskReadModel, String> key) {
        return tasks.stream()
                .filter(task -> key.apply(task) != null)
                .collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }

    static Instant truncate(Instant timestamp, String groupBy) {
        ZonedDateTime day = timestamp.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS);
        return switch (groupBy == null ? "day" : groupBy) {
            case "week" -> day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toInstant();
            case "month" -> day.withDayOfMonth(1).toInstant();
            default -> day.toInstant();
        };
    }

    int size() {
        return workflows.size();
    }
}
