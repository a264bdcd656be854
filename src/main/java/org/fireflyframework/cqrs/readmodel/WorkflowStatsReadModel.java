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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated workflow statistics.
 *
 * @param totalWorkflows               workflows in the requested range
 * @param workflowsByStatus            count per status name
 * @param workflowsByDate              creation counts per period, oldest first
 * @param averageCompletionTimeMinutes mean start-to-completion time of completed workflows
 * @param successRatePercentage        completed workflows as a percentage of finished ones
 * @param mostCommonMethodologies      methodologies by usage, most used first
 * @param taskStatistics               task figures
 */
public record WorkflowStatsReadModel(
        long totalWorkflows,
        Map<String, Long> workflowsByStatus,
        List<DateCount> workflowsByDate,
        double averageCompletionTimeMinutes,
        double successRatePercentage,
        List<MethodologyCount> mostCommonMethodologies,
        TaskStatistics taskStatistics
) {

    public record DateCount(Instant date, long count) {
    }

    public record MethodologyCount(String methodology, long count, double successRate) {
    }
}
