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


package org.fireflyframework.cqrs.model;

import java.time.Instant;
import java.util.List;

/**
 * Final results of a completed research workflow.
 */
public record ResearchResults(
        String summary,
        List<Finding> findings,
        List<Source> sources,
        double confidenceScore,
        int completionTimeMinutes) {

    public ResearchResults {
        findings = findings != null ? List.copyOf(findings) : List.of();
        sources = sources != null ? List.copyOf(sources) : List.of();
    }

    /**
     * A single research finding.
     */
    public record Finding(String title, String content, double confidence, List<String> sources) {

        public Finding {
            sources = sources != null ? List.copyOf(sources) : List.of();
        }
    }

    /**
     * A source consulted during research.
     */
    public record Source(String url, String title, double relevanceScore, Instant accessedAt) {
    }
}
