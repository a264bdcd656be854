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


package org.fireflyframework.cqrs.config;

import org.fireflyframework.cqrs.metrics.CqrsMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for CQRS metrics using Micrometer.
 * <p>
 * Meters are published under {@code firefly.cqrs.*}: commands, queries, query cache,
 * projections and replay. Without a {@link MeterRegistry} bean the metrics are kept
 * in a local {@link SimpleMeterRegistry} so {@link CqrsMetrics#getSnapshot()} still works.
 * <pre>
 * firefly:
 *   cqrs:
 *     metrics-enabled: true  # Enable/disable metrics (default: true)
 * </pre>
 */
@Slf4j
@AutoConfiguration(before = CqrsAutoConfiguration.class)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnProperty(prefix = "firefly.cqrs", name = {"enabled", "metrics-enabled"}, havingValue = "true",
        matchIfMissing = true)
public class CqrsMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CqrsMetrics cqrsMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        log.info("Configuring CqrsMetrics with Micrometer MeterRegistry");
        return new CqrsMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }
}
