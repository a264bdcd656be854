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


package org.fireflyframework.cqrs.resilience;

import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.properties.CqrsProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for RetryPolicy.
 */
class RetryPolicyTest {

    @Test
    void shouldHaveDefaultPolicyConstant() {
        RetryPolicy policy = RetryPolicy.DEFAULT;

        assertThat(policy.maxAttempts()).isEqualTo(3);
        assertThat(policy.initialDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.multiplier()).isEqualTo(2.0);
    }

    @Test
    void shouldCalculateExponentialBackoffWithoutJitter() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofSeconds(10), 2.0, 0.0);

        assertThat(policy.calculateDelay(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.calculateDelay(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.calculateDelay(3)).isEqualTo(Duration.ofMillis(800));
    }

    @Test
    void shouldCapDelayAtMaxDelay() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0, 0.0);

        assertThat(policy.calculateDelay(9)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void shouldKeepJitterWithinBounds() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1000), Duration.ofSeconds(5), 2.0, 0.1);

        for (int i = 0; i < 50; i++) {
            assertThat(policy.calculateDelay(0).toMillis()).isBetween(900L, 1100L);
        }
    }

    @Test
    void shouldRetryOnlyRetryableErrorsUnderMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
        CqrsException transientError = CqrsException.serviceUnavailable("down", null);

        assertThat(policy.shouldRetry(1, transientError)).isTrue();
        assertThat(policy.shouldRetry(3, transientError)).isFalse();
        assertThat(policy.shouldRetry(1, CqrsException.validation("bad"))).isFalse();
        assertThat(policy.shouldRetry(1, new IllegalStateException())).isFalse();
    }

    @Test
    void shouldHaveNoRetryPolicyConstant() {
        assertThat(RetryPolicy.NO_RETRY.maxAttempts()).isEqualTo(1);
        assertThat(RetryPolicy.NO_RETRY.shouldRetry(1)).isFalse();
    }

    @Test
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.5, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldBuildFromConfiguration() {
        CqrsProperties.RetryConfig config = new CqrsProperties.RetryConfig();
        config.setMaxAttempts(7);
        config.setJitterFactor(0.0);

        RetryPolicy policy = RetryPolicy.from(config);

        assertThat(policy.maxAttempts()).isEqualTo(7);
        assertThat(policy.jitterFactor()).isZero();
    }
}
