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

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for retrying commands.
 * <p>
 * Only failures whose {@link CqrsException#isRetryable()} flag is set are retried.
 *
 * @param maxAttempts  maximum number of attempts, including the first
 * @param initialDelay delay before the first retry
 * @param maxDelay     upper bound for any delay before jitter
 * @param multiplier   backoff multiplier per attempt
 * @param jitterFactor random deviation as a fraction of the delay (0.0 to 1.0)
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        double multiplier,
        double jitterFactor
) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(
            3, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0, 0.1);

    public static final RetryPolicy NO_RETRY = new RetryPolicy(
            1, Duration.ZERO, Duration.ZERO, 1.0, 0.0);

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
        if (jitterFactor < 0.0 || jitterFactor > 1.0) throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
    }

    public static RetryPolicy from(CqrsProperties.RetryConfig config) {
        return new RetryPolicy(config.getMaxAttempts(), config.getInitialDelay(), config.getMaxDelay(),
                config.getMultiplier(), config.getJitterFactor());
    }

    /**
     * Delay before retry number {@code retry} (0-based): {@code initialDelay * multiplier^retry},
     * capped at {@code maxDelay}, then spread by the jitter factor.
     */
    public Duration calculateDelay(int retry) {
        long delayMs = initialDelay.toMillis();
        for (int i = 0; i < retry; i++) {
            delayMs = (long) (delayMs * multiplier);
        }
        delayMs = Math.min(delayMs, maxDelay.toMillis());
        if (jitterFactor > 0.0) {
            long jitter = (long) (delayMs * jitterFactor);
            delayMs = delayMs - jitter + ThreadLocalRandom.current().nextLong(2 * jitter + 1);
            delayMs = Math.max(0, delayMs);
        }
        return Duration.ofMillis(delayMs);
    }

    public boolean shouldRetry(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    public boolean shouldRetry(int currentAttempt, Throwable error) {
        return shouldRetry(currentAttempt) && CqrsException.isRetryable(error);
    }
}
