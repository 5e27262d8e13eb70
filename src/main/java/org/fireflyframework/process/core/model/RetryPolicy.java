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

package org.fireflyframework.process.core.model;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Attempt budget and backoff for a step. {@code maxAttempts} counts every attempt,
 * the first one included.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        double multiplier,
        double jitterFactor
) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(
            3, Duration.ofSeconds(5), Duration.ofMinutes(5), 2.0, 0.0);

    public static final RetryPolicy NO_RETRY = new RetryPolicy(
            1, Duration.ZERO, Duration.ZERO, 1.0, 0.0);

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (initialDelay == null || initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay must be >= 0");
        if (maxDelay == null || maxDelay.isNegative()) throw new IllegalArgumentException("maxDelay must be >= 0");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
        if (jitterFactor < 0.0 || jitterFactor > 1.0) throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay, delay, 1.0, 0.0);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, 2.0, 0.0);
    }

    /**
     * Delay before the next attempt once {@code attemptsMade} attempts have failed.
     * Grows by {@code multiplier} per attempt and never exceeds {@code maxDelay}.
     */
    public Duration calculateDelay(int attemptsMade) {
        long delayMs = initialDelay.toMillis();
        for (int i = 1; i < attemptsMade; i++) {
            delayMs = (long) (delayMs * multiplier);
            if (delayMs >= maxDelay.toMillis()) break;
        }
        delayMs = Math.min(delayMs, maxDelay.toMillis());
        if (jitterFactor > 0.0) {
            long jitter = (long) (delayMs * jitterFactor);
            delayMs = delayMs - jitter + ThreadLocalRandom.current().nextLong(2 * jitter + 1);
            delayMs = Math.max(0, Math.min(delayMs, maxDelay.toMillis()));
        }
        return Duration.ofMillis(delayMs);
    }

    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }
}
