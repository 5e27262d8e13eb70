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

package org.fireflyframework.process.engine;

import org.fireflyframework.process.core.event.ExecutionEvent;
import org.fireflyframework.process.core.model.Money;
import org.fireflyframework.process.core.model.TokenUsage;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one handler invocation.
 */
public sealed interface StepResult permits StepResult.Success, StepResult.Failure, StepResult.Suspend {

    static Success success(Map<String, Object> output) {
        return new Success(output, null, null, null);
    }

    static Failure failure(String error, String code, boolean retryable) {
        return new Failure(error, code, retryable);
    }

    static Suspend suspend(String reason, Instant resumeAt) {
        return new Suspend(reason, resumeAt, null);
    }

    record Success(Map<String, Object> output, Money cost, TokenUsage tokens, Duration duration) implements StepResult {
        public Success {
            output = output != null ? output : Map.of();
            cost = cost != null ? cost : Money.zero();
            tokens = tokens != null ? tokens : TokenUsage.NONE;
        }
    }

    record Failure(String error, String code, boolean retryable) implements StepResult {
        public Failure {
            Objects.requireNonNull(code, "code");
            error = error != null ? error : code;
        }
    }

    /**
     * Yields control without failing. The step is parked WAITING until the engine is
     * re-entered for this execution.
     *
     * @param resumeAt     when set, the engine schedules a re-entry at that instant
     * @param announcement event published once when the step first parks, may be {@code null}
     */
    record Suspend(String reason, Instant resumeAt, ExecutionEvent announcement) implements StepResult {
        public Suspend {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
