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

package org.fireflyframework.process.core.event;

import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.Money;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.TokenUsage;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * A step finished successfully. {@code output} is empty and {@code outputPath} set when the
 * output was too large to embed and went to output storage.
 */
public record StepCompleted(
        ExecutionId executionId,
        StepId stepId,
        String stepName,
        Map<String, Object> output,
        String outputPath,
        Money cost,
        TokenUsage tokens,
        Duration duration,
        Instant timestamp
) implements StepEvent {
}
