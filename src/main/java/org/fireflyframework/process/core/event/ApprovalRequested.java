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
import org.fireflyframework.process.core.model.StepId;

import java.time.Instant;
import java.util.List;

public record ApprovalRequested(
        ExecutionId executionId,
        StepId stepId,
        String stepName,
        String title,
        String description,
        List<String> assignees,
        Instant deadline,
        Instant timestamp
) implements StepEvent {
}
