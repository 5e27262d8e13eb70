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

package org.fireflyframework.process.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.fireflyframework.process.core.model.StepType;

import java.time.Duration;
import java.util.List;

public record HumanApprovalConfig(String title, String description, List<String> assignees,
                                  Duration timeout) implements StepConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(24);

    @JsonCreator
    public HumanApprovalConfig {
        description = description != null ? description : "";
        assignees = assignees != null ? List.copyOf(assignees) : List.of();
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
    }

    public HumanApprovalConfig(String title, String description) {
        this(title, description, List.of(), DEFAULT_TIMEOUT);
    }

    @Override
    public StepType stepType() {
        return StepType.HUMAN_APPROVAL;
    }
}
