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

/**
 * @param agent   name of the agent that runs the task
 * @param message prompt template, may contain {@code ${step.path}} references
 * @param timeout upper bound of a single dispatch
 * @param model   optional model override passed through to the agent
 */
public record AgentTaskConfig(String agent, String message, Duration timeout, String model) implements StepConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    @JsonCreator
    public AgentTaskConfig {
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        message = message != null ? message : "";
    }

    public AgentTaskConfig(String agent, String message) {
        this(agent, message, DEFAULT_TIMEOUT, null);
    }

    @Override
    public StepType stepType() {
        return StepType.AGENT_TASK;
    }
}
