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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.fireflyframework.process.core.model.StepType;

/**
 * Type-specific configuration of a step. Each variant is bound to exactly one {@link StepType}.
 *
 * <p>Serialized with a {@code kind} discriminator so stored definitions read back into the
 * right variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AgentTaskConfig.class, name = "agent_task"),
        @JsonSubTypes.Type(value = HumanApprovalConfig.class, name = "human_approval"),
        @JsonSubTypes.Type(value = GatewayConfig.class, name = "gateway"),
        @JsonSubTypes.Type(value = TimerConfig.class, name = "timer"),
        @JsonSubTypes.Type(value = NotificationConfig.class, name = "notification")
})
public sealed interface StepConfig permits
        AgentTaskConfig, HumanApprovalConfig, GatewayConfig, TimerConfig, NotificationConfig {

    StepType stepType();
}
