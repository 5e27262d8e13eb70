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

package org.fireflyframework.process.definition.builder;

import org.fireflyframework.process.core.model.DefinitionStatus;
import org.fireflyframework.process.core.model.ErrorPolicy;
import org.fireflyframework.process.core.model.OnErrorAction;
import org.fireflyframework.process.core.model.ProcessId;
import org.fireflyframework.process.core.model.RetryPolicy;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.Version;
import org.fireflyframework.process.definition.AgentTaskConfig;
import org.fireflyframework.process.definition.CompensationConfig;
import org.fireflyframework.process.definition.GatewayConfig;
import org.fireflyframework.process.definition.GatewayRoute;
import org.fireflyframework.process.definition.GatewayType;
import org.fireflyframework.process.definition.HumanApprovalConfig;
import org.fireflyframework.process.definition.NotificationConfig;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.StepConfig;
import org.fireflyframework.process.definition.StepDefinition;
import org.fireflyframework.process.definition.StepRoles;
import org.fireflyframework.process.definition.TimerConfig;
import org.fireflyframework.process.definition.TriggerConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fluent construction of DRAFT {@link ProcessDefinition}s.
 *
 * <pre>{@code
 * ProcessDefinition def = new ProcessBuilder("onboarding")
 *         .step("research").agentTask("researcher", "Look into ${input.topic}").add()
 *         .step("review").approval("Review research", "").dependsOn("research").add()
 *         .build();
 * }</pre>
 */
public class ProcessBuilder {

    private final String name;
    private ProcessId id = ProcessId.generate();
    private String description = "";
    private String createdBy = "system";
    private final List<StepDefinition> steps = new ArrayList<>();
    private final List<TriggerConfig> triggers = new ArrayList<>();

    public ProcessBuilder(String name) {
        this.name = name;
    }

    public ProcessBuilder id(ProcessId id) {
        this.id = id;
        return this;
    }

    public ProcessBuilder description(String description) {
        this.description = description;
        return this;
    }

    public ProcessBuilder createdBy(String createdBy) {
        this.createdBy = createdBy;
        return this;
    }

    public ProcessBuilder trigger(TriggerConfig trigger) {
        this.triggers.add(trigger);
        return this;
    }

    public StepBuilder step(String stepId) {
        return new StepBuilder(this, stepId);
    }

    ProcessBuilder addStep(StepDefinition step) {
        steps.add(step);
        return this;
    }

    public ProcessDefinition build() {
        return new ProcessDefinition(id, name, description, List.copyOf(steps), DefinitionStatus.DRAFT,
                Version.INITIAL, createdBy, Instant.now(), null, List.copyOf(triggers));
    }

    public static class StepBuilder {

        private final ProcessBuilder parent;
        private final String stepId;
        private String name;
        private StepConfig config;
        private List<String> dependsOn = List.of();
        private RetryPolicy retryPolicy;
        private ErrorPolicy errorPolicy;
        private CompensationConfig compensation;
        private StepRoles roles;
        private String condition;
        private Duration timeout;

        StepBuilder(ProcessBuilder parent, String stepId) {
            this.parent = parent;
            this.stepId = stepId;
        }

        public StepBuilder name(String name) {
            this.name = name;
            return this;
        }

        public StepBuilder config(StepConfig config) {
            this.config = config;
            return this;
        }

        public StepBuilder agentTask(String agent, String message) {
            return config(new AgentTaskConfig(agent, message));
        }

        public StepBuilder approval(String title, String description, String... assignees) {
            return config(new HumanApprovalConfig(title, description, Arrays.asList(assignees), null));
        }

        public StepBuilder gateway(GatewayType type, String defaultRoute, GatewayRoute... routes) {
            return config(new GatewayConfig(type, Arrays.asList(routes),
                    defaultRoute != null ? StepId.of(defaultRoute) : null));
        }

        public StepBuilder timer(Duration delay) {
            return config(new TimerConfig(delay));
        }

        public StepBuilder notification(String message, String... recipients) {
            return config(new NotificationConfig(message, Arrays.asList(recipients)));
        }

        public StepBuilder dependsOn(String... deps) {
            this.dependsOn = Arrays.asList(deps);
            return this;
        }

        public StepBuilder retryPolicy(RetryPolicy policy) {
            this.retryPolicy = policy;
            return this;
        }

        public StepBuilder onError(OnErrorAction action) {
            this.errorPolicy = ErrorPolicy.of(action);
            return this;
        }

        public StepBuilder errorPolicy(ErrorPolicy policy) {
            this.errorPolicy = policy;
            return this;
        }

        public StepBuilder compensation(CompensationConfig compensation) {
            this.compensation = compensation;
            return this;
        }

        public StepBuilder roles(StepRoles roles) {
            this.roles = roles;
            return this;
        }

        public StepBuilder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public StepBuilder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public ProcessBuilder add() {
            if (config == null) {
                throw new IllegalStateException("Step '" + stepId + "' has no configuration");
            }
            return parent.addStep(new StepDefinition(StepId.of(stepId), name, config.stepType(), config,
                    dependsOn.stream().map(StepId::of).toList(), retryPolicy, errorPolicy, compensation,
                    roles, condition, timeout));
        }
    }
}
