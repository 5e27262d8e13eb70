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

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.fireflyframework.process.core.model.ErrorPolicy;
import org.fireflyframework.process.core.model.RetryPolicy;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepType;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * One node of a process graph.
 *
 * @param id          step identifier, unique inside the definition
 * @param name        display name
 * @param type        step type, always equal to {@code config.stepType()}
 * @param config      type-specific configuration
 * @param dependsOn   steps that must be COMPLETED or SKIPPED before this one starts
 * @param retryPolicy attempt budget, {@code null} to use the engine default
 * @param errorPolicy error boundary, {@code null} for {@link ErrorPolicy#DEFAULT}
 * @param compensation undo action run on rollback, may be {@code null}
 * @param roles       executor / monitor / informed assignments
 * @param condition   optional guard; when it evaluates to false the step is skipped
 * @param timeout     optional bound on one handler invocation
 */
public record StepDefinition(
        StepId id,
        String name,
        StepType type,
        StepConfig config,
        List<StepId> dependsOn,
        RetryPolicy retryPolicy,
        ErrorPolicy errorPolicy,
        CompensationConfig compensation,
        StepRoles roles,
        String condition,
        Duration timeout
) {
    public StepDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(config, "config");
        name = name != null && !name.isBlank() ? name : id.value();
        type = type != null ? type : config.stepType();
        if (type != config.stepType()) {
            throw new IllegalArgumentException("Step '" + id + "' has type " + type.value()
                    + " but a " + config.stepType().value() + " configuration");
        }
        dependsOn = dependsOn != null ? List.copyOf(new LinkedHashSet<>(dependsOn)) : List.of();
        errorPolicy = errorPolicy != null ? errorPolicy : ErrorPolicy.DEFAULT;
        roles = roles != null ? roles : StepRoles.NONE;
        condition = condition != null ? condition : "";
    }

    public static StepDefinition of(String id, StepConfig config, String... dependsOn) {
        return new StepDefinition(StepId.of(id), null, null, config,
                Arrays.stream(dependsOn).map(StepId::of).toList(),
                null, null, null, null, null, null);
    }

    public boolean hasCondition() {
        return !condition.isBlank();
    }

    @JsonIgnore
    public boolean isCompensatable() {
        return compensation != null;
    }

    public RetryPolicy retryPolicyOr(RetryPolicy fallback) {
        return retryPolicy != null ? retryPolicy : fallback;
    }
}
