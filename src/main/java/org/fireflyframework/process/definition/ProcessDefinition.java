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
import org.fireflyframework.process.core.exception.InvalidDefinitionStateException;
import org.fireflyframework.process.core.model.DefinitionStatus;
import org.fireflyframework.process.core.model.ProcessId;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.Version;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Versioned template of a process: an ordered set of steps forming a DAG.
 *
 * <p>Only a {@link DefinitionStatus#DRAFT} definition may change its steps. Publishing
 * freezes the graph; later edits start from {@link #newRevision()}. The {@code version}
 * is advanced by the repository on every write, so an execution pinned to
 * {@code (id, version)} always sees the graph it was started with.
 */
public record ProcessDefinition(
        ProcessId id,
        String name,
        String description,
        List<StepDefinition> steps,
        DefinitionStatus status,
        Version version,
        String createdBy,
        Instant createdAt,
        Instant publishedAt,
        List<TriggerConfig> triggers
) {
    public ProcessDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        name = name != null ? name : "";
        description = description != null ? description : "";
        steps = steps != null ? List.copyOf(steps) : List.of();
        version = version != null ? version : Version.INITIAL;
        createdBy = createdBy != null ? createdBy : "system";
        createdAt = createdAt != null ? createdAt : Instant.now();
        triggers = triggers != null ? List.copyOf(triggers) : List.of();
    }

    public static ProcessDefinition draft(String name, String description, List<StepDefinition> steps,
                                          String createdBy) {
        return new ProcessDefinition(ProcessId.generate(), name, description, steps, DefinitionStatus.DRAFT,
                Version.INITIAL, createdBy, Instant.now(), null, List.of());
    }

    public Optional<StepDefinition> step(StepId stepId) {
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }

    public StepDefinition requireStep(StepId stepId) {
        return step(stepId).orElseThrow(() ->
                new IllegalArgumentException("Step '" + stepId + "' is not part of process '" + name + "'"));
    }

    public List<StepId> stepIds() {
        return steps.stream().map(StepDefinition::id).toList();
    }

    /** Position of the step in definition order, {@code -1} when unknown. */
    public int indexOf(StepId stepId) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).id().equals(stepId)) return i;
        }
        return -1;
    }

    /** Steps that list {@code stepId} in their {@code dependsOn}, in definition order. */
    public List<StepDefinition> dependentsOf(StepId stepId) {
        List<StepDefinition> dependents = new ArrayList<>();
        for (StepDefinition step : steps) {
            if (step.dependsOn().contains(stepId)) dependents.add(step);
        }
        return dependents;
    }

    @JsonIgnore
    public boolean isExecutable() {
        return status == DefinitionStatus.PUBLISHED;
    }

    public ProcessDefinition withSteps(List<StepDefinition> newSteps) {
        requireStatus(DefinitionStatus.DRAFT, "edit steps of");
        return new ProcessDefinition(id, name, description, newSteps, status, version, createdBy, createdAt,
                publishedAt, triggers);
    }

    public ProcessDefinition withTriggers(List<TriggerConfig> newTriggers) {
        requireStatus(DefinitionStatus.DRAFT, "edit triggers of");
        return new ProcessDefinition(id, name, description, steps, status, version, createdBy, createdAt,
                publishedAt, newTriggers);
    }

    public ProcessDefinition withVersion(Version newVersion) {
        return new ProcessDefinition(id, name, description, steps, status, newVersion, createdBy, createdAt,
                publishedAt, triggers);
    }

    public ProcessDefinition publish(Instant now) {
        requireStatus(DefinitionStatus.DRAFT, "publish");
        return new ProcessDefinition(id, name, description, steps, DefinitionStatus.PUBLISHED, version, createdBy,
                createdAt, now, triggers);
    }

    public ProcessDefinition archive() {
        requireStatus(DefinitionStatus.PUBLISHED, "archive");
        return new ProcessDefinition(id, name, description, steps, DefinitionStatus.ARCHIVED, version, createdBy,
                createdAt, publishedAt, triggers);
    }

    /** Editable DRAFT copy of a published or archived definition. */
    public ProcessDefinition newRevision() {
        if (status == DefinitionStatus.DRAFT) {
            throw new InvalidDefinitionStateException("Process '" + name + "' is already a draft");
        }
        return new ProcessDefinition(id, name, description, steps, DefinitionStatus.DRAFT, version, createdBy,
                createdAt, null, triggers);
    }

    private void requireStatus(DefinitionStatus expected, String action) {
        if (status != expected) {
            throw new InvalidDefinitionStateException("Cannot " + action + " process '" + name + "' in status "
                    + status + " (requires " + expected + ")");
        }
    }
}
