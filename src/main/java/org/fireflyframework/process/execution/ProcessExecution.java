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

package org.fireflyframework.process.execution;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.fireflyframework.process.core.exception.InvalidExecutionStateException;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.ExecutionStatus;
import org.fireflyframework.process.core.model.Money;
import org.fireflyframework.process.core.model.ProcessId;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepStatus;
import org.fireflyframework.process.core.model.TokenUsage;
import org.fireflyframework.process.core.model.Version;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.StepDefinition;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * One run of a published process definition. Immutable; the engine produces a new
 * instance for every transition and persists it through the execution repository.
 *
 * <p>Status moves CREATED -> RUNNING -> {COMPLETED, FAILED, CANCELLED} and never back.
 * Once terminal no step may start.
 */
public record ProcessExecution(
        ExecutionId id,
        ProcessId processId,
        Version definitionVersion,
        String processName,
        ExecutionStatus status,
        Map<StepId, StepExecution> steps,
        Map<String, Object> input,
        Map<String, Object> output,
        Money totalCost,
        TokenUsage totalTokens,
        String triggeredBy,
        ExecutionId retryOf,
        StepId failedStepId,
        String failureReason,
        Version version,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant updatedAt
) {
    public ProcessExecution {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(processId, "processId");
        Objects.requireNonNull(status, "status");
        steps = steps != null ? Collections.unmodifiableMap(new LinkedHashMap<>(steps)) : Map.of();
        input = nullSafeCopy(input);
        output = nullSafeCopy(output);
        totalCost = totalCost != null ? totalCost : Money.zero();
        totalTokens = totalTokens != null ? totalTokens : TokenUsage.NONE;
        triggeredBy = triggeredBy != null ? triggeredBy : "manual";
        version = version != null ? version : Version.INITIAL;
    }

    private static Map<String, Object> nullSafeCopy(Map<String, Object> source) {
        if (source == null) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static ProcessExecution create(ProcessDefinition definition, Map<String, Object> input,
                                          String triggeredBy, ExecutionId retryOf, Instant now) {
        if (!definition.isExecutable()) {
            throw new InvalidExecutionStateException("Process '" + definition.name() + "' is "
                    + definition.status() + " and cannot be executed");
        }
        Map<StepId, StepExecution> steps = new LinkedHashMap<>();
        for (StepDefinition step : definition.steps()) {
            steps.put(step.id(), StepExecution.pending(step.id()));
        }
        return new ProcessExecution(ExecutionId.generate(), definition.id(), definition.version(),
                definition.name(), ExecutionStatus.CREATED, steps, input, null, null, null, triggeredBy,
                retryOf, null, null, Version.INITIAL, now, null, null, now);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Optional<StepExecution> step(StepId stepId) {
        return Optional.ofNullable(steps.get(stepId));
    }

    public StepExecution requireStep(StepId stepId) {
        StepExecution step = steps.get(stepId);
        if (step == null) {
            throw new IllegalArgumentException("Execution " + id + " has no step '" + stepId + "'");
        }
        return step;
    }

    public List<StepExecution> stepsWithStatus(StepStatus stepStatus) {
        return steps.values().stream().filter(s -> s.status() == stepStatus).toList();
    }

    public Map<StepId, StepStatus> statusSnapshot() {
        Map<StepId, StepStatus> snapshot = new LinkedHashMap<>();
        steps.forEach((stepId, step) -> snapshot.put(stepId, step.status()));
        return snapshot;
    }

    /** Most recent of start, step start and step completion timestamps. */
    public Instant lastActivity() {
        Instant last = startedAt != null ? startedAt : createdAt;
        for (StepExecution step : steps.values()) {
            if (step.startedAt() != null && (last == null || step.startedAt().isAfter(last))) last = step.startedAt();
            if (step.completedAt() != null && (last == null || step.completedAt().isAfter(last))) last = step.completedAt();
        }
        return last;
    }

    /**
     * Currency of the costs recorded so far. The first non-zero step cost fixes it; zero
     * costs count in any currency.
     */
    public String costCurrency() {
        return steps.values().stream()
                .map(StepExecution::cost)
                .filter(cost -> !cost.isZero())
                .map(Money::currency)
                .findFirst()
                .orElse(totalCost.currency());
    }

    public boolean acceptsCost(Money cost) {
        return cost == null || cost.isZero() || cost.currency().equals(costCurrency());
    }

    public Duration elapsed(Instant now) {
        return startedAt != null ? Duration.between(startedAt, now) : Duration.ZERO;
    }

    public ProcessExecution start(Instant now) {
        transition(ExecutionStatus.RUNNING);
        return new ProcessExecution(id, processId, definitionVersion, processName, ExecutionStatus.RUNNING, steps,
                input, output, totalCost, totalTokens, triggeredBy, retryOf, failedStepId, failureReason, version,
                createdAt, now, completedAt, now);
    }

    public ProcessExecution startStep(StepId stepId, Instant now) {
        if (status != ExecutionStatus.RUNNING) {
            throw new InvalidExecutionStateException("Cannot start step '" + stepId + "' of execution " + id
                    + " in status " + status);
        }
        return withStepState(requireStep(stepId).start(now), now);
    }

    public ProcessExecution updateStep(StepId stepId, UnaryOperator<StepExecution> change, Instant now) {
        if (isTerminal()) {
            throw new InvalidExecutionStateException("Execution " + id + " is " + status
                    + "; step '" + stepId + "' can no longer change");
        }
        return withStepState(change.apply(requireStep(stepId)), now);
    }

    /** Compensation is the one step change allowed after the execution failed. */
    public ProcessExecution compensateStep(StepId stepId, Instant now) {
        if (status != ExecutionStatus.RUNNING && status != ExecutionStatus.FAILED) {
            throw new InvalidExecutionStateException("Cannot compensate step '" + stepId + "' of execution " + id
                    + " in status " + status);
        }
        return withStepState(requireStep(stepId).compensated(), now);
    }

    public ProcessExecution complete(Map<String, Object> finalOutput, Instant now) {
        transition(ExecutionStatus.COMPLETED);
        Money cost = aggregateCost();
        TokenUsage tokens = steps.values().stream().map(StepExecution::tokens).reduce(TokenUsage.NONE, TokenUsage::add);
        return new ProcessExecution(id, processId, definitionVersion, processName, ExecutionStatus.COMPLETED, steps,
                input, finalOutput, cost, tokens, triggeredBy, retryOf, null, null, version, createdAt, startedAt,
                now, now);
    }

    public ProcessExecution fail(StepId stepId, String reason, Instant now) {
        transition(ExecutionStatus.FAILED);
        Money cost = aggregateCost();
        return new ProcessExecution(id, processId, definitionVersion, processName, ExecutionStatus.FAILED, steps,
                input, output, cost, totalTokens, triggeredBy, retryOf, stepId, reason, version, createdAt,
                startedAt, now, now);
    }

    /** Cancels the execution; every non-terminal step is settled SKIPPED. */
    public ProcessExecution cancel(String reason, Instant now) {
        transition(ExecutionStatus.CANCELLED);
        Map<StepId, StepExecution> settled = new LinkedHashMap<>();
        steps.forEach((stepId, step) -> settled.put(stepId,
                step.status().isTerminal() ? step : step.skip("cancelled", now)));
        return new ProcessExecution(id, processId, definitionVersion, processName, ExecutionStatus.CANCELLED,
                settled, input, output, totalCost, totalTokens, triggeredBy, retryOf, null, reason, version,
                createdAt, startedAt, now, now);
    }

    public ProcessExecution withVersion(Version newVersion) {
        return new ProcessExecution(id, processId, definitionVersion, processName, status, steps, input, output,
                totalCost, totalTokens, triggeredBy, retryOf, failedStepId, failureReason, newVersion, createdAt,
                startedAt, completedAt, updatedAt);
    }

    private Money aggregateCost() {
        return Money.sum(steps.values().stream().map(StepExecution::cost).filter(cost -> !cost.isZero()).toList(),
                costCurrency());
    }

    private ProcessExecution withStepState(StepExecution step, Instant now) {
        Map<StepId, StepExecution> updated = new LinkedHashMap<>(steps);
        updated.put(step.stepId(), step);
        return new ProcessExecution(id, processId, definitionVersion, processName, status, updated, input, output,
                totalCost, totalTokens, triggeredBy, retryOf, failedStepId, failureReason, version, createdAt,
                startedAt, completedAt, now);
    }

    private void transition(ExecutionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidExecutionStateException("Execution " + id + " cannot move from " + status
                    + " to " + target);
        }
    }
}
