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

import org.fireflyframework.process.core.exception.InvalidExecutionStateException;
import org.fireflyframework.process.core.model.Money;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepStatus;
import org.fireflyframework.process.core.model.TokenUsage;
import org.fireflyframework.process.core.output.OutputPath;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runtime state of one step inside an execution. Immutable; every transition returns a
 * new instance and rejects moves the state machine does not allow.
 *
 * <p>{@code output} holds small payloads inline. Large payloads live in output storage
 * and only {@code outputPath} is kept here.
 */
public record StepExecution(
        StepId stepId,
        StepStatus status,
        int attempt,
        Map<String, Object> output,
        OutputPath outputPath,
        Money cost,
        TokenUsage tokens,
        Duration duration,
        Instant startedAt,
        Instant completedAt,
        String error,
        String errorCode,
        String reason,
        Instant retryAt,
        int resets
) {
    public StepExecution {
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(status, "status");
        output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
        cost = cost != null ? cost : Money.zero();
        tokens = tokens != null ? tokens : TokenUsage.NONE;
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static StepExecution pending(StepId stepId) {
        return new StepExecution(stepId, StepStatus.PENDING, 0, null, null, null, null, null,
                null, null, null, null, null, null, 0);
    }

    public boolean hasExternalOutput() {
        return outputPath != null;
    }

    /** PENDING to RUNNING, counting a new attempt. */
    public StepExecution start(Instant now) {
        require(EnumSet.of(StepStatus.PENDING), "start");
        return new StepExecution(stepId, StepStatus.RUNNING, attempt + 1, null, null, null, null, null,
                now, null, null, null, null, null, resets);
    }

    /** WAITING to RUNNING for a re-check of the external condition; no new attempt. */
    public StepExecution reenter() {
        require(EnumSet.of(StepStatus.WAITING), "re-enter");
        return new StepExecution(stepId, StepStatus.RUNNING, attempt, output, outputPath, cost, tokens, duration,
                startedAt, null, error, errorCode, reason, null, resets);
    }

    public StepExecution complete(Map<String, Object> newOutput, OutputPath path, Money newCost,
                                  TokenUsage newTokens, Duration newDuration, Instant now) {
        require(EnumSet.of(StepStatus.RUNNING), "complete");
        return new StepExecution(stepId, StepStatus.COMPLETED, attempt, path != null ? null : newOutput, path,
                newCost, newTokens, newDuration, startedAt, now, null, null, null, null, resets);
    }

    public StepExecution fail(String message, String code, Instant now) {
        require(EnumSet.of(StepStatus.RUNNING, StepStatus.WAITING), "fail");
        return new StepExecution(stepId, StepStatus.FAILED, attempt, output, outputPath, cost, tokens,
                durationUntil(now), startedAt, now, message, code, null, null, resets);
    }

    /** RUNNING back to PENDING with a not-before instant for the next attempt. */
    public StepExecution scheduleRetry(String message, String code, Instant nextAttemptAt) {
        require(EnumSet.of(StepStatus.RUNNING), "schedule a retry of");
        return new StepExecution(stepId, StepStatus.PENDING, attempt, null, null, cost, tokens, duration,
                startedAt, null, message, code, null, nextAttemptAt, resets);
    }

    /** Starts a fresh attempt budget, used by the {@code retry} error action. */
    public StepExecution resetAttempts(String message, String code, Instant nextAttemptAt) {
        require(EnumSet.of(StepStatus.RUNNING), "reset attempts of");
        return new StepExecution(stepId, StepStatus.PENDING, 0, null, null, cost, tokens, duration,
                startedAt, null, message, code, null, nextAttemptAt, resets + 1);
    }

    public StepExecution waiting(String waitReason) {
        require(EnumSet.of(StepStatus.RUNNING), "suspend");
        return new StepExecution(stepId, StepStatus.WAITING, attempt, output, outputPath, cost, tokens, duration,
                startedAt, null, null, null, waitReason, null, resets);
    }

    public StepExecution skip(String skipReason, Instant now) {
        require(EnumSet.of(StepStatus.PENDING, StepStatus.RUNNING, StepStatus.WAITING), "skip");
        return new StepExecution(stepId, StepStatus.SKIPPED, attempt, null, null, cost, tokens, duration,
                startedAt, now, error, errorCode, skipReason, null, resets);
    }

    public StepExecution compensated() {
        require(EnumSet.of(StepStatus.COMPLETED), "compensate");
        return new StepExecution(stepId, StepStatus.COMPENSATED, attempt, output, outputPath, cost, tokens,
                duration, startedAt, completedAt, null, null, "compensated", null, resets);
    }

    /** Interrupted RUNNING step put back to PENDING so it is re-invoked as a new attempt. */
    public StepExecution interruptedForRetry() {
        require(EnumSet.of(StepStatus.RUNNING), "retry interrupted");
        return new StepExecution(stepId, StepStatus.PENDING, attempt, null, null, cost, tokens, duration,
                null, null, error, errorCode, null, null, resets);
    }

    /** Interrupted RUNNING step parked as WAITING so the next drive re-polls it. */
    public StepExecution interruptedForRecheck() {
        require(EnumSet.of(StepStatus.RUNNING), "re-check interrupted");
        return new StepExecution(stepId, StepStatus.WAITING, attempt, output, outputPath, cost, tokens, duration,
                startedAt, null, null, null, "recovered", null, resets);
    }

    public boolean isRetryDue(Instant now) {
        return retryAt == null || !retryAt.isAfter(now);
    }

    private Duration durationUntil(Instant now) {
        return startedAt != null && now != null ? Duration.between(startedAt, now) : duration;
    }

    private void require(Set<StepStatus> allowed, String action) {
        if (!allowed.contains(status)) {
            throw new InvalidExecutionStateException("Cannot " + action + " step '" + stepId
                    + "' in status " + status);
        }
    }
}
