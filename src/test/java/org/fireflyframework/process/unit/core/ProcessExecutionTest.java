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

package org.fireflyframework.process.unit.core;

import org.fireflyframework.process.core.exception.InvalidExecutionStateException;
import org.fireflyframework.process.core.model.ExecutionStatus;
import org.fireflyframework.process.core.model.Money;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepStatus;
import org.fireflyframework.process.core.model.TokenUsage;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.builder.ProcessBuilder;
import org.fireflyframework.process.execution.ProcessExecution;
import org.fireflyframework.process.execution.StepExecution;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ProcessExecutionTest {

    private static final Instant T0 = Instant.parse("2026-01-15T09:00:00Z");
    private static final StepId A = StepId.of("a");
    private static final StepId B = StepId.of("b");

    private final ProcessDefinition draft = new ProcessBuilder("two-steps")
            .step("a").agentTask("x", "a").add()
            .step("b").agentTask("x", "b").dependsOn("a").add()
            .build();
    private final ProcessDefinition published = draft.publish(T0);

    private ProcessExecution running() {
        return ProcessExecution.create(published, Map.of("k", "v"), "tester", null, T0).start(T0);
    }

    // ── Creation ─────────────────────────────────────────────────

    @Test
    void create_fromDraft_isRejected() {
        assertThatThrownBy(() -> ProcessExecution.create(draft, Map.of(), "tester", null, T0))
                .isInstanceOf(InvalidExecutionStateException.class);
    }

    @Test
    void create_startsWithEveryStepPending() {
        ProcessExecution execution = ProcessExecution.create(published, Map.of(), "tester", null, T0);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.CREATED);
        assertThat(execution.statusSnapshot()).containsOnlyKeys(A, B);
        assertThat(execution.statusSnapshot().values()).containsOnly(StepStatus.PENDING);
        assertThat(execution.totalCost()).isEqualTo(Money.zero());
    }

    // ── Step transitions ─────────────────────────────────────────

    @Test
    void startStep_countsAttempts_acrossRetries() {
        Instant retryAt = T0.plusSeconds(5);
        StepExecution step = StepExecution.pending(A).start(T0).scheduleRetry("boom", "AGENT_TIMEOUT", retryAt);

        assertThat(step.status()).isEqualTo(StepStatus.PENDING);
        assertThat(step.isRetryDue(T0)).isFalse();
        assertThat(step.isRetryDue(retryAt)).isTrue();
        assertThat(step.start(retryAt).attempt()).isEqualTo(2);
    }

    @Test
    void reenter_keepsAttemptAndStartTime() {
        StepExecution waiting = StepExecution.pending(A).start(T0).waiting("timer");
        StepExecution reentered = waiting.reenter();

        assertThat(reentered.status()).isEqualTo(StepStatus.RUNNING);
        assertThat(reentered.attempt()).isEqualTo(1);
        assertThat(reentered.startedAt()).isEqualTo(T0);
    }

    @Test
    void completedStep_cannotBeStartedAgain() {
        StepExecution completed = StepExecution.pending(A).start(T0)
                .complete(Map.of(), null, null, null, Duration.ZERO, T0);

        assertThatThrownBy(() -> completed.start(T0)).isInstanceOf(InvalidExecutionStateException.class);
        assertThatThrownBy(() -> completed.skip("late", T0)).isInstanceOf(InvalidExecutionStateException.class);
    }

    @Test
    void compensated_onlyFromCompleted() {
        StepExecution completed = StepExecution.pending(A).start(T0)
                .complete(Map.of(), null, null, null, Duration.ZERO, T0);

        assertThat(completed.compensated().status()).isEqualTo(StepStatus.COMPENSATED);
        assertThatThrownBy(() -> StepExecution.pending(A).compensated())
                .isInstanceOf(InvalidExecutionStateException.class);
    }

    // ── Execution transitions ────────────────────────────────────

    @Test
    void complete_aggregatesCostAndTokens() {
        ProcessExecution execution = running()
                .startStep(A, T0)
                .updateStep(A, s -> s.complete(Map.of("x", 1), null, Money.of("0.25"), new TokenUsage(10, 5),
                        Duration.ofSeconds(1), T0), T0)
                .startStep(B, T0)
                .updateStep(B, s -> s.complete(Map.of("y", 2), null, Money.of("0.75"), new TokenUsage(1, 1),
                        Duration.ofSeconds(1), T0), T0);

        ProcessExecution done = execution.complete(Map.of("y", 2), T0.plusSeconds(60));

        assertThat(done.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(done.totalCost()).isEqualTo(Money.of("1.00"));
        assertThat(done.totalTokens()).isEqualTo(new TokenUsage(11, 6));
        assertThat(done.elapsed(T0.plusSeconds(60))).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void costCurrency_isFixedByFirstNonZeroCost() {
        ProcessExecution execution = running()
                .startStep(A, T0)
                .updateStep(A, s -> s.complete(Map.of(), null, Money.of(new BigDecimal("2.00"), "GBP"),
                        TokenUsage.NONE, Duration.ZERO, T0), T0);

        assertThat(running().costCurrency()).isEqualTo(Money.DEFAULT_CURRENCY);
        assertThat(execution.costCurrency()).isEqualTo("GBP");
        assertThat(execution.acceptsCost(Money.of(new BigDecimal("1.00"), "GBP"))).isTrue();
        assertThat(execution.acceptsCost(Money.zero())).isTrue();
        assertThat(execution.acceptsCost(Money.of("1.00"))).isFalse();

        ProcessExecution failed = execution.fail(B, "boom", T0);
        assertThat(failed.totalCost()).isEqualTo(Money.of(new BigDecimal("2.00"), "GBP"));
    }

    @Test
    void terminalExecution_rejectsFurtherChanges() {
        ProcessExecution failed = running().fail(A, "boom", T0);

        assertThat(failed.isTerminal()).isTrue();
        assertThatThrownBy(() -> failed.start(T0)).isInstanceOf(InvalidExecutionStateException.class);
        assertThatThrownBy(() -> failed.updateStep(B, s -> s.skip("x", T0), T0))
                .isInstanceOf(InvalidExecutionStateException.class);
        assertThatThrownBy(() -> failed.cancel("late", T0)).isInstanceOf(InvalidExecutionStateException.class);
    }

    @Test
    void cancel_skipsEveryUnfinishedStep() {
        ProcessExecution execution = running().startStep(A, T0);

        ProcessExecution cancelled = execution.cancel("stop", T0.plusSeconds(1));

        assertThat(cancelled.status()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(cancelled.requireStep(A).status()).isEqualTo(StepStatus.SKIPPED);
        assertThat(cancelled.requireStep(A).reason()).isEqualTo("cancelled");
        assertThat(cancelled.requireStep(B).status()).isEqualTo(StepStatus.SKIPPED);
    }

    @Test
    void createdExecution_canBeCancelledBeforeStarting() {
        assertThat(ExecutionStatus.CREATED.canTransitionTo(ExecutionStatus.CANCELLED)).isTrue();
        assertThat(ExecutionStatus.COMPLETED.canTransitionTo(ExecutionStatus.RUNNING)).isFalse();
    }

    @Test
    void lastActivity_tracksLatestStepTimestamp() {
        Instant later = T0.plusSeconds(90);
        ProcessExecution execution = running().startStep(A, later);

        assertThat(execution.lastActivity()).isEqualTo(later);
    }
}
