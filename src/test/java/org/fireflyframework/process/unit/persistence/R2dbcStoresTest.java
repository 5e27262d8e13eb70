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

package org.fireflyframework.process.unit.persistence;

import org.fireflyframework.process.core.event.ExecutionEvent;
import org.fireflyframework.process.core.event.ProcessCancelled;
import org.fireflyframework.process.core.event.ProcessStarted;
import org.fireflyframework.process.core.event.StepStarted;
import org.fireflyframework.process.core.exception.ConcurrencyConflictException;
import org.fireflyframework.process.core.exception.InvalidExecutionStateException;
import org.fireflyframework.process.core.model.ApprovalStatus;
import org.fireflyframework.process.core.model.DefinitionStatus;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.ExecutionStatus;
import org.fireflyframework.process.core.model.Money;
import org.fireflyframework.process.core.model.OnErrorAction;
import org.fireflyframework.process.core.model.RetryPolicy;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepType;
import org.fireflyframework.process.core.model.TokenUsage;
import org.fireflyframework.process.core.model.Version;
import org.fireflyframework.process.core.persistence.AggregateSerializer;
import org.fireflyframework.process.core.persistence.DomainEventSerializer;
import org.fireflyframework.process.definition.CompensationConfig;
import org.fireflyframework.process.definition.GatewayConfig;
import org.fireflyframework.process.definition.GatewayRoute;
import org.fireflyframework.process.definition.GatewayType;
import org.fireflyframework.process.definition.HumanApprovalConfig;
import org.fireflyframework.process.definition.NotificationConfig;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.StepRoles;
import org.fireflyframework.process.definition.TimerConfig;
import org.fireflyframework.process.definition.TriggerConfig;
import org.fireflyframework.process.definition.builder.ProcessBuilder;
import org.fireflyframework.process.execution.ProcessExecution;
import org.fireflyframework.process.handler.approval.ApprovalRequest;
import org.fireflyframework.process.persistence.r2dbc.R2dbcApprovalStore;
import org.fireflyframework.process.persistence.r2dbc.R2dbcEventRepository;
import org.fireflyframework.process.persistence.r2dbc.R2dbcProcessDefinitionRepository;
import org.fireflyframework.process.persistence.r2dbc.R2dbcProcessExecutionRepository;
import org.fireflyframework.process.testing.H2Database;
import org.fireflyframework.process.testing.MutableClock;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Relational stores against an in-memory H2 database created from the shipped schema.
 */
class R2dbcStoresTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final H2Database database = H2Database.create();
    private final MutableClock clock = MutableClock.startingNow();
    private final AggregateSerializer aggregates = new AggregateSerializer();
    private final R2dbcProcessDefinitionRepository definitions =
            new R2dbcProcessDefinitionRepository(database.client, aggregates);
    private final R2dbcProcessExecutionRepository executions =
            new R2dbcProcessExecutionRepository(database.client, aggregates, clock);
    private final R2dbcEventRepository events = new R2dbcEventRepository(database.client, new DomainEventSerializer());
    private final R2dbcApprovalStore approvals = new R2dbcApprovalStore(database.client, aggregates);

    private ProcessDefinition draft(String name) {
        return new ProcessBuilder(name).step("a").agentTask("x", "go").add().build();
    }

    private ProcessExecution created(ProcessDefinition definition) {
        return ProcessExecution.create(definition.publish(clock.instant()), Map.of("order", "o-1"), "tester", null,
                clock.instant());
    }

    // ── Definitions ──────────────────────────────────────────────

    @Test
    void definitionSave_appendsNewVersion_andKeepsHistory() {
        ProcessDefinition v1 = definitions.save(draft("persisted")).block(TIMEOUT);
        ProcessDefinition v2 = definitions.save(v1.publish(clock.instant())).block(TIMEOUT);

        assertThat(v1.version()).isEqualTo(Version.of(1));
        assertThat(v2.version()).isEqualTo(Version.of(2));
        assertThat(definitions.findById(v1.id()).block(TIMEOUT)).get()
                .extracting(ProcessDefinition::status).isEqualTo(DefinitionStatus.PUBLISHED);
        assertThat(definitions.findByIdAndVersion(v1.id(), Version.of(1)).block(TIMEOUT)).get()
                .extracting(ProcessDefinition::status).isEqualTo(DefinitionStatus.DRAFT);
        assertThat(definitions.findByIdAndVersion(v1.id(), Version.of(7)).block(TIMEOUT)).isEmpty();
        StepVerifier.create(definitions.findVersions(v1.id()).map(ProcessDefinition::version))
                .expectNext(Version.of(1), Version.of(2))
                .verifyComplete();
    }

    @Test
    void definitionSave_fromStaleCopy_conflictsWithStoredVersion() {
        ProcessDefinition v1 = definitions.save(draft("persisted")).block(TIMEOUT);
        definitions.save(v1.withSteps(v1.steps())).block(TIMEOUT);

        StepVerifier.create(definitions.save(v1.withSteps(v1.steps())))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOfSatisfying(ConcurrencyConflictException.class, conflict -> {
                            assertThat(conflict.getExpected()).isEqualTo(Version.of(1));
                            assertThat(conflict.getActual()).isEqualTo(Version.of(2));
                        }))
                .verify(TIMEOUT);
        StepVerifier.create(definitions.findVersions(v1.id()).count())
                .expectNext(2L)
                .verifyComplete();
    }

    @Test
    void findAll_returnsLatestVersionOfEachDefinition() {
        ProcessDefinition first = definitions.save(draft("first")).block(TIMEOUT);
        definitions.save(first.publish(clock.instant())).block(TIMEOUT);
        ProcessDefinition second = definitions.save(draft("second")).block(TIMEOUT);

        assertThat(definitions.findAll().collectList().block(TIMEOUT))
                .extracting(ProcessDefinition::id, ProcessDefinition::version)
                .containsExactlyInAnyOrder(tuple(first.id(), Version.of(2)), tuple(second.id(), Version.of(1)));
    }

    @Test
    void storedDefinition_keepsEveryStepKindAndTrigger() {
        ProcessDefinition rich = new ProcessBuilder("onboarding")
                .description("New supplier")
                .trigger(new TriggerConfig.ScheduleTrigger("nightly", "0 0 2 * * *", "Europe/Madrid", true))
                .trigger(new TriggerConfig.WebhookTrigger("intake", "s3cret", false))
                .step("check").agentTask("kyc", "Check ${input.name}")
                        .retryPolicy(RetryPolicy.fixed(2, Duration.ofSeconds(3)))
                        .compensation(CompensationConfig.agentTask("kyc", "undo"))
                        .roles(new StepRoles("kyc", List.of("ops"), List.of("audit")))
                        .timeout(Duration.ofMinutes(2))
                        .add()
                .step("route").gateway(GatewayType.EXCLUSIVE, "manual",
                        GatewayRoute.when("${check.score} > 80", "auto")).dependsOn("check").add()
                .step("auto").notification("Approved ${input.name}", "ops").dependsOn("route").add()
                .step("manual").approval("Review", "Score too low", "lead").dependsOn("route")
                        .onError(OnErrorAction.SKIP).add()
                .step("settle").timer(Duration.ofHours(1)).dependsOn("manual").condition("${input.wait}").add()
                .build();

        ProcessDefinition stored = definitions.save(rich).block(TIMEOUT);
        ProcessDefinition loaded = definitions.findById(stored.id()).block(TIMEOUT).orElseThrow();

        assertThat(loaded).isEqualTo(stored);
        assertThat(loaded.requireStep(StepId.of("route")).config()).isInstanceOfSatisfying(GatewayConfig.class,
                gateway -> assertThat(gateway.defaultRoute()).isEqualTo(StepId.of("manual")));
        assertThat(loaded.requireStep(StepId.of("manual")).config()).isInstanceOf(HumanApprovalConfig.class);
        assertThat(loaded.requireStep(StepId.of("auto")).config()).isInstanceOf(NotificationConfig.class);
        assertThat(loaded.requireStep(StepId.of("settle")).config()).isEqualTo(new TimerConfig(Duration.ofHours(1)));
        assertThat(loaded.triggers()).hasSize(2).first().isInstanceOf(TriggerConfig.ScheduleTrigger.class);
    }

    // ── Executions ───────────────────────────────────────────────

    @Test
    void executionSave_bumpsVersion_andRejectsStaleWrites() {
        ProcessExecution stored = executions.save(created(draft("run"))).block(TIMEOUT);
        assertThat(stored.version()).isEqualTo(Version.of(1));
        executions.save(stored.start(clock.instant())).block(TIMEOUT);

        StepVerifier.create(executions.save(stored.start(clock.instant())))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOfSatisfying(ConcurrencyConflictException.class, conflict -> {
                            assertThat(conflict.getExpected()).isEqualTo(Version.of(1));
                            assertThat(conflict.getActual()).isEqualTo(Version.of(2));
                        }))
                .verify(TIMEOUT);
        assertThat(executions.findById(stored.id()).block(TIMEOUT)).get()
                .satisfies(reloaded -> {
                    assertThat(reloaded.version()).isEqualTo(Version.of(2));
                    assertThat(reloaded.status()).isEqualTo(ExecutionStatus.RUNNING);
                });
    }

    @Test
    void executionSave_ofSecondFreshCopy_conflicts() {
        ProcessExecution fresh = created(draft("run"));
        executions.save(fresh).block(TIMEOUT);

        StepVerifier.create(executions.save(fresh))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOfSatisfying(ConcurrencyConflictException.class,
                                conflict -> assertThat(conflict.getActual()).isEqualTo(Version.of(1))))
                .verify(TIMEOUT);
    }

    @Test
    void executionSave_ofUnknownExecution_conflictsAgainstInitialVersion() {
        ProcessExecution neverStored = created(draft("run")).withVersion(Version.of(3));

        StepVerifier.create(executions.save(neverStored))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOfSatisfying(ConcurrencyConflictException.class,
                                conflict -> assertThat(conflict.getActual()).isEqualTo(Version.INITIAL)))
                .verify(TIMEOUT);
        assertThat(executions.findById(neverStored.id()).block(TIMEOUT)).isEmpty();
    }

    @Test
    void storedExecution_keepsStepStateCostsAndInput() {
        ProcessExecution running = executions.save(created(draft("run"))).block(TIMEOUT);
        Instant now = clock.instant();
        ProcessExecution progressed = running.start(now)
                .startStep(StepId.of("a"), now)
                .updateStep(StepId.of("a"), step -> step.complete(Map.of("answer", "yes"), null,
                        Money.of(new BigDecimal("0.25"), "EUR"), new TokenUsage(10, 4), Duration.ofSeconds(2), now), now);

        ProcessExecution saved = executions.save(progressed).block(TIMEOUT);
        ProcessExecution loaded = executions.findById(saved.id()).block(TIMEOUT).orElseThrow();

        assertThat(loaded.input()).containsEntry("order", "o-1");
        assertThat(loaded.requireStep(StepId.of("a")).output()).containsEntry("answer", "yes");
        assertThat(loaded.requireStep(StepId.of("a")).cost()).isEqualTo(Money.of(new BigDecimal("0.25"), "EUR"));
        assertThat(loaded.requireStep(StepId.of("a")).tokens()).isEqualTo(new TokenUsage(10, 4));
        assertThat(loaded.statusSnapshot()).isEqualTo(saved.statusSnapshot());
        assertThat(loaded.version()).isEqualTo(Version.of(2));
    }

    @Test
    void findActive_findByStatus_andCleanup_considerStatusAndAge() {
        ProcessExecution active = executions.save(created(draft("run"))).block(TIMEOUT);
        ProcessExecution old = executions.save(created(draft("run"))).block(TIMEOUT);
        ProcessExecution recent = executions.save(created(draft("run"))).block(TIMEOUT);
        Instant longAgo = clock.instant().minus(Duration.ofDays(3));
        executions.save(old.start(longAgo).fail(null, "gone", longAgo)).block(TIMEOUT);
        executions.save(recent.start(clock.instant()).cancel("stop", clock.instant())).block(TIMEOUT);

        StepVerifier.create(executions.findActive().map(ProcessExecution::id))
                .expectNext(active.id())
                .verifyComplete();
        StepVerifier.create(executions.findByStatus(ExecutionStatus.FAILED).map(ProcessExecution::id))
                .expectNext(old.id())
                .verifyComplete();
        StepVerifier.create(executions.cleanup(Duration.ofDays(1)))
                .expectNext(1L)
                .verifyComplete();
        assertThat(executions.findById(old.id()).block(TIMEOUT)).isEmpty();
        assertThat(executions.findById(recent.id()).block(TIMEOUT)).isPresent();
        assertThat(executions.isHealthy().block(TIMEOUT)).isTrue();
    }

    // ── Event log ────────────────────────────────────────────────

    @Test
    void events_areReadBackPerExecution_inAppendOrder() {
        ExecutionId one = ExecutionId.generate();
        ExecutionId other = ExecutionId.generate();
        ProcessDefinition definition = draft("audited");
        Instant t = clock.instant();
        List<ExecutionEvent> appended = List.of(
                new ProcessStarted(one, definition.id(), "audited", 1, "tester", Map.of("k", "v"), t),
                new StepStarted(one, StepId.of("a"), "a", StepType.AGENT_TASK, 1, t.plusSeconds(1)),
                new ProcessCancelled(one, definition.id(), "audited", "ops", "enough", t.plusSeconds(2)));
        appended.forEach(event -> events.append(event).block(TIMEOUT));
        events.append(new StepStarted(other, StepId.of("a"), "a", StepType.AGENT_TASK, 1, t)).block(TIMEOUT);

        assertThat(events.findByExecutionId(one).collectList().block(TIMEOUT)).isEqualTo(appended);
        StepVerifier.create(events.findByExecutionId(other).count())
                .expectNext(1L)
                .verifyComplete();
    }

    // ── Approvals ────────────────────────────────────────────────

    @Test
    void approvalCreate_keepsFirstRequest_forSameStep() {
        ExecutionId executionId = ExecutionId.generate();
        ApprovalRequest first = ApprovalRequest.pending(executionId, StepId.of("approve"), "Buy desk", "",
                List.of("manager"), clock.instant(), clock.instant().plus(Duration.ofHours(24)));
        ApprovalRequest second = ApprovalRequest.pending(executionId, StepId.of("approve"), "Buy chair", "",
                List.of("lead"), clock.instant(), null);

        approvals.create(first).block(TIMEOUT);

        assertThat(approvals.create(second).block(TIMEOUT)).isEqualTo(first);
        assertThat(approvals.findPending("manager").collectList().block(TIMEOUT)).containsExactly(first);
        assertThat(approvals.findPending("lead").collectList().block(TIMEOUT)).isEmpty();
    }

    @Test
    void recordDecision_storesDecisionOnce() {
        ExecutionId executionId = ExecutionId.generate();
        StepId step = StepId.of("approve");
        approvals.create(ApprovalRequest.pending(executionId, step, "Buy desk", "", List.of("manager"),
                clock.instant(), null)).block(TIMEOUT);

        ApprovalRequest decided = approvals.recordDecision(executionId, step, ApprovalStatus.APPROVED, "carol",
                "ok", clock.instant()).block(TIMEOUT);

        assertThat(decided.status()).isEqualTo(ApprovalStatus.APPROVED);
        assertThat(approvals.find(executionId, step).block(TIMEOUT)).contains(decided);
        assertThat(approvals.findPending(null).collectList().block(TIMEOUT)).isEmpty();
        StepVerifier.create(approvals.recordDecision(executionId, step, ApprovalStatus.REJECTED, "dave", "no",
                        clock.instant()))
                .expectError(InvalidExecutionStateException.class)
                .verify(TIMEOUT);
        StepVerifier.create(approvals.recordDecision(executionId, StepId.of("other"), ApprovalStatus.APPROVED,
                        "carol", null, clock.instant()))
                .expectError(IllegalArgumentException.class)
                .verify(TIMEOUT);
    }
}
