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

package org.fireflyframework.process.unit.engine;

import org.fireflyframework.process.core.event.CompensationStarted;
import org.fireflyframework.process.core.event.ProcessCancelled;
import org.fireflyframework.process.core.event.ProcessFailed;
import org.fireflyframework.process.core.event.ProcessStarted;
import org.fireflyframework.process.core.event.StepFailed;
import org.fireflyframework.process.core.event.StepRetrying;
import org.fireflyframework.process.core.event.StepSkipped;
import org.fireflyframework.process.core.event.StepStarted;
import org.fireflyframework.process.core.exception.AgentTaskException;
import org.fireflyframework.process.core.exception.InvalidDefinitionStateException;
import org.fireflyframework.process.core.exception.InvalidExecutionStateException;
import org.fireflyframework.process.core.exception.ProcessNotFoundException;
import org.fireflyframework.process.core.model.ErrorPolicy;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.ExecutionStatus;
import org.fireflyframework.process.core.model.Money;
import org.fireflyframework.process.core.model.OnErrorAction;
import org.fireflyframework.process.core.model.ProcessId;
import org.fireflyframework.process.core.model.RetryPolicy;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepStatus;
import org.fireflyframework.process.core.model.TokenUsage;
import org.fireflyframework.process.definition.AgentTaskConfig;
import org.fireflyframework.process.definition.CompensationConfig;
import org.fireflyframework.process.definition.CompensationType;
import org.fireflyframework.process.definition.GatewayRoute;
import org.fireflyframework.process.definition.GatewayType;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.builder.ProcessBuilder;
import org.fireflyframework.process.execution.ProcessExecution;
import org.fireflyframework.process.handler.agent.AgentResponse;
import org.fireflyframework.process.handler.notification.Notification;
import org.fireflyframework.process.testing.EngineFixture;
import org.fireflyframework.process.testing.ScriptedAgentGateway;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ExecutionEngineTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static ProcessExecution run(EngineFixture fixture, ProcessDefinition definition, Map<String, Object> input) {
        return fixture.engine.start(definition.id(), "tester", input).block(TIMEOUT);
    }

    private static CompensationConfig undo(String message) {
        return new CompensationConfig(CompensationType.NOTIFICATION, null, message, null, "test", List.of("ops"));
    }

    // ── Happy path ───────────────────────────────────────────────

    @Test
    void linearProcess_runsStepsInOrder_andAggregatesCostAndTokens() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway()
                .on("researcher", m -> Mono.just(new AgentResponse(Map.of("summary", "agents are useful"),
                        Money.of("0.10"), new TokenUsage(100, 20))))
                .on("writer", m -> Mono.just(new AgentResponse(Map.of("draft", "final post"),
                        Money.of("0.05"), new TokenUsage(50, 10))));
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("blog")
                .step("research").agentTask("researcher", "Research ${input.topic}").add()
                .step("write").agentTask("writer", "Write about ${research.summary}").dependsOn("research").add()
                .build());
        fixture.clearEvents();

        StepVerifier.create(fixture.engine.start(definition.id(), "alice", Map.of("topic", "AI")))
                .assertNext(execution -> {
                    assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
                    assertThat(execution.definitionVersion()).isEqualTo(definition.version());
                    assertThat(execution.output()).containsEntry("draft", "final post");
                    assertThat(execution.totalCost()).isEqualTo(Money.of("0.15"));
                    assertThat(execution.totalTokens()).isEqualTo(new TokenUsage(150, 30));
                    assertThat(execution.statusSnapshot().values()).containsOnly(StepStatus.COMPLETED);
                })
                .expectComplete()
                .verify(TIMEOUT);

        assertThat(agents.calls()).containsExactly("researcher: Research AI", "writer: Write about agents are useful");
        assertThat(fixture.eventTypes()).containsExactly("ProcessStarted", "StepStarted", "StepCompleted",
                "StepStarted", "StepCompleted", "ProcessCompleted");
    }

    @Test
    void independentSteps_bothRun_beforeTheirJoin() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway();
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("fan-in")
                .step("left").agentTask("left", "go").add()
                .step("right").agentTask("right", "go").add()
                .step("join").agentTask("joiner", "${left.response} and ${right.response}")
                .dependsOn("left", "right").add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(agents.calls()).hasSize(3);
        assertThat(agents.calls().get(2)).isEqualTo("joiner: left done and right done");
    }

    @Test
    void largeOutput_isStoredExternally_andStillResolvable() {
        String big = "x".repeat(500);
        ScriptedAgentGateway agents = new ScriptedAgentGateway().reply("researcher", Map.of("summary", big));
        EngineFixture fixture = new EngineFixture(agents, Clock.systemUTC(), RetryPolicy.DEFAULT, null, 64);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("big")
                .step("research").agentTask("researcher", "go").add()
                .step("summarize").agentTask("summarizer", "${research.summary}").dependsOn("research").add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.requireStep(StepId.of("research")).outputPath()).isNotNull();
        assertThat(execution.requireStep(StepId.of("research")).output()).isEmpty();
        assertThat(fixture.outputStorage.size()).isGreaterThanOrEqualTo(1);
        assertThat(agents.calls()).contains("summarizer: " + big);
    }

    // ── Cost accounting ──────────────────────────────────────────

    @Test
    void costsInOneNonDefaultCurrency_areTotalledInThatCurrency() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway()
                .on("translator", m -> Mono.just(new AgentResponse(Map.of("text", "bonjour"),
                        Money.of(new BigDecimal("1.20"), "EUR"), TokenUsage.NONE)))
                .on("reviewer", m -> Mono.just(new AgentResponse(Map.of("ok", true),
                        Money.of(new BigDecimal("0.30"), "EUR"), TokenUsage.NONE)));
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("translate")
                .step("translate").agentTask("translator", "hello").add()
                .step("notify").notification("done").dependsOn("translate").add()
                .step("review").agentTask("reviewer", "${translate.text}").dependsOn("translate").add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.totalCost()).isEqualTo(Money.of(new BigDecimal("1.50"), "EUR"));
    }

    @Test
    void costInSecondCurrency_failsExecutionOnce_insteadOfStalling() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway()
                .on("translator", m -> Mono.just(new AgentResponse(Map.of("text", "hola"),
                        Money.of(new BigDecimal("1.00"), "EUR"), TokenUsage.NONE)))
                .on("reviewer", m -> Mono.just(new AgentResponse(Map.of("ok", true),
                        Money.of("0.50"), TokenUsage.NONE)));
        EngineFixture fixture = new EngineFixture(agents, Clock.systemUTC(), RetryPolicy.fixed(3, Duration.ZERO),
                null, 65536);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("translate")
                .step("translate").agentTask("translator", "hello").add()
                .step("review").agentTask("reviewer", "${translate.text}").dependsOn("translate").add()
                .build());

        ProcessExecution failed = run(fixture, definition, Map.of());

        assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failed.failedStepId()).isEqualTo(StepId.of("review"));
        assertThat(failed.requireStep(StepId.of("review")).errorCode()).isEqualTo("COST_CURRENCY_MISMATCH");
        assertThat(failed.totalCost()).isEqualTo(Money.of(new BigDecimal("1.00"), "EUR"));
        assertThat(agents.callsTo("reviewer")).isEqualTo(1);

        StepVerifier.create(fixture.engine.execute(failed.id()))
                .assertNext(again -> assertThat(again.version()).isEqualTo(failed.version()))
                .expectComplete()
                .verify(TIMEOUT);
    }

    // ── Retries and error policies ───────────────────────────────

    @Test
    void retryableFailure_isRetried_untilSuccess() {
        AtomicInteger attempts = new AtomicInteger();
        ScriptedAgentGateway agents = new ScriptedAgentGateway().on("flaky", m -> attempts.incrementAndGet() < 3
                ? Mono.error(AgentTaskException.serverError("flaky", 503, "busy"))
                : Mono.just(AgentResponse.of(Map.of("response", "ok"))));
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("retry")
                .step("call").agentTask("flaky", "ping").retryPolicy(RetryPolicy.fixed(3, Duration.ZERO)).add()
                .build());
        fixture.clearEvents();

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.requireStep(StepId.of("call")).attempt()).isEqualTo(3);
        assertThat(agents.callsTo("flaky")).isEqualTo(3);
        assertThat(fixture.events(StepRetrying.class)).hasSize(2);
        assertThat(fixture.events(StepFailed.class)).allMatch(StepFailed::willRetry);
    }

    @Test
    void retryableFailure_exhaustingAttempts_failsExecution() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway()
                .on("down", m -> Mono.error(AgentTaskException.serverError("down", 500, "boom")));
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("exhaust")
                .step("call").agentTask("down", "ping").retryPolicy(RetryPolicy.fixed(3, Duration.ZERO)).add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.failedStepId()).isEqualTo(StepId.of("call"));
        assertThat(agents.callsTo("down")).isEqualTo(3);
        assertThat(execution.requireStep(StepId.of("call")).errorCode()).isEqualTo("AGENT_SERVER_ERROR");
        assertThat(fixture.events(ProcessFailed.class))
                .singleElement()
                .satisfies(failed -> assertThat(failed.errorCode()).isEqualTo("AGENT_SERVER_ERROR"));
    }

    @Test
    void nonRetryableFailure_isNotRetried() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway()
                .on("strict", m -> Mono.error(AgentTaskException.invalidRequest("strict", "bad prompt")));
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("strict")
                .step("call").agentTask("strict", "ping").retryPolicy(RetryPolicy.fixed(5, Duration.ZERO)).add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(agents.callsTo("strict")).isEqualTo(1);
    }

    @Test
    void retryErrorPolicy_resetsAttempts_beforeGivingUp() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway()
                .on("down", m -> Mono.error(AgentTaskException.timeout("down", "slow")));
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("reset")
                .step("call").agentTask("down", "ping")
                .retryPolicy(RetryPolicy.fixed(2, Duration.ZERO))
                .errorPolicy(new ErrorPolicy(OnErrorAction.RETRY, 1)).add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(agents.callsTo("down")).isEqualTo(4);
        assertThat(execution.requireStep(StepId.of("call")).resets()).isEqualTo(1);
    }

    @Test
    void skipErrorPolicy_skipsFailedStep_andContinues() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway()
                .on("optional", m -> Mono.error(AgentTaskException.invalidRequest("optional", "nope")));
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("skip")
                .step("enrich").agentTask("optional", "enrich").onError(OnErrorAction.SKIP).add()
                .step("finish").agentTask("finisher", "done").dependsOn("enrich").add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.requireStep(StepId.of("enrich")).status()).isEqualTo(StepStatus.SKIPPED);
        assertThat(execution.requireStep(StepId.of("enrich")).reason()).isEqualTo("error_skipped");
        assertThat(agents.callsTo("finisher")).isEqualTo(1);
    }

    @Test
    void stepTimeout_failsAttemptAsRetryableAgentTimeout() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway().on("slow", m -> Mono.never());
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("slow-step")
                .step("call").agentTask("slow", "ping").timeout(Duration.ofMillis(100))
                .retryPolicy(RetryPolicy.fixed(2, Duration.ZERO)).add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(agents.callsTo("slow")).isEqualTo(2);
        assertThat(execution.requireStep(StepId.of("call")).errorCode()).isEqualTo("AGENT_TIMEOUT");
    }

    @Test
    void agentConfigTimeout_boundsTheAgentCall() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway().on("slow", m -> Mono.never());
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("slow-agent")
                .step("call").config(new AgentTaskConfig("slow", "ping", Duration.ofMillis(100), null))
                .retryPolicy(RetryPolicy.fixed(1, Duration.ZERO)).add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(fixture.events(StepFailed.class))
                .singleElement()
                .satisfies(failed -> {
                    assertThat(failed.errorCode()).isEqualTo("AGENT_TIMEOUT");
                    assertThat(failed.willRetry()).isFalse();
                });
    }

    // ── Compensation ─────────────────────────────────────────────

    @Test
    void compensatePolicy_undoesCompletedSteps_inReverseCompletionOrder() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway()
                .on("broken", m -> Mono.error(AgentTaskException.invalidRequest("broken", "cannot")));
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("saga")
                .step("a").agentTask("alpha", "a").compensation(undo("undo a")).add()
                .step("b").agentTask("beta", "b").dependsOn("a").compensation(undo("undo b")).add()
                .step("c").agentTask("gamma", "c").dependsOn("b").compensation(undo("undo ${c.response}")).add()
                .step("d").agentTask("broken", "d").dependsOn("c").onError(OnErrorAction.COMPENSATE).add()
                .build());
        fixture.clearEvents();

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(fixture.channel.sent()).extracting(Notification::message)
                .containsExactly("undo gamma done", "undo b", "undo a");
        assertThat(fixture.channel.sent()).allMatch(n -> n.recipients().contains("ops"));
        assertThat(execution.requireStep(StepId.of("a")).status()).isEqualTo(StepStatus.COMPENSATED);
        assertThat(execution.requireStep(StepId.of("c")).status()).isEqualTo(StepStatus.COMPENSATED);
        assertThat(execution.requireStep(StepId.of("d")).status()).isEqualTo(StepStatus.FAILED);
        assertThat(fixture.events(CompensationStarted.class)).singleElement()
                .satisfies(started -> assertThat(started.stepIds())
                        .containsExactly(StepId.of("c"), StepId.of("b"), StepId.of("a")));
        List<String> types = fixture.eventTypes();
        assertThat(types.indexOf("CompensationStarted")).isLessThan(types.indexOf("ProcessFailed"));
    }

    @Test
    void failExecutionPolicy_marksFailedBeforeCompensating() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway()
                .on("broken", m -> Mono.error(AgentTaskException.invalidRequest("broken", "cannot")));
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("fail-first")
                .step("a").agentTask("alpha", "a").compensation(undo("undo a")).add()
                .step("b").agentTask("broken", "b").dependsOn("a").add()
                .build());
        fixture.clearEvents();

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(fixture.channel.sent()).extracting(Notification::message).containsExactly("undo a");
        List<String> types = fixture.eventTypes();
        assertThat(types.indexOf("ProcessFailed")).isLessThan(types.indexOf("CompensationStarted"));
    }

    // ── Conditions and gateways ──────────────────────────────────

    @Test
    void falseCondition_skipsStep_andDependentsStillRun() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway();
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("conditional")
                .step("premium").agentTask("concierge", "vip").condition("${input.tier} == 'gold'").add()
                .step("wrap").agentTask("closer", "bye").dependsOn("premium").add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of("tier", "silver"));

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.requireStep(StepId.of("premium")).status()).isEqualTo(StepStatus.SKIPPED);
        assertThat(fixture.events(StepSkipped.class)).extracting(StepSkipped::reason).containsExactly("condition_not_met");
        assertThat(agents.callsTo("concierge")).isZero();
        assertThat(agents.callsTo("closer")).isEqualTo(1);
    }

    @Test
    void exclusiveGateway_runsSelectedBranch_andSkipsTheOther() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway();
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("routing")
                .step("check").gateway(GatewayType.EXCLUSIVE, "low", GatewayRoute.when("${input.amount} > 100", "high")).add()
                .step("high").agentTask("manager", "big spend").dependsOn("check").add()
                .step("low").agentTask("clerk", "small spend").dependsOn("check").add()
                .step("done").agentTask("closer", "close").dependsOn("high", "low").add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of("amount", 250));

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.requireStep(StepId.of("check")).output()).containsEntry("route", "high");
        assertThat(execution.requireStep(StepId.of("low")).status()).isEqualTo(StepStatus.SKIPPED);
        assertThat(execution.requireStep(StepId.of("low")).reason()).isEqualTo("branch_not_taken");
        assertThat(agents.callsTo("manager")).isEqualTo(1);
        assertThat(agents.callsTo("clerk")).isZero();
        assertThat(agents.callsTo("closer")).isEqualTo(1);
    }

    @Test
    void parallelGateway_runsEveryBranch() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway();
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("parallel")
                .step("split").gateway(GatewayType.PARALLEL, null,
                        GatewayRoute.when("", "x"), GatewayRoute.when("", "y")).add()
                .step("x").agentTask("ax", "x").dependsOn("split").add()
                .step("y").agentTask("ay", "y").dependsOn("split").add()
                .build());

        ProcessExecution execution = run(fixture, definition, Map.of());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(agents.callsTo("ax")).isEqualTo(1);
        assertThat(agents.callsTo("ay")).isEqualTo(1);
    }

    @Test
    void executeAgain_onTerminalExecution_changesNothing() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway();
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("once")
                .step("check").gateway(GatewayType.EXCLUSIVE, "low", GatewayRoute.when("${input.amount} > 100", "high")).add()
                .step("high").agentTask("manager", "big").dependsOn("check").add()
                .step("low").agentTask("clerk", "small").dependsOn("check").add()
                .build());
        ProcessExecution first = run(fixture, definition, Map.of("amount", 5));
        int eventsBefore = fixture.events().size();

        ProcessExecution again = fixture.engine.execute(first.id()).block(TIMEOUT);

        assertThat(again.version()).isEqualTo(first.version());
        assertThat(again.requireStep(StepId.of("check")).output()).containsEntry("route", "low");
        assertThat(fixture.events()).hasSize(eventsBefore);
        assertThat(agents.callsTo("clerk")).isEqualTo(1);
    }

    // ── Cancellation ─────────────────────────────────────────────

    @Test
    void cancel_interruptsRunningStep_andSkipsTheRest() throws InterruptedException {
        CountDownLatch dispatched = new CountDownLatch(1);
        ScriptedAgentGateway agents = new ScriptedAgentGateway().on("slow", m -> {
            dispatched.countDown();
            return Mono.never();
        });
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("long")
                .step("wait").agentTask("slow", "take your time").add()
                .step("after").agentTask("closer", "close").dependsOn("wait").add()
                .build());

        ExecutionId id = fixture.engine.submit(definition.id(), "tester", Map.of()).block(TIMEOUT);
        assertThat(dispatched.await(5, TimeUnit.SECONDS)).isTrue();

        ProcessExecution cancelled = fixture.engine.cancel(id, "bob", "no longer needed").block(TIMEOUT);

        assertThat(cancelled.status()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(cancelled.statusSnapshot().values()).containsOnly(StepStatus.SKIPPED);
        assertThat(agents.callsTo("closer")).isZero();
        assertThat(fixture.events(ProcessCancelled.class)).singleElement()
                .satisfies(event -> assertThat(event.cancelledBy()).isEqualTo("bob"));

        StepVerifier.create(fixture.engine.cancel(id, "bob", "again"))
                .expectError(InvalidExecutionStateException.class)
                .verify(TIMEOUT);
    }

    // ── Exclusive drives ─────────────────────────────────────────

    @Test
    void concurrentDrives_ofSameExecution_startEachStepAttemptOnce() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway()
                .on("fetcher", m -> Mono.delay(Duration.ofMillis(100))
                        .thenReturn(AgentResponse.of(Map.of("rows", 3))));
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("import")
                .step("fetch").agentTask("fetcher", "pull").add()
                .step("store").agentTask("writer", "${fetch.rows} rows").dependsOn("fetch").add()
                .build());
        ProcessExecution created = fixture.executions.save(
                ProcessExecution.create(definition, Map.of(), "tester", null, fixture.clock.instant())).block(TIMEOUT);
        fixture.clearEvents();

        List<ProcessExecution> results = Flux.merge(
                        fixture.engine.execute(created.id()).subscribeOn(Schedulers.boundedElastic()),
                        fixture.engine.execute(created.id()).subscribeOn(Schedulers.boundedElastic()),
                        fixture.engine.execute(created.id()).subscribeOn(Schedulers.boundedElastic()))
                .collectList()
                .block(TIMEOUT);

        assertThat(results).hasSize(3).allSatisfy(execution ->
                assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED));
        assertThat(fixture.events(StepStarted.class))
                .extracting(StepStarted::stepId)
                .containsExactly(StepId.of("fetch"), StepId.of("store"));
        assertThat(fixture.events(ProcessStarted.class)).hasSize(1);
        assertThat(agents.callsTo("fetcher")).isEqualTo(1);
        assertThat(agents.callsTo("writer")).isEqualTo(1);
    }

    // ── Re-runs and lookup failures ──────────────────────────────

    @Test
    void retryExecution_startsNewExecution_linkedToFailedOne() {
        AtomicInteger calls = new AtomicInteger();
        ScriptedAgentGateway agents = new ScriptedAgentGateway().on("once-broken", m -> calls.incrementAndGet() == 1
                ? Mono.error(AgentTaskException.invalidRequest("once-broken", "first time"))
                : Mono.just(AgentResponse.of(Map.of("response", "fine"))));
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("rerun")
                .step("call").agentTask("once-broken", "${input.ticket}").add()
                .build());
        ProcessExecution failed = run(fixture, definition, Map.of("ticket", "T-1"));
        assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);

        ProcessExecution retried = fixture.engine.retryExecution(failed.id(), "ops").block(TIMEOUT);

        assertThat(retried.id()).isNotEqualTo(failed.id());
        assertThat(retried.retryOf()).isEqualTo(failed.id());
        assertThat(retried.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(retried.input()).containsEntry("ticket", "T-1");
        assertThat(agents.calls()).containsExactly("once-broken: T-1", "once-broken: T-1");
    }

    @Test
    void retryExecution_ofCompletedExecution_isRejected() {
        EngineFixture fixture = new EngineFixture(new ScriptedAgentGateway());
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("ok")
                .step("call").agentTask("any", "go").add()
                .build());
        ProcessExecution done = run(fixture, definition, Map.of());

        StepVerifier.create(fixture.engine.retryExecution(done.id(), "ops"))
                .expectError(InvalidExecutionStateException.class)
                .verify(TIMEOUT);
    }

    @Test
    void start_withUnknownProcess_fails() {
        EngineFixture fixture = new EngineFixture(new ScriptedAgentGateway());

        StepVerifier.create(fixture.engine.start(ProcessId.generate(), "tester", Map.of()))
                .expectError(ProcessNotFoundException.class)
                .verify(TIMEOUT);
    }

    @Test
    void start_withDraftOnlyProcess_fails() {
        EngineFixture fixture = new EngineFixture(new ScriptedAgentGateway());
        ProcessDefinition draft = fixture.definitionService.create(new ProcessBuilder("draft-only")
                .step("call").agentTask("any", "go").add()
                .build()).block(TIMEOUT);

        StepVerifier.create(fixture.engine.start(draft.id(), "tester", Map.of()))
                .expectError(InvalidDefinitionStateException.class)
                .verify(TIMEOUT);
    }

    @Test
    void start_usesPublishedVersion_whileNewerDraftExists() {
        ScriptedAgentGateway agents = new ScriptedAgentGateway();
        EngineFixture fixture = new EngineFixture(agents);
        ProcessDefinition published = fixture.publish(new ProcessBuilder("versioned")
                .step("call").agentTask("v1-agent", "go").add()
                .build());
        fixture.definitionService.createNewVersion(published.id()).block(TIMEOUT);

        ProcessExecution execution = run(fixture, published, Map.of());

        assertThat(execution.definitionVersion()).isEqualTo(published.version());
        assertThat(agents.callsTo("v1-agent")).isEqualTo(1);
    }
}
