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

import org.fireflyframework.process.core.event.ApprovalDecided;
import org.fireflyframework.process.core.event.ApprovalRequested;
import org.fireflyframework.process.core.event.StepFailed;
import org.fireflyframework.process.core.event.StepWaiting;
import org.fireflyframework.process.core.exception.InvalidExecutionStateException;
import org.fireflyframework.process.core.model.ApprovalStatus;
import org.fireflyframework.process.core.model.ExecutionStatus;
import org.fireflyframework.process.core.model.RetryPolicy;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepStatus;
import org.fireflyframework.process.core.scheduling.ProcessScheduler;
import org.fireflyframework.process.definition.NotificationConfig;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.StepRoles;
import org.fireflyframework.process.definition.builder.ProcessBuilder;
import org.fireflyframework.process.execution.ProcessExecution;
import org.fireflyframework.process.handler.approval.ApprovalRequest;
import org.fireflyframework.process.handler.notification.InformedAgentNotifier;
import org.fireflyframework.process.handler.notification.Notification;
import org.fireflyframework.process.testing.EngineFixture;
import org.fireflyframework.process.testing.MutableClock;
import org.fireflyframework.process.testing.ScriptedAgentGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WaitingStepsTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final MutableClock clock = MutableClock.startingNow();
    private final ScriptedAgentGateway agents = new ScriptedAgentGateway();
    private ProcessScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    private EngineFixture fixture() {
        return new EngineFixture(agents, clock, RetryPolicy.fixed(3, Duration.ZERO), null, 65536);
    }

    private static ProcessDefinition purchase(EngineFixture fixture) {
        return fixture.publish(new ProcessBuilder("purchase")
                .step("approve").approval("Approve ${input.item}", "Requested by ${input.requester}", "manager").add()
                .step("order").agentTask("buyer", "Buy ${input.item}").dependsOn("approve").add()
                .build());
    }

    // ── Human approval ───────────────────────────────────────────

    @Test
    void approvalStep_parksExecution_andFilesRequest() {
        EngineFixture fixture = fixture();
        ProcessDefinition definition = purchase(fixture);
        fixture.clearEvents();

        ProcessExecution parked = fixture.engine.start(definition.id(), "alice",
                Map.of("item", "laptop", "requester", "alice")).block(TIMEOUT);

        assertThat(parked.status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(parked.requireStep(StepId.of("approve")).status()).isEqualTo(StepStatus.WAITING);
        assertThat(parked.requireStep(StepId.of("approve")).reason()).isEqualTo("awaiting_approval");
        ApprovalRequest request = fixture.approvals.find(parked.id(), StepId.of("approve")).block(TIMEOUT).orElseThrow();
        assertThat(request.title()).isEqualTo("Approve laptop");
        assertThat(request.description()).isEqualTo("Requested by alice");
        assertThat(request.assignees()).containsExactly("manager");
        assertThat(request.deadline()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
        assertThat(fixture.events(ApprovalRequested.class)).hasSize(1);
        assertThat(fixture.events(StepWaiting.class)).hasSize(1);
        assertThat(agents.calls()).isEmpty();
    }

    @Test
    void reEnteringParkedApproval_doesNotAnnounceAgain() {
        EngineFixture fixture = fixture();
        ProcessDefinition definition = purchase(fixture);
        ProcessExecution parked = fixture.engine.start(definition.id(), "alice", Map.of("item", "desk", "requester", "bo"))
                .block(TIMEOUT);
        fixture.clearEvents();

        ProcessExecution again = fixture.engine.execute(parked.id()).block(TIMEOUT);

        assertThat(again.requireStep(StepId.of("approve")).status()).isEqualTo(StepStatus.WAITING);
        assertThat(fixture.events()).isEmpty();
        assertThat(fixture.approvals.findPending(null).count().block(TIMEOUT)).isEqualTo(1L);
    }

    @Test
    void approve_resumesExecution_toCompletion() {
        EngineFixture fixture = fixture();
        ProcessDefinition definition = purchase(fixture);
        ProcessExecution parked = fixture.engine.start(definition.id(), "alice",
                Map.of("item", "laptop", "requester", "alice")).block(TIMEOUT);

        ProcessExecution done = fixture.engine.decideApproval(parked.id(), StepId.of("approve"), ApprovalStatus.APPROVED,
                "carol", "fine by me").block(TIMEOUT);

        assertThat(done.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(done.requireStep(StepId.of("approve")).output())
                .containsEntry("decision", "approved")
                .containsEntry("decided_by", "carol");
        assertThat(agents.calls()).containsExactly("buyer: Buy laptop");
        assertThat(fixture.events(ApprovalDecided.class)).singleElement()
                .satisfies(decided -> assertThat(decided.decision()).isEqualTo(ApprovalStatus.APPROVED));
    }

    @Test
    void reject_failsExecution_withoutRetrying() {
        EngineFixture fixture = fixture();
        ProcessDefinition definition = purchase(fixture);
        ProcessExecution parked = fixture.engine.start(definition.id(), "alice",
                Map.of("item", "yacht", "requester", "alice")).block(TIMEOUT);

        ProcessExecution done = fixture.engine.decideApproval(parked.id(), StepId.of("approve"), ApprovalStatus.REJECTED,
                "carol", "too expensive").block(TIMEOUT);

        assertThat(done.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(done.requireStep(StepId.of("approve")).errorCode()).isEqualTo("APPROVAL_REJECTED");
        assertThat(done.requireStep(StepId.of("approve")).attempt()).isEqualTo(1);
        assertThat(done.requireStep(StepId.of("order")).status()).isEqualTo(StepStatus.PENDING);
        assertThat(agents.calls()).isEmpty();
    }

    @Test
    void undecidedApproval_pastDeadline_timesOut() {
        EngineFixture fixture = fixture();
        ProcessDefinition definition = purchase(fixture);
        ProcessExecution parked = fixture.engine.start(definition.id(), "alice",
                Map.of("item", "chair", "requester", "alice")).block(TIMEOUT);

        clock.advance(Duration.ofHours(25));
        ProcessExecution done = fixture.engine.execute(parked.id()).block(TIMEOUT);

        assertThat(done.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(done.requireStep(StepId.of("approve")).errorCode()).isEqualTo("APPROVAL_TIMEOUT");
    }

    @Test
    void decideApproval_forStepNotWaiting_isRejected() {
        EngineFixture fixture = fixture();
        ProcessDefinition definition = purchase(fixture);
        ProcessExecution parked = fixture.engine.start(definition.id(), "alice",
                Map.of("item", "pen", "requester", "alice")).block(TIMEOUT);

        StepVerifier.create(fixture.engine.decideApproval(parked.id(), StepId.of("order"), ApprovalStatus.APPROVED,
                        "carol", null))
                .expectError(InvalidExecutionStateException.class)
                .verify(TIMEOUT);
        StepVerifier.create(fixture.engine.decideApproval(parked.id(), StepId.of("approve"), ApprovalStatus.PENDING,
                        "carol", null))
                .expectError(IllegalArgumentException.class)
                .verify(TIMEOUT);
    }

    // ── Timers ───────────────────────────────────────────────────

    @Test
    void timer_waitsUntilDelayElapsed() {
        EngineFixture fixture = fixture();
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("cool-down")
                .step("pause").timer(Duration.ofMinutes(1)).add()
                .step("follow-up").agentTask("nudger", "ping").dependsOn("pause").add()
                .build());

        ProcessExecution parked = fixture.engine.start(definition.id(), "cron", Map.of()).block(TIMEOUT);
        assertThat(parked.requireStep(StepId.of("pause")).status()).isEqualTo(StepStatus.WAITING);
        assertThat(fixture.events(StepWaiting.class)).singleElement()
                .satisfies(waiting -> assertThat(waiting.resumeAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(1))));

        clock.advance(Duration.ofSeconds(30));
        ProcessExecution early = fixture.engine.execute(parked.id()).block(TIMEOUT);
        assertThat(early.requireStep(StepId.of("pause")).status()).isEqualTo(StepStatus.WAITING);
        assertThat(agents.calls()).isEmpty();

        clock.advance(Duration.ofSeconds(31));
        ProcessExecution done = fixture.engine.execute(parked.id()).block(TIMEOUT);
        assertThat(done.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(done.requireStep(StepId.of("pause")).output()).containsEntry("waited_seconds", 60L);
        assertThat(agents.callsTo("nudger")).isEqualTo(1);
    }

    @Test
    void timer_withScheduler_wakesExecutionUp() throws InterruptedException {
        scheduler = new ProcessScheduler(1);
        EngineFixture fixture = new EngineFixture(agents, Clock.systemUTC(), RetryPolicy.DEFAULT, scheduler, 65536);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("short-pause")
                .step("pause").timer(Duration.ofMillis(200)).add()
                .build());

        ProcessExecution parked = fixture.engine.start(definition.id(), "cron", Map.of()).block(TIMEOUT);
        assertThat(parked.status()).isEqualTo(ExecutionStatus.RUNNING);

        ExecutionStatus status = parked.status();
        long deadline = System.currentTimeMillis() + 5000;
        while (status != ExecutionStatus.COMPLETED && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
            status = fixture.engine.getExecution(parked.id()).block(TIMEOUT).status();
        }
        assertThat(status).isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    void cancel_dropsScheduledTimerWakeUp() {
        scheduler = new ProcessScheduler(1);
        EngineFixture fixture = new EngineFixture(agents, Clock.systemUTC(), RetryPolicy.DEFAULT, scheduler, 65536);
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("long-pause")
                .step("pause").timer(Duration.ofHours(1)).add()
                .build());

        ProcessExecution parked = fixture.engine.start(definition.id(), "cron", Map.of()).block(TIMEOUT);
        assertThat(scheduler.activeTaskCount()).isEqualTo(1);

        fixture.engine.cancel(parked.id(), "ops", "no longer needed").block(TIMEOUT);

        assertThat(scheduler.activeTaskCount()).isZero();
    }

    // ── Notifications ────────────────────────────────────────────

    @Test
    void notificationStep_rendersMessage_forConfiguredAndRoleRecipients() {
        EngineFixture fixture = fixture();
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("greet")
                .step("hello").config(new NotificationConfig("test", "Hello ${input.name}", List.of("team"), "Welcome"))
                .roles(new StepRoles(null, List.of("monitor-bot"), List.of("auditor"))).add()
                .build());

        ProcessExecution done = fixture.engine.start(definition.id(), "hr", Map.of("name", "Dana")).block(TIMEOUT);

        assertThat(done.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(fixture.channel.sent()).singleElement().satisfies(notification -> {
            assertThat(notification.subject()).isEqualTo("Welcome");
            assertThat(notification.message()).isEqualTo("Hello Dana");
            assertThat(notification.recipients()).containsExactly("team", "monitor-bot", "auditor");
        });
    }

    @Test
    void notificationToUnknownChannel_failsStepOnce_asInvalidConfig() {
        EngineFixture fixture = fixture();
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("lost")
                .step("hello").config(new NotificationConfig("pager", "Hi", List.of("team"), null)).add()
                .build());

        ProcessExecution done = fixture.engine.start(definition.id(), "hr", Map.of()).block(TIMEOUT);

        assertThat(done.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(done.requireStep(StepId.of("hello")).errorCode()).isEqualTo("INVALID_CONFIG");
        assertThat(done.requireStep(StepId.of("hello")).attempt()).isEqualTo(1);
        assertThat(fixture.events(StepFailed.class)).singleElement()
                .satisfies(failed -> assertThat(failed.willRetry()).isFalse());
        assertThat(fixture.channel.sent()).isEmpty();
    }

    @Test
    void failingChannel_isRetried_asDeliveryFailure() {
        EngineFixture fixture = fixture();
        fixture.channel.failWith(new IllegalStateException("smtp down"));
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("flaky")
                .step("hello").config(new NotificationConfig("test", "Hi", List.of("team"), null)).add()
                .build());

        ProcessExecution done = fixture.engine.start(definition.id(), "hr", Map.of()).block(TIMEOUT);

        assertThat(done.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(done.requireStep(StepId.of("hello")).errorCode()).isEqualTo("NOTIFICATION_DELIVERY_FAILED");
        assertThat(done.requireStep(StepId.of("hello")).attempt()).isEqualTo(3);
    }

    @Test
    void informedAgents_hearAboutCompletedSteps() {
        EngineFixture fixture = fixture();
        fixture.bus.subscribeAll(new InformedAgentNotifier(fixture.executions, fixture.definitions, fixture.router, "test"));
        ProcessDefinition definition = fixture.publish(new ProcessBuilder("informed")
                .step("work").name("Do the work").agentTask("worker", "go")
                .roles(new StepRoles("worker", List.of(), List.of("lead"))).add()
                .step("quiet").agentTask("worker", "again").dependsOn("work").add()
                .build());

        fixture.engine.start(definition.id(), "tester", Map.of()).block(TIMEOUT);

        assertThat(fixture.channel.sent()).extracting(Notification::message)
                .containsExactly("Step 'Do the work' completed");
        assertThat(fixture.channel.sent().get(0).recipients()).containsExactly("lead");
    }
}
