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

package org.fireflyframework.process.engine;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.event.*;
import org.fireflyframework.process.core.exception.AgentTaskException;
import org.fireflyframework.process.core.exception.ExecutionNotFoundException;
import org.fireflyframework.process.core.exception.ExpressionException;
import org.fireflyframework.process.core.exception.InvalidDefinitionStateException;
import org.fireflyframework.process.core.exception.InvalidExecutionStateException;
import org.fireflyframework.process.core.exception.ProcessNotFoundException;
import org.fireflyframework.process.core.expression.EvaluationContext;
import org.fireflyframework.process.core.expression.ExpressionEvaluator;
import org.fireflyframework.process.core.model.*;
import org.fireflyframework.process.core.output.StepOutputs;
import org.fireflyframework.process.core.persistence.ProcessDefinitionRepository;
import org.fireflyframework.process.core.persistence.ProcessExecutionRepository;
import org.fireflyframework.process.core.scheduling.ProcessScheduler;
import org.fireflyframework.process.core.topology.DependencyResolver;
import org.fireflyframework.process.definition.GatewayConfig;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.StepDefinition;
import org.fireflyframework.process.execution.ProcessExecution;
import org.fireflyframework.process.execution.StepExecution;
import org.fireflyframework.process.handler.approval.ApprovalStore;
import org.fireflyframework.process.handler.gateway.GatewayHandler;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.TimeoutException;

/**
 * Drives process executions from CREATED to a terminal status.
 *
 * <p>A drive runs in waves under a per-execution lock. Each wave re-derives the eligible
 * steps from the persisted state, marks them RUNNING, invokes their handlers concurrently
 * and applies the results one by one in definition order. Every state change is persisted
 * before the event describing it is published. A drive ends when the execution is terminal
 * or nothing can run until an external event: a step WAITING for a decision or timer, or a
 * retry whose backoff has not elapsed (the engine waits for the backoff without holding the
 * lock or a thread).
 *
 * <p>{@link #execute(ExecutionId)} is re-entrant: calling it again for the same execution
 * (approval decision, timer wake-up, recovery) continues from the persisted state.
 */
@Slf4j
public class ExecutionEngine {

    /** Failure codes that are never retried, whatever the handler reports. */
    public static final Set<String> NON_RETRYABLE_CODES = Set.of("APPROVAL_REJECTED", "VALIDATION_ERROR", "INVALID_CONFIG",
            "COST_CURRENCY_MISMATCH");

    private final ProcessDefinitionRepository definitions;
    private final ProcessExecutionRepository executions;
    private final StepHandlerRegistry handlers;
    private final ExpressionEvaluator evaluator;
    private final StepOutputs outputs;
    private final DomainEventPublisher publisher;
    private final CompensationRunner compensation;
    private final ApprovalStore approvals;
    private final ProcessScheduler scheduler;
    private final RetryPolicy defaultRetryPolicy;
    private final Clock clock;

    private final ExecutionLocks locks = new ExecutionLocks();
    private final ActiveExecutions active = new ActiveExecutions();

    public ExecutionEngine(ProcessDefinitionRepository definitions, ProcessExecutionRepository executions,
                           StepHandlerRegistry handlers, ExpressionEvaluator evaluator, StepOutputs outputs,
                           DomainEventPublisher publisher, CompensationRunner compensation,
                           ApprovalStore approvals, ProcessScheduler scheduler,
                           RetryPolicy defaultRetryPolicy, Clock clock) {
        this.definitions = Objects.requireNonNull(definitions, "definitions");
        this.executions = Objects.requireNonNull(executions, "executions");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.outputs = Objects.requireNonNull(outputs, "outputs");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.compensation = Objects.requireNonNull(compensation, "compensation");
        this.approvals = approvals;
        this.scheduler = scheduler;
        this.defaultRetryPolicy = defaultRetryPolicy != null ? defaultRetryPolicy : RetryPolicy.DEFAULT;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    // ── Entry points ──────────────────────────────────────────────

    /**
     * Creates an execution of the current published version of the process and drives it
     * until it is terminal or parked.
     */
    public Mono<ProcessExecution> start(ProcessId processId, String triggeredBy, Map<String, Object> input) {
        return create(processId, triggeredBy, input).flatMap(execution -> execute(execution.id()));
    }

    /**
     * Creates an execution and drives it in the background. Used by trigger services that
     * only need the id.
     */
    public Mono<ExecutionId> submit(ProcessId processId, String triggeredBy, Map<String, Object> input) {
        return create(processId, triggeredBy, input).map(execution -> {
            execute(execution.id())
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe(done -> log.debug("[engine] Execution {} settled in {}", done.id(), done.status()),
                            err -> log.error("[engine] Background drive of execution {} failed", execution.id(), err));
            return execution.id();
        });
    }

    /** Drives the execution from its persisted state until it is terminal or parked. */
    public Mono<ProcessExecution> execute(ExecutionId executionId) {
        return Mono.defer(() -> {
            CancellationSignal signal = active.enter(executionId);
            return driveUntilParked(executionId, signal)
                    .doFinally(s -> active.leave(executionId));
        }).doOnError(e -> log.error("[engine] Drive of execution {} aborted: {}", executionId, e.getMessage()));
    }

    /**
     * Cancels the execution. In-flight handlers are signalled first; then every
     * non-terminal step is settled SKIPPED and the execution becomes CANCELLED.
     */
    public Mono<ProcessExecution> cancel(ExecutionId executionId, String cancelledBy, String reason) {
        return Mono.defer(() -> {
            active.signal(executionId).ifPresent(CancellationSignal::cancel);
            return locks.withLock(executionId, () -> load(executionId).flatMap(execution -> {
                if (execution.isTerminal()) {
                    return Mono.error(new InvalidExecutionStateException("Execution " + executionId
                            + " is already " + execution.status()));
                }
                Instant now = clock.instant();
                return executions.save(execution.cancel(reason, now))
                        .flatMap(saved -> publisher.publish(new ProcessCancelled(saved.id(), saved.processId(),
                                saved.processName(), cancelledBy, reason, now)).thenReturn(saved));
            }));
        }).doOnSuccess(cancelled -> {
            cancelWakeUps(executionId);
            log.info("[engine] Execution {} cancelled by {}", executionId, cancelledBy);
        });
    }

    /**
     * Records a human decision for a WAITING approval step, publishes
     * {@link ApprovalDecided} and re-enters the execution.
     */
    public Mono<ProcessExecution> decideApproval(ExecutionId executionId, StepId stepId, ApprovalStatus decision,
                                                 String decidedBy, String comment) {
        if (approvals == null) {
            return Mono.error(new IllegalStateException("No approval store is configured"));
        }
        if (decision == null || !decision.isDecided()) {
            return Mono.error(new IllegalArgumentException("Decision must be approved or rejected"));
        }
        return load(executionId).flatMap(execution -> {
            if (execution.isTerminal()) {
                return Mono.error(new InvalidExecutionStateException("Execution " + executionId + " is "
                        + execution.status()));
            }
            StepExecution step = execution.step(stepId).orElse(null);
            if (step == null || step.status() != StepStatus.WAITING) {
                return Mono.error(new InvalidExecutionStateException("Step '" + stepId + "' of execution "
                        + executionId + " is not awaiting a decision"));
            }
            Instant now = clock.instant();
            return approvals.recordDecision(executionId, stepId, decision, decidedBy, comment, now)
                    .flatMap(request -> publisher.publish(new ApprovalDecided(executionId, stepId, decision,
                            decidedBy, comment, now)))
                    .doOnSuccess(v -> log.info("[approval] Step '{}' of execution {} {} by {}",
                            stepId, executionId, decision.value(), decidedBy))
                    .then(Mono.defer(() -> execute(executionId)));
        });
    }

    /**
     * Starts a new execution of the same definition version with the same input as a
     * FAILED one; the new execution records the failed one as {@code retryOf}.
     */
    public Mono<ProcessExecution> retryExecution(ExecutionId failedExecutionId, String triggeredBy) {
        return load(failedExecutionId).flatMap(failed -> {
            if (failed.status() != ExecutionStatus.FAILED) {
                return Mono.error(new InvalidExecutionStateException("Only FAILED executions can be retried; "
                        + failedExecutionId + " is " + failed.status()));
            }
            return loadDefinition(failed)
                    .flatMap(definition -> persistNew(definition, failed.input(), triggeredBy, failed.id()));
        }).flatMap(execution -> execute(execution.id()));
    }

    public Mono<ProcessExecution> getExecution(ExecutionId executionId) {
        return load(executionId);
    }

    /** Whether this engine instance is currently driving (or waiting to drive) the execution. */
    public boolean isActive(ExecutionId executionId) {
        return active.isActive(executionId) || locks.isLocked(executionId);
    }

    // ── Recovery hooks ────────────────────────────────────────────

    /** Returns an interrupted RUNNING step to PENDING; its next start counts as a new attempt. */
    public Mono<ProcessExecution> retryInterruptedStep(ExecutionId executionId, StepId stepId) {
        return updateInterrupted(executionId, stepId, StepExecution::interruptedForRetry)
                .then(Mono.defer(() -> execute(executionId)));
    }

    /** Parks an interrupted RUNNING step as WAITING so its handler re-checks the outcome. */
    public Mono<ProcessExecution> recheckInterruptedStep(ExecutionId executionId, StepId stepId) {
        return updateInterrupted(executionId, stepId, StepExecution::interruptedForRecheck)
                .then(Mono.defer(() -> execute(executionId)));
    }

    /**
     * Settles an interrupted RUNNING (or parked WAITING) step as a non-retryable failure and applies the step's
     * error policy, exactly as if its handler had failed.
     */
    public Mono<ProcessExecution> failInterruptedStep(ExecutionId executionId, StepId stepId, String error,
                                                      String code) {
        return locks.withLock(executionId, () -> load(executionId).flatMap(execution -> {
            StepExecution step = execution.step(stepId).orElse(null);
            if (execution.isTerminal() || step == null
                    || (step.status() != StepStatus.RUNNING && step.status() != StepStatus.WAITING)) {
                return Mono.just(execution);
            }
            return loadDefinition(execution).flatMap(definition -> {
                Drive drive = new Drive(definition, execution, CancellationSignal.none());
                List<Fatal> fatals = new ArrayList<>();
                return exhausted(drive, definition.requireStep(stepId), new StepResult.Failure(error, code, false),
                        fatals)
                        .then(Mono.defer(() -> fatals.isEmpty() ? Mono.<Void>empty() : failExecution(drive, fatals)))
                        .then(Mono.fromSupplier(() -> drive.execution));
            });
        })).then(Mono.defer(() -> execute(executionId)));
    }

    /**
     * Fails a non-terminal execution that has no step to blame, such as one parked far
     * beyond the recovery cutoff.
     */
    public Mono<ProcessExecution> abandonExecution(ExecutionId executionId, String error, String code) {
        return locks.withLock(executionId, () -> load(executionId).flatMap(execution -> {
            if (execution.isTerminal()) {
                return Mono.just(execution);
            }
            Instant now = clock.instant();
            return executions.save(execution.fail(null, error, now))
                    .flatMap(failed -> publisher.publish(new ProcessFailed(failed.id(), failed.processId(),
                            failed.processName(), null, error, code, now)).thenReturn(failed));
        })).doOnNext(failed -> {
            cancelWakeUps(executionId);
            log.warn("[engine] Execution {} abandoned: {}", executionId, error);
        });
    }

    private Mono<ProcessExecution> updateInterrupted(ExecutionId executionId, StepId stepId,
                                                     java.util.function.UnaryOperator<StepExecution> change) {
        return locks.withLock(executionId, () -> load(executionId).flatMap(execution -> {
            StepExecution step = execution.step(stepId).orElse(null);
            if (execution.isTerminal() || step == null || step.status() != StepStatus.RUNNING) {
                log.debug("[engine] Step '{}' of execution {} is no longer interrupted", stepId, executionId);
                return Mono.just(execution);
            }
            return executions.save(execution.updateStep(stepId, change, clock.instant()));
        }));
    }

    // ── Drive loop ────────────────────────────────────────────────

    private Mono<ProcessExecution> driveUntilParked(ExecutionId executionId, CancellationSignal signal) {
        return locks.withLock(executionId, () -> driveOnce(executionId, signal))
                .flatMap(outcome -> {
                    if (outcome.nextWakeUp() == null || signal.isCancelled()) {
                        return Mono.just(outcome.execution());
                    }
                    Duration wait = Duration.between(clock.instant(), outcome.nextWakeUp());
                    if (wait.isNegative()) wait = Duration.ZERO;
                    log.debug("[engine] Execution {} backing off for {}", executionId, wait);
                    return Mono.delay(wait)
                            .takeUntilOther(signal.whenCancelled())
                            .then(Mono.defer(() -> signal.isCancelled()
                                    ? load(executionId)
                                    : driveUntilParked(executionId, signal)));
                });
    }

    private Mono<DriveOutcome> driveOnce(ExecutionId executionId, CancellationSignal signal) {
        return load(executionId).flatMap(execution -> {
            if (execution.isTerminal() || signal.isCancelled()) {
                return Mono.just(new DriveOutcome(execution, null));
            }
            return loadDefinition(execution).flatMap(definition -> {
                Drive drive = new Drive(definition, execution, signal);
                Mono<Void> begin = execution.status() == ExecutionStatus.CREATED ? begin(drive) : Mono.empty();
                return begin
                        .then(Mono.defer(() -> runWaves(drive)))
                        .then(Mono.defer(() -> settle(drive)));
            });
        });
    }

    private Mono<Void> begin(Drive drive) {
        Instant now = clock.instant();
        return persist(drive, drive.execution.start(now))
                .flatMap(started -> publisher.publish(new ProcessStarted(started.id(), started.processId(),
                        started.processName(), started.definitionVersion().value(), started.triggeredBy(),
                        started.input(), now)))
                .doOnSuccess(v -> log.info("[engine] Execution {} of '{}' started by {}",
                        drive.execution.id(), drive.execution.processName(), drive.execution.triggeredBy()));
    }

    private Mono<Void> runWaves(Drive drive) {
        if (drive.execution.isTerminal() || drive.signal.isCancelled()) {
            return Mono.empty();
        }
        return reconcileGateways(drive)
                .then(Mono.defer(() -> expressionContext(drive.execution, drive.definition)))
                .flatMap(context -> runWave(drive, context))
                .flatMap(progressed -> progressed ? Mono.defer(() -> runWaves(drive)) : Mono.empty());
    }

    /** One wave; emits {@code true} when it changed any step. */
    private Mono<Boolean> runWave(Drive drive, EvaluationContext context) {
        Instant now = clock.instant();
        ProcessExecution execution = drive.execution;
        List<StepId> eligible = DependencyResolver.eligibleSteps(drive.definition, execution.statusSnapshot()).stream()
                .filter(id -> execution.requireStep(id).isRetryDue(now))
                .toList();
        List<StepId> waiting = drive.firstWave
                ? execution.stepsWithStatus(StepStatus.WAITING).stream().map(StepExecution::stepId).toList()
                : List.of();
        drive.firstWave = false;
        if (eligible.isEmpty() && waiting.isEmpty()) {
            return Mono.just(false);
        }

        return Flux.concat(
                        Flux.fromIterable(eligible).concatMap(id -> prepare(drive, drive.definition.requireStep(id), context)),
                        Flux.fromIterable(waiting).concatMap(id -> reenter(drive, drive.definition.requireStep(id))))
                .collectList()
                .flatMap(dispatches -> {
                    if (dispatches.isEmpty()) {
                        return Mono.just(true);
                    }
                    ProcessExecution snapshot = drive.execution;
                    return Flux.fromIterable(dispatches)
                            .flatMap(dispatch -> invoke(drive, snapshot, dispatch, context)
                                    .map(result -> new Invocation(dispatch, result)))
                            .collectList()
                            .flatMap(invocations -> apply(drive, invocations))
                            .thenReturn(true);
                });
    }

    /** Starts an eligible step, or skips it when its condition does not hold. */
    private Mono<Dispatch> prepare(Drive drive, StepDefinition step, EvaluationContext context) {
        StepResult preset = null;
        if (step.hasCondition()) {
            try {
                if (!evaluator.evaluateCondition(step.condition(), context)) {
                    return skipStep(drive, step.id(), "condition_not_met").then(Mono.empty());
                }
            } catch (ExpressionException e) {
                preset = StepResult.failure(e.getMessage(), "EXPRESSION_ERROR", false);
            }
        }
        StepResult presetResult = preset;
        Instant now = clock.instant();
        return persist(drive, drive.execution.startStep(step.id(), now))
                .flatMap(updated -> {
                    StepExecution started = updated.requireStep(step.id());
                    return publisher.publish(new StepStarted(updated.id(), step.id(), step.name(), step.type(),
                                    started.attempt(), now))
                            .thenReturn(new Dispatch(step, started, false, presetResult));
                });
    }

    private Mono<Dispatch> reenter(Drive drive, StepDefinition step) {
        return persist(drive, drive.execution.updateStep(step.id(), StepExecution::reenter, clock.instant()))
                .map(updated -> new Dispatch(step, updated.requireStep(step.id()), true, null));
    }

    private Mono<StepResult> invoke(Drive drive, ProcessExecution snapshot, Dispatch dispatch,
                                    EvaluationContext context) {
        if (dispatch.preset() != null) {
            return Mono.just(dispatch.preset());
        }
        StepDefinition step = dispatch.step();
        Optional<StepHandler> handler = handlers.find(step.type());
        if (handler.isEmpty()) {
            return Mono.just(StepResult.failure("No handler registered for step type '" + step.type().value() + "'",
                    "HANDLER_ERROR", false));
        }
        StepContext stepContext = new StepContext(snapshot, step, dispatch.state(), context, evaluator,
                drive.signal, clock.instant());
        Mono<StepResult> call = Mono.defer(() -> handler.get().execute(stepContext));
        if (step.timeout() != null) {
            call = call.timeout(step.timeout());
        }
        return call
                .takeUntilOther(drive.signal.whenCancelled())
                .switchIfEmpty(Mono.fromSupplier(() -> drive.signal.isCancelled()
                        ? StepResult.failure("Execution cancelled", "CANCELLED", false)
                        : StepResult.failure("Handler returned no result", "HANDLER_ERROR", false)))
                .onErrorResume(e -> Mono.just(toFailure(step, e)));
    }

    private StepResult toFailure(StepDefinition step, Throwable error) {
        if (error instanceof TimeoutException) {
            return StepResult.failure("Step '" + step.id() + "' timed out after " + step.timeout(),
                    step.type() == StepType.AGENT_TASK ? "AGENT_TIMEOUT" : "HANDLER_ERROR", true);
        }
        if (error instanceof AgentTaskException agentError) {
            return StepResult.failure(agentError.getMessage(), agentError.getFailureCode(), agentError.isRetryable());
        }
        if (error instanceof ExpressionException) {
            return StepResult.failure(error.getMessage(), "EXPRESSION_ERROR", false);
        }
        log.error("[engine] Handler for step '{}' threw unexpectedly", step.id(), error);
        return StepResult.failure(String.valueOf(error.getMessage()), "HANDLER_ERROR", false);
    }

    private Mono<Void> apply(Drive drive, List<Invocation> invocations) {
        if (drive.signal.isCancelled()) {
            return Mono.empty();
        }
        List<Invocation> ordered = new ArrayList<>(invocations);
        ordered.sort(Comparator.comparingInt(i -> drive.definition.indexOf(i.dispatch().step().id())));
        List<Fatal> fatals = new ArrayList<>();
        return Flux.fromIterable(ordered)
                .concatMap(invocation -> applyResult(drive, invocation, fatals))
                .then(Mono.defer(() -> fatals.isEmpty() ? Mono.<Void>empty() : failExecution(drive, fatals)));
    }

    private Mono<Void> applyResult(Drive drive, Invocation invocation, List<Fatal> fatals) {
        if (drive.execution.isTerminal()) {
            return Mono.empty();
        }
        StepDefinition step = invocation.dispatch().step();
        StepResult result = invocation.result();
        if (result instanceof StepResult.Success success) {
            if (!drive.execution.acceptsCost(success.cost())) {
                return applyFailure(drive, step, StepResult.failure("Step '" + step.id() + "' reported a cost in "
                        + success.cost().currency() + " but the execution accounts in "
                        + drive.execution.costCurrency(), "COST_CURRENCY_MISMATCH", false), fatals);
            }
            return applySuccess(drive, step, success);
        }
        if (result instanceof StepResult.Suspend suspend) {
            return applySuspend(drive, invocation.dispatch(), suspend);
        }
        return applyFailure(drive, step, (StepResult.Failure) result, fatals);
    }

    private Mono<Void> applySuccess(Drive drive, StepDefinition step, StepResult.Success success) {
        Instant now = clock.instant();
        ExecutionId executionId = drive.execution.id();
        return outputs.place(executionId, step.id(), success.output())
                .flatMap(placement -> {
                    StepExecution running = drive.execution.requireStep(step.id());
                    Duration duration = success.duration() != null ? success.duration()
                            : running.startedAt() != null ? Duration.between(running.startedAt(), now) : Duration.ZERO;
                    return persist(drive, drive.execution.updateStep(step.id(), s -> s.complete(placement.inline(),
                            placement.path(), success.cost(), success.tokens(), duration, now), now))
                            .flatMap(updated -> publisher.publish(new StepCompleted(executionId, step.id(), step.name(),
                                    placement.path() == null ? success.output() : Map.of(),
                                    placement.path() != null ? placement.path().toString() : null,
                                    success.cost(), success.tokens(), duration, now)));
                })
                .doOnSuccess(v -> log.info("[engine] Step '{}' of execution {} completed", step.id(), executionId));
    }

    private Mono<Void> applySuspend(Drive drive, Dispatch dispatch, StepResult.Suspend suspend) {
        StepDefinition step = dispatch.step();
        ExecutionId executionId = drive.execution.id();
        Instant now = clock.instant();
        Mono<Void> announce = Mono.empty();
        if (!dispatch.reentry()) {
            announce = publisher.publish(new StepWaiting(executionId, step.id(), step.name(), suspend.reason(),
                    suspend.resumeAt(), now));
            if (suspend.announcement() != null) {
                announce = announce.then(publisher.publish(suspend.announcement()));
            }
        }
        return persist(drive, drive.execution.updateStep(step.id(), s -> s.waiting(suspend.reason()), now))
                .then(announce)
                .then(Mono.fromRunnable(() -> scheduleWakeUp(executionId, step.id(), suspend.resumeAt())));
    }

    private Mono<Void> applyFailure(Drive drive, StepDefinition step, StepResult.Failure failure, List<Fatal> fatals) {
        StepExecution state = drive.execution.requireStep(step.id());
        RetryPolicy policy = step.retryPolicyOr(defaultRetryPolicy);
        if (isRetryable(drive, failure) && policy.shouldRetry(state.attempt())) {
            Instant now = clock.instant();
            Instant retryAt = now.plus(policy.calculateDelay(state.attempt()));
            log.warn("[engine] Step '{}' of execution {} failed on attempt {}/{} ({}), retrying at {}",
                    step.id(), drive.execution.id(), state.attempt(), policy.maxAttempts(), failure.code(), retryAt);
            return persist(drive, drive.execution.updateStep(step.id(),
                            s -> s.scheduleRetry(failure.error(), failure.code(), retryAt), now))
                    .then(Mono.defer(() -> publisher.publishAll(List.of(
                            stepFailed(drive, step, failure, state.attempt(), true, now),
                            new StepRetrying(drive.execution.id(), step.id(), step.name(), failure.error(),
                                    state.attempt(), policy.maxAttempts(), retryAt, now)))));
        }
        return exhausted(drive, step, failure, fatals);
    }

    private boolean isRetryable(Drive drive, StepResult.Failure failure) {
        return failure.retryable() && !NON_RETRYABLE_CODES.contains(failure.code()) && !drive.signal.isCancelled();
    }

    /** Applies the step's error policy to a failure that will not be retried. */
    private Mono<Void> exhausted(Drive drive, StepDefinition step, StepResult.Failure failure, List<Fatal> fatals) {
        StepExecution state = drive.execution.requireStep(step.id());
        ErrorPolicy errorPolicy = step.errorPolicy();
        Instant now = clock.instant();
        ExecutionId executionId = drive.execution.id();

        if (errorPolicy.onError() == OnErrorAction.SKIP) {
            log.warn("[engine] Step '{}' of execution {} failed ({}), skipping per error policy",
                    step.id(), executionId, failure.code());
            return persist(drive, drive.execution.updateStep(step.id(), s -> s.skip("error_skipped", now), now))
                    .then(Mono.defer(() -> publisher.publishAll(List.of(
                            stepFailed(drive, step, failure, state.attempt(), false, now),
                            new StepSkipped(executionId, step.id(), step.name(), "error_skipped", now)))));
        }
        if (errorPolicy.onError() == OnErrorAction.RETRY && state.resets() < errorPolicy.maxResets()
                && !NON_RETRYABLE_CODES.contains(failure.code()) && !drive.signal.isCancelled()) {
            RetryPolicy policy = step.retryPolicyOr(defaultRetryPolicy);
            Instant retryAt = now.plus(policy.calculateDelay(1));
            log.warn("[engine] Step '{}' of execution {} exhausted its attempts, resetting ({} of {})",
                    step.id(), executionId, state.resets() + 1, errorPolicy.maxResets());
            return persist(drive, drive.execution.updateStep(step.id(),
                            s -> s.resetAttempts(failure.error(), failure.code(), retryAt), now))
                    .then(Mono.defer(() -> publisher.publishAll(List.of(
                            stepFailed(drive, step, failure, state.attempt(), true, now),
                            new StepRetrying(executionId, step.id(), step.name(), failure.error(), 0,
                                    policy.maxAttempts(), retryAt, now)))));
        }

        log.error("[engine] Step '{}' of execution {} failed: {} ({})", step.id(), executionId, failure.error(),
                failure.code());
        return persist(drive, drive.execution.updateStep(step.id(), s -> s.fail(failure.error(), failure.code(), now), now))
                .then(Mono.defer(() -> publisher.publish(stepFailed(drive, step, failure, state.attempt(), false, now))))
                .then(Mono.fromRunnable(() -> fatals.add(new Fatal(step, failure))));
    }

    /**
     * Fails the execution for the first fatal step. {@code compensate} rolls back before the
     * execution is marked FAILED, {@code fail_execution} marks it FAILED first.
     */
    private Mono<Void> failExecution(Drive drive, List<Fatal> fatals) {
        Fatal first = fatals.get(0);
        Mono<Void> compensate = Mono.defer(() -> compensation.compensate(drive.execution, drive.definition))
                .doOnNext(drive::setExecution)
                .then();
        if (first.step().errorPolicy().onError() == OnErrorAction.COMPENSATE) {
            return compensate.then(Mono.defer(() -> markFailed(drive, first)));
        }
        return Mono.defer(() -> markFailed(drive, first)).then(compensate);
    }

    private Mono<Void> markFailed(Drive drive, Fatal fatal) {
        Instant now = clock.instant();
        return persist(drive, drive.execution.fail(fatal.step().id(), fatal.failure().error(), now))
                .flatMap(failed -> publisher.publish(new ProcessFailed(failed.id(), failed.processId(),
                        failed.processName(), fatal.step().id(), fatal.failure().error(), fatal.failure().code(), now)))
                .doOnSuccess(v -> {
                    cancelWakeUps(drive.execution.id());
                    log.error("[engine] Execution {} failed at step '{}'", drive.execution.id(), fatal.step().id());
                });
    }

    /**
     * Skips the unselected direct targets of every completed gateway. The selection is read
     * from the persisted gateway output, so the result is the same on every drive.
     */
    private Mono<Void> reconcileGateways(Drive drive) {
        return Flux.fromIterable(drive.definition.steps())
                .filter(step -> step.type() == StepType.GATEWAY)
                .filter(step -> drive.execution.step(step.id())
                        .map(s -> s.status() == StepStatus.COMPLETED).orElse(false))
                .concatMap(gateway -> outputs.resolve(drive.execution.requireStep(gateway.id()))
                        .flatMapMany(output -> {
                            Set<StepId> selected = GatewayHandler.selectedTargets(output);
                            GatewayConfig config = (GatewayConfig) gateway.config();
                            return Flux.fromIterable(config.targets())
                                    .filter(target -> !selected.contains(target))
                                    .filter(target -> drive.execution.step(target)
                                            .map(s -> s.status() == StepStatus.PENDING).orElse(false))
                                    .concatMap(target -> skipStep(drive, target, "branch_not_taken"));
                        }))
                .then();
    }

    private Mono<Void> skipStep(Drive drive, StepId stepId, String reason) {
        Instant now = clock.instant();
        StepDefinition step = drive.definition.requireStep(stepId);
        return persist(drive, drive.execution.updateStep(stepId, s -> s.skip(reason, now), now))
                .flatMap(updated -> publisher.publish(new StepSkipped(updated.id(), stepId, step.name(), reason, now)))
                .doOnSuccess(v -> log.info("[engine] Step '{}' of execution {} skipped: {}",
                        stepId, drive.execution.id(), reason));
    }

    private Mono<DriveOutcome> settle(Drive drive) {
        ProcessExecution execution = drive.execution;
        if (execution.isTerminal() || drive.signal.isCancelled()) {
            return Mono.just(new DriveOutcome(execution, null));
        }
        boolean allDone = execution.steps().values().stream().allMatch(s -> s.status().satisfiesDependency());
        if (allDone) {
            return complete(drive).map(completed -> new DriveOutcome(completed, null));
        }
        Instant nextRetry = execution.stepsWithStatus(StepStatus.PENDING).stream()
                .map(StepExecution::retryAt)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);
        if (nextRetry != null) {
            return Mono.just(new DriveOutcome(execution, nextRetry));
        }
        if (!execution.stepsWithStatus(StepStatus.WAITING).isEmpty()) {
            log.debug("[engine] Execution {} parked", execution.id());
        } else {
            log.warn("[engine] Execution {} has no runnable step", execution.id());
        }
        return Mono.just(new DriveOutcome(execution, null));
    }

    private Mono<ProcessExecution> complete(Drive drive) {
        ProcessExecution execution = drive.execution;
        return outputs.completedOutputs(execution).flatMap(completed -> {
            Map<String, Object> result = new LinkedHashMap<>();
            for (StepDefinition step : drive.definition.steps()) {
                if (drive.definition.dependentsOf(step.id()).isEmpty() && completed.containsKey(step.id())) {
                    result.putAll(completed.get(step.id()));
                }
            }
            Instant now = clock.instant();
            return persist(drive, execution.complete(result, now))
                    .flatMap(done -> publisher.publish(new ProcessCompleted(done.id(), done.processId(),
                                    done.processName(), done.output(), done.totalCost(), done.elapsed(now), now))
                            .thenReturn(done));
        }).doOnNext(done -> {
            cancelWakeUps(done.id());
            log.info("[engine] Execution {} of '{}' completed (cost {})", done.id(), done.processName(),
                    done.totalCost());
        });
    }

    // ── Helpers ───────────────────────────────────────────────────

    private Mono<ProcessExecution> create(ProcessId processId, String triggeredBy, Map<String, Object> input) {
        return executableDefinition(processId)
                .flatMap(definition -> persistNew(definition, input, triggeredBy, null));
    }

    /**
     * Newest PUBLISHED version of the process. A newer DRAFT revision does not hide it; an
     * archived process has none.
     */
    private Mono<ProcessDefinition> executableDefinition(ProcessId processId) {
        return definitions.findVersions(processId)
                .collectList()
                .flatMap(versions -> {
                    if (versions.isEmpty()) {
                        return Mono.error(new ProcessNotFoundException(processId));
                    }
                    for (int i = versions.size() - 1; i >= 0; i--) {
                        ProcessDefinition candidate = versions.get(i);
                        if (candidate.status() == DefinitionStatus.PUBLISHED) return Mono.just(candidate);
                        if (candidate.status() == DefinitionStatus.ARCHIVED) break;
                    }
                    ProcessDefinition latest = versions.get(versions.size() - 1);
                    return Mono.error(new InvalidDefinitionStateException("Process '" + latest.name()
                            + "' has no published version to execute (latest is " + latest.status() + ")"));
                });
    }

    private Mono<ProcessExecution> persistNew(ProcessDefinition definition, Map<String, Object> input,
                                              String triggeredBy, ExecutionId retryOf) {
        return Mono.fromCallable(() -> ProcessExecution.create(definition, input, triggeredBy, retryOf, clock.instant()))
                .flatMap(executions::save)
                .doOnNext(created -> log.info("[engine] Created execution {} of '{}' v{}", created.id(),
                        definition.name(), definition.version().value()));
    }

    private Mono<ProcessExecution> load(ExecutionId executionId) {
        return executions.findById(executionId)
                .flatMap(found -> found.map(Mono::just)
                        .orElseGet(() -> Mono.error(new ExecutionNotFoundException(executionId))));
    }

    private Mono<ProcessDefinition> loadDefinition(ProcessExecution execution) {
        return definitions.findByIdAndVersion(execution.processId(), execution.definitionVersion())
                .flatMap(found -> found.map(Mono::just).orElseGet(() -> Mono.error(
                        new ProcessNotFoundException(execution.processId(), execution.definitionVersion()))));
    }

    private Mono<ProcessExecution> persist(Drive drive, ProcessExecution updated) {
        return executions.save(updated).doOnNext(drive::setExecution);
    }

    private Mono<EvaluationContext> expressionContext(ProcessExecution execution, ProcessDefinition definition) {
        return outputs.completedOutputs(execution)
                .map(completed -> new EvaluationContext(execution.input(), completed,
                        new LinkedHashSet<>(definition.stepIds()), execution.id(), execution.processName()));
    }

    private StepFailed stepFailed(Drive drive, StepDefinition step, StepResult.Failure failure, int attempt,
                                  boolean willRetry, Instant now) {
        return new StepFailed(drive.execution.id(), step.id(), step.name(), failure.error(), failure.code(), attempt,
                willRetry, now);
    }

    private void scheduleWakeUp(ExecutionId executionId, StepId stepId, Instant at) {
        if (at == null) {
            return;
        }
        if (scheduler == null) {
            log.debug("[engine] No scheduler; step '{}' of execution {} waits for an external re-entry",
                    stepId, executionId);
            return;
        }
        scheduler.scheduleAt(wakeUpKey(executionId) + stepId, at, () -> execute(executionId)
                .subscribe(done -> log.debug("[engine] Wake-up of execution {} left it {}", done.id(), done.status()),
                        err -> log.error("[engine] Wake-up of execution {} failed", executionId, err)));
    }

    private void cancelWakeUps(ExecutionId executionId) {
        if (scheduler != null) {
            scheduler.cancelMatching(wakeUpKey(executionId));
        }
    }

    private static String wakeUpKey(ExecutionId executionId) {
        return "wake:" + executionId + ":";
    }

    /** Mutable state of one drive, confined to the lock holder. */
    private static final class Drive {
        private final ProcessDefinition definition;
        private final CancellationSignal signal;
        private ProcessExecution execution;
        private boolean firstWave = true;

        private Drive(ProcessDefinition definition, ProcessExecution execution, CancellationSignal signal) {
            this.definition = definition;
            this.execution = execution;
            this.signal = signal;
        }

        private void setExecution(ProcessExecution execution) {
            this.execution = execution;
        }
    }

    private record DriveOutcome(ProcessExecution execution, Instant nextWakeUp) {}

    private record Dispatch(StepDefinition step, StepExecution state, boolean reentry, StepResult preset) {}

    private record Invocation(Dispatch dispatch, StepResult result) {}

    private record Fatal(StepDefinition step, StepResult.Failure failure) {}
}
