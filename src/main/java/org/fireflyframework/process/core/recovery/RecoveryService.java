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

package org.fireflyframework.process.core.recovery;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.event.DomainEventPublisher;
import org.fireflyframework.process.core.event.ExecutionRecovered;
import org.fireflyframework.process.core.event.RecoveryCompleted;
import org.fireflyframework.process.core.exception.ProcessNotFoundException;
import org.fireflyframework.process.core.model.RetryPolicy;
import org.fireflyframework.process.core.model.StepStatus;
import org.fireflyframework.process.core.persistence.ProcessDefinitionRepository;
import org.fireflyframework.process.core.persistence.ProcessExecutionRepository;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.StepDefinition;
import org.fireflyframework.process.engine.ExecutionEngine;
import org.fireflyframework.process.engine.StepHandlerRegistry;
import org.fireflyframework.process.execution.ProcessExecution;
import org.fireflyframework.process.execution.StepExecution;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Finds executions left non-terminal by a crash and brings them back under the engine.
 *
 * <p>{@link #recoverOnStartup()} considers every non-terminal execution. {@link #sweep()}
 * runs periodically and only considers executions idle for longer than the stale
 * threshold that this engine instance is not driving; parked executions (only WAITING
 * steps left) are skipped there because their wake-ups are still scheduled.
 *
 * <p>Each execution is recovered independently: an error is recorded in the report and
 * the sweep continues.
 */
@Slf4j
public class RecoveryService {

    public static final String CUTOFF_CODE = "RECOVERY_CUTOFF_EXCEEDED";

    private static final int CONCURRENCY = 4;

    private final ProcessExecutionRepository executions;
    private final ProcessDefinitionRepository definitions;
    private final ExecutionEngine engine;
    private final StepHandlerRegistry handlers;
    private final DomainEventPublisher publisher;
    private final RetryPolicy defaultRetryPolicy;
    private final Duration staleThreshold;
    private final Duration maxAge;
    private final boolean dryRun;
    private final Clock clock;

    private final AtomicReference<RecoveryReport> lastReport = new AtomicReference<>();

    public RecoveryService(ProcessExecutionRepository executions, ProcessDefinitionRepository definitions,
                           ExecutionEngine engine, StepHandlerRegistry handlers, DomainEventPublisher publisher,
                           RetryPolicy defaultRetryPolicy, Duration staleThreshold, Duration maxAge,
                           boolean dryRun, Clock clock) {
        this.executions = Objects.requireNonNull(executions, "executions");
        this.definitions = Objects.requireNonNull(definitions, "definitions");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.defaultRetryPolicy = defaultRetryPolicy != null ? defaultRetryPolicy : RetryPolicy.DEFAULT;
        Objects.requireNonNull(staleThreshold, "staleThreshold must not be null");
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        if (staleThreshold.isNegative() || staleThreshold.isZero()) {
            throw new IllegalArgumentException("staleThreshold must be positive, got: " + staleThreshold);
        }
        if (maxAge.compareTo(staleThreshold) < 0) {
            throw new IllegalArgumentException("maxAge " + maxAge + " is shorter than staleThreshold " + staleThreshold);
        }
        this.staleThreshold = staleThreshold;
        this.maxAge = maxAge;
        this.dryRun = dryRun;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public Mono<RecoveryReport> recoverOnStartup() {
        return run(false);
    }

    public Mono<RecoveryReport> sweep() {
        return run(true);
    }

    public Optional<RecoveryReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public Duration staleThreshold() {
        return staleThreshold;
    }

    private Mono<RecoveryReport> run(boolean periodic) {
        return Mono.defer(() -> {
            Instant startedAt = clock.instant();
            log.info("[recovery] Starting {} scan", periodic ? "periodic" : "startup");
            return executions.findActive()
                    .filter(execution -> !engine.isActive(execution.id()))
                    .filter(execution -> !periodic || isStale(execution, startedAt))
                    .flatMapSequential(execution -> recover(execution, periodic, startedAt)
                            .onErrorResume(e -> {
                                log.error("[recovery] Recovery of execution {} failed", execution.id(), e);
                                return Mono.just(RecoveryResult.failed(execution.id(), RecoveryAction.SKIP,
                                        String.valueOf(e.getMessage())));
                            }), CONCURRENCY)
                    .collectList()
                    .map(results -> RecoveryReport.of(startedAt, clock.instant(), results, dryRun))
                    .onErrorResume(e -> {
                        log.error("[recovery] Could not list active executions", e);
                        return Mono.just(RecoveryReport.of(startedAt, clock.instant(), java.util.List.of(
                                RecoveryResult.failed(null, RecoveryAction.SKIP,
                                        "Failed to list active executions: " + e.getMessage())), dryRun));
                    });
        }).flatMap(report -> {
            lastReport.set(report);
            log.info("[recovery] Recovery complete: resumed={}, retried={}, failed={}, skipped={}, errors={}, duration={}ms",
                    report.resumed().size(), report.retried().size(), report.failed().size(),
                    report.skipped().size(), report.totalErrors(), report.duration().toMillis());
            return publisher.publish(new RecoveryCompleted(report.resumed().size(), report.retried().size(),
                            report.failed().size(), report.skipped().size(), report.totalErrors(),
                            report.duration().toMillis(), clock.instant()))
                    .thenReturn(report);
        });
    }

    private boolean isStale(ProcessExecution execution, Instant now) {
        Instant last = execution.lastActivity();
        return last == null || Duration.between(last, now).compareTo(staleThreshold) > 0;
    }

    private Mono<RecoveryResult> recover(ProcessExecution execution, boolean periodic, Instant now) {
        return definitions.findByIdAndVersion(execution.processId(), execution.definitionVersion())
                .flatMap(found -> found.map(Mono::just).orElseGet(() -> Mono.error(
                        new ProcessNotFoundException(execution.processId(), execution.definitionVersion()))))
                .flatMap(definition -> {
                    Decision decision = decide(execution, definition, periodic, now);
                    log.info("[recovery] Execution {} ({}, {}): {}", execution.id(), execution.processName(),
                            execution.status(), decision.action().value());
                    if (decision.action() == RecoveryAction.SKIP) {
                        return Mono.just(RecoveryResult.ok(execution.id(), RecoveryAction.SKIP));
                    }
                    if (dryRun) {
                        log.info("[recovery] [dry-run] Would {} execution {}", decision.action().value(), execution.id());
                        return Mono.just(RecoveryResult.ok(execution.id(), decision.action()));
                    }
                    return publisher.publish(new ExecutionRecovered(execution.id(), execution.processId(),
                                    execution.processName(), decision.action().value(), clock.instant()))
                            .then(apply(execution, decision))
                            .thenReturn(RecoveryResult.ok(execution.id(), decision.action()))
                            .onErrorResume(e -> Mono.just(RecoveryResult.failed(execution.id(), decision.action(),
                                    String.valueOf(e.getMessage()))));
                });
    }

    /**
     * Decision rules, first match wins: terminal -> SKIP; idle beyond max age -> MARK_FAILED;
     * interrupted re-checkable step -> RESUME; interrupted step with attempts left ->
     * RETRY_STEP, otherwise MARK_FAILED; no interrupted step -> RESUME (SKIP for a parked
     * execution during a periodic sweep).
     */
    Decision decide(ProcessExecution execution, ProcessDefinition definition, boolean periodic, Instant now) {
        if (execution.isTerminal()) {
            return new Decision(RecoveryAction.SKIP, null, null);
        }
        StepExecution running = execution.stepsWithStatus(StepStatus.RUNNING).stream().findFirst().orElse(null);
        Instant last = execution.lastActivity();
        if (last == null || Duration.between(last, now).compareTo(maxAge) > 0) {
            return new Decision(RecoveryAction.MARK_FAILED, running,
                    "Recovery cutoff exceeded: execution idle longer than " + maxAge);
        }
        if (running != null) {
            StepDefinition step = definition.requireStep(running.stepId());
            if (handlers.isRecheckable(step.type())) {
                return new Decision(RecoveryAction.RESUME, running, null);
            }
            RetryPolicy policy = step.retryPolicyOr(defaultRetryPolicy);
            if (!policy.shouldRetry(running.attempt())) {
                return new Decision(RecoveryAction.MARK_FAILED, running,
                        "Step '" + step.id() + "' was interrupted on its last attempt (" + running.attempt() + ")");
            }
            return new Decision(RecoveryAction.RETRY_STEP, running, null);
        }
        if (periodic && isParked(execution)) {
            return new Decision(RecoveryAction.SKIP, null, null);
        }
        return new Decision(RecoveryAction.RESUME, null, null);
    }

    private static boolean isParked(ProcessExecution execution) {
        return execution.steps().values().stream()
                .filter(s -> !s.status().isTerminal())
                .allMatch(s -> s.status() == StepStatus.WAITING)
                && !execution.stepsWithStatus(StepStatus.WAITING).isEmpty();
    }

    private Mono<ProcessExecution> apply(ProcessExecution execution, Decision decision) {
        StepExecution step = decision.step();
        switch (decision.action()) {
            case RESUME:
                return step != null
                        ? engine.recheckInterruptedStep(execution.id(), step.stepId())
                        : engine.execute(execution.id());
            case RETRY_STEP:
                return engine.retryInterruptedStep(execution.id(), step.stepId());
            case MARK_FAILED:
                if (step == null) {
                    step = execution.stepsWithStatus(StepStatus.WAITING).stream().findFirst().orElse(null);
                }
                return step != null
                        ? engine.failInterruptedStep(execution.id(), step.stepId(), decision.reason(), CUTOFF_CODE)
                        : engine.abandonExecution(execution.id(), decision.reason(), CUTOFF_CODE);
            default:
                return Mono.just(execution);
        }
    }

    record Decision(RecoveryAction action, StepExecution step, String reason) {}
}
