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
import org.fireflyframework.process.core.event.CompensationCompleted;
import org.fireflyframework.process.core.event.CompensationFailed;
import org.fireflyframework.process.core.event.CompensationStarted;
import org.fireflyframework.process.core.event.DomainEventPublisher;
import org.fireflyframework.process.core.exception.CompensationException;
import org.fireflyframework.process.core.expression.EvaluationContext;
import org.fireflyframework.process.core.expression.ExpressionEvaluator;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepStatus;
import org.fireflyframework.process.core.output.StepOutputs;
import org.fireflyframework.process.core.persistence.ProcessExecutionRepository;
import org.fireflyframework.process.definition.AgentTaskConfig;
import org.fireflyframework.process.definition.CompensationConfig;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.StepDefinition;
import org.fireflyframework.process.execution.ProcessExecution;
import org.fireflyframework.process.execution.StepExecution;
import org.fireflyframework.process.handler.agent.AgentGateway;
import org.fireflyframework.process.handler.notification.Notification;
import org.fireflyframework.process.handler.notification.NotificationRouter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the compensation actions of completed steps in reverse completion order. Each
 * compensated step moves to COMPENSATED; a failing action is reported with
 * {@link CompensationFailed} and the remaining steps are still compensated.
 */
@Slf4j
public class CompensationRunner {

    private final AgentGateway agentGateway;
    private final NotificationRouter notificationRouter;
    private final ExpressionEvaluator evaluator;
    private final StepOutputs outputs;
    private final ProcessExecutionRepository executions;
    private final DomainEventPublisher publisher;
    private final Clock clock;

    public CompensationRunner(AgentGateway agentGateway, NotificationRouter notificationRouter,
                              ExpressionEvaluator evaluator, StepOutputs outputs,
                              ProcessExecutionRepository executions, DomainEventPublisher publisher, Clock clock) {
        this.agentGateway = agentGateway;
        this.notificationRouter = notificationRouter;
        this.evaluator = evaluator;
        this.outputs = outputs;
        this.executions = executions;
        this.publisher = publisher;
        this.clock = clock;
    }

    /** COMPLETED steps with a compensation action, latest completion first. */
    public static List<StepId> compensationOrder(ProcessExecution execution, ProcessDefinition definition) {
        Comparator<StepExecution> byCompletion = Comparator.comparing(StepExecution::completedAt,
                Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));
        Comparator<StepExecution> byIndex = Comparator.comparingInt(s -> definition.indexOf(s.stepId()));
        return execution.steps().values().stream()
                .filter(step -> step.status() == StepStatus.COMPLETED)
                .filter(step -> definition.step(step.stepId()).map(StepDefinition::isCompensatable).orElse(false))
                .sorted(byCompletion.thenComparing(byIndex).reversed())
                .map(StepExecution::stepId)
                .toList();
    }

    /**
     * Compensates the execution and returns its state after the last compensated step was
     * persisted. Never signals an error for a failing action.
     */
    public Mono<ProcessExecution> compensate(ProcessExecution execution, ProcessDefinition definition) {
        List<StepId> order = compensationOrder(execution, definition);
        if (order.isEmpty()) {
            return Mono.just(execution);
        }
        log.info("[compensation] Compensating execution {} in order {}", execution.id(), order);
        AtomicReference<ProcessExecution> current = new AtomicReference<>(execution);

        return outputs.completedOutputs(execution)
                .map(completed -> new EvaluationContext(execution.input(), completed,
                        new LinkedHashSet<>(definition.stepIds()), execution.id(), execution.processName()))
                .flatMap(context -> publisher.publish(new CompensationStarted(execution.id(),
                                execution.processName(), order, clock.instant()))
                        .thenMany(Flux.fromIterable(order)
                                .concatMap(stepId -> compensateStep(current, definition.requireStep(stepId), context)))
                        .then())
                .then(Mono.fromSupplier(current::get));
    }

    private Mono<Void> compensateStep(AtomicReference<ProcessExecution> current, StepDefinition step,
                                      EvaluationContext context) {
        CompensationConfig config = step.compensation();
        return Mono.defer(() -> runAction(current.get(), step, config, context))
                .timeout(config.timeout())
                .then(Mono.defer(() -> executions.save(current.get().compensateStep(step.id(), clock.instant()))))
                .doOnNext(current::set)
                .then(Mono.defer(() -> publisher.publish(new CompensationCompleted(current.get().id(), step.id(),
                        clock.instant()))))
                .doOnSuccess(v -> log.info("[compensation] Step '{}' of execution {} compensated",
                        step.id(), current.get().id()))
                .onErrorResume(e -> {
                    log.warn("[compensation] Step '{}' of execution {} could not be compensated: {}",
                            step.id(), current.get().id(), e.getMessage());
                    return publisher.publish(new CompensationFailed(current.get().id(), step.id(),
                            String.valueOf(e.getMessage()), clock.instant()));
                });
    }

    private Mono<Void> runAction(ProcessExecution execution, StepDefinition step, CompensationConfig config,
                                 EvaluationContext context) {
        String message = evaluator.evaluate(config.message(), context);
        switch (config.type()) {
            case AGENT_TASK:
                if (agentGateway == null) {
                    return Mono.error(new CompensationException(step.id(), "No agent gateway is configured"));
                }
                return agentGateway.dispatch(config.agent(), message,
                        new AgentTaskConfig(config.agent(), message, config.timeout(), null)).then();
            case NOTIFICATION:
                Set<String> recipients = new LinkedHashSet<>(config.recipients());
                recipients.addAll(step.roles().notificationRecipients());
                return notificationRouter.send(new Notification(config.channel(),
                        "Compensation of step '" + step.name() + "'", message, new ArrayList<>(recipients),
                        execution.id(), step.id()));
            default:
                return Mono.error(new CompensationException(step.id(), "Unsupported compensation type " + config.type()));
        }
    }
}
