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

package org.fireflyframework.process.core.validation;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.exception.CircularDependencyException;
import org.fireflyframework.process.core.exception.ExpressionException;
import org.fireflyframework.process.core.exception.ProcessValidationException;
import org.fireflyframework.process.core.expression.ExpressionEvaluator;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.topology.DependencyResolver;
import org.fireflyframework.process.definition.*;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.*;

/**
 * Structural validation of a {@link ProcessDefinition} before it may be published:
 * graph shape, configuration shape per step type, template references and triggers.
 *
 * <p>{@link #validate} collects every issue; {@link #validateAndThrow} rejects the
 * definition with {@link CircularDependencyException} when the graph has a cycle and
 * with {@link ProcessValidationException} on any other ERROR-level issue.
 */
@Slf4j
public class ProcessDefinitionValidator {

    private static final Duration MAX_REASONABLE_TIMEOUT = Duration.ofDays(1);

    private final ExpressionEvaluator expressions;

    public ProcessDefinitionValidator(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    public List<ValidationIssue> validate(ProcessDefinition definition) {
        List<ValidationIssue> issues = new ArrayList<>();
        String loc = "process." + (definition.name().isBlank() ? definition.id().value() : definition.name());

        if (definition.name().isBlank()) {
            issues.add(ValidationIssue.error("Process has no name", loc));
        }
        if (definition.steps().isEmpty()) {
            issues.add(ValidationIssue.error("Process has no steps", loc));
            return issues;
        }

        Set<StepId> seenIds = new HashSet<>();
        for (StepDefinition step : definition.steps()) {
            String stepLoc = loc + ".step." + step.id();
            if (!seenIds.add(step.id())) {
                issues.add(ValidationIssue.error("Duplicate step ID '" + step.id() + "'", stepLoc));
            }
            if (ExpressionEvaluator.isReservedRoot(step.id().value())) {
                issues.add(ValidationIssue.error("Step ID '" + step.id() + "' is reserved", stepLoc));
            }
            for (StepId dep : step.dependsOn()) {
                if (dep.equals(step.id())) {
                    issues.add(ValidationIssue.error("Step depends on itself", stepLoc));
                } else if (definition.step(dep).isEmpty()) {
                    issues.add(ValidationIssue.error("Depends on non-existent step '" + dep + "'", stepLoc));
                }
            }
        }

        DependencyResolver.findCycle(definition).ifPresent(cycle -> issues.add(ValidationIssue.error(
                new CircularDependencyException(cycle).getMessage(), loc)));

        for (StepDefinition step : definition.steps()) {
            validateStep(definition, step, loc + ".step." + step.id(), issues);
        }

        for (TriggerConfig trigger : definition.triggers()) {
            validateTrigger(trigger, loc + ".trigger." + trigger.id(), issues);
        }
        return issues;
    }

    public void validateAndThrow(ProcessDefinition definition) {
        DependencyResolver.validate(definition);
        List<ValidationIssue> issues = validate(definition);
        issues.stream().filter(i -> !i.isError())
                .forEach(i -> log.warn("[process] Validation warning: {}", i));
        List<ValidationIssue> errors = issues.stream().filter(ValidationIssue::isError).toList();
        if (!errors.isEmpty()) {
            throw new ProcessValidationException(errors);
        }
    }

    private void validateStep(ProcessDefinition definition, StepDefinition step, String stepLoc,
                              List<ValidationIssue> issues) {
        Set<StepId> ancestors = DependencyResolver.ancestorsOf(definition, step.id());

        StepConfig config = step.config();
        if (config instanceof AgentTaskConfig agent) {
            requireText(agent.agent(), "Agent task has no agent", stepLoc, issues);
            requireText(agent.message(), "Agent task has no message", stepLoc, issues);
            checkTimeout(agent.timeout(), "Agent timeout", stepLoc, issues);
            checkTemplate(definition, agent.message(), ancestors, stepLoc, issues);
        } else if (config instanceof HumanApprovalConfig approval) {
            requireText(approval.title(), "Approval has no title", stepLoc, issues);
            if (approval.timeout().isZero() || approval.timeout().isNegative()) {
                issues.add(ValidationIssue.error("Approval timeout must be positive", stepLoc));
            }
            checkTemplate(definition, approval.title(), ancestors, stepLoc, issues);
            checkTemplate(definition, approval.description(), ancestors, stepLoc, issues);
        } else if (config instanceof GatewayConfig gateway) {
            validateGateway(definition, step, gateway, ancestors, stepLoc, issues);
        } else if (config instanceof TimerConfig timer) {
            if (timer.delay().isNegative()) {
                issues.add(ValidationIssue.error("Timer delay is negative", stepLoc));
            }
        } else if (config instanceof NotificationConfig notification) {
            requireText(notification.message(), "Notification has no message", stepLoc, issues);
            if (notification.recipients().isEmpty() && step.roles().notificationRecipients().isEmpty()) {
                issues.add(ValidationIssue.warning("Notification has no recipients", stepLoc));
            }
            checkTemplate(definition, notification.message(), ancestors, stepLoc, issues);
            checkTemplate(definition, notification.subject(), ancestors, stepLoc, issues);
        }

        if (step.hasCondition()) {
            checkTemplate(definition, step.condition(), ancestors, stepLoc + ".condition", issues);
        }
        if (step.timeout() != null) {
            checkTimeout(step.timeout(), "Step timeout", stepLoc, issues);
        }

        CompensationConfig compensation = step.compensation();
        if (compensation != null) {
            String compLoc = stepLoc + ".compensation";
            switch (compensation.type()) {
                case AGENT_TASK -> requireText(compensation.agent(), "Agent compensation has no agent", compLoc, issues);
                case NOTIFICATION -> requireText(compensation.message(), "Notification compensation has no message",
                        compLoc, issues);
            }
            Set<StepId> visible = new LinkedHashSet<>(ancestors);
            visible.add(step.id());
            checkTemplate(definition, compensation.message(), visible, compLoc, issues);
        }
    }

    private void validateGateway(ProcessDefinition definition, StepDefinition step, GatewayConfig gateway,
                                 Set<StepId> ancestors, String stepLoc, List<ValidationIssue> issues) {
        if (gateway.routes().isEmpty() && gateway.defaultRoute() == null) {
            issues.add(ValidationIssue.error("Gateway has no routes", stepLoc));
        }
        for (GatewayRoute route : gateway.routes()) {
            String routeLoc = stepLoc + ".route." + route.target();
            if (gateway.type() != GatewayType.PARALLEL && route.condition().isBlank()) {
                issues.add(ValidationIssue.error("Route has no condition", routeLoc));
            }
            checkTemplate(definition, route.condition(), ancestors, routeLoc, issues);
        }
        for (StepId target : gateway.targets()) {
            Optional<StepDefinition> targetStep = definition.step(target);
            if (targetStep.isEmpty()) {
                issues.add(ValidationIssue.error("Gateway routes to non-existent step '" + target + "'", stepLoc));
            } else if (!targetStep.get().dependsOn().contains(step.id())) {
                issues.add(ValidationIssue.error("Gateway target '" + target + "' does not depend on the gateway",
                        stepLoc));
            }
        }
    }

    private void checkTemplate(ProcessDefinition definition, String template, Set<StepId> visible,
                               String location, List<ValidationIssue> issues) {
        if (template == null || template.isEmpty()) return;
        Set<StepId> references;
        try {
            references = expressions.extractStepReferences(template);
        } catch (ExpressionException e) {
            issues.add(ValidationIssue.error(e.getMessage(), location));
            return;
        }
        for (StepId ref : references) {
            if (definition.step(ref).isEmpty()) {
                issues.add(ValidationIssue.error("Expression references unknown step '" + ref + "'", location));
            } else if (!visible.contains(ref)) {
                issues.add(ValidationIssue.error("Expression references step '" + ref
                        + "' which is not a dependency", location));
            }
        }
    }

    private static void validateTrigger(TriggerConfig trigger, String location, List<ValidationIssue> issues) {
        if (trigger.id() == null || trigger.id().isBlank()) {
            issues.add(ValidationIssue.error("Trigger has no id", location));
        }
        if (trigger instanceof TriggerConfig.ScheduleTrigger schedule) {
            if (schedule.cron() == null || !CronExpression.isValidExpression(schedule.cron())) {
                issues.add(ValidationIssue.error("Invalid cron expression '" + schedule.cron() + "'", location));
            }
            try {
                ZoneId.of(schedule.timezone());
            } catch (DateTimeException e) {
                issues.add(ValidationIssue.error("Unknown timezone '" + schedule.timezone() + "'", location));
            }
        } else if (trigger instanceof TriggerConfig.WebhookTrigger webhook) {
            if (webhook.secret() == null || webhook.secret().isBlank()) {
                issues.add(ValidationIssue.warning("Webhook trigger has no secret", location));
            }
        }
    }

    private static void requireText(String value, String message, String location, List<ValidationIssue> issues) {
        if (value == null || value.isBlank()) {
            issues.add(ValidationIssue.error(message, location));
        }
    }

    private static void checkTimeout(Duration timeout, String what, String location, List<ValidationIssue> issues) {
        if (timeout.isNegative() || timeout.isZero()) {
            issues.add(ValidationIssue.error(what + " must be positive", location));
        } else if (timeout.compareTo(MAX_REASONABLE_TIMEOUT) > 0) {
            issues.add(ValidationIssue.warning(what + " exceeds 24 hours (" + timeout + ")", location));
        }
    }
}
