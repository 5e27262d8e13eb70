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

package org.fireflyframework.process.handler.notification;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.event.DomainEvent;
import org.fireflyframework.process.core.event.EventSubscriber;
import org.fireflyframework.process.core.event.StepCompleted;
import org.fireflyframework.process.core.event.StepEvent;
import org.fireflyframework.process.core.event.StepFailed;
import org.fireflyframework.process.core.persistence.ProcessDefinitionRepository;
import org.fireflyframework.process.core.persistence.ProcessExecutionRepository;
import org.fireflyframework.process.definition.StepDefinition;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Tells a step's informed agents when the step completes or finally fails. Delivery is
 * fire-and-forget: failures are logged and never reach the engine.
 */
@Slf4j
public class InformedAgentNotifier implements EventSubscriber {

    private final ProcessExecutionRepository executions;
    private final ProcessDefinitionRepository definitions;
    private final NotificationRouter router;
    private final String channel;

    public InformedAgentNotifier(ProcessExecutionRepository executions, ProcessDefinitionRepository definitions,
                                 NotificationRouter router, String channel) {
        this.executions = executions;
        this.definitions = definitions;
        this.router = router;
        this.channel = channel != null && !channel.isBlank() ? channel : LoggingNotificationChannel.NAME;
    }

    @Override
    public void onEvent(DomainEvent event) {
        String message;
        if (event instanceof StepCompleted completed) {
            message = "Step '" + completed.stepName() + "' completed";
        } else if (event instanceof StepFailed failed && !failed.willRetry()) {
            message = "Step '" + failed.stepName() + "' failed: " + failed.error();
        } else {
            return;
        }
        StepEvent stepEvent = (StepEvent) event;
        informedOf(stepEvent)
                .filter(recipients -> !recipients.isEmpty())
                .flatMap(recipients -> router.send(new Notification(channel, message, message, recipients,
                        stepEvent.executionId(), stepEvent.stepId())))
                .subscribe(null, err -> log.warn("[notification] Informing agents of step '{}' in execution {} failed: {}",
                        stepEvent.stepId(), stepEvent.executionId(), err.getMessage()));
    }

    private Mono<List<String>> informedOf(StepEvent event) {
        return executions.findById(event.executionId())
                .flatMap(found -> found.map(execution -> definitions.findByIdAndVersion(execution.processId(),
                                execution.definitionVersion()))
                        .orElseGet(() -> Mono.just(Optional.empty())))
                .map(definition -> definition
                        .flatMap(d -> d.step(event.stepId()))
                        .map(StepDefinition::roles)
                        .map(roles -> roles.informed())
                        .orElse(List.of()));
    }
}
