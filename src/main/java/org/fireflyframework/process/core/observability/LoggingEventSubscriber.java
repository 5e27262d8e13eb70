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

package org.fireflyframework.process.core.observability;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.event.*;

/**
 * Audit log of every domain event. Failures are logged at WARN, everything else at INFO.
 */
@Slf4j
public class LoggingEventSubscriber implements EventSubscriber {

    @Override
    public void onEvent(DomainEvent event) {
        if (event instanceof ProcessStarted e) {
            log.info("[process] started execution={} process={} version={} triggeredBy={}",
                    e.executionId(), e.processName(), e.definitionVersion(), e.triggeredBy());
        } else if (event instanceof ProcessCompleted e) {
            log.info("[process] completed execution={} process={} cost={} durationMs={}",
                    e.executionId(), e.processName(), e.totalCost(), e.duration().toMillis());
        } else if (event instanceof ProcessFailed e) {
            log.warn("[process] failed execution={} process={} step={} code={} error={}",
                    e.executionId(), e.processName(), e.failedStepId(), e.errorCode(), e.error());
        } else if (event instanceof ProcessCancelled e) {
            log.info("[process] cancelled execution={} by={} reason={}", e.executionId(), e.cancelledBy(), e.reason());
        } else if (event instanceof StepStarted e) {
            log.info("[process] step.started execution={} step={} type={} attempt={}",
                    e.executionId(), e.stepId(), e.stepType().value(), e.attempt());
        } else if (event instanceof StepCompleted e) {
            log.info("[process] step.completed execution={} step={} cost={} durationMs={}",
                    e.executionId(), e.stepId(), e.cost(), e.duration().toMillis());
        } else if (event instanceof StepFailed e) {
            log.warn("[process] step.failed execution={} step={} attempt={} code={} willRetry={} error={}",
                    e.executionId(), e.stepId(), e.attempt(), e.errorCode(), e.willRetry(), e.error());
        } else if (event instanceof StepRetrying e) {
            log.info("[process] step.retrying execution={} step={} attempt={}/{} at={}",
                    e.executionId(), e.stepId(), e.attempt(), e.maxAttempts(), e.nextRetryAt());
        } else if (event instanceof StepSkipped e) {
            log.info("[process] step.skipped execution={} step={} reason={}", e.executionId(), e.stepId(), e.reason());
        } else if (event instanceof StepWaiting e) {
            log.info("[process] step.waiting execution={} step={} reason={} resumeAt={}",
                    e.executionId(), e.stepId(), e.reason(), e.resumeAt());
        } else if (event instanceof ApprovalRequested e) {
            log.info("[approval] requested execution={} step={} assignees={} deadline={}",
                    e.executionId(), e.stepId(), e.assignees(), e.deadline());
        } else if (event instanceof ApprovalDecided e) {
            log.info("[approval] decided execution={} step={} decision={} by={}",
                    e.executionId(), e.stepId(), e.decision().value(), e.decidedBy());
        } else if (event instanceof CompensationStarted e) {
            log.warn("[compensation] started execution={} steps={}", e.executionId(), e.stepIds());
        } else if (event instanceof CompensationCompleted e) {
            log.info("[compensation] step.compensated execution={} step={}", e.executionId(), e.stepId());
        } else if (event instanceof CompensationFailed e) {
            log.warn("[compensation] step.failed execution={} step={} error={}", e.executionId(), e.stepId(), e.error());
        } else if (event instanceof ExecutionRecovered e) {
            log.info("[recovery] recovered execution={} action={}", e.executionId(), e.action());
        } else if (event instanceof RecoveryCompleted e) {
            log.info("[recovery] completed resumed={} retried={} failed={} skipped={} errors={}",
                    e.resumed(), e.retried(), e.failed(), e.skipped(), e.errors());
        } else if (event instanceof ProcessPublished e) {
            log.info("[process] published process={} version={} by={}", e.processName(), e.version(), e.publishedBy());
        } else if (event instanceof ProcessArchived e) {
            log.info("[process] archived process={} version={}", e.processName(), e.version());
        }
    }
}
