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

package org.fireflyframework.process.handler.approval;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.event.ApprovalRequested;
import org.fireflyframework.process.core.model.StepType;
import org.fireflyframework.process.definition.HumanApprovalConfig;
import org.fireflyframework.process.engine.StepContext;
import org.fireflyframework.process.engine.StepHandler;
import org.fireflyframework.process.engine.StepResult;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parks the step until a human decides. The first invocation files an
 * {@link ApprovalRequest}; every later invocation reads the recorded decision.
 */
@Slf4j
public class HumanApprovalHandler implements StepHandler {

    static final String WAIT_REASON = "awaiting_approval";

    private final ApprovalStore store;

    public HumanApprovalHandler(ApprovalStore store) {
        this.store = store;
    }

    @Override
    public StepType stepType() {
        return StepType.HUMAN_APPROVAL;
    }

    @Override
    public boolean isRecheckable() {
        return true;
    }

    @Override
    public Mono<StepResult> execute(StepContext context) {
        return store.find(context.executionId(), context.stepId())
                .flatMap(found -> found.isPresent()
                        ? Mono.just(outcome(found.get(), context.now()))
                        : request(context));
    }

    private Mono<StepResult> request(StepContext context) {
        HumanApprovalConfig config = context.config(HumanApprovalConfig.class);
        Instant deadline = context.now().plus(config.timeout());
        ApprovalRequest request = ApprovalRequest.pending(context.executionId(), context.stepId(),
                context.render(config.title()), context.render(config.description()), config.assignees(),
                context.now(), deadline);
        return store.create(request).map(stored -> {
            log.info("[approval] Requested approval '{}' for step '{}' of execution {} (deadline {})",
                    stored.title(), stored.stepId(), stored.executionId(), stored.deadline());
            ApprovalRequested announcement = new ApprovalRequested(stored.executionId(), stored.stepId(),
                    context.step().name(), stored.title(), stored.description(), stored.assignees(),
                    stored.deadline(), context.now());
            return new StepResult.Suspend(WAIT_REASON, stored.deadline(), announcement);
        });
    }

    private static StepResult outcome(ApprovalRequest request, Instant now) {
        switch (request.status()) {
            case APPROVED: {
                Map<String, Object> output = new LinkedHashMap<>();
                output.put("decision", request.status().value());
                output.put("decided_by", request.decidedBy());
                output.put("comment", request.comment());
                output.put("decided_at", String.valueOf(request.decidedAt()));
                return StepResult.success(output);
            }
            case REJECTED:
                return StepResult.failure("Approval rejected by " + request.decidedBy()
                        + (request.comment() != null ? ": " + request.comment() : ""), "APPROVAL_REJECTED", false);
            default:
                if (request.isExpired(now)) {
                    return StepResult.failure("Approval not decided before " + request.deadline(),
                            "APPROVAL_TIMEOUT", false);
                }
                return StepResult.suspend(WAIT_REASON, request.deadline());
        }
    }
}
