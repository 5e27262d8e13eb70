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

import org.fireflyframework.process.core.exception.InvalidExecutionStateException;
import org.fireflyframework.process.core.model.ApprovalStatus;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.StepId;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A pending or decided human approval, keyed by {@code (executionId, stepId)}.
 */
public record ApprovalRequest(
        ExecutionId executionId,
        StepId stepId,
        String title,
        String description,
        List<String> assignees,
        ApprovalStatus status,
        Instant requestedAt,
        Instant deadline,
        String decidedBy,
        String comment,
        Instant decidedAt
) {
    public ApprovalRequest {
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(stepId, "stepId");
        assignees = assignees != null ? List.copyOf(assignees) : List.of();
        status = status != null ? status : ApprovalStatus.PENDING;
    }

    public static ApprovalRequest pending(ExecutionId executionId, StepId stepId, String title, String description,
                                          List<String> assignees, Instant requestedAt, Instant deadline) {
        return new ApprovalRequest(executionId, stepId, title, description, assignees, ApprovalStatus.PENDING,
                requestedAt, deadline, null, null, null);
    }

    public boolean isExpired(Instant now) {
        return status == ApprovalStatus.PENDING && deadline != null && !now.isBefore(deadline);
    }

    public ApprovalRequest decide(ApprovalStatus decision, String by, String decisionComment, Instant now) {
        if (!decision.isDecided()) {
            throw new IllegalArgumentException("Decision must be approved or rejected, got " + decision);
        }
        if (status.isDecided()) {
            throw new InvalidExecutionStateException("Approval for step '" + stepId + "' of execution "
                    + executionId + " was already " + status.value());
        }
        return new ApprovalRequest(executionId, stepId, title, description, assignees, decision, requestedAt,
                deadline, by, decisionComment, now);
    }
}
