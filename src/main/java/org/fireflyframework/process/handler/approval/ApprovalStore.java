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

import org.fireflyframework.process.core.model.ApprovalStatus;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.StepId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;

public interface ApprovalStore {

    /** Stores a new request; an existing request for the same step is kept and returned. */
    Mono<ApprovalRequest> create(ApprovalRequest request);

    Mono<Optional<ApprovalRequest>> find(ExecutionId executionId, StepId stepId);

    /**
     * Records the decision. Emits {@code IllegalArgumentException} when no request exists and
     * {@code InvalidExecutionStateException} when it was already decided.
     */
    Mono<ApprovalRequest> recordDecision(ExecutionId executionId, StepId stepId, ApprovalStatus decision,
                                         String decidedBy, String comment, Instant decidedAt);

    /** Pending requests, optionally only those assigned to {@code assignee}. */
    Flux<ApprovalRequest> findPending(String assignee);
}
