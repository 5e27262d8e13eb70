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

package org.fireflyframework.process.persistence.r2dbc;

import org.fireflyframework.process.core.model.ApprovalStatus;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.persistence.AggregateSerializer;
import org.fireflyframework.process.handler.approval.ApprovalRequest;
import org.fireflyframework.process.handler.approval.ApprovalStore;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;

/**
 * Approval requests on a relational database, so a parked approval step and its decision
 * outlive the process that filed them.
 */
public class R2dbcApprovalStore implements ApprovalStore {

    private final DatabaseClient databaseClient;
    private final AggregateSerializer serializer;

    public R2dbcApprovalStore(DatabaseClient databaseClient, AggregateSerializer serializer) {
        this.databaseClient = databaseClient;
        this.serializer = serializer;
    }

    @Override
    public Mono<ApprovalRequest> create(ApprovalRequest request) {
        return find(request.executionId(), request.stepId()).flatMap(existing -> existing
                .map(Mono::just)
                .orElseGet(() -> databaseClient.sql("""
                            INSERT INTO process_approvals (execution_id, step_id, status, payload)
                            VALUES (:executionId, :stepId, :status, :payload)
                            """)
                        .bind("executionId", request.executionId().value())
                        .bind("stepId", request.stepId().value())
                        .bind("status", request.status().name())
                        .bind("payload", serializer.serialize(request))
                        .fetch()
                        .rowsUpdated()
                        .thenReturn(request)
                        // lost the race to another writer: theirs is kept
                        .onErrorResume(DataIntegrityViolationException.class,
                                e -> find(request.executionId(), request.stepId()).map(Optional::orElseThrow))));
    }

    @Override
    public Mono<Optional<ApprovalRequest>> find(ExecutionId executionId, StepId stepId) {
        return databaseClient.sql("""
                    SELECT payload FROM process_approvals
                    WHERE execution_id = :executionId AND step_id = :stepId
                    """)
                .bind("executionId", executionId.value())
                .bind("stepId", stepId.value())
                .map(row -> row.get("payload", String.class))
                .first()
                .map(serializer::deserializeApproval)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    @Override
    public Mono<ApprovalRequest> recordDecision(ExecutionId executionId, StepId stepId, ApprovalStatus decision,
                                                String decidedBy, String comment, Instant decidedAt) {
        return find(executionId, stepId).flatMap(existing -> {
            if (existing.isEmpty()) {
                return Mono.error(new IllegalArgumentException("No approval requested for step '" + stepId
                        + "' of execution " + executionId));
            }
            return Mono.fromCallable(() -> existing.get().decide(decision, decidedBy, comment, decidedAt))
                    .flatMap(decided -> databaseClient.sql("""
                                UPDATE process_approvals SET status = :status, payload = :payload
                                WHERE execution_id = :executionId AND step_id = :stepId AND status = :pending
                                """)
                            .bind("executionId", executionId.value())
                            .bind("stepId", stepId.value())
                            .bind("status", decided.status().name())
                            .bind("payload", serializer.serialize(decided))
                            .bind("pending", ApprovalStatus.PENDING.name())
                            .fetch()
                            .rowsUpdated()
                            // decided concurrently: re-reading reports the decision that won
                            .flatMap(rows -> rows > 0 ? Mono.just(decided)
                                    : recordDecision(executionId, stepId, decision, decidedBy, comment, decidedAt)));
        });
    }

    @Override
    public Flux<ApprovalRequest> findPending(String assignee) {
        return databaseClient.sql("""
                    SELECT payload FROM process_approvals
                    WHERE status = :pending
                    ORDER BY execution_id, step_id
                    """)
                .bind("pending", ApprovalStatus.PENDING.name())
                .map(row -> row.get("payload", String.class))
                .all()
                .map(serializer::deserializeApproval)
                .filter(r -> assignee == null || r.assignees().contains(assignee));
    }
}
