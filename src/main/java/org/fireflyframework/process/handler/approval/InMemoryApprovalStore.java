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
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryApprovalStore implements ApprovalStore {

    private record Key(ExecutionId executionId, StepId stepId) {}

    private final ConcurrentHashMap<Key, ApprovalRequest> store = new ConcurrentHashMap<>();

    @Override
    public Mono<ApprovalRequest> create(ApprovalRequest request) {
        return Mono.fromCallable(() -> store.computeIfAbsent(new Key(request.executionId(), request.stepId()),
                key -> request));
    }

    @Override
    public Mono<Optional<ApprovalRequest>> find(ExecutionId executionId, StepId stepId) {
        return Mono.fromCallable(() -> Optional.ofNullable(store.get(new Key(executionId, stepId))));
    }

    @Override
    public Mono<ApprovalRequest> recordDecision(ExecutionId executionId, StepId stepId, ApprovalStatus decision,
                                                String decidedBy, String comment, Instant decidedAt) {
        return Mono.fromCallable(() -> store.compute(new Key(executionId, stepId), (key, existing) -> {
            if (existing == null) {
                throw new IllegalArgumentException("No approval requested for step '" + stepId
                        + "' of execution " + executionId);
            }
            return existing.decide(decision, decidedBy, comment, decidedAt);
        }));
    }

    @Override
    public Flux<ApprovalRequest> findPending(String assignee) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values())))
                .filter(r -> r.status() == ApprovalStatus.PENDING)
                .filter(r -> assignee == null || r.assignees().contains(assignee));
    }

    // Test helpers
    public int size() { return store.size(); }
    public void clear() { store.clear(); }
}
