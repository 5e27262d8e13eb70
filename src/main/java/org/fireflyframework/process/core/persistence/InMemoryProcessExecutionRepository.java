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

package org.fireflyframework.process.core.persistence;

import org.fireflyframework.process.core.exception.ConcurrencyConflictException;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.ExecutionStatus;
import org.fireflyframework.process.core.model.Version;
import org.fireflyframework.process.execution.ProcessExecution;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryProcessExecutionRepository implements ProcessExecutionRepository {

    private final ConcurrentHashMap<ExecutionId, ProcessExecution> store = new ConcurrentHashMap<>();

    @Override
    public Mono<ProcessExecution> save(ProcessExecution execution) {
        return Mono.fromCallable(() -> store.compute(execution.id(), (id, existing) -> {
            Version stored = existing != null ? existing.version() : Version.INITIAL;
            if (!stored.equals(execution.version())) {
                throw new ConcurrencyConflictException(id.value(), execution.version(), stored);
            }
            return execution.withVersion(stored.next());
        }));
    }

    @Override
    public Mono<Optional<ProcessExecution>> findById(ExecutionId id) {
        return Mono.fromCallable(() -> Optional.ofNullable(store.get(id)));
    }

    @Override
    public Flux<ProcessExecution> findByStatus(ExecutionStatus status) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .filter(e -> e.status() == status));
    }

    @Override
    public Flux<ProcessExecution> findActive() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .filter(e -> e.status().isActive()));
    }

    @Override
    public Mono<Long> cleanup(Duration olderThan) {
        return Mono.fromCallable(() -> {
            Instant threshold = Instant.now().minus(olderThan);
            long count = 0;
            var it = store.entrySet().iterator();
            while (it.hasNext()) {
                var execution = it.next().getValue();
                if (execution.isTerminal() && execution.completedAt() != null
                        && execution.completedAt().isBefore(threshold)) {
                    it.remove();
                    count++;
                }
            }
            return count;
        });
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    // Test helpers
    public int size() { return store.size(); }
    public void clear() { store.clear(); }
}
