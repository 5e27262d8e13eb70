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

import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.ExecutionStatus;
import org.fireflyframework.process.execution.ProcessExecution;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

public interface ProcessExecutionRepository {

    /**
     * Version-checked write. Emits {@code ConcurrencyConflictException} when the stored
     * version differs from {@code execution.version()}.
     *
     * @return the stored execution carrying its new version
     */
    Mono<ProcessExecution> save(ProcessExecution execution);

    Mono<Optional<ProcessExecution>> findById(ExecutionId id);

    Flux<ProcessExecution> findByStatus(ExecutionStatus status);

    /** Executions in CREATED or RUNNING status. */
    Flux<ProcessExecution> findActive();

    /** Removes terminal executions completed before {@code now - olderThan}. */
    Mono<Long> cleanup(Duration olderThan);

    Mono<Boolean> isHealthy();
}
