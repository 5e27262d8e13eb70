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

import org.fireflyframework.process.core.model.ProcessId;
import org.fireflyframework.process.core.model.Version;
import org.fireflyframework.process.definition.ProcessDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Versioned storage of process definitions. Every write is checked against the latest
 * stored version and kept as a new immutable snapshot addressable by {@code (id, version)}.
 */
public interface ProcessDefinitionRepository {

    /**
     * Stores the definition as the next version.
     *
     * @return the stored snapshot carrying its new version
     * @throws org.fireflyframework.process.core.exception.ConcurrencyConflictException (as error signal)
     *         when the latest stored version differs from {@code definition.version()}
     */
    Mono<ProcessDefinition> save(ProcessDefinition definition);

    /** Latest version of the definition. */
    Mono<Optional<ProcessDefinition>> findById(ProcessId id);

    Mono<Optional<ProcessDefinition>> findByIdAndVersion(ProcessId id, Version version);

    /** Every stored version of the definition, oldest first. */
    Flux<ProcessDefinition> findVersions(ProcessId id);

    /** Latest version of every definition. */
    Flux<ProcessDefinition> findAll();
}
