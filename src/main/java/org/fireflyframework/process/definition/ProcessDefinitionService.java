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

package org.fireflyframework.process.definition;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.event.DomainEventPublisher;
import org.fireflyframework.process.core.event.ProcessArchived;
import org.fireflyframework.process.core.event.ProcessPublished;
import org.fireflyframework.process.core.exception.InvalidDefinitionStateException;
import org.fireflyframework.process.core.exception.ProcessNotFoundException;
import org.fireflyframework.process.core.model.DefinitionStatus;
import org.fireflyframework.process.core.model.ProcessId;
import org.fireflyframework.process.core.persistence.ProcessDefinitionRepository;
import org.fireflyframework.process.core.validation.ProcessDefinitionValidator;
import org.fireflyframework.process.core.validation.ValidationIssue;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Lifecycle of process definitions: DRAFT -> PUBLISHED -> ARCHIVED, plus editable
 * revisions of published or archived definitions. Every save stores a new version; an
 * execution pins the version it was created from.
 */
@Slf4j
public class ProcessDefinitionService {

    private final ProcessDefinitionRepository repository;
    private final ProcessDefinitionValidator validator;
    private final DomainEventPublisher publisher;
    private final Clock clock;

    public ProcessDefinitionService(ProcessDefinitionRepository repository, ProcessDefinitionValidator validator,
                                    DomainEventPublisher publisher, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /** Stores a new DRAFT definition. */
    public Mono<ProcessDefinition> create(ProcessDefinition draft) {
        if (draft.status() != DefinitionStatus.DRAFT) {
            return Mono.error(new InvalidDefinitionStateException("New process definitions must be drafts, got "
                    + draft.status()));
        }
        return repository.save(draft)
                .doOnNext(saved -> log.info("[process] Created draft '{}' ({})", saved.name(), saved.id()));
    }

    public Mono<ProcessDefinition> create(String name, String description, List<StepDefinition> steps,
                                          String createdBy) {
        return Mono.fromCallable(() -> ProcessDefinition.draft(name, description, steps, createdBy))
                .flatMap(this::create);
    }

    /**
     * Validates the latest DRAFT and publishes it.
     *
     * @throws org.fireflyframework.process.core.exception.ProcessValidationException when the definition has errors
     * @throws org.fireflyframework.process.core.exception.CircularDependencyException when the step graph has a cycle
     */
    public Mono<ProcessDefinition> publish(ProcessId processId, String publishedBy) {
        return latest(processId)
                .map(draft -> {
                    validator.validateAndThrow(draft);
                    return draft.publish(clock.instant());
                })
                .flatMap(repository::save)
                .flatMap(published -> publisher.publish(new ProcessPublished(published.id(), published.name(),
                                published.version().value(), publishedBy, clock.instant()))
                        .thenReturn(published))
                .doOnNext(published -> log.info("[process] Published '{}' v{} by {}", published.name(),
                        published.version().value(), publishedBy));
    }

    /** Archives the latest PUBLISHED version; existing executions keep running on their pinned version. */
    public Mono<ProcessDefinition> archive(ProcessId processId) {
        return latest(processId)
                .map(ProcessDefinition::archive)
                .flatMap(repository::save)
                .flatMap(archived -> publisher.publish(new ProcessArchived(archived.id(), archived.name(),
                                archived.version().value(), clock.instant()))
                        .thenReturn(archived))
                .doOnNext(archived -> log.info("[process] Archived '{}'", archived.name()));
    }

    /** Opens an editable DRAFT revision of a PUBLISHED or ARCHIVED definition. */
    public Mono<ProcessDefinition> createNewVersion(ProcessId processId) {
        return latest(processId)
                .map(ProcessDefinition::newRevision)
                .flatMap(repository::save)
                .doOnNext(revision -> log.info("[process] Opened revision v{} of '{}'", revision.version().value(),
                        revision.name()));
    }

    public Mono<ProcessDefinition> updateSteps(ProcessId processId, List<StepDefinition> steps) {
        return latest(processId)
                .map(draft -> draft.withSteps(steps))
                .flatMap(repository::save);
    }

    public Mono<ProcessDefinition> updateTriggers(ProcessId processId, List<TriggerConfig> triggers) {
        return latest(processId)
                .map(draft -> draft.withTriggers(triggers))
                .flatMap(repository::save);
    }

    /** Issues of the latest version without changing it. */
    public Mono<List<ValidationIssue>> validate(ProcessId processId) {
        return latest(processId).map(validator::validate);
    }

    public Mono<ProcessDefinition> get(ProcessId processId) {
        return latest(processId);
    }

    public Flux<ProcessDefinition> versions(ProcessId processId) {
        return repository.findVersions(processId);
    }

    public Flux<ProcessDefinition> list() {
        return repository.findAll();
    }

    private Mono<ProcessDefinition> latest(ProcessId processId) {
        return repository.findById(processId)
                .flatMap(found -> found.map(Mono::just)
                        .orElseGet(() -> Mono.error(new ProcessNotFoundException(processId))));
    }
}
