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

package org.fireflyframework.process.unit.core;

import org.fireflyframework.process.core.exception.ConcurrencyConflictException;
import org.fireflyframework.process.core.model.DefinitionStatus;
import org.fireflyframework.process.core.model.ExecutionStatus;
import org.fireflyframework.process.core.model.Version;
import org.fireflyframework.process.core.persistence.InMemoryProcessDefinitionRepository;
import org.fireflyframework.process.core.persistence.InMemoryProcessExecutionRepository;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.builder.ProcessBuilder;
import org.fireflyframework.process.execution.ProcessExecution;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InMemoryPersistenceTest {

    private final InMemoryProcessDefinitionRepository definitions = new InMemoryProcessDefinitionRepository();
    private final InMemoryProcessExecutionRepository executions = new InMemoryProcessExecutionRepository();

    private ProcessDefinition draft() {
        return new ProcessBuilder("persisted").step("a").agentTask("x", "go").add().build();
    }

    // ── Definitions ──────────────────────────────────────────────

    @Test
    void definitionSave_appendsNewVersion_andKeepsHistory() {
        ProcessDefinition v1 = definitions.save(draft()).block();
        ProcessDefinition v2 = definitions.save(v1.publish(Instant.now())).block();

        assertThat(v1.version()).isEqualTo(Version.of(1));
        assertThat(v2.version()).isEqualTo(Version.of(2));
        assertThat(definitions.findById(v1.id()).block()).get()
                .extracting(ProcessDefinition::status).isEqualTo(DefinitionStatus.PUBLISHED);
        assertThat(definitions.findByIdAndVersion(v1.id(), Version.of(1)).block()).get()
                .extracting(ProcessDefinition::status).isEqualTo(DefinitionStatus.DRAFT);
        StepVerifier.create(definitions.findVersions(v1.id()).map(ProcessDefinition::version))
                .expectNext(Version.of(1), Version.of(2))
                .verifyComplete();
    }

    @Test
    void definitionSave_fromStaleCopy_conflicts() {
        ProcessDefinition v1 = definitions.save(draft()).block();
        definitions.save(v1.withSteps(v1.steps())).block();

        StepVerifier.create(definitions.save(v1.withSteps(v1.steps())))
                .expectError(ConcurrencyConflictException.class)
                .verify();
    }

    // ── Executions ───────────────────────────────────────────────

    @Test
    void executionSave_bumpsVersion_andRejectsStaleWrites() {
        ProcessDefinition published = draft().publish(Instant.now());
        ProcessExecution created = ProcessExecution.create(published, Map.of(), "tester", null, Instant.now());

        ProcessExecution stored = executions.save(created).block();
        assertThat(stored.version()).isEqualTo(Version.of(1));
        executions.save(stored.start(Instant.now())).block();

        StepVerifier.create(executions.save(stored.start(Instant.now())))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOfSatisfying(ConcurrencyConflictException.class, conflict -> {
                            assertThat(conflict.getExpected()).isEqualTo(Version.of(1));
                            assertThat(conflict.getActual()).isEqualTo(Version.of(2));
                        }))
                .verify();
    }

    @Test
    void findActive_andCleanup_considerStatus() {
        ProcessDefinition published = draft().publish(Instant.now());
        ProcessExecution active = executions.save(ProcessExecution.create(published, Map.of(), "t", null, Instant.now())).block();
        ProcessExecution old = executions.save(ProcessExecution.create(published, Map.of(), "t", null, Instant.now())).block();
        Instant longAgo = Instant.now().minus(Duration.ofDays(3));
        executions.save(old.start(longAgo).fail(null, "gone", longAgo)).block();

        StepVerifier.create(executions.findActive().map(ProcessExecution::id))
                .expectNext(active.id())
                .verifyComplete();
        StepVerifier.create(executions.findByStatus(ExecutionStatus.FAILED).count())
                .expectNext(1L)
                .verifyComplete();
        StepVerifier.create(executions.cleanup(Duration.ofDays(1)))
                .expectNext(1L)
                .verifyComplete();
        assertThat(executions.size()).isEqualTo(1);
    }
}
