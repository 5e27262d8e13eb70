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

package org.fireflyframework.process.unit.definition;

import org.fireflyframework.process.core.event.ProcessArchived;
import org.fireflyframework.process.core.event.ProcessPublished;
import org.fireflyframework.process.core.exception.InvalidDefinitionStateException;
import org.fireflyframework.process.core.exception.ProcessNotFoundException;
import org.fireflyframework.process.core.exception.ProcessValidationException;
import org.fireflyframework.process.core.model.DefinitionStatus;
import org.fireflyframework.process.core.model.ProcessId;
import org.fireflyframework.process.core.model.Version;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.ProcessDefinitionService;
import org.fireflyframework.process.definition.builder.ProcessBuilder;
import org.fireflyframework.process.testing.EngineFixture;
import org.fireflyframework.process.testing.ScriptedAgentGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.*;

class ProcessDefinitionServiceTest {

    private EngineFixture fixture;
    private ProcessDefinitionService service;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(new ScriptedAgentGateway());
        service = fixture.definitionService;
    }

    private ProcessDefinition draft() {
        return new ProcessBuilder("onboarding")
                .step("welcome").agentTask("writer", "Welcome ${input.name}").add()
                .build();
    }

    // ── Create & publish ─────────────────────────────────────────

    @Test
    void create_storesDraftAsFirstVersion() {
        StepVerifier.create(service.create(draft()))
                .assertNext(created -> {
                    assertThat(created.status()).isEqualTo(DefinitionStatus.DRAFT);
                    assertThat(created.version()).isEqualTo(Version.of(1));
                })
                .verifyComplete();
    }

    @Test
    void create_withPublishedDefinition_isRejected() {
        StepVerifier.create(service.create(draft().publish(fixture.clock.instant())))
                .expectError(InvalidDefinitionStateException.class)
                .verify();
    }

    @Test
    void publish_storesNewVersion_andAnnouncesIt() {
        ProcessDefinition created = service.create(draft()).block();

        StepVerifier.create(service.publish(created.id(), "alice"))
                .assertNext(published -> {
                    assertThat(published.status()).isEqualTo(DefinitionStatus.PUBLISHED);
                    assertThat(published.version()).isEqualTo(Version.of(2));
                    assertThat(published.publishedAt()).isNotNull();
                })
                .verifyComplete();

        assertThat(fixture.events(ProcessPublished.class)).singleElement()
                .satisfies(event -> {
                    assertThat(event.publishedBy()).isEqualTo("alice");
                    assertThat(event.version()).isEqualTo(2L);
                });
    }

    @Test
    void publish_invalidDraft_failsWithIssues_andLeavesDraftInPlace() {
        ProcessDefinition broken = service.create(new ProcessBuilder("broken")
                .step("a").agentTask("x", "go").dependsOn("ghost").add()
                .build()).block();

        StepVerifier.create(service.publish(broken.id(), "alice"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOfSatisfying(ProcessValidationException.class,
                                invalid -> assertThat(invalid.getIssues()).isNotEmpty()))
                .verify();

        assertThat(service.get(broken.id()).block().status()).isEqualTo(DefinitionStatus.DRAFT);
        assertThat(fixture.events(ProcessPublished.class)).isEmpty();
    }

    @Test
    void publish_unknownProcess_fails() {
        StepVerifier.create(service.publish(ProcessId.generate(), "alice"))
                .expectError(ProcessNotFoundException.class)
                .verify();
    }

    // ── Revisions & archive ──────────────────────────────────────

    @Test
    void updateSteps_onPublishedDefinition_isRejected() {
        ProcessDefinition published = fixture.publish(draft());

        StepVerifier.create(service.updateSteps(published.id(), published.steps()))
                .expectError(InvalidDefinitionStateException.class)
                .verify();
    }

    @Test
    void createNewVersion_opensDraft_thatCanBeEditedAndRepublished() {
        ProcessDefinition published = fixture.publish(draft());
        ProcessDefinition extended = new ProcessBuilder("onboarding")
                .step("welcome").agentTask("writer", "Welcome ${input.name}").add()
                .step("follow_up").agentTask("writer", "Follow up on ${welcome.response}").dependsOn("welcome").add()
                .build();

        ProcessDefinition revision = service.createNewVersion(published.id()).block();
        assertThat(revision.status()).isEqualTo(DefinitionStatus.DRAFT);
        assertThat(revision.version()).isEqualTo(Version.of(3));

        service.updateSteps(published.id(), extended.steps()).block();
        ProcessDefinition republished = service.publish(published.id(), "bob").block();

        assertThat(republished.version()).isEqualTo(Version.of(5));
        assertThat(republished.steps()).hasSize(2);
        StepVerifier.create(service.versions(published.id()).map(ProcessDefinition::status))
                .expectNext(DefinitionStatus.DRAFT, DefinitionStatus.PUBLISHED, DefinitionStatus.DRAFT,
                        DefinitionStatus.DRAFT, DefinitionStatus.PUBLISHED)
                .verifyComplete();
    }

    @Test
    void createNewVersion_ofDraft_isRejected() {
        ProcessDefinition created = service.create(draft()).block();

        StepVerifier.create(service.createNewVersion(created.id()))
                .expectError(InvalidDefinitionStateException.class)
                .verify();
    }

    @Test
    void archive_publishedDefinition_announcesIt() {
        ProcessDefinition published = fixture.publish(draft());

        StepVerifier.create(service.archive(published.id()))
                .assertNext(archived -> assertThat(archived.status()).isEqualTo(DefinitionStatus.ARCHIVED))
                .verifyComplete();
        assertThat(fixture.events(ProcessArchived.class)).hasSize(1);
    }

    @Test
    void archive_draft_isRejected() {
        ProcessDefinition created = service.create(draft()).block();

        StepVerifier.create(service.archive(created.id()))
                .expectError(InvalidDefinitionStateException.class)
                .verify();
    }

    @Test
    void validate_reportsIssuesWithoutChangingDefinition() {
        ProcessDefinition created = service.create(draft()).block();

        StepVerifier.create(service.validate(created.id()))
                .assertNext(issues -> assertThat(issues).noneMatch(issue -> issue.isError()))
                .verifyComplete();
        assertThat(service.get(created.id()).block().version()).isEqualTo(Version.of(1));
    }

    @Test
    void list_returnsLatestVersionOfEachProcess() {
        fixture.publish(draft());
        service.create(new ProcessBuilder("other").step("a").agentTask("x", "go").add().build()).block();

        StepVerifier.create(service.list().map(ProcessDefinition::name).collectList())
                .assertNext(names -> assertThat(names).containsExactlyInAnyOrder("onboarding", "other"))
                .verifyComplete();
    }
}
