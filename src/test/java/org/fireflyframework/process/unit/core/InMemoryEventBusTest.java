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

import org.fireflyframework.process.core.event.DomainEvent;
import org.fireflyframework.process.core.event.DomainEventPublisher;
import org.fireflyframework.process.core.event.EventSubscriber;
import org.fireflyframework.process.core.event.InMemoryEventBus;
import org.fireflyframework.process.core.event.ProcessPublished;
import org.fireflyframework.process.core.event.StepSkipped;
import org.fireflyframework.process.core.event.StepStarted;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.ProcessId;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepType;
import org.fireflyframework.process.core.persistence.InMemoryEventRepository;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryEventBusTest {

    private static final Instant NOW = Instant.parse("2026-01-15T09:00:00Z");

    private final ExecutionId executionId = ExecutionId.generate();

    private StepStarted started() {
        return new StepStarted(executionId, StepId.of("a"), "a", StepType.AGENT_TASK, 1, NOW);
    }

    @Test
    void typedSubscriber_receivesOnlyMatchingEvents() {
        InMemoryEventBus bus = new InMemoryEventBus();
        List<StepStarted> received = new ArrayList<>();
        bus.subscribe(StepStarted.class, received::add);

        bus.publish(started());
        bus.publish(new StepSkipped(executionId, StepId.of("b"), "b", "condition_not_met", NOW));

        assertThat(received).hasSize(1);
    }

    @Test
    void failingSubscriber_doesNotStopOthers() {
        List<DomainEvent> received = new ArrayList<>();
        InMemoryEventBus bus = new InMemoryEventBus(List.<EventSubscriber>of(
                event -> { throw new IllegalStateException("subscriber bug"); },
                received::add));

        bus.publish(started());

        assertThat(received).hasSize(1);
    }

    @Test
    void disposedSubscription_stopsDelivery() {
        InMemoryEventBus bus = new InMemoryEventBus();
        List<DomainEvent> received = new ArrayList<>();
        Disposable subscription = bus.subscribeAll(received::add);

        subscription.dispose();
        bus.publish(started());

        assertThat(received).isEmpty();
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void eventsStream_emitsPublishedEvents() {
        InMemoryEventBus bus = new InMemoryEventBus();

        StepVerifier.create(bus.events().take(1))
                .then(() -> bus.publish(started()))
                .assertNext(event -> assertThat(event.eventType()).isEqualTo("StepStarted"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void publisher_appendsExecutionEventsOnly_thenPublishes() {
        InMemoryEventRepository repository = new InMemoryEventRepository();
        InMemoryEventBus bus = new InMemoryEventBus();
        List<DomainEvent> received = new ArrayList<>();
        bus.subscribeAll(received::add);
        DomainEventPublisher publisher = new DomainEventPublisher(repository, bus);

        publisher.publishAll(List.of(started(),
                new ProcessPublished(ProcessId.generate(), "blog", 2, "alice", NOW))).block();

        assertThat(repository.size()).isEqualTo(1);
        assertThat(received).extracting(DomainEvent::eventType).containsExactly("StepStarted", "ProcessPublished");
    }
}
