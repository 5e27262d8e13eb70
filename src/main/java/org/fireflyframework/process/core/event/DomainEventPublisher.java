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

package org.fireflyframework.process.core.event;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.persistence.EventRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Records execution events in the event log, then relays them on the bus. An event that
 * could not be appended is never published.
 */
@Slf4j
public class DomainEventPublisher {

    private final EventRepository eventRepository;
    private final EventBus eventBus;

    public DomainEventPublisher(EventRepository eventRepository, EventBus eventBus) {
        this.eventRepository = eventRepository;
        this.eventBus = eventBus;
    }

    public Mono<Void> publish(DomainEvent event) {
        Mono<Void> record = event instanceof ExecutionEvent executionEvent
                ? eventRepository.append(executionEvent)
                : Mono.empty();
        return record.then(Mono.fromRunnable(() -> eventBus.publish(event)));
    }

    public Mono<Void> publishAll(List<? extends DomainEvent> events) {
        return Flux.fromIterable(events).concatMap(this::publish).then();
    }
}
