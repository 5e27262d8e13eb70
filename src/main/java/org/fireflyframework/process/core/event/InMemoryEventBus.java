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
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-memory {@link EventBus}. Subscribers handed to the constructor are
 * registered as wildcard subscribers.
 */
@Slf4j
public class InMemoryEventBus implements EventBus {

    private record Registration(Class<? extends DomainEvent> type, Consumer<DomainEvent> handler, String name) {}

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final Sinks.Many<DomainEvent> sink = Sinks.many().multicast().directBestEffort();

    public InMemoryEventBus() {
        this(List.of());
    }

    public InMemoryEventBus(List<? extends EventSubscriber> subscribers) {
        subscribers.forEach(this::subscribeAll);
    }

    @Override
    public void publish(DomainEvent event) {
        for (Registration registration : registrations) {
            if (!registration.type().isInstance(event)) continue;
            try {
                registration.handler().accept(event);
            } catch (Exception e) {
                log.warn("[event-bus] Subscriber {} failed on {}: {}", registration.name(), event.eventType(),
                        e.getMessage(), e);
            }
        }
        synchronized (sink) {
            Sinks.EmitResult result = sink.tryEmitNext(event);
            if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                log.debug("[event-bus] Stream emission of {} dropped: {}", event.eventType(), result);
            }
        }
    }

    @Override
    public <E extends DomainEvent> Disposable subscribe(Class<E> eventType, Consumer<? super E> handler) {
        Consumer<DomainEvent> adapter = event -> handler.accept(eventType.cast(event));
        return register(new Registration(eventType, adapter, handler.getClass().getSimpleName()));
    }

    @Override
    public Disposable subscribeAll(EventSubscriber subscriber) {
        return register(new Registration(DomainEvent.class, subscriber::onEvent, subscriber.getClass().getSimpleName()));
    }

    @Override
    public Flux<DomainEvent> events() {
        return sink.asFlux();
    }

    public int subscriberCount() {
        return registrations.size();
    }

    private Disposable register(Registration registration) {
        registrations.add(registration);
        log.debug("[event-bus] Subscribed {} to {}", registration.name(), registration.type().getSimpleName());
        return () -> registrations.remove(registration);
    }
}
