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

import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.util.function.Consumer;

/**
 * In-process fan-out of domain events. The bus does not own or store events.
 */
public interface EventBus {

    /**
     * Delivers the event to every matching subscriber. Subscriber failures are logged and
     * never reach the caller.
     */
    void publish(DomainEvent event);

    /** Registers a handler for one event kind, subtypes included. Dispose the handle to unsubscribe. */
    <E extends DomainEvent> Disposable subscribe(Class<E> eventType, Consumer<? super E> handler);

    /** Registers a wildcard subscriber. Dispose the handle to unsubscribe. */
    Disposable subscribeAll(EventSubscriber subscriber);

    /** Hot stream of published events; slow consumers miss events instead of slowing publishers. */
    Flux<DomainEvent> events();
}
