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

import org.fireflyframework.process.core.event.ExecutionEvent;
import org.fireflyframework.process.core.model.ExecutionId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event log held in memory in its serialized form, so reading it back goes through the
 * same JSON round trip a durable store would.
 */
public class InMemoryEventRepository implements EventRepository {

    private final ConcurrentHashMap<ExecutionId, List<String>> store = new ConcurrentHashMap<>();
    private final DomainEventSerializer serializer;

    public InMemoryEventRepository() {
        this(new DomainEventSerializer());
    }

    public InMemoryEventRepository(DomainEventSerializer serializer) {
        this.serializer = serializer;
    }

    @Override
    public Mono<Void> append(ExecutionEvent event) {
        return Mono.fromRunnable(() -> {
            String json = serializer.serialize(event);
            store.compute(event.executionId(), (id, log) -> {
                List<String> entries = log != null ? log : new ArrayList<>();
                entries.add(json);
                return entries;
            });
        });
    }

    @Override
    public Flux<ExecutionEvent> findByExecutionId(ExecutionId executionId) {
        return Flux.defer(() -> {
            List<String> snapshot = new ArrayList<>();
            store.computeIfPresent(executionId, (id, log) -> {
                snapshot.addAll(log);
                return log;
            });
            return Flux.fromIterable(snapshot).map(json -> (ExecutionEvent) serializer.deserialize(json));
        });
    }

    // Test helpers
    public int size() { return store.values().stream().mapToInt(List::size).sum(); }
    public void clear() { store.clear(); }
}
