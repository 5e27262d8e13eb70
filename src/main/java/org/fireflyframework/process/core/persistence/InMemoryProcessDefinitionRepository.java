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

import org.fireflyframework.process.core.exception.ConcurrencyConflictException;
import org.fireflyframework.process.core.model.ProcessId;
import org.fireflyframework.process.core.model.Version;
import org.fireflyframework.process.definition.ProcessDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryProcessDefinitionRepository implements ProcessDefinitionRepository {

    private final ConcurrentHashMap<ProcessId, List<ProcessDefinition>> store = new ConcurrentHashMap<>();

    @Override
    public Mono<ProcessDefinition> save(ProcessDefinition definition) {
        return Mono.fromCallable(() -> {
            List<ProcessDefinition> history = store.compute(definition.id(), (id, existing) -> {
                List<ProcessDefinition> versions = existing != null ? new ArrayList<>(existing) : new ArrayList<>();
                Version stored = versions.isEmpty() ? Version.INITIAL : versions.get(versions.size() - 1).version();
                if (!stored.equals(definition.version())) {
                    throw new ConcurrencyConflictException(id.value(), definition.version(), stored);
                }
                versions.add(definition.withVersion(stored.next()));
                return List.copyOf(versions);
            });
            return history.get(history.size() - 1);
        });
    }

    @Override
    public Mono<Optional<ProcessDefinition>> findById(ProcessId id) {
        return Mono.fromCallable(() -> Optional.ofNullable(store.get(id)).map(v -> v.get(v.size() - 1)));
    }

    @Override
    public Mono<Optional<ProcessDefinition>> findByIdAndVersion(ProcessId id, Version version) {
        return Mono.fromCallable(() -> Optional.ofNullable(store.get(id))
                .flatMap(versions -> versions.stream().filter(d -> d.version().equals(version)).findFirst()));
    }

    @Override
    public Flux<ProcessDefinition> findVersions(ProcessId id) {
        return Flux.defer(() -> Flux.fromIterable(store.getOrDefault(id, List.of())));
    }

    @Override
    public Flux<ProcessDefinition> findAll() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .map(versions -> versions.get(versions.size() - 1)));
    }

    // Test helpers
    public int size() { return store.size(); }
    public void clear() { store.clear(); }
}
