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

package org.fireflyframework.process.core.output;

import org.fireflyframework.process.core.model.ExecutionId;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryOutputStorage implements OutputStorage {

    private final ConcurrentHashMap<OutputPath, Map<String, Object>> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> store(OutputPath path, Map<String, Object> output) {
        return Mono.fromRunnable(() -> store.put(path, Collections.unmodifiableMap(new LinkedHashMap<>(output))));
    }

    @Override
    public Mono<Optional<Map<String, Object>>> load(OutputPath path) {
        return Mono.fromCallable(() -> Optional.ofNullable(store.get(path)));
    }

    @Override
    public Mono<Long> deleteAll(ExecutionId executionId) {
        return Mono.fromCallable(() -> {
            long count = 0;
            var it = store.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().executionId().equals(executionId)) {
                    it.remove();
                    count++;
                }
            }
            return count;
        });
    }

    // Test helpers
    public int size() { return store.size(); }
    public void clear() { store.clear(); }
}
