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

package org.fireflyframework.process.engine;

import org.fireflyframework.process.core.model.ExecutionId;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executions currently driven by this engine instance, each with the cancellation signal
 * shared by all of its in-flight drives.
 */
class ActiveExecutions {

    private record Entry(CancellationSignal signal, int drives) {}

    private final ConcurrentHashMap<ExecutionId, Entry> entries = new ConcurrentHashMap<>();

    CancellationSignal enter(ExecutionId id) {
        return entries.compute(id, (key, entry) -> entry == null
                ? new Entry(new CancellationSignal(), 1)
                : new Entry(entry.signal(), entry.drives() + 1)).signal();
    }

    void leave(ExecutionId id) {
        entries.computeIfPresent(id, (key, entry) -> entry.drives() <= 1 ? null
                : new Entry(entry.signal(), entry.drives() - 1));
    }

    Optional<CancellationSignal> signal(ExecutionId id) {
        return Optional.ofNullable(entries.get(id)).map(Entry::signal);
    }

    boolean isActive(ExecutionId id) {
        return entries.containsKey(id);
    }
}
