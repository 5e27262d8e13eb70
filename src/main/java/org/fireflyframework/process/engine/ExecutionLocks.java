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
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Per-execution asynchronous mutex. Work submitted for the same execution runs one at a
 * time in subscription order; different executions never wait on each other. No thread is
 * blocked while waiting for the lock.
 *
 * <p>A waiter cancelled before its turn keeps its place in the queue until its
 * predecessor releases, so the waiters behind it never overlap the current holder.
 *
 * <p>Not re-entrant: work holding the lock must not request it again for the same id.
 */
public class ExecutionLocks {

    private final ConcurrentHashMap<ExecutionId, Mono<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> withLock(ExecutionId id, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> release = Sinks.empty();
            Mono<Void> released = release.asMono();
            AtomicReference<Mono<Void>> previous = new AtomicReference<>();
            tails.compute(id, (key, tail) -> {
                previous.set(tail);
                return released;
            });
            Mono<Void> turn = previous.get() != null ? previous.get() : Mono.empty();
            AtomicBoolean started = new AtomicBoolean();
            Runnable unlock = () -> {
                release.tryEmitEmpty();
                tails.remove(id, released);
            };
            return turn.then(Mono.defer(() -> {
                        started.set(true);
                        return Mono.defer(work);
                    }))
                    .doFinally(signal -> {
                        if (started.get()) {
                            unlock.run();
                        } else {
                            // cancelled while queued: hand the turn on once the predecessor is done
                            turn.doFinally(s -> unlock.run()).subscribe();
                        }
                    });
        });
    }

    public boolean isLocked(ExecutionId id) {
        return tails.containsKey(id);
    }
}
