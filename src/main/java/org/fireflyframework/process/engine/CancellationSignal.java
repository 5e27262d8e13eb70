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

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one execution. Handlers may poll {@link #isCancelled()}
 * or compose with {@link #whenCancelled()}; the engine stops retry scheduling once it is set.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.Empty<Void> sink = Sinks.empty();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            sink.tryEmitEmpty();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Completes when the signal is cancelled. */
    public Mono<Void> whenCancelled() {
        return sink.asMono();
    }
}
