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

package org.fireflyframework.process.core.exception;

import org.fireflyframework.process.core.model.StepId;

import java.util.List;
import java.util.stream.Collectors;

public final class CircularDependencyException extends ProcessEngineException {
    private final List<StepId> cycle;

    public CircularDependencyException(List<StepId> cycle) {
        super("Circular dependency detected: " + cycle.stream()
                .map(StepId::value)
                .collect(Collectors.joining(" -> ")), "CIRCULAR_DEPENDENCY");
        this.cycle = List.copyOf(cycle);
    }

    /** The offending cycle, starting and ending with the same step. */
    public List<StepId> getCycle() {
        return cycle;
    }
}
