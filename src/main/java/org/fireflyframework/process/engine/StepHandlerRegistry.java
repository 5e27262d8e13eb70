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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.model.StepType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each {@link StepType} to its handler. Built once; adding a step type means
 * registering one more handler.
 */
@Slf4j
public class StepHandlerRegistry {

    private final Map<StepType, StepHandler> handlers = new EnumMap<>(StepType.class);

    public StepHandlerRegistry(List<? extends StepHandler> handlers) {
        for (StepHandler handler : handlers) {
            StepHandler existing = this.handlers.putIfAbsent(handler.stepType(), handler);
            if (existing != null) {
                throw new IllegalStateException("Duplicate handler for step type '" + handler.stepType().value()
                        + "': " + existing.getClass().getName() + " and " + handler.getClass().getName());
            }
        }
        log.info("[engine] Registered step handlers for {}", this.handlers.keySet());
    }

    public Optional<StepHandler> find(StepType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public boolean isRecheckable(StepType type) {
        return find(type).map(StepHandler::isRecheckable).orElse(false);
    }

    public Map<StepType, StepHandler> handlers() {
        return Collections.unmodifiableMap(handlers);
    }
}
