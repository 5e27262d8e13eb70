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

import org.fireflyframework.process.core.model.StepType;
import reactor.core.publisher.Mono;

/**
 * Executes steps of one {@link StepType}. Expected failures should be returned as
 * {@link StepResult.Failure}; exceptions are converted by the engine.
 */
public interface StepHandler {

    StepType stepType();

    Mono<StepResult> execute(StepContext context);

    /**
     * Whether re-invoking the handler after an interruption only re-checks an outcome
     * (approval decision, timer due time, gateway selection) instead of redoing work.
     * Recovery resumes such steps without consuming an attempt.
     */
    default boolean isRecheckable() {
        return false;
    }
}
