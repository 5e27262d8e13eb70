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

public final class CompensationException extends ProcessEngineException {
    private final StepId stepId;

    public CompensationException(StepId stepId, String message) {
        super("Compensation of step '" + stepId + "' failed: " + message, "COMPENSATION_ERROR");
        this.stepId = stepId;
    }

    public CompensationException(StepId stepId, String message, Throwable cause) {
        super("Compensation of step '" + stepId + "' failed: " + message, "COMPENSATION_ERROR", cause);
        this.stepId = stepId;
    }

    public StepId getStepId() {
        return stepId;
    }
}
