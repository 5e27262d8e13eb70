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

package org.fireflyframework.process.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the engine does with a step failure that is not (or no longer) retried.
 */
public enum OnErrorAction {
    /** Reset the attempt counter and run the step again, bounded by {@link ErrorPolicy#maxResets()}. */
    RETRY("retry"),
    /** Mark the step SKIPPED and keep going. */
    SKIP("skip"),
    /** Fail the step and the execution, then roll back completed steps. */
    FAIL_EXECUTION("fail_execution"),
    /** Roll back completed steps first, then fail the execution. */
    COMPENSATE("compensate");

    private final String value;

    OnErrorAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static OnErrorAction fromValue(String value) {
        for (OnErrorAction action : values()) {
            if (action.value.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown on-error action: " + value);
    }
}
