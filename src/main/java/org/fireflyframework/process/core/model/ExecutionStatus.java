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

public enum ExecutionStatus {
    CREATED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == CREATED || this == RUNNING;
    }

    /**
     * Transitions are monotone: CREATED -> RUNNING -> {COMPLETED, FAILED, CANCELLED}.
     * A CREATED execution may also be cancelled or failed before it starts.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case CREATED -> target == RUNNING || target == CANCELLED || target == FAILED;
            case RUNNING -> target.isTerminal();
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
