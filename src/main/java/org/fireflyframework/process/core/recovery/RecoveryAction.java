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

package org.fireflyframework.process.core.recovery;

/**
 * What recovery does with an execution found in a non-terminal state.
 */
public enum RecoveryAction {
    /** Continue from persisted state; an interrupted re-checkable step is re-polled without a new attempt. */
    RESUME("resume"),
    /** Return the interrupted step to PENDING; its next start is a new attempt. */
    RETRY_STEP("retry_step"),
    /** Settle the interrupted step (or the execution) FAILED. */
    MARK_FAILED("mark_failed"),
    /** Nothing to do. */
    SKIP("skip");

    private final String value;

    RecoveryAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
