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

import java.util.Objects;

/**
 * Error boundary of a step: what happens once a failure is final for the retry policy.
 *
 * @param onError  action to take
 * @param maxResets how many times {@link OnErrorAction#RETRY} may reset the attempt counter
 *                  before the failure is treated as {@link OnErrorAction#FAIL_EXECUTION}
 */
public record ErrorPolicy(OnErrorAction onError, int maxResets) {

    public static final ErrorPolicy DEFAULT = new ErrorPolicy(OnErrorAction.FAIL_EXECUTION, 0);

    public ErrorPolicy {
        Objects.requireNonNull(onError, "onError");
        if (maxResets < 0) throw new IllegalArgumentException("maxResets must be >= 0");
    }

    public static ErrorPolicy of(OnErrorAction onError) {
        return new ErrorPolicy(onError, onError == OnErrorAction.RETRY ? 1 : 0);
    }
}
