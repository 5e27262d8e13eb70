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

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifier of a step inside a process definition.
 *
 * <p>Lowercase letters, digits, {@code -} and {@code _}, starting with a letter, at most
 * {@value #MAX_LENGTH} characters.
 */
public record StepId(String value) {

    public static final int MAX_LENGTH = 64;
    private static final Pattern PATTERN = Pattern.compile("^[a-z][a-z0-9_-]*$");

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public StepId {
        Objects.requireNonNull(value, "value");
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("StepId '" + value + "' exceeds " + MAX_LENGTH + " characters");
        }
        if (!PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid StepId '" + value
                    + "': must start with a lowercase letter and contain only lowercase letters, digits, '-' or '_'");
        }
    }

    public static StepId of(String value) {
        return new StepId(value);
    }

    public static boolean isValid(String value) {
        return value != null && value.length() <= MAX_LENGTH && PATTERN.matcher(value).matches();
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
