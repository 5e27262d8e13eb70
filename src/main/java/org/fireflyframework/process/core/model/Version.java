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
 * Optimistic-concurrency version of an aggregate. {@link #INITIAL} marks an aggregate that
 * has never been stored; every successful repository write advances it by one.
 */
public record Version(long value) implements Comparable<Version> {

    public static final Version INITIAL = new Version(0);

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Version {
        if (value < 0) throw new IllegalArgumentException("Version must be >= 0, got: " + value);
    }

    public static Version of(long value) {
        return new Version(value);
    }

    public Version next() {
        return new Version(value + 1);
    }

    public boolean isInitial() {
        return value == 0;
    }

    @Override
    public int compareTo(Version other) {
        return Long.compare(value, other.value);
    }

    @JsonValue
    public long toLong() {
        return value;
    }

    @Override
    public String toString() {
        return "v" + value;
    }
}
