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

package org.fireflyframework.process.core.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.StepId;

import java.util.Objects;

/**
 * Address of an externally stored step output:
 * {@code /executions/{executionId}/steps/{stepId}/output}.
 */
public record OutputPath(ExecutionId executionId, StepId stepId) {

    public OutputPath {
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(stepId, "stepId");
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static OutputPath parse(String path) {
        Objects.requireNonNull(path, "path");
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        String[] parts = trimmed.split("/");
        if (parts.length != 5 || !"executions".equals(parts[0]) || !"steps".equals(parts[2])
                || !"output".equals(parts[4])) {
            throw new IllegalArgumentException("Invalid output path: " + path);
        }
        return new OutputPath(ExecutionId.of(parts[1]), StepId.of(parts[3]));
    }

    @JsonValue
    @Override
    public String toString() {
        return "/executions/" + executionId + "/steps/" + stepId + "/output";
    }
}
