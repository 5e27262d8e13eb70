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

package org.fireflyframework.process.core.expression;

import org.fireflyframework.process.core.exception.ExpressionException;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.StepId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Data an expression may reference: execution input, outputs of COMPLETED steps and
 * execution metadata. {@code knownSteps} is the full step graph, so a reference to a step
 * that exists but has not completed can be told apart from a typo.
 */
public record EvaluationContext(
        Map<String, Object> input,
        Map<StepId, Map<String, Object>> stepOutputs,
        Set<StepId> knownSteps,
        ExecutionId executionId,
        String processName
) {
    public static final String INPUT_ROOT = "input";
    public static final String EXECUTION_ROOT = "execution";
    public static final String PROCESS_ROOT = "process";

    public EvaluationContext {
        input = input != null ? Collections.unmodifiableMap(new LinkedHashMap<>(input)) : Map.of();
        stepOutputs = stepOutputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(stepOutputs)) : Map.of();
        knownSteps = knownSteps != null ? Collections.unmodifiableSet(new LinkedHashSet<>(knownSteps)) : Set.of();
    }

    public static EvaluationContext empty() {
        return new EvaluationContext(Map.of(), Map.of(), Set.of(), null, null);
    }

    /**
     * Resolves a dotted reference such as {@code research.summary}, {@code input.topic}
     * or {@code execution.id}.
     *
     * @throws ExpressionException when the reference cannot be resolved
     */
    public Object resolve(String expression) {
        String[] parts = expression.split("\\.", -1);
        String root = parts[0];
        List<String> rest = List.of(parts).subList(1, parts.length);
        switch (root) {
            case INPUT_ROOT:
                return navigate(expression, input, rest, "input");
            case EXECUTION_ROOT:
                if (rest.equals(List.of("id")) && executionId != null) return executionId.value();
                throw new ExpressionException(expression, "Unknown execution reference '" + expression + "'");
            case PROCESS_ROOT:
                if (rest.equals(List.of("name")) && processName != null) return processName;
                throw new ExpressionException(expression, "Unknown process reference '" + expression + "'");
            default:
                return resolveStep(expression, root, rest);
        }
    }

    private Object resolveStep(String expression, String root, List<String> path) {
        if (!StepId.isValid(root) || !knownSteps.contains(StepId.of(root))) {
            throw new ExpressionException(expression, "Reference to unknown step '" + root + "'");
        }
        Map<String, Object> output = stepOutputs.get(StepId.of(root));
        if (output == null) {
            throw new ExpressionException(expression, "Step '" + root + "' has not completed");
        }
        // "${step.output.x}" and "${step.x}" address the same value unless the output has its own "output" key
        if (!path.isEmpty() && "output".equals(path.get(0)) && !output.containsKey("output")) {
            path = path.subList(1, path.size());
        }
        return navigate(expression, output, path, "step '" + root + "'");
    }

    private static Object navigate(String expression, Object start, List<String> path, String owner) {
        Object current = start;
        for (String segment : path) {
            if (current instanceof Map<?, ?> map && map.containsKey(segment)) {
                current = map.get(segment);
            } else if (current instanceof List<?> list && isIndex(segment) && Integer.parseInt(segment) < list.size()) {
                current = list.get(Integer.parseInt(segment));
            } else {
                throw new ExpressionException(expression, "No value at '" + expression + "' in " + owner);
            }
        }
        return current;
    }

    private static boolean isIndex(String segment) {
        return !segment.isEmpty() && segment.length() < 10 && segment.chars().allMatch(Character::isDigit);
    }
}
