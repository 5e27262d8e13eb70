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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.process.core.exception.ExpressionException;
import org.fireflyframework.process.core.model.StepId;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${stepId.path}} tokens in templates and evaluates boolean conditions.
 *
 * <p>Templates render each token as text. Conditions are SpEL expressions in which every
 * token is bound as a typed variable, so {@code ${review.score} > 80} compares numbers
 * rather than strings. The condition context is read-only: no type references, no
 * constructors, no bean access.
 */
public class ExpressionEvaluator {

    private static final Pattern TOKEN = Pattern.compile("\\$\\{([^{}]*)}");
    private static final Pattern REFERENCE = Pattern.compile("^[A-Za-z0-9_-]+(\\.[A-Za-z0-9_-]+)*$");
    private static final ExpressionParser SPEL_PARSER = new SpelExpressionParser();

    private final ObjectMapper mapper;

    public ExpressionEvaluator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String evaluate(String template, EvaluationContext context) {
        if (template == null || template.isEmpty()) return "";
        Matcher matcher = TOKEN.matcher(template);
        StringBuilder out = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            String expression = reference(template, matcher.group(1));
            checkNoDanglingToken(template, template.substring(last, matcher.start()));
            out.append(template, last, matcher.start());
            out.append(render(context.resolve(expression)));
            last = matcher.end();
        }
        String tail = template.substring(last);
        checkNoDanglingToken(template, tail);
        out.append(tail);
        return out.toString();
    }

    /**
     * Evaluates a boolean condition. A blank condition is true.
     *
     * @throws ExpressionException when a token cannot be resolved, the expression does not
     *                             parse, or it does not yield a boolean
     */
    public boolean evaluateCondition(String condition, EvaluationContext context) {
        if (condition == null || condition.isBlank()) return true;
        Matcher matcher = TOKEN.matcher(condition);
        StringBuilder spel = new StringBuilder();
        Map<String, Object> variables = new LinkedHashMap<>();
        int last = 0;
        while (matcher.find()) {
            String expression = reference(condition, matcher.group(1));
            checkNoDanglingToken(condition, condition.substring(last, matcher.start()));
            String variable = "v" + variables.size();
            variables.put(variable, context.resolve(expression));
            spel.append(condition, last, matcher.start()).append('#').append(variable);
            last = matcher.end();
        }
        String tail = condition.substring(last);
        checkNoDanglingToken(condition, tail);
        spel.append(tail);

        SimpleEvaluationContext evalCtx = SimpleEvaluationContext.forReadOnlyDataBinding().build();
        variables.forEach(evalCtx::setVariable);
        evalCtx.setVariable("input", context.input());
        Map<String, Object> steps = new LinkedHashMap<>();
        context.stepOutputs().forEach((stepId, output) -> steps.put(stepId.value(), output));
        evalCtx.setVariable("steps", steps);
        try {
            Object result = SPEL_PARSER.parseExpression(spel.toString()).getValue(evalCtx);
            if (result instanceof Boolean bool) return bool;
            throw new ExpressionException(condition, "Condition '" + condition + "' did not evaluate to a boolean: " + result);
        } catch (ParseException | EvaluationException e) {
            throw new ExpressionException(condition, "Cannot evaluate condition '" + condition + "': " + e.getMessage(), e);
        }
    }

    /** Every token expression in the template, in order of appearance. */
    public List<String> extractExpressions(String template) {
        List<String> expressions = new ArrayList<>();
        if (template == null) return expressions;
        Matcher matcher = TOKEN.matcher(template);
        while (matcher.find()) {
            expressions.add(matcher.group(1).trim());
        }
        return expressions;
    }

    /**
     * Step ids referenced by the template. Reserved roots ({@code input}, {@code execution},
     * {@code process}) are not step references.
     *
     * @throws ExpressionException on malformed syntax
     */
    public Set<StepId> extractStepReferences(String template) {
        Set<StepId> refs = new LinkedHashSet<>();
        if (template == null) return refs;
        Matcher matcher = TOKEN.matcher(template);
        int last = 0;
        while (matcher.find()) {
            String expression = reference(template, matcher.group(1));
            checkNoDanglingToken(template, template.substring(last, matcher.start()));
            String root = expression.split("\\.")[0];
            if (!isReservedRoot(root)) {
                if (!StepId.isValid(root)) {
                    throw new ExpressionException(expression, "Invalid step reference '" + root + "' in '" + template + "'");
                }
                refs.add(StepId.of(root));
            }
            last = matcher.end();
        }
        checkNoDanglingToken(template, template.substring(last));
        return refs;
    }

    public static boolean isReservedRoot(String root) {
        return EvaluationContext.INPUT_ROOT.equals(root) || EvaluationContext.EXECUTION_ROOT.equals(root)
                || EvaluationContext.PROCESS_ROOT.equals(root);
    }

    String render(Object value) {
        if (value == null) return "";
        if (value instanceof String s) return s;
        if (value instanceof Map<?, ?> map) {
            if (map.containsKey("response")) return String.valueOf(map.get("response"));
            if (map.containsKey("value")) return String.valueOf(map.get("value"));
            return toJson(value);
        }
        if (value instanceof Iterable<?> || value.getClass().isArray()) return toJson(value);
        return String.valueOf(value);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ExpressionException(String.valueOf(value), "Cannot render value as JSON: " + e.getMessage(), e);
        }
    }

    private static String reference(String source, String raw) {
        String expression = raw.trim();
        if (!REFERENCE.matcher(expression).matches()) {
            throw new ExpressionException(raw, "Malformed expression '${" + raw + "}' in '" + source + "'");
        }
        return expression;
    }

    private static void checkNoDanglingToken(String source, String remainder) {
        if (remainder.contains("${")) {
            throw new ExpressionException(source, "Unterminated expression in '" + source + "'");
        }
    }
}
