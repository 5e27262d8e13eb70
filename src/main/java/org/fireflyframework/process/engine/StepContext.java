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

package org.fireflyframework.process.engine;

import org.fireflyframework.process.core.expression.EvaluationContext;
import org.fireflyframework.process.core.expression.ExpressionEvaluator;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.definition.StepConfig;
import org.fireflyframework.process.definition.StepDefinition;
import org.fireflyframework.process.execution.ProcessExecution;
import org.fireflyframework.process.execution.StepExecution;

import java.time.Instant;

/**
 * Everything a handler sees for one invocation.
 *
 * @param execution     snapshot of the execution taken when the step was dispatched
 * @param step          the step definition
 * @param stepExecution runtime state of the step, already RUNNING
 * @param expressions   input, completed outputs and metadata for template rendering
 * @param evaluator     renders templates and evaluates conditions against {@code expressions}
 * @param cancellation  set when the execution is cancelled
 * @param now           dispatch time
 */
public record StepContext(
        ProcessExecution execution,
        StepDefinition step,
        StepExecution stepExecution,
        EvaluationContext expressions,
        ExpressionEvaluator evaluator,
        CancellationSignal cancellation,
        Instant now
) {

    public ExecutionId executionId() {
        return execution.id();
    }

    public StepId stepId() {
        return step.id();
    }

    public int attempt() {
        return stepExecution.attempt();
    }

    public <C extends StepConfig> C config(Class<C> type) {
        return type.cast(step.config());
    }

    public String render(String template) {
        return evaluator.evaluate(template, expressions);
    }

    public boolean evaluateCondition(String condition) {
        return evaluator.evaluateCondition(condition, expressions);
    }
}
