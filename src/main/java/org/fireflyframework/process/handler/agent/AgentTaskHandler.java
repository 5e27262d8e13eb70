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

package org.fireflyframework.process.handler.agent;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.exception.AgentTaskException;
import org.fireflyframework.process.core.model.StepType;
import org.fireflyframework.process.definition.AgentTaskConfig;
import org.fireflyframework.process.engine.StepContext;
import org.fireflyframework.process.engine.StepHandler;
import org.fireflyframework.process.engine.StepResult;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Renders the step message and dispatches it to the configured agent.
 */
@Slf4j
public class AgentTaskHandler implements StepHandler {

    private final AgentGateway gateway;

    public AgentTaskHandler(AgentGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public StepType stepType() {
        return StepType.AGENT_TASK;
    }

    @Override
    public Mono<StepResult> execute(StepContext context) {
        AgentTaskConfig config = context.config(AgentTaskConfig.class);
        String message = context.render(config.message());
        long started = System.nanoTime();
        log.debug("[agent] Dispatching step '{}' of execution {} to agent '{}' (attempt {})",
                context.stepId(), context.executionId(), config.agent(), context.attempt());

        return gateway.dispatch(config.agent(), message, config)
                .timeout(config.timeout())
                .<StepResult>map(response -> new StepResult.Success(response.output(), response.cost(),
                        response.tokens(), Duration.ofNanos(System.nanoTime() - started)))
                .onErrorResume(TimeoutException.class, e -> Mono.just(toFailure(
                        AgentTaskException.timeout(config.agent(), "no response within " + config.timeout()))))
                .onErrorResume(AgentTaskException.class, e -> Mono.just(toFailure(e)));
    }

    private static StepResult toFailure(AgentTaskException e) {
        log.warn("[agent] {} (code={}, retryable={})", e.getMessage(), e.getFailureCode(), e.isRetryable());
        return StepResult.failure(e.getMessage(), e.getFailureCode(), e.isRetryable());
    }
}
