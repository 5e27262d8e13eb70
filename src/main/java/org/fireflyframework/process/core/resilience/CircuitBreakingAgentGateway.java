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

package org.fireflyframework.process.core.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.fireflyframework.process.core.exception.AgentTaskException;
import org.fireflyframework.process.definition.AgentTaskConfig;
import org.fireflyframework.process.handler.agent.AgentGateway;
import org.fireflyframework.process.handler.agent.AgentResponse;
import reactor.core.publisher.Mono;

/**
 * Guards agent dispatch with one circuit breaker per agent name. An open circuit is
 * reported as a retryable {@code AGENT_UNAVAILABLE} failure so the step backs off instead
 * of hammering a failing agent.
 */
public class CircuitBreakingAgentGateway implements AgentGateway {

    static final String NAME_PREFIX = "process-agent.";

    private final AgentGateway delegate;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public CircuitBreakingAgentGateway(AgentGateway delegate, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.delegate = delegate;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    @Override
    public Mono<AgentResponse> dispatch(String agent, String message, AgentTaskConfig config) {
        CircuitBreaker cb = getCircuitBreaker(agent);
        return Mono.defer(() -> delegate.dispatch(agent, message, config))
                .transformDeferred(CircuitBreakerOperator.of(cb))
                .onErrorMap(CallNotPermittedException.class, e -> new AgentTaskException(
                        "Agent '" + agent + "' is unavailable: circuit " + cb.getState(),
                        "AGENT_UNAVAILABLE", true, e));
    }

    public CircuitBreaker getCircuitBreaker(String agent) {
        return circuitBreakerRegistry.circuitBreaker(NAME_PREFIX + agent);
    }

    public void resetCircuitBreaker(String agent) {
        getCircuitBreaker(agent).reset();
    }
}
