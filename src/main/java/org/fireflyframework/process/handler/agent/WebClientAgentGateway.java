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
import org.fireflyframework.process.core.model.Money;
import org.fireflyframework.process.core.model.TokenUsage;
import org.fireflyframework.process.definition.AgentTaskConfig;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link AgentGateway} that posts a stateless task to the agent container's
 * {@code /api/task} endpoint.
 *
 * <p>Request body: {@code {"message", "timeout_seconds", "model"?}}. The reply's
 * {@code response} text becomes the step output together with the agent name; cost and
 * token usage are read from {@code metadata.cost_usd}, {@code metadata.input_tokens} and
 * {@code metadata.output_tokens} when present.
 *
 * <p>Status mapping: 5xx is a retryable {@code AGENT_SERVER_ERROR}, 408 a retryable
 * {@code AGENT_TIMEOUT}, 429 and connection failures a retryable {@code AGENT_UNAVAILABLE},
 * any other 4xx a non-retryable {@code VALIDATION_ERROR}.
 */
@Slf4j
public class WebClientAgentGateway implements AgentGateway {

    public static final String TASK_PATH = "/api/task";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final String baseUrlTemplate;

    /**
     * @param baseUrlTemplate agent base URL, with {@code {agent}} standing for the agent name,
     *                        e.g. {@code http://agent-{agent}:8000}
     */
    public WebClientAgentGateway(WebClient webClient, String baseUrlTemplate) {
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.baseUrlTemplate = Objects.requireNonNull(baseUrlTemplate, "baseUrlTemplate");
    }

    @Override
    public Mono<AgentResponse> dispatch(String agent, String message, AgentTaskConfig config) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("timeout_seconds", config.timeout().toSeconds());
        if (config.model() != null) {
            body.put("model", config.model());
        }
        return webClient.post()
                .uri(baseUrlTemplate + TASK_PATH, agent)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(response -> handleResponse(agent, response))
                .onErrorMap(WebClientRequestException.class, e -> new AgentTaskException(
                        "Agent '" + agent + "' is unreachable: " + e.getMessage(), "AGENT_UNAVAILABLE", true, e));
    }

    private Mono<AgentResponse> handleResponse(String agent, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.is2xxSuccessful()) {
            return response.bodyToMono(JSON_OBJECT)
                    .defaultIfEmpty(Map.of())
                    .map(reply -> toAgentResponse(agent, reply));
        }
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(detail -> Mono.error(toFailure(agent, status.value(), detail)));
    }

    static AgentTaskException toFailure(String agent, int status, String detail) {
        log.debug("[agent] Agent '{}' answered HTTP {}: {}", agent, status, detail);
        if (status >= 500) {
            return AgentTaskException.serverError(agent, status, detail);
        }
        if (status == 408) {
            return AgentTaskException.timeout(agent, "HTTP 408 " + detail);
        }
        if (status == 429) {
            return new AgentTaskException("Agent '" + agent + "' is busy: " + detail, "AGENT_UNAVAILABLE", true);
        }
        return AgentTaskException.invalidRequest(agent, "HTTP " + status + " " + detail);
    }

    static AgentResponse toAgentResponse(String agent, Map<String, Object> reply) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("response", reply.getOrDefault("response", ""));
        output.put("agent", agent);

        Money cost = null;
        TokenUsage tokens = null;
        if (reply.get("metadata") instanceof Map<?, ?> metadata) {
            if (metadata.get("cost_usd") instanceof Number amount) {
                cost = Money.of(new BigDecimal(amount.toString()), Money.DEFAULT_CURRENCY);
            }
            tokens = new TokenUsage(count(metadata.get("input_tokens")), count(metadata.get("output_tokens")));
        }
        return new AgentResponse(output, cost, tokens);
    }

    private static long count(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
