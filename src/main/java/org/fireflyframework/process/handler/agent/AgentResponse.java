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

import org.fireflyframework.process.core.model.Money;
import org.fireflyframework.process.core.model.TokenUsage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one agent dispatch.
 */
public record AgentResponse(Map<String, Object> output, Money cost, TokenUsage tokens) {

    public AgentResponse {
        output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
        cost = cost != null ? cost : Money.zero();
        tokens = tokens != null ? tokens : TokenUsage.NONE;
    }

    public static AgentResponse of(Map<String, Object> output) {
        return new AgentResponse(output, null, null);
    }
}
