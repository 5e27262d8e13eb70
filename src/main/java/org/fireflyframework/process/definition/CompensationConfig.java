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

package org.fireflyframework.process.definition;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Undo action run for a completed step when the execution is rolled back.
 */
public record CompensationConfig(CompensationType type, String agent, String message, Duration timeout,
                                 String channel, List<String> recipients) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    public CompensationConfig {
        Objects.requireNonNull(type, "type");
        message = message != null ? message : "";
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        channel = channel != null && !channel.isBlank() ? channel : NotificationConfig.DEFAULT_CHANNEL;
        recipients = recipients != null ? List.copyOf(recipients) : List.of();
    }

    public static CompensationConfig agentTask(String agent, String message) {
        return new CompensationConfig(CompensationType.AGENT_TASK, agent, message, DEFAULT_TIMEOUT, null, List.of());
    }

    public static CompensationConfig notification(String message, List<String> recipients) {
        return new CompensationConfig(CompensationType.NOTIFICATION, null, message, DEFAULT_TIMEOUT, null, recipients);
    }
}
