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

import com.fasterxml.jackson.annotation.JsonCreator;
import org.fireflyframework.process.core.model.StepType;

import java.util.List;

public record NotificationConfig(String channel, String message, List<String> recipients, String subject)
        implements StepConfig {

    public static final String DEFAULT_CHANNEL = "log";

    @JsonCreator
    public NotificationConfig {
        channel = channel != null && !channel.isBlank() ? channel : DEFAULT_CHANNEL;
        message = message != null ? message : "";
        recipients = recipients != null ? List.copyOf(recipients) : List.of();
        subject = subject != null ? subject : "";
    }

    public NotificationConfig(String message, List<String> recipients) {
        this(DEFAULT_CHANNEL, message, recipients, "");
    }

    @Override
    public StepType stepType() {
        return StepType.NOTIFICATION;
    }
}
