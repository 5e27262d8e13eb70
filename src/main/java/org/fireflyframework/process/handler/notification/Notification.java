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

package org.fireflyframework.process.handler.notification;

import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.StepId;

import java.util.List;

/**
 * A rendered message addressed to recipients, sent through a named channel.
 */
public record Notification(
        String channel,
        String subject,
        String message,
        List<String> recipients,
        ExecutionId executionId,
        StepId stepId
) {
    public Notification {
        subject = subject != null ? subject : "";
        message = message != null ? message : "";
        recipients = recipients != null ? List.copyOf(recipients) : List.of();
    }
}
