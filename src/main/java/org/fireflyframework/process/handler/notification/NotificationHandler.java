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

import org.fireflyframework.process.core.model.StepType;
import org.fireflyframework.process.definition.NotificationConfig;
import org.fireflyframework.process.engine.StepContext;
import org.fireflyframework.process.engine.StepHandler;
import org.fireflyframework.process.engine.StepResult;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Sends the step message to its configured recipients plus the step's monitor and
 * informed roles. A channel that is not registered is a configuration error
 * ({@code INVALID_CONFIG}, never retried); a failing channel is a retryable
 * {@code NOTIFICATION_DELIVERY_FAILED}.
 */
public class NotificationHandler implements StepHandler {

    private final NotificationRouter router;

    public NotificationHandler(NotificationRouter router) {
        this.router = router;
    }

    @Override
    public StepType stepType() {
        return StepType.NOTIFICATION;
    }

    @Override
    public Mono<StepResult> execute(StepContext context) {
        NotificationConfig config = context.config(NotificationConfig.class);
        if (!router.hasChannel(config.channel())) {
            return Mono.just(StepResult.failure("Unknown notification channel '" + config.channel()
                    + "'; registered channels: " + router.channelNames(), "INVALID_CONFIG", false));
        }
        Set<String> recipients = new LinkedHashSet<>(config.recipients());
        recipients.addAll(context.step().roles().notificationRecipients());

        Notification notification = new Notification(config.channel(), context.render(config.subject()),
                context.render(config.message()), new ArrayList<>(recipients), context.executionId(),
                context.stepId());

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("channel", notification.channel());
        output.put("recipients", notification.recipients());
        output.put("sent_at", context.now().toString());

        return router.send(notification)
                .then(Mono.<StepResult>just(StepResult.success(output)))
                .onErrorResume(e -> Mono.just(StepResult.failure(
                        "Delivery through '" + notification.channel() + "' failed: " + e.getMessage(),
                        "NOTIFICATION_DELIVERY_FAILED", true)));
    }
}
