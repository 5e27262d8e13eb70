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

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Default {@code log} channel: writes the notification to the application log.
 */
@Slf4j
public class LoggingNotificationChannel implements NotificationChannel {

    public static final String NAME = "log";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<Void> send(Notification notification) {
        return Mono.fromRunnable(() -> log.info("[notification] to={} subject='{}' execution={} step={}: {}",
                notification.recipients(), notification.subject(), notification.executionId(),
                notification.stepId(), notification.message()));
    }
}
