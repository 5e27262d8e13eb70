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

import org.fireflyframework.process.core.exception.ProcessEngineException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Looks up channels by name and hands notifications to them.
 */
public class NotificationRouter {

    private final Map<String, NotificationChannel> channels = new LinkedHashMap<>();

    public NotificationRouter(List<? extends NotificationChannel> channels) {
        channels.forEach(channel -> this.channels.put(channel.name(), channel));
    }

    public Mono<Void> send(Notification notification) {
        NotificationChannel channel = channels.get(notification.channel());
        if (channel == null) {
            return Mono.error(new NotificationDeliveryException("Unknown notification channel '"
                    + notification.channel() + "'"));
        }
        return Mono.defer(() -> channel.send(notification));
    }

    public boolean hasChannel(String name) {
        return channels.containsKey(name);
    }

    public Set<String> channelNames() {
        return channels.keySet();
    }

    public static class NotificationDeliveryException extends ProcessEngineException {
        public NotificationDeliveryException(String message) {
            super(message, "NOTIFICATION_DELIVERY_FAILED");
        }
    }
}
