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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * How executions of a definition get submitted besides manual starts.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TriggerConfig.ScheduleTrigger.class, name = "schedule"),
        @JsonSubTypes.Type(value = TriggerConfig.WebhookTrigger.class, name = "webhook")
})
public sealed interface TriggerConfig permits TriggerConfig.ScheduleTrigger, TriggerConfig.WebhookTrigger {

    String id();

    boolean enabled();

    record ScheduleTrigger(String id, String cron, String timezone, boolean enabled) implements TriggerConfig {
        public ScheduleTrigger {
            timezone = timezone != null && !timezone.isBlank() ? timezone : "UTC";
        }
    }

    record WebhookTrigger(String id, String secret, boolean enabled) implements TriggerConfig {
    }
}
