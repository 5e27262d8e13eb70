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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Executor / monitor / informed agent assignments of a step.
 */
public record StepRoles(String executor, List<String> monitors, List<String> informed) {

    public static final StepRoles NONE = new StepRoles(null, List.of(), List.of());

    public StepRoles {
        monitors = monitors != null ? List.copyOf(monitors) : List.of();
        informed = informed != null ? List.copyOf(informed) : List.of();
    }

    /** Monitors followed by informed agents, without duplicates. */
    public Set<String> notificationRecipients() {
        Set<String> recipients = new LinkedHashSet<>(monitors);
        recipients.addAll(informed);
        return recipients;
    }
}
