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

import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepType;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record GatewayConfig(GatewayType type, List<GatewayRoute> routes, StepId defaultRoute) implements StepConfig {

    public GatewayConfig {
        type = type != null ? type : GatewayType.EXCLUSIVE;
        routes = routes != null ? List.copyOf(routes) : List.of();
    }

    public static GatewayConfig exclusive(List<GatewayRoute> routes, String defaultRoute) {
        return new GatewayConfig(GatewayType.EXCLUSIVE, routes, defaultRoute != null ? StepId.of(defaultRoute) : null);
    }

    /** Every step this gateway may route to, in declaration order, default route last. */
    public Set<StepId> targets() {
        Set<StepId> targets = new LinkedHashSet<>();
        routes.forEach(route -> targets.add(route.target()));
        if (defaultRoute != null) {
            targets.add(defaultRoute);
        }
        return targets;
    }

    @Override
    public StepType stepType() {
        return StepType.GATEWAY;
    }
}
