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

package org.fireflyframework.process.handler.gateway;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepType;
import org.fireflyframework.process.definition.GatewayConfig;
import org.fireflyframework.process.definition.GatewayRoute;
import org.fireflyframework.process.definition.GatewayType;
import org.fireflyframework.process.engine.StepContext;
import org.fireflyframework.process.engine.StepHandler;
import org.fireflyframework.process.engine.StepResult;
import reactor.core.publisher.Mono;

import java.util.*;

/**
 * Selects the branch(es) a gateway routes to.
 *
 * <ul>
 *   <li>exclusive: first route whose condition holds, output {@code {"route": target}}</li>
 *   <li>parallel: every route, output {@code {"routes": [...]}}</li>
 *   <li>inclusive: every route whose condition holds, output {@code {"routes": [...]}}</li>
 * </ul>
 * The default route applies when no condition holds. The selection is persisted as the
 * step output; the engine derives the skipped branches from that output only, so a
 * completed gateway is never re-evaluated.
 */
@Slf4j
public class GatewayHandler implements StepHandler {

    public static final String ROUTE_KEY = "route";
    public static final String ROUTES_KEY = "routes";

    @Override
    public StepType stepType() {
        return StepType.GATEWAY;
    }

    @Override
    public boolean isRecheckable() {
        return true;
    }

    @Override
    public Mono<StepResult> execute(StepContext context) {
        return Mono.fromCallable(() -> select(context));
    }

    private StepResult select(StepContext context) {
        GatewayConfig config = context.config(GatewayConfig.class);
        List<StepId> selected = new ArrayList<>();
        for (GatewayRoute route : config.routes()) {
            if (config.type() == GatewayType.PARALLEL || context.evaluateCondition(route.condition())) {
                selected.add(route.target());
                if (config.type() == GatewayType.EXCLUSIVE) break;
            }
        }
        if (selected.isEmpty() && config.defaultRoute() != null) {
            selected.add(config.defaultRoute());
        }
        if (selected.isEmpty()) {
            return StepResult.failure("No route of gateway '" + context.stepId() + "' matched and no default route is set",
                    "NO_MATCHING_ROUTE", false);
        }
        log.info("[gateway] Step '{}' of execution {} selected {}", context.stepId(), context.executionId(), selected);

        Map<String, Object> output = new LinkedHashMap<>();
        if (config.type() == GatewayType.EXCLUSIVE) {
            output.put(ROUTE_KEY, selected.get(0).value());
        } else {
            output.put(ROUTES_KEY, selected.stream().map(StepId::value).toList());
        }
        return StepResult.success(output);
    }

    /** Targets recorded in a gateway output, as written by this handler. */
    public static Set<StepId> selectedTargets(Map<String, Object> output) {
        Set<StepId> targets = new LinkedHashSet<>();
        Object route = output.get(ROUTE_KEY);
        if (route != null) {
            targets.add(StepId.of(route.toString()));
        }
        if (output.get(ROUTES_KEY) instanceof Collection<?> routes) {
            routes.forEach(r -> targets.add(StepId.of(r.toString())));
        }
        return targets;
    }
}
