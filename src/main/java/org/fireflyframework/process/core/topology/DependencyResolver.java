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

package org.fireflyframework.process.core.topology;

import org.fireflyframework.process.core.exception.CircularDependencyException;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepStatus;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.StepDefinition;

import java.util.*;

/**
 * Reads the step graph of a {@link ProcessDefinition}: readiness of steps against a status
 * snapshot, cycle detection and parallel layers.
 *
 * <p>All results follow definition order, so equal inputs always give equal outputs.
 */
public final class DependencyResolver {

    private DependencyResolver() {}

    /**
     * Steps that may start now: PENDING, with every dependency COMPLETED or SKIPPED.
     * A step missing from the snapshot counts as PENDING.
     */
    public static List<StepId> eligibleSteps(ProcessDefinition definition, Map<StepId, StepStatus> snapshot) {
        List<StepId> eligible = new ArrayList<>();
        for (StepDefinition step : definition.steps()) {
            StepStatus status = snapshot.getOrDefault(step.id(), StepStatus.PENDING);
            if (status != StepStatus.PENDING) continue;
            boolean ready = true;
            for (StepId dep : step.dependsOn()) {
                StepStatus depStatus = snapshot.getOrDefault(dep, StepStatus.PENDING);
                if (!depStatus.satisfiesDependency()) {
                    ready = false;
                    break;
                }
            }
            if (ready) eligible.add(step.id());
        }
        return eligible;
    }

    /**
     * Fails with {@link CircularDependencyException} carrying the offending path when the
     * graph has a cycle. Dependencies on unknown steps are ignored here.
     */
    public static void validate(ProcessDefinition definition) {
        findCycle(definition).ifPresent(cycle -> {
            throw new CircularDependencyException(cycle);
        });
    }

    /** First cycle found by depth-first traversal, as a path that starts and ends with the same step. */
    public static Optional<List<StepId>> findCycle(ProcessDefinition definition) {
        Map<StepId, List<StepId>> graph = new LinkedHashMap<>();
        for (StepDefinition step : definition.steps()) {
            graph.putIfAbsent(step.id(), step.dependsOn());
        }
        Set<StepId> visited = new HashSet<>();
        Deque<StepId> recursionStack = new ArrayDeque<>();
        for (StepId id : graph.keySet()) {
            List<StepId> cycle = dfs(id, graph, visited, recursionStack);
            if (cycle != null) return Optional.of(cycle);
        }
        return Optional.empty();
    }

    private static List<StepId> dfs(StepId node, Map<StepId, List<StepId>> graph,
                                    Set<StepId> visited, Deque<StepId> recursionStack) {
        if (recursionStack.contains(node)) {
            List<StepId> path = new ArrayList<>();
            boolean inCycle = false;
            for (Iterator<StepId> it = recursionStack.descendingIterator(); it.hasNext(); ) {
                StepId id = it.next();
                if (id.equals(node)) inCycle = true;
                if (inCycle) path.add(id);
            }
            path.add(node);
            return path;
        }
        if (!visited.add(node)) return null;

        recursionStack.push(node);
        for (StepId dep : graph.getOrDefault(node, List.of())) {
            if (!graph.containsKey(dep)) continue;
            List<StepId> cycle = dfs(dep, graph, visited, recursionStack);
            if (cycle != null) return cycle;
        }
        recursionStack.pop();
        return null;
    }

    /**
     * Groups steps into layers with Kahn's algorithm: layer 0 has no dependencies, every
     * later layer depends only on earlier ones. Steps in one layer are independent.
     *
     * @throws CircularDependencyException if the graph has a cycle
     */
    public static List<List<StepId>> layers(ProcessDefinition definition) {
        validate(definition);
        Map<StepId, Integer> indegree = new LinkedHashMap<>();
        Map<StepId, List<StepId>> adjacency = new LinkedHashMap<>();
        for (StepDefinition step : definition.steps()) {
            indegree.putIfAbsent(step.id(), 0);
            adjacency.putIfAbsent(step.id(), new ArrayList<>());
        }
        for (StepDefinition step : definition.steps()) {
            for (StepId dep : step.dependsOn()) {
                if (!adjacency.containsKey(dep)) continue;
                indegree.merge(step.id(), 1, Integer::sum);
                adjacency.get(dep).add(step.id());
            }
        }

        List<List<StepId>> layers = new ArrayList<>();
        Queue<StepId> queue = new ArrayDeque<>();
        indegree.forEach((id, degree) -> {
            if (degree == 0) queue.add(id);
        });
        while (!queue.isEmpty()) {
            int size = queue.size();
            List<StepId> layer = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                StepId u = queue.poll();
                layer.add(u);
                for (StepId v : adjacency.get(u)) {
                    if (indegree.merge(v, -1, Integer::sum) == 0) queue.add(v);
                }
            }
            layers.add(layer);
        }
        return layers;
    }

    /** Every step {@code stepId} depends on directly or transitively. */
    public static Set<StepId> ancestorsOf(ProcessDefinition definition, StepId stepId) {
        Set<StepId> ancestors = new LinkedHashSet<>();
        Deque<StepId> toVisit = new ArrayDeque<>();
        definition.step(stepId).ifPresent(s -> toVisit.addAll(s.dependsOn()));
        while (!toVisit.isEmpty()) {
            StepId current = toVisit.poll();
            if (ancestors.add(current)) {
                definition.step(current).ifPresent(s -> toVisit.addAll(s.dependsOn()));
            }
        }
        return ancestors;
    }
}
