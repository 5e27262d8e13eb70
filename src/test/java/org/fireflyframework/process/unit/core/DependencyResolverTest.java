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

package org.fireflyframework.process.unit.core;

import org.fireflyframework.process.core.exception.CircularDependencyException;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepStatus;
import org.fireflyframework.process.core.topology.DependencyResolver;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.definition.builder.ProcessBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DependencyResolverTest {

    private static StepId id(String value) {
        return StepId.of(value);
    }

    private static ProcessDefinition diamond() {
        return new ProcessBuilder("diamond")
                .step("a").agentTask("x", "a").add()
                .step("b").agentTask("x", "b").dependsOn("a").add()
                .step("c").agentTask("x", "c").dependsOn("a").add()
                .step("d").agentTask("x", "d").dependsOn("b", "c").add()
                .build();
    }

    @Test
    void eligibleSteps_initially_onlyRoots() {
        assertThat(DependencyResolver.eligibleSteps(diamond(), Map.of())).containsExactly(id("a"));
    }

    @Test
    void eligibleSteps_afterRootCompletes_returnsIndependentSiblings_inDefinitionOrder() {
        Map<StepId, StepStatus> snapshot = Map.of(id("a"), StepStatus.COMPLETED, id("b"), StepStatus.PENDING,
                id("c"), StepStatus.PENDING, id("d"), StepStatus.PENDING);
        assertThat(DependencyResolver.eligibleSteps(diamond(), snapshot)).containsExactly(id("b"), id("c"));
    }

    @Test
    void eligibleSteps_skippedDependency_satisfiesDependents() {
        Map<StepId, StepStatus> snapshot = Map.of(id("a"), StepStatus.COMPLETED, id("b"), StepStatus.SKIPPED,
                id("c"), StepStatus.COMPLETED, id("d"), StepStatus.PENDING);
        assertThat(DependencyResolver.eligibleSteps(diamond(), snapshot)).containsExactly(id("d"));
    }

    @Test
    void eligibleSteps_failedOrWaitingDependency_blocksDependents() {
        Map<StepId, StepStatus> snapshot = Map.of(id("a"), StepStatus.COMPLETED, id("b"), StepStatus.FAILED,
                id("c"), StepStatus.WAITING, id("d"), StepStatus.PENDING);
        assertThat(DependencyResolver.eligibleSteps(diamond(), snapshot)).isEmpty();
    }

    @Test
    void layers_groupIndependentSteps() {
        assertThat(DependencyResolver.layers(diamond()))
                .containsExactly(List.of(id("a")), List.of(id("b"), id("c")), List.of(id("d")));
    }

    @Test
    void ancestorsOf_isTransitive() {
        assertThat(DependencyResolver.ancestorsOf(diamond(), id("d")))
                .containsExactlyInAnyOrder(id("a"), id("b"), id("c"));
        assertThat(DependencyResolver.ancestorsOf(diamond(), id("a"))).isEmpty();
    }

    @Test
    void validate_withCycle_reportsOffendingPath() {
        ProcessDefinition cyclic = new ProcessBuilder("cyclic")
                .step("a").agentTask("x", "a").dependsOn("c").add()
                .step("b").agentTask("x", "b").dependsOn("a").add()
                .step("c").agentTask("x", "c").dependsOn("b").add()
                .build();

        assertThatThrownBy(() -> DependencyResolver.validate(cyclic))
                .isInstanceOfSatisfying(CircularDependencyException.class, e -> {
                    List<StepId> cycle = e.getCycle();
                    assertThat(cycle.get(0)).isEqualTo(cycle.get(cycle.size() - 1));
                    assertThat(cycle).contains(id("a"), id("b"), id("c"));
                });
    }

    @Test
    void findCycle_onAcyclicGraph_isEmpty() {
        assertThat(DependencyResolver.findCycle(diamond())).isEmpty();
    }
}
