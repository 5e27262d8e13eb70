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

package org.fireflyframework.process.core.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.StepId;
import org.fireflyframework.process.core.model.StepStatus;
import org.fireflyframework.process.execution.ProcessExecution;
import org.fireflyframework.process.execution.StepExecution;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides where a step output lives and rehydrates it transparently.
 *
 * <p>Outputs whose JSON encoding is smaller than the inline threshold stay in the step
 * execution; larger ones go to {@link OutputStorage} and are referenced by {@link OutputPath}.
 */
@Slf4j
public class StepOutputs {

    private final OutputStorage storage;
    private final ObjectMapper mapper;
    private final int inlineThresholdBytes;

    public StepOutputs(OutputStorage storage, ObjectMapper mapper, int inlineThresholdBytes) {
        this.storage = storage;
        this.mapper = mapper;
        this.inlineThresholdBytes = inlineThresholdBytes;
    }

    /** Where an output ended up: {@code path} is set when it was stored externally. */
    public record Placement(Map<String, Object> inline, OutputPath path) {}

    public Mono<Placement> place(ExecutionId executionId, StepId stepId, Map<String, Object> output) {
        if (output == null || output.isEmpty()) {
            return Mono.just(new Placement(Map.of(), null));
        }
        int size = sizeOf(output);
        if (size < inlineThresholdBytes) {
            return Mono.just(new Placement(output, null));
        }
        OutputPath path = new OutputPath(executionId, stepId);
        log.debug("[outputs] storing {} bytes for {} externally", size, path);
        return storage.store(path, output).thenReturn(new Placement(null, path));
    }

    public Mono<Map<String, Object>> resolve(StepExecution step) {
        if (!step.hasExternalOutput()) {
            return Mono.just(step.output());
        }
        return storage.load(step.outputPath())
                .map(found -> found.orElseGet(() -> {
                    log.warn("[outputs] output {} is referenced but missing from storage", step.outputPath());
                    return Map.of();
                }));
    }

    /** Outputs of every COMPLETED step of the execution, keyed by step id. */
    public Mono<Map<StepId, Map<String, Object>>> completedOutputs(ProcessExecution execution) {
        return Flux.fromIterable(execution.steps().values())
                .filter(step -> step.status() == StepStatus.COMPLETED)
                .concatMap(step -> resolve(step).map(output -> Map.entry(step.stepId(), output)))
                .collect(LinkedHashMap::new, (map, entry) -> map.put(entry.getKey(), entry.getValue()));
    }

    private int sizeOf(Map<String, Object> output) {
        try {
            return mapper.writeValueAsString(output).getBytes(StandardCharsets.UTF_8).length;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Step output is not serializable to JSON", e);
        }
    }
}
