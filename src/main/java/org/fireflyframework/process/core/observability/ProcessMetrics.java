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

package org.fireflyframework.process.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.process.core.event.*;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer counters and timers fed from domain events.
 */
public class ProcessMetrics implements EventSubscriber {
    private static final String PREFIX = "firefly.process-engine";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public ProcessMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onEvent(DomainEvent event) {
        if (event instanceof ProcessStarted e) {
            counter("executions.started", "process", e.processName()).increment();
        } else if (event instanceof ProcessCompleted e) {
            counter("executions.finished", "process", e.processName(), "status", "completed").increment();
            timer("executions.duration", "process", e.processName()).record(e.duration());
        } else if (event instanceof ProcessFailed e) {
            counter("executions.finished", "process", e.processName(), "status", "failed").increment();
        } else if (event instanceof ProcessCancelled e) {
            counter("executions.finished", "process", e.processName(), "status", "cancelled").increment();
        } else if (event instanceof StepCompleted e) {
            counter("steps.finished", "outcome", "completed").increment();
            timer("steps.duration").record(e.duration());
        } else if (event instanceof StepFailed e && !e.willRetry()) {
            counter("steps.finished", "outcome", "failed", "code", e.errorCode()).increment();
        } else if (event instanceof StepSkipped) {
            counter("steps.finished", "outcome", "skipped").increment();
        } else if (event instanceof StepRetrying) {
            counter("steps.retries").increment();
        } else if (event instanceof CompensationStarted) {
            counter("compensations.started").increment();
        } else if (event instanceof CompensationFailed) {
            counter("compensations.failed").increment();
        } else if (event instanceof ExecutionRecovered e) {
            counter("recovery.executions", "action", e.action()).increment();
        }
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
