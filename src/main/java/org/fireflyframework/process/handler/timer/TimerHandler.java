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

package org.fireflyframework.process.handler.timer;

import org.fireflyframework.process.core.model.StepType;
import org.fireflyframework.process.definition.TimerConfig;
import org.fireflyframework.process.engine.StepContext;
import org.fireflyframework.process.engine.StepHandler;
import org.fireflyframework.process.engine.StepResult;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parks the step until {@code startedAt + delay}. The due time is derived from the
 * persisted start instant, so a re-check after a restart waits only for the remainder.
 */
public class TimerHandler implements StepHandler {

    @Override
    public StepType stepType() {
        return StepType.TIMER;
    }

    @Override
    public boolean isRecheckable() {
        return true;
    }

    @Override
    public Mono<StepResult> execute(StepContext context) {
        TimerConfig config = context.config(TimerConfig.class);
        Instant started = context.stepExecution().startedAt() != null ? context.stepExecution().startedAt() : context.now();
        Instant due = started.plus(config.delay());
        if (context.now().isBefore(due)) {
            return Mono.just(StepResult.suspend("timer", due));
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("waited_seconds", config.delay().getSeconds());
        output.put("fired_at", context.now().toString());
        return Mono.just(StepResult.success(output));
    }
}
