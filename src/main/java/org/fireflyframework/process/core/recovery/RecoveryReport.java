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

package org.fireflyframework.process.core.recovery;

import org.fireflyframework.process.core.model.ExecutionId;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one recovery sweep.
 *
 * @param errors execution id to error message for executions whose recovery failed; a {@code null}
 *               key marks a failure of the scan itself
 */
public record RecoveryReport(
        Instant startedAt,
        Instant completedAt,
        List<ExecutionId> resumed,
        List<ExecutionId> retried,
        List<ExecutionId> failed,
        List<ExecutionId> skipped,
        Map<ExecutionId, String> errors,
        boolean dryRun
) {
    public RecoveryReport {
        resumed = List.copyOf(resumed);
        retried = List.copyOf(retried);
        failed = List.copyOf(failed);
        skipped = List.copyOf(skipped);
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static RecoveryReport of(Instant startedAt, Instant completedAt, List<RecoveryResult> results,
                                    boolean dryRun) {
        List<ExecutionId> resumed = new ArrayList<>();
        List<ExecutionId> retried = new ArrayList<>();
        List<ExecutionId> failed = new ArrayList<>();
        List<ExecutionId> skipped = new ArrayList<>();
        Map<ExecutionId, String> errors = new LinkedHashMap<>();
        for (RecoveryResult result : results) {
            if (result.executionId() == null) {
                errors.put(null, result.error());
                continue;
            }
            switch (result.action()) {
                case RESUME -> resumed.add(result.executionId());
                case RETRY_STEP -> retried.add(result.executionId());
                case MARK_FAILED -> failed.add(result.executionId());
                case SKIP -> skipped.add(result.executionId());
            }
            if (!result.success()) {
                errors.put(result.executionId(), result.error() != null ? result.error() : "unknown error");
            }
        }
        return new RecoveryReport(startedAt, completedAt, resumed, retried, failed, skipped, errors, dryRun);
    }

    public int totalProcessed() {
        return resumed.size() + retried.size() + failed.size() + skipped.size();
    }

    public int totalErrors() {
        return errors.size();
    }

    public Duration duration() {
        return completedAt != null ? Duration.between(startedAt, completedAt) : Duration.ZERO;
    }
}
