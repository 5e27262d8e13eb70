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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.scheduling.ProcessScheduler;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.time.Duration;

/**
 * Runs a recovery scan once the application context is ready and then sweeps
 * periodically on the process scheduler.
 */
@Slf4j
public class RecoveryRunner implements SmartInitializingSingleton {

    static final String SWEEP_TASK_ID = "recovery:sweep";

    private final RecoveryService recoveryService;
    private final ProcessScheduler scheduler;
    private final boolean runOnStartup;
    private final Duration sweepInterval;

    public RecoveryRunner(RecoveryService recoveryService, ProcessScheduler scheduler, boolean runOnStartup,
                          Duration sweepInterval) {
        this.recoveryService = recoveryService;
        this.scheduler = scheduler;
        this.runOnStartup = runOnStartup;
        this.sweepInterval = sweepInterval;
    }

    @Override
    public void afterSingletonsInstantiated() {
        if (runOnStartup) {
            recoveryService.recoverOnStartup()
                    .subscribe(report -> log.info("[recovery] Startup recovery processed {} executions",
                                    report.totalProcessed()),
                            err -> log.error("[recovery] Startup recovery failed", err));
        }
        if (sweepInterval != null && !sweepInterval.isZero() && !sweepInterval.isNegative()) {
            long delayMs = sweepInterval.toMillis();
            scheduler.scheduleWithFixedDelay(SWEEP_TASK_ID, this::sweep, delayMs, delayMs);
            log.info("[recovery] Periodic sweep every {}", sweepInterval);
        }
    }

    void sweep() {
        recoveryService.sweep()
                .subscribe(report -> log.debug("[recovery] Sweep processed {} executions", report.totalProcessed()),
                        err -> log.error("[recovery] Sweep failed", err));
    }
}
