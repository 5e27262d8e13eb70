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

import org.fireflyframework.process.core.persistence.ProcessExecutionRepository;
import org.fireflyframework.process.core.recovery.RecoveryReport;
import org.fireflyframework.process.core.recovery.RecoveryService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

/**
 * DOWN when the execution store is unhealthy; otherwise UP with the last recovery report
 * as details.
 */
public class RecoveryHealthIndicator implements ReactiveHealthIndicator {

    private final ProcessExecutionRepository executions;
    private final RecoveryService recoveryService;

    public RecoveryHealthIndicator(ProcessExecutionRepository executions, RecoveryService recoveryService) {
        this.executions = executions;
        this.recoveryService = recoveryService;
    }

    @Override
    public Mono<Health> health() {
        return executions.isHealthy()
                .map(healthy -> {
                    if (!healthy) {
                        return Health.down().withDetail("reason", "Execution store unhealthy").build();
                    }
                    Health.Builder builder = Health.up();
                    if (recoveryService != null) {
                        recoveryService.lastReport().ifPresentOrElse(
                                report -> addReport(builder, report),
                                () -> builder.withDetail("lastRecovery", "none"));
                    }
                    return builder.build();
                })
                .onErrorResume(e -> Mono.just(Health.down().withException(e).build()));
    }

    private static void addReport(Health.Builder builder, RecoveryReport report) {
        builder.withDetail("lastRecovery", report.completedAt())
                .withDetail("resumed", report.resumed().size())
                .withDetail("retried", report.retried().size())
                .withDetail("failed", report.failed().size())
                .withDetail("skipped", report.skipped().size())
                .withDetail("errors", report.totalErrors())
                .withDetail("durationMs", report.duration().toMillis())
                .withDetail("dryRun", report.dryRun());
    }
}
