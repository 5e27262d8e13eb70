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

package org.fireflyframework.process.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.observability.ProcessMetrics;
import org.fireflyframework.process.core.observability.RecoveryHealthIndicator;
import org.fireflyframework.process.core.persistence.ProcessExecutionRepository;
import org.fireflyframework.process.core.recovery.RecoveryService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer metrics and the actuator health indicator, each activated when its library
 * is on the classpath.
 */
@Slf4j
@AutoConfiguration(after = ProcessEngineAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnBean(ProcessExecutionRepository.class)
public class ProcessEngineObservabilityAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(name = "firefly.process-engine.metrics.enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ProcessMetrics processMetrics(MeterRegistry registry) {
            log.info("[engine] Micrometer metrics enabled");
            return new ProcessMetrics(registry);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(ReactiveHealthIndicator.class)
    @ConditionalOnProperty(name = "firefly.process-engine.health.enabled", havingValue = "true", matchIfMissing = true)
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RecoveryHealthIndicator processEngineHealthIndicator(ProcessExecutionRepository executions,
                                                                    ObjectProvider<RecoveryService> recoveryService) {
            return new RecoveryHealthIndicator(executions, recoveryService.getIfAvailable());
        }
    }
}
