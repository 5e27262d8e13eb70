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

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for resilience4j circuit breakers around agent dispatch.
 *
 * <p>Provides a {@code CircuitBreakerRegistry} when the application has none; the engine
 * wraps its {@code AgentGateway} with one breaker per agent name.
 */
@Slf4j
@AutoConfiguration(before = ProcessEngineAutoConfiguration.class)
@ConditionalOnClass(CircuitBreakerRegistry.class)
@EnableConfigurationProperties(ProcessEngineProperties.class)
@ConditionalOnProperty(name = "firefly.process-engine.resilience.enabled", havingValue = "true", matchIfMissing = true)
public class ProcessEngineResilienceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry processCircuitBreakerRegistry(ProcessEngineProperties properties) {
        ProcessEngineProperties.ResilienceProperties resilience = properties.getResilience();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(resilience.getFailureRateThreshold())
                .waitDurationInOpenState(resilience.getWaitDurationInOpenState())
                .slidingWindowSize(resilience.getSlidingWindowSize())
                .build();
        log.info("[agent] Circuit breakers enabled (failure rate threshold {}%)", resilience.getFailureRateThreshold());
        return CircuitBreakerRegistry.of(config);
    }
}
