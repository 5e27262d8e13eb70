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

import org.fireflyframework.process.core.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the process engine.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   process-engine:
 *     retry:
 *       max-attempts: 3
 *       initial-delay: 5s
 *       max-delay: 5m
 *       multiplier: 2.0
 *     recovery:
 *       enabled: true
 *       run-on-startup: true
 *       stale-threshold: 5m
 *       max-age: 24h
 *       sweep-interval: 5m
 *     outputs:
 *       inline-threshold-bytes: 65536
 *     scheduling:
 *       thread-pool-size: 2
 *     resilience:
 *       enabled: true
 *       failure-rate-threshold: 50
 *     metrics:
 *       enabled: true
 *     notification:
 *       informed-channel: log
 *     agent:
 *       base-url-template: http://agent-{agent}:8000
 *     persistence:
 *       provider: r2dbc
 *       initialize-schema: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.process-engine")
public class ProcessEngineProperties {

    @NestedConfigurationProperty
    private EngineProperties engine = new EngineProperties();

    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();

    @NestedConfigurationProperty
    private RecoveryProperties recovery = new RecoveryProperties();

    @NestedConfigurationProperty
    private OutputsProperties outputs = new OutputsProperties();

    @NestedConfigurationProperty
    private SchedulingProperties scheduling = new SchedulingProperties();

    @NestedConfigurationProperty
    private ResilienceProperties resilience = new ResilienceProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    @NestedConfigurationProperty
    private NotificationProperties notification = new NotificationProperties();

    @NestedConfigurationProperty
    private AgentProperties agent = new AgentProperties();

    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();

    // --- Getters and Setters ---

    public EngineProperties getEngine() { return engine; }
    public void setEngine(EngineProperties engine) { this.engine = engine; }

    public RetryProperties getRetry() { return retry; }
    public void setRetry(RetryProperties retry) { this.retry = retry; }

    public RecoveryProperties getRecovery() { return recovery; }
    public void setRecovery(RecoveryProperties recovery) { this.recovery = recovery; }

    public OutputsProperties getOutputs() { return outputs; }
    public void setOutputs(OutputsProperties outputs) { this.outputs = outputs; }

    public SchedulingProperties getScheduling() { return scheduling; }
    public void setScheduling(SchedulingProperties scheduling) { this.scheduling = scheduling; }

    public ResilienceProperties getResilience() { return resilience; }
    public void setResilience(ResilienceProperties resilience) { this.resilience = resilience; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    public NotificationProperties getNotification() { return notification; }
    public void setNotification(NotificationProperties notification) { this.notification = notification; }

    public AgentProperties getAgent() { return agent; }
    public void setAgent(AgentProperties agent) { this.agent = agent; }

    public PersistenceProperties getPersistence() { return persistence; }
    public void setPersistence(PersistenceProperties persistence) { this.persistence = persistence; }

    // --- Nested property classes ---

    public static class EngineProperties {
        private boolean enabled = true;
        private boolean auditLog = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isAuditLog() { return auditLog; }
        public void setAuditLog(boolean auditLog) { this.auditLog = auditLog; }
    }

    /** Retry policy for steps that do not declare their own. */
    public static class RetryProperties {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = 2.0;
        private double jitter = 0.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }

        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialDelay, maxDelay, multiplier, jitter);
        }
    }

    public static class RecoveryProperties {
        private boolean enabled = true;
        private boolean runOnStartup = true;
        private Duration staleThreshold = Duration.ofMinutes(5);
        private Duration maxAge = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofMinutes(5);
        private boolean dryRun = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isRunOnStartup() { return runOnStartup; }
        public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }

        public Duration getStaleThreshold() { return staleThreshold; }
        public void setStaleThreshold(Duration staleThreshold) { this.staleThreshold = staleThreshold; }

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }

        public boolean isDryRun() { return dryRun; }
        public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }
    }

    public static class OutputsProperties {
        private int inlineThresholdBytes = 65536;

        public int getInlineThresholdBytes() { return inlineThresholdBytes; }
        public void setInlineThresholdBytes(int inlineThresholdBytes) { this.inlineThresholdBytes = inlineThresholdBytes; }
    }

    public static class SchedulingProperties {
        private int threadPoolSize = 2;

        public int getThreadPoolSize() { return threadPoolSize; }
        public void setThreadPoolSize(int threadPoolSize) { this.threadPoolSize = threadPoolSize; }
    }

    public static class ResilienceProperties {
        private boolean enabled = true;
        private float failureRateThreshold = 50;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
        private int slidingWindowSize = 10;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public float getFailureRateThreshold() { return failureRateThreshold; }
        public void setFailureRateThreshold(float failureRateThreshold) { this.failureRateThreshold = failureRateThreshold; }

        public Duration getWaitDurationInOpenState() { return waitDurationInOpenState; }
        public void setWaitDurationInOpenState(Duration waitDurationInOpenState) { this.waitDurationInOpenState = waitDurationInOpenState; }

        public int getSlidingWindowSize() { return slidingWindowSize; }
        public void setSlidingWindowSize(int slidingWindowSize) { this.slidingWindowSize = slidingWindowSize; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class HealthProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class NotificationProperties {
        private boolean informedEnabled = true;
        private String informedChannel = "log";

        public boolean isInformedEnabled() { return informedEnabled; }
        public void setInformedEnabled(boolean informedEnabled) { this.informedEnabled = informedEnabled; }

        public String getInformedChannel() { return informedChannel; }
        public void setInformedChannel(String informedChannel) { this.informedChannel = informedChannel; }
    }

    /** HTTP transport to agent containers; {@code {agent}} in the template is replaced by the agent name. */
    public static class AgentProperties {
        private String baseUrlTemplate;
        private Duration connectTimeout = Duration.ofSeconds(5);

        public String getBaseUrlTemplate() { return baseUrlTemplate; }
        public void setBaseUrlTemplate(String baseUrlTemplate) { this.baseUrlTemplate = baseUrlTemplate; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    }

    /**
     * Store selection: {@code in-memory} (default) or {@code r2dbc}, the latter needing a
     * {@code ConnectionFactory} bean.
     */
    public static class PersistenceProperties {
        private String provider = "in-memory";
        private boolean initializeSchema = true;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public boolean isInitializeSchema() { return initializeSchema; }
        public void setInitializeSchema(boolean initializeSchema) { this.initializeSchema = initializeSchema; }
    }
}
