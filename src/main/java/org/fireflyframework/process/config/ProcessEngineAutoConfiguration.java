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

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.event.DomainEventPublisher;
import org.fireflyframework.process.core.event.EventBus;
import org.fireflyframework.process.core.event.EventSubscriber;
import org.fireflyframework.process.core.event.InMemoryEventBus;
import org.fireflyframework.process.core.expression.ExpressionEvaluator;
import org.fireflyframework.process.core.observability.LoggingEventSubscriber;
import org.fireflyframework.process.core.output.InMemoryOutputStorage;
import org.fireflyframework.process.core.output.OutputStorage;
import org.fireflyframework.process.core.output.StepOutputs;
import org.fireflyframework.process.core.persistence.*;
import org.fireflyframework.process.core.recovery.RecoveryRunner;
import org.fireflyframework.process.core.recovery.RecoveryService;
import org.fireflyframework.process.core.resilience.CircuitBreakingAgentGateway;
import org.fireflyframework.process.core.scheduling.ProcessScheduler;
import org.fireflyframework.process.core.validation.ProcessDefinitionValidator;
import org.fireflyframework.process.definition.ProcessDefinitionService;
import org.fireflyframework.process.engine.CompensationRunner;
import org.fireflyframework.process.engine.ExecutionEngine;
import org.fireflyframework.process.engine.StepHandler;
import org.fireflyframework.process.engine.StepHandlerRegistry;
import org.fireflyframework.process.handler.agent.AgentGateway;
import org.fireflyframework.process.handler.agent.AgentTaskHandler;
import org.fireflyframework.process.handler.approval.ApprovalStore;
import org.fireflyframework.process.handler.approval.HumanApprovalHandler;
import org.fireflyframework.process.handler.approval.InMemoryApprovalStore;
import org.fireflyframework.process.handler.gateway.GatewayHandler;
import org.fireflyframework.process.handler.notification.*;
import org.fireflyframework.process.handler.timer.TimerHandler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Main auto-configuration for the process engine.
 *
 * <p>Wires in-memory stores, the event bus and publisher, expression evaluation, output
 * storage, the built-in step handlers, compensation, the execution engine, definition
 * lifecycle and crash recovery. Every bean backs off when the application defines its own.
 * Agent tasks are only available when the application provides an {@link AgentGateway}.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(ProcessEngineProperties.class)
@ConditionalOnProperty(name = "firefly.process-engine.engine.enabled", havingValue = "true", matchIfMissing = true)
public class ProcessEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock processEngineClock() {
        return Clock.systemUTC();
    }

    // ── Persistence ──────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public DomainEventSerializer domainEventSerializer() {
        return new DomainEventSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessDefinitionRepository processDefinitionRepository() {
        log.info("[engine] Using in-memory process definition repository (default)");
        return new InMemoryProcessDefinitionRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessExecutionRepository processExecutionRepository() {
        log.info("[engine] Using in-memory process execution repository (default)");
        return new InMemoryProcessExecutionRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventRepository eventRepository(DomainEventSerializer serializer) {
        return new InMemoryEventRepository(serializer);
    }

    @Bean
    @ConditionalOnMissingBean
    public OutputStorage outputStorage() {
        return new InMemoryOutputStorage();
    }

    @Bean
    @ConditionalOnMissingBean
    public ApprovalStore approvalStore() {
        return new InMemoryApprovalStore();
    }

    // ── Events ───────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.process-engine.engine.audit-log", havingValue = "true", matchIfMissing = true)
    public LoggingEventSubscriber loggingEventSubscriber() {
        return new LoggingEventSubscriber();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBus processEventBus(ObjectProvider<EventSubscriber> subscribers) {
        InMemoryEventBus bus = new InMemoryEventBus(subscribers.orderedStream().toList());
        log.info("[event-bus] Event bus initialized with {} subscribers", bus.subscriberCount());
        return bus;
    }

    @Bean
    @ConditionalOnMissingBean
    public DomainEventPublisher domainEventPublisher(EventRepository eventRepository, EventBus eventBus) {
        return new DomainEventPublisher(eventRepository, eventBus);
    }

    // ── Expressions, outputs, validation ─────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public ExpressionEvaluator expressionEvaluator(DomainEventSerializer serializer) {
        return new ExpressionEvaluator(serializer.mapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public StepOutputs stepOutputs(OutputStorage storage, DomainEventSerializer serializer,
                                   ProcessEngineProperties properties) {
        return new StepOutputs(storage, serializer.mapper(), properties.getOutputs().getInlineThresholdBytes());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessDefinitionValidator processDefinitionValidator(ExpressionEvaluator evaluator) {
        return new ProcessDefinitionValidator(evaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessDefinitionService processDefinitionService(ProcessDefinitionRepository repository,
                                                             ProcessDefinitionValidator validator,
                                                             DomainEventPublisher publisher, Clock clock) {
        return new ProcessDefinitionService(repository, validator, publisher, clock);
    }

    // ── Scheduling ───────────────────────────────────────────────

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public ProcessScheduler processScheduler(ProcessEngineProperties properties, Clock clock) {
        int poolSize = properties.getScheduling().getThreadPoolSize();
        log.info("[scheduler] Scheduler initialized with thread pool size: {}", poolSize);
        return new ProcessScheduler(poolSize, clock);
    }

    // ── Notifications ────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotificationChannel")
    public LoggingNotificationChannel loggingNotificationChannel() {
        return new LoggingNotificationChannel();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationRouter notificationRouter(ObjectProvider<NotificationChannel> channels) {
        NotificationRouter router = new NotificationRouter(channels.orderedStream().toList());
        log.info("[notification] Channels available: {}", router.channelNames());
        return router;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.process-engine.notification.informed-enabled", havingValue = "true",
            matchIfMissing = true)
    public InformedAgentNotifier informedAgentNotifier(ProcessExecutionRepository executions,
                                                       ProcessDefinitionRepository definitions,
                                                       NotificationRouter router,
                                                       ProcessEngineProperties properties) {
        return new InformedAgentNotifier(executions, definitions, router,
                properties.getNotification().getInformedChannel());
    }

    // ── Step handlers ────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(AgentGateway.class)
    public AgentTaskHandler agentTaskHandler(ObjectProvider<AgentGateway> gateway,
                                             ObjectProvider<CircuitBreakerRegistry> circuitBreakers,
                                             ProcessEngineProperties properties) {
        return new AgentTaskHandler(effectiveGateway(gateway, circuitBreakers, properties));
    }

    @Bean
    @ConditionalOnMissingBean
    public HumanApprovalHandler humanApprovalHandler(ApprovalStore store) {
        return new HumanApprovalHandler(store);
    }

    @Bean
    @ConditionalOnMissingBean
    public GatewayHandler gatewayHandler() {
        return new GatewayHandler();
    }

    @Bean
    @ConditionalOnMissingBean
    public TimerHandler timerHandler() {
        return new TimerHandler();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationHandler notificationHandler(NotificationRouter router) {
        return new NotificationHandler(router);
    }

    @Bean
    @ConditionalOnMissingBean
    public StepHandlerRegistry stepHandlerRegistry(ObjectProvider<StepHandler> handlers) {
        StepHandlerRegistry registry = new StepHandlerRegistry(handlers.orderedStream().toList());
        log.info("[engine] Step handlers registered for: {}", registry.handlers().keySet());
        return registry;
    }

    // ── Engine ───────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public CompensationRunner compensationRunner(ObjectProvider<AgentGateway> gateway,
                                                 ObjectProvider<CircuitBreakerRegistry> circuitBreakers,
                                                 NotificationRouter router, ExpressionEvaluator evaluator,
                                                 StepOutputs outputs, ProcessExecutionRepository executions,
                                                 DomainEventPublisher publisher, ProcessEngineProperties properties,
                                                 Clock clock) {
        return new CompensationRunner(effectiveGateway(gateway, circuitBreakers, properties), router, evaluator,
                outputs, executions, publisher, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionEngine executionEngine(ProcessDefinitionRepository definitions,
                                           ProcessExecutionRepository executions,
                                           StepHandlerRegistry handlers, ExpressionEvaluator evaluator,
                                           StepOutputs outputs, DomainEventPublisher publisher,
                                           CompensationRunner compensation, ObjectProvider<ApprovalStore> approvals,
                                           ProcessScheduler scheduler, ProcessEngineProperties properties,
                                           Clock clock) {
        log.info("[engine] Execution engine initialized (default retry: {} attempts)",
                properties.getRetry().getMaxAttempts());
        return new ExecutionEngine(definitions, executions, handlers, evaluator, outputs, publisher, compensation,
                approvals.getIfAvailable(), scheduler, properties.getRetry().toPolicy(), clock);
    }

    // ── Recovery ─────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.process-engine.recovery.enabled", havingValue = "true", matchIfMissing = true)
    public RecoveryService recoveryService(ProcessExecutionRepository executions,
                                           ProcessDefinitionRepository definitions, ExecutionEngine engine,
                                           StepHandlerRegistry handlers, DomainEventPublisher publisher,
                                           ProcessEngineProperties properties, Clock clock) {
        ProcessEngineProperties.RecoveryProperties recovery = properties.getRecovery();
        log.info("[recovery] Recovery service initialized with stale threshold: {}, max age: {}",
                recovery.getStaleThreshold(), recovery.getMaxAge());
        return new RecoveryService(executions, definitions, engine, handlers, publisher,
                properties.getRetry().toPolicy(), recovery.getStaleThreshold(), recovery.getMaxAge(),
                recovery.isDryRun(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.process-engine.recovery.enabled", havingValue = "true", matchIfMissing = true)
    public RecoveryRunner recoveryRunner(RecoveryService recoveryService, ProcessScheduler scheduler,
                                         ProcessEngineProperties properties) {
        return new RecoveryRunner(recoveryService, scheduler, properties.getRecovery().isRunOnStartup(),
                properties.getRecovery().getSweepInterval());
    }

    private static AgentGateway effectiveGateway(ObjectProvider<AgentGateway> gateway,
                                                 ObjectProvider<CircuitBreakerRegistry> circuitBreakers,
                                                 ProcessEngineProperties properties) {
        AgentGateway delegate = gateway.getIfUnique();
        if (delegate == null) {
            return null;
        }
        CircuitBreakerRegistry registry = circuitBreakers.getIfUnique();
        if (registry == null || !properties.getResilience().isEnabled()) {
            return delegate;
        }
        return new CircuitBreakingAgentGateway(delegate, registry);
    }
}
