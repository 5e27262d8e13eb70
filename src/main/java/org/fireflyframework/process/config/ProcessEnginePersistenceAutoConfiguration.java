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

import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.persistence.AggregateSerializer;
import org.fireflyframework.process.core.persistence.DomainEventSerializer;
import org.fireflyframework.process.core.persistence.EventRepository;
import org.fireflyframework.process.core.persistence.ProcessDefinitionRepository;
import org.fireflyframework.process.core.persistence.ProcessExecutionRepository;
import org.fireflyframework.process.handler.approval.ApprovalStore;
import org.fireflyframework.process.persistence.r2dbc.R2dbcApprovalStore;
import org.fireflyframework.process.persistence.r2dbc.R2dbcEventRepository;
import org.fireflyframework.process.persistence.r2dbc.R2dbcProcessDefinitionRepository;
import org.fireflyframework.process.persistence.r2dbc.R2dbcProcessExecutionRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;

import java.time.Clock;

/**
 * Auto-configuration for durable stores.
 *
 * <p>With {@code firefly.process-engine.persistence.provider=r2dbc} and a
 * {@link ConnectionFactory} bean, definitions, executions, the event log and approval
 * requests are kept in relational tables. Otherwise the in-memory stores from
 * {@link ProcessEngineAutoConfiguration} are used.
 */
@Slf4j
@AutoConfiguration(before = ProcessEngineAutoConfiguration.class,
        afterName = "org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration")
@EnableConfigurationProperties(ProcessEngineProperties.class)
@ConditionalOnProperty(name = "firefly.process-engine.engine.enabled", havingValue = "true", matchIfMissing = true)
public class ProcessEnginePersistenceAutoConfiguration {

    static final String SCHEMA_LOCATION = "db/process-engine/schema.sql";

    @Configuration
    @ConditionalOnClass(name = "org.springframework.r2dbc.core.DatabaseClient")
    @ConditionalOnBean(type = "io.r2dbc.spi.ConnectionFactory")
    @ConditionalOnProperty(name = "firefly.process-engine.persistence.provider", havingValue = "r2dbc")
    static class R2dbcPersistenceConfig {

        private final DatabaseClient databaseClient;
        private final AggregateSerializer aggregateSerializer = new AggregateSerializer();

        R2dbcPersistenceConfig(ConnectionFactory connectionFactory, ObjectProvider<DatabaseClient> databaseClient) {
            this.databaseClient = databaseClient.getIfAvailable(() -> DatabaseClient.create(connectionFactory));
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(name = "firefly.process-engine.persistence.initialize-schema", havingValue = "true",
                matchIfMissing = true)
        public ConnectionFactoryInitializer processEngineSchemaInitializer(ConnectionFactory connectionFactory) {
            ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
            initializer.setConnectionFactory(connectionFactory);
            initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION)));
            log.info("[persistence] Initializing process engine tables from {}", SCHEMA_LOCATION);
            return initializer;
        }

        @Bean
        @ConditionalOnMissingBean(ProcessDefinitionRepository.class)
        public ProcessDefinitionRepository r2dbcProcessDefinitionRepository() {
            log.info("[persistence] Using R2DBC process definition repository");
            return new R2dbcProcessDefinitionRepository(databaseClient, aggregateSerializer);
        }

        @Bean
        @ConditionalOnMissingBean(ProcessExecutionRepository.class)
        public ProcessExecutionRepository r2dbcProcessExecutionRepository(ObjectProvider<Clock> clock) {
            log.info("[persistence] Using R2DBC process execution repository");
            return new R2dbcProcessExecutionRepository(databaseClient, aggregateSerializer,
                    clock.getIfAvailable(Clock::systemUTC));
        }

        @Bean
        @ConditionalOnMissingBean(EventRepository.class)
        public EventRepository r2dbcEventRepository(ObjectProvider<DomainEventSerializer> serializer) {
            return new R2dbcEventRepository(databaseClient, serializer.getIfAvailable(DomainEventSerializer::new));
        }

        @Bean
        @ConditionalOnMissingBean(ApprovalStore.class)
        public ApprovalStore r2dbcApprovalStore() {
            return new R2dbcApprovalStore(databaseClient, aggregateSerializer);
        }
    }
}
