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

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.handler.agent.AgentGateway;
import org.fireflyframework.process.handler.agent.WebClientAgentGateway;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Auto-configuration for the HTTP transport to agent containers.
 *
 * <p>Active only when {@code firefly.process-engine.agent.base-url-template} is set and
 * the application has not provided its own {@link AgentGateway}.
 */
@Slf4j
@AutoConfiguration(before = ProcessEngineAutoConfiguration.class)
@ConditionalOnClass({WebClient.class, HttpClient.class})
@EnableConfigurationProperties(ProcessEngineProperties.class)
@ConditionalOnProperty(name = "firefly.process-engine.agent.base-url-template")
public class ProcessEngineAgentAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(AgentGateway.class)
    public WebClientAgentGateway webClientAgentGateway(ProcessEngineProperties properties,
                                                       ObjectProvider<WebClient.Builder> builders) {
        ProcessEngineProperties.AgentProperties agent = properties.getAgent();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) agent.getConnectTimeout().toMillis());
        WebClient webClient = builders.getIfAvailable(WebClient::builder)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
        log.info("[agent] HTTP agent gateway targeting {}", agent.getBaseUrlTemplate());
        return new WebClientAgentGateway(webClient, agent.getBaseUrlTemplate());
    }
}
