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

package org.fireflyframework.process.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.fireflyframework.process.execution.ProcessExecution;
import org.fireflyframework.process.handler.approval.ApprovalRequest;

/**
 * Serializes definitions, executions and approval requests to and from JSON for durable
 * stores. Shares the event serializer's mapper settings so money and timestamps are
 * written the same way in every table.
 */
public class AggregateSerializer {

    private final ObjectMapper mapper;

    public AggregateSerializer() {
        this(DomainEventSerializer.defaultObjectMapper());
    }

    public AggregateSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String serialize(ProcessDefinition definition) {
        return write(definition, "ProcessDefinition " + definition.id());
    }

    public String serialize(ProcessExecution execution) {
        return write(execution, "ProcessExecution " + execution.id());
    }

    public String serialize(ApprovalRequest request) {
        return write(request, "ApprovalRequest " + request.executionId() + "/" + request.stepId());
    }

    public ProcessDefinition deserializeDefinition(String json) {
        return read(json, ProcessDefinition.class);
    }

    public ProcessExecution deserializeExecution(String json) {
        return read(json, ProcessExecution.class);
    }

    public ApprovalRequest deserializeApproval(String json) {
        return read(json, ApprovalRequest.class);
    }

    private String write(Object value, String description) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + description, e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
