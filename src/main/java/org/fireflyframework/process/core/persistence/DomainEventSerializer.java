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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.core.StreamWriteFeature;
import org.fireflyframework.process.core.event.DomainEvent;

/**
 * Serializes {@link DomainEvent}s to and from JSON for the durable event log.
 *
 * <p>Decimals are read as {@code BigDecimal} and written in plain notation, so money
 * amounts survive a round trip without binary rounding.
 */
public class DomainEventSerializer {

    private final ObjectMapper mapper;

    public DomainEventSerializer() {
        this(defaultObjectMapper());
    }

    public DomainEventSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
                .build();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String serialize(DomainEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + event.eventType(), e);
        }
    }

    public DomainEvent deserialize(String json) {
        try {
            return mapper.readValue(json, DomainEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize domain event", e);
        }
    }
}
