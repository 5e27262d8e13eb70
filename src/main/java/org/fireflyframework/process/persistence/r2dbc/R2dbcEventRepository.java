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

package org.fireflyframework.process.persistence.r2dbc;

import org.fireflyframework.process.core.event.ExecutionEvent;
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.persistence.DomainEventSerializer;
import org.fireflyframework.process.core.persistence.EventRepository;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only event log table. The identity column {@code seq} fixes insertion order.
 */
public class R2dbcEventRepository implements EventRepository {

    private final DatabaseClient databaseClient;
    private final DomainEventSerializer serializer;

    public R2dbcEventRepository(DatabaseClient databaseClient, DomainEventSerializer serializer) {
        this.databaseClient = databaseClient;
        this.serializer = serializer;
    }

    @Override
    public Mono<Void> append(ExecutionEvent event) {
        return Mono.defer(() -> databaseClient.sql("""
                    INSERT INTO process_events (execution_id, event_type, occurred_at, payload)
                    VALUES (:executionId, :eventType, :occurredAt, :payload)
                    """)
                .bind("executionId", event.executionId().value())
                .bind("eventType", event.eventType())
                .bind("occurredAt", event.timestamp().toEpochMilli())
                .bind("payload", serializer.serialize(event))
                .fetch()
                .rowsUpdated()
                .then());
    }

    @Override
    public Flux<ExecutionEvent> findByExecutionId(ExecutionId executionId) {
        return databaseClient.sql("""
                    SELECT payload FROM process_events
                    WHERE execution_id = :executionId
                    ORDER BY seq
                    """)
                .bind("executionId", executionId.value())
                .map(row -> row.get("payload", String.class))
                .all()
                .map(json -> (ExecutionEvent) serializer.deserialize(json));
    }
}
