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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.process.core.exception.ConcurrencyConflictException;
import org.fireflyframework.process.core.model.ProcessId;
import org.fireflyframework.process.core.model.Version;
import org.fireflyframework.process.core.persistence.AggregateSerializer;
import org.fireflyframework.process.core.persistence.ProcessDefinitionRepository;
import org.fireflyframework.process.definition.ProcessDefinition;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Definition store on a relational database: one row per {@code (process_id, version)}.
 * Rows are never updated, a save always inserts the next version. The primary key turns a
 * concurrent save of the same version into a {@link ConcurrencyConflictException}.
 */
@Slf4j
public class R2dbcProcessDefinitionRepository implements ProcessDefinitionRepository {

    private final DatabaseClient databaseClient;
    private final AggregateSerializer serializer;

    public R2dbcProcessDefinitionRepository(DatabaseClient databaseClient, AggregateSerializer serializer) {
        this.databaseClient = databaseClient;
        this.serializer = serializer;
    }

    @Override
    public Mono<ProcessDefinition> save(ProcessDefinition definition) {
        return latestVersion(definition.id()).flatMap(latest -> {
            if (!latest.equals(definition.version())) {
                return conflict(definition.id(), definition.version(), latest);
            }
            ProcessDefinition stored = definition.withVersion(latest.next());
            return databaseClient.sql("""
                        INSERT INTO process_definitions (process_id, version, name, status, payload)
                        VALUES (:processId, :version, :name, :status, :payload)
                        """)
                    .bind("processId", stored.id().value())
                    .bind("version", stored.version().value())
                    .bind("name", stored.name())
                    .bind("status", stored.status().name())
                    .bind("payload", serializer.serialize(stored))
                    .fetch()
                    .rowsUpdated()
                    .thenReturn(stored)
                    .onErrorResume(DataIntegrityViolationException.class, e -> latestVersion(stored.id())
                            .flatMap(actual -> conflict(stored.id(), definition.version(), actual)));
        });
    }

    private Mono<Version> latestVersion(ProcessId id) {
        return databaseClient.sql("""
                    SELECT COALESCE(MAX(version), 0) AS latest FROM process_definitions
                    WHERE process_id = :processId
                    """)
                .bind("processId", id.value())
                .map(row -> Version.of(row.get("latest", Long.class)))
                .first()
                .defaultIfEmpty(Version.INITIAL);
    }

    private Mono<ProcessDefinition> conflict(ProcessId id, Version expected, Version actual) {
        log.debug("[persistence] Version conflict on definition {}: expected {}, stored {}", id, expected, actual);
        return Mono.error(new ConcurrencyConflictException(id.value(), expected, actual));
    }

    @Override
    public Mono<Optional<ProcessDefinition>> findById(ProcessId id) {
        return databaseClient.sql("""
                    SELECT payload FROM process_definitions
                    WHERE process_id = :processId
                    ORDER BY version DESC
                    LIMIT 1
                    """)
                .bind("processId", id.value())
                .map(row -> row.get("payload", String.class))
                .first()
                .map(serializer::deserializeDefinition)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    @Override
    public Mono<Optional<ProcessDefinition>> findByIdAndVersion(ProcessId id, Version version) {
        return databaseClient.sql("""
                    SELECT payload FROM process_definitions
                    WHERE process_id = :processId AND version = :version
                    """)
                .bind("processId", id.value())
                .bind("version", version.value())
                .map(row -> row.get("payload", String.class))
                .first()
                .map(serializer::deserializeDefinition)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    @Override
    public Flux<ProcessDefinition> findVersions(ProcessId id) {
        return databaseClient.sql("""
                    SELECT payload FROM process_definitions
                    WHERE process_id = :processId
                    ORDER BY version
                    """)
                .bind("processId", id.value())
                .map(row -> row.get("payload", String.class))
                .all()
                .map(serializer::deserializeDefinition);
    }

    @Override
    public Flux<ProcessDefinition> findAll() {
        return databaseClient.sql("""
                    SELECT d.payload FROM process_definitions d
                    WHERE d.version = (SELECT MAX(v.version) FROM process_definitions v
                                       WHERE v.process_id = d.process_id)
                    ORDER BY d.process_id
                    """)
                .map(row -> row.get("payload", String.class))
                .all()
                .map(serializer::deserializeDefinition);
    }
}
