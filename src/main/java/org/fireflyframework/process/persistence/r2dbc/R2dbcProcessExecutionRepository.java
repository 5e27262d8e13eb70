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
import org.fireflyframework.process.core.model.ExecutionId;
import org.fireflyframework.process.core.model.ExecutionStatus;
import org.fireflyframework.process.core.model.Version;
import org.fireflyframework.process.core.persistence.AggregateSerializer;
import org.fireflyframework.process.core.persistence.ProcessExecutionRepository;
import org.fireflyframework.process.execution.ProcessExecution;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Execution store on a relational database. Each execution is one row holding its JSON
 * snapshot; status, version and completion time are kept in columns so that lookups and
 * the optimistic version check run in SQL.
 *
 * <p>A save of a fresh execution ({@link Version#INITIAL}) is an insert, any other save an
 * {@code UPDATE ... WHERE version = :expected}. No row written means another writer got
 * there first and is reported as {@link ConcurrencyConflictException}.
 */
@Slf4j
public class R2dbcProcessExecutionRepository implements ProcessExecutionRepository {

    private final DatabaseClient databaseClient;
    private final AggregateSerializer serializer;
    private final Clock clock;

    public R2dbcProcessExecutionRepository(DatabaseClient databaseClient, AggregateSerializer serializer) {
        this(databaseClient, serializer, Clock.systemUTC());
    }

    public R2dbcProcessExecutionRepository(DatabaseClient databaseClient, AggregateSerializer serializer,
                                           Clock clock) {
        this.databaseClient = databaseClient;
        this.serializer = serializer;
        this.clock = clock;
    }

    @Override
    public Mono<ProcessExecution> save(ProcessExecution execution) {
        return Mono.defer(() -> {
            Version expected = execution.version();
            ProcessExecution stored = execution.withVersion(expected.next());
            Mono<Long> write = expected.isInitial() ? insert(stored) : update(stored, expected);
            return write.flatMap(rows -> rows > 0 ? Mono.just(stored) : conflict(execution.id(), expected));
        });
    }

    private Mono<Long> insert(ProcessExecution stored) {
        DatabaseClient.GenericExecuteSpec statement = databaseClient.sql("""
                    INSERT INTO process_executions
                        (execution_id, process_id, status, version, completed_at, payload)
                    VALUES (:executionId, :processId, :status, :version, :completedAt, :payload)
                    """)
                .bind("executionId", stored.id().value())
                .bind("processId", stored.processId().value())
                .bind("status", stored.status().name())
                .bind("version", stored.version().value())
                .bind("payload", serializer.serialize(stored));
        return bindCompletedAt(statement, stored)
                .fetch()
                .rowsUpdated()
                .onErrorResume(DataIntegrityViolationException.class, e -> Mono.just(0L));
    }

    private Mono<Long> update(ProcessExecution stored, Version expected) {
        DatabaseClient.GenericExecuteSpec statement = databaseClient.sql("""
                    UPDATE process_executions
                    SET status = :status, version = :version, completed_at = :completedAt, payload = :payload
                    WHERE execution_id = :executionId AND version = :expected
                    """)
                .bind("executionId", stored.id().value())
                .bind("status", stored.status().name())
                .bind("version", stored.version().value())
                .bind("expected", expected.value())
                .bind("payload", serializer.serialize(stored));
        return bindCompletedAt(statement, stored)
                .fetch()
                .rowsUpdated();
    }

    private static DatabaseClient.GenericExecuteSpec bindCompletedAt(DatabaseClient.GenericExecuteSpec statement,
                                                                     ProcessExecution execution) {
        return execution.completedAt() != null
                ? statement.bind("completedAt", execution.completedAt().toEpochMilli())
                : statement.bindNull("completedAt", Long.class);
    }

    private Mono<ProcessExecution> conflict(ExecutionId id, Version expected) {
        return databaseClient.sql("SELECT version FROM process_executions WHERE execution_id = :executionId")
                .bind("executionId", id.value())
                .map(row -> Version.of(row.get("version", Long.class)))
                .first()
                .defaultIfEmpty(Version.INITIAL)
                .flatMap(actual -> {
                    log.debug("[persistence] Version conflict on execution {}: expected {}, stored {}",
                            id, expected, actual);
                    return Mono.error(new ConcurrencyConflictException(id.value(), expected, actual));
                });
    }

    @Override
    public Mono<Optional<ProcessExecution>> findById(ExecutionId id) {
        return databaseClient.sql("SELECT payload FROM process_executions WHERE execution_id = :executionId")
                .bind("executionId", id.value())
                .map(row -> row.get("payload", String.class))
                .first()
                .map(serializer::deserializeExecution)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    @Override
    public Flux<ProcessExecution> findByStatus(ExecutionStatus status) {
        return databaseClient.sql("""
                    SELECT payload FROM process_executions
                    WHERE status = :status
                    ORDER BY execution_id
                    """)
                .bind("status", status.name())
                .map(row -> row.get("payload", String.class))
                .all()
                .map(serializer::deserializeExecution);
    }

    @Override
    public Flux<ProcessExecution> findActive() {
        return databaseClient.sql("""
                    SELECT payload FROM process_executions
                    WHERE status IN (:created, :running)
                    ORDER BY execution_id
                    """)
                .bind("created", ExecutionStatus.CREATED.name())
                .bind("running", ExecutionStatus.RUNNING.name())
                .map(row -> row.get("payload", String.class))
                .all()
                .map(serializer::deserializeExecution);
    }

    @Override
    public Mono<Long> cleanup(Duration olderThan) {
        return Mono.defer(() -> databaseClient.sql("""
                    DELETE FROM process_executions
                    WHERE status IN (:completed, :failed, :cancelled)
                      AND completed_at IS NOT NULL
                      AND completed_at < :threshold
                    """)
                .bind("completed", ExecutionStatus.COMPLETED.name())
                .bind("failed", ExecutionStatus.FAILED.name())
                .bind("cancelled", ExecutionStatus.CANCELLED.name())
                .bind("threshold", clock.instant().minus(olderThan).toEpochMilli())
                .fetch()
                .rowsUpdated());
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return databaseClient.sql("SELECT COUNT(*) AS cnt FROM process_executions")
                .map(row -> row.get("cnt", Long.class))
                .first()
                .map(count -> true)
                .onErrorResume(e -> {
                    log.warn("[persistence] Execution store health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }
}
