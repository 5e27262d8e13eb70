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

package org.fireflyframework.process.core.exception;

import org.fireflyframework.process.core.model.Version;

/**
 * Optimistic lock lost: the stored aggregate moved on since it was read. Reload and retry.
 */
public final class ConcurrencyConflictException extends ProcessEngineException {
    private final String aggregateId;
    private final Version expected;
    private final Version actual;

    public ConcurrencyConflictException(String aggregateId, Version expected, Version actual) {
        super("Concurrent modification of '" + aggregateId + "': expected " + expected
                + " but stored is " + actual, "CONCURRENCY_CONFLICT");
        this.aggregateId = aggregateId;
        this.expected = expected;
        this.actual = actual;
    }

    public String getAggregateId() { return aggregateId; }
    public Version getExpected() { return expected; }
    public Version getActual() { return actual; }
}
