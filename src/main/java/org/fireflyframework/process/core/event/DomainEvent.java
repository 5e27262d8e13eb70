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

package org.fireflyframework.process.core.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Immutable, append-only fact produced by the process engine.
 *
 * <p>Events describe what happened; they are consumed for audit and notification. The
 * engine never derives its decisions from them, the persisted execution aggregate is the
 * source of truth for current state.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(ProcessStarted.class),
        @JsonSubTypes.Type(ProcessCompleted.class),
        @JsonSubTypes.Type(ProcessFailed.class),
        @JsonSubTypes.Type(ProcessCancelled.class),
        @JsonSubTypes.Type(StepStarted.class),
        @JsonSubTypes.Type(StepCompleted.class),
        @JsonSubTypes.Type(StepFailed.class),
        @JsonSubTypes.Type(StepRetrying.class),
        @JsonSubTypes.Type(StepSkipped.class),
        @JsonSubTypes.Type(StepWaiting.class),
        @JsonSubTypes.Type(ApprovalRequested.class),
        @JsonSubTypes.Type(ApprovalDecided.class),
        @JsonSubTypes.Type(CompensationStarted.class),
        @JsonSubTypes.Type(CompensationCompleted.class),
        @JsonSubTypes.Type(CompensationFailed.class),
        @JsonSubTypes.Type(ExecutionRecovered.class),
        @JsonSubTypes.Type(ProcessPublished.class),
        @JsonSubTypes.Type(ProcessArchived.class),
        @JsonSubTypes.Type(RecoveryCompleted.class)
})
public sealed interface DomainEvent permits ExecutionEvent, ProcessPublished, ProcessArchived, RecoveryCompleted {

    Instant timestamp();

    default String eventType() {
        return getClass().getSimpleName();
    }
}
