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

/**
 * Failure reported by an agent dispatch. Timeouts and server-side errors are retryable,
 * request validation problems are not.
 */
public class AgentTaskException extends ProcessEngineException {
    private final boolean retryable;
    private final String failureCode;

    public AgentTaskException(String message, String failureCode, boolean retryable) {
        super(message, "AGENT_TASK_ERROR");
        this.failureCode = failureCode;
        this.retryable = retryable;
    }

    public AgentTaskException(String message, String failureCode, boolean retryable, Throwable cause) {
        super(message, "AGENT_TASK_ERROR", cause);
        this.failureCode = failureCode;
        this.retryable = retryable;
    }

    public static AgentTaskException timeout(String agent, String detail) {
        return new AgentTaskException("Agent '" + agent + "' timed out: " + detail, "AGENT_TIMEOUT", true);
    }

    public static AgentTaskException serverError(String agent, int status, String detail) {
        return new AgentTaskException("Agent '" + agent + "' returned " + status + ": " + detail,
                "AGENT_SERVER_ERROR", status >= 500);
    }

    public static AgentTaskException invalidRequest(String agent, String detail) {
        return new AgentTaskException("Agent '" + agent + "' rejected the request: " + detail,
                "VALIDATION_ERROR", false);
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getFailureCode() {
        return failureCode;
    }
}
