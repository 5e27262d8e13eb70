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

package org.fireflyframework.process.core.validation;

/**
 * One finding of definition validation.
 *
 * @param severity ERROR blocks publishing, WARNING is informational
 * @param message  human-readable description
 * @param location dotted path of the offending element, e.g. {@code process.onboarding.step.review}
 */
public record ValidationIssue(Severity severity, String message, String location) {

    public enum Severity { ERROR, WARNING }

    public static ValidationIssue error(String message, String location) {
        return new ValidationIssue(Severity.ERROR, message, location);
    }

    public static ValidationIssue warning(String message, String location) {
        return new ValidationIssue(Severity.WARNING, message, location);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + location + ": " + message;
    }
}
