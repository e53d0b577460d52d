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

package org.fireflyframework.contentsaga.shared.exception;

/**
 * Raised when the compensation of a completed step fails.
 */
public class CompensationException extends ContentSagaException {

    private final String runId;
    private final String stepName;

    public CompensationException(String runId, String stepName, Throwable cause) {
        super("Compensation of step '" + stepName + "' failed for run " + runId + ": " + describe(cause), cause);
        this.runId = runId;
        this.stepName = stepName;
    }

    public String getRunId() {
        return runId;
    }

    public String getStepName() {
        return stepName;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
