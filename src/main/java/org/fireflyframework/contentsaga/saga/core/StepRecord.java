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

package org.fireflyframework.contentsaga.saga.core;

import java.util.Objects;

/**
 * Progress of one step of one run, keyed by (runId, stepName).
 * References are stored in their string form ({@code namespace:id}).
 */
public record StepRecord(
        String runId,
        String stepName,
        int sequenceIndex,
        StepStatus status,
        String inputRef,
        String outputRef,
        String error
) {

    public StepRecord {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(stepName, "stepName");
        Objects.requireNonNull(status, "status");
    }

    public static StepRecord pending(String runId, String stepName, int sequenceIndex, String inputRef) {
        return new StepRecord(runId, stepName, sequenceIndex, StepStatus.PENDING, inputRef, null, null);
    }

    public StepRecord executing() {
        return new StepRecord(runId, stepName, sequenceIndex, StepStatus.EXECUTING, inputRef, outputRef, null);
    }

    public StepRecord completed(String output) {
        return new StepRecord(runId, stepName, sequenceIndex, StepStatus.COMPLETED, inputRef, output, null);
    }

    public StepRecord failed(String output, String failure) {
        return new StepRecord(runId, stepName, sequenceIndex, StepStatus.FAILED, inputRef, output, failure);
    }

    public StepRecord compensating() {
        return new StepRecord(runId, stepName, sequenceIndex, StepStatus.COMPENSATING, inputRef, outputRef, error);
    }

    public StepRecord compensated() {
        return new StepRecord(runId, stepName, sequenceIndex, StepStatus.COMPENSATED, inputRef, outputRef, error);
    }
}
