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

import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable outcome of a workflow run. Every run resolves to one of two shapes:
 * success with no compensated steps, or failure with the completed steps compensated
 * in reverse order.
 */
public final class WorkflowResult {
    private final String runId;
    private final String workflowName;
    private final boolean success;
    private final RunStatus status;
    private final List<String> completedSteps;
    private final List<String> compensatedSteps;
    private final String failedStep;
    private final FailureKind failureKind;
    private final String failureReason;
    private final Map<String, String> compensationFailures;
    private final Map<String, ArtifactRef> outputs;
    private final Instant startedAt;
    private final Instant completedAt;

    private WorkflowResult(Builder b) {
        this.runId = b.runId;
        this.workflowName = b.workflowName;
        this.success = b.success;
        this.status = b.status;
        this.completedSteps = List.copyOf(b.completedSteps);
        this.compensatedSteps = List.copyOf(b.compensatedSteps);
        this.failedStep = b.failedStep;
        this.failureKind = b.failureKind;
        this.failureReason = b.failureReason;
        this.compensationFailures = Map.copyOf(b.compensationFailures);
        this.outputs = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(b.outputs));
        this.startedAt = b.startedAt;
        this.completedAt = b.completedAt;
    }

    public String runId() { return runId; }
    public String workflowName() { return workflowName; }
    public boolean isSuccess() { return success; }
    public RunStatus status() { return status; }
    public List<String> completedSteps() { return completedSteps; }
    public List<String> compensatedSteps() { return compensatedSteps; }
    public Optional<String> failedStep() { return Optional.ofNullable(failedStep); }
    public Optional<FailureKind> failureKind() { return Optional.ofNullable(failureKind); }
    public Optional<String> failureReason() { return Optional.ofNullable(failureReason); }
    public Map<String, String> compensationFailures() { return compensationFailures; }
    public Map<String, ArtifactRef> outputs() { return outputs; }
    public Instant startedAt() { return startedAt; }
    public Instant completedAt() { return completedAt; }

    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }

    public Optional<ArtifactRef> outputOf(String stepName) {
        return Optional.ofNullable(outputs.get(stepName));
    }

    public static Builder builder(String runId, String workflowName) {
        return new Builder(runId, workflowName);
    }

    @Override
    public String toString() {
        return "WorkflowResult{runId=" + runId + ", success=" + success + ", status=" + status
                + ", completedSteps=" + completedSteps + ", compensatedSteps=" + compensatedSteps
                + (failedStep != null ? ", failedStep=" + failedStep + " (" + failureKind + ")" : "") + "}";
    }

    public static final class Builder {
        private final String runId;
        private final String workflowName;
        private boolean success;
        private RunStatus status = RunStatus.RUNNING;
        private List<String> completedSteps = List.of();
        private List<String> compensatedSteps = List.of();
        private String failedStep;
        private FailureKind failureKind;
        private String failureReason;
        private Map<String, String> compensationFailures = Map.of();
        private Map<String, ArtifactRef> outputs = Map.of();
        private Instant startedAt;
        private Instant completedAt;

        private Builder(String runId, String workflowName) {
            this.runId = runId;
            this.workflowName = workflowName;
        }

        public Builder success(boolean success) { this.success = success; return this; }
        public Builder status(RunStatus status) { this.status = status; return this; }
        public Builder completedSteps(List<String> steps) { this.completedSteps = steps; return this; }
        public Builder compensatedSteps(List<String> steps) { this.compensatedSteps = steps; return this; }
        public Builder failure(String step, FailureKind kind, String reason) {
            this.failedStep = step;
            this.failureKind = kind;
            this.failureReason = reason;
            return this;
        }
        public Builder compensationFailures(Map<String, String> failures) { this.compensationFailures = failures; return this; }
        public Builder outputs(Map<String, ArtifactRef> outputs) { this.outputs = outputs; return this; }
        public Builder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        public Builder completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }

        public WorkflowResult build() {
            return new WorkflowResult(this);
        }
    }
}
