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

package org.fireflyframework.contentsaga.saga.engine;

import org.fireflyframework.contentsaga.saga.core.FailureKind;
import org.fireflyframework.contentsaga.saga.core.RunStatus;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.core.StepStatus;
import org.fireflyframework.contentsaga.saga.core.WorkflowResult;
import org.fireflyframework.contentsaga.saga.core.WorkflowRun;
import org.fireflyframework.contentsaga.saga.registry.StepDefinition;
import org.fireflyframework.contentsaga.saga.registry.WorkflowDefinition;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one run while the coordinator drives it. Accessed sequentially
 * along a single reactive chain.
 */
final class RunExecution {

    final String runId;
    final WorkflowDefinition definition;
    final Object initialInput;
    final Instant startedAt;

    private CoordinatorState state;
    private final List<String> completed = new ArrayList<>();
    private final Map<String, ArtifactRef> outputs = new LinkedHashMap<>();
    private final Map<String, StepRecord> records = new HashMap<>();
    private final List<String> compensated = new ArrayList<>();
    private final Map<String, String> compensationFailures = new LinkedHashMap<>();
    private String failedStep;
    private FailureKind failureKind;
    private String failureReason;
    private boolean compensationAborted;

    RunExecution(String runId, WorkflowDefinition definition, Object initialInput, Instant startedAt) {
        this(runId, definition, initialInput, startedAt, CoordinatorState.CREATED);
    }

    private RunExecution(String runId, WorkflowDefinition definition, Object initialInput,
                         Instant startedAt, CoordinatorState state) {
        this.runId = runId;
        this.definition = definition;
        this.initialInput = initialInput;
        this.startedAt = startedAt;
        this.state = state;
    }

    /**
     * Rebuilds the state of a finished run from its step records, for manual compensation.
     * Only steps whose record is still COMPLETED take part.
     */
    static RunExecution restore(WorkflowRun run, WorkflowDefinition definition, List<StepRecord> stepRecords) {
        RunExecution execution = new RunExecution(run.runId(), definition, null, run.startedAt(), CoordinatorState.RUNNING);
        stepRecords.stream()
                .sorted(Comparator.comparingInt(StepRecord::sequenceIndex))
                .forEach(r -> {
                    execution.records.put(r.stepName(), r);
                    if (r.status() == StepStatus.COMPLETED && r.outputRef() != null) {
                        execution.completed.add(r.stepName());
                        execution.outputs.put(r.stepName(), ArtifactRef.parse(r.outputRef()));
                    }
                });
        return execution;
    }

    void transition(CoordinatorState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + state + " to " + target);
        }
        state = target;
    }

    CoordinatorState state() {
        return state;
    }

    StepContext contextFor(StepDefinition sd) {
        return new StepContext(runId, definition.name(), sd.name, sd.sequenceIndex, initialInput, outputs());
    }

    /**
     * Input of the next step: the last completed output, or the run input for the first step.
     */
    Object nextInput() {
        return completed.isEmpty() ? initialInput : outputOf(completed.get(completed.size() - 1));
    }

    String nextInputRef() {
        return completed.isEmpty() ? null : outputOf(completed.get(completed.size() - 1)).toString();
    }

    ArtifactRef outputOf(String stepName) {
        return outputs.get(stepName);
    }

    Map<String, ArtifactRef> outputs() {
        return new LinkedHashMap<>(outputs);
    }

    void markCompleted(String stepName, ArtifactRef ref) {
        completed.add(stepName);
        outputs.put(stepName, ref);
    }

    void markFailed(String stepName, FailureKind kind, String reason) {
        this.failedStep = stepName;
        this.failureKind = kind;
        this.failureReason = reason;
    }

    void markManualCompensation(String reason) {
        if (failedStep == null) {
            this.failureReason = reason;
        }
    }

    boolean hasFailed() {
        return failureKind != null;
    }

    void record(StepRecord record) {
        records.put(record.stepName(), record);
    }

    StepRecord recordOf(String stepName) {
        return records.get(stepName);
    }

    List<String> completedSteps() {
        return List.copyOf(completed);
    }

    void markCompensated(String stepName) {
        compensated.add(stepName);
    }

    void markCompensationFailed(String stepName, String reason) {
        compensationFailures.put(stepName, reason);
    }

    void abortCompensation() {
        this.compensationAborted = true;
    }

    boolean isCompensationAborted() {
        return compensationAborted;
    }

    /**
     * Terminal status after compensation: COMPENSATED only when at least one step was
     * rolled back and nothing went wrong while doing so.
     */
    RunStatus compensationStatus() {
        boolean clean = compensationFailures.isEmpty() && !compensationAborted;
        return clean && !compensated.isEmpty() ? RunStatus.COMPENSATED : RunStatus.FAILED;
    }

    String failureSummary() {
        if (failedStep == null) {
            return failureReason;
        }
        return "Step '" + failedStep + "' " + failureKind + ": " + failureReason;
    }

    WorkflowResult toResult(RunStatus status, Instant completedAt) {
        return WorkflowResult.builder(runId, definition.name())
                .success(status == RunStatus.SUCCEEDED)
                .status(status)
                .completedSteps(completed)
                .compensatedSteps(compensated)
                .failure(failedStep, failureKind, failureReason)
                .compensationFailures(compensationFailures)
                .outputs(outputs())
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }
}
