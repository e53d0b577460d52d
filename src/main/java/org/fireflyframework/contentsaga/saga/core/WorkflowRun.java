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

import java.time.Instant;
import java.util.Objects;

/**
 * One invocation of a workflow definition. Created when the run starts and mutated
 * only by the coordinator.
 */
public record WorkflowRun(
        String runId,
        String workflowName,
        RunStatus status,
        Instant startedAt,
        Instant completedAt,
        String error
) {

    public WorkflowRun {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(workflowName, "workflowName");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
    }

    public static WorkflowRun started(String runId, String workflowName, Instant startedAt) {
        return new WorkflowRun(runId, workflowName, RunStatus.RUNNING, startedAt, null, null);
    }

    public WorkflowRun finish(RunStatus terminalStatus, Instant at, String failure) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        return new WorkflowRun(runId, workflowName, terminalStatus, startedAt, at, failure);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
