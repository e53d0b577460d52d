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

package org.fireflyframework.contentsaga.pipeline;

import org.fireflyframework.contentsaga.saga.consistency.ConsistencyChecker;
import org.fireflyframework.contentsaga.saga.consistency.ConsistencyViolation;
import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.core.WorkflowResult;
import org.fireflyframework.contentsaga.saga.core.WorkflowRun;
import org.fireflyframework.contentsaga.saga.engine.SagaCoordinator;
import org.fireflyframework.contentsaga.saga.registry.WorkflowDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Entry point for running and inspecting content pipeline runs.
 */
public class ContentPipelineService {

    private final SagaCoordinator coordinator;
    private final WorkflowDefinition definition;
    private final ConsistencyChecker consistencyChecker;

    public ContentPipelineService(SagaCoordinator coordinator, WorkflowDefinition definition,
                                  ConsistencyChecker consistencyChecker) {
        this.coordinator = coordinator;
        this.definition = definition;
        this.consistencyChecker = consistencyChecker;
    }

    public Mono<WorkflowResult> run(ContentRequest request) {
        return coordinator.runWorkflow(definition, request);
    }

    public Mono<WorkflowRun> status(String runId) {
        return coordinator.getRunStatus(runId);
    }

    public Flux<StepRecord> steps(String runId) {
        return coordinator.getStepRecords(runId);
    }

    /**
     * Rolls back a finished run.
     */
    public Mono<WorkflowResult> compensate(String runId) {
        return coordinator.compensate(definition, runId);
    }

    public Flux<ConsistencyViolation> checkConsistency(String runId) {
        return consistencyChecker.check(runId);
    }

    public WorkflowDefinition definition() {
        return definition;
    }
}
