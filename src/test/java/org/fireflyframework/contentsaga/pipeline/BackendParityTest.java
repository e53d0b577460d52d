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

import org.fireflyframework.contentsaga.saga.core.CompensationLog;
import org.fireflyframework.contentsaga.saga.core.RunStatus;
import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.core.StepStatus;
import org.fireflyframework.contentsaga.saga.core.WorkflowResult;
import org.fireflyframework.contentsaga.saga.events.WorkflowEvent;
import org.fireflyframework.contentsaga.shared.exception.TerminalStepException;
import org.fireflyframework.contentsaga.support.PipelineHarness;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The same request must leave the same observable trace on both backends.
 */
class BackendParityTest {

    record Trace(RunStatus status,
                 List<String> completed,
                 List<String> compensated,
                 String failedStep,
                 List<StepStatus> recordStatuses,
                 List<String> compensationLogs,
                 List<String> events,
                 long liveRows) {
    }

    private static Trace trace(PipelineHarness harness, ContentRequest request) {
        WorkflowResult result = harness.service.run(request).block();
        String runId = result.runId();
        return new Trace(
                result.status(),
                result.completedSteps(),
                result.compensatedSteps(),
                result.failedStep().orElse(null),
                harness.service.steps(runId).map(StepRecord::status).collectList().block(),
                harness.backend.runRepository().findCompensationLogs(runId)
                        .map(log -> log.stepName() + "=" + log.rowsAffected())
                        .collectList().block(),
                harness.events.stream()
                        .map(e -> e.channel().topic() + ":" + e.stepName() + ":" + e.attribute(WorkflowEvent.FAILURE_KIND))
                        .toList(),
                harness.liveRows(runId));
    }

    private static void assertParity(Supplier<PipelineCollaborators> collaborators, ContentRequest request) {
        Trace inMemory = trace(PipelineHarness.on("in-memory", collaborators.get()), request);
        Trace relational = trace(PipelineHarness.on("relational", collaborators.get()), request);

        assertThat(relational).isEqualTo(inMemory);
    }

    @Test
    void successfulRunsMatch() {
        assertParity(PipelineCollaborators::defaults, PipelineHarness.request(false));
    }

    @Test
    void qcRejectionsMatch() {
        assertParity(PipelineCollaborators::defaults, PipelineHarness.request(true));
    }

    @Test
    void deliveryFailuresMatch() {
        assertParity(() -> PipelineCollaborators.defaults().withDeliveryPackager((draft, qc) -> {
            throw new TerminalStepException("delivery failed");
        }), PipelineHarness.request(false));
    }

    @Test
    void compensationLogRowCountsMatchRemovedRows() {
        PipelineHarness harness = PipelineHarness.on("relational", PipelineCollaborators.defaults()
                .withDeliveryPackager((draft, qc) -> {
                    throw new TerminalStepException("delivery failed");
                }));

        WorkflowResult result = harness.service.run(PipelineHarness.request(false)).block();

        int logged = harness.backend.runRepository().findCompensationLogs(result.runId())
                .map(CompensationLog::rowsAffected)
                .reduce(0, Integer::sum)
                .block();
        // intake, strategy, draft with two assets, qc result
        assertThat(logged).isEqualTo(6);
        assertThat(harness.liveRows(result.runId())).isZero();
    }
}
