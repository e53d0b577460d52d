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

import org.fireflyframework.contentsaga.modules.production.DefaultDraftGenerator;
import org.fireflyframework.contentsaga.modules.production.DraftGenerator;
import org.fireflyframework.contentsaga.saga.core.CompensationLog;
import org.fireflyframework.contentsaga.saga.core.FailureKind;
import org.fireflyframework.contentsaga.saga.core.RunStatus;
import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.core.StepStatus;
import org.fireflyframework.contentsaga.saga.core.WorkflowResult;
import org.fireflyframework.contentsaga.saga.events.EventChannel;
import org.fireflyframework.contentsaga.saga.events.WorkflowEvent;
import org.fireflyframework.contentsaga.shared.exception.RecoverableStepException;
import org.fireflyframework.contentsaga.shared.exception.TerminalStepException;
import org.fireflyframework.contentsaga.support.PipelineHarness;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ContentPipelineScenarioTest {

    @ParameterizedTest
    @ValueSource(strings = {"in-memory", "relational"})
    void happyPathDeliversEveryArtifact(String mode) {
        PipelineHarness harness = PipelineHarness.on(mode);

        WorkflowResult result = harness.service.run(PipelineHarness.request(false)).block();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.completedSteps()).containsExactlyElementsOf(ContentPipeline.STEP_ORDER);
        assertThat(result.compensatedSteps()).isEmpty();
        // brief, strategy, draft with two assets, qc result, package with two files
        assertEquals(9L, harness.liveRows(result.runId()));
        assertThat(harness.service.steps(result.runId()).map(StepRecord::status).collectList().block())
                .containsOnly(StepStatus.COMPLETED)
                .hasSize(5);
        assertThat(harness.service.checkConsistency(result.runId()).collectList().block()).isEmpty();
        assertThat(harness.service.status(result.runId()).block().status()).isEqualTo(RunStatus.SUCCEEDED);
    }

    @ParameterizedTest
    @ValueSource(strings = {"in-memory", "relational"})
    void deliveryFailureRollsBackEveryUpstreamArtifact(String mode) {
        PipelineHarness harness = PipelineHarness.on(mode, PipelineCollaborators.defaults()
                .withDeliveryPackager((draft, qc) -> {
                    throw new TerminalStepException("delivery channel rejected the package");
                }));

        WorkflowResult result = harness.service.run(PipelineHarness.request(false)).block();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.status()).isEqualTo(RunStatus.COMPENSATED);
        assertThat(result.failedStep()).contains(ContentPipeline.DELIVERY);
        assertThat(result.failureKind()).contains(FailureKind.ERRORED);
        assertThat(result.completedSteps()).containsExactly("intake", "strategy", "production", "qc");
        assertThat(result.compensatedSteps()).containsExactly("qc", "production", "strategy", "intake");
        assertEquals(0L, harness.liveRows(result.runId()));

        List<CompensationLog> logs = harness.backend.runRepository().findCompensationLogs(result.runId()).collectList().block();
        assertThat(logs).extracting(CompensationLog::stepName).containsExactly("qc", "production", "strategy", "intake");
        assertThat(logs).extracting(CompensationLog::rowsAffected).containsExactly(1, 3, 1, 1);

        List<StepRecord> records = harness.service.steps(result.runId()).collectList().block();
        assertThat(records).extracting(StepRecord::status).containsExactly(
                StepStatus.COMPENSATED, StepStatus.COMPENSATED, StepStatus.COMPENSATED, StepStatus.COMPENSATED,
                StepStatus.FAILED);
        assertThat(records.get(4).error()).contains("delivery channel rejected the package");
        assertThat(harness.service.checkConsistency(result.runId()).collectList().block()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"in-memory", "relational"})
    void qcRejectionDiscardsTheResultAndRollsBackUpstream(String mode) {
        PipelineHarness harness = PipelineHarness.on(mode);

        WorkflowResult result = harness.service.run(PipelineHarness.request(true)).block();

        assertThat(result.status()).isEqualTo(RunStatus.COMPENSATED);
        assertThat(result.failedStep()).contains(ContentPipeline.QC);
        assertThat(result.failureKind()).contains(FailureKind.REJECTED);
        assertThat(result.failureReason()).hasValueSatisfying(r -> assertThat(r).contains("forced_failure"));
        assertThat(result.completedSteps()).containsExactly("intake", "strategy", "production");
        assertThat(result.compensatedSteps()).containsExactly("production", "strategy", "intake");
        assertEquals(0L, harness.liveRows(result.runId()));

        assertThat(harness.backend.runRepository().findCompensationLogs(result.runId())
                .map(CompensationLog::stepName).collectList().block())
                .containsExactly("qc", "production", "strategy", "intake");
        List<StepRecord> records = harness.service.steps(result.runId()).collectList().block();
        assertThat(records).extracting(StepRecord::stepName).containsExactly("intake", "strategy", "production", "qc");
        assertThat(records.get(3).status()).isEqualTo(StepStatus.FAILED);
        assertThat(harness.events).filteredOn(e -> e.channel() == EventChannel.STEP_FAILED)
                .singleElement()
                .satisfies(e -> assertThat(e.attribute(WorkflowEvent.FAILURE_KIND)).isEqualTo("REJECTED"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"in-memory", "relational"})
    void transientProductionFailuresAreRetried(String mode) {
        AtomicInteger calls = new AtomicInteger();
        DraftGenerator delegate = new DefaultDraftGenerator();
        PipelineHarness harness = PipelineHarness.on(mode, PipelineCollaborators.defaults()
                .withDraftGenerator(strategy -> {
                    if (calls.incrementAndGet() < 3) {
                        throw new RecoverableStepException("model endpoint busy");
                    }
                    return delegate.generate(strategy);
                }));

        WorkflowResult result = harness.service.run(PipelineHarness.request(false)).block();

        assertThat(result.isSuccess()).isTrue();
        assertEquals(3, calls.get());
        assertThat(harness.events)
                .filteredOn(e -> e.channel() == EventChannel.STEP_COMPLETED && "production".equals(e.stepName()))
                .singleElement()
                .satisfies(e -> assertThat(e.attribute(WorkflowEvent.ATTEMPTS)).isEqualTo("3"));
    }
}
