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

import org.fireflyframework.contentsaga.saga.core.RunStatus;
import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.core.StepStatus;
import org.fireflyframework.contentsaga.saga.core.WorkflowResult;
import org.fireflyframework.contentsaga.saga.persistence.RunNotFoundException;
import org.fireflyframework.contentsaga.support.PipelineHarness;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ContentPipelineServiceTest {

    @ParameterizedTest
    @ValueSource(strings = {"in-memory", "relational"})
    void succeededRunCanBeRolledBackOnRequest(String mode) {
        PipelineHarness harness = PipelineHarness.on(mode);
        WorkflowResult delivered = harness.service.run(PipelineHarness.request(false)).block();

        StepVerifier.create(harness.service.compensate(delivered.runId()))
                .assertNext(result -> {
                    assertThat(result.runId()).isEqualTo(delivered.runId());
                    assertThat(result.status()).isEqualTo(RunStatus.COMPENSATED);
                    assertThat(result.compensatedSteps()).containsExactly("delivery", "qc", "production", "strategy", "intake");
                })
                .verifyComplete();

        assertThat(harness.liveRows(delivered.runId())).isZero();
        assertThat(harness.service.status(delivered.runId()).block().status()).isEqualTo(RunStatus.COMPENSATED);
        assertThat(harness.service.steps(delivered.runId()).map(StepRecord::status).collectList().block())
                .containsOnly(StepStatus.COMPENSATED);
        assertThat(harness.service.checkConsistency(delivered.runId()).collectList().block()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"in-memory", "relational"})
    void rollingBackACompensatedRunChangesNothing(String mode) {
        PipelineHarness harness = PipelineHarness.on(mode);
        WorkflowResult rejected = harness.service.run(PipelineHarness.request(true)).block();

        StepVerifier.create(harness.service.compensate(rejected.runId()))
                .assertNext(result -> {
                    assertThat(result.compensatedSteps()).isEmpty();
                    assertThat(result.status()).isEqualTo(RunStatus.COMPENSATED);
                })
                .verifyComplete();
        assertThat(harness.backend.runRepository().findCompensationLogs(rejected.runId()).count().block()).isEqualTo(4L);
    }

    @ParameterizedTest
    @ValueSource(strings = {"in-memory", "relational"})
    void unknownRunsAreReportedAsNotFound(String mode) {
        PipelineHarness harness = PipelineHarness.on(mode);

        StepVerifier.create(harness.service.status("nope")).expectError(RunNotFoundException.class).verify();
        StepVerifier.create(harness.service.compensate("nope")).expectError(RunNotFoundException.class).verify();
        StepVerifier.create(harness.service.steps("nope")).verifyComplete();
    }
}
