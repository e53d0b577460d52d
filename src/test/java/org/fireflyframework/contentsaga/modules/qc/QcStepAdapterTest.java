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

package org.fireflyframework.contentsaga.modules.qc;

import org.fireflyframework.contentsaga.modules.intake.Brief;
import org.fireflyframework.contentsaga.modules.production.DraftAsset;
import org.fireflyframework.contentsaga.modules.production.ProductionDraft;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.core.Verdict;
import org.fireflyframework.contentsaga.shared.exception.TerminalStepException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceBackend;
import org.fireflyframework.contentsaga.support.TestBackends;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QcStepAdapterTest {

    private PersistenceBackend backend;
    private QcStepAdapter adapter;

    @BeforeEach
    void setUp() {
        backend = TestBackends.inMemory();
        adapter = new QcStepAdapter("qc", backend.gateway(ModuleNamespace.QC, QcResult.class), backend, new DefaultQcEvaluator());
    }

    private ArtifactRef storeBrief(String runId, String benchmark) {
        return backend.gateway(ModuleNamespace.INTAKE, Brief.class).save(Brief.builder()
                .artifactId("brief-" + runId)
                .runId(runId)
                .stepName("intake")
                .clientName("Acme")
                .brand("Acme")
                .channels(List.of("linkedin"))
                .benchmark(benchmark)
                .build()).block();
    }

    private ArtifactRef storeDraft(String runId) {
        List<DraftAsset> assets = new ArrayList<>(List.of(
                DraftAsset.builder().assetType("post").channel("linkedin").content("[linkedin] copy").build()));
        return backend.gateway(ModuleNamespace.PRODUCTION, ProductionDraft.class).save(ProductionDraft.builder()
                .artifactId("draft-" + runId)
                .runId(runId)
                .stepName("production")
                .contentType("social_post")
                .body("Acme for engineers. Introduce Acme")
                .assets(assets)
                .build()).block();
    }

    private static StepContext context(String runId, ArtifactRef brief, ArtifactRef draft) {
        return new StepContext(runId, "content-pipeline", "qc", 3, null, Map.of("intake", brief, "production", draft));
    }

    @Test
    void passingDraftReportsPassVerdict() {
        ArtifactRef brief = storeBrief("run-1", null);
        ArtifactRef draft = storeDraft("run-1");

        StepVerifier.create(adapter.execute(context("run-1", brief, draft), draft))
                .assertNext(outcome -> {
                    assertThat(outcome.isRejected()).isFalse();
                    assertThat(outcome.verdict()).contains(Verdict.PASS);
                    assertThat(outcome.metadata()).containsEntry(QcStepAdapter.SCORE_KEY, 1.0d);
                    assertThat(outcome.outputRef().namespace()).isEqualTo(ModuleNamespace.QC);
                })
                .verifyComplete();
    }

    @Test
    void forcedFailureBenchmarkIsPersistedAndRejected() {
        ArtifactRef brief = storeBrief("run-2", Brief.FORCE_FAIL_BENCHMARK);
        ArtifactRef draft = storeDraft("run-2");

        StepVerifier.create(adapter.execute(context("run-2", brief, draft), draft))
                .assertNext(outcome -> {
                    assertThat(outcome.isRejected()).isTrue();
                    assertThat(outcome.metadata()).containsEntry(QcStepAdapter.SCORE_KEY, 0.0d);
                    assertThat((String) outcome.metadata().get("reason")).contains("forced_failure");
                })
                .verifyComplete();
        // brief, draft with its asset, qc result with its issue
        StepVerifier.create(backend.liveRowCount("run-2")).expectNext(5L).verifyComplete();
        StepVerifier.create(backend.gateway(ModuleNamespace.QC, QcResult.class).findLive("run-2", "qc"))
                .assertNext(ref -> assertThat(ref.namespace()).isEqualTo(ModuleNamespace.QC))
                .verifyComplete();
    }

    @Test
    void inputFromWrongModuleIsTerminal() {
        ArtifactRef brief = storeBrief("run-3", null);

        StepVerifier.create(adapter.execute(context("run-3", brief, brief), brief))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(TerminalStepException.class)
                        .hasMessageContaining("expects a production reference"))
                .verify();
    }
}
