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

package org.fireflyframework.contentsaga.modules.delivery;

import org.fireflyframework.contentsaga.modules.production.DraftAsset;
import org.fireflyframework.contentsaga.modules.production.ProductionDraft;
import org.fireflyframework.contentsaga.modules.qc.QcResult;
import org.fireflyframework.contentsaga.saga.core.CompensationOutcome;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.core.StepOutcome;
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

class DeliveryStepAdapterTest {

    private PersistenceBackend backend;
    private DeliveryStepAdapter adapter;

    @BeforeEach
    void setUp() {
        backend = TestBackends.relational();
        adapter = new DeliveryStepAdapter("delivery", backend.gateway(ModuleNamespace.DELIVERY, DeliveryPackage.class),
                backend, new DefaultDeliveryPackager());
    }

    private ArtifactRef storeDraft(String runId) {
        List<DraftAsset> assets = new ArrayList<>(List.of(
                DraftAsset.builder().assetType("post").channel("linkedin").content("[linkedin] copy").build(),
                DraftAsset.builder().assetType("post").channel("newsletter").content("[newsletter] copy").build()));
        return backend.gateway(ModuleNamespace.PRODUCTION, ProductionDraft.class).save(ProductionDraft.builder()
                .artifactId("draft-" + runId)
                .runId(runId)
                .stepName("production")
                .body("Acme for engineers. Introduce Acme")
                .assets(assets)
                .build()).block();
    }

    private ArtifactRef storeQc(String runId, String draftRef) {
        return backend.gateway(ModuleNamespace.QC, QcResult.class).save(QcResult.builder()
                .artifactId("qc-" + runId)
                .runId(runId)
                .stepName("qc")
                .draftRef(draftRef)
                .score(1.0d)
                .passed(true)
                .build()).block();
    }

    private static StepContext context(String runId) {
        return new StepContext(runId, "content-pipeline", "delivery", 4, null, Map.of());
    }

    @Test
    void packagesTheDraftReferencedByTheQcResult() {
        ArtifactRef draft = storeDraft("run-1");
        ArtifactRef qc = storeQc("run-1", draft.toString());

        StepOutcome outcome = adapter.execute(context("run-1"), qc).block();

        assertThat(outcome.metadata()).containsEntry("files", 2);
        StepVerifier.create(backend.fetch(outcome.outputRef()))
                .assertNext(pkg -> {
                    assertThat(pkg.get("draftRef").asText()).isEqualTo(draft.toString());
                    assertThat(pkg.get("qcRef").asText()).isEqualTo(qc.toString());
                    assertThat(pkg.get("files").get(0).get("fileName").asText()).isEqualTo("01-linkedin.txt");
                    assertThat(pkg.get("manifest").asText()).startsWith("2 file(s)");
                })
                .verifyComplete();
        StepVerifier.create(adapter.compensate(context("run-1"), outcome.outputRef()))
                .expectNext(CompensationOutcome.removed(3))
                .verifyComplete();
    }

    @Test
    void qcResultWithoutDraftReferenceIsTerminal() {
        ArtifactRef qc = storeQc("run-2", null);

        StepVerifier.create(adapter.execute(context("run-2"), qc))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(TerminalStepException.class)
                        .hasMessageContaining("no draft reference"))
                .verify();
        StepVerifier.create(backend.gateway(ModuleNamespace.DELIVERY, DeliveryPackage.class).findLive("run-2", "delivery"))
                .verifyComplete();
    }
}
