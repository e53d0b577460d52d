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

package org.fireflyframework.contentsaga.shared.gateway.r2dbc;

import org.fireflyframework.contentsaga.modules.intake.Brief;
import org.fireflyframework.contentsaga.modules.qc.QcIssue;
import org.fireflyframework.contentsaga.modules.qc.QcResult;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactNotFoundException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.fireflyframework.contentsaga.shared.gateway.DeleteMode;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGateway;
import org.fireflyframework.contentsaga.support.TestBackends;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class R2dbcSoftDeleteTest {

    private static QcResult qcResult(String runId) {
        return QcResult.builder()
                .artifactId("qc-" + runId)
                .runId(runId)
                .stepName("qc")
                .draftRef("production:d-1")
                .score(0.4)
                .passed(false)
                .issues(List.of(
                        QcIssue.builder().code("short_body").severity("major").message("too short").build(),
                        QcIssue.builder().code("placeholder").severity("major").message("TBD left in body").build()))
                .build();
    }

    private static long countRows(R2dbcPersistenceBackend backend, String sql, String runId) {
        return backend.databaseClient().sql(sql)
                .bind("runId", runId)
                .map(row -> row.get("cnt", Long.class))
                .one()
                .block();
    }

    @Test
    void softDeleteLeavesExplicitTombstones() {
        R2dbcPersistenceBackend backend = TestBackends.relational(DeleteMode.SOFT);
        PersistenceGateway<QcResult> gateway = backend.gateway(ModuleNamespace.QC, QcResult.class);
        ArtifactRef ref = gateway.save(qcResult("run-soft")).block();

        StepVerifier.create(gateway.purge(ref)).expectNext(3).verifyComplete();

        assertEquals(1, countRows(backend,
                "SELECT COUNT(*) AS cnt FROM qc_artifacts WHERE run_id = :runId AND deleted = TRUE AND deleted_at IS NOT NULL",
                "run-soft"));
        assertEquals(2, countRows(backend,
                "SELECT COUNT(*) AS cnt FROM qc_issues WHERE run_id = :runId AND deleted = TRUE", "run-soft"));

        StepVerifier.create(gateway.load(ref)).expectError(ArtifactNotFoundException.class).verify();
        StepVerifier.create(gateway.findLive("run-soft", "qc")).verifyComplete();
        StepVerifier.create(backend.liveRowCount("run-soft")).expectNext(0L).verifyComplete();
        StepVerifier.create(gateway.purge(ref)).expectNext(0).verifyComplete();
    }

    @Test
    void hardDeleteRemovesRows() {
        R2dbcPersistenceBackend backend = TestBackends.relational(DeleteMode.HARD);
        PersistenceGateway<QcResult> gateway = backend.gateway(ModuleNamespace.QC, QcResult.class);
        ArtifactRef ref = gateway.save(qcResult("run-hard")).block();

        StepVerifier.create(gateway.purge(ref)).expectNext(3).verifyComplete();

        assertEquals(0, countRows(backend, "SELECT COUNT(*) AS cnt FROM qc_artifacts WHERE run_id = :runId", "run-hard"));
        assertEquals(0, countRows(backend, "SELECT COUNT(*) AS cnt FROM qc_issues WHERE run_id = :runId", "run-hard"));
    }

    @Test
    void purgeCountsChildRowsAndChildlessParents() {
        R2dbcPersistenceBackend backend = TestBackends.relational(DeleteMode.SOFT);
        PersistenceGateway<Brief> briefs = backend.gateway(ModuleNamespace.INTAKE, Brief.class);
        PersistenceGateway<QcResult> results = backend.gateway(ModuleNamespace.QC, QcResult.class);
        ArtifactRef brief = briefs.save(Brief.builder()
                .artifactId("b-seq").runId("run-seq").stepName("intake").clientName("Acme").build()).block();
        ArtifactRef qc = results.save(qcResult("run-seq")).block();

        StepVerifier.create(results.purge(qc).flatMap(qcRows -> briefs.purge(brief).map(briefRows -> qcRows + briefRows)))
                .expectNext(4)
                .verifyComplete();

        assertEquals(1, countRows(backend,
                "SELECT COUNT(*) AS cnt FROM intake_artifacts WHERE run_id = :runId AND deleted = TRUE", "run-seq"));
        assertEquals(2, countRows(backend,
                "SELECT COUNT(*) AS cnt FROM qc_issues WHERE run_id = :runId AND deleted = TRUE", "run-seq"));
        StepVerifier.create(backend.liveRowCount("run-seq")).expectNext(0L).verifyComplete();
    }
}
