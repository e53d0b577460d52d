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

import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.contentsaga.modules.support.AbstractStepAdapter;
import org.fireflyframework.contentsaga.modules.support.JsonViews;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.core.StepOutcome;
import org.fireflyframework.contentsaga.saga.core.Verdict;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactFetcher;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGateway;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

/**
 * Quality gate. A failing evaluation is still persisted and reported as
 * {@link Verdict#FAIL}; the coordinator turns it into a rejection.
 */
public class QcStepAdapter extends AbstractStepAdapter<QcResult> {

    public static final String SCORE_KEY = "score";
    static final String FORCE_FAIL_BENCHMARK = "FORCE_FAIL";

    private final QcEvaluator evaluator;

    public QcStepAdapter(String name, PersistenceGateway<QcResult> gateway, ArtifactFetcher fetcher, QcEvaluator evaluator) {
        super(name, gateway, fetcher);
        this.evaluator = evaluator;
    }

    @Override
    protected Mono<QcResult> produce(StepContext ctx, Object input, String artifactId) {
        return Mono.zip(fetchInput(input, ModuleNamespace.PRODUCTION), forceFail(ctx))
                .map(t -> {
                    QcResult result = evaluator.evaluate(t.getT1(), t.getT2());
                    result.setArtifactId(artifactId);
                    result.setRunId(ctx.runId());
                    result.setStepName(name());
                    result.setDraftRef(input.toString());
                    return result;
                });
    }

    private Mono<Boolean> forceFail(StepContext ctx) {
        return upstreamIn(ctx, ModuleNamespace.INTAKE)
                .map(ref -> fetcher.fetch(ref)
                        .map(brief -> FORCE_FAIL_BENCHMARK.equals(JsonViews.text(brief, "benchmark"))))
                .orElse(Mono.just(false));
    }

    @Override
    protected StepOutcome describe(QcResult result) {
        StepOutcome outcome = super.describe(result)
                .withMetadata(StepOutcome.VERDICT_KEY, result.isPassed() ? Verdict.PASS : Verdict.FAIL)
                .withMetadata(SCORE_KEY, result.getScore());
        if (!result.isPassed()) {
            outcome = outcome.withMetadata("reason", "score " + result.getScore() + " with issues "
                    + result.ownedChildren().stream().map(QcIssue::getCode).collect(Collectors.joining(",")));
        }
        return outcome;
    }
}
