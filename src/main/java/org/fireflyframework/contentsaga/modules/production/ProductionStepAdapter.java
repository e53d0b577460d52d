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

package org.fireflyframework.contentsaga.modules.production;

import org.fireflyframework.contentsaga.modules.support.AbstractStepAdapter;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.core.StepOutcome;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactFetcher;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGateway;
import reactor.core.publisher.Mono;

public class ProductionStepAdapter extends AbstractStepAdapter<ProductionDraft> {

    private final DraftGenerator generator;

    public ProductionStepAdapter(String name, PersistenceGateway<ProductionDraft> gateway, ArtifactFetcher fetcher,
                                 DraftGenerator generator) {
        super(name, gateway, fetcher);
        this.generator = generator;
    }

    @Override
    protected Mono<ProductionDraft> produce(StepContext ctx, Object input, String artifactId) {
        return fetchInput(input, ModuleNamespace.STRATEGY)
                .map(strategy -> {
                    ProductionDraft draft = generator.generate(strategy);
                    draft.setArtifactId(artifactId);
                    draft.setRunId(ctx.runId());
                    draft.setStepName(name());
                    draft.setStrategyRef(input.toString());
                    return draft;
                });
    }

    @Override
    protected StepOutcome describe(ProductionDraft draft) {
        return super.describe(draft).withMetadata("assets", draft.ownedChildren().size());
    }
}
