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

package org.fireflyframework.contentsaga.modules.strategy;

import org.fireflyframework.contentsaga.modules.support.AbstractStepAdapter;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactFetcher;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGateway;
import reactor.core.publisher.Mono;

public class StrategyStepAdapter extends AbstractStepAdapter<StrategyDocument> {

    private final StrategyGenerator generator;

    public StrategyStepAdapter(String name, PersistenceGateway<StrategyDocument> gateway, ArtifactFetcher fetcher,
                               StrategyGenerator generator) {
        super(name, gateway, fetcher);
        this.generator = generator;
    }

    @Override
    protected Mono<StrategyDocument> produce(StepContext ctx, Object input, String artifactId) {
        return fetchInput(input, ModuleNamespace.INTAKE)
                .map(brief -> {
                    StrategyDocument document = generator.generate(brief);
                    document.setArtifactId(artifactId);
                    document.setRunId(ctx.runId());
                    document.setStepName(name());
                    document.setBriefRef(input.toString());
                    return document;
                });
    }
}
