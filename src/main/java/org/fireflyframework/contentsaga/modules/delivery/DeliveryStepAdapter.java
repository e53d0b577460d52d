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

import org.fireflyframework.contentsaga.modules.support.AbstractStepAdapter;
import org.fireflyframework.contentsaga.modules.support.JsonViews;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.core.StepOutcome;
import org.fireflyframework.contentsaga.shared.exception.TerminalStepException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactFetcher;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGateway;
import reactor.core.publisher.Mono;

/**
 * Last step: follows the QC result's draft reference and packages the draft.
 */
public class DeliveryStepAdapter extends AbstractStepAdapter<DeliveryPackage> {

    private final DeliveryPackager packager;

    public DeliveryStepAdapter(String name, PersistenceGateway<DeliveryPackage> gateway, ArtifactFetcher fetcher,
                               DeliveryPackager packager) {
        super(name, gateway, fetcher);
        this.packager = packager;
    }

    @Override
    protected Mono<DeliveryPackage> produce(StepContext ctx, Object input, String artifactId) {
        return fetchInput(input, ModuleNamespace.QC)
                .flatMap(qc -> {
                    String draftRef = JsonViews.text(qc, "draftRef");
                    if (draftRef == null) {
                        return Mono.error(new TerminalStepException("QC result " + input + " has no draft reference"));
                    }
                    return fetcher.fetch(ArtifactRef.parse(draftRef))
                            .map(draft -> {
                                DeliveryPackage pkg = packager.pack(draft, qc);
                                pkg.setArtifactId(artifactId);
                                pkg.setRunId(ctx.runId());
                                pkg.setStepName(name());
                                pkg.setDraftRef(draftRef);
                                pkg.setQcRef(input.toString());
                                return pkg;
                            });
                });
    }

    @Override
    protected StepOutcome describe(DeliveryPackage pkg) {
        return super.describe(pkg).withMetadata("files", pkg.ownedChildren().size());
    }
}
