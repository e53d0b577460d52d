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

package org.fireflyframework.contentsaga.modules.intake;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.contentsaga.modules.support.AbstractStepAdapter;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.shared.exception.TerminalStepException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactFetcher;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGateway;
import reactor.core.publisher.Mono;

/**
 * First step: normalizes the content request into a {@link Brief}.
 */
public class IntakeStepAdapter extends AbstractStepAdapter<Brief> {

    private final BriefNormalizer normalizer;
    private final ObjectMapper objectMapper;

    public IntakeStepAdapter(String name, PersistenceGateway<Brief> gateway, ArtifactFetcher fetcher,
                             BriefNormalizer normalizer, ObjectMapper objectMapper) {
        super(name, gateway, fetcher);
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
    }

    @Override
    protected Mono<Brief> produce(StepContext ctx, Object input, String artifactId) {
        return Mono.fromCallable(() -> {
            if (input == null) {
                throw new TerminalStepException("Step '" + name() + "' received no content request");
            }
            JsonNode request = input instanceof JsonNode node ? node : objectMapper.valueToTree(input);
            Brief brief = normalizer.normalize(request);
            brief.setArtifactId(artifactId);
            brief.setRunId(ctx.runId());
            brief.setStepName(name());
            return brief;
        });
    }
}
