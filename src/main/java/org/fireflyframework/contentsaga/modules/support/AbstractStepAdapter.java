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

package org.fireflyframework.contentsaga.modules.support;

import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.contentsaga.saga.core.CompensationOutcome;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.core.StepOutcome;
import org.fireflyframework.contentsaga.saga.port.StepPort;
import org.fireflyframework.contentsaga.shared.exception.TerminalStepException;
import org.fireflyframework.contentsaga.shared.gateway.Artifact;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactFetcher;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Shared execute/compensate flow of the module adapters.
 * <p>
 * Execute is idempotent per (runId, stepName): when the gateway already holds a live artifact
 * for that key, the stored artifact is described again and nothing new is produced.
 * Compensate purges the artifact with its child rows and is safe to repeat.
 *
 * @param <T> the artifact type owned by the module
 */
public abstract class AbstractStepAdapter<T extends Artifact> implements StepPort {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String name;
    protected final PersistenceGateway<T> gateway;
    protected final ArtifactFetcher fetcher;

    protected AbstractStepAdapter(String name, PersistenceGateway<T> gateway, ArtifactFetcher fetcher) {
        this.name = Objects.requireNonNull(name, "name");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public final Mono<StepOutcome> execute(StepContext ctx, Object input) {
        return gateway.findLive(ctx.runId(), name)
                .flatMap(existing -> gateway.load(existing)
                        .doOnNext(artifact -> log.debug("Reusing {} for run {} step {}", existing, ctx.runId(), name)))
                .switchIfEmpty(Mono.defer(() -> produce(ctx, input, UUID.randomUUID().toString())
                        .flatMap(artifact -> gateway.save(artifact).thenReturn(artifact))))
                .map(this::describe);
    }

    @Override
    public Mono<CompensationOutcome> compensate(StepContext ctx, ArtifactRef ref) {
        return gateway.purge(ref)
                .map(CompensationOutcome::removed)
                .doOnNext(outcome -> log.debug("Compensated {} for run {}: {} row(s)", ref, ctx.runId(), outcome.rowsRemoved()));
    }

    /**
     * Builds the module artifact for this run. The artifact must carry the given id,
     * the run id and this adapter's step name.
     */
    protected abstract Mono<T> produce(StepContext ctx, Object input, String artifactId);

    protected StepOutcome describe(T artifact) {
        return StepOutcome.of(artifact.toRef());
    }

    /**
     * Resolves the previous step's reference and fetches its read-only view.
     */
    protected Mono<JsonNode> fetchInput(Object input, ModuleNamespace expected) {
        if (!(input instanceof ArtifactRef ref) || ref.namespace() != expected) {
            return Mono.error(new TerminalStepException(
                    "Step '" + name + "' expects a " + expected.key() + " reference but got " + input));
        }
        return fetcher.fetch(ref);
    }

    /**
     * First upstream output owned by the given namespace.
     */
    protected static Optional<ArtifactRef> upstreamIn(StepContext ctx, ModuleNamespace namespace) {
        return ctx.upstreamRefs().values().stream()
                .filter(ref -> ref.namespace() == namespace)
                .findFirst();
    }
}
