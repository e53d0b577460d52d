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

package org.fireflyframework.contentsaga.shared.gateway.inmemory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.contentsaga.saga.persistence.WorkflowRunRepository;
import org.fireflyframework.contentsaga.saga.persistence.impl.InMemoryWorkflowRunRepository;
import org.fireflyframework.contentsaga.shared.gateway.AbstractPersistenceBackend;
import org.fireflyframework.contentsaga.shared.gateway.Artifact;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactLocator;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactNotFoundException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGateway;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Transient backend: one process-local map per namespace plus an in-memory run repository.
 * <p>
 * No state survives a restart. When run cleanup removes a finished run, the artifacts it
 * produced are released from every namespace as well.
 */
public class InMemoryPersistenceBackend extends AbstractPersistenceBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPersistenceBackend.class);

    private final Map<ModuleNamespace, ConcurrentMap<String, StoredDocument>> stores = new EnumMap<>(ModuleNamespace.class);
    private final ObjectMapper objectMapper;
    private final InMemoryWorkflowRunRepository runRepository;
    private final Clock clock;

    public InMemoryPersistenceBackend(ObjectMapper objectMapper) {
        this(objectMapper, new InMemoryWorkflowRunRepository(), Clock.systemUTC());
    }

    public InMemoryPersistenceBackend(ObjectMapper objectMapper, InMemoryWorkflowRunRepository runRepository, Clock clock) {
        this.objectMapper = objectMapper;
        this.runRepository = runRepository;
        this.clock = clock;
        for (ModuleNamespace ns : ModuleNamespace.values()) {
            stores.put(ns, new ConcurrentHashMap<>());
        }
        runRepository.onRunRemoved(this::releaseRun);
    }

    private void releaseRun(String runId) {
        int released = 0;
        for (ConcurrentMap<String, StoredDocument> store : stores.values()) {
            int before = store.size();
            store.values().removeIf(doc -> runId.equals(doc.runId()));
            released += before - store.size();
        }
        log.debug("Released {} artifacts of removed run {}", released, runId);
    }

    @Override
    protected <T extends Artifact> PersistenceGateway<T> createGateway(ModuleNamespace namespace, Class<T> type) {
        return new InMemoryPersistenceGateway<>(namespace, type, stores.get(namespace), objectMapper, clock);
    }

    @Override
    public Mono<JsonNode> fetch(ArtifactRef ref) {
        return Mono.fromCallable(() -> {
            StoredDocument doc = stores.get(ref.namespace()).get(ref.id());
            if (doc == null) {
                throw new ArtifactNotFoundException(ref);
            }
            return doc.payload().deepCopy();
        });
    }

    @Override
    public Flux<ArtifactLocator> liveArtifacts(String runId) {
        return Flux.fromIterable(Arrays.asList(ModuleNamespace.values()))
                .concatMap(ns -> Flux.fromIterable(stores.get(ns).entrySet())
                        .filter(e -> runId.equals(e.getValue().runId()))
                        .map(e -> new ArtifactLocator(ArtifactRef.of(ns, e.getKey()), runId, e.getValue().stepName())));
    }

    @Override
    public Mono<Long> liveRowCount(String runId) {
        return Mono.fromCallable(() -> stores.values().stream()
                .flatMap(store -> store.values().stream())
                .filter(doc -> runId.equals(doc.runId()))
                .mapToLong(StoredDocument::totalRows)
                .sum());
    }

    @Override
    public WorkflowRunRepository runRepository() {
        return runRepository;
    }

    @Override
    public PersistenceMode mode() {
        return PersistenceMode.IN_MEMORY;
    }

    /**
     * Number of stored artifacts in a namespace, regardless of run.
     */
    public int documentCount(ModuleNamespace namespace) {
        return stores.get(namespace).size();
    }

    public void clear() {
        stores.values().forEach(Map::clear);
        runRepository.clear();
    }
}
