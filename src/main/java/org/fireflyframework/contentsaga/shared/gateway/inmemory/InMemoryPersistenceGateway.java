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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.contentsaga.shared.gateway.Artifact;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactNotFoundException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGateway;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;

/**
 * Map-backed gateway slice. Artifacts are stored as JSON trees so a load always returns
 * a fresh instance, exactly like the relational slice does. {@link #purge} removes the
 * entry; nothing is left behind as a flag.
 */
public class InMemoryPersistenceGateway<T extends Artifact> implements PersistenceGateway<T> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPersistenceGateway.class);

    private final ModuleNamespace namespace;
    private final Class<T> type;
    private final ConcurrentMap<String, StoredDocument> store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    InMemoryPersistenceGateway(ModuleNamespace namespace,
                               Class<T> type,
                               ConcurrentMap<String, StoredDocument> store,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.namespace = namespace;
        this.type = type;
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Mono<ArtifactRef> save(T artifact) {
        return Mono.fromCallable(() -> {
            requireOwned(artifact.artifactNamespace(), "save");
            if (artifact.getArtifactId() == null || artifact.getArtifactId().isBlank()) {
                throw new IllegalArgumentException("Artifact id must be assigned before save");
            }
            StoredDocument doc = new StoredDocument(
                    artifact.getRunId(),
                    artifact.getStepName(),
                    objectMapper.valueToTree(artifact),
                    artifact.ownedChildren().size(),
                    clock.instant());
            if (store.putIfAbsent(artifact.getArtifactId(), doc) != null) {
                throw new PersistenceGatewayException(namespace, "Artifact already stored: " + artifact.getArtifactId());
            }
            log.debug("Saved {} artifact {} for run {} ({} child rows)", namespace.key(), artifact.getArtifactId(),
                    artifact.getRunId(), doc.childRows());
            return artifact.toRef();
        });
    }

    @Override
    public Mono<T> load(ArtifactRef ref) {
        return Mono.fromCallable(() -> {
            requireOwned(ref.namespace(), "load");
            StoredDocument doc = store.get(ref.id());
            if (doc == null) {
                throw new ArtifactNotFoundException(ref);
            }
            try {
                return objectMapper.treeToValue(doc.payload(), type);
            } catch (JsonProcessingException e) {
                throw new PersistenceGatewayException(namespace, "load", e);
            }
        });
    }

    @Override
    public Mono<Integer> purge(ArtifactRef ref) {
        return Mono.fromCallable(() -> {
            requireOwned(ref.namespace(), "delete");
            StoredDocument removed = store.remove(ref.id());
            int rows = removed != null ? removed.totalRows() : 0;
            log.debug("Purged {} artifact {}: {} rows", namespace.key(), ref.id(), rows);
            return rows;
        });
    }

    @Override
    public Mono<ArtifactRef> findLive(String runId, String stepName) {
        return Mono.fromCallable(() -> store.entrySet().stream()
                .filter(e -> runId.equals(e.getValue().runId()) && stepName.equals(e.getValue().stepName()))
                .map(Map.Entry::getKey)
                .findFirst()
                .map(id -> ArtifactRef.of(namespace, id))
                .orElse(null));
    }

    @Override
    public ModuleNamespace namespace() {
        return namespace;
    }

    @Override
    public Class<T> artifactType() {
        return type;
    }
}
