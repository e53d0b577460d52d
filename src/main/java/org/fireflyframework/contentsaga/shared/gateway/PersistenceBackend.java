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

package org.fireflyframework.contentsaga.shared.gateway;

import org.fireflyframework.contentsaga.saga.persistence.WorkflowRunRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * One persistence mode: hands out per-namespace gateways, the read-only fetcher used
 * for logical foreign keys, and the run audit repository.
 */
public interface PersistenceBackend extends ArtifactFetcher {

    /**
     * Returns the gateway for a namespace. A namespace is bound to one artifact type for
     * the lifetime of the backend; asking for it with another type is a violation.
     *
     * @throws NamespaceViolationException when the namespace is already bound to a different type
     */
    <T extends Artifact> PersistenceGateway<T> gateway(ModuleNamespace namespace, Class<T> type);

    /**
     * Live (not deleted, not tombstoned) artifacts produced by a run, across all namespaces.
     */
    Flux<ArtifactLocator> liveArtifacts(String runId);

    /**
     * Live rows owned by a run across all namespaces, artifacts and child rows together.
     */
    Mono<Long> liveRowCount(String runId);

    WorkflowRunRepository runRepository();

    PersistenceMode mode();

    /**
     * Prepares the storage (schema creation for relational mode).
     */
    default Mono<Void> initialize() {
        return Mono.empty();
    }
}
