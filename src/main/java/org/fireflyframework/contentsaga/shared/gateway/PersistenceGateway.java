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

import reactor.core.publisher.Mono;

/**
 * Per-module storage slice. A gateway is bound to exactly one {@link ModuleNamespace}
 * and refuses artifacts or references belonging to any other namespace.
 * <p>
 * Both backends must behave identically: after {@code delete(save(a))} a {@code load}
 * of the same reference fails with {@link ArtifactNotFoundException}.
 *
 * @param <T> artifact type stored by this slice
 */
public interface PersistenceGateway<T extends Artifact> {

    /**
     * Stores a new artifact and its owned child rows.
     *
     * @return reference to the stored artifact
     */
    Mono<ArtifactRef> save(T artifact);

    /**
     * Loads a live artifact.
     *
     * @return the artifact, or an {@link ArtifactNotFoundException} error when it is absent or tombstoned
     */
    Mono<T> load(ArtifactRef ref);

    /**
     * Removes an artifact.
     *
     * @return true when something was removed, false when the artifact was already gone
     */
    default Mono<Boolean> delete(ArtifactRef ref) {
        return purge(ref).map(rows -> rows > 0);
    }

    /**
     * Removes an artifact and every child row it owns.
     *
     * @return number of rows or documents removed, 0 when already gone
     */
    Mono<Integer> purge(ArtifactRef ref);

    /**
     * Finds the live artifact produced by a given step of a run. Used to make step
     * execution idempotent on (runId, stepName).
     */
    Mono<ArtifactRef> findLive(String runId, String stepName);

    ModuleNamespace namespace();

    Class<T> artifactType();

    /**
     * Boundary check shared by implementations.
     */
    default void requireOwned(ModuleNamespace attempted, String operation) {
        if (attempted != namespace()) {
            throw new NamespaceViolationException(namespace(), attempted, operation);
        }
    }
}
