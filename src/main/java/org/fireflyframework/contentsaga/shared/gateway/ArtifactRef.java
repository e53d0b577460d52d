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

import java.util.Objects;

/**
 * Opaque, immutable reference to an artifact owned by one module. Downstream steps
 * only ever hold this reference, never the owning module's artifact type.
 * <p>
 * The string form is {@code <namespace>:<artifactId>}, e.g. {@code strategy:5f0c...}.
 */
public record ArtifactRef(ModuleNamespace namespace, String id) {

    private static final char SEPARATOR = ':';

    public ArtifactRef {
        Objects.requireNonNull(namespace, "namespace");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Artifact id must not be blank");
        }
    }

    public static ArtifactRef of(ModuleNamespace namespace, String id) {
        return new ArtifactRef(namespace, id);
    }

    public static ArtifactRef parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Artifact reference must not be null");
        }
        int idx = value.indexOf(SEPARATOR);
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("Malformed artifact reference: " + value);
        }
        return new ArtifactRef(ModuleNamespace.fromKey(value.substring(0, idx)), value.substring(idx + 1));
    }

    @Override
    public String toString() {
        return namespace.key() + SEPARATOR + id;
    }
}
