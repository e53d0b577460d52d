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

import java.util.List;

/**
 * Domain payload produced by exactly one pipeline step and owned by one module namespace.
 */
public interface Artifact {

    String getArtifactId();

    String getRunId();

    String getStepName();

    /**
     * The namespace that owns this artifact. Gateways refuse artifacts of any other namespace.
     */
    ModuleNamespace artifactNamespace();

    /**
     * Child rows owned by this artifact (assets, issues, files). They are stored and
     * removed together with the artifact and counted in compensation row totals.
     */
    default List<?> ownedChildren() {
        return List.of();
    }

    default ArtifactRef toRef() {
        return ArtifactRef.of(artifactNamespace(), getArtifactId());
    }
}
