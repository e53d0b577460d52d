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

import java.util.Locale;
import java.util.Optional;

/**
 * Storage namespaces, one per pipeline module. Each namespace owns its own artifact
 * table and, where the artifact has child rows, its own child table. No table is
 * shared between two namespaces.
 */
public enum ModuleNamespace {

    INTAKE("intake_artifacts", null),
    STRATEGY("strategy_artifacts", null),
    PRODUCTION("production_artifacts", "production_assets"),
    QC("qc_artifacts", "qc_issues"),
    DELIVERY("delivery_artifacts", "delivery_files");

    private final String tableName;
    private final String childTableName;

    ModuleNamespace(String tableName, String childTableName) {
        this.tableName = tableName;
        this.childTableName = childTableName;
    }

    public String tableName() {
        return tableName;
    }

    public Optional<String> childTableName() {
        return Optional.ofNullable(childTableName);
    }

    /**
     * Short lowercase form used in {@link ArtifactRef} string encodings.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ModuleNamespace fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Namespace key must not be blank");
        }
        return ModuleNamespace.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
