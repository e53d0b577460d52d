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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the namespace to gateway binding shared by both backends.
 */
public abstract class AbstractPersistenceBackend implements PersistenceBackend {

    private static final Logger log = LoggerFactory.getLogger(AbstractPersistenceBackend.class);

    private final Map<ModuleNamespace, PersistenceGateway<?>> gateways = new ConcurrentHashMap<>();

    @Override
    @SuppressWarnings("unchecked")
    public <T extends Artifact> PersistenceGateway<T> gateway(ModuleNamespace namespace, Class<T> type) {
        PersistenceGateway<?> gateway = gateways.computeIfAbsent(namespace, ns -> {
            log.debug("Creating {} gateway for namespace {} ({})", mode(), ns.key(), type.getSimpleName());
            return createGateway(ns, type);
        });
        if (!gateway.artifactType().equals(type)) {
            throw new NamespaceViolationException("Namespace '" + namespace.key() + "' is bound to "
                    + gateway.artifactType().getSimpleName() + ", refused " + type.getSimpleName());
        }
        return (PersistenceGateway<T>) gateway;
    }

    protected abstract <T extends Artifact> PersistenceGateway<T> createGateway(ModuleNamespace namespace, Class<T> type);
}
