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

import org.fireflyframework.contentsaga.shared.exception.ContentSagaException;

/**
 * A module tried to read or write storage that belongs to another namespace.
 */
public class NamespaceViolationException extends ContentSagaException {

    private final ModuleNamespace owner;
    private final ModuleNamespace attempted;

    public NamespaceViolationException(ModuleNamespace owner, ModuleNamespace attempted, String operation) {
        super("Gateway for namespace '" + owner.key() + "' refused " + operation + " on namespace '" + attempted.key() + "'");
        this.owner = owner;
        this.attempted = attempted;
    }

    public NamespaceViolationException(String message) {
        super(message);
        this.owner = null;
        this.attempted = null;
    }

    public ModuleNamespace getOwner() {
        return owner;
    }

    public ModuleNamespace getAttempted() {
        return attempted;
    }
}
