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
 * Storage failure inside a module gateway. Treated as a recoverable step error.
 */
public class PersistenceGatewayException extends ContentSagaException {

    private final ModuleNamespace namespace;

    public PersistenceGatewayException(ModuleNamespace namespace, String operation, Throwable cause) {
        super("Gateway '" + namespace.key() + "' failed during " + operation
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.namespace = namespace;
    }

    public PersistenceGatewayException(ModuleNamespace namespace, String message) {
        super(message);
        this.namespace = namespace;
    }

    public ModuleNamespace getNamespace() {
        return namespace;
    }
}
