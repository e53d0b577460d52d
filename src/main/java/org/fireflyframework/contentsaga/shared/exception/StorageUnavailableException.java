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

package org.fireflyframework.contentsaga.shared.exception;

/**
 * The run audit storage could not be reached after all retries.
 * This is the only error a workflow invocation surfaces as a raw exception,
 * because no reliable run record can be written.
 */
public class StorageUnavailableException extends ContentSagaException {

    private final String operation;

    public StorageUnavailableException(String operation, Throwable cause) {
        super("Run storage unavailable during '" + operation + "'", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
