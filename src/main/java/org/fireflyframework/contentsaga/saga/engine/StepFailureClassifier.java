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

package org.fireflyframework.contentsaga.saga.engine;

import io.r2dbc.spi.R2dbcTransientException;
import org.fireflyframework.contentsaga.shared.exception.RecoverableStepException;
import org.fireflyframework.contentsaga.shared.exception.TerminalStepException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactNotFoundException;
import org.fireflyframework.contentsaga.shared.gateway.NamespaceViolationException;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGatewayException;
import org.springframework.dao.TransientDataAccessException;

import java.util.concurrent.TimeoutException;

/**
 * Decides whether a step error is transient (retry with backoff) or terminal
 * (compensate immediately). Unknown errors are terminal.
 */
public class StepFailureClassifier {

    public boolean isRecoverable(Throwable error) {
        if (error instanceof TerminalStepException
                || error instanceof NamespaceViolationException
                || error instanceof ArtifactNotFoundException) {
            return false;
        }
        return error instanceof RecoverableStepException
                || error instanceof TimeoutException
                || error instanceof PersistenceGatewayException
                || error instanceof R2dbcTransientException
                || error instanceof TransientDataAccessException;
    }
}
