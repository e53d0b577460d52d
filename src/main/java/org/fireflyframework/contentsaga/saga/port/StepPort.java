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

package org.fireflyframework.contentsaga.saga.port;

import org.fireflyframework.contentsaga.saga.core.CompensationOutcome;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.core.StepOutcome;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import reactor.core.publisher.Mono;

/**
 * Contract every pipeline module implements towards the coordinator.
 * <p>
 * Error classes surfaced by implementations:
 * <ul>
 *   <li>{@link org.fireflyframework.contentsaga.shared.exception.RecoverableStepException} and timeouts are retried with backoff</li>
 *   <li>{@link org.fireflyframework.contentsaga.shared.exception.TerminalStepException} triggers compensation immediately</li>
 *   <li>a business rejection is not an error; it is reported as a {@code FAIL} verdict in {@link StepOutcome#metadata()}</li>
 * </ul>
 */
public interface StepPort {

    /**
     * Name of the step this port serves, unique within a workflow definition.
     */
    String name();

    /**
     * Performs the module's work and persists exactly one artifact through the module's own
     * gateway. Idempotent on (runId, stepName): a repeated call returns the reference of the
     * artifact stored by the first call without producing a new one.
     *
     * @param input the previous step's output reference, or the run's initial input for the first step
     */
    Mono<StepOutcome> execute(StepContext context, Object input);

    /**
     * Removes the artifact and the rows it owns. Calling it again for an already compensated
     * reference is a no-op returning {@code rowsRemoved = 0}.
     */
    Mono<CompensationOutcome> compensate(StepContext context, ArtifactRef outputRef);
}
