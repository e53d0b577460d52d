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

package org.fireflyframework.contentsaga.shared.engine.compensation;

import org.fireflyframework.contentsaga.saga.core.StepContext;
import reactor.core.publisher.Mono;

/**
 * Strategy interface for handling compensation errors.
 * Implementations decide whether the reverse iteration goes on after a step failed to compensate.
 */
public interface CompensationErrorHandler {

    /**
     * Handles a compensation error for a specific step.
     *
     * @param stepName the step that failed compensation
     * @param error the error that occurred during compensation, after the step's own attempts
     * @param context the context of the failed compensate call
     * @param attempts how many compensate attempts were made
     * @return a Mono that completes with the handling result
     */
    Mono<CompensationErrorResult> handleError(String stepName,
                                              Throwable error,
                                              StepContext context,
                                              int attempts);

    /**
     * Gets the name of this error handling strategy.
     */
    String getStrategyName();

    /**
     * Result of compensation error handling.
     */
    enum CompensationErrorResult {
        /**
         * Continue with compensation of remaining steps.
         */
        CONTINUE,

        /**
         * Stop compensating; the remaining completed steps are left as they are.
         */
        FAIL_SAGA
    }
}
