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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Error handler that stops the reverse iteration on the first compensation error.
 * With a set of critical error types it only stops for those and continues otherwise.
 */
public class FailFastErrorHandler implements CompensationErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(FailFastErrorHandler.class);

    private final Set<Class<? extends Throwable>> criticalErrors;
    private final boolean failOnAnyError;

    public FailFastErrorHandler() {
        this(true, Set.of());
    }

    public FailFastErrorHandler(boolean failOnAnyError, Set<Class<? extends Throwable>> criticalErrors) {
        this.failOnAnyError = failOnAnyError;
        this.criticalErrors = criticalErrors != null ? criticalErrors : Set.of();
    }

    @Override
    public Mono<CompensationErrorResult> handleError(String stepName,
                                                     Throwable error,
                                                     StepContext context,
                                                     int attempts) {
        boolean shouldFail = failOnAnyError || isCriticalError(error);
        String event = shouldFail ? "compensation_error_critical" : "compensation_error_non_critical";
        log.error(CompensationLogLine.of(event, stepName, error, context, attempts)
                .action(shouldFail ? "aborting_compensation" : "continuing")
                .render(), error);
        return Mono.just(shouldFail ? CompensationErrorResult.FAIL_SAGA : CompensationErrorResult.CONTINUE);
    }

    @Override
    public String getStrategyName() {
        return "FailFast";
    }

    private boolean isCriticalError(Throwable error) {
        return criticalErrors.stream()
                .anyMatch(criticalType -> criticalType.isAssignableFrom(error.getClass()));
    }

    @SafeVarargs
    public static FailFastErrorHandler forCriticalErrors(Class<? extends Throwable>... errorTypes) {
        return new FailFastErrorHandler(false, Set.of(errorTypes));
    }
}
