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

/**
 * Error handler that logs compensation errors and continues with remaining compensations.
 * This is the default: cleanup is best-effort across all completed steps.
 */
public class LogAndContinueErrorHandler implements CompensationErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(LogAndContinueErrorHandler.class);

    @Override
    public Mono<CompensationErrorResult> handleError(String stepName,
                                                     Throwable error,
                                                     StepContext context,
                                                     int attempts) {
        log.error(CompensationLogLine.of("compensation_error", stepName, error, context, attempts)
                .action("continuing")
                .render(), error);
        return Mono.just(CompensationErrorResult.CONTINUE);
    }

    @Override
    public String getStrategyName() {
        return "LogAndContinue";
    }
}
