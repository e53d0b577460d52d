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

import org.fireflyframework.contentsaga.saga.persistence.RunNotFoundException;
import org.fireflyframework.contentsaga.shared.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;

/**
 * Retries run audit storage calls with exponential backoff. When the retries are used up
 * the call fails with {@link StorageUnavailableException}.
 */
final class StorageGuard {

    private static final Logger log = LoggerFactory.getLogger(StorageGuard.class);

    private final int maxAttempts;
    private final Duration backoff;

    StorageGuard(int maxAttempts, Duration backoff) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = backoff != null ? backoff : Duration.ofMillis(50);
    }

    <T> Mono<T> guard(String operation, Mono<T> call) {
        return call.retryWhen(retrySpec(operation));
    }

    <T> Flux<T> guardMany(String operation, Flux<T> call) {
        return call.retryWhen(retrySpec(operation));
    }

    private RetryBackoffSpec retrySpec(String operation) {
        return Retry.backoff(maxAttempts - 1L, backoff)
                .filter(StorageGuard::isRetryable)
                .doBeforeRetry(signal -> log.warn("{{\"saga_event\":\"storage_retry\",\"operation\":\"{}\",\"attempt\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}}",
                        operation, signal.totalRetries() + 1, signal.failure().getClass().getSimpleName(), signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> new StorageUnavailableException(operation, signal.failure()));
    }

    private static boolean isRetryable(Throwable error) {
        return !(error instanceof RunNotFoundException
                || error instanceof IllegalArgumentException
                || error instanceof IllegalStateException);
    }
}
