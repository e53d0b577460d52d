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

package org.fireflyframework.contentsaga.saga.registry;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeout and retry knobs applied to a step's execute and compensate calls.
 */
public record StepPolicy(
        Duration timeout,
        int maxAttempts,
        Duration backoff,
        boolean jitter,
        double jitterFactor,
        Duration compensationTimeout,
        int compensationMaxAttempts
) {

    public static final StepPolicy DEFAULT = new StepPolicy(
            Duration.ofSeconds(30), 3, Duration.ofMillis(100), false, 0.5d, Duration.ofSeconds(30), 2);

    public StepPolicy {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(backoff, "backoff");
        Objects.requireNonNull(compensationTimeout, "compensationTimeout");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (compensationMaxAttempts < 1) {
            throw new IllegalArgumentException("compensationMaxAttempts must be >= 1");
        }
        if (jitterFactor < 0.0d || jitterFactor > 1.0d) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
    }
}
