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

import org.fireflyframework.contentsaga.saga.port.StepPort;

import java.time.Duration;

/**
 * Immutable metadata for a single workflow step: its position, the port that executes
 * and compensates it, and its timeout and retry configuration.
 */
public class StepDefinition {
    public final String name;
    public final int sequenceIndex;
    public final StepPort port;
    public final Duration timeout;
    public final int maxAttempts;
    public final Duration backoff;
    public final boolean jitter;
    public final double jitterFactor;
    public final Duration compensationTimeout;
    public final int compensationMaxAttempts;

    public StepDefinition(String name, int sequenceIndex, StepPort port, StepPolicy policy) {
        this.name = name;
        this.sequenceIndex = sequenceIndex;
        this.port = port;
        this.timeout = policy.timeout();
        this.maxAttempts = policy.maxAttempts();
        this.backoff = policy.backoff();
        this.jitter = policy.jitter();
        this.jitterFactor = policy.jitterFactor();
        this.compensationTimeout = policy.compensationTimeout();
        this.compensationMaxAttempts = policy.compensationMaxAttempts();
    }

    @Override
    public String toString() {
        return "StepDefinition{" + name + "#" + sequenceIndex + ", maxAttempts=" + maxAttempts + ", timeout=" + timeout + "}";
    }
}
