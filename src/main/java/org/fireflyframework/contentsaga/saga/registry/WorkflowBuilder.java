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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fluent builder for {@link WorkflowDefinition}.
 * <pre>
 * WorkflowDefinition def = WorkflowBuilder.workflow("client-to-delivery")
 *     .defaults(policy)
 *     .step(intakeAdapter).add()
 *     .step(qcAdapter).timeout(Duration.ofSeconds(5)).maxAttempts(1).add()
 *     .build();
 * </pre>
 */
public class WorkflowBuilder {
    private final String name;
    private final List<StepDefinition> steps = new ArrayList<>();
    private final Set<String> names = new LinkedHashSet<>();
    private StepPolicy defaults = StepPolicy.DEFAULT;

    private WorkflowBuilder(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name must not be blank");
        }
        this.name = name;
    }

    public static WorkflowBuilder workflow(String name) {
        return new WorkflowBuilder(name);
    }

    /** Policy applied to every step that does not override it. Call before adding steps. */
    public WorkflowBuilder defaults(StepPolicy policy) {
        this.defaults = policy != null ? policy : StepPolicy.DEFAULT;
        return this;
    }

    public Step step(StepPort port) {
        if (port == null) throw new IllegalArgumentException("port");
        return new Step(port.name(), port);
    }

    /** Registers a port under a name other than {@link StepPort#name()}. */
    public Step step(String stepName, StepPort port) {
        if (port == null) throw new IllegalArgumentException("port");
        return new Step(stepName, port);
    }

    public WorkflowDefinition build() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("Workflow '" + name + "' declares no steps");
        }
        return new WorkflowDefinition(name, steps);
    }

    public class Step {
        private final String stepName;
        private final StepPort port;
        private Duration timeout;
        private Integer maxAttempts;
        private Duration backoff;
        private Boolean jitter;
        private Double jitterFactor;
        private Duration compensationTimeout;
        private Integer compensationMaxAttempts;

        private Step(String stepName, StepPort port) {
            if (stepName == null || stepName.isBlank()) {
                throw new IllegalArgumentException("Step name must not be blank");
            }
            this.stepName = stepName;
            this.port = port;
        }

        public Step timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Step timeoutMs(long ms) { this.timeout = Duration.ofMillis(ms); return this; }
        public Step maxAttempts(int attempts) { this.maxAttempts = attempts; return this; }
        public Step backoff(Duration backoff) { this.backoff = backoff; return this; }
        public Step backoffMs(long ms) { this.backoff = Duration.ofMillis(ms); return this; }
        /** Enable jitter with the default factor. */
        public Step jitter() { this.jitter = true; return this; }
        public Step jitterFactor(double factor) { this.jitter = true; this.jitterFactor = factor; return this; }
        public Step compensationTimeout(Duration d) { this.compensationTimeout = d; return this; }
        public Step compensationMaxAttempts(int attempts) { this.compensationMaxAttempts = attempts; return this; }

        public WorkflowBuilder add() {
            if (!names.add(stepName)) {
                throw new IllegalStateException("Duplicate step '" + stepName + "' in workflow '" + name + "'");
            }
            StepPolicy policy = new StepPolicy(
                    timeout != null ? timeout : defaults.timeout(),
                    maxAttempts != null ? maxAttempts : defaults.maxAttempts(),
                    backoff != null ? backoff : defaults.backoff(),
                    jitter != null ? jitter : defaults.jitter(),
                    jitterFactor != null ? jitterFactor : defaults.jitterFactor(),
                    compensationTimeout != null ? compensationTimeout : defaults.compensationTimeout(),
                    compensationMaxAttempts != null ? compensationMaxAttempts : defaults.compensationMaxAttempts());
            steps.add(new StepDefinition(stepName, steps.size(), port, policy));
            return WorkflowBuilder.this;
        }
    }
}
