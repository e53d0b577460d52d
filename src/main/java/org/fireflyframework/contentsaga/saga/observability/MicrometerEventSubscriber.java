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

package org.fireflyframework.contentsaga.saga.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import org.fireflyframework.contentsaga.saga.events.EventSubscriber;
import org.fireflyframework.contentsaga.saga.events.WorkflowEvent;

/**
 * Micrometer-based subscriber publishing counters for step and run lifecycle events.
 */
public class MicrometerEventSubscriber implements EventSubscriber {

    public static final String STEP_COMPLETED = "content.saga.step.completed";
    public static final String STEP_FAILED = "content.saga.step.failed";
    public static final String STEP_COMPENSATED = "content.saga.step.compensated";
    public static final String STEP_ATTEMPTS = "content.saga.step.attempts";
    public static final String RUN_TERMINAL = "content.saga.run.terminal";

    private final MeterRegistry registry;

    public MicrometerEventSubscriber(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onEvent(WorkflowEvent event) {
        switch (event.channel()) {
            case STEP_COMPLETED -> {
                Tags tags = stepTags(event);
                registry.counter(STEP_COMPLETED, tags).increment();
                recordAttempts(event, tags);
            }
            case STEP_FAILED -> {
                Tags tags = stepTags(event).and(Tag.of("failure.kind", valueOr(event.attribute(WorkflowEvent.FAILURE_KIND))));
                registry.counter(STEP_FAILED, tags).increment();
                recordAttempts(event, stepTags(event));
            }
            case STEP_COMPENSATED -> {
                Tags tags = stepTags(event);
                registry.counter(STEP_COMPENSATED, tags).increment();
                String rows = event.attribute(WorkflowEvent.ROWS_AFFECTED);
                if (rows != null) {
                    DistributionSummary.builder("content.saga.compensation.rows")
                            .baseUnit("rows")
                            .tags(tags)
                            .register(registry)
                            .record(Double.parseDouble(rows));
                }
            }
            case RUN_TERMINAL -> registry.counter(RUN_TERMINAL, Tags.of(
                    Tag.of("workflow.name", valueOr(event.workflowName())),
                    Tag.of("status", valueOr(event.attribute(WorkflowEvent.STATUS))))).increment();
        }
    }

    private void recordAttempts(WorkflowEvent event, Tags tags) {
        String attempts = event.attribute(WorkflowEvent.ATTEMPTS);
        if (attempts == null) {
            return;
        }
        DistributionSummary.builder(STEP_ATTEMPTS)
                .baseUnit("attempts")
                .tags(tags)
                .register(registry)
                .record(Integer.parseInt(attempts));
    }

    private static Tags stepTags(WorkflowEvent event) {
        return Tags.of(
                Tag.of("workflow.name", valueOr(event.workflowName())),
                Tag.of("step.name", valueOr(event.stepName())));
    }

    private static String valueOr(String value) {
        return value != null ? value : "unknown";
    }
}
