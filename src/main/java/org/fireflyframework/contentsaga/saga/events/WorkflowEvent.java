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

package org.fireflyframework.contentsaga.saga.events;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable lifecycle event. {@code stepName} is null for {@link EventChannel#RUN_TERMINAL}.
 * Attributes use the keys declared on this type.
 */
public record WorkflowEvent(
        EventChannel channel,
        String runId,
        String workflowName,
        String stepName,
        Instant occurredAt,
        Map<String, String> attributes
) {

    public static final String ARTIFACT_REF = "artifact_ref";
    public static final String ATTEMPTS = "attempts";
    public static final String FAILURE_KIND = "failure_kind";
    public static final String ERROR = "error";
    public static final String ROWS_AFFECTED = "rows_affected";
    public static final String STATUS = "status";

    public WorkflowEvent {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(runId, "runId");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static Builder on(EventChannel channel, String runId, String workflowName) {
        return new Builder(channel, runId, workflowName);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public static final class Builder {
        private final EventChannel channel;
        private final String runId;
        private final String workflowName;
        private String stepName;
        private Instant occurredAt = Instant.now();
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder(EventChannel channel, String runId, String workflowName) {
            this.channel = channel;
            this.runId = runId;
            this.workflowName = workflowName;
        }

        public Builder step(String stepName) { this.stepName = stepName; return this; }
        public Builder at(Instant at) { this.occurredAt = at; return this; }

        public Builder attr(String key, Object value) {
            if (value != null) {
                attributes.put(key, String.valueOf(value));
            }
            return this;
        }

        public WorkflowEvent build() {
            return new WorkflowEvent(channel, runId, workflowName, stepName, occurredAt, attributes);
        }
    }
}
