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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.fireflyframework.contentsaga.saga.core.StepContext;

/**
 * Single-line JSON payload written by the compensation error handlers.
 */
final class CompensationLogLine {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode node = MAPPER.createObjectNode();

    private CompensationLogLine(String event) {
        node.put("event", event);
    }

    static CompensationLogLine of(String event, String stepName, Throwable error, StepContext context, int attempts) {
        CompensationLogLine line = new CompensationLogLine(event);
        line.node.put("workflow_name", context.workflowName());
        line.node.put("run_id", context.runId());
        line.node.put("step_name", stepName);
        line.node.put("attempts", attempts);
        line.node.put("error_class", error.getClass().getName());
        line.node.put("error_message", error.getMessage() != null ? error.getMessage() : "No message");
        return line;
    }

    CompensationLogLine action(String action) {
        node.put("action", action);
        return this;
    }

    String render() {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // ObjectNode of scalar values; not expected
            return node.toString();
        }
    }
}
