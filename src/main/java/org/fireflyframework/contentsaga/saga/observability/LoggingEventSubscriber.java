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

import org.fireflyframework.contentsaga.saga.events.EventSubscriber;
import org.fireflyframework.contentsaga.saga.events.WorkflowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every lifecycle event as a single JSON line. Failures log at error level,
 * compensations at warn, everything else at info.
 */
public class LoggingEventSubscriber implements EventSubscriber {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventSubscriber.class);

    @Override
    public void onEvent(WorkflowEvent event) {
        switch (event.channel()) {
            case STEP_COMPLETED -> log.info("{{\"saga_event\":\"step_completed\",\"workflow_name\":\"{}\",\"run_id\":\"{}\",\"step_name\":\"{}\",\"artifact_ref\":\"{}\",\"attempts\":\"{}\"}}",
                    event.workflowName(), event.runId(), event.stepName(),
                    event.attribute(WorkflowEvent.ARTIFACT_REF), event.attribute(WorkflowEvent.ATTEMPTS));
            case STEP_FAILED -> log.error("{{\"saga_event\":\"step_failed\",\"workflow_name\":\"{}\",\"run_id\":\"{}\",\"step_name\":\"{}\",\"failure_kind\":\"{}\",\"attempts\":\"{}\",\"error\":\"{}\"}}",
                    event.workflowName(), event.runId(), event.stepName(),
                    event.attribute(WorkflowEvent.FAILURE_KIND), event.attribute(WorkflowEvent.ATTEMPTS),
                    escape(event.attribute(WorkflowEvent.ERROR)));
            case STEP_COMPENSATED -> log.warn("{{\"saga_event\":\"step_compensated\",\"workflow_name\":\"{}\",\"run_id\":\"{}\",\"step_name\":\"{}\",\"artifact_ref\":\"{}\",\"rows_affected\":\"{}\"}}",
                    event.workflowName(), event.runId(), event.stepName(),
                    event.attribute(WorkflowEvent.ARTIFACT_REF), event.attribute(WorkflowEvent.ROWS_AFFECTED));
            case RUN_TERMINAL -> log.info("{{\"saga_event\":\"run_terminal\",\"workflow_name\":\"{}\",\"run_id\":\"{}\",\"status\":\"{}\"}}",
                    event.workflowName(), event.runId(), event.attribute(WorkflowEvent.STATUS));
        }
    }

    private static String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
