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

package org.fireflyframework.contentsaga.saga.consistency;

/**
 * A mismatch between the step records of a run and the artifacts that are live for it.
 */
public record ConsistencyViolation(String runId, Type type, String stepName, String artifactRef, String detail) {

    public enum Type {
        /**
         * A live artifact that no COMPLETED step record points at.
         */
        ORPHANED_ARTIFACT,
        /**
         * A COMPLETED step record whose artifact is not live.
         */
        MISSING_ARTIFACT
    }
}
