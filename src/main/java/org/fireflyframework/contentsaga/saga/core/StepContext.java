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

package org.fireflyframework.contentsaga.saga.core;

import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;

import java.util.Map;
import java.util.Optional;

/**
 * Per-call context handed to a step port. {@code upstreamRefs} holds the output
 * references of the steps that completed before this one, keyed by step name.
 */
public record StepContext(
        String runId,
        String workflowName,
        String stepName,
        int sequenceIndex,
        Object initialInput,
        Map<String, ArtifactRef> upstreamRefs
) {

    public StepContext {
        upstreamRefs = upstreamRefs == null ? Map.of() : Map.copyOf(upstreamRefs);
    }

    public Optional<ArtifactRef> upstream(String step) {
        return Optional.ofNullable(upstreamRefs.get(step));
    }

    public <T> Optional<T> initialInput(Class<T> type) {
        return type.isInstance(initialInput) ? Optional.of(type.cast(initialInput)) : Optional.empty();
    }
}
