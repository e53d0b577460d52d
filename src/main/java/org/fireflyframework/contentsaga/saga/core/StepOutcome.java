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

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a successful execute call: the reference to the artifact the step persisted
 * plus free-form metadata. A step reports a business rejection by putting
 * {@link Verdict#FAIL} under {@link #VERDICT_KEY}.
 */
public record StepOutcome(ArtifactRef outputRef, Map<String, Object> metadata) {

    public static final String VERDICT_KEY = "verdict";

    public StepOutcome {
        Objects.requireNonNull(outputRef, "outputRef");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static StepOutcome of(ArtifactRef outputRef) {
        return new StepOutcome(outputRef, Map.of());
    }

    public StepOutcome withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new StepOutcome(outputRef, copy);
    }

    public Optional<Verdict> verdict() {
        Object value = metadata.get(VERDICT_KEY);
        if (value instanceof Verdict v) {
            return Optional.of(v);
        }
        if (value instanceof String s && !s.isBlank()) {
            return Optional.of(Verdict.valueOf(s.trim().toUpperCase(Locale.ROOT)));
        }
        return Optional.empty();
    }

    public boolean isRejected() {
        return verdict().filter(v -> v == Verdict.FAIL).isPresent();
    }
}
