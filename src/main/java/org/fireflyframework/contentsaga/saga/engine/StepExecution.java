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

package org.fireflyframework.contentsaga.saga.engine;

import org.fireflyframework.contentsaga.saga.core.FailureKind;
import org.fireflyframework.contentsaga.saga.core.StepOutcome;

import java.util.Optional;

/**
 * Tagged result of executing one step. REJECTED and ERRORED both lead to compensation;
 * they are reported apart.
 */
public final class StepExecution {

    public enum Kind { COMPLETED, REJECTED, ERRORED }

    private final Kind kind;
    private final StepOutcome outcome;
    private final Throwable error;
    private final int attempts;

    private StepExecution(Kind kind, StepOutcome outcome, Throwable error, int attempts) {
        this.kind = kind;
        this.outcome = outcome;
        this.error = error;
        this.attempts = attempts;
    }

    public static StepExecution completed(StepOutcome outcome, int attempts) {
        return new StepExecution(Kind.COMPLETED, outcome, null, attempts);
    }

    public static StepExecution rejected(StepOutcome outcome, int attempts) {
        return new StepExecution(Kind.REJECTED, outcome, null, attempts);
    }

    public static StepExecution errored(Throwable error, int attempts) {
        return new StepExecution(Kind.ERRORED, null, error, attempts);
    }

    public Kind kind() { return kind; }
    public StepOutcome outcome() { return outcome; }
    public Optional<Throwable> error() { return Optional.ofNullable(error); }
    public int attempts() { return attempts; }

    public FailureKind failureKind() {
        return switch (kind) {
            case REJECTED -> FailureKind.REJECTED;
            case ERRORED -> FailureKind.ERRORED;
            case COMPLETED -> throw new IllegalStateException("Completed step has no failure kind");
        };
    }

    /**
     * Human readable failure reason, null for completed steps.
     */
    public String reason() {
        return switch (kind) {
            case COMPLETED -> null;
            case REJECTED -> {
                Object detail = outcome.metadata().get("reason");
                yield "rejected with verdict FAIL" + (detail != null ? ": " + detail : "");
            }
            case ERRORED -> error.getMessage() != null
                    ? error.getClass().getSimpleName() + ": " + error.getMessage()
                    : error.getClass().getSimpleName();
        };
    }
}
