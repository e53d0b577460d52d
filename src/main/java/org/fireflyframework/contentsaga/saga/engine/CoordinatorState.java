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

import java.util.EnumSet;
import java.util.Set;

/**
 * In-memory lifecycle of a run inside the coordinator.
 */
public enum CoordinatorState {
    CREATED,
    RUNNING,
    COMPENSATING,
    SUCCEEDED,
    COMPENSATED;

    public Set<CoordinatorState> next() {
        return switch (this) {
            case CREATED -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(SUCCEEDED, COMPENSATING);
            case COMPENSATING -> EnumSet.of(COMPENSATED);
            case SUCCEEDED, COMPENSATED -> EnumSet.noneOf(CoordinatorState.class);
        };
    }

    public boolean canTransitionTo(CoordinatorState target) {
        return next().contains(target);
    }
}
