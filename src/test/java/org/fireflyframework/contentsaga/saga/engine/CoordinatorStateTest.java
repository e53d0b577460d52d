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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CoordinatorStateTest {

    @Test
    void runningMayEitherSucceedOrStartCompensating() {
        assertThat(CoordinatorState.CREATED.next()).containsExactly(CoordinatorState.RUNNING);
        assertThat(CoordinatorState.RUNNING.next())
                .containsExactlyInAnyOrder(CoordinatorState.SUCCEEDED, CoordinatorState.COMPENSATING);
        assertThat(CoordinatorState.COMPENSATING.canTransitionTo(CoordinatorState.COMPENSATED)).isTrue();
    }

    @Test
    void terminalStatesHaveNoSuccessors() {
        assertThat(CoordinatorState.SUCCEEDED.next()).isEmpty();
        assertThat(CoordinatorState.COMPENSATED.next()).isEmpty();
        assertThat(CoordinatorState.CREATED.canTransitionTo(CoordinatorState.SUCCEEDED)).isFalse();
        assertThat(CoordinatorState.SUCCEEDED.canTransitionTo(CoordinatorState.COMPENSATING)).isFalse();
    }
}
