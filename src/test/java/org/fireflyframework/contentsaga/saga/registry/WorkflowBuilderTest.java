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

package org.fireflyframework.contentsaga.saga.registry;

import org.fireflyframework.contentsaga.support.ScriptedStep;
import org.fireflyframework.contentsaga.support.TestBackends;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowBuilderTest {

    private final List<String> journal = new ArrayList<>();

    @Test
    void stepsKeepDeclarationOrderAndOverrides() {
        WorkflowDefinition def = WorkflowBuilder.workflow("wf")
                .defaults(TestBackends.fastPolicy())
                .step(ScriptedStep.named("a", journal)).add()
                .step("renamed", ScriptedStep.named("b", journal)).timeout(Duration.ofMillis(50)).maxAttempts(1).add()
                .build();

        assertThat(def.name()).isEqualTo("wf");
        assertThat(def.stepNames()).containsExactly("a", "renamed");
        StepDefinition renamed = def.step("renamed").orElseThrow();
        assertThat(renamed.sequenceIndex).isEqualTo(1);
        assertThat(renamed.timeout).isEqualTo(Duration.ofMillis(50));
        assertThat(renamed.maxAttempts).isEqualTo(1);
        assertThat(renamed.compensationMaxAttempts).isEqualTo(TestBackends.fastPolicy().compensationMaxAttempts());
        assertThat(def.step("a").orElseThrow().timeout).isEqualTo(TestBackends.fastPolicy().timeout());
        assertThat(def.step("missing")).isEmpty();
    }

    @Test
    void duplicateStepNamesAreRejected() {
        WorkflowBuilder builder = WorkflowBuilder.workflow("wf").step(ScriptedStep.named("a", journal)).add();

        assertThatThrownBy(() -> builder.step(ScriptedStep.named("a", journal)).add())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate step 'a'");
    }

    @Test
    void emptyWorkflowIsRejected() {
        assertThatThrownBy(() -> WorkflowBuilder.workflow("wf").build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> WorkflowBuilder.workflow(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
