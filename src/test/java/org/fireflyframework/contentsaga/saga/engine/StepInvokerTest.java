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
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.registry.StepDefinition;
import org.fireflyframework.contentsaga.saga.registry.StepPolicy;
import org.fireflyframework.contentsaga.shared.exception.RecoverableStepException;
import org.fireflyframework.contentsaga.shared.exception.TerminalStepException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.support.ScriptedStep;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class StepInvokerTest {

    private final List<String> journal = new CopyOnWriteArrayList<>();
    private final StepInvoker invoker = new StepInvoker();

    private static StepDefinition def(ScriptedStep step, Duration timeout, int maxAttempts) {
        return new StepDefinition(step.name(), 0, step,
                new StepPolicy(timeout, maxAttempts, Duration.ofMillis(5), false, 0.5d, Duration.ofMillis(200), 2));
    }

    private static StepContext ctx(String step) {
        return new StepContext("run-1", "wf", step, 0, null, Map.of());
    }

    @Test
    void recoverableFailureIsRetriedUntilSuccess() {
        ScriptedStep step = ScriptedStep.named("a", journal).failingTimes(2, new RecoverableStepException("flaky"));

        StepVerifier.create(invoker.execute(def(step, Duration.ofSeconds(1), 3), ctx("a"), null))
                .assertNext(execution -> {
                    assertThat(execution.kind()).isEqualTo(StepExecution.Kind.COMPLETED);
                    assertThat(execution.attempts()).isEqualTo(3);
                })
                .verifyComplete();
        assertThat(step.executeCalls()).isEqualTo(3);
    }

    @Test
    void timeoutsAreRetriedThenEscalatedToTerminal() {
        ScriptedStep step = ScriptedStep.named("slow", journal).hanging();

        StepVerifier.create(invoker.execute(def(step, Duration.ofMillis(50), 2), ctx("slow"), null))
                .assertNext(execution -> {
                    assertThat(execution.kind()).isEqualTo(StepExecution.Kind.ERRORED);
                    assertThat(execution.failureKind()).isEqualTo(FailureKind.ERRORED);
                    assertThat(execution.attempts()).isEqualTo(2);
                    assertThat(execution.error()).get()
                            .isInstanceOf(TerminalStepException.class)
                            .satisfies(e -> assertThat(e.getCause()).isInstanceOf(TimeoutException.class));
                    assertThat(execution.reason()).contains("exhausted 2 attempt(s)");
                })
                .verifyComplete();
        assertThat(step.executeCalls()).isEqualTo(2);
    }

    @Test
    void terminalFailureIsNotRetried() {
        ScriptedStep step = ScriptedStep.named("bad", journal).failing(new TerminalStepException("invalid brief"));

        StepVerifier.create(invoker.execute(def(step, Duration.ofSeconds(1), 3), ctx("bad"), null))
                .assertNext(execution -> {
                    assertThat(execution.kind()).isEqualTo(StepExecution.Kind.ERRORED);
                    assertThat(execution.attempts()).isEqualTo(1);
                    assertThat(execution.reason()).isEqualTo("TerminalStepException: invalid brief");
                })
                .verifyComplete();
    }

    @Test
    void unknownErrorsAreTerminal() {
        ScriptedStep step = ScriptedStep.named("npe", journal).failing(new NullPointerException("boom"));

        StepVerifier.create(invoker.execute(def(step, Duration.ofSeconds(1), 3), ctx("npe"), null))
                .assertNext(execution -> assertThat(execution.attempts()).isEqualTo(1))
                .verifyComplete();
        assertThat(step.executeCalls()).isEqualTo(1);
    }

    @Test
    void failVerdictIsReportedAsRejection() {
        ScriptedStep step = ScriptedStep.named("qc", journal).rejecting();

        StepVerifier.create(invoker.execute(def(step, Duration.ofSeconds(1), 3), ctx("qc"), null))
                .assertNext(execution -> {
                    assertThat(execution.kind()).isEqualTo(StepExecution.Kind.REJECTED);
                    assertThat(execution.failureKind()).isEqualTo(FailureKind.REJECTED);
                    assertThat(execution.outcome().isRejected()).isTrue();
                    assertThat(execution.reason()).startsWith("rejected with verdict FAIL");
                })
                .verifyComplete();
        assertThat(step.executeCalls()).isEqualTo(1);
    }

    @Test
    void compensationIsRetriedWithinItsOwnAttempts() {
        ScriptedStep step = ScriptedStep.named("a", journal).compensationFailing(new IllegalStateException("db down"));
        AtomicInteger attempts = new AtomicInteger();

        StepVerifier.create(invoker.compensate(def(step, Duration.ofSeconds(1), 1), ctx("a"),
                        ArtifactRef.of(ModuleNamespace.INTAKE, "x"), attempts))
                .expectErrorMessage("db down")
                .verify();
        assertThat(attempts.get()).isEqualTo(2);
        assertThat(step.compensateCalls()).isEqualTo(2);
    }

    @Test
    void computeDelayStaysWithinJitterBounds() {
        assertThat(StepInvoker.computeDelay(100, false, 0.5d)).isEqualTo(100);
        assertThat(StepInvoker.computeDelay(0, true, 0.5d)).isZero();
        for (int i = 0; i < 50; i++) {
            assertThat(StepInvoker.computeDelay(100, true, 0.5d)).isBetween(50L, 150L);
        }
    }
}
