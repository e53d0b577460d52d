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

import org.fireflyframework.contentsaga.saga.core.CompensationLog;
import org.fireflyframework.contentsaga.saga.core.FailureKind;
import org.fireflyframework.contentsaga.saga.core.RunStatus;
import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.core.StepStatus;
import org.fireflyframework.contentsaga.saga.core.WorkflowResult;
import org.fireflyframework.contentsaga.saga.core.WorkflowRun;
import org.fireflyframework.contentsaga.saga.events.EventChannel;
import org.fireflyframework.contentsaga.saga.events.InProcessEventBus;
import org.fireflyframework.contentsaga.saga.events.WorkflowEvent;
import org.fireflyframework.contentsaga.saga.persistence.RunNotFoundException;
import org.fireflyframework.contentsaga.saga.persistence.WorkflowRunRepository;
import org.fireflyframework.contentsaga.saga.persistence.impl.InMemoryWorkflowRunRepository;
import org.fireflyframework.contentsaga.saga.registry.WorkflowBuilder;
import org.fireflyframework.contentsaga.saga.registry.WorkflowDefinition;
import org.fireflyframework.contentsaga.shared.engine.compensation.CompensationErrorHandler;
import org.fireflyframework.contentsaga.shared.engine.compensation.FailFastErrorHandler;
import org.fireflyframework.contentsaga.shared.engine.compensation.LogAndContinueErrorHandler;
import org.fireflyframework.contentsaga.shared.exception.StorageUnavailableException;
import org.fireflyframework.contentsaga.shared.exception.TerminalStepException;
import org.fireflyframework.contentsaga.support.ScriptedStep;
import org.fireflyframework.contentsaga.support.TestBackends;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SagaCoordinatorTest {

    private final List<String> journal = new CopyOnWriteArrayList<>();
    private final List<WorkflowEvent> events = new CopyOnWriteArrayList<>();
    private InMemoryWorkflowRunRepository repository;
    private InProcessEventBus bus;

    @BeforeEach
    void setUp() {
        repository = new InMemoryWorkflowRunRepository();
        bus = new InProcessEventBus();
        bus.subscribeAll(events::add);
    }

    private SagaCoordinator coordinator(CompensationErrorHandler handler) {
        return new SagaCoordinator(repository, bus, new StepInvoker(), handler, 3, Duration.ofMillis(1), Clock.systemUTC());
    }

    private SagaCoordinator coordinator() {
        return coordinator(new LogAndContinueErrorHandler());
    }

    private static WorkflowDefinition workflow(ScriptedStep... steps) {
        WorkflowBuilder builder = WorkflowBuilder.workflow("wf").defaults(TestBackends.fastPolicy());
        for (ScriptedStep step : steps) {
            builder.step(step).add();
        }
        return builder.build();
    }

    private List<ScriptedStep> steps(int count) {
        List<ScriptedStep> steps = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            steps.add(ScriptedStep.named("s" + i, journal));
        }
        return steps;
    }

    @Test
    void successfulRunCompletesEveryStepAndCompensatesNothing() {
        WorkflowDefinition def = workflow(steps(3).toArray(ScriptedStep[]::new));

        WorkflowResult result = coordinator().runWorkflow(def, "input").block();

        assertThat(result).isNotNull();
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.completedSteps()).containsExactly("s0", "s1", "s2");
        assertThat(result.compensatedSteps()).isEmpty();
        assertThat(result.failedStep()).isEmpty();
        assertThat(result.outputs()).containsOnlyKeys("s0", "s1", "s2");

        StepVerifier.create(repository.findStepRecords(result.runId()).map(StepRecord::status))
                .expectNext(StepStatus.COMPLETED, StepStatus.COMPLETED, StepStatus.COMPLETED)
                .verifyComplete();
        StepVerifier.create(repository.findCompensationLogs(result.runId())).verifyComplete();
        StepVerifier.create(coordinator().getRunStatus(result.runId()))
                .assertNext(run -> {
                    assertThat(run.status()).isEqualTo(RunStatus.SUCCEEDED);
                    assertThat(run.completedAt()).isNotNull();
                })
                .verifyComplete();
    }

    @Test
    void stepInputsChainPreviousOutputReferences() {
        WorkflowDefinition def = workflow(steps(2).toArray(ScriptedStep[]::new));

        WorkflowResult result = coordinator().runWorkflow(def, "input").block();

        List<StepRecord> records = repository.findStepRecords(result.runId()).collectList().block();
        assertThat(records.get(0).inputRef()).isNull();
        assertThat(records.get(1).inputRef()).isEqualTo(records.get(0).outputRef());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4})
    void failedRunCompensatesCompletedStepsInReverseOrder(int failingIndex) {
        List<ScriptedStep> steps = steps(5);
        steps.get(failingIndex).failing(new TerminalStepException("boom"));
        WorkflowDefinition def = workflow(steps.toArray(ScriptedStep[]::new));

        WorkflowResult result = coordinator().runWorkflow(def, null).block();

        List<String> expectedCompleted = def.stepNames().subList(0, failingIndex);
        List<String> expectedCompensated = new ArrayList<>(expectedCompleted);
        Collections.reverse(expectedCompensated);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.completedSteps()).containsExactlyElementsOf(expectedCompleted);
        assertThat(result.compensatedSteps()).containsExactlyElementsOf(expectedCompensated);
        assertThat(result.failedStep()).contains("s" + failingIndex);
        assertThat(result.failureKind()).contains(FailureKind.ERRORED);
        assertThat(result.status()).isEqualTo(failingIndex == 0 ? RunStatus.FAILED : RunStatus.COMPENSATED);
        assertThat(journal.stream().filter(e -> e.startsWith("compensate:")).map(e -> e.substring("compensate:".length())))
                .containsExactlyElementsOf(expectedCompensated);
        for (int i = failingIndex + 1; i < 5; i++) {
            assertThat(steps.get(i).executeCalls()).isZero();
        }
    }

    @Test
    void rejectedStepIsCleanedUpButListedNeitherCompletedNorCompensated() {
        List<ScriptedStep> steps = steps(4);
        steps.get(2).rejecting();
        WorkflowDefinition def = workflow(steps.toArray(ScriptedStep[]::new));

        WorkflowResult result = coordinator().runWorkflow(def, null).block();

        assertThat(result.completedSteps()).containsExactly("s0", "s1");
        assertThat(result.compensatedSteps()).containsExactly("s1", "s0");
        assertThat(result.failureKind()).contains(FailureKind.REJECTED);
        assertThat(result.status()).isEqualTo(RunStatus.COMPENSATED);
        assertThat(journal).containsExactly(
                "execute:s0", "execute:s1", "execute:s2",
                "compensate:s2", "compensate:s1", "compensate:s0");

        List<StepRecord> records = repository.findStepRecords(result.runId()).collectList().block();
        assertThat(records).extracting(StepRecord::stepName).containsExactly("s0", "s1", "s2");
        assertThat(records.get(2).status()).isEqualTo(StepStatus.FAILED);
        assertThat(records.get(2).outputRef()).isNotNull();
        assertThat(records.get(0).status()).isEqualTo(StepStatus.COMPENSATED);
        assertThat(records.get(1).status()).isEqualTo(StepStatus.COMPENSATED);

        assertThat(repository.findCompensationLogs(result.runId()).map(CompensationLog::stepName).collectList().block())
                .containsExactly("s2", "s1", "s0");
    }

    @Test
    void erroredStepRecordCarriesTheError() {
        List<ScriptedStep> steps = steps(2);
        steps.get(1).failing(new TerminalStepException("invalid draft"));

        WorkflowResult result = coordinator().runWorkflow(workflow(steps.toArray(ScriptedStep[]::new)), null).block();

        StepRecord failed = repository.findStepRecord(result.runId(), "s1").block();
        assertThat(failed.status()).isEqualTo(StepStatus.FAILED);
        assertThat(failed.outputRef()).isNull();
        assertThat(failed.error()).contains("invalid draft");
        assertThat(result.failureReason()).hasValueSatisfying(reason -> assertThat(reason).contains("invalid draft"));
    }

    @Test
    void eventsFollowExecutionOrderAndTerminalEventComesLast() {
        List<ScriptedStep> steps = steps(3);
        steps.get(2).failing(new TerminalStepException("boom"));

        WorkflowResult result = coordinator().runWorkflow(workflow(steps.toArray(ScriptedStep[]::new)), null).block();

        assertThat(events).extracting(e -> e.channel().topic() + ":" + (e.stepName() == null ? "-" : e.stepName()))
                .containsExactly(
                        "step.completed:s0",
                        "step.completed:s1",
                        "step.failed:s2",
                        "step.compensated:s1",
                        "step.compensated:s0",
                        "run.terminal:-");
        WorkflowEvent failed = events.get(2);
        assertThat(failed.attribute(WorkflowEvent.FAILURE_KIND)).isEqualTo("ERRORED");
        WorkflowEvent terminal = events.get(events.size() - 1);
        assertThat(terminal.runId()).isEqualTo(result.runId());
        assertThat(terminal.attribute(WorkflowEvent.STATUS)).isEqualTo("COMPENSATED");
    }

    @Test
    void compensationFailureDoesNotStopBestEffortRollback() {
        List<ScriptedStep> steps = steps(4);
        steps.get(1).compensationFailing(new IllegalStateException("cannot delete"));
        steps.get(3).failing(new TerminalStepException("boom"));

        WorkflowResult result = coordinator().runWorkflow(workflow(steps.toArray(ScriptedStep[]::new)), null).block();

        assertThat(result.compensatedSteps()).containsExactly("s2", "s1", "s0");
        assertThat(result.compensationFailures()).containsOnlyKeys("s1");
        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(steps.get(0).compensateCalls()).isEqualTo(1);
        assertThat(steps.get(1).compensateCalls()).isEqualTo(2);

        StepRecord s1 = repository.findStepRecord(result.runId(), "s1").block();
        assertThat(s1.status()).isEqualTo(StepStatus.FAILED);
        assertThat(s1.error()).contains("cannot delete");
        assertThat(repository.findCompensationLogs(result.runId()).map(CompensationLog::stepName).collectList().block())
                .containsExactly("s2", "s0");
    }

    @Test
    void failFastHandlerAbortsRemainingCompensations() {
        List<ScriptedStep> steps = steps(4);
        steps.get(1).compensationFailing(new IllegalStateException("cannot delete"));
        steps.get(3).failing(new TerminalStepException("boom"));

        WorkflowResult result = coordinator(new FailFastErrorHandler())
                .runWorkflow(workflow(steps.toArray(ScriptedStep[]::new)), null).block();

        assertThat(result.compensatedSteps()).containsExactly("s2", "s1");
        assertThat(steps.get(0).compensateCalls()).isZero();
        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        StepRecord s0 = repository.findStepRecord(result.runId(), "s0").block();
        assertThat(s0.status()).isEqualTo(StepStatus.COMPLETED);
    }

    @Test
    void unknownRunIsReportedAsNotFound() {
        StepVerifier.create(coordinator().getRunStatus("missing"))
                .expectError(RunNotFoundException.class)
                .verify();
        StepVerifier.create(coordinator().getStepRecords("missing")).verifyComplete();
    }

    @Test
    void manualCompensationRollsBackSucceededRun() {
        List<ScriptedStep> steps = steps(3);
        WorkflowDefinition def = workflow(steps.toArray(ScriptedStep[]::new));
        SagaCoordinator coordinator = coordinator();
        WorkflowResult first = coordinator.runWorkflow(def, null).block();

        StepVerifier.create(coordinator.compensate(def, first.runId()))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isFalse();
                    assertThat(result.compensatedSteps()).containsExactly("s2", "s1", "s0");
                    assertThat(result.status()).isEqualTo(RunStatus.COMPENSATED);
                })
                .verifyComplete();
        assertThat(coordinator.getRunStatus(first.runId()).block().status()).isEqualTo(RunStatus.COMPENSATED);

        StepVerifier.create(coordinator.compensate(def, first.runId()))
                .assertNext(result -> {
                    assertThat(result.compensatedSteps()).isEmpty();
                    assertThat(result.status()).isEqualTo(RunStatus.COMPENSATED);
                })
                .verifyComplete();
        assertThat(steps.get(0).compensateCalls()).isEqualTo(1);
    }

    @Test
    void manualCompensationRefusesRunningRun() {
        WorkflowDefinition def = workflow(steps(1).toArray(ScriptedStep[]::new));
        repository.createRun(WorkflowRun.started("run-live", "wf", Instant.now())).block();

        StepVerifier.create(coordinator().compensate(def, "run-live"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(IllegalStateException.class)
                        .hasMessageContaining("still running"))
                .verify();
    }

    @Test
    void unreachableRunStorageSurfacesAsStorageUnavailable() {
        WorkflowRunRepository broken = mock(WorkflowRunRepository.class);
        when(broken.createRun(any())).thenReturn(Mono.error(new RuntimeException("connection refused")));
        SagaCoordinator coordinator = new SagaCoordinator(broken, bus, new StepInvoker(), new LogAndContinueErrorHandler(),
                3, Duration.ofMillis(1), Clock.systemUTC());
        ScriptedStep step = ScriptedStep.named("s0", journal);

        StepVerifier.create(coordinator.runWorkflow(workflow(step), null))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(StorageUnavailableException.class);
                    assertThat(((StorageUnavailableException) e).getOperation()).isEqualTo("create_run");
                    assertThat(e.getCause()).hasMessage("connection refused");
                })
                .verify();
        verify(broken, times(1)).createRun(any());
        assertThat(step.executeCalls()).isZero();
        assertThat(events).isEmpty();
    }

    @Test
    void concurrentRunsAreIsolated() {
        List<ScriptedStep> steps = steps(3);
        WorkflowDefinition def = workflow(steps.toArray(ScriptedStep[]::new));
        SagaCoordinator coordinator = coordinator();

        List<WorkflowResult> results = Flux.range(0, 8)
                .flatMap(i -> coordinator.runWorkflow(def, i))
                .collectList()
                .block();

        assertThat(results).hasSize(8);
        assertThat(results).extracting(WorkflowResult::runId).doesNotHaveDuplicates();
        assertThat(results).allSatisfy(r -> assertThat(r.completedSteps()).containsExactly("s0", "s1", "s2"));
        assertThat(repository.getRunCount()).isEqualTo(8);
    }
}
