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
import org.fireflyframework.contentsaga.saga.core.RunStatus;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.core.WorkflowResult;
import org.fireflyframework.contentsaga.saga.core.WorkflowRun;
import org.fireflyframework.contentsaga.saga.events.EventBus;
import org.fireflyframework.contentsaga.saga.events.EventChannel;
import org.fireflyframework.contentsaga.saga.events.WorkflowEvent;
import org.fireflyframework.contentsaga.saga.persistence.RunNotFoundException;
import org.fireflyframework.contentsaga.saga.persistence.WorkflowRunRepository;
import org.fireflyframework.contentsaga.saga.registry.StepDefinition;
import org.fireflyframework.contentsaga.saga.registry.WorkflowDefinition;
import org.fireflyframework.contentsaga.shared.engine.compensation.CompensationErrorHandler;
import org.fireflyframework.contentsaga.shared.engine.compensation.CompensationErrorHandlerFactory;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives a workflow definition step by step and compensates on failure.
 * <p>
 * Steps execute strictly in definition order, one at a time. A rejected or errored step
 * stops the forward pass; the steps that completed before it are then compensated in reverse
 * order. Every run ends with a terminal run record and a {@link EventChannel#RUN_TERMINAL}
 * event published after all step events of that run.
 * <p>
 * Step failures never surface as errors of the returned {@code Mono}: they are reported in
 * the {@link WorkflowResult}. The only raw error is
 * {@link org.fireflyframework.contentsaga.shared.exception.StorageUnavailableException},
 * raised when the run audit storage stays unreachable.
 */
public class SagaCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SagaCoordinator.class);

    private final WorkflowRunRepository repository;
    private final EventBus eventBus;
    private final StepInvoker invoker;
    private final SagaCompensator compensator;
    private final StorageGuard storage;
    private final Clock clock;
    private final Supplier<String> runIds;

    public SagaCoordinator(WorkflowRunRepository repository, EventBus eventBus) {
        this(repository, eventBus, new StepInvoker(), CompensationErrorHandlerFactory.defaultHandler(),
                3, Duration.ofMillis(50), Clock.systemUTC());
    }

    public SagaCoordinator(WorkflowRunRepository repository,
                           EventBus eventBus,
                           StepInvoker invoker,
                           CompensationErrorHandler errorHandler,
                           int storageMaxAttempts,
                           Duration storageBackoff,
                           Clock clock) {
        this(repository, eventBus, invoker, errorHandler, storageMaxAttempts, storageBackoff, clock,
                () -> UUID.randomUUID().toString());
    }

    public SagaCoordinator(WorkflowRunRepository repository,
                           EventBus eventBus,
                           StepInvoker invoker,
                           CompensationErrorHandler errorHandler,
                           int storageMaxAttempts,
                           Duration storageBackoff,
                           Clock clock,
                           Supplier<String> runIds) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.storage = new StorageGuard(storageMaxAttempts, storageBackoff);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.runIds = Objects.requireNonNull(runIds, "runIds");
        this.compensator = new SagaCompensator(repository, eventBus, invoker,
                Objects.requireNonNull(errorHandler, "errorHandler"), storage, clock);
    }

    /**
     * Executes the workflow for the given input. Always completes with a result unless the
     * run audit storage is unavailable.
     */
    public Mono<WorkflowResult> runWorkflow(WorkflowDefinition definition, Object initialInput) {
        Objects.requireNonNull(definition, "definition");
        return Mono.defer(() -> {
            RunExecution run = new RunExecution(runIds.get(), definition, initialInput, clock.instant());
            WorkflowRun created = WorkflowRun.started(run.runId, definition.name(), run.startedAt);
            return storage.guard("create_run", repository.createRun(created))
                    .then(Mono.<Void>fromRunnable(() -> {
                        run.transition(CoordinatorState.RUNNING);
                        log.info("{{\"saga_event\":\"run_started\",\"run_id\":\"{}\",\"workflow_name\":\"{}\",\"steps\":\"{}\"}}",
                                run.runId, definition.name(), definition.stepNames());
                    }))
                    .thenMany(Flux.fromIterable(definition.steps())
                            .concatMap(sd -> run.hasFailed() ? Mono.<Void>empty() : executeStep(run, sd)))
                    .then(Mono.defer(() -> run.hasFailed() ? compensator.compensate(run) : Mono.<Void>empty()))
                    .then(Mono.defer(() -> finish(run, created)));
        });
    }

    private Mono<Void> executeStep(RunExecution run, StepDefinition sd) {
        StepContext ctx = run.contextFor(sd);
        Object input = run.nextInput();
        StepRecord pending = StepRecord.pending(run.runId, sd.name, sd.sequenceIndex, run.nextInputRef());
        StepRecord executing = pending.executing();
        run.record(executing);
        return storage.guard("save_step_record", repository.saveStepRecord(pending))
                .then(storage.guard("save_step_record", repository.saveStepRecord(executing)))
                .then(invoker.execute(sd, ctx, input))
                .flatMap(execution -> switch (execution.kind()) {
                    case COMPLETED -> onCompleted(run, executing, execution);
                    case REJECTED -> onRejected(run, sd, executing, execution);
                    case ERRORED -> onErrored(run, executing, execution);
                });
    }

    private Mono<Void> onCompleted(RunExecution run, StepRecord executing, StepExecution execution) {
        ArtifactRef ref = execution.outcome().outputRef();
        StepRecord completed = executing.completed(ref.toString());
        run.record(completed);
        return storage.guard("save_step_record", repository.saveStepRecord(completed))
                .then(Mono.<Void>fromRunnable(() -> {
                    run.markCompleted(completed.stepName(), ref);
                    eventBus.publish(WorkflowEvent.on(EventChannel.STEP_COMPLETED, run.runId, run.definition.name())
                            .step(completed.stepName())
                            .at(clock.instant())
                            .attr(WorkflowEvent.ARTIFACT_REF, ref)
                            .attr(WorkflowEvent.ATTEMPTS, execution.attempts())
                            .build());
                }));
    }

    private Mono<Void> onRejected(RunExecution run, StepDefinition sd, StepRecord executing, StepExecution execution) {
        ArtifactRef ref = execution.outcome().outputRef();
        run.markFailed(sd.name, execution.failureKind(), execution.reason());
        StepRecord failed = executing.failed(ref.toString(), execution.reason());
        run.record(failed);
        return compensator.discardRejected(run, sd, ref)
                .then(storage.guard("save_step_record", repository.saveStepRecord(failed)))
                .then(Mono.<Void>fromRunnable(() -> publishFailure(run, failed, execution, ref)));
    }

    private Mono<Void> onErrored(RunExecution run, StepRecord executing, StepExecution execution) {
        run.markFailed(executing.stepName(), execution.failureKind(), execution.reason());
        StepRecord failed = executing.failed(null, execution.reason());
        run.record(failed);
        return storage.guard("save_step_record", repository.saveStepRecord(failed))
                .then(Mono.<Void>fromRunnable(() -> publishFailure(run, failed, execution, null)));
    }

    private void publishFailure(RunExecution run, StepRecord failed, StepExecution execution, ArtifactRef ref) {
        eventBus.publish(WorkflowEvent.on(EventChannel.STEP_FAILED, run.runId, run.definition.name())
                .step(failed.stepName())
                .at(clock.instant())
                .attr(WorkflowEvent.ARTIFACT_REF, ref)
                .attr(WorkflowEvent.FAILURE_KIND, execution.failureKind())
                .attr(WorkflowEvent.ATTEMPTS, execution.attempts())
                .attr(WorkflowEvent.ERROR, execution.reason())
                .build());
    }

    private Mono<WorkflowResult> finish(RunExecution run, WorkflowRun created) {
        RunStatus status;
        if (run.hasFailed()) {
            status = run.compensationStatus();
        } else {
            run.transition(CoordinatorState.SUCCEEDED);
            status = RunStatus.SUCCEEDED;
        }
        Instant completedAt = clock.instant();
        WorkflowRun finished = created.finish(status, completedAt, run.failureSummary());
        return storage.guard("update_run", repository.updateRun(finished))
                .then(Mono.fromCallable(() -> {
                    publishTerminal(run, status, completedAt, finished.error());
                    WorkflowResult result = run.toResult(status, completedAt);
                    log.info("{{\"saga_event\":\"run_completed\",\"run_id\":\"{}\",\"workflow_name\":\"{}\",\"status\":\"{}\",\"completed_steps\":\"{}\",\"compensated_steps\":\"{}\",\"latency_ms\":\"{}\"}}",
                            run.runId, run.definition.name(), status, result.completedSteps(), result.compensatedSteps(),
                            result.duration().toMillis());
                    return result;
                }));
    }

    private void publishTerminal(RunExecution run, RunStatus status, Instant at, String error) {
        eventBus.publish(WorkflowEvent.on(EventChannel.RUN_TERMINAL, run.runId, run.definition.name())
                .at(at)
                .attr(WorkflowEvent.STATUS, status)
                .attr(WorkflowEvent.ERROR, error)
                .build());
    }

    /**
     * Compensates the steps of a finished run whose records are still COMPLETED, in reverse
     * sequence order. A run with nothing left to compensate keeps its status.
     *
     * @throws IllegalStateException (as an error signal) when the run is still RUNNING
     */
    public Mono<WorkflowResult> compensate(WorkflowDefinition definition, String runId) {
        Objects.requireNonNull(definition, "definition");
        return getRunStatus(runId)
                .flatMap(existing -> {
                    if (!existing.isTerminal()) {
                        return Mono.error(new IllegalStateException("Run " + runId + " is still running"));
                    }
                    if (!existing.workflowName().equals(definition.name())) {
                        return Mono.error(new IllegalArgumentException("Run " + runId + " belongs to workflow '"
                                + existing.workflowName() + "', not '" + definition.name() + "'"));
                    }
                    return storage.guardMany("find_step_records", repository.findStepRecords(runId))
                            .collectList()
                            .flatMap(records -> {
                                RunExecution run = RunExecution.restore(existing, definition, records);
                                run.markManualCompensation("Compensated on request");
                                if (run.completedSteps().isEmpty()) {
                                    log.info("{{\"saga_event\":\"manual_compensation_noop\",\"run_id\":\"{}\",\"status\":\"{}\"}}",
                                            runId, existing.status());
                                    return Mono.just(run.toResult(existing.status(), existing.completedAt()));
                                }
                                log.info("{{\"saga_event\":\"manual_compensation_started\",\"run_id\":\"{}\",\"steps\":\"{}\"}}",
                                        runId, run.completedSteps());
                                return compensator.compensate(run)
                                        .then(Mono.defer(() -> finishManual(run, existing)));
                            });
                });
    }

    private Mono<WorkflowResult> finishManual(RunExecution run, WorkflowRun existing) {
        RunStatus status = run.compensationStatus();
        Instant completedAt = clock.instant();
        WorkflowRun updated = existing.finish(status, completedAt, run.failureSummary());
        return storage.guard("update_run", repository.updateRun(updated))
                .then(Mono.fromCallable(() -> {
                    publishTerminal(run, status, completedAt, updated.error());
                    return run.toResult(status, completedAt);
                }));
    }

    /**
     * @return the run record, or an error signal with {@link RunNotFoundException}
     */
    public Mono<WorkflowRun> getRunStatus(String runId) {
        return storage.guard("find_run", repository.findRun(runId))
                .switchIfEmpty(Mono.error(() -> new RunNotFoundException(runId)));
    }

    /**
     * @return step records of the run ordered by sequence index; empty for unknown runs
     */
    public Flux<StepRecord> getStepRecords(String runId) {
        return storage.guardMany("find_step_records", repository.findStepRecords(runId));
    }

    public Flux<CompensationLog> getCompensationLogs(String runId) {
        return storage.guardMany("find_compensation_logs", repository.findCompensationLogs(runId));
    }
}
