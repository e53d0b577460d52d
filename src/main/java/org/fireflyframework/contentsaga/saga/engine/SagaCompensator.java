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
import org.fireflyframework.contentsaga.saga.core.CompensationOutcome;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.events.EventBus;
import org.fireflyframework.contentsaga.saga.events.EventChannel;
import org.fireflyframework.contentsaga.saga.events.WorkflowEvent;
import org.fireflyframework.contentsaga.saga.persistence.WorkflowRunRepository;
import org.fireflyframework.contentsaga.saga.registry.StepDefinition;
import org.fireflyframework.contentsaga.shared.engine.compensation.CompensationErrorHandler;
import org.fireflyframework.contentsaga.shared.exception.CompensationException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rolls back the completed steps of a run in reverse completion order.
 * <p>
 * Every completed step is attempted; a failing compensation is recorded and handed to the
 * {@link CompensationErrorHandler}, which decides whether the remaining steps are still visited.
 */
final class SagaCompensator {

    private static final Logger log = LoggerFactory.getLogger(SagaCompensator.class);

    private final WorkflowRunRepository repository;
    private final EventBus eventBus;
    private final StepInvoker invoker;
    private final CompensationErrorHandler errorHandler;
    private final StorageGuard storage;
    private final Clock clock;

    private record Attempt(CompensationOutcome outcome, Throwable error, int attempts) {
        boolean succeeded() {
            return error == null;
        }
    }

    SagaCompensator(WorkflowRunRepository repository, EventBus eventBus, StepInvoker invoker,
                    CompensationErrorHandler errorHandler, StorageGuard storage, Clock clock) {
        this.repository = repository;
        this.eventBus = eventBus;
        this.invoker = invoker;
        this.errorHandler = errorHandler;
        this.storage = storage;
        this.clock = clock;
    }

    Mono<Void> compensate(RunExecution run) {
        return Mono.defer(() -> {
            run.transition(CoordinatorState.COMPENSATING);
            List<String> reversed = new ArrayList<>(run.completedSteps());
            Collections.reverse(reversed);
            log.info("{{\"saga_event\":\"compensation_started\",\"run_id\":\"{}\",\"workflow_name\":\"{}\",\"steps\":\"{}\",\"strategy\":\"{}\"}}",
                    run.runId, run.definition.name(), reversed, errorHandler.getStrategyName());
            return Flux.fromIterable(reversed)
                    .concatMap(stepName -> run.isCompensationAborted() ? Mono.<Void>empty() : compensateOne(run, stepName))
                    .then(Mono.<Void>fromRunnable(() -> run.transition(CoordinatorState.COMPENSATED)));
        });
    }

    private Mono<Void> compensateOne(RunExecution run, String stepName) {
        StepDefinition sd = run.definition.step(stepName)
                .orElseThrow(() -> new IllegalStateException("Step '" + stepName + "' is not part of " + run.definition.name()));
        ArtifactRef ref = run.outputOf(stepName);
        StepContext ctx = run.contextFor(sd);
        StepRecord compensating = run.recordOf(stepName).compensating();
        run.record(compensating);
        return storage.guard("save_step_record", repository.saveStepRecord(compensating))
                .then(attempt(sd, ctx, ref))
                .flatMap(attempt -> {
                    run.markCompensated(stepName);
                    if (attempt.succeeded()) {
                        return onCompensated(run, compensating, attempt.outcome());
                    }
                    return onCompensationFailed(run, compensating, ctx, attempt);
                });
    }

    /**
     * Removes the artifact of a step that reported a business rejection. The step is not
     * listed among the compensated steps, but the removal is logged like any compensation.
     */
    Mono<Void> discardRejected(RunExecution run, StepDefinition sd, ArtifactRef ref) {
        StepContext ctx = run.contextFor(sd);
        return attempt(sd, ctx, ref)
                .flatMap(attempt -> {
                    if (attempt.succeeded()) {
                        return storage.guard("append_compensation_log", repository.appendCompensationLog(
                                new CompensationLog(run.runId, sd.name, clock.instant(), attempt.outcome().rowsRemoved())));
                    }
                    CompensationException failure = new CompensationException(run.runId, sd.name, attempt.error());
                    log.error("{{\"saga_event\":\"rejected_artifact_cleanup_failed\",\"run_id\":\"{}\",\"step_name\":\"{}\",\"artifact_ref\":\"{}\",\"error_message\":\"{}\"}}",
                            run.runId, sd.name, ref, failure.getMessage());
                    run.markCompensationFailed(sd.name, failure.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Attempt> attempt(StepDefinition sd, StepContext ctx, ArtifactRef ref) {
        AtomicInteger attempts = new AtomicInteger();
        return invoker.compensate(sd, ctx, ref, attempts)
                .map(outcome -> new Attempt(outcome, null, attempts.get()))
                .onErrorResume(err -> Mono.just(new Attempt(null, err, attempts.get())));
    }

    private Mono<Void> onCompensated(RunExecution run, StepRecord compensating, CompensationOutcome outcome) {
        StepRecord done = compensating.compensated();
        run.record(done);
        CompensationLog entry = new CompensationLog(run.runId, done.stepName(), clock.instant(), outcome.rowsRemoved());
        return storage.guard("append_compensation_log", repository.appendCompensationLog(entry))
                .then(storage.guard("save_step_record", repository.saveStepRecord(done)))
                .then(Mono.<Void>fromRunnable(() -> eventBus.publish(WorkflowEvent.on(EventChannel.STEP_COMPENSATED, run.runId, run.definition.name())
                        .step(done.stepName())
                        .at(entry.compensatedAt())
                        .attr(WorkflowEvent.ARTIFACT_REF, done.outputRef())
                        .attr(WorkflowEvent.ROWS_AFFECTED, outcome.rowsRemoved())
                        .build())));
    }

    private Mono<Void> onCompensationFailed(RunExecution run, StepRecord compensating, StepContext ctx, Attempt attempt) {
        CompensationException failure = new CompensationException(run.runId, compensating.stepName(), attempt.error());
        run.markCompensationFailed(compensating.stepName(), failure.getMessage());
        StepRecord failed = compensating.failed(compensating.outputRef(), failure.getMessage());
        run.record(failed);
        return storage.guard("save_step_record", repository.saveStepRecord(failed))
                .then(Mono.<Void>fromRunnable(() -> eventBus.publish(WorkflowEvent.on(EventChannel.STEP_FAILED, run.runId, run.definition.name())
                        .step(failed.stepName())
                        .at(clock.instant())
                        .attr(WorkflowEvent.ARTIFACT_REF, failed.outputRef())
                        .attr(WorkflowEvent.FAILURE_KIND, "COMPENSATION")
                        .attr(WorkflowEvent.ATTEMPTS, attempt.attempts())
                        .attr(WorkflowEvent.ERROR, failure.getMessage())
                        .build())))
                .then(Mono.defer(() -> errorHandler.handleError(failed.stepName(), failure, ctx, attempt.attempts())))
                .doOnNext(result -> {
                    if (result == CompensationErrorHandler.CompensationErrorResult.FAIL_SAGA) {
                        log.error("{{\"saga_event\":\"compensation_aborted\",\"run_id\":\"{}\",\"step_name\":\"{}\",\"strategy\":\"{}\"}}",
                                run.runId, failed.stepName(), errorHandler.getStrategyName());
                        run.abortCompensation();
                    }
                })
                .then();
    }
}
