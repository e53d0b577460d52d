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

package org.fireflyframework.contentsaga.saga.persistence;

import org.fireflyframework.contentsaga.saga.core.CompensationLog;
import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.core.WorkflowRun;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Audit storage for runs, step records and compensation logs.
 * <p>
 * Implementations must be thread-safe: concurrent runs write disjoint keys.
 */
public interface WorkflowRunRepository {

    /**
     * Inserts a new run record.
     */
    Mono<Void> createRun(WorkflowRun run);

    /**
     * Replaces status, completion time and error of an existing run.
     */
    Mono<Void> updateRun(WorkflowRun run);

    /**
     * @return the run, or empty when unknown
     */
    Mono<WorkflowRun> findRun(String runId);

    /**
     * Inserts or replaces the record keyed by (runId, stepName).
     */
    Mono<Void> saveStepRecord(StepRecord record);

    Mono<StepRecord> findStepRecord(String runId, String stepName);

    /**
     * @return the step records of a run ordered by sequence index
     */
    Flux<StepRecord> findStepRecords(String runId);

    Mono<Void> appendCompensationLog(CompensationLog entry);

    /**
     * @return compensation logs of a run in the order they were written
     */
    Flux<CompensationLog> findCompensationLogs(String runId);

    /**
     * Removes finished runs (any status but RUNNING) completed more than {@code olderThan} ago,
     * together with their step records and compensation logs.
     *
     * @return the number of runs removed
     */
    Mono<Long> cleanupCompletedRuns(Duration olderThan);

    Mono<Boolean> isHealthy();
}
