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

package org.fireflyframework.contentsaga.saga.persistence.impl;

import org.fireflyframework.contentsaga.saga.core.CompensationLog;
import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.core.WorkflowRun;
import org.fireflyframework.contentsaga.saga.persistence.RunNotFoundException;
import org.fireflyframework.contentsaga.saga.persistence.WorkflowRunRepository;
import org.fireflyframework.contentsaga.saga.core.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Process-local run audit storage. State lives only as long as the process, and finished
 * runs are dropped by {@link #cleanupCompletedRuns(Duration)}. Listeners registered with
 * {@link #onRunRemoved(Consumer)} hear about every removed run so that owners of related
 * state can release it too.
 */
public class InMemoryWorkflowRunRepository implements WorkflowRunRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowRunRepository.class);

    private final ConcurrentMap<String, WorkflowRun> runs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConcurrentMap<String, StepRecord>> stepRecords = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<CompensationLog>> compensationLogs = new ConcurrentHashMap<>();
    private final List<Consumer<String>> removalListeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryWorkflowRunRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryWorkflowRunRepository(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a callback invoked with the id of every run removed by cleanup.
     */
    public void onRunRemoved(Consumer<String> listener) {
        removalListeners.add(listener);
    }

    @Override
    public Mono<Void> createRun(WorkflowRun run) {
        return Mono.fromRunnable(() -> {
            log.debug("Creating run {} ({}) in memory", run.runId(), run.workflowName());
            if (runs.putIfAbsent(run.runId(), run) != null) {
                throw new IllegalStateException("Run already exists: " + run.runId());
            }
        });
    }

    @Override
    public Mono<Void> updateRun(WorkflowRun run) {
        return Mono.fromRunnable(() -> {
            log.debug("Updating run {} to {} in memory", run.runId(), run.status());
            if (runs.replace(run.runId(), run) == null) {
                throw new RunNotFoundException(run.runId());
            }
        });
    }

    @Override
    public Mono<WorkflowRun> findRun(String runId) {
        return Mono.fromCallable(() -> runs.get(runId));
    }

    @Override
    public Mono<Void> saveStepRecord(StepRecord record) {
        return Mono.fromRunnable(() -> {
            log.debug("Saving step record {}/{} as {} in memory", record.runId(), record.stepName(), record.status());
            stepRecords.computeIfAbsent(record.runId(), id -> new ConcurrentHashMap<>())
                    .put(record.stepName(), record);
        });
    }

    @Override
    public Mono<StepRecord> findStepRecord(String runId, String stepName) {
        return Mono.fromCallable(() -> {
            ConcurrentMap<String, StepRecord> records = stepRecords.get(runId);
            return records != null ? records.get(stepName) : null;
        });
    }

    @Override
    public Flux<StepRecord> findStepRecords(String runId) {
        return Flux.defer(() -> {
            ConcurrentMap<String, StepRecord> records = stepRecords.get(runId);
            if (records == null) {
                return Flux.empty();
            }
            return Flux.fromIterable(records.values().stream()
                    .sorted(Comparator.comparingInt(StepRecord::sequenceIndex))
                    .toList());
        });
    }

    @Override
    public Mono<Void> appendCompensationLog(CompensationLog entry) {
        return Mono.fromRunnable(() -> {
            log.debug("Appending compensation log {}/{} rows={} in memory", entry.runId(), entry.stepName(), entry.rowsAffected());
            compensationLogs.computeIfAbsent(entry.runId(), id -> new CopyOnWriteArrayList<>()).add(entry);
        });
    }

    @Override
    public Flux<CompensationLog> findCompensationLogs(String runId) {
        return Flux.defer(() -> Flux.fromIterable(compensationLogs.getOrDefault(runId, List.of())));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    @Override
    public Mono<Long> cleanupCompletedRuns(Duration olderThan) {
        return Mono.fromCallable(() -> {
            Instant cutoff = clock.instant().minus(olderThan);
            log.debug("Cleaning up finished runs completed before {}", cutoff);
            List<String> expired = runs.values().stream()
                    .filter(run -> run.status() != RunStatus.RUNNING)
                    .filter(run -> run.completedAt() != null && run.completedAt().isBefore(cutoff))
                    .map(WorkflowRun::runId)
                    .toList();
            long removed = 0;
            for (String runId : expired) {
                if (runs.remove(runId) == null) {
                    continue;
                }
                stepRecords.remove(runId);
                compensationLogs.remove(runId);
                removalListeners.forEach(listener -> listener.accept(runId));
                removed++;
            }
            log.debug("Removed {} finished runs from memory", removed);
            return removed;
        });
    }

    public int getRunCount() {
        return runs.size();
    }

    /**
     * Clears all state. Intended for tests.
     */
    public void clear() {
        runs.clear();
        stepRecords.clear();
        compensationLogs.clear();
        log.debug("Cleared in-memory run storage");
    }
}
