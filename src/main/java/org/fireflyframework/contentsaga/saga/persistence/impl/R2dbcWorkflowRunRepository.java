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

import io.r2dbc.spi.Readable;
import org.fireflyframework.contentsaga.saga.core.CompensationLog;
import org.fireflyframework.contentsaga.saga.core.RunStatus;
import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.core.StepStatus;
import org.fireflyframework.contentsaga.saga.core.WorkflowRun;
import org.fireflyframework.contentsaga.saga.persistence.RunNotFoundException;
import org.fireflyframework.contentsaga.saga.persistence.WorkflowRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Durable run audit storage on the {@code workflow_runs}, {@code step_records} and
 * {@code compensation_logs} tables. Records are kept after the run ends.
 */
public class R2dbcWorkflowRunRepository implements WorkflowRunRepository {

    private static final Logger log = LoggerFactory.getLogger(R2dbcWorkflowRunRepository.class);

    private final DatabaseClient databaseClient;
    private final Clock clock;

    public R2dbcWorkflowRunRepository(DatabaseClient databaseClient, Clock clock) {
        this.databaseClient = databaseClient;
        this.clock = clock;
    }

    @Override
    public Mono<Void> createRun(WorkflowRun run) {
        log.debug("Inserting run {} ({})", run.runId(), run.workflowName());
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("""
                    INSERT INTO workflow_runs (run_id, workflow_name, status, started_at, completed_at, error)
                    VALUES (:runId, :workflowName, :status, :startedAt, :completedAt, :error)
                    """)
                .bind("runId", run.runId())
                .bind("workflowName", run.workflowName())
                .bind("status", run.status().name())
                .bind("startedAt", toOffset(run.startedAt()));
        spec = bindNullable(spec, "completedAt", toOffset(run.completedAt()), OffsetDateTime.class);
        spec = bindNullable(spec, "error", truncate(run.error()), String.class);
        return spec.fetch().rowsUpdated().then();
    }

    @Override
    public Mono<Void> updateRun(WorkflowRun run) {
        log.debug("Updating run {} to {}", run.runId(), run.status());
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("""
                    UPDATE workflow_runs
                    SET status = :status, completed_at = :completedAt, error = :error
                    WHERE run_id = :runId
                    """)
                .bind("runId", run.runId())
                .bind("status", run.status().name());
        spec = bindNullable(spec, "completedAt", toOffset(run.completedAt()), OffsetDateTime.class);
        spec = bindNullable(spec, "error", truncate(run.error()), String.class);
        return spec.fetch().rowsUpdated()
                .flatMap(count -> count > 0 ? Mono.<Void>empty() : Mono.error(new RunNotFoundException(run.runId())));
    }

    @Override
    public Mono<WorkflowRun> findRun(String runId) {
        return databaseClient.sql("""
                    SELECT run_id, workflow_name, status, started_at, completed_at, error
                    FROM workflow_runs WHERE run_id = :runId
                    """)
                .bind("runId", runId)
                .map(R2dbcWorkflowRunRepository::toRun)
                .one();
    }

    @Override
    public Mono<Void> saveStepRecord(StepRecord record) {
        log.debug("Saving step record {}/{} as {}", record.runId(), record.stepName(), record.status());
        OffsetDateTime now = OffsetDateTime.now(clock);
        DatabaseClient.GenericExecuteSpec update = databaseClient.sql("""
                    UPDATE step_records
                    SET sequence_index = :sequenceIndex, status = :status, input_ref = :inputRef,
                        output_ref = :outputRef, error = :error, updated_at = :updatedAt
                    WHERE run_id = :runId AND step_name = :stepName
                    """);
        return bindStepRecord(update, record, now).fetch().rowsUpdated()
                .flatMap(count -> {
                    if (count > 0) {
                        return Mono.<Void>empty();
                    }
                    DatabaseClient.GenericExecuteSpec insert = databaseClient.sql("""
                                INSERT INTO step_records
                                    (run_id, step_name, sequence_index, status, input_ref, output_ref, error, updated_at)
                                VALUES (:runId, :stepName, :sequenceIndex, :status, :inputRef, :outputRef, :error, :updatedAt)
                                """);
                    return bindStepRecord(insert, record, now).fetch().rowsUpdated().then();
                });
    }

    @Override
    public Mono<StepRecord> findStepRecord(String runId, String stepName) {
        return databaseClient.sql("""
                    SELECT run_id, step_name, sequence_index, status, input_ref, output_ref, error
                    FROM step_records WHERE run_id = :runId AND step_name = :stepName
                    """)
                .bind("runId", runId)
                .bind("stepName", stepName)
                .map(R2dbcWorkflowRunRepository::toStepRecord)
                .one();
    }

    @Override
    public Flux<StepRecord> findStepRecords(String runId) {
        return databaseClient.sql("""
                    SELECT run_id, step_name, sequence_index, status, input_ref, output_ref, error
                    FROM step_records WHERE run_id = :runId
                    ORDER BY sequence_index
                    """)
                .bind("runId", runId)
                .map(R2dbcWorkflowRunRepository::toStepRecord)
                .all();
    }

    @Override
    public Mono<Void> appendCompensationLog(CompensationLog entry) {
        log.debug("Appending compensation log {}/{} rows={}", entry.runId(), entry.stepName(), entry.rowsAffected());
        return databaseClient.sql("""
                    INSERT INTO compensation_logs (log_id, run_id, step_name, compensated_at, rows_affected, entry_index)
                    VALUES (:logId, :runId, :stepName, :compensatedAt, :rowsAffected,
                            (SELECT COUNT(*) FROM compensation_logs WHERE run_id = :runId))
                    """)
                .bind("logId", UUID.randomUUID().toString())
                .bind("runId", entry.runId())
                .bind("stepName", entry.stepName())
                .bind("compensatedAt", toOffset(entry.compensatedAt()))
                .bind("rowsAffected", entry.rowsAffected())
                .fetch()
                .rowsUpdated()
                .then();
    }

    @Override
    public Flux<CompensationLog> findCompensationLogs(String runId) {
        return databaseClient.sql("""
                    SELECT run_id, step_name, compensated_at, rows_affected
                    FROM compensation_logs WHERE run_id = :runId
                    ORDER BY entry_index
                    """)
                .bind("runId", runId)
                .map(row -> new CompensationLog(
                        row.get("run_id", String.class),
                        row.get("step_name", String.class),
                        toInstant(row.get("compensated_at", OffsetDateTime.class)),
                        row.get("rows_affected", Integer.class)))
                .all();
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return databaseClient.sql("SELECT COUNT(*) AS cnt FROM workflow_runs")
                .map(row -> row.get("cnt", Long.class))
                .one()
                .map(count -> true)
                .onErrorResume(e -> {
                    log.warn("Run storage health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Removes the audit rows of old finished runs. Module artifacts are durable deliverables
     * in relational mode and are left in place.
     */
    @Override
    public Mono<Long> cleanupCompletedRuns(Duration olderThan) {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(olderThan);
        log.debug("Cleaning up finished runs completed before {}", cutoff);
        String expired = """
                SELECT run_id FROM workflow_runs
                WHERE status <> 'RUNNING' AND completed_at IS NOT NULL AND completed_at < :cutoff
                """;
        return databaseClient.sql("DELETE FROM compensation_logs WHERE run_id IN (" + expired + ")")
                .bind("cutoff", cutoff)
                .fetch().rowsUpdated()
                .then(databaseClient.sql("DELETE FROM step_records WHERE run_id IN (" + expired + ")")
                        .bind("cutoff", cutoff)
                        .fetch().rowsUpdated())
                .then(databaseClient.sql("""
                            DELETE FROM workflow_runs
                            WHERE status <> 'RUNNING' AND completed_at IS NOT NULL AND completed_at < :cutoff
                            """)
                        .bind("cutoff", cutoff)
                        .fetch().rowsUpdated())
                .doOnNext(removed -> log.debug("Removed {} finished runs", removed));
    }

    private static DatabaseClient.GenericExecuteSpec bindStepRecord(DatabaseClient.GenericExecuteSpec spec,
                                                                    StepRecord record,
                                                                    OffsetDateTime now) {
        DatabaseClient.GenericExecuteSpec s = spec
                .bind("runId", record.runId())
                .bind("stepName", record.stepName())
                .bind("sequenceIndex", record.sequenceIndex())
                .bind("status", record.status().name())
                .bind("updatedAt", now);
        s = bindNullable(s, "inputRef", record.inputRef(), String.class);
        s = bindNullable(s, "outputRef", record.outputRef(), String.class);
        return bindNullable(s, "error", truncate(record.error()), String.class);
    }

    private static <T> DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec,
                                                                      String name, T value, Class<T> type) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, type);
    }

    private static WorkflowRun toRun(Readable row) {
        return new WorkflowRun(
                row.get("run_id", String.class),
                row.get("workflow_name", String.class),
                RunStatus.valueOf(row.get("status", String.class)),
                toInstant(row.get("started_at", OffsetDateTime.class)),
                toInstant(row.get("completed_at", OffsetDateTime.class)),
                row.get("error", String.class));
    }

    private static StepRecord toStepRecord(Readable row) {
        return new StepRecord(
                row.get("run_id", String.class),
                row.get("step_name", String.class),
                row.get("sequence_index", Integer.class),
                StepStatus.valueOf(row.get("status", String.class)),
                row.get("input_ref", String.class),
                row.get("output_ref", String.class),
                row.get("error", String.class));
    }

    static String truncate(String value) {
        if (value == null || value.length() <= 2000) {
            return value;
        }
        return value.substring(0, 2000);
    }

    static OffsetDateTime toOffset(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }
}
