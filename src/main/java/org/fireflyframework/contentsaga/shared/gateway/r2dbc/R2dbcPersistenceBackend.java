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

package org.fireflyframework.contentsaga.shared.gateway.r2dbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.r2dbc.spi.ConnectionFactory;
import org.fireflyframework.contentsaga.saga.persistence.WorkflowRunRepository;
import org.fireflyframework.contentsaga.saga.persistence.impl.R2dbcWorkflowRunRepository;
import org.fireflyframework.contentsaga.shared.gateway.AbstractPersistenceBackend;
import org.fireflyframework.contentsaga.shared.gateway.Artifact;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactLocator;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactNotFoundException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.fireflyframework.contentsaga.shared.gateway.DeleteMode;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGateway;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGatewayException;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Arrays;

/**
 * Durable backend on a Spring {@link DatabaseClient}. Each namespace gets its own table set
 * and the run audit lives in {@code workflow_runs}, {@code step_records} and {@code compensation_logs}.
 */
public class R2dbcPersistenceBackend extends AbstractPersistenceBackend {

    public static final String SCHEMA_LOCATION = "db/content-saga-schema.sql";

    private static final Logger log = LoggerFactory.getLogger(R2dbcPersistenceBackend.class);

    private final ConnectionFactory connectionFactory;
    private final DatabaseClient databaseClient;
    private final TransactionalOperator transactionalOperator;
    private final ObjectMapper objectMapper;
    private final DeleteMode deleteMode;
    private final Clock clock;
    private final R2dbcWorkflowRunRepository runRepository;

    public R2dbcPersistenceBackend(ConnectionFactory connectionFactory, ObjectMapper objectMapper, DeleteMode deleteMode) {
        this(connectionFactory, objectMapper, deleteMode, Clock.systemUTC());
    }

    public R2dbcPersistenceBackend(ConnectionFactory connectionFactory,
                                   ObjectMapper objectMapper,
                                   DeleteMode deleteMode,
                                   Clock clock) {
        this.connectionFactory = connectionFactory;
        this.databaseClient = DatabaseClient.create(connectionFactory);
        this.transactionalOperator = TransactionalOperator.create(new R2dbcTransactionManager(connectionFactory));
        this.objectMapper = objectMapper;
        this.deleteMode = deleteMode != null ? deleteMode : DeleteMode.HARD;
        this.clock = clock;
        this.runRepository = new R2dbcWorkflowRunRepository(databaseClient, clock);
    }

    @Override
    public Mono<Void> initialize() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        return populator.populate(connectionFactory)
                .doOnSuccess(v -> log.info("Content saga schema initialized from {}", SCHEMA_LOCATION));
    }

    @Override
    protected <T extends Artifact> PersistenceGateway<T> createGateway(ModuleNamespace namespace, Class<T> type) {
        return new R2dbcPersistenceGateway<>(databaseClient, transactionalOperator, namespace, type, objectMapper, deleteMode, clock);
    }

    @Override
    public Mono<JsonNode> fetch(ArtifactRef ref) {
        return databaseClient.sql("""
                    SELECT payload FROM %s WHERE artifact_id = :artifactId AND deleted = FALSE
                    """.formatted(ref.namespace().tableName()))
                .bind("artifactId", ref.id())
                .map(row -> row.get("payload", String.class))
                .one()
                .<JsonNode>handle((json, sink) -> {
                    try {
                        sink.next(objectMapper.readTree(json));
                    } catch (JsonProcessingException e) {
                        sink.error(new PersistenceGatewayException(ref.namespace(), "fetch", e));
                    }
                })
                .switchIfEmpty(Mono.error(() -> new ArtifactNotFoundException(ref)));
    }

    @Override
    public Flux<ArtifactLocator> liveArtifacts(String runId) {
        return Flux.fromIterable(Arrays.asList(ModuleNamespace.values()))
                .concatMap(ns -> databaseClient.sql("""
                            SELECT artifact_id, step_name FROM %s WHERE run_id = :runId AND deleted = FALSE
                            """.formatted(ns.tableName()))
                        .bind("runId", runId)
                        .map(row -> new ArtifactLocator(
                                ArtifactRef.of(ns, row.get("artifact_id", String.class)),
                                runId,
                                row.get("step_name", String.class)))
                        .all());
    }

    @Override
    public Mono<Long> liveRowCount(String runId) {
        return Flux.fromIterable(Arrays.asList(ModuleNamespace.values()))
                .concatMap(ns -> ns.childTableName()
                        .map(child -> Flux.just(ns.tableName(), child))
                        .orElse(Flux.just(ns.tableName())))
                .concatMap(table -> databaseClient.sql("""
                            SELECT COUNT(*) AS cnt FROM %s WHERE run_id = :runId AND deleted = FALSE
                            """.formatted(table))
                        .bind("runId", runId)
                        .map(row -> row.get("cnt", Long.class))
                        .one()
                        .defaultIfEmpty(0L))
                .reduce(0L, Long::sum);
    }

    @Override
    public WorkflowRunRepository runRepository() {
        return runRepository;
    }

    @Override
    public PersistenceMode mode() {
        return PersistenceMode.RELATIONAL;
    }

    public DeleteMode deleteMode() {
        return deleteMode;
    }

    public DatabaseClient databaseClient() {
        return databaseClient;
    }
}
