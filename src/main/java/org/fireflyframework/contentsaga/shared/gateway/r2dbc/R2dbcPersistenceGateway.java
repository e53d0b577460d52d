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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.contentsaga.shared.exception.ContentSagaException;
import org.fireflyframework.contentsaga.shared.gateway.Artifact;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactNotFoundException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.fireflyframework.contentsaga.shared.gateway.DeleteMode;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGateway;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceGatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.function.Function;

/**
 * Relational gateway slice. Every statement targets only the tables of its own namespace;
 * table names come from {@link ModuleNamespace}, never from callers.
 * <p>
 * {@link #purge} performs a real removal: a {@code DELETE} in {@link DeleteMode#HARD} mode,
 * or an explicit tombstone ({@code deleted = TRUE}) in {@link DeleteMode#SOFT} mode. Tombstoned
 * rows are invisible to {@link #load} and {@link #findLive}. Parent and child rows are written
 * and removed in one transaction.
 */
public class R2dbcPersistenceGateway<T extends Artifact> implements PersistenceGateway<T> {

    private static final Logger log = LoggerFactory.getLogger(R2dbcPersistenceGateway.class);

    private final DatabaseClient databaseClient;
    private final TransactionalOperator transactionalOperator;
    private final ModuleNamespace namespace;
    private final Class<T> type;
    private final ObjectMapper objectMapper;
    private final DeleteMode deleteMode;
    private final Clock clock;

    R2dbcPersistenceGateway(DatabaseClient databaseClient,
                            TransactionalOperator transactionalOperator,
                            ModuleNamespace namespace,
                            Class<T> type,
                            ObjectMapper objectMapper,
                            DeleteMode deleteMode,
                            Clock clock) {
        this.databaseClient = databaseClient;
        this.transactionalOperator = transactionalOperator;
        this.namespace = namespace;
        this.type = type;
        this.objectMapper = objectMapper;
        this.deleteMode = deleteMode;
        this.clock = clock;
    }

    @Override
    public Mono<ArtifactRef> save(T artifact) {
        return Mono.defer(() -> {
                    requireOwned(artifact.artifactNamespace(), "save");
                    if (artifact.getArtifactId() == null || artifact.getArtifactId().isBlank()) {
                        return Mono.error(new IllegalArgumentException("Artifact id must be assigned before save"));
                    }
                    String payload = write(artifact);
                    Mono<Long> parent = databaseClient.sql("""
                                INSERT INTO %s (artifact_id, run_id, step_name, payload, created_at, deleted)
                                VALUES (:artifactId, :runId, :stepName, :payload, :createdAt, FALSE)
                                """.formatted(namespace.tableName()))
                            .bind("artifactId", artifact.getArtifactId())
                            .bind("runId", artifact.getRunId())
                            .bind("stepName", artifact.getStepName())
                            .bind("payload", payload)
                            .bind("createdAt", OffsetDateTime.now(clock))
                            .fetch()
                            .rowsUpdated();
                    return parent.thenMany(insertChildren(artifact))
                            .then(Mono.fromCallable(artifact::toRef))
                            .doOnSuccess(ref -> log.debug("Saved {} artifact {} for run {} ({} child rows)",
                                    namespace.key(), ref.id(), artifact.getRunId(), artifact.ownedChildren().size()));
                })
                .as(transactionalOperator::transactional)
                .onErrorMap(translate("save"));
    }

    private Flux<Long> insertChildren(T artifact) {
        List<?> children = artifact.ownedChildren();
        if (children.isEmpty()) {
            return Flux.empty();
        }
        String childTable = namespace.childTableName().orElseThrow(() ->
                new IllegalStateException("Namespace '" + namespace.key() + "' has no child table"));
        return Flux.range(0, children.size())
                .concatMap(index -> databaseClient.sql("""
                            INSERT INTO %s (child_id, artifact_id, run_id, child_index, payload, deleted)
                            VALUES (:childId, :artifactId, :runId, :childIndex, :payload, FALSE)
                            """.formatted(childTable))
                        .bind("childId", artifact.getArtifactId() + "#" + index)
                        .bind("artifactId", artifact.getArtifactId())
                        .bind("runId", artifact.getRunId())
                        .bind("childIndex", index)
                        .bind("payload", write(children.get(index)))
                        .fetch()
                        .rowsUpdated());
    }

    @Override
    public Mono<T> load(ArtifactRef ref) {
        return Mono.defer(() -> {
                    requireOwned(ref.namespace(), "load");
                    return databaseClient.sql("""
                                SELECT payload FROM %s WHERE artifact_id = :artifactId AND deleted = FALSE
                                """.formatted(namespace.tableName()))
                            .bind("artifactId", ref.id())
                            .map(row -> row.get("payload", String.class))
                            .one();
                })
                .<T>handle((json, sink) -> {
                    try {
                        sink.next(objectMapper.readValue(json, type));
                    } catch (JsonProcessingException e) {
                        sink.error(new PersistenceGatewayException(namespace, "load", e));
                    }
                })
                .switchIfEmpty(Mono.error(() -> new ArtifactNotFoundException(ref)))
                .onErrorMap(translate("load"));
    }

    @Override
    public Mono<Integer> purge(ArtifactRef ref) {
        return Mono.defer(() -> {
                    requireOwned(ref.namespace(), "delete");
                    Mono<Long> children = namespace.childTableName()
                            .map(table -> removeRows(table, ref.id()))
                            .orElse(Mono.just(0L));
                    // children first, then the parent, one statement at a time on the transaction's connection
                    return children.flatMap(childRows -> removeRows(namespace.tableName(), ref.id())
                            .map(parentRows -> childRows + parentRows));
                })
                .as(transactionalOperator::transactional)
                .map(Long::intValue)
                .doOnSuccess(rows -> log.debug("Purged {} artifact {} ({}): {} rows", namespace.key(), ref.id(), deleteMode, rows))
                .onErrorMap(translate("delete"));
    }

    private Mono<Long> removeRows(String table, String artifactId) {
        if (deleteMode == DeleteMode.SOFT) {
            return databaseClient.sql("""
                        UPDATE %s SET deleted = TRUE, deleted_at = :deletedAt
                        WHERE artifact_id = :artifactId AND deleted = FALSE
                        """.formatted(table))
                    .bind("deletedAt", OffsetDateTime.now(clock))
                    .bind("artifactId", artifactId)
                    .fetch()
                    .rowsUpdated();
        }
        return databaseClient.sql("""
                    DELETE FROM %s WHERE artifact_id = :artifactId AND deleted = FALSE
                    """.formatted(table))
                .bind("artifactId", artifactId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<ArtifactRef> findLive(String runId, String stepName) {
        return databaseClient.sql("""
                    SELECT artifact_id FROM %s
                    WHERE run_id = :runId AND step_name = :stepName AND deleted = FALSE
                    """.formatted(namespace.tableName()))
                .bind("runId", runId)
                .bind("stepName", stepName)
                .map(row -> row.get("artifact_id", String.class))
                .first()
                .map(id -> ArtifactRef.of(namespace, id))
                .onErrorMap(translate("findLive"));
    }

    @Override
    public ModuleNamespace namespace() {
        return namespace;
    }

    @Override
    public Class<T> artifactType() {
        return type;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceGatewayException(namespace, "serialize", e);
        }
    }

    private Function<Throwable, Throwable> translate(String operation) {
        return e -> e instanceof ContentSagaException || e instanceof IllegalArgumentException
                ? e
                : new PersistenceGatewayException(namespace, operation, e);
    }
}
