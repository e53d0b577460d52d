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

package org.fireflyframework.contentsaga.saga.consistency;

import org.fireflyframework.contentsaga.saga.core.StepRecord;
import org.fireflyframework.contentsaga.saga.core.StepStatus;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactLocator;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Cross-checks the step records of a run against the live artifacts of every module.
 * A run that finished cleanly, succeeded or compensated, yields no violations.
 */
public class ConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyChecker.class);

    private final PersistenceBackend backend;

    public ConsistencyChecker(PersistenceBackend backend) {
        this.backend = backend;
    }

    public Flux<ConsistencyViolation> check(String runId) {
        Mono<List<StepRecord>> records = backend.runRepository().findStepRecords(runId).collectList();
        Mono<List<ArtifactLocator>> live = backend.liveArtifacts(runId).collectList();
        return Mono.zip(records, live)
                .flatMapMany(t -> Flux.fromIterable(compare(runId, t.getT1(), t.getT2())))
                .doOnNext(v -> log.warn("{{\"saga_event\":\"consistency_violation\",\"run_id\":\"{}\",\"type\":\"{}\",\"step_name\":\"{}\",\"artifact_ref\":\"{}\"}}",
                        v.runId(), v.type(), v.stepName(), v.artifactRef()));
    }

    private List<ConsistencyViolation> compare(String runId, List<StepRecord> records, List<ArtifactLocator> live) {
        Map<String, StepRecord> byStep = records.stream()
                .collect(Collectors.toMap(StepRecord::stepName, Function.identity()));
        Set<String> liveRefs = live.stream().map(l -> l.ref().toString()).collect(Collectors.toSet());

        List<ConsistencyViolation> orphans = live.stream()
                .filter(l -> {
                    StepRecord r = byStep.get(l.stepName());
                    return r == null || r.status() != StepStatus.COMPLETED || !Objects.equals(r.outputRef(), l.ref().toString());
                })
                .map(l -> new ConsistencyViolation(runId, ConsistencyViolation.Type.ORPHANED_ARTIFACT, l.stepName(),
                        l.ref().toString(), describe(byStep.get(l.stepName()))))
                .toList();

        List<ConsistencyViolation> missing = records.stream()
                .filter(r -> r.status() == StepStatus.COMPLETED && r.outputRef() != null && !liveRefs.contains(r.outputRef()))
                .map(r -> new ConsistencyViolation(runId, ConsistencyViolation.Type.MISSING_ARTIFACT, r.stepName(),
                        r.outputRef(), "step record is COMPLETED but the artifact is gone"))
                .toList();

        return Stream.concat(orphans.stream(), missing.stream()).toList();
    }

    private static String describe(StepRecord record) {
        if (record == null) {
            return "no step record";
        }
        return "step record is " + record.status()
                + (record.outputRef() != null ? " with output " + record.outputRef() : "");
    }
}
