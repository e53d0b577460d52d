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

import org.fireflyframework.contentsaga.saga.core.CompensationOutcome;
import org.fireflyframework.contentsaga.saga.core.StepContext;
import org.fireflyframework.contentsaga.saga.core.StepOutcome;
import org.fireflyframework.contentsaga.saga.registry.StepDefinition;
import org.fireflyframework.contentsaga.shared.exception.TerminalStepException;
import org.fireflyframework.contentsaga.shared.gateway.ArtifactRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Invokes step ports with timeout, retry and backoff semantics.
 * <p>
 * Execute calls retry only recoverable errors and escalate to a terminal error once the
 * attempts are used up, so every call resolves to a definite {@link StepExecution}.
 * Compensate calls retry any error; compensation is idempotent.
 */
public class StepInvoker {

    private static final Logger log = LoggerFactory.getLogger(StepInvoker.class);

    private final StepFailureClassifier classifier;

    public StepInvoker() {
        this(new StepFailureClassifier());
    }

    public StepInvoker(StepFailureClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Never errors; failures are folded into the returned execution.
     */
    public Mono<StepExecution> execute(StepDefinition sd, StepContext ctx, Object input) {
        AtomicInteger attempts = new AtomicInteger();
        return attemptExecute(sd, ctx, input, attempts)
                .map(outcome -> outcome.isRejected()
                        ? StepExecution.rejected(outcome, attempts.get())
                        : StepExecution.completed(outcome, attempts.get()))
                .onErrorResume(err -> Mono.just(StepExecution.errored(escalate(sd, err, attempts.get()), attempts.get())));
    }

    private Mono<StepOutcome> attemptExecute(StepDefinition sd, StepContext ctx, Object input, AtomicInteger attempts) {
        return Mono.defer(() -> sd.port.execute(ctx, input))
                .transform(m -> isPositive(sd.timeout) ? m.timeout(sd.timeout) : m)
                .switchIfEmpty(Mono.error(() -> new TerminalStepException("Step '" + sd.name + "' returned no outcome")))
                .onErrorResume(err -> {
                    if (classifier.isRecoverable(err) && attempts.get() < sd.maxAttempts) {
                        long delay = computeDelay(sd.backoff.toMillis(), sd.jitter, sd.jitterFactor);
                        log.warn("{{\"saga_event\":\"step_retry\",\"run_id\":\"{}\",\"step_name\":\"{}\",\"attempt\":\"{}\",\"delay_ms\":\"{}\",\"error_class\":\"{}\"}}",
                                ctx.runId(), sd.name, attempts.get(), delay, err.getClass().getSimpleName());
                        return Mono.delay(Duration.ofMillis(delay))
                                .then(attemptExecute(sd, ctx, input, attempts));
                    }
                    return Mono.error(err);
                })
                .doFirst(attempts::incrementAndGet);
    }

    /**
     * Errors with the last compensation error once {@code compensationMaxAttempts} are used up.
     */
    public Mono<CompensationOutcome> compensate(StepDefinition sd, StepContext ctx, ArtifactRef ref, AtomicInteger attempts) {
        return Mono.defer(() -> sd.port.compensate(ctx, ref))
                .transform(m -> isPositive(sd.compensationTimeout) ? m.timeout(sd.compensationTimeout) : m)
                .defaultIfEmpty(CompensationOutcome.none())
                .onErrorResume(err -> {
                    if (attempts.get() < sd.compensationMaxAttempts) {
                        long delay = computeDelay(sd.backoff.toMillis(), sd.jitter, sd.jitterFactor);
                        log.warn("{{\"saga_event\":\"compensation_retry\",\"run_id\":\"{}\",\"step_name\":\"{}\",\"attempt\":\"{}\",\"error_class\":\"{}\"}}",
                                ctx.runId(), sd.name, attempts.get(), err.getClass().getSimpleName());
                        return Mono.delay(Duration.ofMillis(delay))
                                .then(compensate(sd, ctx, ref, attempts));
                    }
                    return Mono.error(err);
                })
                .doFirst(attempts::incrementAndGet);
    }

    private Throwable escalate(StepDefinition sd, Throwable err, int attempts) {
        if (!classifier.isRecoverable(err)) {
            return err;
        }
        String detail = err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
        return new TerminalStepException("Step '" + sd.name + "' exhausted " + attempts + " attempt(s): " + detail, err);
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }

    public static long computeDelay(long backoffMs, boolean jitter, double jitterFactor) {
        if (backoffMs <= 0) return 0L;
        if (!jitter) return backoffMs;
        double f = Math.max(0.0d, Math.min(jitterFactor, 1.0d));
        double min = backoffMs * (1.0d - f);
        double max = backoffMs * (1.0d + f);
        if (max <= min) return backoffMs;
        long v = Math.round(ThreadLocalRandom.current().nextDouble(min, max));
        return Math.max(0L, v);
    }
}
