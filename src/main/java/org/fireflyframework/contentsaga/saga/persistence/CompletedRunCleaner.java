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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Periodically removes finished runs older than the retention period from run storage.
 * A failed pass is logged and the next tick tries again.
 */
public class CompletedRunCleaner implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(CompletedRunCleaner.class);

    private final WorkflowRunRepository repository;
    private final Duration interval;
    private final Duration retentionPeriod;
    private volatile Disposable subscription;

    public CompletedRunCleaner(WorkflowRunRepository repository, Duration interval, Duration retentionPeriod) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("cleanup interval must be positive");
        }
        if (retentionPeriod == null || retentionPeriod.isNegative()) {
            throw new IllegalArgumentException("retention period must not be negative");
        }
        this.repository = repository;
        this.interval = interval;
        this.retentionPeriod = retentionPeriod;
    }

    /**
     * Starts the cleanup loop; a second call while running does nothing.
     */
    public void start() {
        if (isRunning()) {
            log.debug("Completed run cleaner already running");
            return;
        }
        log.info("Starting completed run cleaner with interval={}, retention={}", interval, retentionPeriod);
        subscription = Flux.interval(interval)
                .concatMap(tick -> cleanupOnce())
                .subscribe();
    }

    /**
     * Runs one cleanup pass now. Errors are logged and resolve to zero.
     */
    public Mono<Long> cleanupOnce() {
        return repository.cleanupCompletedRuns(retentionPeriod)
                .doOnNext(removed -> {
                    if (removed > 0) {
                        log.info("Removed {} finished runs older than {}", removed, retentionPeriod);
                    }
                })
                .onErrorResume(error -> {
                    log.warn("Completed run cleanup failed: {}", error.getMessage());
                    return Mono.just(0L);
                });
    }

    public boolean isRunning() {
        Disposable current = subscription;
        return current != null && !current.isDisposed();
    }

    public void stop() {
        Disposable current = subscription;
        if (current != null && !current.isDisposed()) {
            log.info("Stopping completed run cleaner");
            current.dispose();
        }
    }

    @Override
    public void destroy() {
        stop();
    }
}
