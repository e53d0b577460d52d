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

package org.fireflyframework.contentsaga.saga.config;

import org.fireflyframework.contentsaga.saga.registry.StepPolicy;
import org.fireflyframework.contentsaga.shared.engine.compensation.CompensationErrorHandlerFactory;
import org.fireflyframework.contentsaga.shared.gateway.DeleteMode;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the content saga.
 *
 * Example configuration:
 * <pre>
 * firefly.content-saga.persistence.mode=RELATIONAL
 * firefly.content-saga.persistence.delete-mode=SOFT
 * firefly.content-saga.persistence.r2dbc-url=r2dbc:h2:mem:///content?options=DB_CLOSE_DELAY=-1
 * firefly.content-saga.step.timeout=10s
 * firefly.content-saga.step.max-attempts=3
 * firefly.content-saga.compensation.error-handler=fail-fast
 * firefly.content-saga.qc.pass-threshold=0.8
 * firefly.content-saga.observability.metrics-enabled=false
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.content-saga")
public class ContentSagaProperties {

    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();

    @NestedConfigurationProperty
    private StepProperties step = new StepProperties();

    @NestedConfigurationProperty
    private CompensationProperties compensation = new CompensationProperties();

    @NestedConfigurationProperty
    private StorageProperties storage = new StorageProperties();

    @NestedConfigurationProperty
    private QcProperties qc = new QcProperties();

    @NestedConfigurationProperty
    private ObservabilityProperties observability = new ObservabilityProperties();

    /**
     * Default step policy built from the step and compensation sections.
     */
    public StepPolicy toStepPolicy() {
        return new StepPolicy(
                step.getTimeout(),
                step.getMaxAttempts(),
                step.getBackoff(),
                step.isJitter(),
                step.getJitterFactor(),
                compensation.getTimeout(),
                compensation.getMaxAttempts());
    }

    // Getters and setters
    public PersistenceProperties getPersistence() {
        return persistence;
    }

    public void setPersistence(PersistenceProperties persistence) {
        this.persistence = persistence;
    }

    public StepProperties getStep() {
        return step;
    }

    public void setStep(StepProperties step) {
        this.step = step;
    }

    public CompensationProperties getCompensation() {
        return compensation;
    }

    public void setCompensation(CompensationProperties compensation) {
        this.compensation = compensation;
    }

    public StorageProperties getStorage() {
        return storage;
    }

    public void setStorage(StorageProperties storage) {
        this.storage = storage;
    }

    public QcProperties getQc() {
        return qc;
    }

    public void setQc(QcProperties qc) {
        this.qc = qc;
    }

    public ObservabilityProperties getObservability() {
        return observability;
    }

    public void setObservability(ObservabilityProperties observability) {
        this.observability = observability;
    }

    /**
     * Persistence configuration.
     */
    public static class PersistenceProperties {

        /**
         * Backend for artifacts and run records.
         */
        private PersistenceMode mode = PersistenceMode.IN_MEMORY;

        /**
         * How compensation removes relational rows.
         */
        private DeleteMode deleteMode = DeleteMode.HARD;

        /**
         * R2DBC URL used when no ConnectionFactory bean is present.
         */
        private String r2dbcUrl;

        /**
         * Whether to run the bundled schema script on startup (relational mode).
         */
        private boolean initializeSchema = true;

        /**
         * Whether finished runs are periodically removed from run storage.
         */
        private boolean cleanupEnabled = true;

        /**
         * Interval between cleanup passes over finished runs.
         */
        private Duration cleanupInterval = Duration.ofHours(1);

        /**
         * How long a finished run is kept before cleanup removes it.
         */
        private Duration retentionPeriod = Duration.ofDays(7);

        public PersistenceMode getMode() { return mode; }
        public void setMode(PersistenceMode mode) { this.mode = mode; }
        public DeleteMode getDeleteMode() { return deleteMode; }
        public void setDeleteMode(DeleteMode deleteMode) { this.deleteMode = deleteMode; }
        public String getR2dbcUrl() { return r2dbcUrl; }
        public void setR2dbcUrl(String r2dbcUrl) { this.r2dbcUrl = r2dbcUrl; }
        public boolean isInitializeSchema() { return initializeSchema; }
        public void setInitializeSchema(boolean initializeSchema) { this.initializeSchema = initializeSchema; }
        public boolean isCleanupEnabled() { return cleanupEnabled; }
        public void setCleanupEnabled(boolean cleanupEnabled) { this.cleanupEnabled = cleanupEnabled; }
        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
        public Duration getRetentionPeriod() { return retentionPeriod; }
        public void setRetentionPeriod(Duration retentionPeriod) { this.retentionPeriod = retentionPeriod; }
    }

    /**
     * Default step execution policy.
     */
    public static class StepProperties {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(100);
        private boolean jitter = false;
        private double jitterFactor = 0.5d;

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration backoff) { this.backoff = backoff; }
        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
    }

    /**
     * Compensation configuration.
     */
    public static class CompensationProperties {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxAttempts = 2;

        /**
         * Name of the compensation error handler, see {@link CompensationErrorHandlerFactory}.
         */
        private String errorHandler = CompensationErrorHandlerFactory.LOG_AND_CONTINUE;

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public String getErrorHandler() { return errorHandler; }
        public void setErrorHandler(String errorHandler) { this.errorHandler = errorHandler; }
    }

    /**
     * Retry of run audit storage calls.
     */
    public static class StorageProperties {
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(50);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration backoff) { this.backoff = backoff; }
    }

    public static class QcProperties {
        private double passThreshold = 0.7d;

        public double getPassThreshold() { return passThreshold; }
        public void setPassThreshold(double passThreshold) { this.passThreshold = passThreshold; }
    }

    /**
     * Observability configuration.
     */
    public static class ObservabilityProperties {
        private boolean loggingEnabled = true;
        private boolean metricsEnabled = true;

        public boolean isLoggingEnabled() { return loggingEnabled; }
        public void setLoggingEnabled(boolean loggingEnabled) { this.loggingEnabled = loggingEnabled; }
        public boolean isMetricsEnabled() { return metricsEnabled; }
        public void setMetricsEnabled(boolean metricsEnabled) { this.metricsEnabled = metricsEnabled; }
    }
}
