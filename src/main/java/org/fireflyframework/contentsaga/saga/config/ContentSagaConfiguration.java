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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import org.fireflyframework.contentsaga.modules.delivery.DefaultDeliveryPackager;
import org.fireflyframework.contentsaga.modules.delivery.DeliveryPackager;
import org.fireflyframework.contentsaga.modules.intake.BriefNormalizer;
import org.fireflyframework.contentsaga.modules.intake.DefaultBriefNormalizer;
import org.fireflyframework.contentsaga.modules.production.DefaultDraftGenerator;
import org.fireflyframework.contentsaga.modules.production.DraftGenerator;
import org.fireflyframework.contentsaga.modules.qc.DefaultQcEvaluator;
import org.fireflyframework.contentsaga.modules.qc.QcEvaluator;
import org.fireflyframework.contentsaga.modules.strategy.DefaultStrategyGenerator;
import org.fireflyframework.contentsaga.modules.strategy.StrategyGenerator;
import org.fireflyframework.contentsaga.pipeline.ContentPipeline;
import org.fireflyframework.contentsaga.pipeline.ContentPipelineService;
import org.fireflyframework.contentsaga.pipeline.PipelineCollaborators;
import org.fireflyframework.contentsaga.saga.consistency.ConsistencyChecker;
import org.fireflyframework.contentsaga.saga.engine.SagaCoordinator;
import org.fireflyframework.contentsaga.saga.engine.StepInvoker;
import org.fireflyframework.contentsaga.saga.events.EventBus;
import org.fireflyframework.contentsaga.saga.events.EventSubscriber;
import org.fireflyframework.contentsaga.saga.events.InProcessEventBus;
import org.fireflyframework.contentsaga.saga.observability.LoggingEventSubscriber;
import org.fireflyframework.contentsaga.saga.observability.MicrometerEventSubscriber;
import org.fireflyframework.contentsaga.saga.persistence.CompletedRunCleaner;
import org.fireflyframework.contentsaga.saga.persistence.WorkflowRunRepository;
import org.fireflyframework.contentsaga.saga.registry.WorkflowDefinition;
import org.fireflyframework.contentsaga.shared.engine.compensation.CompensationErrorHandler;
import org.fireflyframework.contentsaga.shared.engine.compensation.CompensationErrorHandlerFactory;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceBackend;
import org.fireflyframework.contentsaga.shared.gateway.inmemory.InMemoryPersistenceBackend;
import org.fireflyframework.contentsaga.shared.gateway.r2dbc.R2dbcPersistenceBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration that wires the content saga: persistence backend, event bus,
 * module adapters, coordinator and the pipeline facade.
 * Users typically activate it via {@link org.fireflyframework.contentsaga.shared.annotations.EnableContentSaga};
 * Spring Boot applications also pick it up through auto-configuration.
 */
@Configuration
@EnableConfigurationProperties(ContentSagaProperties.class)
public class ContentSagaConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ContentSagaConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper contentSagaObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    // Persistence

    /**
     * Picks the backend from the bound {@code persistence.mode}.
     */
    @Bean
    @ConditionalOnMissingBean
    public PersistenceBackend contentSagaPersistenceBackend(ContentSagaProperties properties,
                                                            ObjectProvider<ConnectionFactory> connectionFactory,
                                                            ObjectMapper objectMapper) {
        ContentSagaProperties.PersistenceProperties persistence = properties.getPersistence();
        switch (persistence.getMode()) {
            case RELATIONAL:
                return relationalBackend(persistence, connectionFactory, objectMapper);
            case IN_MEMORY:
            default:
                log.info("Configuring in-memory content saga persistence (no external storage)");
                return new InMemoryPersistenceBackend(objectMapper);
        }
    }

    private static PersistenceBackend relationalBackend(ContentSagaProperties.PersistenceProperties persistence,
                                                        ObjectProvider<ConnectionFactory> connectionFactory,
                                                        ObjectMapper objectMapper) {
        ConnectionFactory factory = connectionFactory.getIfAvailable(() -> {
            if (persistence.getR2dbcUrl() == null || persistence.getR2dbcUrl().isBlank()) {
                throw new IllegalStateException("Relational persistence needs a ConnectionFactory bean or "
                        + "firefly.content-saga.persistence.r2dbc-url");
            }
            return ConnectionFactories.get(persistence.getR2dbcUrl());
        });
        log.info("Configuring relational content saga persistence (delete mode {})", persistence.getDeleteMode());
        R2dbcPersistenceBackend backend = new R2dbcPersistenceBackend(factory, objectMapper, persistence.getDeleteMode());
        if (persistence.isInitializeSchema()) {
            backend.initialize().block();
        }
        return backend;
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowRunRepository workflowRunRepository(PersistenceBackend backend) {
        return backend.runRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.content-saga.persistence.cleanup-enabled", havingValue = "true", matchIfMissing = true)
    public CompletedRunCleaner completedRunCleaner(WorkflowRunRepository repository, ContentSagaProperties properties) {
        ContentSagaProperties.PersistenceProperties persistence = properties.getPersistence();
        CompletedRunCleaner cleaner = new CompletedRunCleaner(
                repository, persistence.getCleanupInterval(), persistence.getRetentionPeriod());
        cleaner.start();
        return cleaner;
    }

    // Events

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.content-saga.observability.logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingEventSubscriber loggingEventSubscriber() {
        return new LoggingEventSubscriber();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBus contentSagaEventBus(ObjectProvider<EventSubscriber> subscribers) {
        InProcessEventBus bus = new InProcessEventBus();
        subscribers.orderedStream().forEach(bus::subscribeAll);
        log.info("Content saga event bus ready with {} subscriber(s)", bus.subscriberCount());
        return bus;
    }

    // Modules

    @Bean
    @ConditionalOnMissingBean
    public BriefNormalizer briefNormalizer() {
        return new DefaultBriefNormalizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public StrategyGenerator strategyGenerator() {
        return new DefaultStrategyGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public DraftGenerator draftGenerator() {
        return new DefaultDraftGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public QcEvaluator qcEvaluator(ContentSagaProperties properties) {
        return new DefaultQcEvaluator(properties.getQc().getPassThreshold());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryPackager deliveryPackager() {
        return new DefaultDeliveryPackager();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowDefinition contentPipelineDefinition(PersistenceBackend backend,
                                                        ObjectMapper objectMapper,
                                                        BriefNormalizer briefNormalizer,
                                                        StrategyGenerator strategyGenerator,
                                                        DraftGenerator draftGenerator,
                                                        QcEvaluator qcEvaluator,
                                                        DeliveryPackager deliveryPackager,
                                                        ContentSagaProperties properties) {
        PipelineCollaborators collaborators = new PipelineCollaborators(
                briefNormalizer, strategyGenerator, draftGenerator, qcEvaluator, deliveryPackager);
        return ContentPipeline.create(backend, objectMapper, collaborators, properties.toStepPolicy());
    }

    // Coordinator

    @Bean
    @ConditionalOnMissingBean
    public StepInvoker stepInvoker() {
        return new StepInvoker();
    }

    @Bean
    @ConditionalOnMissingBean
    public CompensationErrorHandler compensationErrorHandler(ContentSagaProperties properties) {
        CompensationErrorHandler handler = CompensationErrorHandlerFactory.getHandler(properties.getCompensation().getErrorHandler());
        log.info("Using compensation error handler: {}", handler.getStrategyName());
        return handler;
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaCoordinator sagaCoordinator(WorkflowRunRepository repository,
                                           EventBus eventBus,
                                           StepInvoker stepInvoker,
                                           CompensationErrorHandler compensationErrorHandler,
                                           ContentSagaProperties properties) {
        ContentSagaProperties.StorageProperties storage = properties.getStorage();
        return new SagaCoordinator(repository, eventBus, stepInvoker, compensationErrorHandler,
                storage.getMaxAttempts(), storage.getBackoff(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsistencyChecker consistencyChecker(PersistenceBackend backend) {
        return new ConsistencyChecker(backend);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentPipelineService contentPipelineService(SagaCoordinator coordinator,
                                                         WorkflowDefinition definition,
                                                         ConsistencyChecker consistencyChecker) {
        return new ContentPipelineService(coordinator, definition, consistencyChecker);
    }

    /**
     * Micrometer metrics, active when Micrometer is on the classpath.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnProperty(name = "firefly.content-saga.observability.metrics-enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public MicrometerEventSubscriber micrometerEventSubscriber(ObjectProvider<MeterRegistry> meterRegistry) {
            MeterRegistry registry = meterRegistry.getIfAvailable(() -> {
                log.info("No MeterRegistry bean found. Publishing content saga metrics to the global registry");
                return Metrics.globalRegistry;
            });
            return new MicrometerEventSubscriber(registry);
        }
    }
}
