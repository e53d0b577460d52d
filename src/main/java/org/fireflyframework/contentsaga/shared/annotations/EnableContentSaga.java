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

package org.fireflyframework.contentsaga.shared.annotations;

import org.fireflyframework.contentsaga.saga.config.ContentSagaConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables the content saga components in a Spring application.
 * <p>
 * This annotation imports {@link ContentSagaConfiguration} directly so it works in both
 * Spring Boot (auto-configuration) and plain Spring contexts.
 * <p>
 * Components wired by this annotation:
 * - {@code PersistenceBackend}: in-memory or R2DBC, per {@code firefly.content-saga.persistence.mode}
 * - {@code EventBus}: in-process bus with every {@code EventSubscriber} bean subscribed
 * - {@code SagaCoordinator}: runs and compensates workflows
 * - {@code ContentPipelineService}: facade over the five-step content pipeline
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(ContentSagaConfiguration.class)
public @interface EnableContentSaga {
}
