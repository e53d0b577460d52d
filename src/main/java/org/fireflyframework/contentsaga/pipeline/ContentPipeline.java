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

package org.fireflyframework.contentsaga.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.contentsaga.modules.delivery.DeliveryPackage;
import org.fireflyframework.contentsaga.modules.delivery.DeliveryStepAdapter;
import org.fireflyframework.contentsaga.modules.intake.Brief;
import org.fireflyframework.contentsaga.modules.intake.IntakeStepAdapter;
import org.fireflyframework.contentsaga.modules.production.ProductionDraft;
import org.fireflyframework.contentsaga.modules.production.ProductionStepAdapter;
import org.fireflyframework.contentsaga.modules.qc.QcResult;
import org.fireflyframework.contentsaga.modules.qc.QcStepAdapter;
import org.fireflyframework.contentsaga.modules.strategy.StrategyDocument;
import org.fireflyframework.contentsaga.modules.strategy.StrategyStepAdapter;
import org.fireflyframework.contentsaga.saga.port.StepPort;
import org.fireflyframework.contentsaga.saga.registry.StepPolicy;
import org.fireflyframework.contentsaga.saga.registry.WorkflowBuilder;
import org.fireflyframework.contentsaga.saga.registry.WorkflowDefinition;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceBackend;

import java.util.List;

/**
 * The five-step content workflow: intake, strategy, production, qc, delivery.
 */
public final class ContentPipeline {

    public static final String WORKFLOW_NAME = "content-pipeline";

    public static final String INTAKE = "intake";
    public static final String STRATEGY = "strategy";
    public static final String PRODUCTION = "production";
    public static final String QC = "qc";
    public static final String DELIVERY = "delivery";

    public static final List<String> STEP_ORDER = List.of(INTAKE, STRATEGY, PRODUCTION, QC, DELIVERY);

    private ContentPipeline() {
    }

    /**
     * Builds the module adapters on top of a backend and assembles the definition.
     */
    public static WorkflowDefinition create(PersistenceBackend backend, ObjectMapper objectMapper,
                                            PipelineCollaborators collaborators, StepPolicy policy) {
        return definition(policy,
                new IntakeStepAdapter(INTAKE, backend.gateway(ModuleNamespace.INTAKE, Brief.class), backend,
                        collaborators.briefNormalizer(), objectMapper),
                new StrategyStepAdapter(STRATEGY, backend.gateway(ModuleNamespace.STRATEGY, StrategyDocument.class), backend,
                        collaborators.strategyGenerator()),
                new ProductionStepAdapter(PRODUCTION, backend.gateway(ModuleNamespace.PRODUCTION, ProductionDraft.class), backend,
                        collaborators.draftGenerator()),
                new QcStepAdapter(QC, backend.gateway(ModuleNamespace.QC, QcResult.class), backend,
                        collaborators.qcEvaluator()),
                new DeliveryStepAdapter(DELIVERY, backend.gateway(ModuleNamespace.DELIVERY, DeliveryPackage.class), backend,
                        collaborators.deliveryPackager()));
    }

    public static WorkflowDefinition definition(StepPolicy policy, StepPort intake, StepPort strategy,
                                                StepPort production, StepPort qc, StepPort delivery) {
        return WorkflowBuilder.workflow(WORKFLOW_NAME)
                .defaults(policy)
                .step(INTAKE, intake).add()
                .step(STRATEGY, strategy).add()
                .step(PRODUCTION, production).add()
                .step(QC, qc).add()
                .step(DELIVERY, delivery).add()
                .build();
    }
}
