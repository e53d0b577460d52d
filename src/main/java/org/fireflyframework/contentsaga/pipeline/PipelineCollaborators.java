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

/**
 * The external black boxes each module delegates its work to.
 */
public record PipelineCollaborators(
        BriefNormalizer briefNormalizer,
        StrategyGenerator strategyGenerator,
        DraftGenerator draftGenerator,
        QcEvaluator qcEvaluator,
        DeliveryPackager deliveryPackager
) {

    public static PipelineCollaborators defaults() {
        return defaults(DefaultQcEvaluator.DEFAULT_PASS_THRESHOLD);
    }

    public static PipelineCollaborators defaults(double qcPassThreshold) {
        return new PipelineCollaborators(
                new DefaultBriefNormalizer(),
                new DefaultStrategyGenerator(),
                new DefaultDraftGenerator(),
                new DefaultQcEvaluator(qcPassThreshold),
                new DefaultDeliveryPackager());
    }

    public PipelineCollaborators withDraftGenerator(DraftGenerator generator) {
        return new PipelineCollaborators(briefNormalizer, strategyGenerator, generator, qcEvaluator, deliveryPackager);
    }

    public PipelineCollaborators withQcEvaluator(QcEvaluator evaluator) {
        return new PipelineCollaborators(briefNormalizer, strategyGenerator, draftGenerator, evaluator, deliveryPackager);
    }

    public PipelineCollaborators withDeliveryPackager(DeliveryPackager packager) {
        return new PipelineCollaborators(briefNormalizer, strategyGenerator, draftGenerator, qcEvaluator, packager);
    }
}
