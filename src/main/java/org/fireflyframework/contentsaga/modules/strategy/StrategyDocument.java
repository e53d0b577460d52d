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

package org.fireflyframework.contentsaga.modules.strategy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.fireflyframework.contentsaga.shared.gateway.Artifact;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;

import java.util.List;

/**
 * Content strategy derived from a brief. {@code briefRef} is a logical foreign key into intake.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyDocument implements Artifact {

    private String artifactId;
    private String runId;
    private String stepName;
    private String briefRef;
    private String positioning;
    private List<String> messagingPillars;
    private List<String> channelPlan;

    @Override
    public ModuleNamespace artifactNamespace() {
        return ModuleNamespace.STRATEGY;
    }
}
