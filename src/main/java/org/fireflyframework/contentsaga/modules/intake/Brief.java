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

package org.fireflyframework.contentsaga.modules.intake;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.fireflyframework.contentsaga.shared.gateway.Artifact;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;

import java.util.List;

/**
 * Normalized client brief produced by the intake step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Brief implements Artifact {

    /**
     * Benchmark marker that makes the quality gate reject the draft.
     */
    public static final String FORCE_FAIL_BENCHMARK = "FORCE_FAIL";

    private String artifactId;
    private String runId;
    private String stepName;
    private String clientName;
    private String brand;
    private List<String> objectives;
    private String audience;
    private List<String> channels;
    private String benchmark;

    @Override
    public ModuleNamespace artifactNamespace() {
        return ModuleNamespace.INTAKE;
    }
}
