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

package org.fireflyframework.contentsaga.modules.qc;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.fireflyframework.contentsaga.shared.gateway.Artifact;
import org.fireflyframework.contentsaga.shared.gateway.ModuleNamespace;

import java.util.ArrayList;
import java.util.List;

/**
 * Quality gate evaluation of a draft. {@code draftRef} is a logical foreign key into production.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QcResult implements Artifact {

    private String artifactId;
    private String runId;
    private String stepName;
    private String draftRef;
    private double score;
    private boolean passed;
    @Builder.Default
    private List<QcIssue> issues = new ArrayList<>();

    @Override
    public ModuleNamespace artifactNamespace() {
        return ModuleNamespace.QC;
    }

    @Override
    public List<QcIssue> ownedChildren() {
        return issues != null ? issues : List.of();
    }
}
