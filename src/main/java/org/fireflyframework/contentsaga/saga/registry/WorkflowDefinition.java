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

package org.fireflyframework.contentsaga.saga.registry;

import java.util.List;
import java.util.Optional;

/**
 * Declarative, ordered list of steps. Steps execute in list order and compensate in
 * the reverse of their completion order.
 */
public final class WorkflowDefinition {
    private final String name;
    private final List<StepDefinition> steps;

    WorkflowDefinition(String name, List<StepDefinition> steps) {
        this.name = name;
        this.steps = List.copyOf(steps);
    }

    public String name() {
        return name;
    }

    public List<StepDefinition> steps() {
        return steps;
    }

    public List<String> stepNames() {
        return steps.stream().map(s -> s.name).toList();
    }

    public Optional<StepDefinition> step(String stepName) {
        return steps.stream().filter(s -> s.name.equals(stepName)).findFirst();
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" + name + ", steps=" + stepNames() + "}";
    }
}
