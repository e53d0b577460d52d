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

import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.contentsaga.modules.support.JsonViews;

import java.util.ArrayList;
import java.util.List;

public class DefaultStrategyGenerator implements StrategyGenerator {

    @Override
    public StrategyDocument generate(JsonNode brief) {
        String brand = JsonViews.text(brief, "brand");
        String audience = JsonViews.text(brief, "audience");
        List<String> pillars = new ArrayList<>();
        for (String objective : JsonViews.texts(brief, "objectives")) {
            pillars.add("Show how " + brand + " delivers on: " + objective);
        }
        if (pillars.isEmpty()) {
            pillars.add("Introduce " + brand);
        }
        List<String> plan = JsonViews.texts(brief, "channels").stream()
                .map(channel -> channel + ": weekly")
                .toList();
        return StrategyDocument.builder()
                .positioning(brand + " for " + (audience != null ? audience : "a general audience"))
                .messagingPillars(pillars)
                .channelPlan(plan)
                .build();
    }
}
