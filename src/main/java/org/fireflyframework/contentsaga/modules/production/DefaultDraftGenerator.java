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

package org.fireflyframework.contentsaga.modules.production;

import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.contentsaga.modules.support.JsonViews;

import java.util.ArrayList;
import java.util.List;

public class DefaultDraftGenerator implements DraftGenerator {

    @Override
    public ProductionDraft generate(JsonNode strategy) {
        String positioning = JsonViews.text(strategy, "positioning");
        List<String> pillars = JsonViews.texts(strategy, "messagingPillars");
        String body = positioning + ". " + String.join(" ", pillars);
        List<DraftAsset> assets = JsonViews.texts(strategy, "channelPlan").stream()
                .map(entry -> entry.contains(":") ? entry.substring(0, entry.indexOf(':')).trim() : entry)
                .map(channel -> DraftAsset.builder()
                        .assetType("post")
                        .channel(channel)
                        .content("[" + channel + "] " + body)
                        .build())
                .toList();
        return ProductionDraft.builder()
                .contentType("social_post")
                .body(body)
                .assets(new ArrayList<>(assets))
                .build();
    }
}
