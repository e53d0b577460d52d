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

package org.fireflyframework.contentsaga.modules.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.contentsaga.modules.support.JsonViews;

import java.util.ArrayList;
import java.util.List;

public class DefaultDeliveryPackager implements DeliveryPackager {

    @Override
    public DeliveryPackage pack(JsonNode draft, JsonNode qcResult) {
        List<DeliveryFile> files = new ArrayList<>();
        JsonNode assets = draft.get("assets");
        if (assets != null && assets.isArray()) {
            int index = 0;
            for (JsonNode asset : assets) {
                String channel = JsonViews.text(asset, "channel");
                files.add(DeliveryFile.builder()
                        .fileName(String.format("%02d-%s.txt", ++index, channel))
                        .channel(channel)
                        .mediaType("text/plain")
                        .content(JsonViews.text(asset, "content"))
                        .build());
            }
        }
        String manifest = files.size() + " file(s), qc score " + JsonViews.text(qcResult, "score");
        return DeliveryPackage.builder()
                .manifest(manifest)
                .files(files)
                .build();
    }
}
