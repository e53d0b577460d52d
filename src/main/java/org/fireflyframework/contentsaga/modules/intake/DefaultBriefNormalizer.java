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

import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.contentsaga.modules.support.JsonViews;
import org.fireflyframework.contentsaga.shared.exception.TerminalStepException;

import java.util.List;
import java.util.Locale;

public class DefaultBriefNormalizer implements BriefNormalizer {

    private static final List<String> DEFAULT_CHANNELS = List.of("linkedin");

    @Override
    public Brief normalize(JsonNode request) {
        String clientName = JsonViews.text(request, "clientName");
        if (clientName == null || clientName.isBlank()) {
            throw new TerminalStepException("Content request has no client name");
        }
        String brand = JsonViews.text(request, "brand");
        List<String> channels = JsonViews.texts(request, "channels").stream()
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .filter(c -> !c.isEmpty())
                .distinct()
                .toList();
        JsonNode forceFail = request.get("forceQcFail");
        return Brief.builder()
                .clientName(clientName.trim())
                .brand(brand == null || brand.isBlank() ? clientName.trim() : brand.trim())
                .objectives(JsonViews.texts(request, "objectives").stream().map(String::trim).toList())
                .audience(JsonViews.text(request, "audience"))
                .channels(channels.isEmpty() ? DEFAULT_CHANNELS : channels)
                .benchmark(forceFail != null && forceFail.asBoolean(false) ? Brief.FORCE_FAIL_BENCHMARK : null)
                .build();
    }
}
