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

/**
 * Turns a raw content request into a normalized brief.
 */
public interface BriefNormalizer {

    /**
     * @param request JSON view of the request the run was started with
     * @return the brief without identity fields; the adapter assigns those
     * @throws org.fireflyframework.contentsaga.shared.exception.TerminalStepException when the request is unusable
     */
    Brief normalize(JsonNode request);
}
