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

import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.contentsaga.modules.production.DraftAsset;
import org.fireflyframework.contentsaga.modules.production.ProductionDraft;
import org.fireflyframework.contentsaga.support.TestBackends;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultQcEvaluatorTest {

    private static JsonNode draft(String body, int assets) {
        List<DraftAsset> list = new ArrayList<>();
        for (int i = 0; i < assets; i++) {
            list.add(DraftAsset.builder().assetType("post").channel("linkedin").content(body).build());
        }
        return TestBackends.objectMapper().valueToTree(ProductionDraft.builder().body(body).assets(list).build());
    }

    @Test
    void cleanDraftPassesWithFullScore() {
        QcResult result = new DefaultQcEvaluator().evaluate(draft("Acme Rockets for engineers. Launch week", 1), false);

        assertTrue(result.isPassed());
        assertEquals(1.0d, result.getScore());
        assertThat(result.getIssues()).isEmpty();
    }

    @Test
    void eachIssueCostsAQuarterOfTheScore() {
        QcResult result = new DefaultQcEvaluator().evaluate(draft("TBD", 0), false);

        assertFalse(result.isPassed());
        assertEquals(0.25d, result.getScore(), 1e-9);
        assertThat(result.getIssues()).extracting(QcIssue::getCode)
                .containsExactly("body_too_short", "no_assets", "unresolved_placeholder");
    }

    @Test
    void thresholdDecidesBorderlineDrafts() {
        JsonNode oneIssue = draft("Acme Rockets for engineers. Launch week", 0);

        assertTrue(new DefaultQcEvaluator().evaluate(oneIssue, false).isPassed());
        assertFalse(new DefaultQcEvaluator(0.8d).evaluate(oneIssue, false).isPassed());
    }

    @Test
    void forcedFailureAlwaysRejects() {
        QcResult result = new DefaultQcEvaluator(0.0d).evaluate(draft("Acme Rockets for engineers. Launch week", 2), true);

        assertFalse(result.isPassed());
        assertEquals(0.0d, result.getScore());
        assertThat(result.getIssues()).extracting(QcIssue::getCode).containsExactly("forced_failure");
    }

    @Test
    void thresholdOutsideUnitIntervalIsRefused() {
        assertThatThrownBy(() -> new DefaultQcEvaluator(1.5d)).isInstanceOf(IllegalArgumentException.class);
    }
}
