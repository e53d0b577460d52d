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
import org.fireflyframework.contentsaga.modules.support.JsonViews;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic rule-based gate: each issue costs a fixed share of the score.
 */
public class DefaultQcEvaluator implements QcEvaluator {

    public static final double DEFAULT_PASS_THRESHOLD = 0.7d;
    static final double ISSUE_PENALTY = 0.25d;
    static final int MIN_BODY_LENGTH = 20;
    static final String PLACEHOLDER = "TBD";

    private final double passThreshold;

    public DefaultQcEvaluator() {
        this(DEFAULT_PASS_THRESHOLD);
    }

    public DefaultQcEvaluator(double passThreshold) {
        if (passThreshold < 0.0d || passThreshold > 1.0d) {
            throw new IllegalArgumentException("passThreshold must be within [0, 1]");
        }
        this.passThreshold = passThreshold;
    }

    @Override
    public QcResult evaluate(JsonNode draft, boolean forceFail) {
        List<QcIssue> issues = new ArrayList<>();
        if (forceFail) {
            issues.add(issue("forced_failure", "critical", "Benchmark requested a failing quality gate"));
            return QcResult.builder().score(0.0d).passed(false).issues(issues).build();
        }
        String body = JsonViews.text(draft, "body");
        if (body == null || body.trim().length() < MIN_BODY_LENGTH) {
            issues.add(issue("body_too_short", "major", "Draft body is shorter than " + MIN_BODY_LENGTH + " characters"));
        }
        if (JsonViews.size(draft, "assets") == 0) {
            issues.add(issue("no_assets", "major", "Draft has no channel assets"));
        }
        if (body != null && body.contains(PLACEHOLDER)) {
            issues.add(issue("unresolved_placeholder", "minor", "Draft body contains an unresolved placeholder"));
        }
        double score = Math.max(0.0d, 1.0d - ISSUE_PENALTY * issues.size());
        return QcResult.builder()
                .score(score)
                .passed(score >= passThreshold)
                .issues(issues)
                .build();
    }

    public double passThreshold() {
        return passThreshold;
    }

    private static QcIssue issue(String code, String severity, String message) {
        return QcIssue.builder().code(code).severity(severity).message(message).build();
    }
}
