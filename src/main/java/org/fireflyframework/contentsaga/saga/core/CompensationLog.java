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

package org.fireflyframework.contentsaga.saga.core;

import java.time.Instant;

/**
 * Audit entry written for every compensated step. {@code rowsAffected} is the number of
 * rows or documents the step's execution had created and the compensation removed.
 */
public record CompensationLog(String runId, String stepName, Instant compensatedAt, int rowsAffected) {
}
