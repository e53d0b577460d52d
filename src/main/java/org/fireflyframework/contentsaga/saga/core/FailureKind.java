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

/**
 * Why the forward execution of a run stopped. Both kinds compensate identically;
 * they are kept apart for observability.
 */
public enum FailureKind {
    /** The step executed but its outcome carried a negative business verdict. */
    REJECTED,
    /** The step raised a terminal error or exhausted its retries. */
    ERRORED
}
