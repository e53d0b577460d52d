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

package org.fireflyframework.contentsaga.shared.engine.compensation;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of compensation error handlers by name, used to resolve the
 * {@code firefly.content-saga.compensation.error-handler} property.
 */
public final class CompensationErrorHandlerFactory {

    public static final String LOG_AND_CONTINUE = "log-and-continue";
    public static final String FAIL_FAST = "fail-fast";

    private static final Map<String, CompensationErrorHandler> handlers = new ConcurrentHashMap<>();

    static {
        registerDefaults();
    }

    private CompensationErrorHandlerFactory() {
    }

    /**
     * @throws IllegalArgumentException if no handler is registered under that name
     */
    public static CompensationErrorHandler getHandler(String handlerName) {
        CompensationErrorHandler handler = handlers.get(handlerName);
        if (handler == null) {
            throw new IllegalArgumentException("Unknown compensation error handler: " + handlerName);
        }
        return handler;
    }

    public static void registerHandler(String name, CompensationErrorHandler handler) {
        handlers.put(name, handler);
    }

    public static CompensationErrorHandler defaultHandler() {
        return getHandler(LOG_AND_CONTINUE);
    }

    public static CompensationErrorHandler failFast() {
        return getHandler(FAIL_FAST);
    }

    public static boolean isHandlerRegistered(String handlerName) {
        return handlers.containsKey(handlerName);
    }

    public static String[] getAvailableHandlers() {
        return handlers.keySet().toArray(new String[0]);
    }

    /**
     * Clears custom registrations and restores the built-in handlers.
     */
    public static void resetToDefaults() {
        handlers.clear();
        registerDefaults();
    }

    private static void registerDefaults() {
        registerHandler(LOG_AND_CONTINUE, new LogAndContinueErrorHandler());
        registerHandler(FAIL_FAST, new FailFastErrorHandler());
    }
}
