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

package org.fireflyframework.contentsaga.saga.events;

/**
 * In-process publish/subscribe for step lifecycle events.
 * <p>
 * Dispatch is synchronous and follows subscriber registration order, so every subscriber
 * has handled an event before {@link #publish} returns and the coordinator advances.
 * Events are not persisted.
 */
public interface EventBus {

    Subscription subscribe(EventChannel channel, EventSubscriber subscriber);

    /**
     * Subscribes to every channel.
     */
    Subscription subscribeAll(EventSubscriber subscriber);

    void publish(WorkflowEvent event);
}
