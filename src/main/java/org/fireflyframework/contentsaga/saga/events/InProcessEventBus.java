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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default {@link EventBus}. A subscriber that throws is logged and skipped; the remaining
 * subscribers still receive the event and the run is not affected.
 */
public class InProcessEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InProcessEventBus.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(EventChannel channel, EventSubscriber subscriber) {
        Objects.requireNonNull(channel, "channel");
        return register(new Registration(channel, subscriber));
    }

    @Override
    public Subscription subscribeAll(EventSubscriber subscriber) {
        return register(new Registration(null, subscriber));
    }

    private Subscription register(Registration registration) {
        Objects.requireNonNull(registration.subscriber, "subscriber");
        registrations.add(registration);
        log.debug("Registered subscriber {} on {}", registration.subscriber.getClass().getName(),
                registration.channel != null ? registration.channel.topic() : "*");
        return () -> registrations.remove(registration);
    }

    @Override
    public void publish(WorkflowEvent event) {
        for (Registration r : registrations) {
            if (r.channel != null && r.channel != event.channel()) {
                continue;
            }
            try {
                r.subscriber.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("{{\"bus_event\":\"subscriber_failed\",\"topic\":\"{}\",\"run_id\":\"{}\",\"subscriber\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}}",
                        event.channel().topic(), event.runId(), r.subscriber.getClass().getName(),
                        e.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    public int subscriberCount() {
        return registrations.size();
    }

    // identity equality: one registration per subscribe call
    private static final class Registration {
        private final EventChannel channel;
        private final EventSubscriber subscriber;

        private Registration(EventChannel channel, EventSubscriber subscriber) {
            this.channel = channel;
            this.subscriber = subscriber;
        }
    }
}
