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

package org.fireflyframework.contentsaga.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import org.fireflyframework.contentsaga.saga.registry.StepPolicy;
import org.fireflyframework.contentsaga.shared.gateway.DeleteMode;
import org.fireflyframework.contentsaga.shared.gateway.PersistenceBackend;
import org.fireflyframework.contentsaga.shared.gateway.inmemory.InMemoryPersistenceBackend;
import org.fireflyframework.contentsaga.shared.gateway.r2dbc.R2dbcPersistenceBackend;

import java.time.Duration;
import java.util.UUID;

/**
 * Backends and policies shared by the tests. Every relational backend gets its own
 * in-memory H2 database.
 */
public final class TestBackends {

    private TestBackends() {
    }

    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public static String h2Url() {
        return "r2dbc:h2:mem:///saga-" + UUID.randomUUID() + "?options=DB_CLOSE_DELAY=-1";
    }

    public static ConnectionFactory h2ConnectionFactory() {
        return ConnectionFactories.get(h2Url());
    }

    public static InMemoryPersistenceBackend inMemory() {
        return new InMemoryPersistenceBackend(objectMapper());
    }

    public static R2dbcPersistenceBackend relational() {
        return relational(DeleteMode.HARD);
    }

    public static R2dbcPersistenceBackend relational(DeleteMode deleteMode) {
        R2dbcPersistenceBackend backend = new R2dbcPersistenceBackend(h2ConnectionFactory(), objectMapper(), deleteMode);
        backend.initialize().block();
        return backend;
    }

    public static PersistenceBackend of(String mode) {
        return "relational".equals(mode) ? relational() : inMemory();
    }

    /**
     * Short timeouts and backoffs so retry paths run quickly.
     */
    public static StepPolicy fastPolicy() {
        return new StepPolicy(Duration.ofSeconds(2), 3, Duration.ofMillis(5), false, 0.5d, Duration.ofSeconds(2), 2);
    }
}
