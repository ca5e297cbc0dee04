/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
package dev.mars.subq.pg;

import dev.mars.subq.api.config.SubQConfiguration;
import dev.mars.subq.api.connection.ConnectionStringBuilder;
import dev.mars.subq.api.connection.SubscriptionConnection;
import dev.mars.subq.api.connection.SubscriptionConnectionRegistrar;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Registers the PostgreSQL transport under the {@code postgresql} and {@code postgres} endpoint
 * schemes. Each connection created this way owns a pool of its own.
 *
 * <pre>{@code
 * PgConnectionRegistrar.registerWith(ConnectionProviderRegistry.getDefault(), vertx);
 * SubscriptionClient client = SubscriptionClient.createFromConnectionString(
 *     "Endpoint=postgresql://db:5432/subq;Username=subq;Password=secret;EntityPath=orders",
 *     "billing", SubscriptionClientConfig.defaultConfig());
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class PgConnectionRegistrar {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionRegistrar.class);

    public static final String SCHEME = "postgresql";
    public static final List<String> SCHEMES = List.of(SCHEME, "postgres");

    private PgConnectionRegistrar() {
    }

    /**
     * @param registrar the registrar to register with
     * @param vertx the Vert.x instance pools are created on
     */
    public static void registerWith(SubscriptionConnectionRegistrar registrar, Vertx vertx) {
        Objects.requireNonNull(vertx, "Vertx cannot be null");
        PgConnectionCreator creator = new PgConnectionCreator(vertx);
        for (String scheme : SCHEMES) {
            registrar.registerConnectionCreator(scheme, creator);
        }
        logger.info("Registered PostgreSQL transport under schemes {}", SCHEMES);
    }

    public static void unregisterFrom(SubscriptionConnectionRegistrar registrar) {
        for (String scheme : SCHEMES) {
            registrar.unregisterConnectionCreator(scheme);
        }
        logger.debug("Unregistered PostgreSQL transport schemes {}", SCHEMES);
    }

    private static class PgConnectionCreator implements SubscriptionConnectionRegistrar.ConnectionCreator {
        private final Vertx vertx;

        PgConnectionCreator(Vertx vertx) {
            this.vertx = vertx;
        }

        @Override
        public SubscriptionConnection create(ConnectionStringBuilder connectionString,
                                             SubQConfiguration configuration) {
            return PgSubscriptionConnection.connect(vertx, connectionString, configuration);
        }
    }
}
