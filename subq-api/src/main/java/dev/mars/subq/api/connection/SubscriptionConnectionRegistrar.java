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
package dev.mars.subq.api.connection;

import dev.mars.subq.api.config.SubQConfiguration;

/**
 * Registry that transport modules register their connection creators with.
 *
 * <p>Transports register under the endpoint URI scheme they handle, e.g.
 * {@code postgresql}. This keeps the client free of compile-time dependencies on any
 * transport implementation.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface SubscriptionConnectionRegistrar {

    /**
     * Registers a connection creator for an endpoint scheme, replacing any previous one.
     *
     * @param scheme the endpoint URI scheme, case-insensitive
     * @param creator the creator
     */
    void registerConnectionCreator(String scheme, ConnectionCreator creator);

    /**
     * @param scheme the endpoint URI scheme to unregister
     */
    void unregisterConnectionCreator(String scheme);

    /**
     * Creates connections from parsed connection strings.
     */
    @FunctionalInterface
    interface ConnectionCreator {
        /**
         * @param connectionString the parsed connection string
         * @param configuration the active configuration
         * @return a new connection
         * @throws Exception if the connection cannot be created
         */
        SubscriptionConnection create(ConnectionStringBuilder connectionString,
                                      SubQConfiguration configuration) throws Exception;
    }
}
