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
package dev.mars.subq.client.provider;

import dev.mars.subq.api.config.SubQConfiguration;
import dev.mars.subq.api.connection.ConnectionStringBuilder;
import dev.mars.subq.api.connection.SubscriptionConnection;
import dev.mars.subq.api.connection.SubscriptionConnectionRegistrar;
import dev.mars.subq.api.error.ConnectionFactoryException;
import dev.mars.subq.api.error.SubQError;
import dev.mars.subq.api.error.SubQException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of transport connection creators keyed by endpoint scheme.
 *
 * <p>Transport modules register themselves, e.g.
 * {@code PgConnectionRegistrar.registerWith(ConnectionProviderRegistry.getDefault())}.
 * {@link dev.mars.subq.client.SubscriptionClient#createFromConnectionString} then resolves
 * the transport from the {@code Endpoint} scheme of the connection string.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class ConnectionProviderRegistry implements SubscriptionConnectionRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionProviderRegistry.class);

    private static final ConnectionProviderRegistry DEFAULT = new ConnectionProviderRegistry();

    private final Map<String, ConnectionCreator> connectionCreators = new ConcurrentHashMap<>();

    /**
     * @return the process-wide registry used when no registry is passed explicitly
     */
    public static ConnectionProviderRegistry getDefault() {
        return DEFAULT;
    }

    @Override
    public void registerConnectionCreator(String scheme, ConnectionCreator creator) {
        if (scheme == null || scheme.isBlank()) {
            throw new IllegalArgumentException("Scheme cannot be null or blank");
        }
        Objects.requireNonNull(creator, "Connection creator cannot be null");
        connectionCreators.put(normalize(scheme), creator);
        logger.info("Registered connection creator for scheme: {}", normalize(scheme));
    }

    @Override
    public void unregisterConnectionCreator(String scheme) {
        if (scheme != null && connectionCreators.remove(normalize(scheme)) != null) {
            logger.info("Unregistered connection creator for scheme: {}", normalize(scheme));
        }
    }

    public Set<String> getSupportedSchemes() {
        return new TreeSet<>(connectionCreators.keySet());
    }

    public boolean isSchemeSupported(String scheme) {
        return scheme != null && connectionCreators.containsKey(normalize(scheme));
    }

    /**
     * Resolves the creator for the connection string's scheme, failing fast if none is registered.
     *
     * @throws IllegalArgumentException if no transport is registered for the scheme
     */
    public ConnectionCreator resolve(ConnectionStringBuilder connectionString) {
        ConnectionCreator creator = connectionCreators.get(connectionString.getScheme());
        if (creator == null) {
            throw new IllegalArgumentException("No transport registered for endpoint scheme: "
                + connectionString.getScheme() + ". Registered schemes: " + getSupportedSchemes());
        }
        return creator;
    }

    /**
     * Creates a connection for the given connection string.
     *
     * @throws IllegalArgumentException if no transport is registered for the scheme
     * @throws ConnectionFactoryException if the transport failed to create the connection
     */
    public SubscriptionConnection createConnection(ConnectionStringBuilder connectionString,
                                                   SubQConfiguration configuration) {
        Objects.requireNonNull(connectionString, "Connection string cannot be null");
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        ConnectionCreator creator = resolve(connectionString);

        try {
            logger.debug("Creating connection for endpoint: {}", connectionString.getEndpoint());
            SubscriptionConnection connection = creator.create(connectionString, configuration);
            logger.info("Created {} connection to {}", connectionString.getScheme(), connection.getEndpoint());
            return connection;
        } catch (SubQException e) {
            logger.error("Failed to create connection to {}", connectionString.getEndpoint(), e);
            throw e;
        } catch (Exception e) {
            logger.error("Failed to create connection to {}", connectionString.getEndpoint(), e);
            throw new ConnectionFactoryException(
                SubQError.connectionCreateFailed(connectionString.getEndpoint().toString(), e.getMessage()), e);
        }
    }

    private static String normalize(String scheme) {
        return scheme.trim().toLowerCase(Locale.ROOT);
    }
}
