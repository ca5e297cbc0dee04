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

import java.net.URI;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Parses connection strings of the form
 * {@code Endpoint=postgresql://host:5432/db;EntityPath=orders;Username=app;Password=secret}.
 *
 * <p>Keys are case-insensitive. {@code Endpoint} is required; its URI scheme selects the
 * transport. {@code EntityPath} names the topic for entity-level connection strings.
 * {@code OperationTimeout} is an ISO-8601 duration such as {@code PT30S}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class ConnectionStringBuilder {

    public static final String ENDPOINT = "Endpoint";
    public static final String ENTITY_PATH = "EntityPath";
    public static final String USERNAME = "Username";
    public static final String PASSWORD = "Password";
    public static final String OPERATION_TIMEOUT = "OperationTimeout";

    private final Map<String, String> values;
    private final URI endpoint;

    private ConnectionStringBuilder(Map<String, String> values, URI endpoint) {
        this.values = values;
        this.endpoint = endpoint;
    }

    /**
     * Parses a connection string.
     *
     * @throws IllegalArgumentException if the string is blank, malformed, or has no valid Endpoint
     */
    public static ConnectionStringBuilder parse(String connectionString) {
        if (connectionString == null || connectionString.isBlank()) {
            throw new IllegalArgumentException("Connection string cannot be null or blank");
        }

        Map<String, String> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String part : connectionString.split(";")) {
            if (part.isBlank()) {
                continue;
            }
            int eq = part.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Malformed connection string segment: '" + part.trim() + "'");
            }
            String key = part.substring(0, eq).trim();
            String value = part.substring(eq + 1).trim();
            if (values.put(key, value) != null) {
                throw new IllegalArgumentException("Duplicate connection string key: " + key);
            }
        }

        String endpointValue = values.get(ENDPOINT);
        if (endpointValue == null || endpointValue.isEmpty()) {
            throw new IllegalArgumentException("Connection string is missing required key: " + ENDPOINT);
        }
        URI endpoint;
        try {
            endpoint = URI.create(endpointValue);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid endpoint URI: " + endpointValue, e);
        }
        if (endpoint.getScheme() == null) {
            throw new IllegalArgumentException("Endpoint must include a scheme, e.g. postgresql://host:5432/db");
        }

        String timeout = values.get(OPERATION_TIMEOUT);
        if (timeout != null) {
            try {
                Duration parsed = Duration.parse(timeout);
                if (parsed.isNegative() || parsed.isZero()) {
                    throw new IllegalArgumentException("OperationTimeout must be positive, got: " + timeout);
                }
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("OperationTimeout must be an ISO-8601 duration, got: " + timeout, e);
            }
        }

        return new ConnectionStringBuilder(values, endpoint);
    }

    public URI getEndpoint() {
        return endpoint;
    }

    /**
     * @return the lower-case endpoint scheme, used to select the transport
     */
    public String getScheme() {
        return endpoint.getScheme().toLowerCase(Locale.ROOT);
    }

    public Optional<String> getEntityPath() {
        return get(ENTITY_PATH);
    }

    public Optional<String> getUsername() {
        return get(USERNAME);
    }

    public Optional<String> getPassword() {
        return get(PASSWORD);
    }

    public Optional<Duration> getOperationTimeout() {
        return get(OPERATION_TIMEOUT).map(Duration::parse);
    }

    /**
     * @return the value of any key, including transport-specific ones
     */
    public Optional<String> get(String key) {
        String value = values.get(key);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        values.forEach((key, value) -> {
            if (sb.length() > 0) {
                sb.append(';');
            }
            sb.append(key).append('=').append(PASSWORD.equalsIgnoreCase(key) ? "****" : value);
        });
        return sb.toString();
    }
}
