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
package dev.mars.subq.client;

import dev.mars.subq.api.SubscriptionPath;
import dev.mars.subq.api.config.SubQConfiguration;
import dev.mars.subq.api.connection.ConnectionStringBuilder;
import dev.mars.subq.api.connection.SubscriptionConnection;
import dev.mars.subq.client.provider.ConnectionProviderRegistry;
import io.vertx.core.Future;

import java.util.Objects;

/**
 * A connection scoped to one topic. Clients created from it share the connection
 * and never close it; whoever created the topic connection closes it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class TopicConnection {

    private final SubscriptionConnection connection;
    private final String topicPath;

    private TopicConnection(SubscriptionConnection connection, String topicPath) {
        this.connection = connection;
        this.topicPath = topicPath;
    }

    public static TopicConnection of(SubscriptionConnection connection, String topicPath) {
        Objects.requireNonNull(connection, "Connection cannot be null");
        if (topicPath == null || topicPath.isBlank()) {
            throw new IllegalArgumentException("Topic path cannot be null or blank");
        }
        return new TopicConnection(connection, topicPath);
    }

    /**
     * Creates a topic connection from an entity-level connection string whose
     * {@code EntityPath} names the topic.
     */
    public static TopicConnection fromConnectionString(String connectionString,
                                                      ConnectionProviderRegistry registry,
                                                      SubQConfiguration configuration) {
        ConnectionStringBuilder builder = ConnectionStringBuilder.parse(connectionString);
        String topicPath = builder.getEntityPath().orElseThrow(() ->
            new IllegalArgumentException("Connection string must contain EntityPath naming the topic"));
        return of(registry.createConnection(builder, configuration), topicPath);
    }

    public SubscriptionConnection getConnection() {
        return connection;
    }

    public String getTopicPath() {
        return topicPath;
    }

    public SubscriptionPath subscriptionPath(String subscriptionName) {
        return SubscriptionPath.of(topicPath, subscriptionName);
    }

    public Future<Void> close() {
        return connection.close();
    }

    @Override
    public String toString() {
        return "TopicConnection{" + connection.getEndpoint() + ", topic=" + topicPath + '}';
    }
}
