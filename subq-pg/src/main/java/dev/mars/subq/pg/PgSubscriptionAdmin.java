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

import dev.mars.subq.api.SubscriptionPath;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Schema setup and subscription management for the PostgreSQL transport.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgSubscriptionAdmin {
    private static final Logger logger = LoggerFactory.getLogger(PgSubscriptionAdmin.class);

    static final String SCHEMA_SCRIPT = "/db/subq-schema.sql";

    private static final String UPSERT_SUBSCRIPTION = """
        INSERT INTO subq_subscriptions (entity_path, topic_path, subscription_name, max_delivery_count)
        VALUES ($1, $2, $3, $4)
        ON CONFLICT (entity_path) DO UPDATE SET max_delivery_count = EXCLUDED.max_delivery_count
        """;

    private static final String COUNT_MESSAGES = """
        SELECT count(*) FILTER (WHERE state <> 'DEAD_LETTERED') AS active,
               count(*) FILTER (WHERE state = 'DEAD_LETTERED') AS dead_lettered
        FROM subq_messages WHERE entity_path = $1
        """;

    private final Pool pool;
    private final int defaultMaxDeliveryCount;

    public PgSubscriptionAdmin(Pool pool, int defaultMaxDeliveryCount) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        if (defaultMaxDeliveryCount < 1) {
            throw new IllegalArgumentException("Max delivery count must be positive, got: " + defaultMaxDeliveryCount);
        }
        this.defaultMaxDeliveryCount = defaultMaxDeliveryCount;
    }

    /**
     * Creates the SubQ tables if they do not exist yet. Safe to run on every start.
     */
    public Future<Void> initializeSchema() {
        logger.info("Initializing SubQ schema");
        return loadSchemaScript()
            .compose(this::executeSchemaScript)
            .onSuccess(v -> logger.info("SubQ schema initialized"))
            .onFailure(error -> logger.error("Failed to initialize SubQ schema", error));
    }

    private Future<String> loadSchemaScript() {
        return Future.future(promise -> {
            try (InputStream is = getClass().getResourceAsStream(SCHEMA_SCRIPT)) {
                if (is == null) {
                    promise.fail(new IllegalStateException("Schema script not found: " + SCHEMA_SCRIPT));
                    return;
                }
                try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                    promise.complete(reader.lines().collect(Collectors.joining("\n")));
                }
            } catch (IOException e) {
                promise.fail(e);
            }
        });
    }

    private Future<Void> executeSchemaScript(String script) {
        List<String> statements = parseStatements(script);
        logger.debug("Executing {} schema statement(s)", statements.size());
        return pool.withTransaction(conn -> {
            Future<Void> chain = Future.succeededFuture();
            for (String statement : statements) {
                chain = chain.compose(v -> conn.query(statement).execute().mapEmpty());
            }
            return chain;
        });
    }

    /**
     * Splits a script on semicolons after dropping {@code --} comment lines.
     */
    static List<String> parseStatements(String script) {
        String withoutComments = script.lines()
            .filter(line -> !line.trim().startsWith("--"))
            .collect(Collectors.joining("\n"));
        List<String> statements = new ArrayList<>();
        for (String part : withoutComments.split(";")) {
            String statement = part.trim();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }

    public Future<SubscriptionPath> createSubscription(String topicPath, String subscriptionName) {
        return createSubscription(topicPath, subscriptionName, defaultMaxDeliveryCount);
    }

    /**
     * Creates a subscription, or updates the max delivery count of an existing one.
     */
    public Future<SubscriptionPath> createSubscription(String topicPath, String subscriptionName, int maxDeliveryCount) {
        SubscriptionPath path = SubscriptionPath.of(topicPath, subscriptionName);
        if (maxDeliveryCount < 1) {
            throw new IllegalArgumentException("Max delivery count must be positive, got: " + maxDeliveryCount);
        }
        return pool.preparedQuery(UPSERT_SUBSCRIPTION)
            .execute(Tuple.of(path.getPath(), path.getTopicPath(), path.getSubscriptionName(), maxDeliveryCount))
            .map(rows -> {
                logger.info("Created subscription {} (max delivery count {})", path, maxDeliveryCount);
                return path;
            });
    }

    /**
     * Deletes a subscription with all its messages, session locks and session state.
     *
     * @return true if the subscription existed
     */
    public Future<Boolean> deleteSubscription(SubscriptionPath path) {
        return pool.preparedQuery("DELETE FROM subq_subscriptions WHERE entity_path = $1")
            .execute(Tuple.of(path.getPath()))
            .map(rows -> {
                boolean deleted = rows.rowCount() > 0;
                if (deleted) {
                    logger.info("Deleted subscription {}", path);
                }
                return deleted;
            });
    }

    /**
     * @return active and deferred messages on the subscription, locked or not
     */
    public Future<Long> getActiveMessageCount(SubscriptionPath path) {
        return countMessages(path, "active");
    }

    public Future<Long> getDeadLetterMessageCount(SubscriptionPath path) {
        return countMessages(path, "dead_lettered");
    }

    private Future<Long> countMessages(SubscriptionPath path, String column) {
        return pool.preparedQuery(COUNT_MESSAGES)
            .execute(Tuple.of(path.getPath()))
            .map(rows -> rows.iterator().next().getLong(column));
    }
}
