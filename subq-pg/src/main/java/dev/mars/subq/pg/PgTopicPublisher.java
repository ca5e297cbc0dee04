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

import dev.mars.subq.api.connection.TopicPublisher;
import dev.mars.subq.api.messaging.OutgoingMessage;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Publishes to a topic by inserting one row per subscription of the topic, all in one statement.
 * Each copy takes its own sequence number.
 */
public class PgTopicPublisher implements TopicPublisher {
    private static final Logger logger = LoggerFactory.getLogger(PgTopicPublisher.class);

    private static final String INSERT_COPIES = """
        INSERT INTO subq_messages (entity_path, sequence_number, message_id, session_id, headers, payload)
        SELECT s.entity_path, nextval('subq_sequence_numbers'), $2::text, $3::text, $4::jsonb, $5::jsonb
        FROM subq_subscriptions s
        WHERE s.topic_path = $1
        ORDER BY s.entity_path
        """;

    private final Pool pool;

    public PgTopicPublisher(Pool pool) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
    }

    @Override
    public Future<Integer> send(String topicPath, OutgoingMessage message) {
        Objects.requireNonNull(message, "Message cannot be null");
        if (topicPath == null || topicPath.isBlank()) {
            throw new IllegalArgumentException("Topic path cannot be null or blank");
        }
        String topic = topicPath.trim().replaceAll("^/+|/+$", "");
        Tuple params = Tuple.tuple()
            .addString(topic)
            .addString(message.messageId())
            .addString(message.sessionId())
            .addValue(PgMessageMapper.headersToJson(message.headers()))
            .addValue(message.payload());
        return pool.preparedQuery(INSERT_COPIES)
            .execute(params)
            .map(rows -> {
                logger.debug("Published message {} to {} subscription(s) of {}", message.messageId(), rows.rowCount(), topic);
                return rows.rowCount();
            });
    }
}
