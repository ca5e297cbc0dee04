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
package dev.mars.subq.api.messaging;

import io.vertx.core.json.JsonObject;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A message handed to a {@link dev.mars.subq.api.connection.TopicPublisher}.
 *
 * @param messageId application message id
 * @param sessionId session the message belongs to, or null
 * @param headers application headers
 * @param payload message body
 */
public record OutgoingMessage(String messageId, String sessionId, Map<String, String> headers, JsonObject payload) {

    public OutgoingMessage {
        Objects.requireNonNull(messageId, "Message ID cannot be null");
        Objects.requireNonNull(payload, "Payload cannot be null");
        if (sessionId != null && sessionId.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be blank");
        }
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        payload = payload.copy();
    }

    /**
     * Creates a message with a random id and no session.
     */
    public static OutgoingMessage of(JsonObject payload) {
        return new OutgoingMessage(UUID.randomUUID().toString(), null, null, payload);
    }

    /**
     * Creates a message with a random id belonging to the given session.
     */
    public static OutgoingMessage forSession(String sessionId, JsonObject payload) {
        return new OutgoingMessage(UUID.randomUUID().toString(), sessionId, null, payload);
    }
}
