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

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable {@link ReceivedMessage} built by transports.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class SimpleReceivedMessage implements ReceivedMessage {

    private final String messageId;
    private final long sequenceNumber;
    private final UUID lockToken;
    private final Instant lockedUntil;
    private final int deliveryCount;
    private final Instant enqueuedAt;
    private final String sessionId;
    private final MessageState state;
    private final String deadLetterReason;
    private final String deadLetterDescription;
    private final Map<String, String> headers;
    private final JsonObject payload;

    private SimpleReceivedMessage(Builder builder) {
        this.messageId = Objects.requireNonNull(builder.messageId, "Message ID cannot be null");
        this.sequenceNumber = builder.sequenceNumber;
        this.lockToken = builder.lockToken;
        this.lockedUntil = builder.lockToken != null ? builder.lockedUntil : null;
        this.deliveryCount = builder.deliveryCount;
        this.enqueuedAt = builder.enqueuedAt != null ? builder.enqueuedAt : Instant.now();
        this.sessionId = builder.sessionId;
        this.state = builder.state != null ? builder.state : MessageState.ACTIVE;
        this.deadLetterReason = builder.deadLetterReason;
        this.deadLetterDescription = builder.deadLetterDescription;
        this.headers = builder.headers != null ? Map.copyOf(builder.headers) : Map.of();
        this.payload = builder.payload != null ? builder.payload.copy() : new JsonObject();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this message's values
     */
    public Builder toBuilder() {
        return new Builder()
            .messageId(messageId)
            .sequenceNumber(sequenceNumber)
            .lock(lockToken, lockedUntil)
            .deliveryCount(deliveryCount)
            .enqueuedAt(enqueuedAt)
            .sessionId(sessionId)
            .state(state)
            .deadLetter(deadLetterReason, deadLetterDescription)
            .headers(headers)
            .payload(payload);
    }

    @Override
    public String getMessageId() {
        return messageId;
    }

    @Override
    public long getSequenceNumber() {
        return sequenceNumber;
    }

    @Override
    public Optional<UUID> getLockToken() {
        return Optional.ofNullable(lockToken);
    }

    @Override
    public Instant getLockedUntil() {
        return lockedUntil;
    }

    @Override
    public int getDeliveryCount() {
        return deliveryCount;
    }

    @Override
    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    @Override
    public String getSessionId() {
        return sessionId;
    }

    @Override
    public MessageState getState() {
        return state;
    }

    @Override
    public String getDeadLetterReason() {
        return deadLetterReason;
    }

    @Override
    public String getDeadLetterDescription() {
        return deadLetterDescription;
    }

    @Override
    public Map<String, String> getHeaders() {
        return headers;
    }

    @Override
    public JsonObject getPayload() {
        return payload.copy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimpleReceivedMessage that = (SimpleReceivedMessage) o;
        return sequenceNumber == that.sequenceNumber &&
               deliveryCount == that.deliveryCount &&
               Objects.equals(messageId, that.messageId) &&
               Objects.equals(lockToken, that.lockToken) &&
               Objects.equals(sessionId, that.sessionId) &&
               state == that.state &&
               Objects.equals(headers, that.headers) &&
               Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId, sequenceNumber, lockToken, deliveryCount, sessionId, state, headers, payload);
    }

    @Override
    public String toString() {
        return String.format(
            "SimpleReceivedMessage{messageId='%s', sequenceNumber=%d, lockToken=%s, deliveryCount=%d, sessionId='%s', state=%s}",
            messageId, sequenceNumber, lockToken, deliveryCount, sessionId, state
        );
    }

    public static class Builder {
        private String messageId;
        private long sequenceNumber;
        private UUID lockToken;
        private Instant lockedUntil;
        private int deliveryCount;
        private Instant enqueuedAt;
        private String sessionId;
        private MessageState state = MessageState.ACTIVE;
        private String deadLetterReason;
        private String deadLetterDescription;
        private Map<String, String> headers;
        private JsonObject payload;

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder sequenceNumber(long sequenceNumber) {
            this.sequenceNumber = sequenceNumber;
            return this;
        }

        /**
         * Sets the lock carried by the message. A null token clears the lock.
         */
        public Builder lock(UUID lockToken, Instant lockedUntil) {
            this.lockToken = lockToken;
            this.lockedUntil = lockedUntil;
            return this;
        }

        public Builder deliveryCount(int deliveryCount) {
            this.deliveryCount = deliveryCount;
            return this;
        }

        public Builder enqueuedAt(Instant enqueuedAt) {
            this.enqueuedAt = enqueuedAt;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder state(MessageState state) {
            this.state = state;
            return this;
        }

        public Builder deadLetter(String reason, String description) {
            this.deadLetterReason = reason;
            this.deadLetterDescription = description;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder payload(JsonObject payload) {
            this.payload = payload;
            return this;
        }

        public SimpleReceivedMessage build() {
            if (sequenceNumber < 0) {
                throw new IllegalArgumentException("Sequence number must be non-negative, got: " + sequenceNumber);
            }
            if (deliveryCount < 0) {
                throw new IllegalArgumentException("Delivery count must be non-negative, got: " + deliveryCount);
            }
            return new SimpleReceivedMessage(this);
        }
    }
}
