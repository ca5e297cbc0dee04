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
import java.util.Optional;
import java.util.UUID;

/**
 * A message delivered by a receive or peek operation.
 *
 * <p>The lock token is only present for messages received under
 * {@link dev.mars.subq.api.ReceiveMode#PEEK_LOCK}. Peeked messages and messages
 * received under {@link dev.mars.subq.api.ReceiveMode#RECEIVE_AND_DELETE} never
 * carry one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface ReceivedMessage {

    /**
     * @return the application-assigned message id
     */
    String getMessageId();

    /**
     * @return the broker-assigned sequence number, unique within the subscription
     */
    long getSequenceNumber();

    /**
     * @return the lock token redeemable by settlement calls, if the message is locked for this receiver
     */
    Optional<UUID> getLockToken();

    /**
     * @return the lock expiry, or null if the message carries no lock
     */
    Instant getLockedUntil();

    /**
     * @return the number of times delivery of this message was given up
     */
    int getDeliveryCount();

    /**
     * @return when the broker accepted the message
     */
    Instant getEnqueuedAt();

    /**
     * @return the session the message belongs to, or null
     */
    String getSessionId();

    MessageState getState();

    /**
     * @return the dead-letter reason, or null if the message was never dead-lettered
     */
    String getDeadLetterReason();

    String getDeadLetterDescription();

    Map<String, String> getHeaders();

    JsonObject getPayload();
}
