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
package dev.mars.subq.api.receiver;

import dev.mars.subq.api.ReceiveMode;
import dev.mars.subq.api.messaging.ReceivedMessage;
import io.vertx.core.Future;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Transport capability bound to one entity path and receive mode.
 *
 * <p>Implementations talk to the broker; the broker is authoritative for lock state.
 * Settlement methods fail with {@link dev.mars.subq.api.error.MessageLockLostException}
 * when a token is unknown, expired or already settled. Multi-token settlement is
 * all-or-nothing.</p>
 *
 * <p>All methods return Vert.x Futures and never block the caller.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface MessageReceiver {

    /**
     * @return the entity path this receiver is bound to
     */
    String getPath();

    ReceiveMode getReceiveMode();

    /**
     * @return the default wait used by receive calls that do not specify one
     */
    Duration getOperationTimeout();

    int getPrefetchCount();

    /**
     * @param prefetchCount number of messages the receiver may buffer ahead of receive calls, not negative
     */
    void setPrefetchCount(int prefetchCount);

    /**
     * Receives up to {@code maxCount} messages, waiting up to {@code waitTime} for at least one.
     *
     * @return the messages, or an empty list if none arrived in time
     */
    Future<List<ReceivedMessage>> receive(int maxCount, Duration waitTime);

    /**
     * Receives active or deferred messages by sequence number. Numbers that match nothing are skipped.
     */
    Future<List<ReceivedMessage>> receiveBySequenceNumbers(Collection<Long> sequenceNumbers);

    /**
     * Reads up to {@code count} messages with a sequence number of at least {@code fromSequenceNumber}
     * without locking or otherwise changing them.
     */
    Future<List<ReceivedMessage>> peekBySequenceNumber(long fromSequenceNumber, int count);

    Future<Void> complete(Collection<UUID> lockTokens);

    Future<Void> abandon(Collection<UUID> lockTokens);

    Future<Void> defer(Collection<UUID> lockTokens);

    Future<Void> deadLetter(Collection<UUID> lockTokens, String reason, String description);

    /**
     * Extends the lock held by {@code lockToken}.
     *
     * @return the new lock expiry
     */
    Future<Instant> renewLock(UUID lockToken);

    /**
     * Releases the receiver. Safe to call multiple times.
     */
    Future<Void> close();

    boolean isClosed();
}
