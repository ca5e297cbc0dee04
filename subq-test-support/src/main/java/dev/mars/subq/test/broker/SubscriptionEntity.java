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
package dev.mars.subq.test.broker;

import dev.mars.subq.api.ReceiveMode;
import dev.mars.subq.api.SubscriptionPath;
import dev.mars.subq.api.error.MessageLockLostException;
import dev.mars.subq.api.error.SessionLockLostException;
import dev.mars.subq.api.messaging.MessageState;
import dev.mars.subq.api.messaging.OutgoingMessage;
import dev.mars.subq.api.messaging.ReceivedMessage;
import dev.mars.subq.api.messaging.SimpleReceivedMessage;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * State of one subscription inside the {@link InMemoryBroker}: its messages, its dead-letter
 * sub-queue and its session locks. Every method is atomic with respect to the others.
 */
final class SubscriptionEntity {

    static final String MAX_DELIVERY_COUNT_EXCEEDED = "MaxDeliveryCountExceeded";

    enum Disposition { COMPLETE, ABANDON, DEFER, DEAD_LETTER }

    /**
     * What a receiver can see: the dead-letter sub-queue, or the main queue restricted to
     * one session (or to messages without a session when {@code sessionId} is null).
     * A non-null owner means every call first checks the session lock is still held.
     */
    record Scope(boolean deadLetter, String sessionId, UUID sessionOwner) {
        static final Scope MAIN = new Scope(false, null, null);
        static final Scope DEAD_LETTER = new Scope(true, null, null);

        static Scope session(String sessionId, UUID owner) {
            return new Scope(false, sessionId, owner);
        }
    }

    record SessionGrant(String sessionId, UUID owner, Instant lockedUntil) {
    }

    private final SubscriptionPath path;
    private final int maxDeliveryCount;
    private final TreeMap<Long, StoredMessage> messages = new TreeMap<>();
    private final TreeMap<Long, StoredMessage> deadLetters = new TreeMap<>();
    private final Map<String, SessionLock> sessionLocks = new HashMap<>();
    private final Map<String, Buffer> sessionStates = new HashMap<>();

    SubscriptionEntity(SubscriptionPath path, int maxDeliveryCount) {
        this.path = path;
        this.maxDeliveryCount = maxDeliveryCount;
    }

    SubscriptionPath getPath() {
        return path;
    }

    int getMaxDeliveryCount() {
        return maxDeliveryCount;
    }

    synchronized void enqueue(long sequenceNumber, OutgoingMessage message) {
        messages.put(sequenceNumber, new StoredMessage(sequenceNumber, message));
    }

    // ------------------------------------------------------------------------
    // Receive and peek
    // ------------------------------------------------------------------------

    synchronized List<ReceivedMessage> claim(Scope scope, ReceiveMode mode, int maxCount, Duration lockDuration) {
        checkSessionOwned(scope);
        Instant now = Instant.now();
        List<ReceivedMessage> claimed = new ArrayList<>();
        Iterator<StoredMessage> it = queue(scope).values().iterator();
        while (it.hasNext() && claimed.size() < maxCount) {
            StoredMessage m = it.next();
            if (!inScope(scope, m) || m.state == MessageState.DEFERRED || m.isLocked(now)) {
                continue;
            }
            if (reclaimExpired(scope, m)) {
                it.remove();
                moveToDeadLetter(m, MAX_DELIVERY_COUNT_EXCEEDED, deliveryCountDescription());
                continue;
            }
            claimed.add(deliver(m, mode, lockDuration, now, it));
        }
        return claimed;
    }

    synchronized List<ReceivedMessage> claimBySequenceNumbers(Scope scope, ReceiveMode mode,
                                                             Collection<Long> sequenceNumbers, Duration lockDuration) {
        checkSessionOwned(scope);
        Instant now = Instant.now();
        TreeMap<Long, StoredMessage> queue = queue(scope);
        List<ReceivedMessage> claimed = new ArrayList<>();
        for (Long sequenceNumber : new LinkedHashSet<>(sequenceNumbers)) {
            StoredMessage m = queue.get(sequenceNumber);
            if (m == null || !inScope(scope, m) || m.isLocked(now)) {
                continue;
            }
            if (reclaimExpired(scope, m)) {
                queue.remove(sequenceNumber);
                moveToDeadLetter(m, MAX_DELIVERY_COUNT_EXCEEDED, deliveryCountDescription());
                continue;
            }
            if (mode == ReceiveMode.RECEIVE_AND_DELETE) {
                queue.remove(sequenceNumber);
                claimed.add(m.snapshot(false));
            } else {
                m.lock(now.plus(lockDuration));
                claimed.add(m.snapshot(true));
            }
        }
        return claimed;
    }

    synchronized List<ReceivedMessage> peek(Scope scope, long fromSequenceNumber, int count) {
        checkSessionOwned(scope);
        List<ReceivedMessage> peeked = new ArrayList<>();
        for (StoredMessage m : queue(scope).tailMap(fromSequenceNumber, true).values()) {
            if (peeked.size() >= count) {
                break;
            }
            if (inScope(scope, m)) {
                peeked.add(m.snapshot(false));
            }
        }
        return peeked;
    }

    /**
     * Releases a lock that expired without settlement and counts it as a failed delivery.
     *
     * @return true if the message has now reached the max delivery count and must be dead-lettered
     */
    private boolean reclaimExpired(Scope scope, StoredMessage m) {
        if (m.lockToken == null) {
            return false;
        }
        m.releaseLock();
        m.deliveryCount++;
        return !scope.deadLetter() && m.deliveryCount >= maxDeliveryCount;
    }

    private ReceivedMessage deliver(StoredMessage m, ReceiveMode mode, Duration lockDuration, Instant now,
                                    Iterator<StoredMessage> it) {
        if (mode == ReceiveMode.RECEIVE_AND_DELETE) {
            it.remove();
            return m.snapshot(false);
        }
        m.lock(now.plus(lockDuration));
        return m.snapshot(true);
    }

    // ------------------------------------------------------------------------
    // Settlement
    // ------------------------------------------------------------------------

    synchronized void settle(Scope scope, Collection<UUID> lockTokens, Disposition disposition,
                             String reason, String description) {
        checkSessionOwned(scope);
        Instant now = Instant.now();
        Map<UUID, StoredMessage> found = new LinkedHashMap<>();
        List<UUID> lost = new ArrayList<>();
        for (UUID token : new LinkedHashSet<>(lockTokens)) {
            StoredMessage m = findLocked(scope, token, now);
            if (m == null) {
                lost.add(token);
            } else {
                found.put(token, m);
            }
        }
        if (!lost.isEmpty()) {
            throw new MessageLockLostException(entityPath(scope), lost);
        }

        TreeMap<Long, StoredMessage> queue = queue(scope);
        for (StoredMessage m : found.values()) {
            m.releaseLock();
            switch (disposition) {
                case COMPLETE:
                    queue.remove(m.sequenceNumber);
                    break;
                case ABANDON:
                    m.deliveryCount++;
                    if (!scope.deadLetter() && m.deliveryCount >= maxDeliveryCount) {
                        queue.remove(m.sequenceNumber);
                        moveToDeadLetter(m, MAX_DELIVERY_COUNT_EXCEEDED, deliveryCountDescription());
                    }
                    break;
                case DEFER:
                    m.state = MessageState.DEFERRED;
                    break;
                case DEAD_LETTER:
                    queue.remove(m.sequenceNumber);
                    moveToDeadLetter(m, reason, description);
                    break;
                default:
                    throw new IllegalStateException("Unknown disposition: " + disposition);
            }
        }
    }

    synchronized Instant renewLock(Scope scope, UUID lockToken, Duration lockDuration) {
        checkSessionOwned(scope);
        Instant now = Instant.now();
        StoredMessage m = findLocked(scope, lockToken, now);
        if (m == null) {
            throw new MessageLockLostException(entityPath(scope), List.of(lockToken));
        }
        m.lockedUntil = now.plus(lockDuration);
        return m.lockedUntil;
    }

    private StoredMessage findLocked(Scope scope, UUID token, Instant now) {
        for (StoredMessage m : queue(scope).values()) {
            if (token.equals(m.lockToken)) {
                return m.isLocked(now) && inScope(scope, m) ? m : null;
            }
        }
        return null;
    }

    private void moveToDeadLetter(StoredMessage m, String reason, String description) {
        m.state = MessageState.DEAD_LETTERED;
        m.deadLetterReason = reason;
        m.deadLetterDescription = description;
        deadLetters.put(m.sequenceNumber, m);
    }

    private String deliveryCountDescription() {
        return "Message could not be consumed after " + maxDeliveryCount + " delivery attempts";
    }

    // ------------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------------

    /**
     * @return the grant, or empty if another owner holds an unexpired lock on the session
     */
    synchronized Optional<SessionGrant> tryLockSession(String sessionId, Duration lockDuration) {
        Instant now = Instant.now();
        SessionLock existing = sessionLocks.get(sessionId);
        if (existing != null && existing.lockedUntil.isAfter(now)) {
            return Optional.empty();
        }
        SessionLock lock = new SessionLock(UUID.randomUUID(), now.plus(lockDuration));
        sessionLocks.put(sessionId, lock);
        return Optional.of(new SessionGrant(sessionId, lock.owner, lock.lockedUntil));
    }

    /**
     * Locks the unlocked session whose oldest available message has the lowest sequence number.
     */
    synchronized Optional<SessionGrant> tryLockAnySession(Duration lockDuration) {
        Instant now = Instant.now();
        for (StoredMessage m : messages.values()) {
            if (m.sessionId == null || m.state != MessageState.ACTIVE || m.isLocked(now)) {
                continue;
            }
            SessionLock existing = sessionLocks.get(m.sessionId);
            if (existing == null || !existing.lockedUntil.isAfter(now)) {
                return tryLockSession(m.sessionId, lockDuration);
            }
        }
        return Optional.empty();
    }

    synchronized Instant renewSessionLock(String sessionId, UUID owner, Duration lockDuration) {
        SessionLock lock = ownedLock(sessionId, owner);
        lock.lockedUntil = Instant.now().plus(lockDuration);
        return lock.lockedUntil;
    }

    synchronized void releaseSession(String sessionId, UUID owner) {
        SessionLock lock = sessionLocks.get(sessionId);
        if (lock != null && lock.owner.equals(owner)) {
            sessionLocks.remove(sessionId);
        }
    }

    synchronized Optional<Buffer> getSessionState(String sessionId, UUID owner) {
        ownedLock(sessionId, owner);
        Buffer state = sessionStates.get(sessionId);
        return state == null ? Optional.empty() : Optional.of(state.copy());
    }

    synchronized void setSessionState(String sessionId, UUID owner, Buffer state) {
        ownedLock(sessionId, owner);
        if (state == null) {
            sessionStates.remove(sessionId);
        } else {
            sessionStates.put(sessionId, state.copy());
        }
    }

    private void checkSessionOwned(Scope scope) {
        if (scope.sessionOwner() != null) {
            ownedLock(scope.sessionId(), scope.sessionOwner());
        }
    }

    private SessionLock ownedLock(String sessionId, UUID owner) {
        SessionLock lock = sessionLocks.get(sessionId);
        if (lock == null || !lock.owner.equals(owner) || !lock.lockedUntil.isAfter(Instant.now())) {
            throw new SessionLockLostException(path.getPath(), sessionId);
        }
        return lock;
    }

    // ------------------------------------------------------------------------
    // Inspection
    // ------------------------------------------------------------------------

    synchronized int activeMessageCount() {
        return messages.size();
    }

    synchronized int deadLetterMessageCount() {
        return deadLetters.size();
    }

    private TreeMap<Long, StoredMessage> queue(Scope scope) {
        return scope.deadLetter() ? deadLetters : messages;
    }

    private boolean inScope(Scope scope, StoredMessage m) {
        if (scope.deadLetter()) {
            return true;
        }
        return scope.sessionId() == null ? m.sessionId == null : scope.sessionId().equals(m.sessionId);
    }

    private String entityPath(Scope scope) {
        return scope.deadLetter() ? path.deadLetterPath() : path.getPath();
    }

    private static final class SessionLock {
        private final UUID owner;
        private Instant lockedUntil;

        private SessionLock(UUID owner, Instant lockedUntil) {
            this.owner = owner;
            this.lockedUntil = lockedUntil;
        }
    }

    private static final class StoredMessage {
        private final long sequenceNumber;
        private final String messageId;
        private final String sessionId;
        private final Map<String, String> headers;
        private final JsonObject payload;
        private final Instant enqueuedAt = Instant.now();
        private MessageState state = MessageState.ACTIVE;
        private int deliveryCount;
        private UUID lockToken;
        private Instant lockedUntil;
        private String deadLetterReason;
        private String deadLetterDescription;

        private StoredMessage(long sequenceNumber, OutgoingMessage message) {
            this.sequenceNumber = sequenceNumber;
            this.messageId = message.messageId();
            this.sessionId = message.sessionId();
            this.headers = message.headers();
            this.payload = message.payload();
        }

        private boolean isLocked(Instant now) {
            return lockToken != null && lockedUntil.isAfter(now);
        }

        private void lock(Instant until) {
            lockToken = UUID.randomUUID();
            lockedUntil = until;
        }

        private void releaseLock() {
            lockToken = null;
            lockedUntil = null;
        }

        private ReceivedMessage snapshot(boolean withLock) {
            return SimpleReceivedMessage.builder()
                .messageId(messageId)
                .sequenceNumber(sequenceNumber)
                .lock(withLock ? lockToken : null, withLock ? lockedUntil : null)
                .deliveryCount(deliveryCount)
                .enqueuedAt(enqueuedAt)
                .sessionId(sessionId)
                .state(state)
                .deadLetter(deadLetterReason, deadLetterDescription)
                .headers(headers)
                .payload(payload)
                .build();
        }
    }
}
