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
import dev.mars.subq.api.messaging.ReceivedMessage;
import dev.mars.subq.api.receiver.PeekCursor;
import dev.mars.subq.api.session.MessageSession;
import dev.mars.subq.test.broker.SubscriptionEntity.Scope;
import dev.mars.subq.test.broker.SubscriptionEntity.SessionGrant;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Session of an {@link InMemoryBroker} subscription, holding the session lock until closed.
 */
public class InMemoryMessageSession extends InMemoryMessageReceiver implements MessageSession {

    private final String sessionId;
    private final UUID owner;
    private final PeekCursor peekCursor = new PeekCursor();
    private volatile Instant lockedUntil;

    InMemoryMessageSession(InMemoryBroker broker, SubscriptionEntity entity, ReceiveMode receiveMode,
                           SessionGrant grant, Duration operationTimeout,
                           Consumer<InMemoryMessageReceiver> onClose) {
        super(broker, entity, entity.getPath().getPath(), receiveMode,
              Scope.session(grant.sessionId(), grant.owner()), operationTimeout, onClose);
        this.sessionId = grant.sessionId();
        this.owner = grant.owner();
        this.lockedUntil = grant.lockedUntil();
    }

    @Override
    public String getSessionId() {
        return sessionId;
    }

    @Override
    public Instant getLockedUntil() {
        return lockedUntil;
    }

    @Override
    public Future<Instant> renewSessionLock() {
        checkOpen();
        Duration lockDuration = broker.brokerConfig().sessionLockDuration();
        return call(() -> entity.renewSessionLock(sessionId, owner, lockDuration))
            .onSuccess(renewed -> lockedUntil = renewed);
    }

    @Override
    public Future<Optional<Buffer>> getState() {
        checkOpen();
        return call(() -> entity.getSessionState(sessionId, owner));
    }

    @Override
    public Future<Void> setState(Buffer state) {
        checkOpen();
        return call(() -> {
            entity.setSessionState(sessionId, owner, state);
            return null;
        });
    }

    @Override
    public Future<List<ReceivedMessage>> peek(int count) {
        checkOpen();
        return peekBySequenceNumber(peekCursor.next(), count).map(peekCursor::advance);
    }

    @Override
    public Future<Void> close() {
        if (!isClosed()) {
            entity.releaseSession(sessionId, owner);
        }
        return super.close();
    }

    @Override
    public String toString() {
        return "InMemoryMessageSession{" + getPath() + ", session=" + sessionId + "}";
    }
}
