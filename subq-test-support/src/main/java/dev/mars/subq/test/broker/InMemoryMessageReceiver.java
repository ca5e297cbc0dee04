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
import dev.mars.subq.api.receiver.MessageReceiver;
import dev.mars.subq.test.broker.SubscriptionEntity.Disposition;
import dev.mars.subq.test.broker.SubscriptionEntity.Scope;
import io.vertx.core.Future;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link MessageReceiver} over a subscription, or its dead-letter sub-queue, of an {@link InMemoryBroker}.
 * Prefetch is recorded but has no effect.
 */
public class InMemoryMessageReceiver implements MessageReceiver {

    protected final InMemoryBroker broker;
    protected final SubscriptionEntity entity;
    private final String entityPath;
    private final ReceiveMode receiveMode;
    private final Duration operationTimeout;
    private final Consumer<InMemoryMessageReceiver> onClose;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Scope scope;
    private volatile int prefetchCount;

    InMemoryMessageReceiver(InMemoryBroker broker, SubscriptionEntity entity, String entityPath,
                            ReceiveMode receiveMode, Scope scope, Duration operationTimeout,
                            Consumer<InMemoryMessageReceiver> onClose) {
        this.broker = broker;
        this.entity = entity;
        this.entityPath = entityPath;
        this.receiveMode = Objects.requireNonNull(receiveMode, "Receive mode cannot be null");
        this.scope = scope;
        this.operationTimeout = operationTimeout;
        this.onClose = onClose;
    }

    @Override
    public String getPath() {
        return entityPath;
    }

    @Override
    public ReceiveMode getReceiveMode() {
        return receiveMode;
    }

    @Override
    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    @Override
    public int getPrefetchCount() {
        return prefetchCount;
    }

    @Override
    public void setPrefetchCount(int prefetchCount) {
        if (prefetchCount < 0) {
            throw new IllegalArgumentException("Prefetch count must be non-negative, got: " + prefetchCount);
        }
        this.prefetchCount = prefetchCount;
    }

    @Override
    public Future<List<ReceivedMessage>> receive(int maxCount, Duration waitTime) {
        checkOpen();
        if (maxCount < 1) {
            throw new IllegalArgumentException("Max count must be positive, got: " + maxCount);
        }
        Duration lockDuration = broker.brokerConfig().lockDuration();
        return broker.poll(() -> entity.claim(scope, receiveMode, maxCount, lockDuration),
            messages -> !messages.isEmpty(), waitTime);
    }

    @Override
    public Future<List<ReceivedMessage>> receiveBySequenceNumbers(Collection<Long> sequenceNumbers) {
        checkOpen();
        Duration lockDuration = broker.brokerConfig().lockDuration();
        return call(() -> entity.claimBySequenceNumbers(scope, receiveMode, sequenceNumbers, lockDuration));
    }

    @Override
    public Future<List<ReceivedMessage>> peekBySequenceNumber(long fromSequenceNumber, int count) {
        checkOpen();
        return call(() -> entity.peek(scope, fromSequenceNumber, count));
    }

    @Override
    public Future<Void> complete(Collection<UUID> lockTokens) {
        return settle(lockTokens, Disposition.COMPLETE, null, null);
    }

    @Override
    public Future<Void> abandon(Collection<UUID> lockTokens) {
        return settle(lockTokens, Disposition.ABANDON, null, null);
    }

    @Override
    public Future<Void> defer(Collection<UUID> lockTokens) {
        checkNotDeadLetterQueue("defer");
        return settle(lockTokens, Disposition.DEFER, null, null);
    }

    @Override
    public Future<Void> deadLetter(Collection<UUID> lockTokens, String reason, String description) {
        checkNotDeadLetterQueue("deadLetter");
        return settle(lockTokens, Disposition.DEAD_LETTER, reason, description);
    }

    @Override
    public Future<Instant> renewLock(UUID lockToken) {
        checkSettlement();
        Duration lockDuration = broker.brokerConfig().lockDuration();
        return call(() -> entity.renewLock(scope, lockToken, lockDuration));
    }

    private Future<Void> settle(Collection<UUID> lockTokens, Disposition disposition, String reason, String description) {
        checkSettlement();
        return call(() -> {
            entity.settle(scope, lockTokens, disposition, reason, description);
            return null;
        });
    }

    @Override
    public Future<Void> close() {
        if (closed.compareAndSet(false, true)) {
            onClose.accept(this);
        }
        return Future.succeededFuture();
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    protected <T> Future<T> call(Supplier<T> operation) {
        try {
            return Future.succeededFuture(operation.get());
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    protected void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Receiver for " + entityPath + " has been closed");
        }
    }

    private void checkSettlement() {
        checkOpen();
        if (!receiveMode.supportsSettlement()) {
            throw new IllegalStateException("Settlement is not supported in " + receiveMode + " mode");
        }
    }

    private void checkNotDeadLetterQueue(String operation) {
        if (scope.deadLetter()) {
            throw new IllegalStateException(operation + " is not supported on a dead-letter sub-queue");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + entityPath + ", " + receiveMode + "}";
    }
}
