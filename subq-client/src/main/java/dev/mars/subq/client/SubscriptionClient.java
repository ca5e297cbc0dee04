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

import dev.mars.subq.api.ReceiveMode;
import dev.mars.subq.api.SubscriptionPath;
import dev.mars.subq.api.connection.ConnectionStringBuilder;
import dev.mars.subq.api.connection.SubscriptionConnection;
import dev.mars.subq.api.lifecycle.SubscriptionEventListener;
import dev.mars.subq.api.messaging.ReceivedMessage;
import dev.mars.subq.api.receiver.MessageReceiver;
import dev.mars.subq.api.receiver.PeekCursor;
import dev.mars.subq.api.session.MessageSession;
import dev.mars.subq.client.metrics.SubQMetrics;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Client for one subscription of a topic.
 *
 * <p>The client creates its message receiver lazily on the first operation that needs it
 * and reuses it for its whole life. Settlement operations are only valid in
 * {@link ReceiveMode#PEEK_LOCK}; in {@link ReceiveMode#RECEIVE_AND_DELETE} they throw
 * {@link IllegalStateException} without touching the broker.</p>
 *
 * <p>Argument and state errors are thrown synchronously. Broker failures are reported
 * through the returned {@link Future} unchanged.</p>
 *
 * <pre>{@code
 * SubscriptionClient client = SubscriptionClient.createFromConnectionString(
 *     "Endpoint=postgresql://localhost:5432/subq;EntityPath=orders", "billing");
 * client.receive()
 *     .compose(message -> message
 *         .map(m -> client.complete(m.getLockToken().orElseThrow()))
 *         .orElse(Future.succeededFuture()));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class SubscriptionClient {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionClient.class);

    private static final AtomicInteger CLIENT_COUNTER = new AtomicInteger();

    private final String clientId;
    private final SubscriptionConnection connection;
    private final boolean ownsConnection;
    private final SubscriptionPath subscriptionPath;
    private final ReceiveMode receiveMode;
    private final SubscriptionEventListener eventListener;
    private final SubQMetrics metrics;
    private final ReceiverBinding receiverBinding;
    private final SessionAcceptor sessionAcceptor;
    private final PeekCursor peekCursor = new PeekCursor();
    private final AtomicReference<Future<Void>> closeFuture = new AtomicReference<>();

    protected SubscriptionClient(SubscriptionConnection connection, boolean ownsConnection,
                                 SubscriptionPath subscriptionPath, SubscriptionClientConfig config) {
        this.connection = connection;
        this.ownsConnection = ownsConnection;
        this.subscriptionPath = subscriptionPath;
        this.receiveMode = config.getReceiveMode();
        this.eventListener = config.getEventListener();
        this.metrics = config.getMetrics();
        this.clientId = "SubscriptionClient-" + CLIENT_COUNTER.incrementAndGet()
            + "(" + subscriptionPath.getSubscriptionName() + ")";
        this.receiverBinding = new ReceiverBinding(clientId, connection, subscriptionPath.getPath(), receiveMode, metrics);
        this.sessionAcceptor = new SessionAcceptor(clientId, connection, subscriptionPath, receiveMode,
            eventListener, metrics);
        logger.info("Created {} for {} in {} mode on {}", clientId, subscriptionPath, receiveMode,
            connection.getEndpoint());
    }

    // ------------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------------

    /**
     * Creates a client from a topic connection string, e.g.
     * {@code Endpoint=postgresql://host:5432/db;EntityPath=orders}. The client owns the
     * connection it creates and closes it on {@link #close()}.
     */
    public static SubscriptionClient createFromConnectionString(String topicConnectionString, String subscriptionName) {
        return createFromConnectionString(topicConnectionString, subscriptionName, SubscriptionClientConfig.defaultConfig());
    }

    public static SubscriptionClient createFromConnectionString(String topicConnectionString, String subscriptionName,
                                                                ReceiveMode mode) {
        return createFromConnectionString(topicConnectionString, subscriptionName, SubscriptionClientConfig.forMode(mode));
    }

    public static SubscriptionClient createFromConnectionString(String topicConnectionString, String subscriptionName,
                                                                SubscriptionClientConfig config) {
        Objects.requireNonNull(config, "Config cannot be null");
        ConnectionStringBuilder builder = ConnectionStringBuilder.parse(topicConnectionString);
        String topicPath = builder.getEntityPath().orElseThrow(() ->
            new IllegalArgumentException("Connection string must contain EntityPath naming the topic"));
        SubscriptionPath path = SubscriptionPath.of(topicPath, subscriptionName);
        // Fail on an unknown scheme before anything is created
        config.getRegistry().resolve(builder);

        SubscriptionConnection connection = config.getRegistry().createConnection(builder, config.getConfiguration());
        return new SubscriptionClient(connection, true, path, config);
    }

    /**
     * Creates a client on a shared namespace connection. The caller keeps ownership of the connection.
     */
    public static SubscriptionClient create(SubscriptionConnection connection, String topicPath, String subscriptionName) {
        return create(connection, topicPath, subscriptionName, SubscriptionClientConfig.defaultConfig());
    }

    public static SubscriptionClient create(SubscriptionConnection connection, String topicPath, String subscriptionName,
                                            ReceiveMode mode) {
        return create(connection, topicPath, subscriptionName, SubscriptionClientConfig.forMode(mode));
    }

    public static SubscriptionClient create(SubscriptionConnection connection, String topicPath, String subscriptionName,
                                            SubscriptionClientConfig config) {
        Objects.requireNonNull(connection, "Connection cannot be null");
        Objects.requireNonNull(config, "Config cannot be null");
        return new SubscriptionClient(connection, false, SubscriptionPath.of(topicPath, subscriptionName), config);
    }

    /**
     * Creates a client on a topic connection. The caller keeps ownership of the connection.
     */
    public static SubscriptionClient create(TopicConnection topicConnection, String subscriptionName) {
        return create(topicConnection, subscriptionName, SubscriptionClientConfig.defaultConfig());
    }

    public static SubscriptionClient create(TopicConnection topicConnection, String subscriptionName, ReceiveMode mode) {
        return create(topicConnection, subscriptionName, SubscriptionClientConfig.forMode(mode));
    }

    public static SubscriptionClient create(TopicConnection topicConnection, String subscriptionName,
                                            SubscriptionClientConfig config) {
        Objects.requireNonNull(topicConnection, "Topic connection cannot be null");
        return create(topicConnection.getConnection(), topicConnection.getTopicPath(), subscriptionName, config);
    }

    // ------------------------------------------------------------------------
    // Identity
    // ------------------------------------------------------------------------

    public String getClientId() { return clientId; }
    public String getTopicPath() { return subscriptionPath.getTopicPath(); }
    public String getSubscriptionName() { return subscriptionPath.getSubscriptionName(); }
    public String getPath() { return subscriptionPath.getPath(); }
    public SubscriptionPath getSubscriptionPath() { return subscriptionPath; }
    public ReceiveMode getReceiveMode() { return receiveMode; }
    public SubscriptionConnection getConnection() { return connection; }

    public Duration getOperationTimeout() {
        return connection.getOperationTimeout();
    }

    public int getPrefetchCount() {
        checkNotClosed();
        return receiverBinding.getOrCreateReceiver().getPrefetchCount();
    }

    Optional<MessageReceiver> getBoundReceiver() {
        return receiverBinding.boundReceiver();
    }

    public void setPrefetchCount(int prefetchCount) {
        checkNotClosed();
        if (prefetchCount < 0) {
            throw new IllegalArgumentException("Prefetch count must be non-negative, got: " + prefetchCount);
        }
        receiverBinding.getOrCreateReceiver().setPrefetchCount(prefetchCount);
    }

    // ------------------------------------------------------------------------
    // Receive
    // ------------------------------------------------------------------------

    /**
     * Receives one message, waiting up to the receiver's operation timeout.
     *
     * @return the message, or empty if none arrived in time
     */
    public Future<Optional<ReceivedMessage>> receive() {
        checkNotClosed();
        return withReceiver("receive", receiver ->
            receiveInternal(receiver, 1, receiver.getOperationTimeout()).map(SubscriptionClient::first));
    }

    public Future<Optional<ReceivedMessage>> receive(Duration serverWaitTime) {
        checkNotClosed();
        checkWaitTime(serverWaitTime);
        return withReceiver("receive", receiver ->
            receiveInternal(receiver, 1, serverWaitTime).map(SubscriptionClient::first));
    }

    /**
     * Receives up to {@code maxMessageCount} messages, waiting up to the operation timeout for the first.
     *
     * @return the messages, empty if none arrived in time
     */
    public Future<List<ReceivedMessage>> receiveBatch(int maxMessageCount) {
        checkNotClosed();
        checkCount(maxMessageCount);
        return withReceiver("receiveBatch", receiver ->
            receiveInternal(receiver, maxMessageCount, receiver.getOperationTimeout()));
    }

    public Future<List<ReceivedMessage>> receiveBatch(int maxMessageCount, Duration serverWaitTime) {
        checkNotClosed();
        checkCount(maxMessageCount);
        checkWaitTime(serverWaitTime);
        return withReceiver("receiveBatch", receiver -> receiveInternal(receiver, maxMessageCount, serverWaitTime));
    }

    private Future<List<ReceivedMessage>> receiveInternal(MessageReceiver receiver, int maxCount, Duration waitTime) {
        return receiver.receive(maxCount, waitTime).onSuccess(this::recordReceived);
    }

    /**
     * Receives an active or deferred message by its sequence number.
     *
     * @return the message, or empty if no such message exists
     */
    public Future<Optional<ReceivedMessage>> receiveBySequenceNumber(long sequenceNumber) {
        checkNotClosed();
        checkSequenceNumber(sequenceNumber);
        return withReceiver("receiveBySequenceNumber", receiver ->
            receiver.receiveBySequenceNumbers(List.of(sequenceNumber))
                .onSuccess(this::recordReceived)
                .map(SubscriptionClient::first));
    }

    public Future<List<ReceivedMessage>> receiveBySequenceNumbers(Collection<Long> sequenceNumbers) {
        checkNotClosed();
        if (sequenceNumbers == null || sequenceNumbers.isEmpty()) {
            throw new IllegalArgumentException("Sequence numbers cannot be null or empty");
        }
        List<Long> numbers = new ArrayList<>(sequenceNumbers.size());
        for (Long sequenceNumber : sequenceNumbers) {
            if (sequenceNumber == null) {
                throw new IllegalArgumentException("Sequence numbers cannot contain null");
            }
            checkSequenceNumber(sequenceNumber);
            numbers.add(sequenceNumber);
        }
        return withReceiver("receiveBySequenceNumbers", receiver ->
            receiver.receiveBySequenceNumbers(numbers).onSuccess(this::recordReceived));
    }

    // ------------------------------------------------------------------------
    // Peek
    // ------------------------------------------------------------------------

    /**
     * Reads the next message after the last peeked one without locking it.
     */
    public Future<Optional<ReceivedMessage>> peek() {
        return peek(1).map(SubscriptionClient::first);
    }

    public Future<List<ReceivedMessage>> peek(int maxMessageCount) {
        checkNotClosed();
        checkCount(maxMessageCount);
        return withReceiver("peek", receiver ->
            receiver.peekBySequenceNumber(peekCursor.next(), maxMessageCount).map(peekCursor::advance));
    }

    public Future<Optional<ReceivedMessage>> peekBySequenceNumber(long fromSequenceNumber) {
        return peekBySequenceNumber(fromSequenceNumber, 1).map(SubscriptionClient::first);
    }

    public Future<List<ReceivedMessage>> peekBySequenceNumber(long fromSequenceNumber, int messageCount) {
        checkNotClosed();
        checkSequenceNumber(fromSequenceNumber);
        checkCount(messageCount);
        return withReceiver("peekBySequenceNumber", receiver ->
            receiver.peekBySequenceNumber(fromSequenceNumber, messageCount).map(peekCursor::advance));
    }

    /**
     * @return the sequence number of the last peeked message, or -1 if nothing was peeked yet
     */
    public long getLastPeekedSequenceNumber() {
        return peekCursor.lastPeeked();
    }

    // ------------------------------------------------------------------------
    // Settlement
    // ------------------------------------------------------------------------

    public Future<Void> complete(UUID lockToken) {
        return complete(singleToken(lockToken));
    }

    /**
     * Completes all messages or none. Fails with
     * {@link dev.mars.subq.api.error.MessageLockLostException} if any token is no longer valid.
     */
    public Future<Void> complete(Collection<UUID> lockTokens) {
        List<UUID> tokens = checkSettlement(lockTokens);
        return settle("complete", tokens, receiver -> receiver.complete(tokens))
            .onSuccess(v -> {
                if (metrics != null) {
                    metrics.recordMessagesCompleted(tokens.size());
                }
            });
    }

    /**
     * Releases the lock so the message can be received again. Its delivery count is incremented.
     */
    public Future<Void> abandon(UUID lockToken) {
        List<UUID> tokens = checkSettlement(singleToken(lockToken));
        return settle("abandon", tokens, receiver -> receiver.abandon(tokens))
            .onSuccess(v -> {
                if (metrics != null) {
                    metrics.recordMessagesAbandoned(tokens.size());
                }
            });
    }

    /**
     * Sets the message aside. It is only reachable through {@link #receiveBySequenceNumber(long)} afterwards.
     */
    public Future<Void> defer(UUID lockToken) {
        List<UUID> tokens = checkSettlement(singleToken(lockToken));
        return settle("defer", tokens, receiver -> receiver.defer(tokens))
            .onSuccess(v -> {
                if (metrics != null) {
                    metrics.recordMessagesDeferred(tokens.size());
                }
            });
    }

    public Future<Void> deadLetter(UUID lockToken) {
        return deadLetter(lockToken, null, null);
    }

    /**
     * Moves the message to the subscription's dead-letter sub-queue.
     */
    public Future<Void> deadLetter(UUID lockToken, String reason, String description) {
        List<UUID> tokens = checkSettlement(singleToken(lockToken));
        return settle("deadLetter", tokens, receiver -> receiver.deadLetter(tokens, reason, description))
            .onSuccess(v -> {
                if (metrics != null) {
                    metrics.recordMessagesDeadLettered(tokens.size());
                }
            });
    }

    /**
     * Extends the message lock.
     *
     * @return the new lock expiry
     */
    public Future<Instant> renewMessageLock(UUID lockToken) {
        List<UUID> tokens = checkSettlement(singleToken(lockToken));
        return settle("renewMessageLock", tokens, receiver -> receiver.renewLock(lockToken))
            .onSuccess(lockedUntil -> {
                if (metrics != null) {
                    metrics.recordLockRenewal();
                }
            });
    }

    private <T> Future<T> settle(String operation, List<UUID> tokens, Function<MessageReceiver, Future<T>> action) {
        logger.debug("{}: {} {} token(s)", clientId, operation, tokens.size());
        return withReceiver(operation, action).onFailure(e -> {
            if (metrics != null) {
                metrics.recordSettlementFailure();
            }
        });
    }

    // ------------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------------

    /**
     * Accepts any session with pending messages, waiting up to the connection's operation timeout.
     */
    public Future<MessageSession> acceptMessageSession() {
        checkNotClosed();
        return sessionAcceptor.accept(null, connection.getOperationTimeout());
    }

    public Future<MessageSession> acceptMessageSession(Duration serverWaitTime) {
        checkNotClosed();
        checkWaitTime(serverWaitTime);
        return sessionAcceptor.accept(null, serverWaitTime);
    }

    /**
     * Accepts the named session, whether or not it has messages yet.
     */
    public Future<MessageSession> acceptMessageSession(String sessionId) {
        checkNotClosed();
        checkSessionId(sessionId);
        return sessionAcceptor.accept(sessionId, connection.getOperationTimeout());
    }

    public Future<MessageSession> acceptMessageSession(String sessionId, Duration serverWaitTime) {
        checkNotClosed();
        checkSessionId(sessionId);
        checkWaitTime(serverWaitTime);
        return sessionAcceptor.accept(sessionId, serverWaitTime);
    }

    /**
     * @return open sessions accepted through this client
     */
    public List<MessageSession> getOwnedSessions() {
        return sessionAcceptor.getOwnedSessions();
    }

    // ------------------------------------------------------------------------
    // Dead-letter sub-queue
    // ------------------------------------------------------------------------

    /**
     * Creates a peek-lock receiver on this subscription's dead-letter sub-queue.
     * The caller owns the returned receiver and must close it.
     */
    public MessageReceiver createDeadLetterReceiver() {
        return createDeadLetterReceiver(ReceiveMode.PEEK_LOCK);
    }

    public MessageReceiver createDeadLetterReceiver(ReceiveMode mode) {
        checkNotClosed();
        Objects.requireNonNull(mode, "Receive mode cannot be null");
        logger.debug("{}: creating dead-letter receiver for {}", clientId, subscriptionPath.deadLetterPath());
        return connection.createMessageReceiver(subscriptionPath.deadLetterPath(), mode);
    }

    // ------------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------------

    /**
     * Closes owned sessions, then the receiver, then the connection if this client created it.
     * Every later call returns the same future.
     */
    public Future<Void> close() {
        Promise<Void> promise = Promise.promise();
        if (!closeFuture.compareAndSet(null, promise.future())) {
            return closeFuture.get();
        }

        logger.info("Closing {}", clientId);
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        closeStep("sessions", sessionAcceptor::closeAll, firstFailure)
            .compose(v -> closeStep("receiver", receiverBinding::close, firstFailure))
            .compose(v -> ownsConnection
                ? closeStep("connection", connection::close, firstFailure)
                : Future.<Void>succeededFuture())
            .onComplete(ar -> {
                try {
                    eventListener.onClientClosed(clientId);
                } catch (RuntimeException e) {
                    logger.warn("{}: listener failed on close: {}", clientId, e.getMessage(), e);
                }
                Throwable failure = firstFailure.get();
                if (failure == null) {
                    logger.info("Closed {}", clientId);
                    promise.complete();
                } else {
                    promise.fail(failure);
                }
            });
        return promise.future();
    }

    private Future<Void> closeStep(String what, Supplier<Future<Void>> step, AtomicReference<Throwable> firstFailure) {
        Future<Void> result;
        try {
            result = step.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result.recover(e -> {
            logger.warn("{}: failed to close {}: {}", clientId, what, e.getMessage());
            firstFailure.compareAndSet(null, e);
            return Future.succeededFuture();
        });
    }

    public boolean isClosed() {
        return closeFuture.get() != null;
    }

    // ------------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------------

    /**
     * Runs an operation against the bound receiver. Callers make their usage checks first; a failure
     * to bind, of any type, is reported through the returned future like any other broker failure,
     * and every failure is logged at debug.
     */
    private <T> Future<T> withReceiver(String operation, Function<MessageReceiver, Future<T>> action) {
        Future<T> result;
        try {
            result = action.apply(receiverBinding.getOrCreateReceiver());
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result.onFailure(e -> logger.debug("{}: {} on {} failed: {}", clientId, operation, subscriptionPath, e.toString()));
    }

    private void recordReceived(List<ReceivedMessage> messages) {
        if (metrics != null) {
            metrics.recordMessagesReceived(messages.size());
        }
        logger.debug("{}: received {} message(s)", clientId, messages.size());
    }

    private List<UUID> checkSettlement(Collection<UUID> lockTokens) {
        checkNotClosed();
        if (!receiveMode.supportsSettlement()) {
            throw new IllegalStateException("Settlement is not supported in " + receiveMode
                + " mode; messages are removed when they are received");
        }
        if (lockTokens == null || lockTokens.isEmpty()) {
            throw new IllegalArgumentException("Lock tokens cannot be null or empty");
        }
        List<UUID> tokens = new ArrayList<>(lockTokens.size());
        for (UUID token : lockTokens) {
            if (token == null) {
                throw new IllegalArgumentException("Lock tokens cannot contain null");
            }
            tokens.add(token);
        }
        return List.copyOf(tokens);
    }

    private static List<UUID> singleToken(UUID lockToken) {
        if (lockToken == null) {
            throw new IllegalArgumentException("Lock token cannot be null");
        }
        return List.of(lockToken);
    }

    private void checkNotClosed() {
        if (isClosed()) {
            throw new IllegalStateException(clientId + " has been closed");
        }
    }

    private static void checkCount(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Message count must be positive, got: " + count);
        }
    }

    private static void checkWaitTime(Duration waitTime) {
        Objects.requireNonNull(waitTime, "Wait time cannot be null");
        if (waitTime.isNegative()) {
            throw new IllegalArgumentException("Wait time must be non-negative, got: " + waitTime);
        }
    }

    private static void checkSequenceNumber(long sequenceNumber) {
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("Sequence number must be non-negative, got: " + sequenceNumber);
        }
    }

    private static void checkSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
    }

    private static Optional<ReceivedMessage> first(List<ReceivedMessage> messages) {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(0));
    }

    @Override
    public String toString() {
        return clientId + "{" + subscriptionPath + ", " + receiveMode + "}";
    }
}
