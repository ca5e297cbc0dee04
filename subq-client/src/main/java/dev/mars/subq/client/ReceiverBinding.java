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
import dev.mars.subq.api.connection.SubscriptionConnection;
import dev.mars.subq.api.receiver.MessageReceiver;
import dev.mars.subq.client.metrics.SubQMetrics;
import dev.mars.subq.client.util.OnceCell;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single lazily created {@link MessageReceiver} of a subscription client.
 *
 * <p>The receiver is created on first use by the calling thread. Concurrent first callers
 * share one creation attempt; if it fails they all see the same exception and the binding
 * stays unbound, so the next call tries again. Once bound the receiver is never replaced.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class ReceiverBinding {
    private static final Logger logger = LoggerFactory.getLogger(ReceiverBinding.class);

    private final String clientId;
    private final SubscriptionConnection connection;
    private final String entityPath;
    private final ReceiveMode receiveMode;
    private final SubQMetrics metrics;
    private final OnceCell<MessageReceiver> receiver = new OnceCell<>();
    private final AtomicReference<Future<Void>> closeFuture = new AtomicReference<>();

    public ReceiverBinding(String clientId, SubscriptionConnection connection, String entityPath,
                           ReceiveMode receiveMode, SubQMetrics metrics) {
        this.clientId = Objects.requireNonNull(clientId, "Client ID cannot be null");
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
        this.entityPath = Objects.requireNonNull(entityPath, "Entity path cannot be null");
        this.receiveMode = Objects.requireNonNull(receiveMode, "Receive mode cannot be null");
        this.metrics = metrics;
    }

    /**
     * Returns the bound receiver, creating it first if necessary.
     *
     * @throws IllegalStateException if the binding has been closed
     * @throws RuntimeException whatever the transport threw while creating the receiver
     */
    public MessageReceiver getOrCreateReceiver() {
        checkNotClosed();
        return receiver.getOrCreate(this::createReceiver);
    }

    /**
     * @return the receiver if one is bound; never creates one
     */
    public Optional<MessageReceiver> boundReceiver() {
        return receiver.get();
    }

    public boolean isBound() {
        return receiver.get().isPresent();
    }

    public String getEntityPath() {
        return entityPath;
    }

    public ReceiveMode getReceiveMode() {
        return receiveMode;
    }

    private MessageReceiver createReceiver() {
        long start = System.nanoTime();
        logger.debug("{}: creating {} receiver for {}", clientId, receiveMode, entityPath);
        MessageReceiver created;
        try {
            created = connection.createMessageReceiver(entityPath, receiveMode);
        } catch (RuntimeException e) {
            logger.error("{}: failed to create receiver for {}", clientId, entityPath, e);
            throw e;
        }
        if (created == null) {
            throw new IllegalStateException("Connection returned no receiver for " + entityPath);
        }

        if (metrics != null) {
            metrics.recordReceiverCreation(Duration.ofNanos(System.nanoTime() - start));
        }

        if (isClosed()) {
            // Closed while the receiver was being created
            created.close();
            throw new IllegalStateException(clientId + " was closed while its receiver was being created");
        }
        logger.info("{}: bound {} receiver for {}", clientId, receiveMode, entityPath);
        return created;
    }

    /**
     * Closes the bound receiver, if any. Later calls return the first call's result.
     */
    public Future<Void> close() {
        Promise<Void> promise = Promise.promise();
        if (!closeFuture.compareAndSet(null, promise.future())) {
            return closeFuture.get();
        }

        Optional<MessageReceiver> bound = receiver.get();
        if (bound.isEmpty()) {
            promise.complete();
            return promise.future();
        }

        bound.get().close().onComplete(ar -> {
            if (ar.succeeded()) {
                logger.debug("{}: closed receiver for {}", clientId, entityPath);
                promise.complete();
            } else {
                logger.warn("{}: failed to close receiver for {}: {}", clientId, entityPath, ar.cause().getMessage());
                promise.fail(ar.cause());
            }
        });
        return promise.future();
    }

    public boolean isClosed() {
        return closeFuture.get() != null;
    }

    private void checkNotClosed() {
        if (isClosed()) {
            throw new IllegalStateException(clientId + " has been closed");
        }
    }
}
