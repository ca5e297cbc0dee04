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

import dev.mars.subq.api.ReceiveMode;
import dev.mars.subq.api.SubscriptionPath;
import dev.mars.subq.api.config.SubQConfiguration;
import dev.mars.subq.api.config.SubQConfiguration.BrokerConfig;
import dev.mars.subq.api.connection.ConnectionStringBuilder;
import dev.mars.subq.api.connection.SubscriptionConnection;
import dev.mars.subq.api.receiver.MessageReceiver;
import dev.mars.subq.api.session.MessageSession;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * {@link SubscriptionConnection} backed by a Vert.x reactive PostgreSQL pool.
 *
 * <p>Creating a receiver does no I/O: the subscription is looked up inside the transaction of
 * every operation, so a missing subscription surfaces as a failed operation future. Waiting
 * receives and session accepts poll the database on Vert.x timers.</p>
 *
 * <p>Endpoints have the form {@code postgresql://host[:port]/database}. Besides the common
 * connection string keys, {@code Schema} overrides the configured search_path and
 * {@code SslMode} selects a {@link SslMode}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgSubscriptionConnection implements SubscriptionConnection {
    private static final Logger logger = LoggerFactory.getLogger(PgSubscriptionConnection.class);

    public static final String SCHEMA = "Schema";
    public static final String SSL_MODE = "SslMode";

    static final int DEFAULT_PORT = 5432;
    private static final Duration MAX_WAIT = Duration.ofDays(1);

    private final Vertx vertx;
    private final Pool pool;
    private final String endpoint;
    private final Duration operationTimeout;
    private final BrokerConfig brokerConfig;
    private final boolean ownsPool;
    private final PgSessionNegotiator sessionNegotiator;
    private final Set<PgMessageReceiver> openReceivers = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Promise<Void> closePromise = Promise.promise();

    /**
     * Wraps an existing pool. The pool is left open when the connection closes.
     */
    public PgSubscriptionConnection(Vertx vertx, Pool pool, String endpoint, Duration operationTimeout,
                                    BrokerConfig brokerConfig) {
        this(vertx, pool, endpoint, operationTimeout, brokerConfig, false);
    }

    PgSubscriptionConnection(Vertx vertx, Pool pool, String endpoint, Duration operationTimeout,
                             BrokerConfig brokerConfig, boolean ownsPool) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint cannot be null");
        this.operationTimeout = Objects.requireNonNull(operationTimeout, "Operation timeout cannot be null");
        this.brokerConfig = Objects.requireNonNull(brokerConfig, "Broker config cannot be null");
        this.ownsPool = ownsPool;
        this.sessionNegotiator = new PgSessionNegotiator(this);
    }

    /**
     * Opens a connection with its own pool from a {@code postgresql://} connection string.
     *
     * @throws IllegalArgumentException if the endpoint, credentials or schema are invalid
     */
    public static PgSubscriptionConnection connect(Vertx vertx, ConnectionStringBuilder connectionString,
                                                   SubQConfiguration configuration) {
        URI uri = connectionString.getEndpoint();
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("PostgreSQL endpoint must include a host: " + uri);
        }
        String database = uri.getPath() == null ? "" : uri.getPath().replaceFirst("^/", "");
        if (database.isBlank()) {
            throw new IllegalArgumentException("PostgreSQL endpoint must include a database: " + uri);
        }
        String username = connectionString.getUsername()
            .orElseThrow(() -> new IllegalArgumentException("Connection string is missing required key: "
                + ConnectionStringBuilder.USERNAME));
        String password = connectionString.getPassword().orElse("");

        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(uri.getHost())
            .setPort(uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT)
            .setDatabase(database)
            .setUser(username)
            .setPassword(password)
            .setSslMode(connectionString.get(SSL_MODE)
                .map(mode -> SslMode.valueOf(mode.toUpperCase(Locale.ROOT)))
                .orElse(SslMode.DISABLE));

        String searchPath = normalizeSearchPath(connectionString.get(SCHEMA).orElseGet(configuration::getDatabaseSchema));
        if (!searchPath.isEmpty()) {
            connectOptions.addProperty("search_path", searchPath);
        }

        PoolOptions poolOptions = new PoolOptions()
            .setMaxSize(configuration.getDatabasePoolMaxSize());

        Pool pool = PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectOptions)
            .using(vertx)
            .build();

        String endpoint = uri.getScheme() + "://" + uri.getHost() + ":" + connectOptions.getPort() + "/" + database;
        logger.info("Created PostgreSQL pool for {} (search_path: {}, max size: {})",
            endpoint, searchPath.isEmpty() ? "<server default>" : searchPath, poolOptions.getMaxSize());

        Duration timeout = connectionString.getOperationTimeout().orElseGet(configuration::getOperationTimeout);
        return new PgSubscriptionConnection(vertx, pool, endpoint, timeout, configuration.getBrokerConfig(), true);
    }

    /**
     * Accepts letters, digits, underscores and commas, and joins the parts with ", ".
     */
    static String normalizeSearchPath(String schemaConfig) {
        if (schemaConfig == null) return "";
        String s = schemaConfig.trim();
        if (s.isEmpty()) return "";
        if (!s.matches("[A-Za-z0-9_,\\s]+")) {
            throw new IllegalArgumentException(
                "Invalid schema (allowed: letters, digits, underscore, comma, space): " + schemaConfig);
        }
        StringBuilder sb = new StringBuilder();
        for (String part : s.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) continue;
            if (sb.length() > 0) sb.append(", ");
            sb.append(p);
        }
        return sb.toString();
    }

    @Override
    public String getEndpoint() {
        return endpoint;
    }

    @Override
    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    @Override
    public MessageReceiver createMessageReceiver(String entityPath, ReceiveMode receiveMode) {
        checkNotClosed();
        Objects.requireNonNull(receiveMode, "Receive mode cannot be null");
        SubscriptionPath path = SubscriptionPath.parse(entityPath);
        PgScope scope = SubscriptionPath.isDeadLetterPath(entityPath) ? PgScope.DEAD_LETTER : PgScope.MAIN;

        PgMessageReceiver receiver = new PgMessageReceiver(this, path, entityPath, receiveMode, scope);
        openReceivers.add(receiver);
        logger.debug("Created {} receiver for {}", receiveMode, entityPath);
        return receiver;
    }

    @Override
    public Future<MessageSession> acceptMessageSession(SubscriptionPath path, ReceiveMode receiveMode,
                                                       String sessionId, Duration waitTime) {
        checkNotClosed();
        Objects.requireNonNull(path, "Subscription path cannot be null");
        Objects.requireNonNull(receiveMode, "Receive mode cannot be null");
        Objects.requireNonNull(waitTime, "Wait time cannot be null");

        Future<PgSessionNegotiator.SessionGrant> grant = sessionId != null
            ? sessionNegotiator.lockSession(path, sessionId)
            : sessionNegotiator.lockAnySession(path, waitTime);
        return grant.<MessageSession>map(g -> {
            PgMessageSession session = new PgMessageSession(this, path, receiveMode, g);
            openReceivers.add(session);
            logger.debug("Accepted session {} on {}", g.sessionId(), path);
            return session;
        });
    }

    @Override
    public Future<Void> close() {
        if (closed.compareAndSet(false, true)) {
            List<PgMessageReceiver> toClose = new ArrayList<>(openReceivers);
            List<Future<Void>> closing = new ArrayList<>();
            toClose.forEach(receiver -> closing.add(receiver.close()));
            Future.join(closing)
                .transform(ar -> {
                    if (ar.failed()) {
                        logger.warn("Failed to release receivers of {}: {}", endpoint, ar.cause().getMessage());
                    }
                    return ownsPool ? pool.close() : Future.<Void>succeededFuture();
                })
                .onSuccess(v -> logger.debug("Closed connection {} and {} receiver(s)", endpoint, toClose.size()))
                .onComplete(ar -> {
                    if (ar.succeeded()) {
                        closePromise.complete();
                    } else {
                        closePromise.fail(ar.cause());
                    }
                });
        }
        return closePromise.future();
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return receivers and sessions created by this connection that are still open
     */
    public int getOpenReceiverCount() {
        return openReceivers.size();
    }

    Pool pool() {
        return pool;
    }

    BrokerConfig brokerConfig() {
        return brokerConfig;
    }

    void receiverClosed(PgMessageReceiver receiver) {
        openReceivers.remove(receiver);
    }

    /**
     * Runs {@code attempt} until its result satisfies {@code satisfied} or the wait elapses,
     * re-trying on the configured poll interval. The last result is returned either way.
     */
    <T> Future<T> poll(Supplier<Future<T>> attempt, Predicate<T> satisfied, Duration waitTime) {
        Duration wait = waitTime.compareTo(MAX_WAIT) > 0 ? MAX_WAIT : waitTime;
        Promise<T> promise = Promise.promise();
        pollAttempt(attempt, satisfied, System.nanoTime() + wait.toNanos(), promise);
        return promise.future();
    }

    private <T> void pollAttempt(Supplier<Future<T>> attempt, Predicate<T> satisfied, long deadline, Promise<T> promise) {
        Future<T> result;
        try {
            result = attempt.get();
        } catch (RuntimeException e) {
            promise.fail(e);
            return;
        }
        result.onComplete(ar -> {
            if (ar.failed()) {
                promise.fail(ar.cause());
                return;
            }
            long remaining = deadline - System.nanoTime();
            if (satisfied.test(ar.result()) || remaining <= 0 || closed.get()) {
                promise.complete(ar.result());
                return;
            }
            long delayMs = Math.max(1, Math.min(brokerConfig.pollInterval().toMillis(),
                TimeUnit.NANOSECONDS.toMillis(remaining)));
            vertx.setTimer(delayMs, id -> pollAttempt(attempt, satisfied, deadline, promise));
        });
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("Connection " + endpoint + " has been closed");
        }
    }

    @Override
    public String toString() {
        return "PgSubscriptionConnection{" + endpoint + "}";
    }
}
