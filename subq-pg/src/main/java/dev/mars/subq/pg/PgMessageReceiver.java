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
import dev.mars.subq.api.error.MessageLockLostException;
import dev.mars.subq.api.error.MessagingEntityNotFoundException;
import dev.mars.subq.api.messaging.ReceivedMessage;
import dev.mars.subq.api.receiver.MessageReceiver;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * {@link MessageReceiver} over the {@code subq_messages} table.
 *
 * <p>Every operation runs in its own transaction which first checks that the subscription
 * exists. Receives claim rows with {@code FOR UPDATE SKIP LOCKED}, so competing receivers on
 * other connections never see the same message. A message lock is a random token plus an
 * expiry on the row; a lock that expires without settlement counts as a failed delivery the
 * next time the row is claimed.</p>
 *
 * <p>Prefetch is recorded but has no effect: every receive is a database round trip.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgMessageReceiver implements MessageReceiver {
    private static final Logger logger = LoggerFactory.getLogger(PgMessageReceiver.class);

    static final String MAX_DELIVERY_COUNT_EXCEEDED = "MaxDeliveryCountExceeded";

    private static final String SELECT_SUBSCRIPTION =
        "SELECT max_delivery_count FROM subq_subscriptions WHERE entity_path = $1";

    private enum Disposition { COMPLETE, ABANDON, DEFER, DEAD_LETTER }

    protected final PgSubscriptionConnection connection;
    protected final SubscriptionPath subscriptionPath;
    private final String entityPath;
    private final ReceiveMode receiveMode;
    private final PgScope scope;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Promise<Void> closePromise = Promise.promise();
    private volatile int prefetchCount;

    PgMessageReceiver(PgSubscriptionConnection connection, SubscriptionPath subscriptionPath, String entityPath,
                      ReceiveMode receiveMode, PgScope scope) {
        this.connection = connection;
        this.subscriptionPath = subscriptionPath;
        this.entityPath = entityPath;
        this.receiveMode = Objects.requireNonNull(receiveMode, "Receive mode cannot be null");
        this.scope = scope;
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
        return connection.getOperationTimeout();
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

    // ------------------------------------------------------------------------
    // Receive and peek
    // ------------------------------------------------------------------------

    @Override
    public Future<List<ReceivedMessage>> receive(int maxCount, Duration waitTime) {
        checkOpen();
        if (maxCount < 1) {
            throw new IllegalArgumentException("Max count must be positive, got: " + maxCount);
        }
        Objects.requireNonNull(waitTime, "Wait time cannot be null");
        return connection.poll(
            () -> inTransaction(conn -> checkAccess(conn)
                .compose(maxDeliveryCount -> deadLetterExpired(conn, maxDeliveryCount, null))
                .compose(v -> claim(conn, maxCount))),
            messages -> !messages.isEmpty(), waitTime);
    }

    /**
     * Dead-letters messages whose lock expired unsettled and whose next claim would reach the max
     * delivery count. With {@code sequenceNumbers} the sweep covers just those messages, deferred
     * ones included; without, it covers the active messages in scope.
     */
    private Future<Void> deadLetterExpired(SqlConnection conn, int maxDeliveryCount, Long[] sequenceNumbers) {
        if (scope.deadLetter()) {
            return Future.succeededFuture();
        }
        String states = sequenceNumbers == null
            ? "m.state = 'ACTIVE'"
            : "m.state IN ('ACTIVE', 'DEFERRED') AND m.sequence_number = ANY($6::bigint[])";
        String sql = """
            UPDATE subq_messages m
            SET state = 'DEAD_LETTERED', delivery_count = m.delivery_count + 1,
                lock_token = NULL, locked_until = NULL,
                dead_letter_reason = $3, dead_letter_description = $4
            WHERE %s
              AND %s AND m.lock_token IS NOT NULL AND m.locked_until <= now()
              AND m.delivery_count + 1 >= $5
            """.formatted(scope.filter(), states);
        Tuple params = scoped()
            .addString(MAX_DELIVERY_COUNT_EXCEEDED)
            .addString(deliveryCountDescription(maxDeliveryCount))
            .addInteger(maxDeliveryCount);
        if (sequenceNumbers != null) {
            params.addArrayOfLong(sequenceNumbers);
        }
        return conn.preparedQuery(sql)
            .execute(params)
            .map(rows -> {
                if (rows.rowCount() > 0) {
                    logger.debug("Dead-lettered {} message(s) with expired locks on {}", rows.rowCount(), entityPath);
                }
                return null;
            });
    }

    private Future<List<ReceivedMessage>> claim(SqlConnection conn, int maxCount) {
        String candidates = """
            WITH c AS (
                SELECT m.sequence_number FROM subq_messages m
                WHERE %s
                ORDER BY m.sequence_number
                LIMIT $3
                FOR UPDATE SKIP LOCKED
            )
            """.formatted(scope.receivableFilter());
        if (receiveMode == ReceiveMode.RECEIVE_AND_DELETE) {
            String sql = candidates + """
                DELETE FROM subq_messages m USING c
                WHERE m.entity_path = $1 AND m.sequence_number = c.sequence_number
                RETURNING m.*
                """;
            return conn.preparedQuery(sql)
                .execute(scoped().addInteger(maxCount))
                .map(rows -> PgMessageMapper.toMessages(rows, false));
        }
        // An expired lock that is claimed again counts as one more delivery attempt
        String sql = candidates + """
            UPDATE subq_messages m
            SET lock_token = gen_random_uuid(),
                locked_until = now() + make_interval(secs => $4),
                delivery_count = m.delivery_count + CASE WHEN m.lock_token IS NULL THEN 0 ELSE 1 END
            FROM c
            WHERE m.entity_path = $1 AND m.sequence_number = c.sequence_number
            RETURNING m.*
            """;
        return conn.preparedQuery(sql)
            .execute(scoped().addInteger(maxCount).addDouble(lockSeconds()))
            .map(rows -> PgMessageMapper.toMessages(rows, true));
    }

    @Override
    public Future<List<ReceivedMessage>> receiveBySequenceNumbers(Collection<Long> sequenceNumbers) {
        checkOpen();
        Objects.requireNonNull(sequenceNumbers, "Sequence numbers cannot be null");
        if (sequenceNumbers.isEmpty()) {
            return Future.succeededFuture(List.of());
        }
        Long[] numbers = new LinkedHashSet<>(sequenceNumbers).toArray(new Long[0]);
        String candidates = """
            WITH c AS (
                SELECT m.sequence_number FROM subq_messages m
                WHERE %s
                  AND m.sequence_number = ANY($3::bigint[])
                  AND (m.locked_until IS NULL OR m.locked_until <= now())
                FOR UPDATE SKIP LOCKED
            )
            """.formatted(scope.filter());

        if (receiveMode == ReceiveMode.RECEIVE_AND_DELETE) {
            String sql = candidates + """
                DELETE FROM subq_messages m USING c
                WHERE m.entity_path = $1 AND m.sequence_number = c.sequence_number
                RETURNING m.*
                """;
            return inTransaction(conn -> checkAccess(conn)
                .compose(maxDeliveryCount -> deadLetterExpired(conn, maxDeliveryCount, numbers))
                .compose(v -> conn.preparedQuery(sql).execute(scoped().addArrayOfLong(numbers)))
                .map(rows -> PgMessageMapper.toMessages(rows, false)));
        }
        String sql = candidates + """
            UPDATE subq_messages m
            SET lock_token = gen_random_uuid(),
                locked_until = now() + make_interval(secs => $4),
                delivery_count = m.delivery_count + CASE WHEN m.lock_token IS NULL THEN 0 ELSE 1 END
            FROM c
            WHERE m.entity_path = $1 AND m.sequence_number = c.sequence_number
            RETURNING m.*
            """;
        return inTransaction(conn -> checkAccess(conn)
            .compose(maxDeliveryCount -> deadLetterExpired(conn, maxDeliveryCount, numbers))
            .compose(v -> conn.preparedQuery(sql).execute(scoped().addArrayOfLong(numbers).addDouble(lockSeconds())))
            .map(rows -> PgMessageMapper.toMessages(rows, true)));
    }

    @Override
    public Future<List<ReceivedMessage>> peekBySequenceNumber(long fromSequenceNumber, int count) {
        checkOpen();
        if (count < 1) {
            throw new IllegalArgumentException("Message count must be positive, got: " + count);
        }
        String sql = """
            SELECT m.* FROM subq_messages m
            WHERE %s AND m.sequence_number >= $3
            ORDER BY m.sequence_number
            LIMIT $4
            """.formatted(scope.filter());
        return inTransaction(conn -> checkAccess(conn)
            .compose(max -> conn.preparedQuery(sql).execute(scoped().addLong(fromSequenceNumber).addInteger(count)))
            .map(rows -> PgMessageMapper.toMessages(rows, false)));
    }

    // ------------------------------------------------------------------------
    // Settlement
    // ------------------------------------------------------------------------

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

    /**
     * Settles all tokens or none: if any token no longer holds a live lock in this scope,
     * nothing changes and the call fails with {@link MessageLockLostException}.
     */
    private Future<Void> settle(Collection<UUID> lockTokens, Disposition disposition, String reason, String description) {
        checkSettlement();
        Objects.requireNonNull(lockTokens, "Lock tokens cannot be null");
        if (lockTokens.isEmpty()) {
            return Future.succeededFuture();
        }
        UUID[] tokens = new LinkedHashSet<>(lockTokens).toArray(new UUID[0]);
        String lookup = """
            SELECT m.lock_token FROM subq_messages m
            WHERE %s AND m.lock_token = ANY($3::uuid[]) AND m.locked_until > now()
            FOR UPDATE
            """.formatted(scope.filter());

        return inTransaction(conn -> checkAccess(conn)
            .compose(maxDeliveryCount -> conn.preparedQuery(lookup).execute(scoped().addArrayOfUUID(tokens))
                .compose(rows -> {
                    Set<UUID> locked = new HashSet<>();
                    for (Row row : rows) {
                        locked.add(row.getUUID("lock_token"));
                    }
                    List<UUID> lost = new ArrayList<>();
                    for (UUID token : tokens) {
                        if (!locked.contains(token)) {
                            lost.add(token);
                        }
                    }
                    if (!lost.isEmpty()) {
                        return Future.<Void>failedFuture(new MessageLockLostException(entityPath, lost));
                    }
                    return apply(conn, tokens, disposition, maxDeliveryCount, reason, description);
                })))
            .onSuccess(v -> logger.debug("{} {} message(s) on {}", disposition, tokens.length, entityPath));
    }

    private Future<Void> apply(SqlConnection conn, UUID[] tokens, Disposition disposition, int maxDeliveryCount,
                               String reason, String description) {
        Tuple params = Tuple.tuple().addArrayOfUUID(tokens);
        String sql;
        switch (disposition) {
            case COMPLETE:
                sql = "DELETE FROM subq_messages WHERE lock_token = ANY($1::uuid[])";
                break;
            case ABANDON:
                sql = """
                    UPDATE subq_messages
                    SET lock_token = NULL, locked_until = NULL,
                        delivery_count = delivery_count + 1,
                        state = CASE WHEN delivery_count + 1 >= $2::int THEN 'DEAD_LETTERED' ELSE state END,
                        dead_letter_reason = CASE WHEN delivery_count + 1 >= $2::int THEN $3::text ELSE dead_letter_reason END,
                        dead_letter_description = CASE WHEN delivery_count + 1 >= $2::int THEN $4::text ELSE dead_letter_description END
                    WHERE lock_token = ANY($1::uuid[])
                    """;
                // Abandoning on the dead-letter sub-queue never moves a message again
                int threshold = scope.deadLetter() ? Integer.MAX_VALUE : maxDeliveryCount;
                params.addInteger(threshold)
                    .addString(MAX_DELIVERY_COUNT_EXCEEDED)
                    .addString(deliveryCountDescription(maxDeliveryCount));
                break;
            case DEFER:
                sql = "UPDATE subq_messages SET lock_token = NULL, locked_until = NULL, state = 'DEFERRED' "
                    + "WHERE lock_token = ANY($1::uuid[])";
                break;
            case DEAD_LETTER:
                sql = "UPDATE subq_messages SET lock_token = NULL, locked_until = NULL, state = 'DEAD_LETTERED', "
                    + "dead_letter_reason = $2::text, dead_letter_description = $3::text "
                    + "WHERE lock_token = ANY($1::uuid[])";
                params.addString(reason).addString(description);
                break;
            default:
                throw new IllegalStateException("Unknown disposition: " + disposition);
        }
        return conn.preparedQuery(sql).execute(params).mapEmpty();
    }

    @Override
    public Future<Instant> renewLock(UUID lockToken) {
        checkSettlement();
        Objects.requireNonNull(lockToken, "Lock token cannot be null");
        String sql = """
            UPDATE subq_messages m
            SET locked_until = now() + make_interval(secs => $4)
            WHERE %s AND m.lock_token = $3 AND m.locked_until > now()
            RETURNING m.locked_until
            """.formatted(scope.filter());
        return inTransaction(conn -> checkAccess(conn)
            .compose(max -> conn.preparedQuery(sql).execute(scoped().addUUID(lockToken).addDouble(lockSeconds())))
            .compose(rows -> rows.size() == 0
                ? Future.<Instant>failedFuture(new MessageLockLostException(entityPath, List.of(lockToken)))
                : Future.succeededFuture(rows.iterator().next().getOffsetDateTime("locked_until").toInstant())));
    }

    // ------------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------------

    @Override
    public Future<Void> close() {
        if (closed.compareAndSet(false, true)) {
            release()
                .transform(ar -> {
                    if (ar.failed()) {
                        logger.warn("Failed to release {}: {}", this, ar.cause().getMessage());
                    }
                    connection.receiverClosed(this);
                    return Future.<Void>succeededFuture();
                })
                .onComplete(ar -> closePromise.complete());
        }
        return closePromise.future();
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Releases broker-side resources held by this receiver. Called once, on the first close.
     */
    protected Future<Void> release() {
        return Future.succeededFuture();
    }

    // ------------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------------

    protected <T> Future<T> inTransaction(Function<SqlConnection, Future<T>> operation) {
        Pool pool = connection.pool();
        return pool.withTransaction(operation);
    }

    /**
     * Verifies that the subscription exists and, for sessions, that the session is still owned.
     *
     * @return the subscription's max delivery count
     */
    protected Future<Integer> checkAccess(SqlConnection conn) {
        return conn.preparedQuery(SELECT_SUBSCRIPTION)
            .execute(Tuple.of(subscriptionPath.getPath()))
            .map(rows -> {
                if (rows.size() == 0) {
                    throw new MessagingEntityNotFoundException(subscriptionPath.getPath());
                }
                return rows.iterator().next().getInteger("max_delivery_count");
            });
    }

    /**
     * @return a tuple with {@code $1} bound to the subscription path and {@code $2} to the session id
     */
    protected Tuple scoped() {
        return Tuple.tuple().addValue(subscriptionPath.getPath()).addValue(scope.sessionId());
    }

    private double lockSeconds() {
        return connection.brokerConfig().lockDuration().toMillis() / 1000.0;
    }

    private static String deliveryCountDescription(int maxDeliveryCount) {
        return "Message could not be consumed after " + maxDeliveryCount + " delivery attempts";
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
