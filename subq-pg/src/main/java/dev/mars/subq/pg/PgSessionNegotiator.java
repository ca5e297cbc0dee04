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

import dev.mars.subq.api.SubscriptionPath;
import dev.mars.subq.api.error.MessagingEntityNotFoundException;
import dev.mars.subq.api.error.MessagingTimeoutException;
import dev.mars.subq.api.error.SessionCannotBeLockedException;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Negotiates exclusive session locks in {@code subq_session_locks}.
 *
 * <p>A lock row is owned by a random owner id until it expires. An expired row is taken over
 * by the next acceptor, which is how a session abandoned by a crashed client becomes
 * available again.</p>
 */
final class PgSessionNegotiator {
    private static final Logger logger = LoggerFactory.getLogger(PgSessionNegotiator.class);

    private static final String SELECT_SUBSCRIPTION = "SELECT 1 FROM subq_subscriptions WHERE entity_path = $1";

    private static final String LOCK_SESSION = """
        INSERT INTO subq_session_locks (entity_path, session_id, owner_id, locked_until)
        VALUES ($1, $2, $3, now() + make_interval(secs => $4))
        ON CONFLICT (entity_path, session_id) DO UPDATE
            SET owner_id = EXCLUDED.owner_id, locked_until = EXCLUDED.locked_until
            WHERE subq_session_locks.locked_until <= now()
        RETURNING locked_until
        """;

    // Oldest available session message whose session nobody holds
    private static final String SELECT_CANDIDATE = """
        SELECT m.session_id FROM subq_messages m
        WHERE m.entity_path = $1 AND m.session_id IS NOT NULL AND m.state = 'ACTIVE'
          AND (m.locked_until IS NULL OR m.locked_until <= now())
          AND NOT EXISTS (
              SELECT 1 FROM subq_session_locks l
              WHERE l.entity_path = m.entity_path AND l.session_id = m.session_id AND l.locked_until > now())
        ORDER BY m.sequence_number
        LIMIT 1
        """;

    /**
     * An accepted session lock.
     */
    record SessionGrant(String sessionId, UUID owner, Instant lockedUntil) {
    }

    private final PgSubscriptionConnection connection;

    PgSessionNegotiator(PgSubscriptionConnection connection) {
        this.connection = connection;
    }

    /**
     * Locks a named session, whether or not it has messages.
     */
    Future<SessionGrant> lockSession(SubscriptionPath path, String sessionId) {
        return connection.pool()
            .withTransaction(conn -> checkSubscription(conn, path).compose(v -> tryLock(conn, path, sessionId)))
            .compose(grant -> grant.isPresent()
                ? Future.succeededFuture(grant.get())
                : Future.<SessionGrant>failedFuture(new SessionCannotBeLockedException(path.getPath(), sessionId)));
    }

    /**
     * Locks the first unlocked session with an available message, polling until one appears.
     */
    Future<SessionGrant> lockAnySession(SubscriptionPath path, Duration waitTime) {
        return connection.<Optional<SessionGrant>>poll(
                () -> connection.pool().withTransaction(conn -> checkSubscription(conn, path)
                    .compose(v -> conn.preparedQuery(SELECT_CANDIDATE).execute(Tuple.of(path.getPath())))
                    .compose(rows -> rows.size() == 0
                        ? Future.succeededFuture(Optional.<SessionGrant>empty())
                        : tryLock(conn, path, rows.iterator().next().getString("session_id")))),
                Optional::isPresent, waitTime)
            .compose(grant -> grant.isPresent()
                ? Future.succeededFuture(grant.get())
                : Future.<SessionGrant>failedFuture(MessagingTimeoutException.sessionAccept(path.getPath(), waitTime)));
    }

    private Future<Void> checkSubscription(SqlConnection conn, SubscriptionPath path) {
        return conn.preparedQuery(SELECT_SUBSCRIPTION)
            .execute(Tuple.of(path.getPath()))
            .map(rows -> {
                if (rows.size() == 0) {
                    throw new MessagingEntityNotFoundException(path.getPath());
                }
                return null;
            });
    }

    private Future<Optional<SessionGrant>> tryLock(SqlConnection conn, SubscriptionPath path, String sessionId) {
        UUID owner = UUID.randomUUID();
        double seconds = connection.brokerConfig().sessionLockDuration().toMillis() / 1000.0;
        return conn.preparedQuery(LOCK_SESSION)
            .execute(Tuple.of(path.getPath(), sessionId, owner, seconds))
            .map(rows -> {
                if (rows.size() == 0) {
                    logger.debug("Session {} on {} is locked by another receiver", sessionId, path);
                    return Optional.<SessionGrant>empty();
                }
                Instant lockedUntil = rows.iterator().next().getOffsetDateTime("locked_until").toInstant();
                return Optional.of(new SessionGrant(sessionId, owner, lockedUntil));
            });
    }
}
