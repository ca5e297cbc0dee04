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
import dev.mars.subq.api.error.SessionLockLostException;
import dev.mars.subq.api.messaging.ReceivedMessage;
import dev.mars.subq.api.receiver.PeekCursor;
import dev.mars.subq.api.session.MessageSession;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A session accepted through {@link PgSubscriptionConnection}. Every operation first checks
 * that this session's owner id still holds an unexpired row in {@code subq_session_locks}.
 */
public class PgMessageSession extends PgMessageReceiver implements MessageSession {

    private static final String SELECT_OWNED_LOCK = """
        SELECT locked_until FROM subq_session_locks
        WHERE entity_path = $1 AND session_id = $2 AND owner_id = $3 AND locked_until > now()
        FOR SHARE
        """;

    private static final String RENEW_LOCK = """
        UPDATE subq_session_locks SET locked_until = now() + make_interval(secs => $4)
        WHERE entity_path = $1 AND session_id = $2 AND owner_id = $3 AND locked_until > now()
        RETURNING locked_until
        """;

    private static final String RELEASE_LOCK =
        "DELETE FROM subq_session_locks WHERE entity_path = $1 AND session_id = $2 AND owner_id = $3";

    private static final String SELECT_STATE =
        "SELECT state FROM subq_session_state WHERE entity_path = $1 AND session_id = $2";

    private static final String UPSERT_STATE = """
        INSERT INTO subq_session_state (entity_path, session_id, state) VALUES ($1, $2, $3)
        ON CONFLICT (entity_path, session_id) DO UPDATE SET state = EXCLUDED.state, updated_at = now()
        """;

    private static final String DELETE_STATE =
        "DELETE FROM subq_session_state WHERE entity_path = $1 AND session_id = $2";

    private final String sessionId;
    private final UUID owner;
    private final PeekCursor peekCursor = new PeekCursor();
    private volatile Instant lockedUntil;

    PgMessageSession(PgSubscriptionConnection connection, SubscriptionPath path, ReceiveMode receiveMode,
                     PgSessionNegotiator.SessionGrant grant) {
        super(connection, path, path.getPath(), receiveMode, PgScope.session(grant.sessionId(), grant.owner()));
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
        double seconds = connection.brokerConfig().sessionLockDuration().toMillis() / 1000.0;
        return inTransaction(conn -> conn.preparedQuery(RENEW_LOCK).execute(owned().addDouble(seconds)))
            .compose(rows -> {
                if (rows.size() == 0) {
                    return Future.<Instant>failedFuture(new SessionLockLostException(getPath(), sessionId));
                }
                lockedUntil = rows.iterator().next().getOffsetDateTime("locked_until").toInstant();
                return Future.succeededFuture(lockedUntil);
            });
    }

    @Override
    public Future<Optional<Buffer>> getState() {
        checkOpen();
        return inTransaction(conn -> checkAccess(conn)
            .compose(max -> conn.preparedQuery(SELECT_STATE).execute(Tuple.of(getPath(), sessionId))))
            .map(rows -> rows.size() == 0
                ? Optional.<Buffer>empty()
                : Optional.of(rows.iterator().next().getBuffer("state")));
    }

    @Override
    public Future<Void> setState(Buffer state) {
        checkOpen();
        return inTransaction(conn -> checkAccess(conn)
            .compose(max -> state == null
                ? conn.preparedQuery(DELETE_STATE).execute(Tuple.of(getPath(), sessionId))
                : conn.preparedQuery(UPSERT_STATE).execute(Tuple.of(getPath(), sessionId, state))))
            .mapEmpty();
    }

    @Override
    public Future<List<ReceivedMessage>> peek(int count) {
        return peekBySequenceNumber(peekCursor.next(), count).map(peekCursor::advance);
    }

    @Override
    protected Future<Integer> checkAccess(SqlConnection conn) {
        return super.checkAccess(conn)
            .compose(maxDeliveryCount -> conn.preparedQuery(SELECT_OWNED_LOCK).execute(owned())
                .compose(rows -> rows.size() == 0
                    ? Future.<Integer>failedFuture(new SessionLockLostException(getPath(), sessionId))
                    : Future.succeededFuture(maxDeliveryCount)));
    }

    @Override
    protected Future<Void> release() {
        return connection.pool().preparedQuery(RELEASE_LOCK).execute(owned()).mapEmpty();
    }

    private Tuple owned() {
        return scoped().addUUID(owner);
    }

    @Override
    public String toString() {
        return "PgMessageSession{" + getPath() + ", session=" + sessionId + "}";
    }
}
