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
import dev.mars.subq.api.connection.SubscriptionConnection;
import dev.mars.subq.api.error.SessionCannotBeLockedException;
import dev.mars.subq.api.lifecycle.SubscriptionEventListener;
import dev.mars.subq.api.session.MessageSession;
import dev.mars.subq.client.metrics.SubQMetrics;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Negotiates exclusive session ownership on behalf of one subscription client.
 *
 * <p>Every attempt is bracketed by listener events: start, then either stop or exception.
 * Sessions produced here are tracked until the client closes them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class SessionAcceptor {
    private static final Logger logger = LoggerFactory.getLogger(SessionAcceptor.class);

    private final String clientId;
    private final SubscriptionConnection connection;
    private final SubscriptionPath path;
    private final ReceiveMode receiveMode;
    private final SubscriptionEventListener listener;
    private final SubQMetrics metrics;
    private final Map<String, MessageSession> ownedSessions = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public SessionAcceptor(String clientId, SubscriptionConnection connection, SubscriptionPath path,
                           ReceiveMode receiveMode, SubscriptionEventListener listener, SubQMetrics metrics) {
        this.clientId = clientId;
        this.connection = connection;
        this.path = path;
        this.receiveMode = receiveMode;
        this.listener = listener;
        this.metrics = metrics;
    }

    /**
     * Accepts a session.
     *
     * @param sessionId the session to lock, or null for any session with pending messages
     * @param waitTime how long the broker may wait for a session
     * @return the owned session, or the negotiation failure unchanged
     */
    public Future<MessageSession> accept(String sessionId, Duration waitTime) {
        notifyStart(sessionId);

        if (sessionId != null && isHeldOpen(sessionId)) {
            SessionCannotBeLockedException alreadyHeld = new SessionCannotBeLockedException(path.getPath(), sessionId);
            logger.debug("{}: session {} is already held open by this client", clientId, sessionId);
            return failed(sessionId, alreadyHeld);
        }

        Future<MessageSession> negotiation;
        try {
            negotiation = connection.acceptMessageSession(path, receiveMode, sessionId, waitTime);
        } catch (RuntimeException e) {
            negotiation = Future.failedFuture(e);
        }

        return negotiation.compose(
            session -> {
                ownedSessions.put(session.getSessionId(), session);
                // closeAll() may have run while negotiating; whoever removes the entry closes it
                if (closed && ownedSessions.remove(session.getSessionId(), session)) {
                    return releaseLateSession(sessionId, session);
                }
                if (metrics != null) {
                    metrics.recordSessionAccepted();
                }
                notifyStop(session.getSessionId());
                return Future.succeededFuture(session);
            },
            error -> failed(sessionId, error));
    }

    private Future<MessageSession> releaseLateSession(String sessionId, MessageSession session) {
        logger.debug("{}: session {} was accepted after close, releasing it", clientId, session.getSessionId());
        IllegalStateException closedError = new IllegalStateException(clientId + " has been closed");
        return session.close()
            .transform(ar -> {
                if (ar.failed()) {
                    logger.warn("{}: failed to release session {}: {}",
                        clientId, session.getSessionId(), ar.cause().getMessage());
                }
                return failed(sessionId, closedError);
            });
    }

    private Future<MessageSession> failed(String sessionId, Throwable error) {
        logger.debug("{}: accept session {} on {} failed: {}", clientId,
            sessionId != null ? sessionId : "<any>", path, error.toString());
        if (metrics != null) {
            metrics.recordSessionAcceptFailure();
        }
        notifyException(sessionId, error);
        return Future.failedFuture(error);
    }

    private boolean isHeldOpen(String sessionId) {
        MessageSession session = ownedSessions.get(sessionId);
        if (session == null) {
            return false;
        }
        Instant lockedUntil = session.getLockedUntil();
        if (session.isClosed() || lockedUntil == null || !lockedUntil.isAfter(Instant.now())) {
            ownedSessions.remove(sessionId, session);
            return false;
        }
        return true;
    }

    /**
     * @return the sessions accepted by this client that have not been closed
     */
    public List<MessageSession> getOwnedSessions() {
        ownedSessions.values().removeIf(MessageSession::isClosed);
        return List.copyOf(ownedSessions.values());
    }

    /**
     * Closes every session this acceptor produced. Failures are logged; the first one is reported.
     * A negotiation still in flight releases its session when it completes and fails with
     * {@link IllegalStateException}.
     */
    public Future<Void> closeAll() {
        closed = true;
        List<Future<Void>> closes = new ArrayList<>();
        for (Map.Entry<String, MessageSession> entry : ownedSessions.entrySet()) {
            MessageSession session = entry.getValue();
            if (!ownedSessions.remove(entry.getKey(), session)) {
                continue;
            }
            closes.add(session.close()
                .onFailure(e -> logger.warn("{}: failed to close session {}: {}",
                    clientId, session.getSessionId(), e.getMessage())));
        }
        return Future.join(closes).mapEmpty();
    }

    private void notifyStart(String sessionId) {
        try {
            listener.onAcceptSessionStart(clientId, sessionId);
        } catch (RuntimeException e) {
            logger.warn("{}: listener failed on accept start: {}", clientId, e.getMessage(), e);
        }
    }

    private void notifyStop(String sessionId) {
        try {
            listener.onAcceptSessionStop(clientId, sessionId);
        } catch (RuntimeException e) {
            logger.warn("{}: listener failed on accept stop: {}", clientId, e.getMessage(), e);
        }
    }

    private void notifyException(String sessionId, Throwable error) {
        try {
            listener.onAcceptSessionException(clientId, sessionId, error);
        } catch (RuntimeException e) {
            logger.warn("{}: listener failed on accept exception: {}", clientId, e.getMessage(), e);
        }
    }
}
