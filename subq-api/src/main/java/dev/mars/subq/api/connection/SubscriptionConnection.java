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
package dev.mars.subq.api.connection;

import dev.mars.subq.api.ReceiveMode;
import dev.mars.subq.api.SubscriptionPath;
import dev.mars.subq.api.receiver.MessageReceiver;
import dev.mars.subq.api.session.MessageSession;
import io.vertx.core.Future;

import java.time.Duration;

/**
 * Namespace-level connection to a broker, implemented by a transport module.
 *
 * <p>A connection produces receivers bound to an entity path and negotiates session
 * ownership. It is shared by any number of subscription clients.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface SubscriptionConnection {

    /**
     * @return the endpoint this connection talks to, for logging
     */
    String getEndpoint();

    /**
     * @return the default timeout for receive and accept operations
     */
    Duration getOperationTimeout();

    /**
     * Creates a receiver bound to the given entity path. This may touch the network and may fail.
     *
     * @param entityPath a subscription path or dead-letter path
     * @param receiveMode the delivery contract
     * @return a new receiver
     */
    MessageReceiver createMessageReceiver(String entityPath, ReceiveMode receiveMode);

    default MessageReceiver createMessageReceiver(SubscriptionPath path, ReceiveMode receiveMode) {
        return createMessageReceiver(path.getPath(), receiveMode);
    }

    /**
     * Negotiates exclusive ownership of a session.
     *
     * @param path the subscription
     * @param receiveMode delivery contract for the session's receive path
     * @param sessionId the session to lock, or null to let the broker pick any available session
     * @param waitTime how long to wait for a session to become available
     * @return the owned session; fails with {@link dev.mars.subq.api.error.SessionCannotBeLockedException}
     *         if the requested session is owned elsewhere, or with
     *         {@link dev.mars.subq.api.error.MessagingTimeoutException} if none became available
     */
    Future<MessageSession> acceptMessageSession(SubscriptionPath path, ReceiveMode receiveMode,
                                                String sessionId, Duration waitTime);

    /**
     * Releases the connection and everything it created. Safe to call multiple times.
     */
    Future<Void> close();

    boolean isClosed();
}
