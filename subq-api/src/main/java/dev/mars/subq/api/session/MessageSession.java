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
package dev.mars.subq.api.session;

import dev.mars.subq.api.messaging.ReceivedMessage;
import dev.mars.subq.api.receiver.MessageReceiver;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.Future;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Exclusive ownership of one session of a subscription.
 *
 * <p>Receive, peek and settlement calls only see messages of this session. Once the
 * session lock is lost every operation fails with
 * {@link dev.mars.subq.api.error.SessionLockLostException}; after {@link #close()}
 * operations fail with {@link IllegalStateException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface MessageSession extends MessageReceiver {

    String getSessionId();

    /**
     * @return when the session lock expires unless renewed
     */
    Instant getLockedUntil();

    /**
     * Extends the session lock.
     *
     * @return the new session lock expiry
     */
    Future<Instant> renewSessionLock();

    /**
     * Reads the opaque state stored with the session.
     *
     * @return the state, or empty if none was set
     */
    Future<Optional<Buffer>> getState();

    /**
     * Replaces the session state. A null state clears it.
     */
    Future<Void> setState(Buffer state);

    /**
     * Peeks from this session's own cursor, which is independent of the subscription's.
     */
    Future<List<ReceivedMessage>> peek(int count);
}
