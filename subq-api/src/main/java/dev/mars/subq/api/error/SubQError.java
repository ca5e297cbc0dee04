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

package dev.mars.subq.api.error;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Error descriptor carried by every {@link SubQException}.
 *
 * @param code SUBQERR#### code from {@link SubQErrorCodes}
 * @param message human readable message
 * @param timestamp when the error was raised
 * @param details optional detail, may be null
 */
public record SubQError(
    String code,
    String message,
    Instant timestamp,
    String details
) {
    /**
     * Creates an error with code and message, using current timestamp.
     */
    public static SubQError of(String code, String message) {
        return new SubQError(code, message, Instant.now(), null);
    }

    /**
     * Creates an error with code, message, and details, using current timestamp.
     */
    public static SubQError of(String code, String message, String details) {
        return new SubQError(code, message, Instant.now(), details);
    }

    public static SubQError messageLockLost(String entityPath, Collection<?> lockTokens) {
        return of(SubQErrorCodes.MESSAGE_LOCK_LOST,
                  "The lock supplied is invalid. Either the lock expired, or the message has already been settled",
                  "entity=" + entityPath + ", lockTokens=" + lockTokens);
    }

    public static SubQError sessionCannotBeLocked(String entityPath, String sessionId) {
        return of(SubQErrorCodes.SESSION_CANNOT_BE_LOCKED,
                  "The requested session '" + sessionId + "' cannot be accepted. It may be locked by another receiver",
                  "entity=" + entityPath);
    }

    public static SubQError sessionLockLost(String entityPath, String sessionId) {
        return of(SubQErrorCodes.SESSION_LOCK_LOST,
                  "The session lock has expired on the session '" + sessionId + "'",
                  "entity=" + entityPath);
    }

    public static SubQError sessionAcceptTimeout(String entityPath, Duration waitTime) {
        return of(SubQErrorCodes.SESSION_ACCEPT_TIMEOUT,
                  "No session became available within " + waitTime,
                  "entity=" + entityPath);
    }

    public static SubQError entityNotFound(String entityPath) {
        return of(SubQErrorCodes.ENTITY_NOT_FOUND, "Messaging entity not found: " + entityPath);
    }

    public static SubQError connectionCreateFailed(String endpoint, String reason) {
        return of(SubQErrorCodes.CONNECTION_CREATE_FAILED,
                  "Failed to create connection to " + endpoint, reason);
    }
}
