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
package dev.mars.subq.api.lifecycle;

/**
 * Observer of subscription client lifecycle points.
 *
 * <p>Callbacks are fire-and-forget: they run on the calling thread, must not block,
 * and anything they throw is logged and otherwise ignored by the caller.</p>
 */
public interface SubscriptionEventListener {

    /** A listener that does nothing. */
    SubscriptionEventListener NO_OP = new SubscriptionEventListener() { };

    default void onAcceptSessionStart(String clientId, String sessionId) {
    }

    default void onAcceptSessionStop(String clientId, String sessionId) {
    }

    default void onAcceptSessionException(String clientId, String sessionId, Throwable error) {
    }

    default void onClientClosed(String clientId) {
    }
}
