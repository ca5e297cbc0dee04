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
package dev.mars.subq.client.lifecycle;

import dev.mars.subq.api.lifecycle.SubscriptionEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default listener; writes every lifecycle event to the log.
 */
public class LoggingSubscriptionEventListener implements SubscriptionEventListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingSubscriptionEventListener.class);

    public static final LoggingSubscriptionEventListener INSTANCE = new LoggingSubscriptionEventListener();

    @Override
    public void onAcceptSessionStart(String clientId, String sessionId) {
        logger.debug("{}: accepting session {}", clientId, sessionId != null ? sessionId : "<any>");
    }

    @Override
    public void onAcceptSessionStop(String clientId, String sessionId) {
        logger.info("{}: accepted session {}", clientId, sessionId);
    }

    @Override
    public void onAcceptSessionException(String clientId, String sessionId, Throwable error) {
        logger.warn("{}: failed to accept session {}: {}", clientId,
            sessionId != null ? sessionId : "<any>", error.getMessage());
    }

    @Override
    public void onClientClosed(String clientId) {
        logger.info("{}: closed", clientId);
    }
}
