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
package dev.mars.subq.api;

/**
 * Delivery contract of a subscription client. Fixed when the client is created.
 */
public enum ReceiveMode {
    /**
     * Received messages are locked for the receiver and stay on the subscription
     * until they are completed, abandoned, deferred or dead-lettered.
     * Every received message carries a lock token.
     */
    PEEK_LOCK,

    /**
     * Messages are deleted by the broker as they are delivered.
     * No lock token is issued and no settlement step exists.
     */
    RECEIVE_AND_DELETE;

    /**
     * @return true if lock-token settlement operations are meaningful in this mode
     */
    public boolean supportsSettlement() {
        return this == PEEK_LOCK;
    }
}
