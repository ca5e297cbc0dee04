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
package dev.mars.subq.api.messaging;

/**
 * Broker-side state of a message held by a subscription.
 */
public enum MessageState {
    /** Eligible for ordinary receive calls. */
    ACTIVE,
    /** Set aside by a receiver; only reachable by sequence number. */
    DEFERRED,
    /** Moved to the dead-letter sub-queue. */
    DEAD_LETTERED
}
