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
package dev.mars.subq.api.receiver;

import dev.mars.subq.api.messaging.ReceivedMessage;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks the last peeked sequence number for one receive path.
 * The cursor only ever moves forward, even when peeks complete out of order.
 */
public final class PeekCursor {

    private final AtomicLong lastPeekedSequenceNumber = new AtomicLong(-1);

    /**
     * @return the sequence number the next implicit peek starts from
     */
    public long next() {
        return lastPeekedSequenceNumber.get() + 1;
    }

    public long lastPeeked() {
        return lastPeekedSequenceNumber.get();
    }

    /**
     * Advances past the highest sequence number in {@code peeked}.
     *
     * @return the same list, for chaining in future pipelines
     */
    public List<ReceivedMessage> advance(List<ReceivedMessage> peeked) {
        for (ReceivedMessage message : peeked) {
            lastPeekedSequenceNumber.accumulateAndGet(message.getSequenceNumber(), Math::max);
        }
        return peeked;
    }
}
