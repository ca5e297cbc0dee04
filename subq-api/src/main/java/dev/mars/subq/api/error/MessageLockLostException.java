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

import java.util.List;
import java.util.UUID;

/**
 * A lock token was unknown to the broker: the lock expired, the message was
 * already settled, or the token was never issued for this entity.
 */
public class MessageLockLostException extends SubQException {

    private final List<UUID> lockTokens;

    public MessageLockLostException(String entityPath, List<UUID> lockTokens) {
        super(SubQError.messageLockLost(entityPath, lockTokens));
        this.lockTokens = List.copyOf(lockTokens);
    }

    /** Returns the tokens the broker did not recognise */
    public List<UUID> getLockTokens() { return lockTokens; }
}
