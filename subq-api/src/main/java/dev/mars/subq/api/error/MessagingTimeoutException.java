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

/**
 * An operation did not complete within its wait time.
 */
public class MessagingTimeoutException extends SubQException {

    public MessagingTimeoutException(SubQError error) {
        super(error);
    }

    public static MessagingTimeoutException sessionAccept(String entityPath, Duration waitTime) {
        return new MessagingTimeoutException(SubQError.sessionAcceptTimeout(entityPath, waitTime));
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
