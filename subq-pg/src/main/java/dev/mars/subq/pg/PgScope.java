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
package dev.mars.subq.pg;

import java.util.UUID;

/**
 * What a PostgreSQL receiver can see. Every scoped statement binds {@code $1} to the
 * subscription path and {@code $2} to the session id (null outside sessions), and uses
 * {@code m} as the alias of {@code subq_messages}.
 */
record PgScope(boolean deadLetter, String sessionId, UUID sessionOwner) {

    static final PgScope MAIN = new PgScope(false, null, null);
    static final PgScope DEAD_LETTER = new PgScope(true, null, null);

    static PgScope session(String sessionId, UUID owner) {
        return new PgScope(false, sessionId, owner);
    }

    /**
     * @return the WHERE fragment restricting {@code m} to this scope
     */
    String filter() {
        if (deadLetter) {
            // $2 is always null here but still has to be referenced
            return "m.entity_path = $1 AND m.state = 'DEAD_LETTERED' AND $2::text IS NULL";
        }
        return "m.entity_path = $1 AND m.state <> 'DEAD_LETTERED' AND m.session_id IS NOT DISTINCT FROM $2::text";
    }

    /**
     * @return the WHERE fragment restricting {@code m} to messages an ordinary receive may claim
     */
    String receivableFilter() {
        String available = filter() + " AND (m.locked_until IS NULL OR m.locked_until <= now())";
        return deadLetter ? available : available + " AND m.state = 'ACTIVE'";
    }
}
