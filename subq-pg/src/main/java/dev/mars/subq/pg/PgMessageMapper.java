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

import dev.mars.subq.api.messaging.MessageState;
import dev.mars.subq.api.messaging.ReceivedMessage;
import dev.mars.subq.api.messaging.SimpleReceivedMessage;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps {@code subq_messages} rows to {@link ReceivedMessage}s.
 */
final class PgMessageMapper {

    private PgMessageMapper() {
    }

    static List<ReceivedMessage> toMessages(RowSet<Row> rows, boolean withLock) {
        List<ReceivedMessage> messages = new ArrayList<>(rows.size());
        for (Row row : rows) {
            messages.add(toMessage(row, withLock));
        }
        // RETURNING gives no ordering guarantee
        messages.sort(Comparator.comparingLong(ReceivedMessage::getSequenceNumber));
        return messages;
    }

    static ReceivedMessage toMessage(Row row, boolean withLock) {
        return SimpleReceivedMessage.builder()
            .messageId(row.getString("message_id"))
            .sequenceNumber(row.getLong("sequence_number"))
            .lock(withLock ? row.getUUID("lock_token") : null, withLock ? instant(row, "locked_until") : null)
            .deliveryCount(row.getInteger("delivery_count"))
            .enqueuedAt(instant(row, "enqueued_at"))
            .sessionId(row.getString("session_id"))
            .state(MessageState.valueOf(row.getString("state")))
            .deadLetter(row.getString("dead_letter_reason"), row.getString("dead_letter_description"))
            .headers(headers(row.getJsonObject("headers")))
            .payload(row.getJsonObject("payload"))
            .build();
    }

    static JsonObject headersToJson(Map<String, String> headers) {
        return new JsonObject(new LinkedHashMap<String, Object>(headers));
    }

    private static Map<String, String> headers(JsonObject json) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (json != null) {
            json.forEach(entry -> headers.put(entry.getKey(), String.valueOf(entry.getValue())));
        }
        return headers;
    }

    private static Instant instant(Row row, String column) {
        OffsetDateTime value = row.getOffsetDateTime(column);
        return value != null ? value.toInstant() : null;
    }
}
