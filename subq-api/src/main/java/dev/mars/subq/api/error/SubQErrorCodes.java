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

/**
 * Centralized error codes for SubQ.
 *
 * <p>Codes follow the format SUBQERR####, grouped by area.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class SubQErrorCodes {

    private SubQErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "SUBQERR0001";
    public static final String INVALID_REQUEST = "SUBQERR0002";
    public static final String TIMEOUT = "SUBQERR0009";

    // ========================================================================
    // Connection Errors (0050-0099)
    // ========================================================================
    public static final String CONNECTION_CREATE_FAILED = "SUBQERR0050";
    public static final String CONNECTION_CLOSED = "SUBQERR0052";

    // ========================================================================
    // Entity Errors (0100-0149)
    // ========================================================================
    public static final String ENTITY_NOT_FOUND = "SUBQERR0100";
    public static final String RECEIVER_CREATE_FAILED = "SUBQERR0101";

    // ========================================================================
    // Message Lock Errors (0150-0199)
    // ========================================================================
    public static final String MESSAGE_LOCK_LOST = "SUBQERR0150";
    public static final String SETTLEMENT_NOT_SUPPORTED = "SUBQERR0151";

    // ========================================================================
    // Session Errors (0200-0249)
    // ========================================================================
    public static final String SESSION_CANNOT_BE_LOCKED = "SUBQERR0200";
    public static final String SESSION_LOCK_LOST = "SUBQERR0201";
    public static final String SESSION_ACCEPT_TIMEOUT = "SUBQERR0202";
}
