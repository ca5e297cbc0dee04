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

import java.util.Objects;

/**
 * Base class for failures reported by the broker or a transport.
 *
 * <p>Usage errors are not SubQExceptions; they are reported with the standard
 * {@link IllegalArgumentException} and {@link IllegalStateException}.</p>
 */
public class SubQException extends RuntimeException {

    private final SubQError error;

    public SubQException(SubQError error) {
        super(formatMessage(error));
        this.error = error;
    }

    public SubQException(SubQError error, Throwable cause) {
        super(formatMessage(error), cause);
        this.error = error;
    }

    /** Returns the structured error */
    public SubQError getError() { return error; }

    /** Returns the SUBQERR#### code */
    public String getCode() { return error.code(); }

    /**
     * @return true if retrying the same operation later may succeed
     */
    public boolean isTransient() {
        return false;
    }

    private static String formatMessage(SubQError error) {
        Objects.requireNonNull(error, "error cannot be null");
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(error.code()).append("] ").append(error.message());
        if (error.details() != null) {
            sb.append(" (").append(error.details()).append(')');
        }
        return sb.toString();
    }
}
