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
package dev.mars.subq.client.util;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds a value that is created at most once at a time and kept once created.
 *
 * <p>The first caller of {@link #getOrCreate(Supplier)} runs the creator on its own thread.
 * Callers arriving while creation is in flight wait for that attempt and receive its value,
 * or the very exception it threw. A failed attempt leaves the cell empty so a later call
 * starts a fresh attempt. A successful value is never replaced.</p>
 *
 * @param <T> the value type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class OnceCell<T> {

    private final AtomicReference<CompletableFuture<T>> cell = new AtomicReference<>();

    /**
     * Returns the value, creating it if no attempt has succeeded yet.
     *
     * @param creator creates the value; must not return null
     * @return the value
     * @throws RuntimeException whatever the creator of the attempt this call joined threw
     */
    public T getOrCreate(Supplier<T> creator) {
        Objects.requireNonNull(creator, "creator cannot be null");
        while (true) {
            CompletableFuture<T> current = cell.get();
            if (current != null) {
                return await(current);
            }

            CompletableFuture<T> attempt = new CompletableFuture<>();
            if (!cell.compareAndSet(null, attempt)) {
                continue;
            }

            try {
                T value = Objects.requireNonNull(creator.get(), "creator returned null");
                attempt.complete(value);
                return value;
            } catch (RuntimeException | Error e) {
                // Empty the cell before waking joiners so their retries start a new attempt
                cell.compareAndSet(attempt, null);
                attempt.completeExceptionally(e);
                throw e;
            }
        }
    }

    /**
     * @return the value if an attempt has already succeeded, without creating it
     */
    public Optional<T> get() {
        CompletableFuture<T> current = cell.get();
        if (current == null || !current.isDone() || current.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(current.join());
    }

    private static <T> T await(CompletableFuture<T> attempt) {
        try {
            return attempt.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
