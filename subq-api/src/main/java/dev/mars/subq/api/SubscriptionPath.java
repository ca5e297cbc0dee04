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

import java.util.Objects;

/**
 * Identity of a subscription on a topic.
 *
 * <p>The entity path is always derived from the topic path and subscription name,
 * e.g. {@code orders/Subscriptions/billing}. The dead-letter sub-queue of the
 * subscription lives at {@code orders/Subscriptions/billing/$DeadLetterQueue}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class SubscriptionPath {

    public static final String SUBSCRIPTIONS_SEGMENT = "/Subscriptions/";
    public static final String DEAD_LETTER_SUFFIX = "/$DeadLetterQueue";

    private final String topicPath;
    private final String subscriptionName;

    private SubscriptionPath(String topicPath, String subscriptionName) {
        this.topicPath = topicPath;
        this.subscriptionName = subscriptionName;
    }

    /**
     * Creates the identity for a subscription.
     *
     * @param topicPath the topic path, not blank
     * @param subscriptionName the subscription name, not blank
     * @return the subscription identity
     * @throws IllegalArgumentException if either argument is null or blank
     */
    public static SubscriptionPath of(String topicPath, String subscriptionName) {
        if (topicPath == null || topicPath.isBlank()) {
            throw new IllegalArgumentException("Topic path cannot be null or blank");
        }
        if (subscriptionName == null || subscriptionName.isBlank()) {
            throw new IllegalArgumentException("Subscription name cannot be null or blank");
        }
        if (subscriptionName.contains("/")) {
            throw new IllegalArgumentException("Subscription name cannot contain '/': " + subscriptionName);
        }
        return new SubscriptionPath(trimSlashes(topicPath), subscriptionName);
    }

    /**
     * Parses an entity path of the form {@code <topic>/Subscriptions/<name>}, optionally
     * followed by the dead-letter suffix, which is ignored.
     *
     * @param entityPath the entity path
     * @return the subscription identity
     * @throws IllegalArgumentException if the path is not a subscription path
     */
    public static SubscriptionPath parse(String entityPath) {
        if (entityPath == null || entityPath.isBlank()) {
            throw new IllegalArgumentException("Entity path cannot be null or blank");
        }
        String path = isDeadLetterPath(entityPath)
            ? entityPath.substring(0, entityPath.length() - DEAD_LETTER_SUFFIX.length())
            : entityPath;
        int idx = path.lastIndexOf(SUBSCRIPTIONS_SEGMENT);
        if (idx <= 0) {
            throw new IllegalArgumentException("Not a subscription path: " + entityPath);
        }
        return of(path.substring(0, idx), path.substring(idx + SUBSCRIPTIONS_SEGMENT.length()));
    }

    /**
     * @param entityPath an entity path
     * @return true if the path addresses a dead-letter sub-queue
     */
    public static boolean isDeadLetterPath(String entityPath) {
        return entityPath != null && entityPath.endsWith(DEAD_LETTER_SUFFIX);
    }

    private static String trimSlashes(String path) {
        String trimmed = path.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Topic path cannot be empty");
        }
        return trimmed;
    }

    public String getTopicPath() {
        return topicPath;
    }

    public String getSubscriptionName() {
        return subscriptionName;
    }

    /**
     * @return {@code <topicPath>/Subscriptions/<subscriptionName>}
     */
    public String getPath() {
        return topicPath + SUBSCRIPTIONS_SEGMENT + subscriptionName;
    }

    /**
     * @return the entity path of this subscription's dead-letter sub-queue
     */
    public String deadLetterPath() {
        return getPath() + DEAD_LETTER_SUFFIX;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubscriptionPath that = (SubscriptionPath) o;
        return topicPath.equals(that.topicPath) && subscriptionName.equals(that.subscriptionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topicPath, subscriptionName);
    }

    @Override
    public String toString() {
        return getPath();
    }
}
