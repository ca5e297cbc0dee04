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
package dev.mars.subq.client;

import dev.mars.subq.api.ReceiveMode;
import dev.mars.subq.api.config.SubQConfiguration;
import dev.mars.subq.api.lifecycle.SubscriptionEventListener;
import dev.mars.subq.client.lifecycle.LoggingSubscriptionEventListener;
import dev.mars.subq.client.metrics.SubQMetrics;
import dev.mars.subq.client.provider.ConnectionProviderRegistry;

/**
 * Optional settings for a {@link SubscriptionClient}.
 *
 * <p>Everything has a default: peek-lock receive mode, the logging listener, no metrics,
 * configuration loaded from the active profile, and the default connection registry.</p>
 */
public class SubscriptionClientConfig {
    private final ReceiveMode receiveMode;
    private final SubscriptionEventListener eventListener;
    private final SubQMetrics metrics;
    private final SubQConfiguration configuration;
    private final ConnectionProviderRegistry registry;

    private SubscriptionClientConfig(Builder builder) {
        this.receiveMode = builder.receiveMode;
        this.eventListener = builder.eventListener;
        this.metrics = builder.metrics;
        this.configuration = builder.configuration;
        this.registry = builder.registry;
    }

    // Getters
    public ReceiveMode getReceiveMode() { return receiveMode; }
    public SubscriptionEventListener getEventListener() { return eventListener; }
    public ConnectionProviderRegistry getRegistry() { return registry; }

    /**
     * @return the metrics to record to, or null if none were supplied or metrics are disabled
     */
    public SubQMetrics getMetrics() {
        return metrics != null && getConfiguration().isMetricsEnabled() ? metrics : null;
    }

    /**
     * @return the supplied configuration, or one loaded from the active profile on first use
     */
    public SubQConfiguration getConfiguration() {
        return configuration != null ? configuration : DefaultConfigurationHolder.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SubscriptionClientConfig defaultConfig() {
        return builder().build();
    }

    public static SubscriptionClientConfig forMode(ReceiveMode receiveMode) {
        return builder().receiveMode(receiveMode).build();
    }

    private static final class DefaultConfigurationHolder {
        static final SubQConfiguration INSTANCE = new SubQConfiguration();
    }

    public static class Builder {
        private ReceiveMode receiveMode = ReceiveMode.PEEK_LOCK;
        private SubscriptionEventListener eventListener = LoggingSubscriptionEventListener.INSTANCE;
        private SubQMetrics metrics;
        private SubQConfiguration configuration;
        private ConnectionProviderRegistry registry = ConnectionProviderRegistry.getDefault();

        public Builder receiveMode(ReceiveMode receiveMode) {
            this.receiveMode = receiveMode;
            return this;
        }

        public Builder eventListener(SubscriptionEventListener eventListener) {
            this.eventListener = eventListener;
            return this;
        }

        public Builder metrics(SubQMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder configuration(SubQConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder registry(ConnectionProviderRegistry registry) {
            this.registry = registry;
            return this;
        }

        public SubscriptionClientConfig build() {
            if (receiveMode == null) {
                throw new NullPointerException("Receive mode cannot be null");
            }
            if (eventListener == null) {
                throw new NullPointerException("Event listener cannot be null");
            }
            if (registry == null) {
                throw new NullPointerException("Connection registry cannot be null");
            }
            return new SubscriptionClientConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SubscriptionClientConfig{" +
            "receiveMode=" + receiveMode +
            ", eventListener=" + eventListener.getClass().getSimpleName() +
            ", metrics=" + (metrics != null ? metrics.getInstanceId() : "none") +
            '}';
    }
}
