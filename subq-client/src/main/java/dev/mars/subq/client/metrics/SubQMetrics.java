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
package dev.mars.subq.client.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Micrometer metrics for subscription clients.
 *
 * <p>Recording methods are no-ops until {@link #bindTo(MeterRegistry)} has been called,
 * so an unbound instance can be handed to clients safely.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class SubQMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(SubQMetrics.class);

    private final String instanceId;

    // Counters
    private Counter messagesReceived;
    private Counter messagesCompleted;
    private Counter messagesAbandoned;
    private Counter messagesDeferred;
    private Counter messagesDeadLettered;
    private Counter lockRenewals;
    private Counter settlementFailures;
    private Counter sessionsAccepted;
    private Counter sessionAcceptFailures;

    // Timers
    private Timer receiverCreationTime;

    public SubQMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        messagesReceived = counter(registry, "subq.messages.received",
            "Total number of messages received from subscriptions");
        messagesCompleted = counter(registry, "subq.messages.completed",
            "Total number of messages completed");
        messagesAbandoned = counter(registry, "subq.messages.abandoned",
            "Total number of messages abandoned");
        messagesDeferred = counter(registry, "subq.messages.deferred",
            "Total number of messages deferred");
        messagesDeadLettered = counter(registry, "subq.messages.dead_lettered",
            "Total number of messages explicitly dead-lettered");
        lockRenewals = counter(registry, "subq.locks.renewed",
            "Total number of message lock renewals");
        settlementFailures = counter(registry, "subq.settlement.failures",
            "Total number of failed settlement calls");
        sessionsAccepted = counter(registry, "subq.sessions.accepted",
            "Total number of sessions accepted");
        sessionAcceptFailures = counter(registry, "subq.sessions.accept_failures",
            "Total number of failed session accept attempts");

        receiverCreationTime = Timer.builder("subq.receiver.creation.time")
            .description("Time taken to create a message receiver")
            .tag("instance", instanceId)
            .register(registry);

        logger.info("SubQ metrics registered for instance: {}", instanceId);
    }

    private Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name)
            .description(description)
            .tag("instance", instanceId)
            .register(registry);
    }

    public void recordMessagesReceived(int count) {
        if (messagesReceived != null && count > 0) {
            messagesReceived.increment(count);
        }
    }

    public void recordMessagesCompleted(int count) {
        if (messagesCompleted != null) {
            messagesCompleted.increment(count);
        }
    }

    public void recordMessagesAbandoned(int count) {
        if (messagesAbandoned != null) {
            messagesAbandoned.increment(count);
        }
    }

    public void recordMessagesDeferred(int count) {
        if (messagesDeferred != null) {
            messagesDeferred.increment(count);
        }
    }

    public void recordMessagesDeadLettered(int count) {
        if (messagesDeadLettered != null) {
            messagesDeadLettered.increment(count);
        }
    }

    public void recordLockRenewal() {
        if (lockRenewals != null) {
            lockRenewals.increment();
        }
    }

    public void recordSettlementFailure() {
        if (settlementFailures != null) {
            settlementFailures.increment();
        }
    }

    public void recordSessionAccepted() {
        if (sessionsAccepted != null) {
            sessionsAccepted.increment();
        }
    }

    public void recordSessionAcceptFailure() {
        if (sessionAcceptFailures != null) {
            sessionAcceptFailures.increment();
        }
    }

    public void recordReceiverCreation(Duration duration) {
        if (receiverCreationTime != null) {
            receiverCreationTime.record(duration);
        }
    }

    public String getInstanceId() {
        return instanceId;
    }
}
