package dev.mars.subq.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SubscriptionPathTest {

    @Test
    void testPathIsDerivedFromTopicAndName() {
        SubscriptionPath path = SubscriptionPath.of("orders", "billing");

        assertEquals("orders", path.getTopicPath());
        assertEquals("billing", path.getSubscriptionName());
        assertEquals("orders/Subscriptions/billing", path.getPath());
        assertEquals("orders/Subscriptions/billing/$DeadLetterQueue", path.deadLetterPath());
        assertEquals(path.getPath(), path.toString());
    }

    @Test
    void testTopicSlashesAreTrimmed() {
        SubscriptionPath path = SubscriptionPath.of("/eu/orders/", "billing");

        assertEquals("eu/orders", path.getTopicPath());
        assertEquals("eu/orders/Subscriptions/billing", path.getPath());
    }

    @Test
    void testInvalidArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SubscriptionPath.of(null, "billing"));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionPath.of("  ", "billing"));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionPath.of("/", "billing"));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionPath.of("orders", null));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionPath.of("orders", ""));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionPath.of("orders", "a/b"));
    }

    @Test
    void testParseRoundTripsAndIgnoresDeadLetterSuffix() {
        SubscriptionPath path = SubscriptionPath.of("eu/orders", "billing");

        assertEquals(path, SubscriptionPath.parse(path.getPath()));
        assertEquals(path, SubscriptionPath.parse(path.deadLetterPath()));
        assertEquals(path.hashCode(), SubscriptionPath.parse(path.getPath()).hashCode());
    }

    @Test
    void testParseRejectsNonSubscriptionPaths() {
        assertThrows(IllegalArgumentException.class, () -> SubscriptionPath.parse("orders"));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionPath.parse("/Subscriptions/billing"));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionPath.parse(""));
    }

    @Test
    void testDeadLetterPathDetection() {
        assertTrue(SubscriptionPath.isDeadLetterPath("orders/Subscriptions/billing/$DeadLetterQueue"));
        assertFalse(SubscriptionPath.isDeadLetterPath("orders/Subscriptions/billing"));
        assertFalse(SubscriptionPath.isDeadLetterPath(null));
    }

    @Test
    void testReceiveModeSettlementSupport() {
        assertTrue(ReceiveMode.PEEK_LOCK.supportsSettlement());
        assertFalse(ReceiveMode.RECEIVE_AND_DELETE.supportsSettlement());
    }
}
