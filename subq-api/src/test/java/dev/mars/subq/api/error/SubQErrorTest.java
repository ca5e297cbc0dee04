package dev.mars.subq.api.error;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class SubQErrorTest {

    @Test
    void testMessageLockLostCarriesTokens() {
        UUID token = UUID.randomUUID();
        MessageLockLostException e = new MessageLockLostException("orders/Subscriptions/billing", List.of(token));

        assertEquals(SubQErrorCodes.MESSAGE_LOCK_LOST, e.getCode());
        assertEquals(List.of(token), e.getLockTokens());
        assertTrue(e.getMessage().startsWith("[SUBQERR0150] "));
        assertTrue(e.getMessage().contains(token.toString()));
        assertFalse(e.isTransient());
    }

    @Test
    void testSessionErrors() {
        SessionCannotBeLockedException cannotLock = new SessionCannotBeLockedException("t/Subscriptions/s", "s-1");
        SessionLockLostException lockLost = new SessionLockLostException("t/Subscriptions/s", "s-1");

        assertEquals(SubQErrorCodes.SESSION_CANNOT_BE_LOCKED, cannotLock.getCode());
        assertEquals("s-1", cannotLock.getSessionId());
        assertTrue(cannotLock.isTransient());
        assertEquals(SubQErrorCodes.SESSION_LOCK_LOST, lockLost.getCode());
        assertFalse(lockLost.isTransient());
    }

    @Test
    void testTimeoutIsTransient() {
        MessagingTimeoutException e = MessagingTimeoutException.sessionAccept("t/Subscriptions/s", Duration.ofSeconds(2));

        assertEquals(SubQErrorCodes.SESSION_ACCEPT_TIMEOUT, e.getCode());
        assertTrue(e.isTransient());
        assertTrue(e.getMessage().contains("PT2S"));
    }

    @Test
    void testErrorWithoutDetailsHasNoParentheses() {
        SubQException e = new SubQException(SubQError.of(SubQErrorCodes.INTERNAL_ERROR, "boom"));

        assertEquals("[SUBQERR0001] boom", e.getMessage());
        assertNotNull(e.getError().timestamp());
        assertNull(e.getError().details());
    }

    @Test
    void testConnectionFactoryExceptionKeepsCause() {
        IllegalStateException cause = new IllegalStateException("refused");
        ConnectionFactoryException e = new ConnectionFactoryException(
            SubQError.connectionCreateFailed("postgresql://db", cause.getMessage()), cause);

        assertSame(cause, e.getCause());
        assertEquals(SubQErrorCodes.CONNECTION_CREATE_FAILED, e.getCode());
    }
}
