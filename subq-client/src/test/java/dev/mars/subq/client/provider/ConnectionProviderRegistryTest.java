package dev.mars.subq.client.provider;

import dev.mars.subq.api.config.SubQConfiguration;
import dev.mars.subq.api.connection.ConnectionStringBuilder;
import dev.mars.subq.api.connection.SubscriptionConnection;
import dev.mars.subq.api.error.ConnectionFactoryException;
import dev.mars.subq.api.error.MessagingEntityNotFoundException;
import dev.mars.subq.api.error.SubQErrorCodes;
import dev.mars.subq.test.broker.InMemoryBroker;
import dev.mars.subq.test.broker.InMemoryConnectionRegistrar;
import dev.mars.subq.test.categories.TestCategories;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
class ConnectionProviderRegistryTest {

    private ConnectionProviderRegistry registry;
    private SubQConfiguration configuration;

    @BeforeEach
    void setUp() {
        registry = new ConnectionProviderRegistry();
        configuration = new SubQConfiguration("default", Map.of("subq.client.operation-timeout", "PT7S"));
    }

    @Test
    @DisplayName("schemes are registered case-insensitively")
    void testRegisterAndResolve() {
        SubscriptionConnection connection = mock(SubscriptionConnection.class);
        registry.registerConnectionCreator("Memory", (cs, config) -> connection);

        assertTrue(registry.isSchemeSupported("memory"));
        assertTrue(registry.isSchemeSupported("MEMORY"));
        assertEquals(Set.of("memory"), registry.getSupportedSchemes());
        assertSame(connection, registry.createConnection(ConnectionStringBuilder.parse("Endpoint=MEMORY://local"), configuration));

        registry.unregisterConnectionCreator("memory");
        assertFalse(registry.isSchemeSupported("memory"));
    }

    @Test
    @DisplayName("an unknown scheme is a usage error naming the registered schemes")
    void testUnknownScheme() {
        registry.registerConnectionCreator("memory", (cs, config) -> mock(SubscriptionConnection.class));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> registry.resolve(ConnectionStringBuilder.parse("Endpoint=amqp://broker")));

        assertTrue(e.getMessage().contains("amqp"));
        assertTrue(e.getMessage().contains("[memory]"));
    }

    @Test
    @DisplayName("checked creator failures are wrapped, SubQ failures pass through")
    void testCreatorFailures() {
        registry.registerConnectionCreator("broken", (cs, config) -> {
            throw new IOException("connection refused");
        });
        registry.registerConnectionCreator("missing", (cs, config) -> {
            throw new MessagingEntityNotFoundException("orders");
        });

        ConnectionFactoryException wrapped = assertThrows(ConnectionFactoryException.class,
            () -> registry.createConnection(ConnectionStringBuilder.parse("Endpoint=broken://x"), configuration));
        assertEquals(SubQErrorCodes.CONNECTION_CREATE_FAILED, wrapped.getCode());
        assertInstanceOf(IOException.class, wrapped.getCause());

        assertThrows(MessagingEntityNotFoundException.class,
            () -> registry.createConnection(ConnectionStringBuilder.parse("Endpoint=missing://x"), configuration));
    }

    @Test
    @DisplayName("blank schemes are rejected")
    void testBlankScheme() {
        assertThrows(IllegalArgumentException.class,
            () -> registry.registerConnectionCreator(" ", (cs, config) -> mock(SubscriptionConnection.class)));
    }

    @Test
    @DisplayName("the in-memory registrar takes the timeout from the connection string, else the configuration")
    void testInMemoryRegistrar(Vertx vertx) {
        InMemoryConnectionRegistrar.registerWith(registry, new InMemoryBroker(vertx));

        SubscriptionConnection fromString = registry.createConnection(
            ConnectionStringBuilder.parse("Endpoint=memory://local;OperationTimeout=PT3S"), configuration);
        SubscriptionConnection fromConfig = registry.createConnection(
            ConnectionStringBuilder.parse("Endpoint=memory://local"), configuration);

        assertEquals(Duration.ofSeconds(3), fromString.getOperationTimeout());
        assertEquals(Duration.ofSeconds(7), fromConfig.getOperationTimeout());

        InMemoryConnectionRegistrar.unregisterFrom(registry);
        assertFalse(registry.isSchemeSupported(InMemoryConnectionRegistrar.SCHEME));
    }
}
