package dev.mars.subq.pg;

import dev.mars.subq.api.config.SubQConfiguration;
import dev.mars.subq.api.connection.ConnectionStringBuilder;
import dev.mars.subq.test.categories.TestCategories;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.Map;

import static dev.mars.subq.pg.PgTestSupport.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Connection string handling. Pools connect lazily, so none of these tests needs a database.
 */
@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
class PgSubscriptionConnectionTest {

    private final SubQConfiguration configuration =
        new SubQConfiguration("default", Map.of("subq.client.operation-timeout", "PT9S"));

    @Test
    @DisplayName("connect derives the endpoint, default port and timeout")
    void testConnect(Vertx vertx) throws Exception {
        PgSubscriptionConnection connection = PgSubscriptionConnection.connect(vertx,
            ConnectionStringBuilder.parse("Endpoint=postgresql://db.local/subq;Username=subq;Password=secret"),
            configuration);

        assertEquals("postgresql://db.local:5432/subq", connection.getEndpoint());
        assertEquals(Duration.ofSeconds(9), connection.getOperationTimeout());
        assertEquals(configuration.getBrokerConfig(), connection.brokerConfig());

        await(connection.close());
        assertTrue(connection.isClosed());
    }

    @Test
    @DisplayName("the connection string timeout wins over the configuration")
    void testOperationTimeoutFromConnectionString(Vertx vertx) throws Exception {
        PgSubscriptionConnection connection = PgSubscriptionConnection.connect(vertx,
            ConnectionStringBuilder.parse("Endpoint=postgresql://db.local:6543/subq;Username=subq;OperationTimeout=PT2S"),
            configuration);

        assertEquals("postgresql://db.local:6543/subq", connection.getEndpoint());
        assertEquals(Duration.ofSeconds(2), connection.getOperationTimeout());
        await(connection.close());
    }

    @Test
    @DisplayName("endpoints without a database, a username or with a bad schema are rejected")
    void testInvalidConnectionStrings(Vertx vertx) {
        assertThrows(IllegalArgumentException.class, () -> PgSubscriptionConnection.connect(vertx,
            ConnectionStringBuilder.parse("Endpoint=postgresql://db.local;Username=subq"), configuration));
        assertThrows(IllegalArgumentException.class, () -> PgSubscriptionConnection.connect(vertx,
            ConnectionStringBuilder.parse("Endpoint=postgresql://db.local/subq"), configuration));
        assertThrows(IllegalArgumentException.class, () -> PgSubscriptionConnection.connect(vertx,
            ConnectionStringBuilder.parse("Endpoint=postgresql://db.local/subq;Username=subq;Schema=public-x"),
            configuration));
    }

    @Test
    @DisplayName("search paths are validated and normalized")
    void testNormalizeSearchPath() {
        assertEquals("tenant_a, public", PgSubscriptionConnection.normalizeSearchPath(" tenant_a ,public "));
        assertEquals("", PgSubscriptionConnection.normalizeSearchPath("  "));
        assertEquals("", PgSubscriptionConnection.normalizeSearchPath(null));
        assertThrows(IllegalArgumentException.class, () -> PgSubscriptionConnection.normalizeSearchPath("public;drop"));
        assertThrows(IllegalArgumentException.class, () -> PgSubscriptionConnection.normalizeSearchPath("\"quoted\""));
    }

    @Test
    @DisplayName("the schema script splits into its statements")
    void testSchemaScriptStatements() {
        String script = """
            -- comment; with a semicolon
            CREATE TABLE a (id INT);

            CREATE INDEX b ON a (id);
            """;

        assertEquals(2, PgSubscriptionAdmin.parseStatements(script).size());
        assertTrue(PgSubscriptionAdmin.parseStatements(script).get(0).startsWith("CREATE TABLE a"));
    }
}
