package dev.mars.subq.pg;

import dev.mars.subq.api.SubscriptionPath;
import dev.mars.subq.api.config.SubQConfiguration;
import dev.mars.subq.api.messaging.MessageState;
import dev.mars.subq.api.messaging.OutgoingMessage;
import dev.mars.subq.api.messaging.ReceivedMessage;
import dev.mars.subq.api.receiver.MessageReceiver;
import dev.mars.subq.api.session.MessageSession;
import dev.mars.subq.client.SubscriptionClient;
import dev.mars.subq.client.SubscriptionClientConfig;
import dev.mars.subq.client.provider.ConnectionProviderRegistry;
import dev.mars.subq.test.PostgreSQLTestConstants;
import dev.mars.subq.test.categories.TestCategories;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.sqlclient.Pool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static dev.mars.subq.pg.PgTestSupport.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link SubscriptionClient} end to end over the PostgreSQL transport, resolved from a connection string.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
@ExtendWith(VertxExtension.class)
class PgSubscriptionClientIntegrationTest {

    @Container
    @SuppressWarnings("resource")
    static PostgreSQLContainer<?> postgres = PostgreSQLTestConstants.createStandardContainer();

    private static final Duration WAIT = Duration.ofSeconds(5);

    private Pool adminPool;
    private PgSubscriptionAdmin admin;
    private PgTopicPublisher publisher;
    private SubscriptionClient client;
    private String topic;
    private SubscriptionPath path;

    @BeforeEach
    void setUp(Vertx vertx) throws Exception {
        adminPool = PgTestSupport.createPool(vertx, postgres);
        admin = new PgSubscriptionAdmin(adminPool, 2);
        await(admin.initializeSchema());
        publisher = new PgTopicPublisher(adminPool);
        topic = PgTestSupport.uniqueTopic("invoices");
        path = await(admin.createSubscription(topic, "ledger"));

        ConnectionProviderRegistry registry = new ConnectionProviderRegistry();
        PgConnectionRegistrar.registerWith(registry, vertx);
        SubQConfiguration configuration = new SubQConfiguration("default", Map.of(
            "subq.broker.poll-interval", "PT0.05S",
            "subq.database.pool.max-size", "2"));
        client = SubscriptionClient.createFromConnectionString(
            PostgreSQLTestConstants.connectionString(postgres, topic), "ledger",
            SubscriptionClientConfig.builder().registry(registry).configuration(configuration).build());
    }

    @AfterEach
    void tearDown() throws Exception {
        await(client.close());
        await(adminPool.close());
    }

    @Test
    @DisplayName("the client binds lazily and settles messages through the database")
    void testReceiveAndSettle() throws Exception {
        assertEquals(path.getPath(), client.getPath());
        assertFalse(client.getConnection().isClosed());
        for (int i = 1; i <= 3; i++) {
            await(publisher.send(topic, OutgoingMessage.of(new JsonObject().put("invoice", i))));
        }

        List<ReceivedMessage> batch = await(client.receiveBatch(3, WAIT));
        assertEquals(3, batch.size());

        await(client.complete(batch.get(0).getLockToken().orElseThrow()));
        await(client.defer(batch.get(1).getLockToken().orElseThrow()));
        await(client.deadLetter(batch.get(2).getLockToken().orElseThrow(), "Rejected", "duplicate invoice"));

        ReceivedMessage deferred = await(client.receiveBySequenceNumber(batch.get(1).getSequenceNumber())).orElseThrow();
        assertEquals(MessageState.DEFERRED, deferred.getState());
        await(client.complete(deferred.getLockToken().orElseThrow()));

        MessageReceiver deadLetters = client.createDeadLetterReceiver();
        List<ReceivedMessage> dead = await(deadLetters.receive(10, WAIT));
        assertEquals(1, dead.size());
        assertEquals("Rejected", dead.get(0).getDeadLetterReason());
        await(deadLetters.complete(List.of(dead.get(0).getLockToken().orElseThrow())));

        assertEquals(0L, await(admin.getActiveMessageCount(path)));
        assertEquals(0L, await(admin.getDeadLetterMessageCount(path)));
    }

    @Test
    @DisplayName("abandoning past the subscription's max delivery count dead-letters the message")
    void testMaxDeliveryCount() throws Exception {
        await(publisher.send(topic, OutgoingMessage.of(new JsonObject().put("invoice", 9))));

        await(client.abandon(await(client.receive(WAIT)).orElseThrow().getLockToken().orElseThrow()));
        await(client.abandon(await(client.receive(WAIT)).orElseThrow().getLockToken().orElseThrow()));

        assertTrue(await(client.receive(Duration.ofMillis(200))).isEmpty());
        assertEquals(1L, await(admin.getDeadLetterMessageCount(path)));
    }

    @Test
    @DisplayName("sessions accepted through the client are released when it closes")
    void testSessionsThroughClient() throws Exception {
        await(publisher.send(topic, OutgoingMessage.forSession("customer-1", new JsonObject().put("invoice", 1))));

        MessageSession session = await(client.acceptMessageSession(WAIT));
        assertEquals("customer-1", session.getSessionId());
        ReceivedMessage message = await(session.receive(1, WAIT)).get(0);
        await(session.complete(List.of(message.getLockToken().orElseThrow())));

        await(client.close());

        assertTrue(session.isClosed());
        assertTrue(client.getConnection().isClosed());
    }

    @Test
    @DisplayName("peek walks the subscription without taking locks")
    void testPeek() throws Exception {
        await(publisher.send(topic, OutgoingMessage.of(new JsonObject().put("invoice", 1))));
        await(publisher.send(topic, OutgoingMessage.of(new JsonObject().put("invoice", 2))));

        ReceivedMessage first = await(client.peek()).orElseThrow();
        ReceivedMessage second = await(client.peek()).orElseThrow();

        assertTrue(second.getSequenceNumber() > first.getSequenceNumber());
        assertTrue(await(client.peek()).isEmpty());
        assertEquals(second.getSequenceNumber(), client.getLastPeekedSequenceNumber());
        assertEquals(2, await(client.receiveBatch(10, WAIT)).size());
    }
}
