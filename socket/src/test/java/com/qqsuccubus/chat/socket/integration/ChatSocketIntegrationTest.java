package com.qqsuccubus.chat.socket.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.chat.core.model.User;
import com.qqsuccubus.chat.core.util.JsonUtils;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.dispatch.Dispatcher;
import com.qqsuccubus.chat.socket.drain.DrainService;
import com.qqsuccubus.chat.socket.http.HttpServer;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.chat.socket.presence.PresenceNotifier;
import com.qqsuccubus.chat.socket.registry.CloseCodes;
import com.qqsuccubus.chat.socket.registry.ConnectionRegistry;
import com.qqsuccubus.chat.socket.store.InMemoryChatStore;
import com.qqsuccubus.chat.socket.ws.UpgradeGate;
import com.qqsuccubus.chat.socket.ws.WebSocketHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.http.client.HttpClient;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the node through real WebSocket clients.
 */
class ChatSocketIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private InMemoryChatStore store;
    private ConnectionRegistry registry;
    private DrainService drainService;
    private HttpServer httpServer;

    private long alice;
    private long bob;

    @BeforeEach
    void setUp() {
        SocketConfig config = SocketConfig.builder()
            .nodeId("it-node")
            .httpPort(0)
            .wsPath("/api/ws")
            .perConnBufferSize(64)
            .pingInterval(0)
            .idleTimeout(0)
            .drainBatchSize(10)
            .drainBatchIntervalMs(10)
            .build();

        store = new InMemoryChatStore();
        registry = new ConnectionRegistry();
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), config);
        metricsService.bindConnectionGauge(registry);

        PresenceNotifier presenceNotifier = new PresenceNotifier(store, metricsService, Clock.systemUTC());
        Dispatcher dispatcher = new Dispatcher(store, registry, metricsService);
        drainService = new DrainService(registry, config);
        WebSocketHandler wsHandler = new WebSocketHandler(config, registry, dispatcher, presenceNotifier, metricsService);
        UpgradeGate upgradeGate = new UpgradeGate(store, wsHandler, drainService, metricsService);

        httpServer = new HttpServer(config, upgradeGate, drainService, new PrometheusMetricsExporter("it-node"));
        httpServer.start();

        alice = store.createUser(User.builder().username("alice").build()).map(User::getId).block();
        bob = store.createUser(User.builder().username("bob").build()).map(User::getId).block();
    }

    @AfterEach
    void tearDown() {
        httpServer.stop();
    }

    @Test
    @DisplayName("Should answer 401 to an upgrade for an unknown user")
    void testUnknownUserRejected() {
        assertEquals(401, statusOf("/api/ws?userId=999"));
        assertEquals(401, statusOf("/api/ws?userId=abc"));
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Should report healthy until drain starts, then refuse upgrades")
    void testDrainRefusesUpgrades() {
        assertEquals(200, statusOf("/healthz"));

        Integer drainStatus = HttpClient.create()
            .post()
            .uri(baseUrl() + "/drain")
            .responseSingle((res, body) -> Mono.just(res.status().code()))
            .block(TIMEOUT);
        assertEquals(202, drainStatus);

        assertEquals(503, statusOf("/healthz"));
        assertEquals(503, statusOf("/api/ws?userId=" + alice));
        assertTrue(drainService.isDraining());
    }

    @Test
    @DisplayName("Should welcome a client, answer a bogus frame with an error and ack a message")
    void testSenderRoundTrip() {
        List<JsonNode> frames = HttpClient.create()
            .websocket()
            .uri(wsUrl(alice))
            .handle((in, out) -> Flux.merge(
                in.receive().asString(),
                out.sendString(Flux.just(
                    "{\"type\":\"bogus\"}",
                    "{\"type\":\"message\",\"receiverId\":" + bob + ",\"content\":\"hi\"}"
                )).then().then(Mono.<String>empty())
            ).take(3))
            .map(frame -> JsonUtils.readValue(frame, JsonNode.class))
            .collectList()
            .block(TIMEOUT);

        assertNotNull(frames);
        assertEquals("connected", frames.get(0).get("type").asText());
        assertEquals(alice, frames.get(0).get("data").get("userId").asLong());
        assertEquals("error", frames.get(1).get("type").asText());
        assertEquals("message_sent", frames.get(2).get("type").asText());
        assertEquals(1L, store.getMessagesBetweenUsers(alice, bob).count().block());
    }

    @Test
    @DisplayName("Should deliver a direct message to a connected peer and track presence")
    void testDirectMessageBetweenClients() {
        Instant disconnectedAt;
        Sinks.Many<String> bobFrames = Sinks.many().replay().all();
        Disposable bobClient = HttpClient.create()
            .websocket()
            .uri(wsUrl(bob))
            .handle((in, out) -> in.receive().asString().doOnNext(bobFrames::tryEmitNext))
            .subscribe();

        try {
            StepVerifier.create(bobFrames.asFlux().map(this::typeOf))
                .expectNext("connected")
                .thenCancel()
                .verify(TIMEOUT);
            assertTrue(registry.isOnline(bob));
            awaitPresence(bob, true);

            List<String> aliceTypes = sendAndCollect(alice,
                "{\"type\":\"message\",\"receiverId\":" + bob + ",\"content\":\"hello bob\"}", 2);
            assertEquals(List.of("connected", "message_sent"), aliceTypes);

            StepVerifier.create(bobFrames.asFlux().map(frame -> JsonUtils.readValue(frame, JsonNode.class)))
                .expectNextMatches(frame -> "connected".equals(frame.get("type").asText()))
                .expectNextMatches(frame -> "message".equals(frame.get("type").asText())
                    && "hello bob".equals(frame.get("data").get("content").asText())
                    && frame.get("data").get("senderId").asLong() == alice)
                .thenCancel()
                .verify(TIMEOUT);
        } finally {
            disconnectedAt = Instant.now();
            bobClient.dispose();
        }

        awaitPresence(bob, false);
        User offline = store.getUser(bob).block();
        assertNotNull(offline);
        assertFalse(offline.getLastSeen().isBefore(disconnectedAt), "lastSeen should be the disconnect time");
        assertTrue(offline.getLastSeen().isAfter(offline.getCreatedAt()));
    }

    @Test
    @DisplayName("Should keep a reconnected user online when the superseded socket closes")
    void testReconnectSupersedesOldSocket() {
        AtomicInteger firstCloseCode = new AtomicInteger();
        Sinks.Empty<Void> firstDisposed = Sinks.empty();
        Sinks.Many<String> firstFrames = Sinks.many().replay().all();
        Disposable first = HttpClient.create()
            .websocket()
            .uri(wsUrl(bob))
            .handle((in, out) -> {
                in.withConnection(conn -> conn.onDispose(firstDisposed::tryEmitEmpty));
                in.receiveCloseStatus().subscribe(status -> firstCloseCode.set(status.code()));
                return in.receive().asString().doOnNext(firstFrames::tryEmitNext);
            })
            .subscribe();

        Sinks.Many<String> secondFrames = Sinks.many().replay().all();
        Disposable second = null;
        try {
            awaitConnected(firstFrames);

            second = HttpClient.create()
                .websocket()
                .uri(wsUrl(bob))
                .handle((in, out) -> in.receive().asString().doOnNext(secondFrames::tryEmitNext))
                .subscribe();
            awaitConnected(secondFrames);

            // Wait for the old socket to go away, then let its server-side dispose hook run
            firstDisposed.asMono().block(TIMEOUT);
            Mono.delay(Duration.ofMillis(300)).block();

            assertEquals(CloseCodes.SUPERSEDED, firstCloseCode.get());
            assertTrue(registry.isOnline(bob));
            assertEquals(1, registry.size());
            User user = store.getUser(bob).block();
            assertNotNull(user);
            assertTrue(user.isOnline(), "Stale disconnect must not mark the user offline");

            List<String> aliceTypes = sendAndCollect(alice,
                "{\"type\":\"message\",\"receiverId\":" + bob + ",\"content\":\"still there?\"}", 2);
            assertEquals(List.of("connected", "message_sent"), aliceTypes);
            StepVerifier.create(secondFrames.asFlux().map(this::typeOf))
                .expectNext("connected", "message")
                .thenCancel()
                .verify(TIMEOUT);
        } finally {
            first.dispose();
            if (second != null) {
                second.dispose();
            }
        }
    }

    private void awaitConnected(Sinks.Many<String> frames) {
        StepVerifier.create(frames.asFlux().map(this::typeOf))
            .expectNext("connected")
            .thenCancel()
            .verify(TIMEOUT);
    }

    /**
     * Opens a socket as {@code userId}, sends one frame and returns the types of the first
     * {@code expected} frames received.
     */
    private List<String> sendAndCollect(long userId, String frame, int expected) {
        return HttpClient.create()
            .websocket()
            .uri(wsUrl(userId))
            .handle((in, out) -> Flux.merge(
                in.receive().asString(),
                out.sendString(Mono.just(frame)).then().then(Mono.<String>empty())
            ).take(expected))
            .map(this::typeOf)
            .collectList()
            .block(TIMEOUT);
    }

    private void awaitPresence(long userId, boolean online) {
        User user = Flux.interval(Duration.ofMillis(20))
            .flatMap(tick -> store.getUser(userId))
            .filter(u -> u.isOnline() == online)
            .next()
            .block(TIMEOUT);
        assertNotNull(user);
    }

    private int statusOf(String path) {
        Integer status = HttpClient.create()
            .get()
            .uri(baseUrl() + path)
            .responseSingle((res, body) -> Mono.just(res.status().code()))
            .block(TIMEOUT);
        assertNotNull(status);
        return status;
    }

    private String typeOf(String frame) {
        return JsonUtils.readValue(frame, JsonNode.class).get("type").asText();
    }

    private String baseUrl() {
        return "http://localhost:" + httpServer.port();
    }

    private String wsUrl(long userId) {
        return "ws://localhost:" + httpServer.port() + "/api/ws?userId=" + userId;
    }
}
