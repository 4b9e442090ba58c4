package com.qqsuccubus.chat.socket.ws;

import com.qqsuccubus.chat.core.error.PersistenceException;
import com.qqsuccubus.chat.core.error.UnauthorizedException;
import com.qqsuccubus.chat.core.model.User;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.dispatch.Dispatcher;
import com.qqsuccubus.chat.socket.drain.DrainService;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.presence.PresenceNotifier;
import com.qqsuccubus.chat.socket.registry.ConnectionRegistry;
import com.qqsuccubus.chat.socket.store.IChatStore;
import com.qqsuccubus.chat.socket.store.InMemoryChatStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class UpgradeGateTest {

    private InMemoryChatStore store;
    private long alice;

    @BeforeEach
    void setUp() {
        store = new InMemoryChatStore();
        alice = store.createUser(User.builder().username("alice").build()).map(User::getId).block();
    }

    @Test
    @DisplayName("Should accept a known user")
    void testAuthenticateKnownUser() {
        StepVerifier.create(gate(store).authenticate("/api/ws?userId=" + alice))
            .expectNext(alice)
            .verifyComplete();
    }

    @Test
    @DisplayName("Should reject an unknown user")
    void testAuthenticateUnknownUser() {
        StepVerifier.create(gate(store).authenticate("/api/ws?userId=999"))
            .expectErrorSatisfies(err -> {
                assertInstanceOf(UnauthorizedException.class, err);
                assertEquals("Unknown user 999", err.getMessage());
            })
            .verify();
    }

    @Test
    @DisplayName("Should reject missing and malformed identities without touching the store")
    void testAuthenticateMalformed() {
        UpgradeGate gate = gate(new InMemoryChatStore() {
            @Override
            public Mono<User> getUser(long userId) {
                return Mono.error(new AssertionError("store must not be called"));
            }
        });

        for (String uri : new String[]{"/api/ws", "/api/ws?userId=", "/api/ws?userId=abc",
            "/api/ws?userId=0", "/api/ws?userId=-5", "/api/ws?userId=1.5", "/api/ws?user=1"}) {
            StepVerifier.create(gate.authenticate(uri))
                .expectError(UnauthorizedException.class)
                .verify();
        }
    }

    @Test
    @DisplayName("Should refuse admission when the user lookup fails")
    void testAuthenticateStoreFailure() {
        UpgradeGate gate = gate(new InMemoryChatStore() {
            @Override
            public Mono<User> getUser(long userId) {
                return Mono.error(new PersistenceException("timeout"));
            }
        });

        StepVerifier.create(gate.authenticate("/api/ws?userId=" + alice))
            .expectErrorSatisfies(err -> {
                assertInstanceOf(UnauthorizedException.class, err);
                assertInstanceOf(PersistenceException.class, err.getCause());
            })
            .verify();
    }

    @Test
    @DisplayName("Should parse positive numeric identities only")
    void testParseIdentity() {
        assertEquals(42L, UpgradeGate.parseIdentity("42"));
        assertEquals(42L, UpgradeGate.parseIdentity(" 42 "));
        assertThrows(UnauthorizedException.class, () -> UpgradeGate.parseIdentity(null));
        assertThrows(UnauthorizedException.class, () -> UpgradeGate.parseIdentity("  "));
        assertThrows(UnauthorizedException.class, () -> UpgradeGate.parseIdentity("99999999999999999999"));
        assertThrows(UnauthorizedException.class, () -> UpgradeGate.parseIdentity("0"));
    }

    private static UpgradeGate gate(IChatStore chatStore) {
        SocketConfig config = SocketConfig.builder().nodeId("test-node").perConnBufferSize(16).build();
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), config);
        ConnectionRegistry registry = new ConnectionRegistry();
        WebSocketHandler wsHandler = new WebSocketHandler(
            config,
            registry,
            new Dispatcher(chatStore, registry, metricsService),
            new PresenceNotifier(chatStore, metricsService, Clock.systemUTC()),
            metricsService
        );
        return new UpgradeGate(chatStore, wsHandler, new DrainService(registry, config), metricsService);
    }
}
