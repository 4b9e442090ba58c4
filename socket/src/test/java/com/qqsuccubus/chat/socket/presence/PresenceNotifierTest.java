package com.qqsuccubus.chat.socket.presence;

import com.qqsuccubus.chat.core.error.PersistenceException;
import com.qqsuccubus.chat.core.metrics.MetricsNames;
import com.qqsuccubus.chat.core.model.User;
import com.qqsuccubus.chat.core.model.UserPatch;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.store.InMemoryChatStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class PresenceNotifierTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private SimpleMeterRegistry meterRegistry;
    private MetricsService metricsService;
    private Clock clock;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new MetricsService(meterRegistry, SocketConfig.builder().nodeId("test-node").build());
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("Should mark a user online")
    void testMarkOnline() {
        InMemoryChatStore store = new InMemoryChatStore(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
        long userId = createUser(store, "alice");
        PresenceNotifier notifier = new PresenceNotifier(store, metricsService, clock);

        StepVerifier.create(notifier.markOnline(userId)).verifyComplete();

        User user = store.getUser(userId).block();
        assertNotNull(user);
        assertTrue(user.isOnline());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), user.getLastSeen(), "Going online keeps lastSeen");
    }

    @Test
    @DisplayName("Should mark a user offline with lastSeen from the clock")
    void testMarkOffline() {
        InMemoryChatStore store = new InMemoryChatStore();
        long userId = createUser(store, "bob");
        PresenceNotifier notifier = new PresenceNotifier(store, metricsService, clock);
        notifier.markOnline(userId).block();

        StepVerifier.create(notifier.markOffline(userId)).verifyComplete();

        User user = store.getUser(userId).block();
        assertNotNull(user);
        assertFalse(user.isOnline());
        assertEquals(NOW, user.getLastSeen());
    }

    @Test
    @DisplayName("Should complete normally and count the failure when the store errors")
    void testStoreFailureSwallowed() {
        InMemoryChatStore store = new InMemoryChatStore() {
            @Override
            public Mono<User> updateUser(long userId, UserPatch patch) {
                return Mono.error(new PersistenceException("connection refused"));
            }
        };
        PresenceNotifier notifier = new PresenceNotifier(store, metricsService, clock);

        StepVerifier.create(notifier.markOnline(1)).verifyComplete();
        StepVerifier.create(notifier.markOffline(1)).verifyComplete();

        assertEquals(2.0, meterRegistry.get(MetricsNames.PRESENCE_FAILURES_TOTAL).counter().count());
    }

    @Test
    @DisplayName("Should complete for a user that no longer exists")
    void testUnknownUser() {
        PresenceNotifier notifier = new PresenceNotifier(new InMemoryChatStore(), metricsService, clock);

        StepVerifier.create(notifier.markOffline(404)).verifyComplete();

        assertEquals(0.0, meterRegistry.get(MetricsNames.PRESENCE_FAILURES_TOTAL).counter().count());
    }

    private static long createUser(InMemoryChatStore store, String username) {
        return store.createUser(User.builder().username(username).build()).map(User::getId).block();
    }
}
