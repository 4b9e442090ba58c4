package com.qqsuccubus.chat.socket.drain;

import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.registry.CloseCodes;
import com.qqsuccubus.chat.socket.registry.ConnectionRegistry;
import com.qqsuccubus.chat.socket.registry.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DrainServiceTest {

    private ConnectionRegistry registry;
    private DrainService drainService;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        SocketConfig config = SocketConfig.builder()
            .drainBatchSize(2)
            .drainBatchIntervalMs(10)
            .build();
        drainService = new DrainService(registry, config);
    }

    @Test
    @DisplayName("Should close every connection in batches and then complete")
    void testDrainClosesAllConnections() {
        List<RecordingConnection> connections = new ArrayList<>();
        for (long userId = 1; userId <= 5; userId++) {
            long id = userId;
            // Emulates the transport dispose hook removing the entry
            RecordingConnection connection = RecordingConnection.open(id, c -> registry.remove(id, c));
            registry.add(id, connection.connection());
            connections.add(connection);
        }

        StepVerifier.create(drainService.startDrain().then(drainService.awaitDrained()))
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertTrue(drainService.isDraining());
        assertTrue(drainService.isDrainComplete());
        assertEquals(0, drainService.getRemainingConnections());
        assertEquals(0, registry.size());
        connections.forEach(c -> assertEquals(List.of(CloseCodes.GOING_AWAY), c.closeCodes()));
    }

    @Test
    @DisplayName("Should close at most one batch per tick")
    void testDrainBatchSize() {
        for (long userId = 1; userId <= 5; userId++) {
            registry.add(userId, RecordingConnection.open(userId).connection());
        }

        drainService.drainBatch();

        long open = registry.getOnlineUserIds().stream().filter(registry::isOnline).count();
        assertEquals(3, open);
    }

    @Test
    @DisplayName("Should complete immediately with no connections and ignore repeated starts")
    void testDrainEmptyRegistry() {
        StepVerifier.create(drainService.startDrain()
                .then(drainService.startDrain())
                .then(drainService.awaitDrained()))
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertTrue(drainService.isDrainComplete());
    }
}
