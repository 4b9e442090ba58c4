package com.qqsuccubus.chat.socket;

import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.dispatch.Dispatcher;
import com.qqsuccubus.chat.socket.drain.DrainService;
import com.qqsuccubus.chat.socket.http.HttpServer;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.chat.socket.presence.PresenceNotifier;
import com.qqsuccubus.chat.socket.registry.ConnectionRegistry;
import com.qqsuccubus.chat.socket.store.IChatStore;
import com.qqsuccubus.chat.socket.store.InMemoryChatStore;
import com.qqsuccubus.chat.socket.store.RedisChatStore;
import com.qqsuccubus.chat.socket.ws.UpgradeGate;
import com.qqsuccubus.chat.socket.ws.WebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for the chat socket node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at /api/ws (query: userId)</li>
 *   <li>Keep the single-process connection registry</li>
 *   <li>Persist and fan out direct messages, group messages, typing and read receipts</li>
 *   <li>Write presence on connect/disconnect</li>
 *   <li>Drain connections gracefully on shutdown</li>
 *   <li>Expose /healthz, /readyz, /drain and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class ChatSocketApp {
    private static final Logger log = LoggerFactory.getLogger(ChatSocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting chat socket node: {}", config.getNodeId());
        log.info("  Store: {}", config.getStoreType());
        log.info("  WebSocket path: {}", config.getWsPath());

        // Setup metrics registry with Prometheus support
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        // Initialize services
        IChatStore store = createStore(config);
        ConnectionRegistry registry = new ConnectionRegistry();
        metricsService.bindConnectionGauge(registry);

        PresenceNotifier presenceNotifier = new PresenceNotifier(store, metricsService, Clock.systemUTC());
        Dispatcher dispatcher = new Dispatcher(store, registry, metricsService);
        DrainService drainService = new DrainService(registry, config);
        WebSocketHandler wsHandler = new WebSocketHandler(config, registry, dispatcher, presenceNotifier, metricsService);
        UpgradeGate upgradeGate = new UpgradeGate(store, wsHandler, drainService, metricsService);

        // Start HTTP + WebSocket server
        HttpServer httpServer = new HttpServer(config, upgradeGate, drainService, metricsExporter);
        httpServer.start();

        log.info("Chat socket node {} is ready", config.getNodeId());

        handleShutdown(config, drainService, httpServer, store);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    static IChatStore createStore(SocketConfig config) {
        return switch (config.getStoreType()) {
            case REDIS -> new RedisChatStore(config);
            case MEMORY -> new InMemoryChatStore();
        };
    }

    private static void handleShutdown(SocketConfig config,
                                       DrainService drainService,
                                       HttpServer httpServer,
                                       IChatStore store) {
        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            // Stop admitting and close live connections
            drainService.startDrain()
                .then(drainService.awaitDrained())
                .block(Duration.ofSeconds(35));

            // Stop WS server
            httpServer.stop();

            store.close();

            log.info("Shutdown complete");
        }));
    }
}
