package com.qqsuccubus.chat.socket.http;

import com.qqsuccubus.chat.core.util.JsonUtils;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.drain.DrainService;
import com.qqsuccubus.chat.socket.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.chat.socket.ws.UpgradeGate;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.Map;

/**
 * HTTP server for health checks, metrics, drain endpoint, and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SocketConfig config;
    private final UpgradeGate upgradeGate;
    private final DrainService drainService;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Starts the HTTP server and blocks until it is bound.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .route(routes -> routes
                // Health check endpoint - fails if draining
                .get("/healthz", (req, res) -> {
                    if (drainService.isDraining()) {
                        return res.status(503).sendString(Mono.just("Draining"));
                    }
                    return res.status(200).sendString(Mono.just("OK"));
                })
                .get("/readyz", (req, res) -> {
                    if (drainService.isDraining()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Draining"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .post("/drain", (req, res) -> {
                    log.warn("Drain endpoint called - starting graceful connection draining");
                    return drainService.startDrain()
                        .then(res.status(202).sendString(Mono.fromSupplier(() -> String.format(
                            "Drain started - %d connections to drain",
                            drainService.getRemainingConnections()
                        ))).then());
                })
                .get("/drain/status", (req, res) -> res.status(200)
                    .header("Content-Type", "application/json")
                    .sendString(Mono.fromSupplier(() -> JsonUtils.writeValueAsString(Map.of(
                        "draining", drainService.isDraining(),
                        "complete", drainService.isDrainComplete(),
                        "remaining", drainService.getRemainingConnections()
                    )))))
                .get("/metrics", (req, res) -> res
                    .header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.fromSupplier(metricsExporter::scrape)))
                .get(config.getWsPath(), upgradeGate::handle)
            )
            .bindNow(Duration.ofSeconds(45));

        log.info("HTTP server started on port {}", server.port());
        return server;
    }

    public int port() {
        return server.port();
    }

    public void stop() {
        server.disposeNow(Duration.ofSeconds(30));
    }
}
