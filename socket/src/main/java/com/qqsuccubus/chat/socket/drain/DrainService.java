package com.qqsuccubus.chat.socket.drain;

import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.registry.CloseCodes;
import com.qqsuccubus.chat.socket.registry.Connection;
import com.qqsuccubus.chat.socket.registry.IConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Graceful connection draining for shutdown.
 * <p>
 * 1. Drain starts (POST /drain or the shutdown hook)
 * 2. New upgrades are rejected with 503
 * 3. Open connections are closed with 1001 in batches so clients reconnect gradually
 * 4. Drain completes when the registry is empty or the deadline passes
 * </p>
 */
public class DrainService {
    private static final Logger log = LoggerFactory.getLogger(DrainService.class);

    private static final Duration DRAIN_DEADLINE = Duration.ofSeconds(30);

    private final IConnectionRegistry registry;
    private final int batchSize;
    private final Duration batchInterval;
    private final AtomicBoolean isDraining = new AtomicBoolean(false);
    private final AtomicBoolean isDrainComplete = new AtomicBoolean(false);
    private final AtomicInteger remainingConnections = new AtomicInteger(0);
    private final Sinks.Empty<Void> drained = Sinks.empty();

    public DrainService(IConnectionRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.batchSize = Math.max(1, config.getDrainBatchSize());
        this.batchInterval = Duration.ofMillis(Math.max(1, config.getDrainBatchIntervalMs()));
    }

    /**
     * Starts the draining process. Subsequent calls are no-ops.
     *
     * @return Mono completing when drain is started
     */
    public Mono<Void> startDrain() {
        return Mono.fromRunnable(() -> {
            if (!isDraining.compareAndSet(false, true)) {
                return;
            }
            int total = registry.size();
            remainingConnections.set(total);
            log.warn("Drain mode activated - closing {} connections in batches of {} every {} ms",
                total, batchSize, batchInterval.toMillis());

            Flux.interval(Duration.ZERO, batchInterval)
                .map(tick -> drainBatch())
                .takeUntil(remaining -> remaining == 0)
                .take(DRAIN_DEADLINE)
                .doOnComplete(this::completeDrain)
                .doOnError(err -> {
                    log.error("Drain task failed", err);
                    completeDrain();
                })
                .subscribe();
        });
    }

    /**
     * @return Mono completing once the drain has finished
     */
    public Mono<Void> awaitDrained() {
        return drained.asMono();
    }

    int drainBatch() {
        List<Connection> batch = registry.getOnlineUserIds().stream()
            .map(registry::lookup)
            .flatMap(Optional::stream)
            .limit(batchSize)
            .collect(Collectors.toList());

        batch.forEach(connection -> connection.close(CloseCodes.GOING_AWAY, "Server draining"));

        int remaining = registry.size();
        remainingConnections.set(remaining);
        if (!batch.isEmpty()) {
            log.info("Drained batch of {} connections, {} remaining", batch.size(), remaining);
        }
        return remaining;
    }

    private void completeDrain() {
        isDrainComplete.set(true);
        log.info("Drain complete, {} connections remaining", remainingConnections.get());
        drained.tryEmitEmpty();
    }

    public boolean isDraining() {
        return isDraining.get();
    }

    public boolean isDrainComplete() {
        return isDrainComplete.get();
    }

    public int getRemainingConnections() {
        return isDrainComplete.get() ? remainingConnections.get() : registry.size();
    }
}
