package com.qqsuccubus.chat.socket.presence;

import com.qqsuccubus.chat.core.model.UserPatch;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.store.IChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Writes online/offline/last-seen transitions tied to the connection lifecycle.
 * <p>
 * Presence is not safety-critical: every method returns a Mono that completes normally even when
 * the durable write fails, so admission and teardown never depend on it. No broadcast is sent;
 * peers read presence through the CRUD layer.
 * </p>
 */
public class PresenceNotifier {
    private static final Logger log = LoggerFactory.getLogger(PresenceNotifier.class);

    private final IChatStore store;
    private final MetricsService metricsService;
    private final Clock clock;

    public PresenceNotifier(IChatStore store, MetricsService metricsService, Clock clock) {
        this.store = store;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Sets {@code isOnline=true}.
     *
     * @param userId admitted user
     * @return Mono completing when written or skipped
     */
    public Mono<Void> markOnline(long userId) {
        return update(userId, UserPatch.online(), "online");
    }

    /**
     * Sets {@code isOnline=false} and {@code lastSeen=now}.
     *
     * @param userId disconnected user
     * @return Mono completing when written or skipped
     */
    public Mono<Void> markOffline(long userId) {
        return update(userId, UserPatch.offline(clock.instant()), "offline");
    }

    private Mono<Void> update(long userId, UserPatch patch, String transition) {
        long start = System.nanoTime();
        return Mono.defer(() -> store.updateUser(userId, patch))
            .doOnNext(user -> log.debug("User {} is now {}", userId, transition))
            .switchIfEmpty(Mono.fromRunnable(() ->
                log.warn("Presence {} skipped: user {} no longer exists", transition, userId)))
            .doFinally(signal -> metricsService.recordStoreLatency("updateUser", start))
            .then()
            .onErrorResume(err -> {
                metricsService.recordPresenceFailure();
                log.warn("Failed to mark user {} {}: {}", userId, transition, err.getMessage());
                return Mono.empty();
            });
    }
}
