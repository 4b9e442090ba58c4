package com.qqsuccubus.chat.socket.ws;

import com.qqsuccubus.chat.core.error.UnauthorizedException;
import com.qqsuccubus.chat.core.model.User;
import com.qqsuccubus.chat.socket.drain.DrainService;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.store.IChatStore;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Collection;
import java.util.stream.Stream;

/**
 * Authenticates WebSocket upgrade requests before any socket exists.
 * <p>
 * The claimed identity comes from the {@code userId} query parameter. It must parse as a positive
 * id and resolve to an existing user through one collaborator lookup; otherwise the request is
 * answered with 401 and never upgraded.
 * </p>
 */
public class UpgradeGate {
    private static final Logger log = LoggerFactory.getLogger(UpgradeGate.class);

    static final String USER_ID_PARAM = "userId";

    private final IChatStore store;
    private final WebSocketHandler wsHandler;
    private final DrainService drainService;
    private final MetricsService metricsService;

    public UpgradeGate(
            IChatStore store,
            WebSocketHandler wsHandler,
            DrainService drainService,
            MetricsService metricsService
    ) {
        this.store = store;
        this.wsHandler = wsHandler;
        this.drainService = drainService;
        this.metricsService = metricsService;
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        // Reject new connections if node is draining
        if (drainService.isDraining()) {
            log.warn("Rejecting new WebSocket connection - node is draining");
            metricsService.recordConnectionRejected(MetricsService.REASON_DRAINING);
            return res.status(HttpResponseStatus.SERVICE_UNAVAILABLE)
                .sendString(Mono.just("Service unavailable - node is draining"))
                .then();
        }

        return authenticate(req.uri())
            .flatMap(userId -> res.sendWebsocket((inbound, outbound) ->
                wsHandler.handle(inbound, outbound, userId)
            ))
            .onErrorResume(UnauthorizedException.class, err -> {
                log.warn("Rejecting WebSocket upgrade from {}: {}", req.remoteAddress(), err.getMessage());
                metricsService.recordConnectionRejected(MetricsService.REASON_UNAUTHORIZED);
                return res.status(HttpResponseStatus.UNAUTHORIZED)
                    .sendString(Mono.just("Unauthorized"))
                    .then();
            });
    }

    /**
     * Verifies the identity claimed by an upgrade request URI.
     *
     * @param uri request URI including query string
     * @return the verified user id, or {@link UnauthorizedException}
     */
    public Mono<Long> authenticate(String uri) {
        return Mono.defer(() -> {
            QueryStringDecoder decoder = new QueryStringDecoder(uri);
            String claimed = Stream.ofNullable(decoder.parameters().get(USER_ID_PARAM))
                .flatMap(Collection::stream).findFirst()
                .orElse(null);
            long userId = parseIdentity(claimed);

            return store.getUser(userId)
                .onErrorMap(err -> !(err instanceof UnauthorizedException), err -> {
                    log.error("User lookup failed during upgrade for {}", userId, err);
                    return new UnauthorizedException("Could not verify user " + userId, err);
                })
                .switchIfEmpty(Mono.error(() -> new UnauthorizedException("Unknown user " + userId)))
                .map(User::getId);
        });
    }

    static long parseIdentity(String claimed) {
        if (claimed == null || claimed.isBlank()) {
            throw new UnauthorizedException("Missing " + USER_ID_PARAM);
        }
        long userId;
        try {
            userId = Long.parseLong(claimed.trim());
        } catch (NumberFormatException e) {
            throw new UnauthorizedException("Malformed " + USER_ID_PARAM + " '" + claimed + "'", e);
        }
        if (userId <= 0) {
            throw new UnauthorizedException("Malformed " + USER_ID_PARAM + " '" + claimed + "'");
        }
        return userId;
    }
}
