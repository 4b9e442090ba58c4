package com.qqsuccubus.chat.socket.ws;

import com.qqsuccubus.chat.core.msg.Envelope;
import com.qqsuccubus.chat.core.util.BytesUtils;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.dispatch.Dispatcher;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.presence.PresenceNotifier;
import com.qqsuccubus.chat.socket.registry.Connection;
import com.qqsuccubus.chat.socket.registry.ConnectionFactory;
import com.qqsuccubus.chat.socket.registry.IConnectionRegistry;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * WebSocket handler for admitted user connections.
 * <p>
 * Protocol (server → client), every frame {@code {"type", "data"}}:
 * <ul>
 *   <li>connected: {message, userId}</li>
 *   <li>message / message_sent: DirectMessage</li>
 *   <li>group_message / group_message_sent: GroupMessage</li>
 *   <li>typing: {senderId}</li>
 *   <li>messages_read: {readerId}</li>
 *   <li>error: {message}</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (client → server), flat frames:
 * <ul>
 *   <li>message: {receiverId, content}</li>
 *   <li>group_message: {groupId, content}</li>
 *   <li>typing: {receiverId}</li>
 *   <li>read_messages: {senderId}</li>
 * </ul>
 * </p>
 */
public class WebSocketHandler {
	private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

	private final SocketConfig config;
	private final IConnectionRegistry registry;
	private final ConnectionFactory connectionFactory;
	private final Dispatcher dispatcher;
	private final PresenceNotifier presenceNotifier;
	private final MetricsService metricsService;

	public WebSocketHandler(
			SocketConfig config,
			IConnectionRegistry registry,
			Dispatcher dispatcher,
			PresenceNotifier presenceNotifier,
			MetricsService metricsService
	) {
		this.config = config;
		this.registry = registry;
		this.connectionFactory = new ConnectionFactory(config);
		this.dispatcher = dispatcher;
		this.presenceNotifier = presenceNotifier;
		this.metricsService = metricsService;
	}

	/**
	 * Handles the lifecycle of one authenticated WebSocket.
	 *
	 * @param inbound  WebSocket inbound
	 * @param outbound WebSocket outbound
	 * @param userId   identity verified by the upgrade gate
	 * @return Publisher completing when the socket is done
	 */
	public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, long userId) {
		Connection connection = connectionFactory.create(userId, (code, reason) ->
				outbound.sendClose(code, reason).subscribe(
						null,
						err -> log.debug("Close frame to user {} not sent: {}", userId, err.getMessage())
				));

		admit(connection);
		handleConnectionStateUpdates(inbound, outbound, connection);
		dispatcher.reply(connection, Envelope.connected(userId));

		return Mono.when(
						outbound.sendString(connection.outboundFrames()
								.doOnNext(frame -> metricsService.recordNetworkOutboundWs(BytesUtils.getBytesLength(frame)))),
						handleInboundMessages(inbound, connection)
				)
				.onErrorResume(err -> {
					log.error("WebSocket error for user {}", userId, err);
					return outbound.sendClose();
				});
	}

	private void admit(Connection connection) {
		long userId = connection.getUserId();
		MDC.put("userId", String.valueOf(userId));
		try {
			registry.add(userId, connection).ifPresent(previous -> metricsService.recordConnectionSuperseded());
			metricsService.recordConnectionAccepted();
			log.info("User {} connected ({})", userId, connection.getConnectionId());
		} finally {
			MDC.remove("userId");
		}

		// Best-effort and not awaited: admission never waits on presence
		presenceNotifier.markOnline(userId).subscribe();
	}

	private void handleConnectionStateUpdates(WebsocketInbound inbound, WebsocketOutbound outbound, Connection connection) {
		long userId = connection.getUserId();

		inbound.withConnection(conn -> {
			long pingIntervalInMillis = config.getPingInterval() * 1000L;
			long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;

			if (pingIntervalInMillis > 0) {
				conn.onWriteIdle(pingIntervalInMillis, () -> conn.outbound().sendObject(
						Mono.just(new PingWebSocketFrame())
				).then().subscribe());
			}
			if (idleTimeoutInMillis > 0) {
				conn.onReadIdle(idleTimeoutInMillis, () -> {
					log.debug("User {} idle for {} ms, closing", userId, idleTimeoutInMillis);
					outbound.sendClose().subscribe();
				});
			}

			conn.onDispose(() -> {
				log.debug("WebSocket connection disposed for user {}, removing connection", userId);
				connection.markClosed();
				if (registry.remove(userId, connection)) {
					log.info("User {} disconnected ({})", userId, connection.getConnectionId());
					presenceNotifier.markOffline(userId).subscribe();
				}
			});
		});
	}

	private Mono<Void> handleInboundMessages(WebsocketInbound inbound, Connection connection) {
		long userId = connection.getUserId();

		return inbound.aggregateFrames()
				.receive()
				.asString()
				.doOnNext(frame -> metricsService.recordNetworkInboundWs(BytesUtils.getBytesLength(frame)))
				.onBackpressureBuffer(config.getPerConnBufferSize())
				// Sequential per connection; frames arriving after close started are not processed
				.concatMap(frame -> connection.isOpen() ? dispatcher.dispatch(connection, frame) : Mono.empty())
				.doOnError(err -> {
					// AbortedException is expected on close
					if (!(err instanceof AbortedException)) {
						log.error("Fatal error in inbound stream for {}", userId, err);
					}
				})
				.onErrorResume(err -> Mono.empty())
				.then();
	}
}
