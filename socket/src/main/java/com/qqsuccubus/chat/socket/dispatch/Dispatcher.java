package com.qqsuccubus.chat.socket.dispatch;

import com.qqsuccubus.chat.core.error.EnvelopeValidationException;
import com.qqsuccubus.chat.core.error.PersistenceException;
import com.qqsuccubus.chat.core.model.DirectMessageDraft;
import com.qqsuccubus.chat.core.model.GroupMessageDraft;
import com.qqsuccubus.chat.core.model.User;
import com.qqsuccubus.chat.core.msg.Envelope;
import com.qqsuccubus.chat.core.msg.EnvelopeCodec;
import com.qqsuccubus.chat.core.msg.EnvelopeType;
import com.qqsuccubus.chat.core.msg.InboundFrame;
import com.qqsuccubus.chat.core.msg.InboundFrames;
import com.qqsuccubus.chat.core.util.BytesUtils;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.registry.CloseCodes;
import com.qqsuccubus.chat.socket.registry.Connection;
import com.qqsuccubus.chat.socket.registry.IConnectionRegistry;
import com.qqsuccubus.chat.socket.store.IChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Routes decoded inbound frames: persist through the storage collaborator first, then fan out to
 * whichever recipients are connected at that moment.
 * <p>
 * Routing rules:
 * <ul>
 *   <li>message: persist, deliver {@code message} to the receiver, ack {@code message_sent} to the sender</li>
 *   <li>group_message: persist, re-read members, deliver {@code group_message} to every other member,
 *   ack {@code group_message_sent}</li>
 *   <li>typing: deliver {@code typing} to the receiver, nothing persisted, no ack</li>
 *   <li>read_messages: mark read, deliver {@code messages_read} to the original sender</li>
 * </ul>
 * </p>
 * <p>
 * A frame that fails validation or persistence is answered with one {@code error} envelope and the
 * connection stays open. Fan-out happens only after the record exists, and a failed delivery never
 * undoes the write. Offline recipients are skipped; nothing is queued for them.
 * </p>
 */
public class Dispatcher {
	private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

	static final String PROCESSING_FAILED = "Failed to process message";

	private final IChatStore store;
	private final IConnectionRegistry registry;
	private final MetricsService metricsService;

	public Dispatcher(IChatStore store, IConnectionRegistry registry, MetricsService metricsService) {
		this.store = store;
		this.registry = registry;
		this.metricsService = metricsService;
	}

	/**
	 * Handles one raw text frame from {@code sender}. Never signals an error.
	 *
	 * @param sender connection the frame arrived on
	 * @param raw    frame text
	 * @return Mono completing when persistence and fan-out are done
	 */
	public Mono<Void> dispatch(Connection sender, String raw) {
		return Mono.defer(() -> {
					InboundFrame frame = EnvelopeCodec.decode(raw);
					log.debug("Processing {} frame from {} ({} bytes)",
							frame.getType().wireName(), sender.getUserId(), BytesUtils.getBytesLength(raw));
					return route(sender, frame);
				})
				.onErrorResume(err -> {
					reject(sender, err);
					return Mono.empty();
				});
	}

	/**
	 * Sends an envelope straight to one connection (acks, errors, the welcome frame).
	 *
	 * @param connection target
	 * @param envelope   envelope to send
	 * @return {@code true} if queued
	 */
	public boolean reply(Connection connection, Envelope envelope) {
		return send(connection, envelope.getType(), EnvelopeCodec.encode(envelope));
	}

	/**
	 * Delivers to a user if they are connected. A miss is a normal outcome, not an error.
	 *
	 * @param userId   recipient
	 * @param envelope envelope to send
	 * @return {@code true} if queued on a live connection
	 */
	public boolean deliver(long userId, Envelope envelope) {
		Optional<Connection> target = registry.lookup(userId);
		if (target.isEmpty()) {
			metricsService.recordDeliveryMiss(envelope.getType());
			log.debug("User {} is offline, skipping {}", userId, envelope.getType().wireName());
			return false;
		}
		return send(target.get(), envelope.getType(), EnvelopeCodec.encode(envelope));
	}

	/**
	 * Delivers one envelope to many users, serialised once.
	 *
	 * @param userIds  recipients, duplicates ignored by the caller
	 * @param envelope envelope to send
	 * @return number of live connections the envelope was queued on
	 */
	public int fanOut(Collection<Long> userIds, Envelope envelope) {
		String frame = EnvelopeCodec.encode(envelope);
		int delivered = 0;
		for (Long userId : userIds) {
			Optional<Connection> target = registry.lookup(userId);
			if (target.isEmpty()) {
				metricsService.recordDeliveryMiss(envelope.getType());
				continue;
			}
			if (send(target.get(), envelope.getType(), frame)) {
				delivered++;
			}
		}
		log.debug("Fan-out of {} reached {}/{} recipients", envelope.getType().wireName(), delivered, userIds.size());
		return delivered;
	}

	private Mono<Void> route(Connection sender, InboundFrame frame) {
		if (frame instanceof InboundFrames.DirectMessage message) {
			return onDirectMessage(sender, message);
		}
		if (frame instanceof InboundFrames.GroupMessage message) {
			return onGroupMessage(sender, message);
		}
		if (frame instanceof InboundFrames.Typing typing) {
			return onTyping(sender, typing);
		}
		if (frame instanceof InboundFrames.ReadMessages read) {
			return onReadMessages(sender, read);
		}
		return Mono.error(new EnvelopeValidationException(
				"Unsupported message type '" + frame.getType().wireName() + "'"));
	}

	private Mono<Void> onDirectMessage(Connection sender, InboundFrames.DirectMessage frame) {
		DirectMessageDraft draft = new DirectMessageDraft(sender.getUserId(), frame.getReceiverId(), frame.getContent());

		return timed("createMessage", () -> store.createMessage(draft))
				.switchIfEmpty(Mono.error(() -> new PersistenceException("Store returned no message record")))
				.doOnNext(saved -> {
					deliver(saved.getReceiverId(), Envelope.message(saved));
					reply(sender, Envelope.messageSent(saved));
				})
				.then();
	}

	private Mono<Void> onGroupMessage(Connection sender, InboundFrames.GroupMessage frame) {
		long senderId = sender.getUserId();
		GroupMessageDraft draft = new GroupMessageDraft(frame.getGroupId(), senderId, frame.getContent());

		return timed("createGroupMessage", () -> store.createGroupMessage(draft))
				.switchIfEmpty(Mono.error(() -> new PersistenceException("Store returned no group message record")))
				.flatMap(saved -> timed("getGroupMembers", () -> store.getGroupMembers(saved.getGroupId())
						.map(User::getId)
						.filter(memberId -> memberId != senderId)
						.distinct()
						.collectList())
						.doOnNext(recipients -> {
							fanOut(recipients, Envelope.groupMessage(saved));
							reply(sender, Envelope.groupMessageSent(saved));
						}))
				.then();
	}

	private Mono<Void> onTyping(Connection sender, InboundFrames.Typing frame) {
		return Mono.fromRunnable(() -> deliver(frame.getReceiverId(), Envelope.typing(sender.getUserId())));
	}

	private Mono<Void> onReadMessages(Connection sender, InboundFrames.ReadMessages frame) {
		long readerId = sender.getUserId();

		return timed("markMessagesAsRead", () -> store.markMessagesAsRead(readerId, frame.getSenderId()))
				.then(Mono.fromRunnable(() -> deliver(frame.getSenderId(), Envelope.messagesRead(readerId))));
	}

	private void reject(Connection sender, Throwable err) {
		if (err instanceof EnvelopeValidationException) {
			metricsService.recordFrameRejected(MetricsService.REASON_VALIDATION);
			log.warn("Rejected frame from {}: {}", sender.getUserId(), err.getMessage());
			reply(sender, Envelope.error(err.getMessage()));
			return;
		}
		metricsService.recordFrameRejected(MetricsService.REASON_PERSISTENCE);
		log.error("Failed to process frame from {}", sender.getUserId(), err);
		reply(sender, Envelope.error(PROCESSING_FAILED));
	}

	private boolean send(Connection connection, EnvelopeType type, String frame) {
		Sinks.EmitResult result = connection.send(frame);
		if (result.isSuccess()) {
			metricsService.recordDelivered(type);
			return true;
		}

		if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
			metricsService.recordDrop(MetricsService.REASON_BUFFER_FULL);
			log.warn("Outbound buffer full for user {}, closing connection {}",
					connection.getUserId(), connection.getConnectionId());
			connection.close(CloseCodes.SLOW_CONSUMER, "Outbound buffer full");
		} else {
			metricsService.recordDrop(MetricsService.REASON_CLOSED);
			log.debug("Send of {} to user {} failed: {}", type.wireName(), connection.getUserId(), result);
			connection.close(CloseCodes.INTERNAL_ERROR, "Outbound channel unavailable");
		}
		return false;
	}

	private <T> Mono<T> timed(String operation, Supplier<Mono<T>> call) {
		return Mono.defer(() -> {
			long start = System.nanoTime();
			return call.get().doFinally(signal -> metricsService.recordStoreLatency(operation, start));
		});
	}
}
