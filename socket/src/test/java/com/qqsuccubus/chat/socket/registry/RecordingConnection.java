package com.qqsuccubus.chat.socket.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.chat.core.util.JsonUtils;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Test double around a real {@link Connection}: records outbound frames and close requests
 * instead of writing to a socket.
 */
public class RecordingConnection {

    private final Connection connection;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private final List<Integer> closeCodes = new CopyOnWriteArrayList<>();

    private RecordingConnection(long userId, int bufferSize, Consumer<Connection> onClose, boolean drain) {
        SocketConfig config = SocketConfig.builder().perConnBufferSize(bufferSize).build();
        Connection[] self = new Connection[1];
        this.connection = new ConnectionFactory(config).create(userId, (code, reason) -> {
            closeCodes.add(code);
            onClose.accept(self[0]);
        });
        self[0] = connection;

        if (drain) {
            connection.outboundFrames().subscribe(frames::add);
        } else {
            connection.outboundFrames().subscribe(new BaseSubscriber<String>() {
                @Override
                protected void hookOnSubscribe(Subscription subscription) {
                    // never requests, so the buffer fills up
                }
            });
        }
    }

    public static RecordingConnection open(long userId) {
        return new RecordingConnection(userId, 256, c -> {
        }, true);
    }

    /**
     * Connection that runs {@code onClose} after recording a close request, e.g. to emulate the
     * transport dispose hook.
     */
    public static RecordingConnection open(long userId, Consumer<Connection> onClose) {
        return new RecordingConnection(userId, 256, onClose, true);
    }

    /**
     * Connection whose outbound buffer is never drained.
     */
    public static RecordingConnection stalled(long userId, int bufferSize) {
        return new RecordingConnection(userId, bufferSize, c -> {
        }, false);
    }

    public Connection connection() {
        return connection;
    }

    public long userId() {
        return connection.getUserId();
    }

    public List<JsonNode> frames() {
        return frames.stream()
            .map(frame -> JsonUtils.readValue(frame, JsonNode.class))
            .collect(Collectors.toList());
    }

    public List<JsonNode> framesOfType(String type) {
        return frames().stream()
            .filter(frame -> type.equals(frame.path("type").asText()))
            .collect(Collectors.toList());
    }

    public List<Integer> closeCodes() {
        return closeCodes;
    }
}
