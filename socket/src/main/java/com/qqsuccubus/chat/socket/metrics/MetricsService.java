package com.qqsuccubus.chat.socket.metrics;

import com.qqsuccubus.chat.core.metrics.MetricsNames;
import com.qqsuccubus.chat.core.metrics.MetricsTags;
import com.qqsuccubus.chat.core.msg.EnvelopeType;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.registry.IConnectionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics service for the chat socket node.
 */
public class MetricsService {

    public static final String REASON_UNAUTHORIZED = "unauthorized";
    public static final String REASON_DRAINING = "draining";
    public static final String REASON_BUFFER_FULL = "buffer_full";
    public static final String REASON_CLOSED = "closed";
    public static final String REASON_VALIDATION = "validation";
    public static final String REASON_PERSISTENCE = "persistence";

    private final MeterRegistry registry;
    private final String nodeId;

    private final Counter connectionsAccepted;
    private final Counter connectionsSuperseded;
    private final Counter presenceFailures;

    private final Map<EnvelopeType, Counter> delivered = new EnumMap<>(EnvelopeType.class);
    private final Map<EnvelopeType, Counter> deliveryMisses = new EnumMap<>(EnvelopeType.class);
    private final Map<String, Counter> tagged = new ConcurrentHashMap<>();
    private final Map<String, Timer> storeLatency = new ConcurrentHashMap<>();

    // Network traffic counters (bytes)
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;
    private final DistributionSummary messageSizeInbound;
    private final DistributionSummary messageSizeOutbound;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        connectionsAccepted = Counter.builder(MetricsNames.CONNECTIONS_ACCEPTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("WebSocket upgrades admitted into the registry")
            .register(registry);

        connectionsSuperseded = Counter.builder(MetricsNames.CONNECTIONS_SUPERSEDED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections closed because the same user connected again")
            .register(registry);

        presenceFailures = Counter.builder(MetricsNames.PRESENCE_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Presence writes that failed and were skipped")
            .register(registry);

        for (EnvelopeType type : EnvelopeType.values()) {
            if (!type.isOutbound()) {
                continue;
            }
            delivered.put(type, Counter.builder(MetricsNames.DELIVERED_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.TYPE, type.wireName())
                .description("Envelopes handed to a live connection")
                .register(registry));
            deliveryMisses.put(type, Counter.builder(MetricsNames.DELIVERY_MISS_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.TYPE, type.wireName())
                .description("Fan-out targets that were not connected")
                .register(registry));
        }

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        messageSizeInbound = DistributionSummary.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES + ".size")
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Inbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);

        messageSizeOutbound = DistributionSummary.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES + ".size")
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Outbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);
    }

    /**
     * Registers the live-connection gauge against the registry it should observe.
     *
     * @param connectionRegistry registry to sample
     */
    public void bindConnectionGauge(IConnectionRegistry connectionRegistry) {
        Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, connectionRegistry, IConnectionRegistry::size)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Live connections in the registry")
            .strongReference(true)
            .register(registry);
    }

    public void recordConnectionAccepted() {
        connectionsAccepted.increment();
    }

    public void recordConnectionRejected(String reason) {
        taggedCounter(MetricsNames.CONNECTIONS_REJECTED_TOTAL, reason).increment();
    }

    public void recordConnectionSuperseded() {
        connectionsSuperseded.increment();
    }

    public void recordDelivered(EnvelopeType type) {
        delivered.get(type).increment();
    }

    public void recordDeliveryMiss(EnvelopeType type) {
        deliveryMisses.get(type).increment();
    }

    public void recordDrop(String reason) {
        taggedCounter(MetricsNames.DROPS_TOTAL, reason).increment();
    }

    public void recordFrameRejected(String reason) {
        taggedCounter(MetricsNames.FRAMES_REJECTED_TOTAL, reason).increment();
    }

    public void recordPresenceFailure() {
        presenceFailures.increment();
    }

    /**
     * Records storage collaborator latency.
     *
     * @param operation  collaborator operation name
     * @param startNanos start nanos
     */
    public void recordStoreLatency(String operation, long startNanos) {
        storeLatency.computeIfAbsent(operation, op -> Timer.builder(MetricsNames.STORE_LATENCY)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.OPERATION, op)
                .description("Storage collaborator call latency")
                .publishPercentileHistogram()
                .serviceLevelObjectives(
                    Duration.ofMillis(5),
                    Duration.ofMillis(20),
                    Duration.ofMillis(50),
                    Duration.ofMillis(100),
                    Duration.ofMillis(500)
                )
                .register(registry))
            .record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Records bytes received from WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
        messageSizeInbound.record(bytes);
    }

    /**
     * Records bytes sent to WebSocket client.
     *
     * @param bytes number of bytes sent
     */
    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
        messageSizeOutbound.record(bytes);
    }

    private Counter taggedCounter(String name, String reason) {
        return tagged.computeIfAbsent(name + "|" + reason, key -> Counter.builder(name)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry));
    }
}
