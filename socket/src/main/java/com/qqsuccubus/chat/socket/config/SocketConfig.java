package com.qqsuccubus.chat.socket.config;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Configuration for the chat socket node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    public enum StoreType {
        MEMORY,
        REDIS
    }

    String nodeId;
    int httpPort;
    String wsPath;
    StoreType storeType;
    String redisUrl;
    int perConnBufferSize;
    int pingInterval;      // seconds of write-idleness before a ping
    int idleTimeout;       // seconds of read-idleness before close
    int drainBatchSize;
    long drainBatchIntervalMs;

    public static SocketConfig fromEnv() {
        return SocketConfig.builder()
                .nodeId(getEnv("NODE_ID", "chat-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .wsPath(getEnv("WS_PATH", "/api/ws"))
                .storeType(parseStoreType(getEnv("STORE", "memory")))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "10")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "60")))
                .drainBatchSize(Integer.parseInt(getEnv("DRAIN_BATCH_SIZE", "100")))
                .drainBatchIntervalMs(Long.parseLong(getEnv("DRAIN_BATCH_INTERVAL_MS", "200")))
                .build();
    }

    static StoreType parseStoreType(String value) {
        return StoreType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
