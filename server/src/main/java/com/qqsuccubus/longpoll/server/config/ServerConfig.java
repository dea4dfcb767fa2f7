package com.qqsuccubus.longpoll.server.config;

import com.qqsuccubus.longpoll.core.queue.MarkerResetScope;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the event server, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ServerConfig {

    String nodeId;
    int httpPort;

    // Client queue lifecycle
    Duration queueIdleTimeout;   // default idle lifetime of a client descriptor
    Duration queueGcInterval;    // how often expired descriptors are swept
    Duration pollTimeout;        // how long a blocking poll waits for an event

    MarkerResetScope markerResetScope;
    boolean seedDemoRealm;

    public static ServerConfig fromEnv() {
        return ServerConfig.builder()
            .nodeId(getEnv("NODE_ID", "events-node-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "9991")))
            .queueIdleTimeout(Duration.ofSeconds(Long.parseLong(getEnv("QUEUE_IDLE_TIMEOUT_SEC", "600"))))
            .queueGcInterval(Duration.ofSeconds(Long.parseLong(getEnv("QUEUE_GC_INTERVAL_SEC", "60"))))
            .pollTimeout(Duration.ofSeconds(Long.parseLong(getEnv("POLL_TIMEOUT_SEC", "50"))))
            .markerResetScope(MarkerResetScope.valueOf(getEnv("MARKER_RESET_SCOPE", "ALL_KEYS")))
            .seedDemoRealm(Boolean.parseBoolean(getEnv("SEED_DEMO_REALM", "true")))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
