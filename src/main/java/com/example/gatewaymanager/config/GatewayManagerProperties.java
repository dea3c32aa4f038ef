package com.example.gatewaymanager.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Central configuration for the gateway manager.
 * Maps to the 'gateway-manager' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "gateway-manager")
public class GatewayManagerProperties {

    private WebSocketEndpointConfig websocket = new WebSocketEndpointConfig();
    private EncryptionConfig encryption = new EncryptionConfig();
    private AdapterDefaultsConfig adapter = new AdapterDefaultsConfig();

    @Data
    public static class WebSocketEndpointConfig {
        private String path = "/api/internal/v1/ws/gateways/connect";
        private int maxConnections = 1000;
        private int heartbeatIntervalSeconds = 20;
        private int heartbeatTimeoutSeconds = 30;
        /** Applied as the servlet container's connection timeout. */
        private int handshakeTimeoutSeconds = 10;
        private int sendTimeLimitSeconds = 10;
        private int sendBufferSizeLimit = 1024 * 1024 + 64 * 1024;
        private int rateLimitPerMinute = 10;
    }

    @Data
    public static class EncryptionConfig {
        /** Base64 encoded 32-byte AES key. */
        private String key;
    }

    @Data
    public static class AdapterDefaultsConfig {
        private String defaultType = "on-premise";
        private int defaultTimeoutSeconds = 30;
        private int healthCheckTimeoutSeconds = 5;
    }
}
