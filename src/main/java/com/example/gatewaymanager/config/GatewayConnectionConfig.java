package com.example.gatewaymanager.config;

import com.example.gatewaymanager.gateway.ConnectionRateLimiter;
import com.example.gatewaymanager.gateway.GatewayConnectionManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Wires the connection registry and the handshake rate limiter from properties.
 */
@Configuration
public class GatewayConnectionConfig {

    @Bean(destroyMethod = "shutdown")
    public GatewayConnectionManager gatewayConnectionManager(GatewayManagerProperties properties,
                                                             @Qualifier("heartbeatExecutor") ExecutorService heartbeatExecutor) {
        GatewayManagerProperties.WebSocketEndpointConfig ws = properties.getWebsocket();
        return new GatewayConnectionManager(
                ws.getMaxConnections(),
                Duration.ofSeconds(ws.getHeartbeatIntervalSeconds()),
                Duration.ofSeconds(ws.getHeartbeatTimeoutSeconds()),
                heartbeatExecutor);
    }

    @Bean
    public ConnectionRateLimiter connectionRateLimiter(GatewayManagerProperties properties) {
        return new ConnectionRateLimiter(properties.getWebsocket().getRateLimitPerMinute());
    }
}
