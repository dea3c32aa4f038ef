package com.example.gatewaymanager.config;

import com.example.gatewaymanager.gateway.ApiKeyHandshakeInterceptor;
import com.example.gatewaymanager.gateway.GatewayWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket configuration for gateway connections.
 * Every gateway instance connects through a single authenticated endpoint.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final GatewayWebSocketHandler gatewayHandler;
    private final ApiKeyHandshakeInterceptor handshakeInterceptor;
    private final GatewayManagerProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(gatewayHandler, properties.getWebsocket().getPath())
                .addInterceptors(handshakeInterceptor)
                .setAllowedOrigins("*");
    }
}
