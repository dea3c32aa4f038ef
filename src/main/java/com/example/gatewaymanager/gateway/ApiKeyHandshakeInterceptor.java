package com.example.gatewaymanager.gateway;

import com.example.gatewaymanager.domain.Gateway;
import com.example.gatewaymanager.exception.GatewayNotFoundException;
import com.example.gatewaymanager.service.GatewayService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Map;

/**
 * Gates the WebSocket upgrade: rate-limits attempts per source address, then
 * exchanges the {@code api-key} header for the gateway's identity. On success
 * the gateway ID and key are stored as session attributes for the handler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyHandshakeInterceptor implements HandshakeInterceptor {

    public static final String API_KEY_HEADER = "api-key";
    public static final String ATTR_GATEWAY_ID = "gatewayId";
    public static final String ATTR_API_KEY = "apiKey";

    private final ConnectionRateLimiter rateLimiter;
    private final GatewayService gatewayService;
    private final ObjectMapper objectMapper;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) throws IOException {
        String clientAddress = clientAddress(request);

        if (!rateLimiter.tryAcquire(clientAddress)) {
            log.warn("Rate limit exceeded: address={}", clientAddress);
            reject(response, HttpStatus.TOO_MANY_REQUESTS, "Connection rate limit exceeded. Please try again later.");
            return false;
        }

        String apiKey = request.getHeaders().getFirst(API_KEY_HEADER);
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("WebSocket connection attempt without API key: address={}", clientAddress);
            reject(response, HttpStatus.UNAUTHORIZED, "API key is required. Provide 'api-key' header.");
            return false;
        }

        Gateway gateway;
        try {
            gateway = gatewayService.verifyToken(apiKey);
        } catch (GatewayNotFoundException e) {
            log.warn("WebSocket authentication failed: address={}", clientAddress);
            reject(response, HttpStatus.UNAUTHORIZED, "Invalid API key");
            return false;
        } catch (RuntimeException e) {
            log.warn("WebSocket authentication failed: address={}, error={}", clientAddress, e.getMessage());
            reject(response, HttpStatus.UNAUTHORIZED, "Authentication failed");
            return false;
        }

        attributes.put(ATTR_GATEWAY_ID, gateway.getId());
        attributes.put(ATTR_API_KEY, apiKey);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.error("WebSocket upgrade failed: address={}, error={}", clientAddress(request), exception.getMessage());
        }
    }

    private void reject(ServerHttpResponse response, HttpStatus status, String message) throws IOException {
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        response.getBody().write(objectMapper.writeValueAsBytes(Map.of("error", status.getReasonPhrase(), "message", message)));
    }

    private static String clientAddress(ServerHttpRequest request) {
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null) {
            return "unknown";
        }
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }
}
