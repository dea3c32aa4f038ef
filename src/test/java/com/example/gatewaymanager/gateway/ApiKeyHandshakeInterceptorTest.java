package com.example.gatewaymanager.gateway;

import com.example.gatewaymanager.domain.Gateway;
import com.example.gatewaymanager.exception.GatewayNotFoundException;
import com.example.gatewaymanager.service.GatewayService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ApiKeyHandshakeInterceptorTest {

    private GatewayService gatewayService;
    private ApiKeyHandshakeInterceptor interceptor;
    private MockHttpServletRequest servletRequest;
    private MockHttpServletResponse servletResponse;
    private final Map<String, Object> attributes = new HashMap<>();

    @BeforeEach
    void setUp() {
        gatewayService = mock(GatewayService.class);
        interceptor = new ApiKeyHandshakeInterceptor(new ConnectionRateLimiter(2), gatewayService, new ObjectMapper());
        servletRequest = new MockHttpServletRequest("GET", "/api/internal/v1/ws/gateways/connect");
        servletRequest.setRemoteAddr("10.1.2.3");
        servletResponse = new MockHttpServletResponse();
    }

    private boolean handshake() throws Exception {
        return interceptor.beforeHandshake(new ServletServerHttpRequest(servletRequest),
                new ServletServerHttpResponse(servletResponse), mock(WebSocketHandler.class), attributes);
    }

    @Test
    void acceptsValidKeyAndStoresGatewayIdentity() throws Exception {
        servletRequest.addHeader("api-key", "good-key");
        when(gatewayService.verifyToken("good-key")).thenReturn(Gateway.builder().id("gw-1").name("edge").build());

        assertTrue(handshake());
        assertEquals("gw-1", attributes.get(ApiKeyHandshakeInterceptor.ATTR_GATEWAY_ID));
        assertEquals("good-key", attributes.get(ApiKeyHandshakeInterceptor.ATTR_API_KEY));
    }

    @Test
    void rejectsMissingKey() throws Exception {
        assertFalse(handshake());
        assertEquals(401, servletResponse.getStatus());
        verifyNoInteractions(gatewayService);
    }

    @Test
    void rejectsUnknownKey() throws Exception {
        servletRequest.addHeader("api-key", "bad-key");
        when(gatewayService.verifyToken("bad-key")).thenThrow(GatewayNotFoundException.forApiKey());

        assertFalse(handshake());
        assertEquals(401, servletResponse.getStatus());
        assertTrue(servletResponse.getContentAsString().contains("Invalid API key"));
        assertTrue(attributes.isEmpty());
    }

    @Test
    void rateLimitsBeforeAuthenticating() throws Exception {
        servletRequest.addHeader("api-key", "bad-key");
        when(gatewayService.verifyToken(anyString())).thenThrow(GatewayNotFoundException.forApiKey());

        handshake();
        handshake();
        servletResponse = new MockHttpServletResponse();

        assertFalse(handshake());
        assertEquals(429, servletResponse.getStatus());
        verify(gatewayService, times(2)).verifyToken(anyString());
    }
}
