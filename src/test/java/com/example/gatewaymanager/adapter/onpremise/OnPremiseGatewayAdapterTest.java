package com.example.gatewaymanager.adapter.onpremise;

import com.example.gatewaymanager.adapter.AdapterConfig;
import com.example.gatewaymanager.adapter.HealthStatus;
import com.example.gatewaymanager.adapter.PolicyInfo;
import com.example.gatewaymanager.adapter.ProviderDeploymentConfig;
import com.example.gatewaymanager.adapter.ProviderDeploymentResult;
import com.example.gatewaymanager.adapter.ProviderStatus;
import com.example.gatewaymanager.domain.Gateway;
import com.example.gatewaymanager.domain.GatewayCredentials;
import com.example.gatewaymanager.exception.AdapterConfigurationException;
import com.example.gatewaymanager.exception.GatewayOperationException;
import com.example.gatewaymanager.exception.GatewayUnreachableException;
import com.example.gatewaymanager.exception.InvalidCiphertextException;
import com.example.gatewaymanager.exception.ProviderNotFoundException;
import com.example.gatewaymanager.service.GatewayService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OnPremiseGatewayAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private GatewayService gatewayService;
    private OnPremiseGatewayAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        gatewayService = mock(GatewayService.class);
        adapter = new OnPremiseGatewayAdapter(AdapterConfig.of(OnPremiseGatewayAdapter.TYPE), gatewayService,
                new OkHttpClient(), objectMapper, Duration.ofSeconds(5), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void givenGateway(Map<String, Object> adapterConfig) {
        Gateway gateway = Gateway.builder().id("gw-1").name("edge").adapterType("on-premise")
                .adapterConfig(new HashMap<>(adapterConfig)).build();
        when(gatewayService.getGatewayWithCredentials("gw-1")).thenReturn(
                new GatewayService.GatewayWithCredentials(gateway, new GatewayCredentials("admin", "s3cret")));
    }

    private String controlPlaneUrl() {
        String url = server.url("/").toString();
        return url.substring(0, url.length() - 1);
    }

    private static ProviderDeploymentConfig providerConfig() {
        return ProviderDeploymentConfig.builder()
                .handle("openai-main")
                .configuration(Map.of("kind", "LlmProvider", "metadata", Map.of("name", "OpenAI")))
                .build();
    }

    private static MockResponse json(int code, String body) {
        return new MockResponse().setResponseCode(code).setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    void deployPostsConfigurationWithBasicAuth() throws Exception {
        givenGateway(Map.of("controlPlaneUrl", controlPlaneUrl()));
        server.enqueue(json(201, "{\"id\":\"prov-1\",\"status\":\"DEPLOYED\"}"));

        ProviderDeploymentResult result = adapter.deployProvider("gw-1", providerConfig());

        assertEquals("prov-1", result.getDeploymentId());
        assertEquals("DEPLOYED", result.getStatus());
        assertNotNull(result.getDeployedAt());

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/llm-providers", request.getPath());
        assertEquals(Credentials.basic("admin", "s3cret"), request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("LlmProvider", body.get("kind").asText());
    }

    @Test
    void missingControlPlaneUrlFailsBeforeAnyHttpCall() {
        givenGateway(Map.of("timeoutSeconds", 10));

        assertThrows(AdapterConfigurationException.class, () -> adapter.deployProvider("gw-1", providerConfig()));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void decryptFailureIsSurfaced() {
        when(gatewayService.getGatewayWithCredentials("gw-1")).thenThrow(new InvalidCiphertextException());

        assertThrows(InvalidCiphertextException.class, () -> adapter.deployProvider("gw-1", providerConfig()));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void updateOfUnknownProviderIsNotFound() throws Exception {
        givenGateway(Map.of("controlPlaneUrl", controlPlaneUrl()));
        server.enqueue(new MockResponse().setResponseCode(404));

        ProviderNotFoundException e = assertThrows(ProviderNotFoundException.class,
                () -> adapter.updateProvider("gw-1", "prov-9", providerConfig()));

        assertEquals("prov-9", e.getProviderId());
        RecordedRequest request = server.takeRequest();
        assertEquals("PUT", request.getMethod());
        assertEquals("/llm-providers/prov-9", request.getPath());
    }

    @Test
    void otherErrorStatusIsOperationFailure() {
        givenGateway(Map.of("controlPlaneUrl", controlPlaneUrl()));
        server.enqueue(new MockResponse().setResponseCode(500));

        GatewayOperationException e = assertThrows(GatewayOperationException.class,
                () -> adapter.deployProvider("gw-1", providerConfig()));
        assertEquals(500, e.getStatusCode());
    }

    @Test
    void undeployAcceptsNoContent() throws Exception {
        givenGateway(Map.of("controlPlaneUrl", controlPlaneUrl()));
        server.enqueue(new MockResponse().setResponseCode(204));

        adapter.undeployProvider("gw-1", "prov-1");

        RecordedRequest request = server.takeRequest();
        assertEquals("DELETE", request.getMethod());
        assertEquals("/llm-providers/prov-1", request.getPath());
    }

    @Test
    void providerStatusIsMappedFromDetailResponse() {
        givenGateway(Map.of("controlPlaneUrl", controlPlaneUrl()));
        server.enqueue(json(200, """
                {"provider":{"id":"prov-1",
                  "configuration":{"kind":"LlmProvider","metadata":{"name":"OpenAI"},"spec":{"template":"openai"}},
                  "deploymentStatus":"DEPLOYED",
                  "metadata":{"deployedAt":"2026-01-01T00:00:00Z"}}}
                """));

        ProviderStatus status = adapter.getProviderStatus("gw-1", "prov-1");

        assertEquals("prov-1", status.getId());
        assertEquals("OpenAI", status.getName());
        assertEquals("LlmProvider", status.getKind());
        assertEquals("DEPLOYED", status.getStatus());
        assertEquals("2026-01-01T00:00:00Z", status.getDeployedAt());
        assertEquals("openai", status.getSpec().get("template"));
    }

    @Test
    void listsProvidersAndPolicies() {
        givenGateway(Map.of("controlPlaneUrl", controlPlaneUrl()));
        server.enqueue(json(200, """
                {"providers":[{"id":"p1","displayName":"OpenAI","template":"openai","status":"DEPLOYED","createdAt":"2026-01-01T00:00:00Z"},
                              {"id":"p2","displayName":"Claude","template":"anthropic","status":"PENDING"}]}
                """));
        server.enqueue(json(200, """
                {"policies":[{"name":"rate-limit","description":"Limits requests","parameters":{"rpm":60}}]}
                """));

        List<ProviderStatus> providers = adapter.listProviders("gw-1");
        List<PolicyInfo> policies = adapter.getPolicies("gw-1");

        assertEquals(2, providers.size());
        assertEquals("anthropic", providers.get(1).getKind());
        assertNull(providers.get(1).getDeployedAt());
        assertEquals(1, policies.size());
        assertEquals("rate-limit", policies.get(0).getName());
        assertEquals("", policies.get(0).getVersion());
        assertEquals(60, policies.get(0).getParameters().get("rpm"));
    }

    @Test
    void healthReportsActiveAndUnhealthyWithoutThrowing() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        server.enqueue(new MockResponse().setResponseCode(503));

        HealthStatus healthy = adapter.checkHealth(controlPlaneUrl());
        HealthStatus unhealthy = adapter.checkHealth(controlPlaneUrl());

        assertEquals(HealthStatus.State.ACTIVE, healthy.getStatus());
        assertNotNull(healthy.getResponseTime());
        assertEquals(HealthStatus.State.ERROR, unhealthy.getStatus());
        assertTrue(unhealthy.getErrorMessage().contains("503"));
        assertEquals("/health", server.takeRequest().getPath());
        assertNull(server.takeRequest().getHeader("Authorization"));
    }

    @Test
    void healthWithoutControlPlaneUrlIsConfigurationError() {
        assertThrows(AdapterConfigurationException.class, () -> adapter.checkHealth(null));
        assertThrows(AdapterConfigurationException.class, () -> adapter.checkHealth(" "));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void unreachableEndpointThrows() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        String url = stopped.url("/").toString();
        stopped.shutdown();

        assertThrows(GatewayUnreachableException.class, () -> adapter.checkHealth(url));
        assertThrows(GatewayUnreachableException.class, () -> adapter.validateGatewayEndpoint(url));
    }
}
