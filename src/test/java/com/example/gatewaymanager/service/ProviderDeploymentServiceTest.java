package com.example.gatewaymanager.service;

import com.example.gatewaymanager.adapter.AdapterConfig;
import com.example.gatewaymanager.adapter.GatewayAdapter;
import com.example.gatewaymanager.adapter.GatewayAdapterFactory;
import com.example.gatewaymanager.adapter.ProviderDeploymentConfig;
import com.example.gatewaymanager.adapter.ProviderDeploymentResult;
import com.example.gatewaymanager.adapter.ProviderStatus;
import com.example.gatewaymanager.adapter.mock.MockGatewayAdapter;
import com.example.gatewaymanager.domain.Gateway;
import com.example.gatewaymanager.event.GatewayConfigEvent;
import com.example.gatewaymanager.event.GatewayEventService;
import com.example.gatewaymanager.exception.AdapterConfigurationException;
import com.example.gatewaymanager.exception.GatewayOperationException;
import com.example.gatewaymanager.exception.UnsupportedAdapterTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ProviderDeploymentServiceTest {

    private GatewayService gatewayService;
    private GatewayEventService eventService;
    private GatewayAdapterFactory factory;
    private ProviderDeploymentService service;

    @BeforeEach
    void setUp() {
        gatewayService = mock(GatewayService.class);
        eventService = mock(GatewayEventService.class);
        factory = new GatewayAdapterFactory();
        Map<String, Map<String, ProviderStatus>> shared = new ConcurrentHashMap<>();
        factory.register("mock", config -> MockGatewayAdapter.fromConfig(config, shared));
        service = new ProviderDeploymentService(gatewayService, factory, eventService);
    }

    private void givenGateway(String adapterType, Map<String, Object> adapterConfig) {
        when(gatewayService.getGateway("gw-1")).thenReturn(Gateway.builder()
                .id("gw-1").name("edge").adapterType(adapterType).adapterConfig(new HashMap<>(adapterConfig)).build());
    }

    private static ProviderDeploymentConfig config() {
        return ProviderDeploymentConfig.builder().handle("openai-main").configuration(Map.of("kind", "LlmProvider")).build();
    }

    @Test
    void deployAnnouncesConfigChange() {
        givenGateway("mock", Map.of());

        ProviderDeploymentResult result = service.deployProvider("gw-1", config(), "user-1");

        assertEquals("openai-main", result.getDeploymentId());
        ArgumentCaptor<GatewayConfigEvent> event = ArgumentCaptor.forClass(GatewayConfigEvent.class);
        verify(eventService).broadcastConfigUpdated(eq("gw-1"), event.capture(), eq("user-1"));
        assertEquals("llm-provider", event.getValue().getConfigType());
        assertEquals("deployed", event.getValue().getAction());
    }

    @Test
    void stateIsSharedAcrossAdapterInstances() {
        givenGateway("mock", Map.of());

        service.deployProvider("gw-1", config(), null);
        service.updateProvider("gw-1", "openai-main", config(), null);
        service.undeployProvider("gw-1", "openai-main", null);

        assertTrue(service.listProviders("gw-1").isEmpty());
        verify(eventService, times(3)).broadcastConfigUpdated(eq("gw-1"), any(GatewayConfigEvent.class), any());
    }

    @Test
    void failedMutationIsNotAnnounced() {
        givenGateway("mock", Map.of("shouldFail", true));

        assertThrows(GatewayOperationException.class, () -> service.deployProvider("gw-1", config(), null));
        verifyNoInteractions(eventService);
    }

    @Test
    void broadcastFailureDoesNotFailMutation() {
        givenGateway("mock", Map.of());
        when(eventService.broadcastConfigUpdated(anyString(), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> service.deployProvider("gw-1", config(), null));
    }

    @Test
    void adapterIsClosedAfterEachCall() {
        GatewayAdapter adapter = mock(GatewayAdapter.class);
        factory.register("spy", config -> adapter);
        givenGateway("spy", Map.of());

        service.listProviders("gw-1");
        service.getPolicies("gw-1");

        verify(adapter, times(2)).close();
    }

    @Test
    void unknownAdapterTypeIsUnsupported() {
        givenGateway("cloud", Map.of());

        assertThrows(UnsupportedAdapterTypeException.class, () -> service.listProviders("gw-1"));
    }

    @Test
    void mockHealthNeedsNoControlPlaneUrl() {
        givenGateway("mock", Map.of("responseTimeMillis", 7));
        assertEquals(Duration.ofMillis(7), service.checkHealth("gw-1").getResponseTime());

        when(gatewayService.getGateway("gw-1")).thenReturn(Gateway.builder()
                .id("gw-1").name("edge").adapterType("mock").adapterConfig(null).build());
        assertTrue(service.checkHealth("gw-1").isHealthy());
    }

    @Test
    void healthPassesConfiguredUrlToAdapter() {
        GatewayAdapter adapter = mock(GatewayAdapter.class);
        factory.register("needs-url", config -> adapter);
        when(adapter.checkHealth(null)).thenThrow(new AdapterConfigurationException("controlPlaneUrl not found"));
        givenGateway("needs-url", Map.of());

        assertThrows(AdapterConfigurationException.class, () -> service.checkHealth("gw-1"));

        givenGateway("needs-url", Map.of("controlPlaneUrl", "http://gw:9090"));
        service.checkHealth("gw-1");
        verify(adapter).checkHealth("http://gw:9090");
        verify(adapter, times(2)).close();
    }

    @Test
    void adapterReceivesGatewayConfig() {
        GatewayAdapter adapter = mock(GatewayAdapter.class);
        ArgumentCaptor<AdapterConfig> seen = ArgumentCaptor.forClass(AdapterConfig.class);
        factory.register("spy", config -> adapter);
        GatewayAdapterFactory spyFactory = spy(factory);
        service = new ProviderDeploymentService(gatewayService, spyFactory, eventService);
        givenGateway("spy", Map.of("controlPlaneUrl", "http://gw:9090"));

        service.getPolicies("gw-1");

        verify(spyFactory).createAdapter(seen.capture());
        assertEquals("spy", seen.getValue().type());
        assertEquals("http://gw:9090", seen.getValue().stringParam("controlPlaneUrl"));
    }
}
