package com.example.gatewaymanager.service;

import com.example.gatewaymanager.adapter.AdapterConfig;
import com.example.gatewaymanager.adapter.GatewayAdapter;
import com.example.gatewaymanager.adapter.GatewayAdapterFactory;
import com.example.gatewaymanager.adapter.HealthStatus;
import com.example.gatewaymanager.adapter.PolicyInfo;
import com.example.gatewaymanager.adapter.ProviderDeploymentConfig;
import com.example.gatewaymanager.adapter.ProviderDeploymentResult;
import com.example.gatewaymanager.adapter.ProviderStatus;
import com.example.gatewaymanager.domain.Gateway;
import com.example.gatewaymanager.event.GatewayConfigEvent;
import com.example.gatewaymanager.event.GatewayEventService;
import com.example.gatewaymanager.exception.AdapterConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Function;

/**
 * Manages LLM providers on a gateway through that gateway's adapter.
 *
 * The adapter is resolved per call from the gateway's stored adapter type and
 * config, and closed afterwards. Successful mutations are announced to the
 * gateway's live connections with a {@code config.updated} event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderDeploymentService {

    static final String CONFIG_TYPE = "llm-provider";

    private final GatewayService gatewayService;
    private final GatewayAdapterFactory adapterFactory;
    private final GatewayEventService eventService;

    public ProviderDeploymentResult deployProvider(String gatewayId, ProviderDeploymentConfig config, String userId) {
        ProviderDeploymentResult result = withAdapter(gatewayId, adapter -> adapter.deployProvider(gatewayId, config));
        log.info("Provider deployed: gatewayId={}, deploymentId={}, status={}",
                gatewayId, result.getDeploymentId(), result.getStatus());
        announce(gatewayId, "deployed", userId);
        return result;
    }

    public ProviderDeploymentResult updateProvider(String gatewayId, String providerId,
                                                   ProviderDeploymentConfig config, String userId) {
        ProviderDeploymentResult result = withAdapter(gatewayId,
                adapter -> adapter.updateProvider(gatewayId, providerId, config));
        log.info("Provider updated: gatewayId={}, providerId={}, status={}", gatewayId, providerId, result.getStatus());
        announce(gatewayId, "updated", userId);
        return result;
    }

    public void undeployProvider(String gatewayId, String providerId, String userId) {
        withAdapter(gatewayId, adapter -> {
            adapter.undeployProvider(gatewayId, providerId);
            return null;
        });
        log.info("Provider undeployed: gatewayId={}, providerId={}", gatewayId, providerId);
        announce(gatewayId, "undeployed", userId);
    }

    public ProviderStatus getProviderStatus(String gatewayId, String providerId) {
        return withAdapter(gatewayId, adapter -> adapter.getProviderStatus(gatewayId, providerId));
    }

    public List<ProviderStatus> listProviders(String gatewayId) {
        return withAdapter(gatewayId, adapter -> adapter.listProviders(gatewayId));
    }

    public List<PolicyInfo> getPolicies(String gatewayId) {
        return withAdapter(gatewayId, adapter -> adapter.getPolicies(gatewayId));
    }

    /**
     * Probe the gateway's control plane. The configured controlPlaneUrl, or null
     * when there is none, is handed to the adapter, which decides whether it needs one.
     *
     * @throws AdapterConfigurationException if the adapter requires a controlPlaneUrl and none is configured
     */
    public HealthStatus checkHealth(String gatewayId) {
        AdapterConfig config = adapterConfigOf(gatewayService.getGateway(gatewayId));
        try (GatewayAdapter adapter = adapterFactory.createAdapter(config)) {
            return adapter.checkHealth(config.stringParam("controlPlaneUrl"));
        }
    }

    public List<String> listSupportedAdapterTypes() {
        return adapterFactory.listSupportedTypes();
    }

    private <T> T withAdapter(String gatewayId, Function<GatewayAdapter, T> call) {
        Gateway gateway = gatewayService.getGateway(gatewayId);
        try (GatewayAdapter adapter = adapterFactory.createAdapter(adapterConfigOf(gateway))) {
            return call.apply(adapter);
        }
    }

    private static AdapterConfig adapterConfigOf(Gateway gateway) {
        return new AdapterConfig(gateway.getAdapterType(), gateway.getAdapterConfig());
    }

    private void announce(String gatewayId, String action, String userId) {
        try {
            eventService.broadcastConfigUpdated(gatewayId,
                    GatewayConfigEvent.builder().configType(CONFIG_TYPE).action(action).build(), userId);
        } catch (RuntimeException e) {
            log.error("Failed to broadcast provider change: gatewayId={}, action={}, error={}",
                    gatewayId, action, e.getMessage());
        }
    }
}
