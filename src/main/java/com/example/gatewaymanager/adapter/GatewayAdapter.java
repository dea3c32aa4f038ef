package com.example.gatewaymanager.adapter;

import java.util.List;

/**
 * Capability set of a gateway backend.
 *
 * Everything above the {@link GatewayAdapterFactory} talks to gateways only
 * through this interface, whether the gateway is reached over plain HTTP,
 * a cloud API or an in-memory test double. Implementations perform no
 * retries; failures are reported with the exception types in
 * {@code com.example.gatewaymanager.exception}.
 */
public interface GatewayAdapter extends AutoCloseable {

    /**
     * Check that a control-plane endpoint answers its health probe.
     *
     * @throws com.example.gatewaymanager.exception.GatewayUnreachableException on transport failure
     * @throws com.example.gatewaymanager.exception.GatewayOperationException on a non-200 answer
     */
    void validateGatewayEndpoint(String controlPlaneUrl);

    /**
     * Probe a control-plane endpoint and report its latency. A reachable but
     * unhealthy endpoint yields {@link HealthStatus.State#ERROR}.
     */
    HealthStatus checkHealth(String controlPlaneUrl);

    ProviderDeploymentResult deployProvider(String gatewayId, ProviderDeploymentConfig config);

    ProviderDeploymentResult updateProvider(String gatewayId, String providerId, ProviderDeploymentConfig config);

    void undeployProvider(String gatewayId, String providerId);

    ProviderStatus getProviderStatus(String gatewayId, String providerId);

    List<ProviderStatus> listProviders(String gatewayId);

    List<PolicyInfo> getPolicies(String gatewayId);

    String getAdapterType();

    /** Release adapter resources. Never throws. */
    @Override
    void close();
}
