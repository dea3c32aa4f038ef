package com.example.gatewaymanager.adapter.mock;

import com.example.gatewaymanager.adapter.AdapterConfig;
import com.example.gatewaymanager.adapter.GatewayAdapter;
import com.example.gatewaymanager.adapter.HealthStatus;
import com.example.gatewaymanager.adapter.PolicyInfo;
import com.example.gatewaymanager.adapter.ProviderDeploymentConfig;
import com.example.gatewaymanager.adapter.ProviderDeploymentResult;
import com.example.gatewaymanager.adapter.ProviderStatus;
import com.example.gatewaymanager.exception.GatewayOperationException;
import com.example.gatewaymanager.exception.ProviderNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory gateway for development and tests. Providers deployed through it
 * are remembered so that status and list calls stay consistent. With
 * {@code shouldFail} set, every operation fails with {@code failMessage}.
 */
@Slf4j
public class MockGatewayAdapter implements GatewayAdapter {

    public static final String TYPE = "mock";
    public static final String DEPLOYED = "DEPLOYED";

    private final String adapterType;
    private final boolean shouldFail;
    private final String failMessage;
    private final Duration responseTime;
    private final Map<String, Map<String, ProviderStatus>> providers;

    public MockGatewayAdapter(String adapterType, boolean shouldFail, String failMessage, Duration responseTime) {
        this(adapterType, shouldFail, failMessage, responseTime, new ConcurrentHashMap<>());
    }

    /**
     * @param providers provider table keyed by gateway ID, shared between
     *                  instances that should observe each other's deployments
     */
    public MockGatewayAdapter(String adapterType, boolean shouldFail, String failMessage, Duration responseTime,
                              Map<String, Map<String, ProviderStatus>> providers) {
        this.providers = providers;
        this.adapterType = adapterType != null && !adapterType.isBlank() ? adapterType : TYPE;
        this.shouldFail = shouldFail;
        this.failMessage = failMessage != null ? failMessage : "mock adapter failure";
        this.responseTime = responseTime;
    }

    public static MockGatewayAdapter fromConfig(AdapterConfig config,
                                                Map<String, Map<String, ProviderStatus>> providers) {
        return new MockGatewayAdapter(
                config.stringParam("adapterType"),
                config.booleanParam("shouldFail", false),
                config.stringParam("failMessage"),
                Duration.ofMillis(config.longParam("responseTimeMillis", 10)),
                providers);
    }

    @Override
    public String getAdapterType() {
        return adapterType;
    }

    @Override
    public void close() {
        log.debug("Mock adapter closed");
    }

    @Override
    public void validateGatewayEndpoint(String controlPlaneUrl) {
        failIfConfigured(controlPlaneUrl);
        log.debug("Mock gateway validation successful: url={}", controlPlaneUrl);
    }

    @Override
    public HealthStatus checkHealth(String controlPlaneUrl) {
        HealthStatus.HealthStatusBuilder status = HealthStatus.builder()
                .status(HealthStatus.State.ACTIVE)
                .responseTime(responseTime)
                .checkedAt(Instant.now());
        try {
            validateGatewayEndpoint(controlPlaneUrl);
        } catch (GatewayOperationException e) {
            status.status(HealthStatus.State.ERROR).errorMessage(e.getMessage());
        }
        return status.build();
    }

    @Override
    public ProviderDeploymentResult deployProvider(String gatewayId, ProviderDeploymentConfig config) {
        failIfConfigured(gatewayId);
        String id = config.getHandle() != null ? config.getHandle() : UUID.randomUUID().toString();
        Instant now = Instant.now();
        providersOf(gatewayId).put(id, toStatus(id, config, now));
        return ProviderDeploymentResult.builder().deploymentId(id).status(DEPLOYED).deployedAt(now).build();
    }

    @Override
    public ProviderDeploymentResult updateProvider(String gatewayId, String providerId, ProviderDeploymentConfig config) {
        failIfConfigured(gatewayId);
        Map<String, ProviderStatus> deployed = providersOf(gatewayId);
        if (!deployed.containsKey(providerId)) {
            throw new ProviderNotFoundException(providerId);
        }
        Instant now = Instant.now();
        deployed.put(providerId, toStatus(providerId, config, now));
        return ProviderDeploymentResult.builder().deploymentId(providerId).status(DEPLOYED).deployedAt(now).build();
    }

    @Override
    public void undeployProvider(String gatewayId, String providerId) {
        failIfConfigured(gatewayId);
        if (providersOf(gatewayId).remove(providerId) == null) {
            throw new ProviderNotFoundException(providerId);
        }
    }

    @Override
    public ProviderStatus getProviderStatus(String gatewayId, String providerId) {
        failIfConfigured(gatewayId);
        ProviderStatus status = providersOf(gatewayId).get(providerId);
        if (status == null) {
            throw new ProviderNotFoundException(providerId);
        }
        return status;
    }

    @Override
    public List<ProviderStatus> listProviders(String gatewayId) {
        failIfConfigured(gatewayId);
        return new ArrayList<>(providersOf(gatewayId).values());
    }

    @Override
    public List<PolicyInfo> getPolicies(String gatewayId) {
        failIfConfigured(gatewayId);
        return List.of(PolicyInfo.builder()
                .name("rate-limit")
                .description("Mock rate limiting policy")
                .parameters(Map.of("requestsPerMinute", 60))
                .build());
    }

    private Map<String, ProviderStatus> providersOf(String gatewayId) {
        return providers.computeIfAbsent(gatewayId, id -> new ConcurrentHashMap<>());
    }

    private void failIfConfigured(String target) {
        if (shouldFail) {
            throw new GatewayOperationException(failMessage + ": " + target);
        }
    }

    @SuppressWarnings("unchecked")
    private static ProviderStatus toStatus(String id, ProviderDeploymentConfig config, Instant deployedAt) {
        Map<String, Object> configuration = config.getConfiguration() != null ? config.getConfiguration() : Map.of();
        Map<String, Object> metadata = configuration.get("metadata") instanceof Map<?, ?> m
                ? (Map<String, Object>) m : Map.of();
        Map<String, Object> spec = configuration.get("spec") instanceof Map<?, ?> s
                ? new HashMap<>((Map<String, Object>) s) : null;
        return ProviderStatus.builder()
                .id(id)
                .name(metadata.get("name") instanceof String name ? name : id)
                .kind(configuration.get("kind") instanceof String kind ? kind : null)
                .status(DEPLOYED)
                .deployedAt(deployedAt.toString())
                .spec(spec)
                .build();
    }
}
