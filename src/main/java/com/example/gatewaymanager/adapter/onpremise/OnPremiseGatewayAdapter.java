package com.example.gatewaymanager.adapter.onpremise;

import com.example.gatewaymanager.adapter.AdapterConfig;
import com.example.gatewaymanager.adapter.GatewayAdapter;
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
import com.example.gatewaymanager.service.GatewayService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Adapter for self-hosted gateways reached over their HTTP control API.
 *
 * Every management call loads the gateway row, decrypts its stored
 * credentials, reads {@code controlPlaneUrl} from the row's adapter config and
 * talks to that URL through a fresh {@link GatewayControlClient} using HTTP
 * Basic authentication.
 */
@Slf4j
public class OnPremiseGatewayAdapter implements GatewayAdapter {

    public static final String TYPE = "on-premise";
    public static final String PARAM_CONTROL_PLANE_URL = "controlPlaneUrl";
    public static final String PARAM_TIMEOUT_SECONDS = "timeoutSeconds";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final GatewayService gatewayService;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;
    private final OkHttpClient healthClient;

    public OnPremiseGatewayAdapter(AdapterConfig config, GatewayService gatewayService, OkHttpClient baseClient,
                                   ObjectMapper objectMapper, Duration defaultTimeout, Duration healthCheckTimeout) {
        this.gatewayService = gatewayService;
        this.objectMapper = objectMapper;
        Duration timeout = Duration.ofSeconds(config.longParam(PARAM_TIMEOUT_SECONDS, defaultTimeout.toSeconds()));
        this.httpClient = baseClient.newBuilder()
                .callTimeout(timeout)
                .build();
        this.healthClient = baseClient.newBuilder()
                .callTimeout(healthCheckTimeout)
                .build();
    }

    @Override
    public String getAdapterType() {
        return TYPE;
    }

    @Override
    public void close() {
        // clients share the base client's pool, nothing to release
    }

    @Override
    public void validateGatewayEndpoint(String controlPlaneUrl) {
        if (controlPlaneUrl == null || controlPlaneUrl.isBlank()) {
            throw new AdapterConfigurationException("controlPlaneUrl not found in gateway adapter config");
        }
        Request request = new Request.Builder()
                .url(GatewayControlClient.parseUrl(controlPlaneUrl).newBuilder().addPathSegment("health").build())
                .get()
                .build();
        try (Response response = healthClient.newCall(request).execute()) {
            if (response.code() != 200) {
                throw new GatewayOperationException("gateway health check", response.code());
            }
        } catch (IOException e) {
            throw new GatewayUnreachableException("gateway endpoint unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public HealthStatus checkHealth(String controlPlaneUrl) {
        long start = System.nanoTime();
        HealthStatus.State state = HealthStatus.State.ACTIVE;
        String errorMessage = null;
        try {
            validateGatewayEndpoint(controlPlaneUrl);
        } catch (GatewayOperationException e) {
            state = HealthStatus.State.ERROR;
            errorMessage = e.getMessage();
        }
        return HealthStatus.builder()
                .status(state)
                .responseTime(Duration.ofNanos(System.nanoTime() - start))
                .checkedAt(Instant.now())
                .errorMessage(errorMessage)
                .build();
    }

    @Override
    public ProviderDeploymentResult deployProvider(String gatewayId, ProviderDeploymentConfig config) {
        log.info("Deploying provider to gateway: gatewayId={}, handle={}", gatewayId, config.getHandle());
        JsonNode body = clientFor(gatewayId).createProvider(config.getConfiguration());
        return deploymentResult(body);
    }

    @Override
    public ProviderDeploymentResult updateProvider(String gatewayId, String providerId, ProviderDeploymentConfig config) {
        log.info("Updating provider on gateway: gatewayId={}, providerId={}", gatewayId, providerId);
        JsonNode body = clientFor(gatewayId).updateProvider(providerId, config.getConfiguration());
        return deploymentResult(body);
    }

    @Override
    public void undeployProvider(String gatewayId, String providerId) {
        log.info("Undeploying provider from gateway: gatewayId={}, providerId={}", gatewayId, providerId);
        clientFor(gatewayId).deleteProvider(providerId);
    }

    @Override
    public ProviderStatus getProviderStatus(String gatewayId, String providerId) {
        JsonNode provider = clientFor(gatewayId).getProvider(providerId).path("provider");
        if (provider.isMissingNode() || provider.isNull()) {
            throw new GatewayOperationException("provider data not found in response");
        }

        JsonNode configuration = provider.path("configuration");
        ProviderStatus.ProviderStatusBuilder status = ProviderStatus.builder()
                .id(text(provider, "id"))
                .name(text(configuration.path("metadata"), "name"))
                .kind(text(configuration, "kind"))
                .status(text(provider, "deploymentStatus"))
                .deployedAt(text(provider.path("metadata"), "deployedAt"));
        JsonNode spec = configuration.path("spec");
        if (spec.isObject()) {
            status.spec(objectMapper.convertValue(spec, MAP_TYPE));
        }
        return status.build();
    }

    @Override
    public List<ProviderStatus> listProviders(String gatewayId) {
        JsonNode body = clientFor(gatewayId).listProviders();
        List<ProviderStatus> providers = new ArrayList<>();
        for (JsonNode item : body.path("providers")) {
            providers.add(ProviderStatus.builder()
                    .id(text(item, "id"))
                    .name(text(item, "displayName"))
                    .kind(text(item, "template"))
                    .status(text(item, "status"))
                    .deployedAt(text(item, "createdAt"))
                    .build());
        }
        return providers;
    }

    @Override
    public List<PolicyInfo> getPolicies(String gatewayId) {
        JsonNode body = clientFor(gatewayId).listPolicies();
        List<PolicyInfo> policies = new ArrayList<>();
        for (JsonNode item : body.path("policies")) {
            PolicyInfo.PolicyInfoBuilder policy = PolicyInfo.builder()
                    .name(text(item, "name"))
                    .description(text(item, "description"));
            JsonNode parameters = item.path("parameters");
            if (parameters.isObject()) {
                policy.parameters(objectMapper.convertValue(parameters, MAP_TYPE));
            }
            policies.add(policy.build());
        }
        return policies;
    }

    /**
     * Resolve credentials and control-plane URL for a gateway and bind a client
     * to them. Fails before any HTTP traffic when either is missing.
     */
    private GatewayControlClient clientFor(String gatewayId) {
        GatewayService.GatewayWithCredentials loaded = gatewayService.getGatewayWithCredentials(gatewayId);
        Gateway gateway = loaded.gateway();
        Object url = gateway.getAdapterConfig() != null ? gateway.getAdapterConfig().get(PARAM_CONTROL_PLANE_URL) : null;
        if (!(url instanceof String controlPlaneUrl) || controlPlaneUrl.isBlank()) {
            throw new AdapterConfigurationException("controlPlaneUrl not found in gateway adapter config");
        }
        GatewayCredentials credentials = loaded.credentials();
        if (credentials.getUsername() == null || credentials.getPassword() == null) {
            throw new AdapterConfigurationException("incomplete credentials stored for gateway " + gatewayId);
        }
        String authorization = Credentials.basic(credentials.getUsername(), credentials.getPassword(), StandardCharsets.UTF_8);
        return new GatewayControlClient(controlPlaneUrl, httpClient, objectMapper, authorization);
    }

    private static ProviderDeploymentResult deploymentResult(JsonNode body) {
        return ProviderDeploymentResult.builder()
                .deploymentId(body.path("id").asText(""))
                .status(body.path("status").asText(""))
                .deployedAt(Instant.now())
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() ? value.asText() : null;
    }
}
