package com.example.gatewaymanager.controller;

import com.example.gatewaymanager.adapter.HealthStatus;
import com.example.gatewaymanager.adapter.PolicyInfo;
import com.example.gatewaymanager.adapter.ProviderDeploymentConfig;
import com.example.gatewaymanager.adapter.ProviderDeploymentResult;
import com.example.gatewaymanager.adapter.ProviderStatus;
import com.example.gatewaymanager.domain.Gateway;
import com.example.gatewaymanager.domain.GatewayCredentials;
import com.example.gatewaymanager.gateway.GatewayConnection;
import com.example.gatewaymanager.gateway.GatewayConnectionManager;
import com.example.gatewaymanager.service.GatewayService;
import com.example.gatewaymanager.service.ProviderDeploymentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway administration: registration, live connection inspection and
 * provider management through the gateway's adapter.
 */
@RestController
@RequestMapping("/api/v1/gateways")
@RequiredArgsConstructor
public class GatewayController {

    static final String USER_HEADER = "X-User-Id";

    private final GatewayService gatewayService;
    private final GatewayConnectionManager connectionManager;
    private final ProviderDeploymentService deploymentService;

    public record RegisterGatewayRequest(String name, String adapterType, Map<String, Object> adapterConfig,
                                         GatewayCredentials credentials) {}

    /**
     * Register a gateway. The API key is only ever returned here.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> registerGateway(@RequestBody RegisterGatewayRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "name is required"));
        }
        GatewayService.RegisteredGateway registered = gatewayService.registerGateway(
                request.name(), request.adapterType(), request.adapterConfig(), request.credentials());
        Map<String, Object> body = new LinkedHashMap<>(describe(registered.gateway()));
        body.put("apiKey", registered.apiKey());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listGateways() {
        return ResponseEntity.ok(gatewayService.listGateways().stream().map(this::describe).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getGateway(@PathVariable String id) {
        return ResponseEntity.ok(describe(gatewayService.getGateway(id)));
    }

    @GetMapping("/connections/stats")
    public ResponseEntity<Map<String, Object>> getConnectionStats() {
        Map<String, Object> stats = new LinkedHashMap<>(connectionManager.getStats());
        stats.put("maxConnections", connectionManager.getMaxConnections());
        return ResponseEntity.ok(stats);
    }

    @GetMapping("/{id}/connections")
    public ResponseEntity<Map<String, Object>> getConnections(@PathVariable String id) {
        List<Map<String, Object>> connections = connectionManager.getConnections(id).stream()
                .map(GatewayConnection::getConnectionInfo)
                .toList();
        return ResponseEntity.ok(Map.of(
                "gatewayId", id,
                "count", connections.size(),
                "connections", connections));
    }

    @PostMapping("/{id}/providers")
    public ResponseEntity<ProviderDeploymentResult> deployProvider(
            @PathVariable String id,
            @RequestBody ProviderDeploymentConfig config,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(deploymentService.deployProvider(id, config, userId));
    }

    @PutMapping("/{id}/providers/{providerId}")
    public ResponseEntity<ProviderDeploymentResult> updateProvider(
            @PathVariable String id,
            @PathVariable String providerId,
            @RequestBody ProviderDeploymentConfig config,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return ResponseEntity.ok(deploymentService.updateProvider(id, providerId, config, userId));
    }

    @DeleteMapping("/{id}/providers/{providerId}")
    public ResponseEntity<Void> undeployProvider(
            @PathVariable String id,
            @PathVariable String providerId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        deploymentService.undeployProvider(id, providerId, userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/providers/{providerId}")
    public ResponseEntity<ProviderStatus> getProviderStatus(@PathVariable String id, @PathVariable String providerId) {
        return ResponseEntity.ok(deploymentService.getProviderStatus(id, providerId));
    }

    @GetMapping("/{id}/providers")
    public ResponseEntity<List<ProviderStatus>> listProviders(@PathVariable String id) {
        return ResponseEntity.ok(deploymentService.listProviders(id));
    }

    @GetMapping("/{id}/policies")
    public ResponseEntity<List<PolicyInfo>> getPolicies(@PathVariable String id) {
        return ResponseEntity.ok(deploymentService.getPolicies(id));
    }

    @GetMapping("/{id}/health")
    public ResponseEntity<HealthStatus> checkHealth(@PathVariable String id) {
        return ResponseEntity.ok(deploymentService.checkHealth(id));
    }

    @GetMapping("/adapter-types")
    public ResponseEntity<Map<String, Object>> getAdapterTypes() {
        return ResponseEntity.ok(Map.of("types", deploymentService.listSupportedAdapterTypes()));
    }

    private Map<String, Object> describe(Gateway gateway) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", gateway.getId());
        body.put("name", gateway.getName());
        body.put("adapterType", gateway.getAdapterType());
        body.put("adapterConfig", gateway.getAdapterConfig());
        body.put("active", gateway.isActive());
        body.put("liveConnections", connectionManager.getConnections(gateway.getId()).size());
        body.put("createdAt", gateway.getCreatedAt());
        body.put("updatedAt", gateway.getUpdatedAt());
        return body;
    }
}
