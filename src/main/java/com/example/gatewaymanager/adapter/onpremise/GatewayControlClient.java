package com.example.gatewaymanager.adapter.onpremise;

import com.example.gatewaymanager.exception.AdapterConfigurationException;
import com.example.gatewaymanager.exception.GatewayOperationException;
import com.example.gatewaymanager.exception.GatewayUnreachableException;
import com.example.gatewaymanager.exception.ProviderNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

/**
 * HTTP client for one gateway's control API, bound to a single base URL and
 * credential. Instances are created per call and never shared between
 * requests that target different gateways.
 */
@Slf4j
class GatewayControlClient {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final String PROVIDERS = "llm-providers";
    private static final String POLICIES = "policies";

    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String authorization;

    GatewayControlClient(String controlPlaneUrl, OkHttpClient httpClient, ObjectMapper objectMapper, String authorization) {
        this.baseUrl = parseUrl(controlPlaneUrl);
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.authorization = authorization;
    }

    static HttpUrl parseUrl(String controlPlaneUrl) {
        HttpUrl url = HttpUrl.parse(controlPlaneUrl);
        if (url == null) {
            throw new AdapterConfigurationException("invalid controlPlaneUrl: " + controlPlaneUrl);
        }
        return url;
    }

    JsonNode createProvider(Map<String, Object> configuration) {
        Request request = authorized(url(PROVIDERS))
                .post(jsonBody(configuration))
                .build();
        return execute(request, "create provider", Set.of(200, 201), null);
    }

    JsonNode updateProvider(String providerId, Map<String, Object> configuration) {
        Request request = authorized(url(PROVIDERS, providerId))
                .put(jsonBody(configuration))
                .build();
        return execute(request, "update provider", Set.of(200), providerId);
    }

    void deleteProvider(String providerId) {
        Request request = authorized(url(PROVIDERS, providerId))
                .delete()
                .build();
        execute(request, "delete provider", Set.of(200, 204), providerId);
    }

    JsonNode getProvider(String providerId) {
        Request request = authorized(url(PROVIDERS, providerId)).get().build();
        return execute(request, "get provider", Set.of(200), providerId);
    }

    JsonNode listProviders() {
        Request request = authorized(url(PROVIDERS)).get().build();
        return execute(request, "list providers", Set.of(200), null);
    }

    JsonNode listPolicies() {
        Request request = authorized(url(POLICIES)).get().build();
        return execute(request, "list policies", Set.of(200), null);
    }

    private HttpUrl url(String collection) {
        return baseUrl.newBuilder().addPathSegment(collection).build();
    }

    private HttpUrl url(String collection, String id) {
        return baseUrl.newBuilder().addPathSegment(collection).addPathSegment(id).build();
    }

    private Request.Builder authorized(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", authorization)
                .header("Accept", "application/json");
    }

    private RequestBody jsonBody(Map<String, Object> body) {
        try {
            return RequestBody.create(objectMapper.writeValueAsBytes(body), JSON);
        } catch (JsonProcessingException e) {
            throw new GatewayOperationException("failed to marshal configuration", e);
        }
    }

    /**
     * Run a request and translate the status. 404 on a provider resource maps to
     * {@link ProviderNotFoundException}; any other status outside {@code expected}
     * maps to {@link GatewayOperationException}.
     */
    private JsonNode execute(Request request, String operation, Set<Integer> expected, String providerId) {
        try (Response response = httpClient.newCall(request).execute()) {
            int code = response.code();
            if (code == 404 && providerId != null) {
                throw new ProviderNotFoundException(providerId);
            }
            if (!expected.contains(code)) {
                log.error("Gateway {} failed: url={}, status={}", operation, request.url(), code);
                throw new GatewayOperationException(operation, code);
            }
            return readBody(response.body(), operation);
        } catch (IOException e) {
            throw new GatewayUnreachableException("failed to " + operation + " on gateway: " + e.getMessage(), e);
        }
    }

    private JsonNode readBody(ResponseBody body, String operation) throws IOException {
        if (body == null) {
            return MissingNode.getInstance();
        }
        String text = body.string();
        if (text.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new GatewayOperationException("failed to decode " + operation + " response", e);
        }
    }
}
