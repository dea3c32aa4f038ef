package com.example.gatewaymanager.adapter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * An LLM provider configuration to push to a gateway. {@code configuration}
 * is sent as-is as the request body of the gateway's control API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderDeploymentConfig {

    private String handle;
    private Map<String, Object> configuration;
}
