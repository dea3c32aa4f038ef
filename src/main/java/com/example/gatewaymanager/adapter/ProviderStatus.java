package com.example.gatewaymanager.adapter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A provider as reported by a gateway. {@code deployedAt} is passed through
 * in whatever timestamp form the gateway returned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderStatus {

    private String id;
    private String name;
    private String kind;
    private String status;
    private String deployedAt;
    private Map<String, Object> spec;
}
