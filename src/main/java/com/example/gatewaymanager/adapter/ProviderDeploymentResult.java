package com.example.gatewaymanager.adapter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderDeploymentResult {

    private String deploymentId;
    private String status;
    private Instant deployedAt;
}
