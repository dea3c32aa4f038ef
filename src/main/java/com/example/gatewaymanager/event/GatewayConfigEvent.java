package com.example.gatewaymanager.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of a {@code config.updated} event: which kind of configuration
 * changed and how.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayConfigEvent {

    private String configType;
    private String action;
}
