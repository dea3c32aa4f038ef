package com.example.gatewaymanager.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentDeployedEvent {

    private String agentId;
    private String environment;
    private String revisionId;
}
