package com.example.gatewaymanager.event;

/**
 * Event types understood by gateways.
 */
public final class GatewayEventTypes {

    public static final String AGENT_DEPLOYED = "agent.deployed";
    public static final String AGENT_UNDEPLOYED = "agent.undeployed";
    public static final String CONFIG_UPDATED = "config.updated";

    private GatewayEventTypes() {
    }
}
