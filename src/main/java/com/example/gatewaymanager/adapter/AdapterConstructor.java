package com.example.gatewaymanager.adapter;

/**
 * Builds an adapter instance from its configuration.
 */
@FunctionalInterface
public interface AdapterConstructor {

    GatewayAdapter create(AdapterConfig config);
}
