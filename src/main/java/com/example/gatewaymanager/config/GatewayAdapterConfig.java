package com.example.gatewaymanager.config;

import com.example.gatewaymanager.adapter.GatewayAdapterFactory;
import com.example.gatewaymanager.adapter.ProviderStatus;
import com.example.gatewaymanager.adapter.mock.MockGatewayAdapter;
import com.example.gatewaymanager.adapter.onpremise.OnPremiseGatewayAdapter;
import com.example.gatewaymanager.service.GatewayService;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registers the built-in gateway adapters with the factory.
 */
@Configuration
public class GatewayAdapterConfig {

    @Bean
    public GatewayAdapterFactory gatewayAdapterFactory(GatewayService gatewayService,
                                                       OkHttpClient okHttpClient,
                                                       ObjectMapper objectMapper,
                                                       GatewayManagerProperties properties) {
        GatewayManagerProperties.AdapterDefaultsConfig defaults = properties.getAdapter();
        Duration defaultTimeout = Duration.ofSeconds(defaults.getDefaultTimeoutSeconds());
        Duration healthTimeout = Duration.ofSeconds(defaults.getHealthCheckTimeoutSeconds());

        GatewayAdapterFactory factory = new GatewayAdapterFactory();
        factory.register(OnPremiseGatewayAdapter.TYPE, config -> new OnPremiseGatewayAdapter(
                config, gatewayService, okHttpClient, objectMapper, defaultTimeout, healthTimeout));

        // mock adapters created by the factory share one provider table
        Map<String, Map<String, ProviderStatus>> mockProviders = new ConcurrentHashMap<>();
        factory.register(MockGatewayAdapter.TYPE, config -> MockGatewayAdapter.fromConfig(config, mockProviders));
        return factory;
    }
}
