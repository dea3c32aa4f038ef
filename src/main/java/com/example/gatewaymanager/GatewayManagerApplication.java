package com.example.gatewaymanager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Gateway Manager
 *
 * Control plane for remotely deployed AI gateways:
 * - WebSocket endpoint that keeps an authenticated channel open to every gateway instance
 * - Heartbeat supervision that reaps dead channels
 * - Event broadcast of deployment and configuration changes
 * - Adapter-based provider management over each gateway's control API
 */
@SpringBootApplication
public class GatewayManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayManagerApplication.class, args);
    }
}
