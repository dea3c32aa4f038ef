package com.example.gatewaymanager.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Executors for background connection work.
 */
@Configuration
public class AsyncConfig {

    /**
     * One long-lived task per live connection, so the pool is unbounded and
     * sized by the connection ceiling. Lifecycle is owned by the connection
     * manager, which shuts it down and waits for every task to exit.
     */
    @Bean(name = "heartbeatExecutor", destroyMethod = "")
    public ExecutorService heartbeatExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("heartbeat-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }
}
