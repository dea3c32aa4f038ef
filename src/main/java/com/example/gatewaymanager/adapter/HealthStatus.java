package com.example.gatewaymanager.adapter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthStatus {

    public enum State { ACTIVE, ERROR }

    private State status;
    private Duration responseTime;
    private Instant checkedAt;
    private String errorMessage;

    public boolean isHealthy() {
        return status == State.ACTIVE;
    }
}
