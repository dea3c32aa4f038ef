package com.example.gatewaymanager.adapter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyInfo {

    private String name;
    /** Not reported by every gateway; empty when unknown. */
    @Builder.Default
    private String version = "";
    private String description;
    private Map<String, Object> parameters;
}
