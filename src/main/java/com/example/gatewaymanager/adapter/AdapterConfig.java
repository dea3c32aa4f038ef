package com.example.gatewaymanager.adapter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Adapter discriminator plus its parameter bag. Read-only after construction.
 * Absent optional parameters resolve to the supplied default.
 */
public record AdapterConfig(String type, Map<String, Object> parameters) {

    public AdapterConfig {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new HashMap<>(parameters));
    }

    public static AdapterConfig of(String type) {
        return new AdapterConfig(type, Map.of());
    }

    public String stringParam(String name) {
        Object value = parameters.get(name);
        return value instanceof String s && !s.isBlank() ? s : null;
    }

    public boolean booleanParam(String name, boolean defaultValue) {
        Object value = parameters.get(name);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return defaultValue;
    }

    public long longParam(String name, long defaultValue) {
        Object value = parameters.get(name);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
