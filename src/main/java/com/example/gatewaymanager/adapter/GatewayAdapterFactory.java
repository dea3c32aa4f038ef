package com.example.gatewaymanager.adapter;

import com.example.gatewaymanager.exception.UnsupportedAdapterTypeException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named adapter constructors. The last registration for a type wins.
 */
@Slf4j
public class GatewayAdapterFactory {

    private final Map<String, AdapterConstructor> constructors = new ConcurrentHashMap<>();

    public void register(String adapterType, AdapterConstructor constructor) {
        AdapterConstructor previous = constructors.put(adapterType, constructor);
        if (previous != null) {
            log.debug("Replaced adapter constructor: type={}", adapterType);
        } else {
            log.info("Registered gateway adapter: type={}", adapterType);
        }
    }

    /**
     * @throws UnsupportedAdapterTypeException if no constructor is registered for {@code config.type()}
     */
    public GatewayAdapter createAdapter(AdapterConfig config) {
        AdapterConstructor constructor = config.type() != null ? constructors.get(config.type()) : null;
        if (constructor == null) {
            throw new UnsupportedAdapterTypeException(config.type());
        }
        return constructor.create(config);
    }

    public List<String> listSupportedTypes() {
        return constructors.keySet().stream().sorted().toList();
    }
}
