package com.example.gatewaymanager.exception;

public class UnsupportedAdapterTypeException extends RuntimeException {

    private final String adapterType;

    public UnsupportedAdapterTypeException(String adapterType) {
        super("unsupported adapter type: " + adapterType);
        this.adapterType = adapterType;
    }

    public String getAdapterType() {
        return adapterType;
    }
}
