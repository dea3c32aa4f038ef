package com.example.gatewaymanager.gateway;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * First frame sent to a gateway after its connection is registered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionAck {

    public static final String TYPE = "connection.ack";

    @Builder.Default
    private String type = TYPE;
    private String gatewayId;
    private String connectionId;
    private String timestamp;
}
