package com.example.gatewaymanager.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Credentials used to authenticate against a gateway's own control API.
 * Only ever held decrypted in memory for the duration of one outbound call;
 * at rest it is the opaque blob produced by {@link com.example.gatewaymanager.crypto.CredentialVault}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayCredentials {

    private String username;

    @ToString.Exclude
    private String password;
}
