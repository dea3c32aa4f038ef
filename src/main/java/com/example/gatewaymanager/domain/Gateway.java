package com.example.gatewaymanager.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A registered gateway instance.
 * The credentials column holds an AES-GCM blob produced by the credential vault;
 * the API key itself is never stored, only its SHA-256 digest.
 */
@Entity
@Table(name = "gateways")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Gateway {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    /** Discriminator resolved by the adapter factory, e.g. "on-premise". */
    @Column(name = "adapter_type", nullable = false)
    private String adapterType;

    /** Adapter parameters such as controlPlaneUrl and timeoutSeconds. */
    @Convert(converter = MapJsonConverter.class)
    @Column(name = "adapter_config", length = 4096)
    @Builder.Default
    private Map<String, Object> adapterConfig = new HashMap<>();

    @Lob
    @Column(name = "encrypted_credentials")
    @ToString.Exclude
    private byte[] encryptedCredentials;

    @Column(name = "api_key_hash", unique = true, length = 64)
    @ToString.Exclude
    private String apiKeyHash;

    @Builder.Default
    private boolean active = false;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
