package com.example.gatewaymanager.service;

import com.example.gatewaymanager.config.GatewayManagerProperties;
import com.example.gatewaymanager.crypto.CredentialVault;
import com.example.gatewaymanager.domain.Gateway;
import com.example.gatewaymanager.domain.GatewayCredentials;
import com.example.gatewaymanager.exception.AdapterConfigurationException;
import com.example.gatewaymanager.exception.GatewayNotFoundException;
import com.example.gatewaymanager.exception.InvalidKeySizeException;
import com.example.gatewaymanager.repository.GatewayRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Gateway records: registration, API key verification and credential access.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int API_KEY_BYTES = 32;

    private final GatewayRepository gatewayRepository;
    private final CredentialVault credentialVault;
    private final GatewayManagerProperties properties;

    /** A freshly registered gateway together with its plaintext API key, which is never retrievable again. */
    public record RegisteredGateway(Gateway gateway, String apiKey) {}

    /** A gateway row with its decrypted credentials, held only for one outbound call. */
    public record GatewayWithCredentials(Gateway gateway, GatewayCredentials credentials) {}

    /**
     * Exchange an API key for the gateway it belongs to.
     *
     * @throws GatewayNotFoundException if no gateway holds that key
     */
    @Transactional(readOnly = true)
    public Gateway verifyToken(String apiKey) {
        return gatewayRepository.findByApiKeyHash(hashApiKey(apiKey))
                .orElseThrow(GatewayNotFoundException::forApiKey);
    }

    @Transactional(readOnly = true)
    public Gateway getGateway(String gatewayId) {
        return gatewayRepository.findById(gatewayId)
                .orElseThrow(() -> new GatewayNotFoundException(gatewayId));
    }

    @Transactional(readOnly = true)
    public List<Gateway> listGateways() {
        return gatewayRepository.findAll();
    }

    @Transactional
    public void updateGatewayActiveStatus(String gatewayId, boolean active) {
        Gateway gateway = getGateway(gatewayId);
        if (gateway.isActive() != active) {
            gateway.setActive(active);
            gatewayRepository.save(gateway);
            log.debug("Gateway active status updated: gatewayId={}, active={}", gatewayId, active);
        }
    }

    @Transactional
    public RegisteredGateway registerGateway(String name, String adapterType, Map<String, Object> adapterConfig,
                                             GatewayCredentials credentials) {
        String apiKey = generateApiKey();
        Gateway gateway = Gateway.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .adapterType(adapterType != null ? adapterType : properties.getAdapter().getDefaultType())
                .adapterConfig(adapterConfig != null ? new HashMap<>(adapterConfig) : new HashMap<>())
                .encryptedCredentials(credentials != null ? credentialVault.encrypt(credentials, encryptionKey()) : null)
                .apiKeyHash(hashApiKey(apiKey))
                .build();
        Gateway saved = gatewayRepository.save(gateway);
        log.info("Gateway registered: gatewayId={}, name={}, adapterType={}",
                saved.getId(), saved.getName(), saved.getAdapterType());
        return new RegisteredGateway(saved, apiKey);
    }

    /**
     * Load a gateway and decrypt its stored credentials.
     *
     * @throws AdapterConfigurationException if the gateway has no stored credentials
     * @throws com.example.gatewaymanager.exception.InvalidCiphertextException if the blob cannot be decrypted
     */
    @Transactional(readOnly = true)
    public GatewayWithCredentials getGatewayWithCredentials(String gatewayId) {
        Gateway gateway = getGateway(gatewayId);
        byte[] blob = gateway.getEncryptedCredentials();
        if (blob == null || blob.length == 0) {
            throw new AdapterConfigurationException("no credentials stored for gateway " + gatewayId);
        }
        GatewayCredentials credentials = credentialVault.decrypt(blob, encryptionKey());
        return new GatewayWithCredentials(gateway, credentials);
    }

    static String hashApiKey(String apiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(apiKey.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String generateApiKey() {
        byte[] bytes = new byte[API_KEY_BYTES];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private byte[] encryptionKey() {
        String encoded = properties.getEncryption().getKey();
        if (encoded == null || encoded.isBlank()) {
            throw new InvalidKeySizeException(CredentialVault.KEY_SIZE);
        }
        try {
            return Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidKeySizeException(CredentialVault.KEY_SIZE);
        }
    }
}
