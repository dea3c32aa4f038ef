package com.example.gatewaymanager.crypto;

import com.example.gatewaymanager.domain.GatewayCredentials;
import com.example.gatewaymanager.exception.CredentialEncryptionException;
import com.example.gatewaymanager.exception.InvalidCiphertextException;
import com.example.gatewaymanager.exception.InvalidKeySizeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * Encrypts and decrypts gateway credentials using AES-256-GCM.
 *
 * Encrypted blobs are laid out as [12-byte nonce][ciphertext][16-byte auth tag].
 * Key storage and rotation are the caller's concern; this class only checks
 * that the key is exactly 32 bytes.
 */
@Component
@RequiredArgsConstructor
public class CredentialVault {

    public static final int KEY_SIZE = 32;
    public static final int NONCE_SIZE = 12;
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final ObjectMapper objectMapper;

    /**
     * Encrypt a credential record. A fresh random nonce is drawn per call, so
     * encrypting the same record twice never yields the same bytes.
     *
     * @throws InvalidKeySizeException if the key is not 32 bytes
     */
    public byte[] encrypt(GatewayCredentials credentials, byte[] key) {
        if (credentials == null) {
            throw new CredentialEncryptionException("credentials cannot be null");
        }
        requireKeySize(key);

        byte[] plaintext;
        try {
            plaintext = objectMapper.writeValueAsBytes(credentials);
        } catch (JsonProcessingException e) {
            throw new CredentialEncryptionException("failed to serialize credentials", e);
        }

        byte[] nonce = new byte[NONCE_SIZE];
        RANDOM.nextBytes(nonce);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
            byte[] sealed = cipher.doFinal(plaintext);

            ByteBuffer buffer = ByteBuffer.allocate(nonce.length + sealed.length);
            buffer.put(nonce);
            buffer.put(sealed);
            return buffer.array();
        } catch (GeneralSecurityException e) {
            throw new CredentialEncryptionException("failed to encrypt credentials", e);
        }
    }

    /**
     * Decrypt a blob produced by {@link #encrypt}. Every authentication or
     * format failure surfaces as the same {@link InvalidCiphertextException}.
     *
     * @throws InvalidKeySizeException if the key is not 32 bytes
     */
    public GatewayCredentials decrypt(byte[] encrypted, byte[] key) {
        requireKeySize(key);
        if (encrypted == null || encrypted.length < NONCE_SIZE) {
            throw new InvalidCiphertextException();
        }

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(GCM_TAG_LENGTH, encrypted, 0, NONCE_SIZE));
            plaintext = cipher.doFinal(encrypted, NONCE_SIZE, encrypted.length - NONCE_SIZE);
        } catch (GeneralSecurityException e) {
            throw new InvalidCiphertextException();
        }

        try {
            return objectMapper.readValue(plaintext, GatewayCredentials.class);
        } catch (IOException e) {
            throw new CredentialEncryptionException("failed to read decrypted credentials", e);
        }
    }

    /**
     * Generate a fresh random 32-byte key for AES-256-GCM.
     */
    public static byte[] generateKey() {
        byte[] key = new byte[KEY_SIZE];
        RANDOM.nextBytes(key);
        return key;
    }

    private static void requireKeySize(byte[] key) {
        if (key == null || key.length != KEY_SIZE) {
            throw new InvalidKeySizeException(KEY_SIZE);
        }
    }
}
