package com.example.gatewaymanager.exception;

/**
 * Decryption failed. Deliberately carries no cause and no detail so tampered
 * data, a wrong key and a malformed blob are indistinguishable to callers.
 */
public class InvalidCiphertextException extends CredentialEncryptionException {

    public InvalidCiphertextException() {
        super("invalid ciphertext");
    }
}
