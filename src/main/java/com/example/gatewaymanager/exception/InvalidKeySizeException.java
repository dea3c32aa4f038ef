package com.example.gatewaymanager.exception;

public class InvalidKeySizeException extends CredentialEncryptionException {

    public InvalidKeySizeException(int requiredBytes) {
        super("invalid key size: must be " + requiredBytes + " bytes for AES-256");
    }
}
