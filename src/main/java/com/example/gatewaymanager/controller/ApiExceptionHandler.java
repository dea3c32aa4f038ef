package com.example.gatewaymanager.controller;

import com.example.gatewaymanager.exception.AdapterConfigurationException;
import com.example.gatewaymanager.exception.ConnectionLimitExceededException;
import com.example.gatewaymanager.exception.CredentialEncryptionException;
import com.example.gatewaymanager.exception.EventPayloadTooLargeException;
import com.example.gatewaymanager.exception.GatewayNotFoundException;
import com.example.gatewaymanager.exception.GatewayOperationException;
import com.example.gatewaymanager.exception.GatewayUnreachableException;
import com.example.gatewaymanager.exception.ProviderNotFoundException;
import com.example.gatewaymanager.exception.UnsupportedAdapterTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to HTTP status codes with a uniform JSON body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({GatewayNotFoundException.class, ProviderNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(ConnectionLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleCapacity(ConnectionLimitExceededException ex) {
        return error(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
    }

    @ExceptionHandler(GatewayUnreachableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreachable(GatewayUnreachableException ex) {
        log.error("Gateway unreachable: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(GatewayOperationException.class)
    public ResponseEntity<Map<String, Object>> handleOperation(GatewayOperationException ex) {
        log.error("Gateway operation failed: status={}, error={}", ex.getStatusCode(), ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(AdapterConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(AdapterConfigurationException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }

    @ExceptionHandler(UnsupportedAdapterTypeException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupportedAdapter(UnsupportedAdapterTypeException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(EventPayloadTooLargeException.class)
    public ResponseEntity<Map<String, Object>> handlePayloadTooLarge(EventPayloadTooLargeException ex) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, ex.getMessage());
    }

    @ExceptionHandler(CredentialEncryptionException.class)
    public ResponseEntity<Map<String, Object>> handleCredentials(CredentialEncryptionException ex) {
        log.error("Credential operation failed: {}", ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "credential operation failed");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
