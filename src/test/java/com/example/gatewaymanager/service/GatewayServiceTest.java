package com.example.gatewaymanager.service;

import com.example.gatewaymanager.config.GatewayManagerProperties;
import com.example.gatewaymanager.crypto.CredentialVault;
import com.example.gatewaymanager.domain.Gateway;
import com.example.gatewaymanager.domain.GatewayCredentials;
import com.example.gatewaymanager.exception.AdapterConfigurationException;
import com.example.gatewaymanager.exception.GatewayNotFoundException;
import com.example.gatewaymanager.exception.InvalidKeySizeException;
import com.example.gatewaymanager.repository.GatewayRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Base64;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GatewayServiceTest {

    private GatewayRepository repository;
    private GatewayManagerProperties properties;
    private GatewayService service;

    @BeforeEach
    void setUp() {
        repository = mock(GatewayRepository.class);
        when(repository.save(any(Gateway.class))).thenAnswer(invocation -> invocation.getArgument(0));
        properties = new GatewayManagerProperties();
        properties.getEncryption().setKey(Base64.getEncoder().encodeToString(CredentialVault.generateKey()));
        service = new GatewayService(repository, new CredentialVault(new ObjectMapper()), properties);
    }

    @Test
    void registerStoresHashAndEncryptedCredentials() {
        GatewayService.RegisteredGateway registered = service.registerGateway("edge", null,
                Map.of("controlPlaneUrl", "http://gw:9090"), new GatewayCredentials("admin", "s3cret"));

        Gateway gateway = registered.gateway();
        assertNotNull(gateway.getId());
        assertEquals("on-premise", gateway.getAdapterType());
        assertEquals(GatewayService.hashApiKey(registered.apiKey()), gateway.getApiKeyHash());
        assertNotEquals(registered.apiKey(), gateway.getApiKeyHash());
        assertNotNull(gateway.getEncryptedCredentials());
        assertFalse(gateway.isActive());
    }

    @Test
    void verifyTokenLooksUpByHash() {
        Gateway gateway = Gateway.builder().id("gw-1").name("edge").adapterType("mock").build();
        when(repository.findByApiKeyHash(GatewayService.hashApiKey("the-key"))).thenReturn(Optional.of(gateway));

        assertSame(gateway, service.verifyToken("the-key"));
        assertThrows(GatewayNotFoundException.class, () -> service.verifyToken("other-key"));
    }

    @Test
    void credentialsRoundTripThroughStorage() {
        GatewayService.RegisteredGateway registered = service.registerGateway("edge", "on-premise",
                Map.of(), new GatewayCredentials("admin", "s3cret"));
        when(repository.findById(registered.gateway().getId())).thenReturn(Optional.of(registered.gateway()));

        GatewayService.GatewayWithCredentials loaded = service.getGatewayWithCredentials(registered.gateway().getId());

        assertEquals("admin", loaded.credentials().getUsername());
        assertEquals("s3cret", loaded.credentials().getPassword());
    }

    @Test
    void missingCredentialsIsConfigurationError() {
        Gateway gateway = Gateway.builder().id("gw-1").name("edge").adapterType("on-premise").build();
        when(repository.findById("gw-1")).thenReturn(Optional.of(gateway));

        assertThrows(AdapterConfigurationException.class, () -> service.getGatewayWithCredentials("gw-1"));
    }

    @Test
    void missingEncryptionKeyIsRejected() {
        properties.getEncryption().setKey(null);

        assertThrows(InvalidKeySizeException.class, () -> service.registerGateway("edge", "on-premise",
                Map.of(), new GatewayCredentials("admin", "s3cret")));
    }

    @Test
    void activeStatusIsOnlySavedOnChange() {
        Gateway gateway = Gateway.builder().id("gw-1").name("edge").adapterType("mock").build();
        when(repository.findById("gw-1")).thenReturn(Optional.of(gateway));

        service.updateGatewayActiveStatus("gw-1", true);
        service.updateGatewayActiveStatus("gw-1", true);

        ArgumentCaptor<Gateway> saved = ArgumentCaptor.forClass(Gateway.class);
        verify(repository, times(1)).save(saved.capture());
        assertTrue(saved.getValue().isActive());
    }

    @Test
    void unknownGatewayIsNotFound() {
        when(repository.findById("nope")).thenReturn(Optional.empty());

        assertThrows(GatewayNotFoundException.class, () -> service.getGateway("nope"));
    }
}
