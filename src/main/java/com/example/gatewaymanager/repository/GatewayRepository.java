package com.example.gatewaymanager.repository;

import com.example.gatewaymanager.domain.Gateway;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GatewayRepository extends JpaRepository<Gateway, String> {

    Optional<Gateway> findByApiKeyHash(String apiKeyHash);
}
