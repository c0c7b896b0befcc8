package com.heronix.beacon.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.heronix.beacon.repository.AgentCredentialRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot Actuator health indicator for the credential store.
 *
 * Reports UP with the number of active credentials and of bindings waiting for
 * approval. Reports DOWN when the store cannot be queried, since no agent can
 * authenticate then.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CredentialStoreHealthIndicator implements HealthIndicator {

    private final AgentCredentialRepository credentialRepository;

    @Override
    public Health health() {
        try {
            return Health.up()
                    .withDetail("active-credentials", credentialRepository.countByRevokedAtIsNull())
                    .withDetail("pending-approvals",
                            credentialRepository.countByRevokedAtIsNullAndApprovedFalseAndAgentInstallationIdIsNotNull())
                    .build();
        } catch (DataAccessException e) {
            log.error("Credential store health check failed: {}", e.getMessage());
            return Health.down(e)
                    .withDetail("credential-store", "unreachable")
                    .build();
        }
    }
}
