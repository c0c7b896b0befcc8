package com.heronix.beacon.service;

import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.beacon.exception.AgentAuthenticationException;
import com.heronix.beacon.exception.BindingStateException;
import com.heronix.beacon.exception.ResourceNotFoundException;
import com.heronix.beacon.model.domain.AgentCredential;
import com.heronix.beacon.model.dto.HeartbeatRequestDTO;
import com.heronix.beacon.model.enums.HeartbeatStatus;
import com.heronix.beacon.repository.AgentCredentialRepository;
import com.heronix.beacon.security.AgentScope;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Binds a credential to one agent installation and tracks the owner's approval.
 *
 * The installation id is the binding key. Hardware address, hostname and
 * network address are shown to the approving owner and may drift freely while
 * the installation id stays the same.
 *
 * Binding states: UNBOUND -> PENDING (first heartbeat) -> APPROVED (owner
 * approves); reject returns any state to UNBOUND. A heartbeat from another
 * installation is answered with DEVICE_MISMATCH and changes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentIdentityGuard {

    private static final String CREDENTIAL = "Token";

    private final AgentCredentialRepository credentialRepository;

    /**
     * Heartbeat result, with the binding as it stands after the heartbeat.
     */
    public record HeartbeatOutcome(HeartbeatStatus status, AgentCredential credential) {
    }

    /**
     * Process a heartbeat.
     *
     * @param scope    authenticated credential scope
     * @param identity identity the agent reports
     * @return OK, PENDING_APPROVAL or DEVICE_MISMATCH
     */
    @Transactional
    public HeartbeatOutcome heartbeat(AgentScope scope, HeartbeatRequestDTO identity) {
        Long credentialId = scope.credentialId();
        String installationId = identity.getInstallationId();
        // stored as reported; only device matching uses the canonical form
        String hardwareAddress = identity.getHardwareAddress();
        LocalDateTime now = LocalDateTime.now();

        AgentCredential binding = loadActive(credentialId);

        if (!binding.isBound()) {
            int claimed = credentialRepository.claimBinding(credentialId, installationId,
                    hardwareAddress, identity.getHostname(), identity.getNetworkAddress(), now);
            binding = loadActive(credentialId);

            if (claimed > 0) {
                log.info("Credential {} claimed by installation {} ({}, {}), awaiting approval",
                        credentialId, installationId, identity.getHostname(), hardwareAddress);
                return new HeartbeatOutcome(HeartbeatStatus.PENDING_APPROVAL, binding);
            }
            // lost the race: fall through and classify against the winner
            log.debug("Credential {} was claimed concurrently, re-evaluating", credentialId);
        }

        if (!installationId.equals(binding.getAgentInstallationId())) {
            log.warn("Credential {} is bound to installation {} but heartbeat came from {} ({}, {})",
                    credentialId, binding.getAgentInstallationId(), installationId,
                    identity.getHostname(), hardwareAddress);
            return new HeartbeatOutcome(HeartbeatStatus.DEVICE_MISMATCH, binding);
        }

        int refreshed = credentialRepository.refreshBinding(credentialId, installationId,
                hardwareAddress, identity.getHostname(), identity.getNetworkAddress(), now);
        binding = loadActive(credentialId);

        if (refreshed == 0) {
            // binding was reset or handed to another installation in between
            log.warn("Credential {} binding changed during heartbeat from {}", credentialId, installationId);
            return new HeartbeatOutcome(
                    binding.isBound() && !installationId.equals(binding.getAgentInstallationId())
                            ? HeartbeatStatus.DEVICE_MISMATCH
                            : HeartbeatStatus.PENDING_APPROVAL,
                    binding);
        }

        HeartbeatStatus status = binding.isApproved() ? HeartbeatStatus.OK : HeartbeatStatus.PENDING_APPROVAL;
        log.debug("Heartbeat from installation {} on credential {}: {}", installationId, credentialId, status);
        return new HeartbeatOutcome(status, binding);
    }

    /**
     * Approve the installation currently bound to a credential.
     *
     * @throws ResourceNotFoundException if the credential is absent, revoked or not owned
     * @throws BindingStateException     if no agent has connected yet
     */
    @Transactional
    public AgentCredential approve(Long credentialId, String ownerPrincipalId) {
        AgentCredential credential = loadOwned(credentialId, ownerPrincipalId);

        if (credentialRepository.approveBinding(credentialId, ownerPrincipalId) == 0) {
            throw new BindingStateException("No agent has connected with this token yet");
        }

        log.info("Owner {} approved installation {} on credential {}",
                ownerPrincipalId, credential.getAgentInstallationId(), credentialId);
        return loadOwned(credentialId, ownerPrincipalId);
    }

    /**
     * Reset a credential's binding so that a different installation may claim it.
     * The credential itself stays valid.
     *
     * @throws ResourceNotFoundException if the credential is absent, revoked or not owned
     */
    @Transactional
    public AgentCredential reject(Long credentialId, String ownerPrincipalId) {
        AgentCredential credential = loadOwned(credentialId, ownerPrincipalId);
        String previousInstallation = credential.getAgentInstallationId();

        if (credentialRepository.clearBinding(credentialId, ownerPrincipalId) == 0) {
            throw new ResourceNotFoundException(CREDENTIAL);
        }

        log.info("Owner {} rejected installation {} on credential {}, binding reset",
                ownerPrincipalId, previousInstallation, credentialId);
        return loadOwned(credentialId, ownerPrincipalId);
    }

    private AgentCredential loadActive(Long credentialId) {
        return credentialRepository.findById(credentialId)
                .filter(credential -> !credential.isRevoked())
                .orElseThrow(() -> new AgentAuthenticationException(
                        "Credential " + credentialId + " revoked during request"));
    }

    private AgentCredential loadOwned(Long credentialId, String ownerPrincipalId) {
        return credentialRepository.findByIdAndOwnerPrincipalId(credentialId, ownerPrincipalId)
                .filter(credential -> !credential.isRevoked())
                .orElseThrow(() -> new ResourceNotFoundException(CREDENTIAL));
    }
}
