package com.heronix.beacon.repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.beacon.model.domain.AgentCredential;

/**
 * Repository for AgentCredential entity.
 *
 * Binding transitions are conditional bulk updates so that two requests racing
 * on the same credential cannot both win. Each returns the number of rows
 * changed (0 or 1).
 */
@Repository
public interface AgentCredentialRepository extends JpaRepository<AgentCredential, Long> {

    /**
     * Find the active (non-revoked) credential with the given secret hash.
     */
    Optional<AgentCredential> findBySecretHashAndRevokedAtIsNull(String secretHash);

    /**
     * Check if a secret hash is already taken, revoked credentials included.
     */
    boolean existsBySecretHash(String secretHash);

    /**
     * All credentials of an owner, newest first.
     */
    List<AgentCredential> findByOwnerPrincipalIdOrderByCreatedAtDesc(String ownerPrincipalId);

    Optional<AgentCredential> findByIdAndOwnerPrincipalId(Long id, String ownerPrincipalId);

    long countByRevokedAtIsNull();

    /**
     * Count active credentials that are bound but not approved yet.
     */
    long countByRevokedAtIsNullAndApprovedFalseAndAgentInstallationIdIsNotNull();

    /**
     * Runs in its own transaction; called off the request thread.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AgentCredential c SET c.lastUsedAt = :usedAt WHERE c.id = :id")
    int touchLastUsed(@Param("id") Long id, @Param("usedAt") LocalDateTime usedAt);

    /**
     * Revoke a credential of the given owner unless it is already revoked.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AgentCredential c SET c.revokedAt = :revokedAt " +
           "WHERE c.id = :id AND c.ownerPrincipalId = :owner AND c.revokedAt IS NULL")
    int revoke(@Param("id") Long id,
               @Param("owner") String ownerPrincipalId,
               @Param("revokedAt") LocalDateTime revokedAt);

    /**
     * Claim an unbound credential for an installation (UNBOUND -> PENDING).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AgentCredential c SET c.agentInstallationId = :installationId, " +
           "c.agentHardwareAddress = :hardwareAddress, c.agentHostname = :hostname, " +
           "c.agentNetworkAddress = :networkAddress, c.firstConnectedAt = :now, c.lastHeartbeatAt = :now " +
           "WHERE c.id = :id AND c.agentInstallationId IS NULL AND c.revokedAt IS NULL")
    int claimBinding(@Param("id") Long id,
                     @Param("installationId") String installationId,
                     @Param("hardwareAddress") String hardwareAddress,
                     @Param("hostname") String hostname,
                     @Param("networkAddress") String networkAddress,
                     @Param("now") LocalDateTime now);

    /**
     * Refresh the descriptive agent fields while the installation is still the bound one.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AgentCredential c SET c.agentHardwareAddress = :hardwareAddress, " +
           "c.agentHostname = :hostname, c.agentNetworkAddress = :networkAddress, c.lastHeartbeatAt = :now " +
           "WHERE c.id = :id AND c.agentInstallationId = :installationId AND c.revokedAt IS NULL")
    int refreshBinding(@Param("id") Long id,
                       @Param("installationId") String installationId,
                       @Param("hardwareAddress") String hardwareAddress,
                       @Param("hostname") String hostname,
                       @Param("networkAddress") String networkAddress,
                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AgentCredential c SET c.approved = true " +
           "WHERE c.id = :id AND c.ownerPrincipalId = :owner AND c.revokedAt IS NULL " +
           "AND c.agentInstallationId IS NOT NULL")
    int approveBinding(@Param("id") Long id, @Param("owner") String ownerPrincipalId);

    /**
     * Reset a binding to UNBOUND so that any installation may claim it next.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AgentCredential c SET c.approved = false, c.agentInstallationId = NULL, " +
           "c.agentHardwareAddress = NULL, c.agentHostname = NULL, c.agentNetworkAddress = NULL, " +
           "c.firstConnectedAt = NULL, c.lastHeartbeatAt = NULL " +
           "WHERE c.id = :id AND c.ownerPrincipalId = :owner AND c.revokedAt IS NULL")
    int clearBinding(@Param("id") Long id, @Param("owner") String ownerPrincipalId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM AgentCredential c WHERE c.ownerPrincipalId = :owner")
    int deleteAllByOwner(@Param("owner") String ownerPrincipalId);
}
