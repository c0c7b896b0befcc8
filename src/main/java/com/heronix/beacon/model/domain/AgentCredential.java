package com.heronix.beacon.model.domain;

import java.time.LocalDateTime;

import com.heronix.beacon.model.enums.BindingState;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bearer credential issued to a dashboard user for one agent installation.
 *
 * Only the SHA-256 hash of the secret is stored. The plaintext is handed to the
 * owner once, when the credential is issued. The agent binding columns record
 * which installation claimed the credential and whether the owner approved it;
 * they are written only by {@code AgentIdentityGuard}.
 */
@Entity
@Table(name = "agent_credentials", indexes = {
    @Index(name = "idx_agent_credential_hash", columnList = "secret_hash", unique = true),
    @Index(name = "idx_agent_credential_owner", columnList = "owner_principal_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentCredential {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Dashboard user that owns this credential.
     */
    @NotBlank
    @Column(name = "owner_principal_id", nullable = false, length = 255, updatable = false)
    private String ownerPrincipalId;

    /**
     * Human-readable label chosen by the owner (e.g. "Home NAS agent").
     */
    @NotBlank
    @Size(max = 100)
    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    /**
     * Hex SHA-256 of the secret.
     */
    @NotBlank
    @Column(name = "secret_hash", nullable = false, unique = true, length = 64, updatable = false)
    private String secretHash;

    /**
     * Leading characters of the secret, safe to display.
     */
    @NotBlank
    @Column(name = "secret_prefix", nullable = false, length = 8, updatable = false)
    private String secretPrefix;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    /**
     * Set once on revocation, never cleared.
     */
    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;

    // ---- agent binding ----

    @Column(name = "approved", nullable = false)
    @Builder.Default
    private boolean approved = false;

    /**
     * Stable id the agent generates once and keeps across restarts.
     * This is the binding key; the remaining agent fields are descriptive.
     */
    @Column(name = "agent_installation_id", length = 64)
    private String agentInstallationId;

    /**
     * MAC address exactly as the agent reported it.
     */
    @Column(name = "agent_hardware_address", length = 17)
    private String agentHardwareAddress;

    @Column(name = "agent_hostname", length = 255)
    private String agentHostname;

    @Column(name = "agent_network_address", length = 45)
    private String agentNetworkAddress;

    @Column(name = "first_connected_at")
    private LocalDateTime firstConnectedAt;

    @Column(name = "last_heartbeat_at")
    private LocalDateTime lastHeartbeatAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isBound() {
        return agentInstallationId != null;
    }

    public BindingState getBindingState() {
        if (!isBound()) {
            return BindingState.UNBOUND;
        }
        return approved ? BindingState.APPROVED : BindingState.PENDING;
    }
}
