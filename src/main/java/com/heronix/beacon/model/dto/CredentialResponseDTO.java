package com.heronix.beacon.model.dto;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.heronix.beacon.model.domain.AgentCredential;
import com.heronix.beacon.model.enums.BindingState;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for credential operations. Never carries the secret hash.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CredentialResponseDTO {

    private Long id;

    private String name;

    /**
     * First characters of the secret, for recognising it.
     */
    private String tokenPrefix;

    /**
     * Plaintext secret. Only present in the response that issued it.
     */
    private String token;

    private LocalDateTime createdAt;

    private LocalDateTime lastUsedAt;

    private LocalDateTime revokedAt;

    private boolean approved;

    private BindingState bindingState;

    private String agentInstallationId;

    private String agentHardwareAddress;

    private String agentHostname;

    private String agentNetworkAddress;

    private LocalDateTime firstConnectedAt;

    private LocalDateTime lastHeartbeatAt;

    public static CredentialResponseDTO fromEntity(AgentCredential credential) {
        return CredentialResponseDTO.builder()
                .id(credential.getId())
                .name(credential.getDisplayName())
                .tokenPrefix(credential.getSecretPrefix())
                .createdAt(credential.getCreatedAt())
                .lastUsedAt(credential.getLastUsedAt())
                .revokedAt(credential.getRevokedAt())
                .approved(credential.isApproved())
                .bindingState(credential.getBindingState())
                .agentInstallationId(credential.getAgentInstallationId())
                .agentHardwareAddress(credential.getAgentHardwareAddress())
                .agentHostname(credential.getAgentHostname())
                .agentNetworkAddress(credential.getAgentNetworkAddress())
                .firstConnectedAt(credential.getFirstConnectedAt())
                .lastHeartbeatAt(credential.getLastHeartbeatAt())
                .build();
    }

    /**
     * Response for a freshly issued credential, including the one-time secret.
     */
    public static CredentialResponseDTO issued(AgentCredential credential, String plaintextSecret) {
        CredentialResponseDTO response = fromEntity(credential);
        response.setToken(plaintextSecret);
        return response;
    }
}
