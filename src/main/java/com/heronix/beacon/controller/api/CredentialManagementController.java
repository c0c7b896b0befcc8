package com.heronix.beacon.controller.api;

import java.security.Principal;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.beacon.exception.ResourceNotFoundException;
import com.heronix.beacon.model.dto.CredentialRequestDTO;
import com.heronix.beacon.model.dto.CredentialResponseDTO;
import com.heronix.beacon.model.dto.MessageResponseDTO;
import com.heronix.beacon.service.AgentIdentityGuard;
import com.heronix.beacon.service.CredentialVault;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for managing agent credentials from the dashboard.
 */
@RestController
@RequestMapping("/dashboard/credentials")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Credential Management", description = "Issue, revoke and approve agent tokens")
public class CredentialManagementController {

    private final CredentialVault credentialVault;
    private final AgentIdentityGuard identityGuard;

    @GetMapping
    @Operation(summary = "List tokens", description = "All tokens of the current user with their agent binding")
    @ApiResponse(responseCode = "200", description = "Tokens returned")
    public ResponseEntity<List<CredentialResponseDTO>> listCredentials(Principal principal) {
        List<CredentialResponseDTO> response = credentialVault.listForOwner(principal.getName()).stream()
                .map(CredentialResponseDTO::fromEntity)
                .toList();
        return ResponseEntity.ok(response);
    }

    @PostMapping
    @Operation(summary = "Issue a token", description = "Create a token; the secret is only returned in this response")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Token created"),
        @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<CredentialResponseDTO> issueCredential(
            Principal principal,
            @Valid @RequestBody CredentialRequestDTO request) {

        var issued = credentialVault.issue(principal.getName(), request.getName());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CredentialResponseDTO.issued(issued.credential(), issued.plaintextSecret()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Revoke a token", description = "Agents using the token are rejected immediately")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Token revoked"),
        @ApiResponse(responseCode = "404", description = "Token not found")
    })
    public ResponseEntity<MessageResponseDTO> revokeCredential(
            Principal principal,
            @Parameter(description = "Token id") @PathVariable Long id) {

        if (!credentialVault.revoke(id, principal.getName())) {
            throw new ResourceNotFoundException("Token");
        }
        return ResponseEntity.ok(new MessageResponseDTO("Token revoked successfully"));
    }

    @PostMapping("/{id}/approve")
    @Operation(summary = "Approve agent", description = "Trust the installation currently bound to the token")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Agent approved"),
        @ApiResponse(responseCode = "404", description = "Token not found"),
        @ApiResponse(responseCode = "409", description = "No agent has connected yet")
    })
    public ResponseEntity<MessageResponseDTO> approveAgent(
            Principal principal,
            @Parameter(description = "Token id") @PathVariable Long id) {

        identityGuard.approve(id, principal.getName());
        return ResponseEntity.ok(new MessageResponseDTO("Agent approved successfully"));
    }

    @PostMapping("/{id}/reject")
    @Operation(summary = "Reject agent", description = "Unbind the installation so another agent may claim the token")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Binding reset"),
        @ApiResponse(responseCode = "404", description = "Token not found")
    })
    public ResponseEntity<MessageResponseDTO> rejectAgent(
            Principal principal,
            @Parameter(description = "Token id") @PathVariable Long id) {

        identityGuard.reject(id, principal.getName());
        return ResponseEntity.ok(new MessageResponseDTO("Agent rejected and reset"));
    }
}
