package com.heronix.beacon.service;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.heronix.beacon.config.BeaconProperties;
import com.heronix.beacon.exception.AgentAuthenticationException;
import com.heronix.beacon.exception.CredentialGenerationException;
import com.heronix.beacon.model.domain.AgentCredential;
import com.heronix.beacon.repository.AgentCredentialRepository;
import com.heronix.beacon.security.AgentScope;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for CredentialVault
 */
@ExtendWith(MockitoExtension.class)
class CredentialVaultTest {

    @Mock
    private AgentCredentialRepository credentialRepository;

    @Mock
    private CredentialUsageRecorder usageRecorder;

    private CredentialVault vault;

    @BeforeEach
    void setUp() {
        vault = new CredentialVault(credentialRepository, usageRecorder, new BeaconProperties());
    }

    @Test
    @DisplayName("Hash is deterministic lowercase hex SHA-256")
    void testHashSecret() {
        String hash = CredentialVault.hashSecret("abc");

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", hash);
        assertEquals(hash, CredentialVault.hashSecret("abc"));
        assertNotEquals(hash, CredentialVault.hashSecret("abd"));
    }

    @Test
    @DisplayName("Issue stores hash and prefix, returns plaintext once")
    void testIssue() {
        when(credentialRepository.existsBySecretHash(anyString())).thenReturn(false);
        when(credentialRepository.save(any(AgentCredential.class))).thenAnswer(inv -> {
            AgentCredential saved = inv.getArgument(0);
            saved.setId(7L);
            return saved;
        });

        CredentialVault.IssuedCredential issued = vault.issue("alice", "Home agent");

        String secret = issued.plaintextSecret();
        assertEquals(64, secret.length());
        assertTrue(secret.matches("[0-9a-f]{64}"));

        AgentCredential credential = issued.credential();
        assertEquals("alice", credential.getOwnerPrincipalId());
        assertEquals("Home agent", credential.getDisplayName());
        assertEquals(CredentialVault.hashSecret(secret), credential.getSecretHash());
        assertEquals(secret.substring(0, 8), credential.getSecretPrefix());
        assertNull(credential.getRevokedAt());
        assertFalse(credential.isApproved());
        assertNull(credential.getAgentInstallationId());
    }

    @Test
    @DisplayName("Two issued secrets differ")
    void testIssueUniqueSecrets() {
        when(credentialRepository.existsBySecretHash(anyString())).thenReturn(false);
        when(credentialRepository.save(any(AgentCredential.class))).thenAnswer(inv -> inv.getArgument(0));

        String first = vault.issue("alice", "one").plaintextSecret();
        String second = vault.issue("alice", "two").plaintextSecret();

        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("Issue gives up after repeated hash collisions")
    void testIssueCollisionExhausted() {
        when(credentialRepository.existsBySecretHash(anyString())).thenReturn(true);

        assertThrows(CredentialGenerationException.class, () -> vault.issue("alice", "agent"));
        verify(credentialRepository, times(5)).existsBySecretHash(anyString());
        verify(credentialRepository, never()).save(any());
    }

    @Test
    @DisplayName("Missing or non-bearer header is rejected before lookup")
    void testAuthenticateMalformedHeader() {
        assertThrows(AgentAuthenticationException.class, () -> vault.authenticate(null));
        assertThrows(AgentAuthenticationException.class, () -> vault.authenticate(""));
        assertThrows(AgentAuthenticationException.class, () -> vault.authenticate("Basic abc"));
        assertThrows(AgentAuthenticationException.class, () -> vault.authenticate("bearer " + "a".repeat(64)));

        verifyNoInteractions(credentialRepository, usageRecorder);
    }

    @Test
    @DisplayName("Secret shorter than the minimum length is rejected before lookup")
    void testAuthenticateShortSecret() {
        assertThrows(AgentAuthenticationException.class, () -> vault.authenticate("Bearer " + "a".repeat(31)));

        verifyNoInteractions(credentialRepository, usageRecorder);
    }

    @Test
    @DisplayName("Unknown or revoked secret is rejected")
    void testAuthenticateUnknown() {
        when(credentialRepository.findBySecretHashAndRevokedAtIsNull(anyString())).thenReturn(Optional.empty());

        assertThrows(AgentAuthenticationException.class, () -> vault.authenticate("Bearer " + "a".repeat(64)));
        verifyNoInteractions(usageRecorder);
    }

    @Test
    @DisplayName("Matching secret yields the owner scope and records usage")
    void testAuthenticateSuccess() {
        String secret = "0123456789abcdef".repeat(4);
        AgentCredential credential = AgentCredential.builder()
                .id(42L)
                .ownerPrincipalId("alice")
                .secretHash(CredentialVault.hashSecret(secret))
                .build();
        when(credentialRepository.findBySecretHashAndRevokedAtIsNull(CredentialVault.hashSecret(secret)))
                .thenReturn(Optional.of(credential));

        AgentScope scope = vault.authenticate("Bearer " + secret);

        assertEquals(42L, scope.credentialId());
        assertEquals("alice", scope.ownerPrincipalId());
        verify(usageRecorder).recordUsage(42L);
    }

    @Test
    @DisplayName("Revoke reports whether a row was revoked")
    void testRevoke() {
        when(credentialRepository.revoke(eq(1L), eq("alice"), any())).thenReturn(1);
        when(credentialRepository.revoke(eq(2L), eq("alice"), any())).thenReturn(0);

        assertTrue(vault.revoke(1L, "alice"));
        assertFalse(vault.revoke(2L, "alice"));

        ArgumentCaptor<Long> ids = ArgumentCaptor.forClass(Long.class);
        verify(credentialRepository, times(2)).revoke(ids.capture(), eq("alice"), any());
        assertEquals(2, ids.getAllValues().size());
    }
}
