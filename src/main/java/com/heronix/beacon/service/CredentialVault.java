package com.heronix.beacon.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.beacon.config.BeaconProperties;
import com.heronix.beacon.exception.AgentAuthenticationException;
import com.heronix.beacon.exception.CredentialGenerationException;
import com.heronix.beacon.model.domain.AgentCredential;
import com.heronix.beacon.repository.AgentCredentialRepository;
import com.heronix.beacon.security.AgentScope;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues, authenticates and revokes agent credentials.
 *
 * A secret is {@code token.secret-bytes} random bytes, hex encoded. Only its
 * SHA-256 hex digest and the first {@code token.prefix-length} characters are
 * stored; the plaintext leaves this service exactly once, from {@link #issue}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialVault {

    public static final String BEARER_PREFIX = "Bearer ";

    private final AgentCredentialRepository credentialRepository;
    private final CredentialUsageRecorder usageRecorder;
    private final BeaconProperties properties;

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * A newly issued credential together with its one-time plaintext secret.
     */
    public record IssuedCredential(String plaintextSecret, AgentCredential credential) {
    }

    /**
     * Issue a new credential for an owner.
     *
     * @param ownerPrincipalId dashboard user the credential belongs to
     * @param displayName      label shown on the dashboard
     * @return the stored credential and the plaintext secret; the caller must not persist the secret
     */
    @Transactional
    public IssuedCredential issue(String ownerPrincipalId, String displayName) {
        BeaconProperties.TokenConfig config = properties.getToken();

        for (int attempt = 0; attempt < config.getMaxGenerationAttempts(); attempt++) {
            String secret = generateSecret(config.getSecretBytes());
            String hash = hashSecret(secret);

            if (credentialRepository.existsBySecretHash(hash)) {
                log.debug("Secret hash collision on attempt {}, regenerating...", attempt + 1);
                continue;
            }

            AgentCredential credential = AgentCredential.builder()
                    .ownerPrincipalId(ownerPrincipalId)
                    .displayName(displayName)
                    .secretHash(hash)
                    .secretPrefix(secret.substring(0, config.getPrefixLength()))
                    .build();

            credential = credentialRepository.save(credential);
            log.info("Issued agent credential {} ({}...) for owner {}",
                    credential.getId(), credential.getSecretPrefix(), ownerPrincipalId);

            return new IssuedCredential(secret, credential);
        }

        throw new CredentialGenerationException(
                "Failed to generate unique credential after " + config.getMaxGenerationAttempts() + " attempts");
    }

    /**
     * Authenticate the value of an Authorization header.
     *
     * @param authorizationHeader raw header value, may be null
     * @return scope of the matching active credential
     * @throws AgentAuthenticationException if the header is missing or malformed,
     *         or no active credential matches
     */
    @Transactional(readOnly = true)
    public AgentScope authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new AgentAuthenticationException("Missing or invalid authorization header");
        }

        String secret = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (secret.length() < properties.getToken().getMinLength()) {
            throw new AgentAuthenticationException("Invalid token format");
        }

        Optional<AgentCredential> credentialOpt =
                credentialRepository.findBySecretHashAndRevokedAtIsNull(hashSecret(secret));
        if (credentialOpt.isEmpty()) {
            throw new AgentAuthenticationException("Invalid or revoked token");
        }

        AgentCredential credential = credentialOpt.get();
        usageRecorder.recordUsage(credential.getId());

        return new AgentScope(credential.getId(), credential.getOwnerPrincipalId());
    }

    /**
     * Revoke a credential. Takes effect for the very next authentication.
     *
     * @return false if the credential does not exist, belongs to someone else or is already revoked
     */
    @Transactional
    public boolean revoke(Long credentialId, String ownerPrincipalId) {
        boolean revoked = credentialRepository.revoke(credentialId, ownerPrincipalId, LocalDateTime.now()) > 0;
        if (revoked) {
            log.info("Revoked agent credential {} of owner {}", credentialId, ownerPrincipalId);
        }
        return revoked;
    }

    /**
     * All credentials of an owner, newest first, revoked ones included.
     */
    @Transactional(readOnly = true)
    public List<AgentCredential> listForOwner(String ownerPrincipalId) {
        return credentialRepository.findByOwnerPrincipalIdOrderByCreatedAtDesc(ownerPrincipalId);
    }

    /**
     * Hex SHA-256 of a secret.
     */
    public static String hashSecret(String secret) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHex(digest.digest(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String generateSecret(int byteCount) {
        byte[] bytes = new byte[byteCount];
        secureRandom.nextBytes(bytes);
        return toHex(bytes);
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
