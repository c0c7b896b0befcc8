package com.heronix.beacon.security;

/**
 * Authenticated scope of an agent request: which credential was presented and
 * which dashboard user owns it. Passed explicitly into every agent operation.
 */
public record AgentScope(Long credentialId, String ownerPrincipalId) {
}
