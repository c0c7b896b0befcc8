package com.heronix.beacon.security;

import java.util.List;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * Spring Security authentication for a request that presented a valid agent credential.
 */
public class AgentAuthenticationToken extends AbstractAuthenticationToken {

    public static final String ROLE_AGENT = "ROLE_AGENT";

    private final AgentScope scope;

    public AgentAuthenticationToken(AgentScope scope) {
        super(List.of(new SimpleGrantedAuthority(ROLE_AGENT)));
        this.scope = scope;
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        // the secret is never kept after hashing
        return null;
    }

    @Override
    public AgentScope getPrincipal() {
        return scope;
    }

    @Override
    public String getName() {
        return "agent-credential-" + scope.credentialId();
    }
}
