package com.heronix.beacon.security;

import java.io.IOException;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.beacon.exception.AgentAuthenticationException;
import com.heronix.beacon.model.dto.ErrorResponseDTO;
import com.heronix.beacon.service.CredentialVault;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * OncePerRequestFilter on /agent/**.
 * Reads the Bearer credential, authenticates it via CredentialVault and stores
 * the resulting AgentScope in the security context. Returns 401 with a generic
 * message for any missing, malformed, unknown or revoked credential.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentTokenAuthenticationFilter extends OncePerRequestFilter {

    private final CredentialVault credentialVault;
    private final ObjectMapper objectMapper;

    public static final String AGENT_PATH = "/agent/";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());

        // Only filter agent paths
        if (!path.startsWith(AGENT_PATH)) {
            return true;
        }

        // CORS preflight carries no credential
        return HttpMethod.OPTIONS.matches(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        AgentScope scope;
        try {
            scope = credentialVault.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));
        } catch (AgentAuthenticationException e) {
            log.warn("AGENT_AUTH: Rejected {} {} from {}: {}",
                    request.getMethod(), request.getRequestURI(), request.getRemoteAddr(), e.getMessage());
            SecurityContextHolder.clearContext();
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getWriter(),
                    ErrorResponseDTO.of(AgentAuthenticationException.PUBLIC_MESSAGE));
            return;
        }

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(new AgentAuthenticationToken(scope));
        SecurityContextHolder.setContext(context);

        log.debug("AGENT_AUTH: Credential {} authenticated for {}", scope.credentialId(), request.getRequestURI());
        filterChain.doFilter(request, response);
    }
}
