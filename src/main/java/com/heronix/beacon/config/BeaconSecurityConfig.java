package com.heronix.beacon.config;

import java.util.List;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.beacon.exception.AgentAuthenticationException;
import com.heronix.beacon.model.dto.ErrorResponseDTO;
import com.heronix.beacon.security.AgentAuthenticationToken;
import com.heronix.beacon.security.AgentTokenAuthenticationFilter;

import lombok.RequiredArgsConstructor;

/**
 * Security configuration for Heronix Beacon.
 *
 * Three chains: agent endpoints authenticate with a bearer credential,
 * dashboard endpoints with the dashboard user, everything else is closed
 * except health and API docs.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class BeaconSecurityConfig {

    public static final String ROLE_DASHBOARD = "DASHBOARD";

    private final AgentTokenAuthenticationFilter agentTokenAuthenticationFilter;
    private final BeaconProperties properties;
    private final ObjectMapper objectMapper;

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * Dashboard users from configuration. Login itself is owned by the external
     * identity provider in production; this is its stand-in.
     */
    @Bean
    public UserDetailsService dashboardUserDetailsService() {
        List<UserDetails> users = properties.getDashboard().getUsers().stream()
                .map(user -> User.withUsername(user.getUsername())
                        .password(user.getPasswordHash())
                        .roles(ROLE_DASHBOARD)
                        .build())
                .toList();
        return new InMemoryUserDetailsManager(users);
    }

    /**
     * The agent filter only runs inside the agent chain, not as a servlet filter.
     */
    @Bean
    public FilterRegistrationBean<AgentTokenAuthenticationFilter> agentTokenFilterRegistration() {
        FilterRegistrationBean<AgentTokenAuthenticationFilter> registration =
                new FilterRegistrationBean<>(agentTokenAuthenticationFilter);
        registration.setEnabled(false);
        return registration;
    }

    /**
     * Agent API: bearer credential on every request, CORS open to any origin.
     */
    @Bean
    @Order(1)
    public SecurityFilterChain agentSecurityFilterChain(HttpSecurity http) throws Exception {
        http
            .securityMatcher("/agent/**")
            .cors(cors -> cors.configurationSource(agentCorsConfigurationSource()))
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/agent/**").permitAll()
                .anyRequest().hasAuthority(AgentAuthenticationToken.ROLE_AGENT)
            )
            .addFilterBefore(agentTokenAuthenticationFilter, AuthorizationFilter.class)
            .exceptionHandling(ex -> ex.authenticationEntryPoint(
                jsonEntryPoint(AgentAuthenticationException.PUBLIC_MESSAGE)));

        return http.build();
    }

    /**
     * Dashboard API: authenticated dashboard user, owner id = username.
     */
    @Bean
    @Order(2)
    public SecurityFilterChain dashboardSecurityFilterChain(HttpSecurity http) throws Exception {
        http
            .securityMatcher("/dashboard/**")
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .anyRequest().authenticated()
            )
            .httpBasic(basic -> basic.authenticationEntryPoint(jsonEntryPoint("Authentication required")))
            .exceptionHandling(ex -> ex.authenticationEntryPoint(jsonEntryPoint("Authentication required")));

        return http.build();
    }

    @Bean
    @Order(Ordered.LOWEST_PRECEDENCE)
    public SecurityFilterChain defaultSecurityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                // Allow actuator health check
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                // Allow Swagger/OpenAPI
                .requestMatchers("/swagger-ui/**", "/api-docs/**", "/swagger-ui.html").permitAll()
                .requestMatchers("/error").permitAll()
                .anyRequest().denyAll()
            )
            .headers(headers -> headers
                .contentSecurityPolicy(csp ->
                    csp.policyDirectives("default-src 'self'; frame-ancestors 'none';"))
                .frameOptions(frame -> frame.deny())
            );

        return http.build();
    }

    private CorsConfigurationSource agentCorsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(properties.getAgent().getCorsAllowedOrigins());
        configuration.setAllowedMethods(List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        configuration.setAllowedHeaders(List.of("Content-Type", "Authorization"));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/agent/**", configuration);
        return source;
    }

    private AuthenticationEntryPoint jsonEntryPoint(String message) {
        return (request, response, authException) -> {
            response.setStatus(HttpStatus.UNAUTHORIZED.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getWriter(), ErrorResponseDTO.of(message));
        };
    }
}
