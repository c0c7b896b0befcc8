package com.heronix.beacon.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for Heronix Beacon.
 */
@Data
@ConfigurationProperties(prefix = "heronix.beacon")
public class BeaconProperties {

    /**
     * Agent credential configuration
     */
    private TokenConfig token = new TokenConfig();

    /**
     * Agent API configuration
     */
    private AgentConfig agent = new AgentConfig();

    /**
     * Dashboard access configuration
     */
    private DashboardConfig dashboard = new DashboardConfig();

    @Data
    public static class TokenConfig {
        /**
         * Random bytes per generated secret (hex encoded, so 32 bytes = 64 chars)
         */
        private int secretBytes = 32;

        /**
         * Number of leading secret characters kept for display
         */
        private int prefixLength = 8;

        /**
         * Presented secrets shorter than this are rejected before hashing
         */
        private int minLength = 32;

        /**
         * Maximum attempts to generate a secret with an unused hash before failing
         */
        private int maxGenerationAttempts = 5;
    }

    @Data
    public static class AgentConfig {
        /**
         * Origins allowed to call /agent/** (agents and simulators run anywhere)
         */
        private List<String> corsAllowedOrigins = new ArrayList<>(List.of("*"));

        /**
         * Message returned with a pending_approval heartbeat
         */
        private String pendingMessage = "Waiting for approval from dashboard user.";

        /**
         * Message returned with a device_mismatch heartbeat
         */
        private String mismatchMessage =
                "A different agent is attempting to use this token. Please check your dashboard.";
    }

    @Data
    public static class DashboardConfig {
        /**
         * Dashboard users accepted over HTTP Basic. The username is the owner id
         * of every credential and device the user creates.
         */
        private List<DashboardUser> users = new ArrayList<>();
    }

    @Data
    public static class DashboardUser {
        private String username;

        /**
         * BCrypt hash of the user's password
         */
        private String passwordHash;
    }
}
