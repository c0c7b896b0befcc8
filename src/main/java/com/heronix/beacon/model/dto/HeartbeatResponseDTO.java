package com.heronix.beacon.model.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.heronix.beacon.model.enums.HeartbeatStatus;

/**
 * Heartbeat answer. {@code device_mismatch} is a normal 200 answer the agent
 * must surface to its user.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HeartbeatResponseDTO(
        HeartbeatStatus status,
        Instant serverTime,
        String message
) {
}
