package com.heronix.beacon.model.dto;

import java.time.LocalDateTime;

import com.heronix.beacon.model.domain.DeviceNetworkState;

/**
 * Last known network address of a device.
 */
public record NetworkStateResponseDTO(
        Long deviceId,
        String networkAddress,
        boolean authoritative,
        LocalDateTime updatedAt
) {
    public static NetworkStateResponseDTO fromEntity(DeviceNetworkState state) {
        return new NetworkStateResponseDTO(state.getDeviceId(), state.getNetworkAddress(),
                state.isAuthoritative(), state.getUpdatedAt());
    }
}
