package com.heronix.beacon.model.dto;

import java.time.LocalDateTime;

import com.heronix.beacon.model.domain.Device;
import com.heronix.beacon.model.enums.DeviceStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for device operations.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceResponseDTO {

    private Long id;

    private String name;

    private String hardwareAddress;

    private DeviceStatus status;

    private LocalDateTime lastSeenAt;

    private LocalDateTime createdAt;

    public static DeviceResponseDTO fromEntity(Device device) {
        return DeviceResponseDTO.builder()
                .id(device.getId())
                .name(device.getName())
                .hardwareAddress(device.getHardwareAddress())
                .status(device.getStatus())
                .lastSeenAt(device.getLastSeenAt())
                .createdAt(device.getCreatedAt())
                .build();
    }
}
