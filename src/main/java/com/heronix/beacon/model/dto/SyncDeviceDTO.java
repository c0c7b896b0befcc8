package com.heronix.beacon.model.dto;

import com.heronix.beacon.model.enums.DeviceStatus;
import com.heronix.beacon.validation.HardwareAddress;
import com.heronix.beacon.validation.NetworkAddress;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a full device snapshot. Unlike registration, status is required.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncDeviceDTO {

    @NotBlank(message = "Name is required")
    @Size(max = 255)
    private String name;

    @HardwareAddress
    private String hardwareAddress;

    @NotNull(message = "Status is required")
    @Pattern(regexp = DeviceStatus.WIRE_PATTERN, message = "must be one of online, offline, away")
    private String status;

    @NetworkAddress
    private String networkAddress;
}
