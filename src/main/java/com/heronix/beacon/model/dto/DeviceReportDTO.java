package com.heronix.beacon.model.dto;

import com.heronix.beacon.model.enums.DeviceStatus;
import com.heronix.beacon.validation.HardwareAddress;
import com.heronix.beacon.validation.NetworkAddress;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A device as reported by an agent, used for single registration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceReportDTO {

    @NotBlank(message = "Name is required")
    @Size(max = 255)
    private String name;

    @HardwareAddress
    private String hardwareAddress;

    /**
     * online, offline or away. Defaults to online on registration.
     */
    @Pattern(regexp = DeviceStatus.WIRE_PATTERN, message = "must be one of online, offline, away")
    private String status;

    @NetworkAddress
    private String networkAddress;
}
