package com.heronix.beacon.model.dto;

import com.heronix.beacon.model.enums.DeviceStatus;
import com.heronix.beacon.validation.NetworkAddress;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial device update. Null fields are left untouched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceUpdateDTO {

    @Size(min = 1, max = 255)
    private String name;

    @Pattern(regexp = DeviceStatus.WIRE_PATTERN, message = "must be one of online, offline, away")
    private String status;

    @NetworkAddress
    private String networkAddress;
}
