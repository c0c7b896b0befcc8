package com.heronix.beacon.model.dto;

import com.heronix.beacon.validation.HardwareAddress;
import com.heronix.beacon.validation.NetworkAddress;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity an agent reports with every heartbeat.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HeartbeatRequestDTO {

    /**
     * Id generated once by the agent and persisted locally. Binding key.
     */
    @NotBlank(message = "Installation id is required")
    @Size(max = 64)
    private String installationId;

    @NotBlank(message = "Hardware address is required")
    @HardwareAddress
    private String hardwareAddress;

    @NotBlank(message = "Hostname is required")
    @Size(max = 255)
    private String hostname;

    @NetworkAddress
    private String networkAddress;
}
