package com.heronix.beacon.model.dto;

import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Full snapshot of the devices an agent currently sees.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceSyncRequestDTO {

    @NotNull(message = "Devices are required")
    @Valid
    private List<SyncDeviceDTO> devices = new ArrayList<>();
}
