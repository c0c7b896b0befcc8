package com.heronix.beacon.controller.api;

import java.security.Principal;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.beacon.model.dto.DeviceResponseDTO;
import com.heronix.beacon.model.dto.NetworkStateResponseDTO;
import com.heronix.beacon.service.DeviceQueryService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * Read-only device views for the dashboard.
 */
@RestController
@RequestMapping("/dashboard/devices")
@RequiredArgsConstructor
@Tag(name = "Devices", description = "Devices reported by the current user's agents")
public class DashboardDeviceController {

    private final DeviceQueryService deviceQueryService;

    @GetMapping
    @Operation(summary = "List devices", description = "Most recently seen first")
    public ResponseEntity<List<DeviceResponseDTO>> listDevices(Principal principal) {
        return ResponseEntity.ok(deviceQueryService.listDevices(principal.getName()).stream()
                .map(DeviceResponseDTO::fromEntity)
                .toList());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get device")
    @ApiResponse(responseCode = "404", description = "Device not found")
    public ResponseEntity<DeviceResponseDTO> getDevice(Principal principal, @PathVariable Long id) {
        return ResponseEntity.ok(DeviceResponseDTO.fromEntity(deviceQueryService.getDevice(principal.getName(), id)));
    }

    @GetMapping("/{id}/network-state")
    @Operation(summary = "Get device network state", description = "Body is null when no address was reported yet")
    @ApiResponse(responseCode = "404", description = "Device not found")
    public ResponseEntity<NetworkStateResponseDTO> getNetworkState(Principal principal, @PathVariable Long id) {
        return ResponseEntity.ok(deviceQueryService.getNetworkState(principal.getName(), id)
                .map(NetworkStateResponseDTO::fromEntity)
                .orElse(null));
    }
}
