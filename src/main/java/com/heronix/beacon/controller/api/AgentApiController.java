package com.heronix.beacon.controller.api;

import java.time.Instant;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.beacon.config.BeaconProperties;
import com.heronix.beacon.model.dto.DeviceReportDTO;
import com.heronix.beacon.model.dto.DeviceResponseDTO;
import com.heronix.beacon.model.dto.DeviceSyncRequestDTO;
import com.heronix.beacon.model.dto.DeviceUpdateDTO;
import com.heronix.beacon.model.dto.HeartbeatRequestDTO;
import com.heronix.beacon.model.dto.HeartbeatResponseDTO;
import com.heronix.beacon.model.dto.MessageResponseDTO;
import com.heronix.beacon.model.dto.SyncResultDTO;
import com.heronix.beacon.security.AgentScope;
import com.heronix.beacon.service.AgentIdentityGuard;
import com.heronix.beacon.service.DeviceReconciler;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API called by agents. Every request is authenticated by
 * AgentTokenAuthenticationFilter and scoped to the credential's owner.
 */
@RestController
@RequestMapping("/agent")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Agent API", description = "Heartbeat and device reporting for network agents")
public class AgentApiController {

    private final AgentIdentityGuard identityGuard;
    private final DeviceReconciler deviceReconciler;
    private final BeaconProperties properties;

    @PostMapping("/heartbeat")
    @Operation(summary = "Agent heartbeat", description = "Report agent identity and learn the binding status")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "ok, pending_approval or device_mismatch"),
        @ApiResponse(responseCode = "400", description = "Invalid identity"),
        @ApiResponse(responseCode = "401", description = "Missing, invalid or revoked token")
    })
    public ResponseEntity<HeartbeatResponseDTO> heartbeat(
            @AuthenticationPrincipal AgentScope scope,
            @Valid @RequestBody HeartbeatRequestDTO request) {

        var outcome = identityGuard.heartbeat(scope, request);

        String message = switch (outcome.status()) {
            case OK -> null;
            case PENDING_APPROVAL -> properties.getAgent().getPendingMessage();
            case DEVICE_MISMATCH -> properties.getAgent().getMismatchMessage();
        };

        return ResponseEntity.ok(new HeartbeatResponseDTO(outcome.status(), Instant.now(), message));
    }

    @PostMapping("/devices")
    @Operation(summary = "Register a device", description = "Create a device, or update the one with the same hardware address")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Device created"),
        @ApiResponse(responseCode = "200", description = "Existing device updated"),
        @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<DeviceResponseDTO> registerDevice(
            @AuthenticationPrincipal AgentScope scope,
            @Valid @RequestBody DeviceReportDTO request) {

        var registration = deviceReconciler.register(scope, request);

        return ResponseEntity.status(registration.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(DeviceResponseDTO.fromEntity(registration.device()));
    }

    @PatchMapping("/devices/{id}")
    @Operation(summary = "Update a device", description = "Partially update a device; omitted fields are kept")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Device updated"),
        @ApiResponse(responseCode = "404", description = "Device not found")
    })
    public ResponseEntity<DeviceResponseDTO> updateDevice(
            @AuthenticationPrincipal AgentScope scope,
            @Parameter(description = "Device id") @PathVariable Long id,
            @Valid @RequestBody DeviceUpdateDTO request) {

        return ResponseEntity.ok(DeviceResponseDTO.fromEntity(deviceReconciler.update(scope, id, request)));
    }

    @DeleteMapping("/devices/{id}")
    @Operation(summary = "Delete a device")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Device deleted"),
        @ApiResponse(responseCode = "404", description = "Device not found")
    })
    public ResponseEntity<MessageResponseDTO> deleteDevice(
            @AuthenticationPrincipal AgentScope scope,
            @Parameter(description = "Device id") @PathVariable Long id) {

        deviceReconciler.delete(scope, id);
        return ResponseEntity.ok(new MessageResponseDTO("Device deleted successfully"));
    }

    @PutMapping("/devices/sync")
    @Operation(summary = "Sync all devices",
            description = "Replace the stored device set with the reported snapshot, matched by hardware address")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Snapshot applied"),
        @ApiResponse(responseCode = "400", description = "Snapshot rejected, nothing changed")
    })
    public ResponseEntity<SyncResultDTO> syncDevices(
            @AuthenticationPrincipal AgentScope scope,
            @Valid @RequestBody DeviceSyncRequestDTO request) {

        log.debug("Sync of {} devices from credential {}", request.getDevices().size(), scope.credentialId());
        return ResponseEntity.ok(deviceReconciler.sync(scope, request.getDevices()));
    }
}
