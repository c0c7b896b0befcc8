package com.heronix.beacon.service;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.beacon.exception.ResourceNotFoundException;
import com.heronix.beacon.model.domain.Device;
import com.heronix.beacon.model.domain.DeviceNetworkState;
import com.heronix.beacon.repository.DeviceRepository;

import lombok.RequiredArgsConstructor;

/**
 * Read-only device views for the dashboard.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DeviceQueryService {

    private final DeviceRepository deviceRepository;
    private final NetworkStateTracker networkStateTracker;

    public List<Device> listDevices(String ownerPrincipalId) {
        return deviceRepository.findByOwnerPrincipalIdOrderByLastSeenAtDesc(ownerPrincipalId);
    }

    /**
     * @throws ResourceNotFoundException if the device is absent or owned by someone else
     */
    public Device getDevice(String ownerPrincipalId, Long deviceId) {
        return deviceRepository.findByIdAndOwnerPrincipalId(deviceId, ownerPrincipalId)
                .orElseThrow(() -> new ResourceNotFoundException("Device"));
    }

    /**
     * Network state of an owned device. A device may not have one yet.
     */
    public Optional<DeviceNetworkState> getNetworkState(String ownerPrincipalId, Long deviceId) {
        Device device = getDevice(ownerPrincipalId, deviceId);
        return networkStateTracker.forDevice(device.getId());
    }
}
