package com.heronix.beacon.service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.beacon.model.domain.Device;
import com.heronix.beacon.model.domain.DeviceNetworkState;
import com.heronix.beacon.repository.DeviceNetworkStateRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the one-to-one side table of last known device network addresses.
 * Only written as part of device reconciliation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NetworkStateTracker {

    private final DeviceNetworkStateRepository networkStateRepository;

    /**
     * Upsert the network address an agent observed for a device.
     * Agent observations are never authoritative.
     */
    @Transactional
    public DeviceNetworkState record(Device device, String networkAddress) {
        DeviceNetworkState state = networkStateRepository.findByDeviceId(device.getId())
                .orElseGet(() -> DeviceNetworkState.builder().deviceId(device.getId()).build());

        state.setNetworkAddress(networkAddress);
        state.setAuthoritative(false);
        state.setUpdatedAt(LocalDateTime.now());

        log.debug("Device {} last seen at {}", device.getId(), networkAddress);
        return networkStateRepository.save(state);
    }

    @Transactional(readOnly = true)
    public Optional<DeviceNetworkState> forDevice(Long deviceId) {
        return networkStateRepository.findByDeviceId(deviceId);
    }

    /**
     * Delete the network state of the given devices.
     */
    @Transactional
    public int forget(Collection<Long> deviceIds) {
        if (deviceIds.isEmpty()) {
            return 0;
        }
        return networkStateRepository.deleteAllByDeviceIds(deviceIds);
    }
}
