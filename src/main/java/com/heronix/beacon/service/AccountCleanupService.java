package com.heronix.beacon.service;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.beacon.repository.AgentCredentialRepository;
import com.heronix.beacon.repository.DeviceRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Removes everything Beacon stores for a dashboard user. The user record itself
 * lives with the external identity provider.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountCleanupService {

    private final DeviceRepository deviceRepository;
    private final AgentCredentialRepository credentialRepository;
    private final NetworkStateTracker networkStateTracker;
    private final DeviceOwnerLocks ownerLocks;

    @Transactional
    public void deleteAccountData(String ownerPrincipalId) {
        ownerLocks.acquire(ownerPrincipalId);
        List<Long> deviceIds = deviceRepository.findIdsByOwner(ownerPrincipalId);

        int states = networkStateTracker.forget(deviceIds);
        int devices = deviceIds.isEmpty() ? 0 : deviceRepository.deleteAllByIds(deviceIds);
        int credentials = credentialRepository.deleteAllByOwner(ownerPrincipalId);
        ownerLocks.release(ownerPrincipalId);

        log.info("Deleted account data of owner {}: {} devices, {} network states, {} credentials",
                ownerPrincipalId, devices, states, credentials);
    }
}
