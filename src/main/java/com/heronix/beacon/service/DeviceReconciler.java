package com.heronix.beacon.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.beacon.exception.DeviceValidationException;
import com.heronix.beacon.exception.ResourceNotFoundException;
import com.heronix.beacon.model.domain.Device;
import com.heronix.beacon.model.dto.DeviceReportDTO;
import com.heronix.beacon.model.dto.DeviceUpdateDTO;
import com.heronix.beacon.model.dto.SyncDeviceDTO;
import com.heronix.beacon.model.dto.SyncResultDTO;
import com.heronix.beacon.model.enums.DeviceStatus;
import com.heronix.beacon.repository.DeviceRepository;
import com.heronix.beacon.security.AgentScope;
import com.heronix.beacon.validation.NetworkAddresses;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies agent device reports to the owner's stored devices.
 *
 * Devices are matched by hardware address within the owner's scope. Devices
 * stored without a hardware address cannot be correlated with a report and are
 * never matched, updated or deleted by reconciliation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceReconciler {

    private static final String DEVICE = "Device";

    private final DeviceRepository deviceRepository;
    private final NetworkStateTracker networkStateTracker;
    private final DeviceOwnerLocks ownerLocks;
    private final Validator validator;

    /**
     * Registration result; {@code created} is false when an existing device was matched.
     */
    public record Registration(Device device, boolean created) {
    }

    /**
     * Reconcile the owner's devices with a full snapshot.
     *
     * Every entry is validated before anything is written; one bad entry rejects
     * the whole snapshot. Matched devices are updated, unmatched entries are
     * created, and stored devices whose hardware address is missing from the
     * snapshot are deleted together with their network state. Of several stored
     * devices sharing one hardware address only the oldest is kept.
     *
     * @param scope    authenticated agent scope
     * @param reported snapshot in the order the agent sent it
     * @return created, updated and deleted counts
     * @throws DeviceValidationException if any entry is invalid
     */
    @Transactional
    public SyncResultDTO sync(AgentScope scope, List<SyncDeviceDTO> reported) {
        validateSnapshot(reported);

        String owner = scope.ownerPrincipalId();
        ownerLocks.acquire(owner);

        // hardware address -> stored device not yet accounted for in this pass
        Map<String, Device> unaccounted = new LinkedHashMap<>();
        // later rows sharing an address with an older one; always removed
        List<Device> duplicates = new ArrayList<>();
        for (Device device : deviceRepository.findByOwnerPrincipalIdOrderByIdAsc(owner)) {
            if (device.getHardwareAddress() != null
                    && unaccounted.putIfAbsent(device.getHardwareAddress(), device) != null) {
                duplicates.add(device);
            }
        }

        int created = 0;
        int updated = 0;

        for (SyncDeviceDTO entry : reported) {
            String hardwareAddress = NetworkAddresses.canonicalHardwareAddress(entry.getHardwareAddress());
            DeviceStatus status = DeviceStatus.fromValue(entry.getStatus());
            Device existing = hardwareAddress != null ? unaccounted.remove(hardwareAddress) : null;

            if (existing != null) {
                applyReport(existing, entry.getName(), status, entry.getNetworkAddress());
                updated++;
            } else {
                createDevice(owner, entry.getName(), hardwareAddress, status, entry.getNetworkAddress());
                created++;
            }
        }

        List<Long> staleIds = new ArrayList<>();
        unaccounted.values().forEach(device -> staleIds.add(device.getId()));
        duplicates.forEach(device -> staleIds.add(device.getId()));
        deleteDevices(staleIds);

        if (!duplicates.isEmpty()) {
            log.warn("Removed {} duplicate device(s) by hardware address for owner {}", duplicates.size(), owner);
        }

        log.info("Synced devices for owner {} via credential {}: {} created, {} updated, {} deleted",
                owner, scope.credentialId(), created, updated, staleIds.size());
        return new SyncResultDTO(created, updated, staleIds.size());
    }

    /**
     * Register one device. A device with the same hardware address is updated
     * instead of duplicated. Status defaults to online. Runs under the owner's
     * device lock, like {@link #sync}.
     */
    @Transactional
    public Registration register(AgentScope scope, DeviceReportDTO report) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        collectViolations(report, "", errors);
        if (!errors.isEmpty()) {
            throw new DeviceValidationException(errors);
        }

        String owner = scope.ownerPrincipalId();
        ownerLocks.acquire(owner);
        String hardwareAddress = NetworkAddresses.canonicalHardwareAddress(report.getHardwareAddress());
        DeviceStatus status = report.getStatus() != null
                ? DeviceStatus.fromValue(report.getStatus())
                : DeviceStatus.ONLINE;

        if (hardwareAddress != null) {
            var existing = deviceRepository
                    .findFirstByOwnerPrincipalIdAndHardwareAddressOrderByIdAsc(owner, hardwareAddress);
            if (existing.isPresent()) {
                Device device = applyReport(existing.get(), report.getName(), status, report.getNetworkAddress());
                log.debug("Registration of {} matched device {} for owner {}", hardwareAddress, device.getId(), owner);
                return new Registration(device, false);
            }
        }

        Device device = createDevice(owner, report.getName(), hardwareAddress, status, report.getNetworkAddress());
        log.info("Registered device {} ({}) for owner {}", device.getId(), device.getName(), owner);
        return new Registration(device, true);
    }

    /**
     * Apply a partial update. Only fields present in the update are written.
     *
     * @throws ResourceNotFoundException if the device is absent or not owned by the scope's owner
     */
    @Transactional
    public Device update(AgentScope scope, Long deviceId, DeviceUpdateDTO update) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        collectViolations(update, "", errors);
        if (!errors.isEmpty()) {
            throw new DeviceValidationException(errors);
        }

        Device device = deviceRepository.findByIdAndOwnerPrincipalId(deviceId, scope.ownerPrincipalId())
                .orElseThrow(() -> new ResourceNotFoundException(DEVICE));

        if (update.getName() != null) {
            device.setName(update.getName());
        }
        if (update.getStatus() != null) {
            device.setStatus(DeviceStatus.fromValue(update.getStatus()));
        }
        device.markSeen();
        device = deviceRepository.save(device);

        if (update.getNetworkAddress() != null) {
            networkStateTracker.record(device, update.getNetworkAddress());
        }
        return device;
    }

    /**
     * Delete one device and its network state.
     *
     * @throws ResourceNotFoundException if the device is absent or not owned by the scope's owner
     */
    @Transactional
    public void delete(AgentScope scope, Long deviceId) {
        Device device = deviceRepository.findByIdAndOwnerPrincipalId(deviceId, scope.ownerPrincipalId())
                .orElseThrow(() -> new ResourceNotFoundException(DEVICE));

        deleteDevices(List.of(device.getId()));
        log.info("Deleted device {} ({}) for owner {}", device.getId(), device.getName(), scope.ownerPrincipalId());
    }

    private Device applyReport(Device device, String name, DeviceStatus status, String networkAddress) {
        device.setName(name);
        device.setStatus(status);
        device.markSeen();
        Device saved = deviceRepository.save(device);

        if (networkAddress != null) {
            networkStateTracker.record(saved, networkAddress);
        }
        return saved;
    }

    private Device createDevice(String owner, String name, String hardwareAddress,
                                DeviceStatus status, String networkAddress) {
        Device device = deviceRepository.save(Device.builder()
                .ownerPrincipalId(owner)
                .name(name)
                .hardwareAddress(hardwareAddress)
                .status(status)
                .build());

        if (networkAddress != null) {
            networkStateTracker.record(device, networkAddress);
        }
        return device;
    }

    private void deleteDevices(List<Long> deviceIds) {
        if (deviceIds.isEmpty()) {
            return;
        }
        networkStateTracker.forget(deviceIds);
        deviceRepository.deleteAllByIds(deviceIds);
    }

    /**
     * Validate every entry and reject hardware addresses reported twice.
     */
    private void validateSnapshot(List<SyncDeviceDTO> reported) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (reported == null) {
            errors.put("devices", List.of("must not be null"));
            throw new DeviceValidationException(errors);
        }

        Map<String, Integer> firstIndexByAddress = new HashMap<>();
        for (int i = 0; i < reported.size(); i++) {
            String path = "devices[" + i + "]";
            SyncDeviceDTO entry = reported.get(i);
            if (entry == null) {
                errors.computeIfAbsent(path, k -> new ArrayList<>()).add("must not be null");
                continue;
            }
            collectViolations(entry, path + ".", errors);

            String hardwareAddress = entry.getHardwareAddress();
            if (hardwareAddress != null && NetworkAddresses.isHardwareAddress(hardwareAddress)) {
                Integer first = firstIndexByAddress.putIfAbsent(
                        NetworkAddresses.canonicalHardwareAddress(hardwareAddress), i);
                if (first != null) {
                    errors.computeIfAbsent(path + ".hardwareAddress", k -> new ArrayList<>())
                            .add("duplicates devices[" + first + "].hardwareAddress");
                }
            }
        }

        if (!errors.isEmpty()) {
            log.debug("Rejected device snapshot with {} invalid field(s)", errors.size());
            throw new DeviceValidationException(errors);
        }
    }

    private void collectViolations(Object bean, String pathPrefix, Map<String, List<String>> errors) {
        for (ConstraintViolation<Object> violation : validator.validate(bean)) {
            errors.computeIfAbsent(pathPrefix + violation.getPropertyPath(), k -> new ArrayList<>())
                    .add(violation.getMessage());
        }
    }
}
