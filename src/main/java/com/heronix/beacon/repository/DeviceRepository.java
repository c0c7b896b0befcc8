package com.heronix.beacon.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.beacon.model.domain.Device;


/**
 * Repository for Device entity. Every lookup is scoped to an owner.
 */
@Repository
public interface DeviceRepository extends JpaRepository<Device, Long> {

    /**
     * Devices of an owner, most recently seen first.
     */
    List<Device> findByOwnerPrincipalIdOrderByLastSeenAtDesc(String ownerPrincipalId);

    /**
     * Devices of an owner, oldest first.
     */
    List<Device> findByOwnerPrincipalIdOrderByIdAsc(String ownerPrincipalId);

    Optional<Device> findByIdAndOwnerPrincipalId(Long id, String ownerPrincipalId);

    Optional<Device> findFirstByOwnerPrincipalIdAndHardwareAddressOrderByIdAsc(
            String ownerPrincipalId, String hardwareAddress);

    @Query("SELECT d.id FROM Device d WHERE d.ownerPrincipalId = :owner")
    List<Long> findIdsByOwner(@Param("owner") String ownerPrincipalId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Device d WHERE d.id IN :ids")
    int deleteAllByIds(@Param("ids") List<Long> ids);
}
