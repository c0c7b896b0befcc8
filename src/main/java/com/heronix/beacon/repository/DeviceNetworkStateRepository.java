package com.heronix.beacon.repository;

import java.util.Collection;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.beacon.model.domain.DeviceNetworkState;

/**
 * Repository for DeviceNetworkState entity.
 */
@Repository
public interface DeviceNetworkStateRepository extends JpaRepository<DeviceNetworkState, Long> {

    Optional<DeviceNetworkState> findByDeviceId(Long deviceId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM DeviceNetworkState s WHERE s.deviceId IN :deviceIds")
    int deleteAllByDeviceIds(@Param("deviceIds") Collection<Long> deviceIds);
}
