package com.heronix.beacon.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.beacon.model.domain.DeviceOwnerLock;

import jakarta.persistence.LockModeType;

/**
 * Repository for DeviceOwnerLock entity.
 */
@Repository
public interface DeviceOwnerLockRepository extends JpaRepository<DeviceOwnerLock, String> {

    /**
     * Write-lock the owner's row until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM DeviceOwnerLock l WHERE l.ownerPrincipalId = :owner")
    Optional<DeviceOwnerLock> lockByOwner(@Param("owner") String ownerPrincipalId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM DeviceOwnerLock l WHERE l.ownerPrincipalId = :owner")
    int deleteByOwner(@Param("owner") String ownerPrincipalId);
}
