package com.heronix.beacon.model.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row per owner, row-locked by every operation that may add or remove
 * devices with a hardware address. It exists so that an owner without any
 * device yet still has something to lock.
 */
@Entity
@Table(name = "device_owner_locks")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceOwnerLock {

    @Id
    @Column(name = "owner_principal_id", length = 255)
    private String ownerPrincipalId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public DeviceOwnerLock(String ownerPrincipalId) {
        this.ownerPrincipalId = ownerPrincipalId;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
