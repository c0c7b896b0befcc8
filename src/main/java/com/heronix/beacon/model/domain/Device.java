package com.heronix.beacon.model.domain;

import java.time.LocalDateTime;

import com.heronix.beacon.model.enums.DeviceStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A device discovered by an agent on the owner's network.
 *
 * The hardware address is optional. Within one owner it is unique among devices
 * that have one; the reconciler keeps it that way, the schema does not.
 */
@Entity
@Table(name = "devices", indexes = {
    @Index(name = "idx_device_owner", columnList = "owner_principal_id"),
    @Index(name = "idx_device_owner_hw", columnList = "owner_principal_id, hardware_address")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Device {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_principal_id", nullable = false, length = 255, updatable = false)
    private String ownerPrincipalId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    /**
     * Upper-case MAC address (AA:BB:CC:DD:EE:FF), or null.
     */
    @Column(name = "hardware_address", length = 17)
    private String hardwareAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    @Builder.Default
    private DeviceStatus status = DeviceStatus.OFFLINE;

    @Column(name = "last_seen_at")
    private LocalDateTime lastSeenAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        if (this.lastSeenAt == null) {
            this.lastSeenAt = now;
        }
    }

    /**
     * Record that the agent reported this device just now.
     */
    public void markSeen() {
        this.lastSeenAt = LocalDateTime.now();
    }
}
