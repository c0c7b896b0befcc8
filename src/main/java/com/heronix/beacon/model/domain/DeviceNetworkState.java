package com.heronix.beacon.model.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last known network address of a device. One row per device at most.
 */
@Entity
@Table(name = "device_network_states", uniqueConstraints = {
    @UniqueConstraint(name = "uk_network_state_device", columnNames = "device_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceNetworkState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false, unique = true, updatable = false)
    private Long deviceId;

    /**
     * IPv4 or IPv6 literal.
     */
    @Column(name = "network_address", length = 45)
    private String networkAddress;

    /**
     * False for addresses that were only observed by an agent.
     */
    @Column(name = "authoritative", nullable = false)
    @Builder.Default
    private boolean authoritative = false;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        this.updatedAt = LocalDateTime.now();
    }
}
