package com.heronix.beacon.model.dto;

/**
 * Counters of one reconciliation pass.
 */
public record SyncResultDTO(int created, int updated, int deleted) {
}
