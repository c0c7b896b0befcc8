package com.heronix.beacon.model.dto;

/**
 * Plain acknowledgement body.
 */
public record MessageResponseDTO(String message) {
}
