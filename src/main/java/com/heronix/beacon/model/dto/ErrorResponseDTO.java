package com.heronix.beacon.model.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body of every failed request. {@code errors} maps a field path to its
 * messages and is only present for validation failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponseDTO(String message, Map<String, List<String>> errors) {

    public static ErrorResponseDTO of(String message) {
        return new ErrorResponseDTO(message, null);
    }
}
