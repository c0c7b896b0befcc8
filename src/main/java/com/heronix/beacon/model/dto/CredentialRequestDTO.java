package com.heronix.beacon.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for issuing a new agent credential.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialRequestDTO {

    /**
     * Label shown on the dashboard (e.g. "Office agent").
     */
    @NotBlank(message = "Name is required")
    @Size(max = 100)
    private String name;
}
