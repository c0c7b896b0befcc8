package com.heronix.beacon.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception thrown when a device report is rejected after bean validation,
 * e.g. a sync payload naming the same hardware address twice.
 */
public class DeviceValidationException extends RuntimeException {

    private final Map<String, List<String>> fieldErrors;

    public DeviceValidationException(Map<String, List<String>> fieldErrors) {
        super("Validation error");
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, List<String>> getFieldErrors() {
        return fieldErrors;
    }
}
