package com.heronix.beacon.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reachability of a monitored device as last reported by the agent.
 */
public enum DeviceStatus {

    ONLINE("online"),
    OFFLINE("offline"),
    AWAY("away");

    /**
     * Pattern accepted in request bodies.
     */
    public static final String WIRE_PATTERN = "online|offline|away";

    private final String value;

    DeviceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve a wire value (e.g. "online").
     *
     * @throws IllegalArgumentException if the value is unknown
     */
    public static DeviceStatus fromValue(String value) {
        for (DeviceStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown device status: " + value);
    }
}
