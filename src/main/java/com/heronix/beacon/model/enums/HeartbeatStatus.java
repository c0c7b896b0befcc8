package com.heronix.beacon.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Answer returned to an agent heartbeat.
 */
public enum HeartbeatStatus {

    /**
     * Installation is bound to the credential and approved
     */
    OK("ok"),

    /**
     * Installation is bound but the owner has not approved it yet
     */
    PENDING_APPROVAL("pending_approval"),

    /**
     * Credential is bound to a different installation; nothing was changed
     */
    DEVICE_MISMATCH("device_mismatch");

    private final String value;

    HeartbeatStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
